package com.flagship.financial_model.validation;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Tolerance for debit/credit balancing checks: an absolute floor and a
 * share of the larger side.
 */
@Value
public class ValidationTolerance {
    BigDecimal absolute;
    BigDecimal relative;

    public static ValidationTolerance defaults() {
        return new ValidationTolerance(new BigDecimal("0.01"), new BigDecimal("0.0001"));
    }

    /**
     * True when |debit - credit| exceeds max(absolute, max(debit, credit) * relative).
     */
    public boolean isOutOfBalance(BigDecimal debit, BigDecimal credit) {
        BigDecimal difference = debit.subtract(credit).abs();
        BigDecimal scaled = debit.max(credit).multiply(relative);
        return difference.compareTo(absolute.max(scaled)) > 0;
    }
}
