package com.flagship.financial_model.classification;

import lombok.Value;

/**
 * Inclusive range of account numbers.
 */
@Value
public class AccountRange {
    int start;
    int end;

    private AccountRange(int start, int end) {
        if (start > end) {
            throw new IllegalArgumentException(
                String.format("Invalid account range: start %d is after end %d", start, end));
        }
        this.start = start;
        this.end = end;
    }

    public static AccountRange of(int start, int end) {
        return new AccountRange(start, end);
    }

    public boolean contains(int accountNumber) {
        return start <= accountNumber && accountNumber <= end;
    }
}
