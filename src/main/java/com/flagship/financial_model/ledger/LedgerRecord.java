package com.flagship.financial_model.ledger;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One row of trial balance or general ledger input.
 *
 * Records arrive already column-normalized and currency-converted.
 * A null transaction date means the upstream parser could not read it.
 *
 * No balancing invariant is enforced per record; debits and credits
 * are checked in aggregate by the validator.
 */
@Value
@With
public class LedgerRecord {
    LocalDate txnDate;
    Integer accountNumber;
    String accountName;
    BigDecimal debit;
    BigDecimal credit;
    String transactionId;
    String currency;

    @Builder
    public LedgerRecord(LocalDate txnDate, Integer accountNumber, String accountName,
                        BigDecimal debit, BigDecimal credit, String transactionId, String currency) {
        this.txnDate = txnDate;
        this.accountNumber = accountNumber;
        this.accountName = accountName;
        this.debit = debit != null ? debit : BigDecimal.ZERO;
        this.credit = credit != null ? credit : BigDecimal.ZERO;
        if (this.debit.signum() < 0 || this.credit.signum() < 0) {
            throw new IllegalArgumentException("Debit and credit amounts must not be negative");
        }
        this.transactionId = transactionId;
        this.currency = currency;
    }

    public boolean hasDate() {
        return txnDate != null;
    }

    public boolean hasTransactionId() {
        return transactionId != null && !transactionId.isBlank();
    }
}
