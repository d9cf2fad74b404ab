package com.flagship.financial_model.statement;

/**
 * The trial balance has no year-end snapshot for the year before the first
 * statement year, so opening balances cannot be established.
 */
public class MissingOpeningSnapshotException extends RuntimeException {

    private final int openingYear;
    private final int firstStatementYear;

    public MissingOpeningSnapshotException(int openingYear, int firstStatementYear) {
        super(String.format(
            "Missing Year 0 opening snapshot in trial balance. Expected a year-end snapshot for %d "
                + "to supply opening balances for first statement year %d.",
            openingYear, firstStatementYear));
        this.openingYear = openingYear;
        this.firstStatementYear = firstStatementYear;
    }

    public int getOpeningYear() {
        return openingYear;
    }

    public int getFirstStatementYear() {
        return firstStatementYear;
    }
}
