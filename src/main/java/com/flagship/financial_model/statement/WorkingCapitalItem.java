package com.flagship.financial_model.statement;

/**
 * Working-capital balances and the cash-flow delta each one drives.
 *
 * An increase in a current asset uses cash (sign -1); an increase in a
 * current liability is a source of cash (sign +1).
 */
public enum WorkingCapitalItem {
    ACCOUNTS_RECEIVABLE(LineItem.ACCOUNTS_RECEIVABLE, LineItem.DELTA_AR, -1),
    INVENTORY(LineItem.INVENTORY, LineItem.DELTA_INVENTORY, -1),
    PREPAID_EXPENSES(LineItem.PREPAID_EXPENSES, LineItem.DELTA_PREPAID, -1),
    OTHER_CURRENT_ASSETS(LineItem.OTHER_CURRENT_ASSETS, LineItem.DELTA_OTHER_CURRENT_ASSETS, -1),
    ACCOUNTS_PAYABLE(LineItem.ACCOUNTS_PAYABLE, LineItem.DELTA_AP, 1),
    ACCRUED_PAYROLL(LineItem.ACCRUED_PAYROLL, LineItem.DELTA_ACCRUED_PAYROLL, 1),
    DEFERRED_REVENUE(LineItem.DEFERRED_REVENUE, LineItem.DELTA_DEFERRED_REVENUE, 1),
    INTEREST_PAYABLE(LineItem.INTEREST_PAYABLE, LineItem.DELTA_INTEREST_PAYABLE, 1),
    OTHER_CURRENT_LIABILITIES(LineItem.OTHER_CURRENT_LIABILITIES, LineItem.DELTA_OTHER_CURRENT_LIABILITIES, 1),
    INCOME_TAXES_PAYABLE(LineItem.INCOME_TAXES_PAYABLE, LineItem.DELTA_INCOME_TAXES_PAYABLE, 1);

    private final LineItem balance;
    private final LineItem delta;
    private final int sign;

    WorkingCapitalItem(LineItem balance, LineItem delta, int sign) {
        this.balance = balance;
        this.delta = delta;
        this.sign = sign;
    }

    public LineItem getBalance() {
        return balance;
    }

    public LineItem getDelta() {
        return delta;
    }

    public int getSign() {
        return sign;
    }
}
