package com.flagship.financial_model;

import com.flagship.financial_model.ledger.LedgerRecord;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Ledger data shared by several tests.
 *
 * The four-year company: cash [100, 120, 150, 200], receivables
 * [50, 60, 55, 70], equipment [350, 350, 360, 340], stock 500 throughout and
 * retained earnings [0, 30, 65, 110]. Assets equal liabilities plus equity in
 * every year. GL revenue [1000, 1100, 1250, 1400] and cost of sales
 * [400, 430, 480, 520].
 */
public final class LedgerFixtures {

    public static final int[] YEARS = {2021, 2022, 2023, 2024};
    public static final int[] CASH = {100, 120, 150, 200};
    public static final int[] RECEIVABLES = {50, 60, 55, 70};
    public static final int[] EQUIPMENT = {350, 350, 360, 340};
    public static final int COMMON_STOCK = 500;
    public static final int[] RETAINED_EARNINGS = {0, 30, 65, 110};
    public static final int[] REVENUE = {1000, 1100, 1250, 1400};
    public static final int[] COST_OF_SALES = {400, 430, 480, 520};

    private LedgerFixtures() {
    }

    public static LedgerRecord debit(LocalDate date, int account, String name, long amount) {
        return LedgerRecord.builder()
            .txnDate(date)
            .accountNumber(account)
            .accountName(name)
            .debit(BigDecimal.valueOf(amount))
            .credit(BigDecimal.ZERO)
            .build();
    }

    public static LedgerRecord credit(LocalDate date, int account, String name, long amount) {
        return LedgerRecord.builder()
            .txnDate(date)
            .accountNumber(account)
            .accountName(name)
            .debit(BigDecimal.ZERO)
            .credit(BigDecimal.valueOf(amount))
            .build();
    }

    /**
     * Year-end trial balance rows for the given years, by index into {@link #YEARS}.
     */
    public static List<LedgerRecord> trialBalance(int fromIndex, int toIndex) {
        List<LedgerRecord> records = new ArrayList<>();
        for (int i = fromIndex; i <= toIndex; i++) {
            LocalDate yearEnd = LocalDate.of(YEARS[i], 12, 31);
            records.add(debit(yearEnd, 1000, "Cash", CASH[i]));
            records.add(debit(yearEnd, 1100, "Accounts Receivable", RECEIVABLES[i]));
            records.add(debit(yearEnd, 1500, "Property Plant and Equipment", EQUIPMENT[i]));
            records.add(credit(yearEnd, 3000, "Owner Equity", COMMON_STOCK));
            records.add(credit(yearEnd, 3100, "Accumulated Profits", RETAINED_EARNINGS[i]));
        }
        return records;
    }

    public static List<LedgerRecord> trialBalance() {
        return trialBalance(0, YEARS.length - 1);
    }

    /**
     * Balanced GL postings: each sale and each cost entry is a two-line
     * transaction against cash.
     */
    public static List<LedgerRecord> glActivity(int fromIndex, int toIndex) {
        List<LedgerRecord> records = new ArrayList<>();
        for (int i = fromIndex; i <= toIndex; i++) {
            LocalDate saleDate = LocalDate.of(YEARS[i], 6, 30);
            LocalDate costDate = LocalDate.of(YEARS[i], 9, 30);
            String saleId = "S-" + YEARS[i];
            String costId = "C-" + YEARS[i];
            records.add(credit(saleDate, 4000, "Sales Revenue", REVENUE[i]).withTransactionId(saleId));
            records.add(debit(saleDate, 1000, "Cash", REVENUE[i]).withTransactionId(saleId));
            records.add(debit(costDate, 5000, "COGS", COST_OF_SALES[i]).withTransactionId(costId));
            records.add(credit(costDate, 1000, "Cash", COST_OF_SALES[i]).withTransactionId(costId));
        }
        return records;
    }

    public static List<LedgerRecord> glActivity() {
        return glActivity(0, YEARS.length - 1);
    }
}
