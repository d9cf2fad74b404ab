package com.flagship.financial_model.classification;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered table of category to account-number range, used as the fallback
 * when name matching finds nothing. Ranges may overlap; the first entry in
 * table order that contains the number wins.
 */
public final class AccountRangeTable {

    private static final AccountRangeTable DEFAULT = buildDefault();

    private final Map<FsliCategory, AccountRange> ranges;

    private AccountRangeTable(Map<FsliCategory, AccountRange> ranges) {
        this.ranges = Collections.unmodifiableMap(new LinkedHashMap<>(ranges));
    }

    public static AccountRangeTable defaults() {
        return DEFAULT;
    }

    /**
     * Builds a table from caller-supplied ranges. Iteration order of the
     * given map is preserved, so pass a LinkedHashMap when order matters.
     */
    public static AccountRangeTable of(Map<FsliCategory, AccountRange> ranges) {
        if (ranges == null || ranges.isEmpty()) {
            return DEFAULT;
        }
        if (ranges.containsKey(FsliCategory.UNCLASSIFIED)) {
            throw new IllegalArgumentException("Cannot assign an account range to the unclassified category");
        }
        return new AccountRangeTable(ranges);
    }

    public Optional<FsliCategory> lookup(int accountNumber) {
        for (Map.Entry<FsliCategory, AccountRange> entry : ranges.entrySet()) {
            if (entry.getValue().contains(accountNumber)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    public Map<FsliCategory, AccountRange> asMap() {
        return ranges;
    }

    public int size() {
        return ranges.size();
    }

    private static AccountRangeTable buildDefault() {
        Map<FsliCategory, AccountRange> ranges = new LinkedHashMap<>();
        // Assets
        ranges.put(FsliCategory.CASH, AccountRange.of(1000, 1099));
        ranges.put(FsliCategory.ACCOUNTS_RECEIVABLE, AccountRange.of(1100, 1199));
        ranges.put(FsliCategory.INVENTORY, AccountRange.of(1200, 1299));
        ranges.put(FsliCategory.PREPAID_EXPENSES, AccountRange.of(1300, 1349));
        ranges.put(FsliCategory.OTHER_CURRENT_ASSETS, AccountRange.of(1350, 1499));
        ranges.put(FsliCategory.PPE_GROSS, AccountRange.of(1500, 1599));
        // Shadowed by PPE_GROSS in table order; kept so custom tables can reorder
        ranges.put(FsliCategory.ACCUMULATED_DEPRECIATION, AccountRange.of(1590, 1599));
        ranges.put(FsliCategory.OTHER_FIXED_ASSETS, AccountRange.of(1600, 1999));

        // Liabilities
        ranges.put(FsliCategory.ACCOUNTS_PAYABLE, AccountRange.of(2000, 2099));
        ranges.put(FsliCategory.ACCRUED_PAYROLL, AccountRange.of(2100, 2149));
        ranges.put(FsliCategory.DEFERRED_REVENUE, AccountRange.of(2150, 2249));
        ranges.put(FsliCategory.INTEREST_PAYABLE, AccountRange.of(2250, 2299));
        ranges.put(FsliCategory.OTHER_CURRENT_LIABILITIES, AccountRange.of(2300, 2449));
        ranges.put(FsliCategory.INCOME_TAXES_PAYABLE, AccountRange.of(2450, 2499));
        ranges.put(FsliCategory.LONG_TERM_DEBT, AccountRange.of(2500, 2999));

        // Equity
        ranges.put(FsliCategory.COMMON_STOCK, AccountRange.of(3000, 3099));
        ranges.put(FsliCategory.RETAINED_EARNINGS, AccountRange.of(3100, 3199));
        ranges.put(FsliCategory.DIVIDENDS, AccountRange.of(3200, 3999));

        // Income statement
        ranges.put(FsliCategory.REVENUE, AccountRange.of(4000, 4999));
        ranges.put(FsliCategory.COGS, AccountRange.of(5000, 5099));
        ranges.put(FsliCategory.DISTRIBUTION_EXPENSES, AccountRange.of(5100, 5199));
        ranges.put(FsliCategory.MARKETING_ADMIN, AccountRange.of(5200, 5299));
        ranges.put(FsliCategory.RESEARCH_DEV, AccountRange.of(5300, 5349));
        ranges.put(FsliCategory.DEPRECIATION_EXPENSE, AccountRange.of(5350, 5399));
        ranges.put(FsliCategory.OTHER_OPEX, AccountRange.of(5400, 5999));
        ranges.put(FsliCategory.INTEREST_EXPENSE, AccountRange.of(6000, 6099));
        ranges.put(FsliCategory.TAX_EXPENSE, AccountRange.of(6100, 6999));
        return new AccountRangeTable(ranges);
    }
}
