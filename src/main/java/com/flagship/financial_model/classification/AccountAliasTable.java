package com.flagship.financial_model.classification;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Name aliases per FSLI category, in matching order.
 *
 * Order matters: classification returns the first category with a matching
 * alias, so broad aliases in early categories shadow later ones.
 * Aliases are stored already normalized (see {@link AccountClassifier#normalize(String)}).
 */
final class AccountAliasTable {

    private static final Map<FsliCategory, List<String>> ALIASES = build();

    private AccountAliasTable() {
    }

    static Map<FsliCategory, List<String>> aliases() {
        return ALIASES;
    }

    private static Map<FsliCategory, List<String>> build() {
        Map<FsliCategory, List<String>> aliases = new LinkedHashMap<>();

        // Assets
        put(aliases, FsliCategory.CASH,
            "cash", "cash and cash equivalents", "cash equivalents",
            "bank", "petty cash", "cash on hand");
        put(aliases, FsliCategory.ACCOUNTS_RECEIVABLE,
            "accounts receivable", "a/r", "ar", "trade receivable",
            "trade and other receivables", "receivables", "debtors");
        put(aliases, FsliCategory.INVENTORY,
            "inventory", "inventories", "stock", "merchandise",
            "finished goods", "raw materials", "work in process", "wip");
        put(aliases, FsliCategory.PREPAID_EXPENSES,
            "prepaid", "prepaid expenses", "prepayments", "deferred expenses");
        put(aliases, FsliCategory.OTHER_CURRENT_ASSETS,
            "other current assets", "current assets - other",
            "deposits", "advances");
        put(aliases, FsliCategory.PPE_GROSS,
            "property plant and equipment", "ppe", "pp&e", "fixed assets",
            "property, plant & equipment", "capital assets", "plant and equipment",
            "property and equipment", "equipment", "machinery", "buildings",
            "land and buildings", "furniture", "fixtures", "vehicles");
        put(aliases, FsliCategory.ACCUMULATED_DEPRECIATION,
            "accumulated depreciation", "accumulated depr", "acc depreciation",
            "depreciation", "amortization");

        // Liabilities
        put(aliases, FsliCategory.ACCOUNTS_PAYABLE,
            "accounts payable", "a/p", "ap", "trade payable",
            "trade payables", "payables", "creditors");
        put(aliases, FsliCategory.ACCRUED_PAYROLL,
            "accrued payroll", "accrued wages", "accrued salaries",
            "payroll payable", "wages payable", "salaries payable",
            "employee compensation", "accrued compensation", "bonus accrual");
        put(aliases, FsliCategory.DEFERRED_REVENUE,
            "deferred revenue", "unearned revenue", "deferred income",
            "contract liabilities", "customer deposits", "advance payments",
            "prepayments from customers");
        put(aliases, FsliCategory.INTEREST_PAYABLE,
            "interest payable", "accrued interest", "interest accrual");
        put(aliases, FsliCategory.OTHER_CURRENT_LIABILITIES,
            "other current liabilities", "accrued liabilities",
            "accrued expenses", "other accruals", "current liabilities - other");
        put(aliases, FsliCategory.INCOME_TAXES_PAYABLE,
            "income taxes payable", "income tax payable", "tax payable",
            "taxes payable", "current tax liability");
        put(aliases, FsliCategory.LONG_TERM_DEBT,
            "long-term debt", "long term debt", "notes payable",
            "term loan", "revolver", "loan payable", "borrowings",
            "bank loan", "debt");

        // Equity
        put(aliases, FsliCategory.COMMON_STOCK,
            "common stock", "share capital", "paid-in capital",
            "additional paid-in capital", "apic", "contributed capital",
            "common stock and additional paid-in capital");
        put(aliases, FsliCategory.RETAINED_EARNINGS,
            "retained earnings", "accumulated earnings",
            "accumulated profits", "earnings retained");
        put(aliases, FsliCategory.DIVIDENDS,
            "dividends", "dividend", "dividends declared",
            "common dividends", "dividend payable");

        // Income statement
        put(aliases, FsliCategory.REVENUE,
            "revenue", "revenues", "sales", "income", "turnover",
            "product revenue", "service revenue", "net sales");
        put(aliases, FsliCategory.COGS,
            "cost of goods sold", "cogs", "cost of sales",
            "cost of revenue", "direct costs");
        put(aliases, FsliCategory.DISTRIBUTION_EXPENSES,
            "distribution", "distribution expenses", "shipping",
            "freight", "delivery", "logistics");
        put(aliases, FsliCategory.MARKETING_ADMIN,
            "marketing", "marketing and administration", "sg&a",
            "selling general and administrative", "admin", "administrative",
            "general and administrative", "overhead");
        put(aliases, FsliCategory.RESEARCH_DEV,
            "research and development", "r&d", "research", "development");
        put(aliases, FsliCategory.DEPRECIATION_EXPENSE,
            "depreciation expense", "depreciation", "amortization expense",
            "depr expense", "amort expense");
        put(aliases, FsliCategory.INTEREST_EXPENSE,
            "interest expense", "interest", "finance charges",
            "interest on debt", "borrowing costs");
        put(aliases, FsliCategory.TAX_EXPENSE,
            "income tax expense", "tax expense", "taxes",
            "provision for income taxes", "current tax", "income taxes");

        return Collections.unmodifiableMap(aliases);
    }

    private static void put(Map<FsliCategory, List<String>> aliases, FsliCategory category, String... names) {
        aliases.put(category, List.of(names).stream()
            .map(AccountClassifier::normalize)
            .distinct()
            .toList());
    }
}
