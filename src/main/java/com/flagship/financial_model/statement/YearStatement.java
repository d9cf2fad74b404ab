package com.flagship.financial_model.statement;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Statement line items for one calendar year.
 *
 * Every {@link LineItem} reads as zero when it has not been set, so callers
 * never see a missing key. Statements are filled by the aggregator, merger
 * and cash-flow deriver, then frozen before reconciliation.
 */
public class YearStatement {

    private final int year;
    private final Map<LineItem, BigDecimal> values;
    private boolean frozen;

    public YearStatement(int year) {
        this.year = year;
        this.values = new EnumMap<>(LineItem.class);
    }

    public int getYear() {
        return year;
    }

    public BigDecimal get(LineItem item) {
        return values.getOrDefault(item, BigDecimal.ZERO);
    }

    public void put(LineItem item, BigDecimal amount) {
        if (frozen) {
            throw new IllegalStateException("Statement for " + year + " is frozen");
        }
        values.put(Objects.requireNonNull(item), amount != null ? amount : BigDecimal.ZERO);
    }

    public boolean contains(LineItem item) {
        return values.containsKey(item);
    }

    /**
     * Sets the item to zero unless it already has a value.
     */
    public void ensure(LineItem item) {
        if (!values.containsKey(item)) {
            put(item, BigDecimal.ZERO);
        }
    }

    /**
     * Recomputes gross profit, total opex, EBIT and EBT from the income
     * statement items. Returns EBT less tax expense.
     */
    public BigDecimal computeSubtotals() {
        BigDecimal grossProfit = get(LineItem.REVENUE).subtract(get(LineItem.COGS));
        BigDecimal totalOpex = get(LineItem.DISTRIBUTION_EXPENSES)
            .add(get(LineItem.MARKETING_ADMIN))
            .add(get(LineItem.RESEARCH_DEV))
            .add(get(LineItem.DEPRECIATION_EXPENSE));
        BigDecimal ebit = grossProfit.subtract(totalOpex);
        BigDecimal ebt = ebit.subtract(get(LineItem.INTEREST_EXPENSE));

        put(LineItem.GROSS_PROFIT, grossProfit);
        put(LineItem.TOTAL_OPEX, totalOpex);
        put(LineItem.EBIT, ebit);
        put(LineItem.EBT, ebt);
        return ebt.subtract(get(LineItem.TAX_EXPENSE));
    }

    /**
     * Copies only the items of the given section.
     */
    public YearStatement copySection(LineItem.Section section) {
        YearStatement copy = new YearStatement(year);
        values.forEach((item, amount) -> {
            if (item.getSection() == section) {
                copy.values.put(item, amount);
            }
        });
        return copy;
    }

    public YearStatement copy() {
        YearStatement copy = new YearStatement(year);
        copy.values.putAll(values);
        return copy;
    }

    public YearStatement freeze() {
        this.frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Items that have been explicitly set.
     */
    public Map<LineItem, BigDecimal> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * Every line item keyed by its snake_case name, zero when unset.
     * Cash-flow items are left out when the year had no prior year to
     * derive them from.
     */
    @JsonValue
    public Map<String, BigDecimal> toKeyMap() {
        boolean derived = hasCashFlow();
        Map<String, BigDecimal> keyed = new LinkedHashMap<>();
        for (LineItem item : LineItem.values()) {
            if (item.getSection() == LineItem.Section.CASH_FLOW && !derived) {
                continue;
            }
            keyed.put(item.key(), get(item));
        }
        return keyed;
    }

    /**
     * True once working-capital deltas have been derived against a prior year.
     */
    public boolean hasCashFlow() {
        return contains(LineItem.DELTA_AR);
    }

    @Override
    public String toString() {
        return "YearStatement{year=" + year + ", values=" + values + "}";
    }
}
