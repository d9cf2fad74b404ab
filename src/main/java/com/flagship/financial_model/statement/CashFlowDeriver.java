package com.flagship.financial_model.statement;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.SortedMap;

/**
 * Derives indirect-method cash-flow drivers from balance-sheet deltas.
 *
 * Both the merged TB+GL path and the single-source path use the same
 * formulas; they differ only in which year counts as the prior year.
 */
@Component
@Slf4j
public class CashFlowDeriver {

    /**
     * Writes working-capital deltas, debt delta, stock issuance and capex
     * into {@code current}, relative to {@code prior}.
     *
     * Capex is the negated change in gross PPE and assumes no disposals.
     */
    public void deriveBetween(YearStatement prior, YearStatement current) {
        for (WorkingCapitalItem item : WorkingCapitalItem.values()) {
            BigDecimal change = current.get(item.getBalance()).subtract(prior.get(item.getBalance()));
            current.put(item.getDelta(), item.getSign() < 0 ? change.negate() : change);
        }

        current.put(LineItem.DELTA_DEBT,
            current.get(LineItem.LONG_TERM_DEBT).subtract(prior.get(LineItem.LONG_TERM_DEBT)));
        current.put(LineItem.STOCK_ISSUANCE,
            current.get(LineItem.COMMON_STOCK).subtract(prior.get(LineItem.COMMON_STOCK)));
        current.put(LineItem.CAPEX,
            current.get(LineItem.PPE_GROSS).subtract(prior.get(LineItem.PPE_GROSS)).negate());
    }

    /**
     * Dividends implied by the retained-earnings roll-forward:
     * max(0, RE_begin + net income - RE_end).
     *
     * A negative result is clamped to zero; the gap shows up in the
     * reconciliation's retained-earnings diagnostics instead.
     */
    public BigDecimal deriveDividends(YearStatement prior, YearStatement current) {
        BigDecimal implied = prior.get(LineItem.RETAINED_EARNINGS)
            .add(current.get(LineItem.NET_INCOME))
            .subtract(current.get(LineItem.RETAINED_EARNINGS));
        BigDecimal dividends = implied.signum() > 0 ? implied : BigDecimal.ZERO;
        if (implied.signum() < 0) {
            log.debug("Retained earnings for {} exceed roll-forward by {}, dividends clamped to zero",
                current.getYear(), implied.negate());
        }
        current.put(LineItem.DIVIDENDS, dividends);
        return dividends;
    }

    /**
     * Single-source variant: deltas between consecutive years present in the
     * series. The first year gets no cash-flow items and no opening snapshot
     * is required.
     */
    public void deriveSeries(SortedMap<Integer, YearStatement> statements) {
        if (statements.size() < 2) {
            return;
        }
        Iterator<YearStatement> iterator = statements.values().iterator();
        YearStatement prior = iterator.next();
        while (iterator.hasNext()) {
            YearStatement current = iterator.next();
            deriveBetween(prior, current);
            prior = current;
        }
    }
}
