package com.flagship.financial_model.report;

import com.flagship.financial_model.statement.LineItem;
import com.flagship.financial_model.statement.YearStatement;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Computes {@link KeyRatios} per year. Any ratio whose denominator is not
 * positive is reported as zero.
 */
@Component
public class RatioCalculator {

    private static final int SCALE = 4;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public SortedMap<Integer, KeyRatios> calculate(SortedMap<Integer, YearStatement> statements) {
        SortedMap<Integer, KeyRatios> ratios = new TreeMap<>();
        YearStatement prior = null;
        for (YearStatement current : statements.values()) {
            ratios.put(current.getYear(), calculate(current, prior));
            prior = current;
        }
        return ratios;
    }

    public KeyRatios calculate(YearStatement current, YearStatement prior) {
        BigDecimal revenue = current.get(LineItem.REVENUE);
        BigDecimal revenueGrowth = BigDecimal.ZERO.setScale(SCALE);
        if (prior != null) {
            BigDecimal priorRevenue = prior.get(LineItem.REVENUE);
            revenueGrowth = percent(revenue.subtract(priorRevenue), priorRevenue);
        }

        return KeyRatios.builder()
            .year(current.getYear())
            .grossMarginPct(percent(DerivedFormula.GROSS_PROFIT.evaluate(current), revenue))
            .ebitMarginPct(percent(DerivedFormula.EBIT.evaluate(current), revenue))
            .netMarginPct(percent(DerivedFormula.NET_INCOME.evaluate(current), revenue))
            .revenueGrowthPct(revenueGrowth)
            .debtToEquity(ratio(DerivedFormula.TOTAL_LIABILITIES.evaluate(current),
                DerivedFormula.TOTAL_EQUITY.evaluate(current)))
            .build();
    }

    static BigDecimal percent(BigDecimal numerator, BigDecimal denominator) {
        return ratio(numerator.multiply(HUNDRED), denominator);
    }

    static BigDecimal ratio(BigDecimal numerator, BigDecimal denominator) {
        if (denominator.signum() <= 0) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        return numerator.divide(denominator, SCALE, RoundingMode.HALF_UP);
    }
}
