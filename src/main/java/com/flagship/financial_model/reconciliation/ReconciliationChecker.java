package com.flagship.financial_model.reconciliation;

import com.flagship.financial_model.statement.LineItem;
import com.flagship.financial_model.statement.WorkingCapitalItem;
import com.flagship.financial_model.statement.YearStatement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Recomputes the accounting identities over a statement series.
 *
 * The earliest year is treated as the opening year and gets no result.
 * For every later year:
 * - balance sheet check: assets - (liabilities + booked equity)
 * - cash check: reported cash - (prior cash + operating + investing + financing)
 * - retained earnings roll-forward, seeded with the opening year's booked value
 *
 * Never throws on out-of-balance data; residuals are returned for the
 * caller to compare against its tolerance.
 */
@Service
@Slf4j
public class ReconciliationChecker {

    public static final BigDecimal DEFAULT_TOLERANCE = new BigDecimal("0.01");

    public SortedMap<Integer, ReconciliationResult> reconcile(Map<Integer, YearStatement> statements) {
        SortedMap<Integer, ReconciliationResult> results = new TreeMap<>();
        if (statements == null || statements.size() < 2) {
            return results;
        }

        SortedMap<Integer, YearStatement> ordered = new TreeMap<>(statements);
        Iterator<YearStatement> iterator = ordered.values().iterator();
        YearStatement prior = iterator.next();
        BigDecimal retainedEarningsCalc = prior.get(LineItem.RETAINED_EARNINGS);

        while (iterator.hasNext()) {
            YearStatement current = iterator.next();

            BigDecimal netIncome = current.get(LineItem.NET_INCOME);
            BigDecimal dividends = current.get(LineItem.DIVIDENDS);
            retainedEarningsCalc = retainedEarningsCalc.add(netIncome).subtract(dividends);

            BigDecimal equityBooked = current.get(LineItem.COMMON_STOCK).add(current.get(LineItem.RETAINED_EARNINGS));
            BigDecimal balanceSheetCheck = totalAssets(current).subtract(totalLiabilities(current).add(equityBooked));

            BigDecimal endingCashCalc = prior.get(LineItem.CASH).add(netCashChange(current));
            BigDecimal cashflowCheck = current.get(LineItem.CASH).subtract(endingCashCalc);

            BigDecimal retainedEarningsTb = current.get(LineItem.RETAINED_EARNINGS);
            results.put(current.getYear(), ReconciliationResult.builder()
                .year(current.getYear())
                .balanceSheetCheck(balanceSheetCheck)
                .cashflowCheck(cashflowCheck)
                .retainedEarningsCalc(retainedEarningsCalc)
                .retainedEarningsTb(retainedEarningsTb)
                .retainedEarningsDiff(retainedEarningsTb.subtract(retainedEarningsCalc))
                .build());

            prior = current;
        }

        log.debug("Reconciled {} statement year(s)", results.size());
        return results;
    }

    public static BigDecimal totalAssets(YearStatement statement) {
        BigDecimal netPpe = statement.get(LineItem.PPE_GROSS).subtract(statement.get(LineItem.ACCUMULATED_DEPRECIATION));
        return statement.get(LineItem.CASH)
            .add(statement.get(LineItem.ACCOUNTS_RECEIVABLE))
            .add(statement.get(LineItem.INVENTORY))
            .add(statement.get(LineItem.PREPAID_EXPENSES))
            .add(statement.get(LineItem.OTHER_CURRENT_ASSETS))
            .add(netPpe);
    }

    public static BigDecimal totalLiabilities(YearStatement statement) {
        return statement.get(LineItem.ACCOUNTS_PAYABLE)
            .add(statement.get(LineItem.ACCRUED_PAYROLL))
            .add(statement.get(LineItem.DEFERRED_REVENUE))
            .add(statement.get(LineItem.INTEREST_PAYABLE))
            .add(statement.get(LineItem.OTHER_CURRENT_LIABILITIES))
            .add(statement.get(LineItem.INCOME_TAXES_PAYABLE))
            .add(statement.get(LineItem.LONG_TERM_DEBT));
    }

    public static BigDecimal workingCapitalChange(YearStatement statement) {
        BigDecimal total = BigDecimal.ZERO;
        for (WorkingCapitalItem item : WorkingCapitalItem.values()) {
            total = total.add(statement.get(item.getDelta()));
        }
        return total;
    }

    /**
     * Net income + depreciation + working-capital deltas.
     */
    public static BigDecimal operatingCashFlow(YearStatement statement) {
        return statement.get(LineItem.NET_INCOME)
            .add(statement.get(LineItem.DEPRECIATION_EXPENSE))
            .add(workingCapitalChange(statement));
    }

    public static BigDecimal financingCashFlow(YearStatement statement) {
        return statement.get(LineItem.STOCK_ISSUANCE)
            .subtract(statement.get(LineItem.DIVIDENDS))
            .add(statement.get(LineItem.DELTA_DEBT));
    }

    public static BigDecimal netCashChange(YearStatement statement) {
        return operatingCashFlow(statement)
            .add(statement.get(LineItem.CAPEX))
            .add(financingCashFlow(statement));
    }
}
