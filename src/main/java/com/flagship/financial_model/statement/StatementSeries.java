package com.flagship.financial_model.statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Year statements in ascending year order, optionally led by an internal
 * opening-balance year (Year0) that is never shown to users.
 */
public final class StatementSeries {

    private final Integer openingYear;
    private final SortedMap<Integer, YearStatement> statements;

    private StatementSeries(Integer openingYear, SortedMap<Integer, YearStatement> statements) {
        if (openingYear != null && !statements.isEmpty() && statements.firstKey() != openingYear.intValue()) {
            throw new IllegalArgumentException("Opening year " + openingYear + " must be the earliest year");
        }
        this.openingYear = openingYear;
        this.statements = Collections.unmodifiableSortedMap(new TreeMap<>(statements));
    }

    public static StatementSeries withOpeningYear(int openingYear, SortedMap<Integer, YearStatement> statements) {
        return new StatementSeries(openingYear, statements);
    }

    public static StatementSeries withoutOpeningYear(SortedMap<Integer, YearStatement> statements) {
        return new StatementSeries(null, statements);
    }

    public static StatementSeries empty() {
        return new StatementSeries(null, new TreeMap<>());
    }

    public boolean hasOpeningYear() {
        return openingYear != null;
    }

    public Integer getOpeningYear() {
        return openingYear;
    }

    /**
     * All statements, including Year0 when present.
     */
    public SortedMap<Integer, YearStatement> getStatements() {
        return statements;
    }

    public YearStatement get(int year) {
        return statements.get(year);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    /**
     * Years shown to users: everything except Year0.
     */
    public List<Integer> statementYears() {
        List<Integer> years = new ArrayList<>(statements.keySet());
        if (openingYear != null) {
            years.remove(openingYear);
        }
        return years;
    }

    public SortedMap<Integer, YearStatement> visibleStatements() {
        if (openingYear == null) {
            return statements;
        }
        return statements.tailMap(openingYear + 1);
    }

    public StatementSeries freeze() {
        statements.values().forEach(YearStatement::freeze);
        return this;
    }
}
