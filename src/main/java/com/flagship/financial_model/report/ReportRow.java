package com.flagship.financial_model.report;

import com.flagship.financial_model.statement.LineItem;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Objects;

/**
 * One row of a statement layout.
 *
 * A row is either a direct read of a line item, a derived formula, a
 * section header or a blank spacer. {@link #getKind()} tells which fields
 * are set.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ReportRow {

    public enum Kind {
        DIRECT_FIELD,
        DERIVED_FIELD,
        SECTION_HEADER,
        BLANK_ROW
    }

    private static final ReportRow BLANK = new ReportRow(Kind.BLANK_ROW, "", null, null, false);

    Kind kind;
    String label;
    LineItem item;
    DerivedFormula formula;
    boolean total;

    public static ReportRow direct(String label, LineItem item) {
        return new ReportRow(Kind.DIRECT_FIELD, label, Objects.requireNonNull(item), null, false);
    }

    public static ReportRow derived(String label, DerivedFormula formula) {
        return new ReportRow(Kind.DERIVED_FIELD, label, null, Objects.requireNonNull(formula), false);
    }

    /**
     * A derived row rendered as a statement total.
     */
    public static ReportRow total(String label, DerivedFormula formula) {
        return new ReportRow(Kind.DERIVED_FIELD, label, null, Objects.requireNonNull(formula), true);
    }

    public static ReportRow header(String label) {
        return new ReportRow(Kind.SECTION_HEADER, label, null, null, false);
    }

    public static ReportRow blank() {
        return BLANK;
    }

    public boolean hasValue() {
        return kind == Kind.DIRECT_FIELD || kind == Kind.DERIVED_FIELD;
    }
}
