package com.flagship.financial_model.report;

import com.flagship.financial_model.statement.YearStatement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Renders statement layouts against year statements.
 */
@Component
@Slf4j
public class StatementReportBuilder {

    public Map<StatementLayout, ReportTable> buildAll(SortedMap<Integer, YearStatement> statements) {
        Map<StatementLayout, ReportTable> tables = new EnumMap<>(StatementLayout.class);
        for (StatementLayout layout : StatementLayout.values()) {
            tables.put(layout, build(layout, statements));
        }
        return tables;
    }

    public ReportTable build(StatementLayout layout, SortedMap<Integer, YearStatement> statements) {
        List<ReportLine> lines = new ArrayList<>(layout.getRows().size());
        for (ReportRow row : layout.getRows()) {
            ReportLine.ReportLineBuilder line = ReportLine.builder()
                .label(row.getLabel())
                .kind(row.getKind())
                .total(row.isTotal());
            if (row.hasValue()) {
                Map<Integer, BigDecimal> values = new LinkedHashMap<>();
                statements.forEach((year, statement) -> values.put(year, resolve(row, statement)));
                line.values(values);
            }
            lines.add(line.build());
        }

        log.debug("Built {} with {} line(s) for years {}", layout.getTitle(), lines.size(), statements.keySet());
        return ReportTable.builder()
            .title(layout.getTitle())
            .years(List.copyOf(statements.keySet()))
            .lines(List.copyOf(lines))
            .build();
    }

    static BigDecimal resolve(ReportRow row, YearStatement statement) {
        return switch (row.getKind()) {
            case DIRECT_FIELD -> statement.get(row.getItem());
            case DERIVED_FIELD -> row.getFormula().evaluate(statement);
            case SECTION_HEADER, BLANK_ROW -> throw new IllegalArgumentException(
                "Row '" + row.getLabel() + "' has no value");
        };
    }
}
