package com.vtb.reporting.reports;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Независимая от формата таблица отчета: колонки и упорядоченные строки
 */
@Value
@Builder
public class ReportTable {
    TableKind kind;
    String title;
    @Singular
    List<ReportColumn> columns;
    @Singular
    List<ReportRow> rows;

    public int size() {
        return rows.size();
    }
}
