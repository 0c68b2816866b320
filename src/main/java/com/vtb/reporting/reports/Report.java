package com.vtb.reporting.reports;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Набор построенных таблиц отчета в порядке {@link TableKind}
 */
public final class Report {

    private final Map<TableKind, ReportTable> tables;

    Report(EnumMap<TableKind, ReportTable> tables) {
        this.tables = Collections.unmodifiableMap(new EnumMap<>(tables));
    }

    public Optional<ReportTable> getTable(TableKind kind) {
        return Optional.ofNullable(tables.get(kind));
    }

    public Collection<ReportTable> getTables() {
        return tables.values();
    }

    public boolean contains(TableKind kind) {
        return tables.containsKey(kind);
    }

    public int size() {
        return tables.size();
    }
}
