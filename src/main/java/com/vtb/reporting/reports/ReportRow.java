package com.vtb.reporting.reports;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Строка таблицы: упорядоченные ячейки по ключам колонок.
 * Значения - String, Integer, Double или List&lt;String&gt;; отсутствующее значение - null.
 */
@ToString
@EqualsAndHashCode
public final class ReportRow {

    private final Map<String, Object> cells;

    private ReportRow(Map<String, Object> cells) {
        this.cells = Collections.unmodifiableMap(cells);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Object get(String key) {
        return cells.get(key);
    }

    @JsonValue
    public Map<String, Object> getCells() {
        return cells;
    }

    public static final class Builder {
        private final Map<String, Object> cells = new LinkedHashMap<>();

        public Builder cell(String key, Object value) {
            cells.put(key, value);
            return this;
        }

        public ReportRow build() {
            return new ReportRow(new LinkedHashMap<>(cells));
        }
    }
}
