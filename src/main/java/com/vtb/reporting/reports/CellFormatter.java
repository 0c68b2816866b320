package com.vtb.reporting.reports;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Текстовое представление ячейки для текстовых форматов
 */
final class CellFormatter {

    /** Разделитель элементов списка, как в исходном CSV экспорте */
    static final String LIST_SEPARATOR = " - ";

    private CellFormatter() {
    }

    static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream()
                .map(CellFormatter::format)
                .collect(Collectors.joining(LIST_SEPARATOR));
        }
        return value.toString();
    }
}
