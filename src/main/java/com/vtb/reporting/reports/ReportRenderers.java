package com.vtb.reporting.reports;

import java.util.List;
import java.util.Locale;

/**
 * Выбор рендерера по имени формата
 */
public final class ReportRenderers {

    public static final List<String> SUPPORTED_FORMATS = List.of("csv", "json", "pdf");

    private ReportRenderers() {
    }

    /**
     * @throws IllegalArgumentException если формат не поддерживается
     */
    public static ReportRenderer forFormat(String format) {
        if (format == null || format.isBlank()) {
            throw new IllegalArgumentException("Формат отчета не может быть пустым");
        }
        switch (format.trim().toLowerCase(Locale.ROOT)) {
            case "csv":
                return new CsvReportRenderer();
            case "json":
                return new JsonReportRenderer();
            case "pdf":
                return new PdfReportRenderer();
            default:
                throw new IllegalArgumentException(String.format(
                    "Неподдерживаемый формат отчета: %s (доступны: %s)", format, String.join(", ", SUPPORTED_FORMATS)));
        }
    }
}
