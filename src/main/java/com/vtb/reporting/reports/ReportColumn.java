package com.vtb.reporting.reports;

import lombok.Value;

/**
 * Метаданные колонки: ключ ячейки и заголовок
 */
@Value
public class ReportColumn {
    String key;
    String header;
}
