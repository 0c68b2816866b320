package com.vtb.reporting.reports;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Интерфейс для рендереров таблиц отчета
 */
public interface ReportRenderer {

    /**
     * Отрендерить таблицу в файл
     *
     * @param table таблица отчета
     * @param outputPath путь для сохранения
     * @throws IOException если произошла ошибка записи
     */
    void render(ReportTable table, Path outputPath) throws IOException;

    /**
     * Получить расширение файла отчета
     */
    String getFileExtension();
}
