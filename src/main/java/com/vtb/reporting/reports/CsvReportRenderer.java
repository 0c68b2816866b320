package com.vtb.reporting.reports;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Рендерер таблиц в CSV (строка заголовков + строки таблицы)
 */
@Slf4j
public class CsvReportRenderer implements ReportRenderer {

    private final CsvMapper mapper = new CsvMapper();

    @Override
    public void render(ReportTable table, Path outputPath) throws IOException {
        if (table == null) {
            throw new IllegalArgumentException("ReportTable не может быть null");
        }
        log.info("Генерация CSV отчета {}: {}", table.getKind(), outputPath);

        CsvSchema.Builder columns = CsvSchema.builder();
        for (ReportColumn column : table.getColumns()) {
            columns.addColumn(column.getHeader());
        }
        CsvSchema schema = columns.build().withHeader();

        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            if (table.getRows().isEmpty()) {
                // Jackson пишет заголовок только вместе с первой строкой
                Map<String, String> header = new LinkedHashMap<>();
                table.getColumns().forEach(column -> header.put(column.getHeader(), column.getHeader()));
                mapper.writer(schema.withoutHeader()).without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                    .writeValue(out, header);
            } else {
                try (SequenceWriter writer = mapper.writer(schema)
                        .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                        .writeValues(out)) {
                    for (ReportRow row : table.getRows()) {
                        Map<String, String> values = new LinkedHashMap<>();
                        for (ReportColumn column : table.getColumns()) {
                            values.put(column.getHeader(), CellFormatter.format(row.get(column.getKey())));
                        }
                        writer.write(values);
                    }
                }
            }
        }
        log.info("CSV отчет сохранен: {} ({} строк)", outputPath, table.size());
    }

    @Override
    public String getFileExtension() {
        return "csv";
    }
}
