package com.vtb.reporting.reports;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Рендерер таблиц в JSON
 */
@Slf4j
public class JsonReportRenderer implements ReportRenderer {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JsonReportRenderer() {
        this(Clock.systemUTC());
    }

    JsonReportRenderer(Clock clock) {
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void render(ReportTable table, Path outputPath) throws IOException {
        log.info("Генерация JSON отчета {}: {}", table == null ? null : table.getKind(), outputPath);

        if (table == null) {
            throw new IllegalArgumentException("ReportTable не может быть null");
        }

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("table", table.getKind().getSlug());
        document.put("title", table.getTitle());
        document.put("generatedAt", OffsetDateTime.now(clock));
        document.put("columns", table.getColumns());
        document.put("rows", table.getRows());

        Files.writeString(outputPath, objectMapper.writeValueAsString(document));
        log.info("JSON отчет сохранен: {} ({} байт)", outputPath, Files.size(outputPath));
    }

    @Override
    public String getFileExtension() {
        return "json";
    }
}
