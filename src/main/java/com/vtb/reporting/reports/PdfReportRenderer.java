package com.vtb.reporting.reports;

import com.itextpdf.kernel.colors.ColorConstants;
import com.itextpdf.kernel.colors.DeviceRgb;
import com.itextpdf.kernel.geom.PageSize;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.layout.Document;
import com.itextpdf.layout.element.Cell;
import com.itextpdf.layout.element.Paragraph;
import com.itextpdf.layout.element.Table;
import com.itextpdf.layout.properties.TextAlignment;
import com.itextpdf.layout.properties.UnitValue;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Рендерер таблиц в PDF документ (альбомная A4, одна таблица на документ)
 */
@Slf4j
public class PdfReportRenderer implements ReportRenderer {

    private static final DateTimeFormatter DATE_FORMATTER =
        DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm:ss");

    private static final DeviceRgb HEADER_COLOR = new DeviceRgb(0x1F, 0x49, 0x7D);

    private static final Map<String, DeviceRgb> LEVEL_COLORS = Map.of(
        "Critical", new DeviceRgb(0x70, 0x20, 0x81),
        "High", new DeviceRgb(0xC0, 0x00, 0x00),
        "Medium", new DeviceRgb(0xFF, 0x80, 0x00),
        "Low", new DeviceRgb(0x00, 0xB0, 0x50),
        "None", new DeviceRgb(0x00, 0x70, 0xC0));

    private final Clock clock;

    public PdfReportRenderer() {
        this(Clock.systemDefaultZone());
    }

    PdfReportRenderer(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void render(ReportTable table, Path outputPath) throws IOException {
        log.info("Генерация PDF отчета {}: {}", table == null ? null : table.getKind(), outputPath);

        if (table == null) {
            throw new IllegalArgumentException("ReportTable не может быть null");
        }

        try (PdfDocument pdf = new PdfDocument(new PdfWriter(outputPath.toString()));
             Document document = new Document(pdf, PageSize.A4.rotate())) {

            document.add(new Paragraph("OpenVAS Report - " + table.getTitle())
                .setFontSize(18)
                .setBold()
                .setTextAlignment(TextAlignment.CENTER));
            document.add(new Paragraph("Generated: " + LocalDateTime.now(clock).format(DATE_FORMATTER))
                .setFontSize(9)
                .setTextAlignment(TextAlignment.CENTER)
                .setMarginBottom(10));

            Table grid = new Table(UnitValue.createPercentArray(table.getColumns().size()));
            grid.setWidth(UnitValue.createPercentValue(100));
            for (ReportColumn column : table.getColumns()) {
                grid.addHeaderCell(new Cell()
                    .add(new Paragraph(column.getHeader()).setBold().setFontSize(8))
                    .setBackgroundColor(HEADER_COLOR)
                    .setFontColor(ColorConstants.WHITE));
            }
            for (ReportRow row : table.getRows()) {
                for (ReportColumn column : table.getColumns()) {
                    String text = CellFormatter.format(row.get(column.getKey()));
                    Cell cell = new Cell().add(new Paragraph(text).setFontSize(7));
                    DeviceRgb levelColor = LEVEL_COLORS.get(text);
                    if (levelColor != null && isLevelColumn(column)) {
                        cell.setBackgroundColor(levelColor).setFontColor(ColorConstants.WHITE);
                    }
                    grid.addCell(cell);
                }
            }
            document.add(grid);
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Ошибка генерации PDF: " + e.getMessage(), e);
        }

        log.info("PDF отчет сохранен: {}", outputPath);
    }

    @Override
    public String getFileExtension() {
        return "pdf";
    }

    private static boolean isLevelColumn(ReportColumn column) {
        String key = column.getKey();
        return "risk_level".equals(key) || "highest_risk_level".equals(key) || "level".equals(key);
    }
}
