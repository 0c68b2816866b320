package com.vtb.reporting.reports;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты рендереров CSV, JSON и PDF
 */
class ReportRenderersTest {

    @TempDir
    Path tempDir;

    private final Clock clock = Clock.fixed(Instant.parse("2026-10-01T12:00:00Z"), ZoneOffset.UTC);

    private ReportTable table() {
        return ReportTable.builder()
            .kind(TableKind.BY_VULNERABILITY)
            .title(TableKind.BY_VULNERABILITY.getTitle())
            .column(new ReportColumn("name", "Vulnerability"))
            .column(new ReportColumn("risk_level", "Risk level"))
            .column(new ReportColumn("cvss", "CVSS"))
            .column(new ReportColumn("cves", "CVE"))
            .row(ReportRow.builder()
                .cell("name", "SSL/TLS: Weak Cipher Suites, \"SWEET32\"")
                .cell("risk_level", "Medium")
                .cell("cvss", 5.0)
                .cell("cves", List.of("CVE-2016-2183", "CVE-2016-6329"))
                .build())
            .row(ReportRow.builder()
                .cell("name", "Unscored check")
                .cell("risk_level", "None")
                .cell("cvss", null)
                .cell("cves", List.of())
                .build())
            .build();
    }

    @Test
    void testCsv() throws Exception {
        Path output = tempDir.resolve("report.csv");

        new CsvReportRenderer().render(table(), output);

        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertEquals(3, lines.size(), "Заголовок и две строки");

        MappingIterator<Map<String, String>> iterator = new CsvMapper()
            .readerFor(Map.class)
            .with(CsvSchema.emptySchema().withHeader())
            .readValues(output.toFile());
        List<Map<String, String>> rows = iterator.readAll();
        assertEquals(2, rows.size());
        assertEquals(List.of("Vulnerability", "Risk level", "CVSS", "CVE"), List.copyOf(rows.get(0).keySet()));
        assertEquals("SSL/TLS: Weak Cipher Suites, \"SWEET32\"", rows.get(0).get("Vulnerability"), "Экранирование кавычек");
        assertEquals("CVE-2016-2183 - CVE-2016-6329", rows.get(0).get("CVE"), "Списки объединяются через ' - '");
        assertEquals("5.0", rows.get(0).get("CVSS"));
        assertEquals("", rows.get(1).get("CVSS"), "Отсутствующее значение - пустая ячейка");
    }

    @Test
    void testCsvEmptyTableKeepsHeader() throws Exception {
        Path output = tempDir.resolve("empty.csv");
        ReportTable empty = ReportTable.builder()
            .kind(TableKind.BY_HOST)
            .title(TableKind.BY_HOST.getTitle())
            .column(new ReportColumn("hostname", "Hostname"))
            .column(new ReportColumn("finding_count", "Findings"))
            .build();

        new CsvReportRenderer().render(empty, output);

        assertEquals(List.of("Hostname,Findings"), Files.readAllLines(output, StandardCharsets.UTF_8));
    }

    @Test
    void testJson() throws Exception {
        Path output = tempDir.resolve("report.json");

        new JsonReportRenderer(clock).render(table(), output);

        JsonNode root = new ObjectMapper().readTree(output.toFile());
        assertEquals("vulnerability", root.get("table").asText());
        assertEquals("2026-10-01T12:00:00Z", root.get("generatedAt").asText());
        assertEquals(4, root.get("columns").size());
        assertEquals("cvss", root.get("columns").get(2).get("key").asText());
        JsonNode first = root.get("rows").get(0);
        assertEquals(5.0, first.get("cvss").asDouble());
        assertEquals(2, first.get("cves").size());
        assertTrue(root.get("rows").get(1).get("cvss").isNull(), "Отсутствующее значение - null");
    }

    @Test
    void testPdf() throws Exception {
        Path output = tempDir.resolve("report.pdf");

        new PdfReportRenderer(clock).render(table(), output);

        assertTrue(Files.size(output) > 0);
        byte[] header = new byte[5];
        System.arraycopy(Files.readAllBytes(output), 0, header, 0, 5);
        assertEquals("%PDF-", new String(header, StandardCharsets.US_ASCII));
    }

    @Test
    void testRendererByFormat() {
        assertEquals("csv", ReportRenderers.forFormat("CSV").getFileExtension());
        assertEquals("json", ReportRenderers.forFormat("json").getFileExtension());
        assertEquals("pdf", ReportRenderers.forFormat(" pdf ").getFileExtension());
        assertThrows(IllegalArgumentException.class, () -> ReportRenderers.forFormat("xlsx"),
            "xlsx не поддерживается");
    }

    @Test
    void testNullTable() {
        assertThrows(IllegalArgumentException.class,
            () -> new CsvReportRenderer().render(null, tempDir.resolve("x.csv")));
    }

    @Test
    void testNaming() {
        assertEquals("openvas_report_host.csv", ReportNaming.fileName("openvas_report", TableKind.BY_HOST, "csv"));
        assertEquals("scan_2026_summary.pdf", ReportNaming.fileName("scan 2026", TableKind.SUMMARY, "pdf"));
        assertEquals(tempDir.resolve("r_vulnerability.json"),
            ReportNaming.resolve(tempDir, "r", TableKind.BY_VULNERABILITY, "json"));
        assertThrows(IllegalArgumentException.class, () -> ReportNaming.fileName(" ", TableKind.SUMMARY, "csv"));
    }
}
