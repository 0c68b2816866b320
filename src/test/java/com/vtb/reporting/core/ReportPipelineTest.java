package com.vtb.reporting.core;

import com.vtb.reporting.TestFixtures;
import com.vtb.reporting.analysis.AggregationResult;
import com.vtb.reporting.config.ReportingConfig;
import com.vtb.reporting.errors.MalformedInputException;
import com.vtb.reporting.errors.MissingIdentifierException;
import com.vtb.reporting.models.Host;
import com.vtb.reporting.models.Port;
import com.vtb.reporting.models.RiskLevel;
import com.vtb.reporting.reports.ReportModelBuilder;
import com.vtb.reporting.reports.ReportRow;
import com.vtb.reporting.reports.ReportTable;
import com.vtb.reporting.reports.TableKind;
import com.vtb.reporting.reports.TableSelection;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для ReportPipeline
 */
class ReportPipelineTest {

    @Test
    void testSampleReport() {
        PipelineResult result = ReportPipeline.builder().build()
            .run(List.of(TestFixtures.report(TestFixtures.SAMPLE_REPORT)));

        RunDiagnostics diagnostics = result.getDiagnostics();
        assertEquals(1, diagnostics.getDocuments());
        assertEquals(5, diagnostics.getParsedRecords());
        assertEquals(5, diagnostics.getNormalizedFindings());
        assertEquals(0, diagnostics.getSkippedCount());
        assertEquals(4, diagnostics.getDistinctVulnerabilities());
        assertEquals(2, diagnostics.getDistinctHosts());
        assertEquals(3, result.getReport().size());

        AggregationResult byVulnerability = result.getByVulnerability().orElseThrow();
        assertEquals(List.of("1.3.6.1.4.1.25623.1.0.900001", "1.3.6.1.4.1.25623.1.0.900004",
                "1.3.6.1.4.1.25623.1.0.900002", "1.3.6.1.4.1.25623.1.0.900003"),
            byVulnerability.getGroups().stream()
                .map(g -> g.getGroup().getKey().identity())
                .collect(Collectors.toList()),
            "Группы упорядочены по убыванию severity");
        assertEquals(2, byVulnerability.getTotals().countOf(RiskLevel.CRITICAL));
        assertEquals(1, byVulnerability.getTotals().countOf(RiskLevel.HIGH));
        assertEquals(1, byVulnerability.getTotals().countOf(RiskLevel.MEDIUM));
        assertEquals(0, byVulnerability.getTotals().countOf(RiskLevel.LOW));
        assertEquals(1, byVulnerability.getTotals().countOf(RiskLevel.NONE));

        ReportTable hosts = result.getReport().getTable(TableKind.BY_HOST).orElseThrow();
        assertEquals("alpha.local", hosts.getRows().get(0).get("hostname"), "У alpha больше находок");
        assertEquals(List.of("22/tcp", "80/tcp", "443/tcp"), hosts.getRows().get(0).get("open_ports"));
    }

    @Test
    void testSkipPolicy() {
        PipelineResult result = ReportPipeline.builder()
            .errorPolicy(RecordErrorPolicy.SKIP)
            .build()
            .run(List.of(TestFixtures.report(TestFixtures.INVALID_RECORDS)));

        RunDiagnostics diagnostics = result.getDiagnostics();
        assertEquals(5, diagnostics.getParsedRecords());
        assertEquals(3, diagnostics.getSkippedCount());
        assertEquals(2, result.getFindings().size());
        assertEquals(List.of("result@id", "nvt@oid", "host"),
            diagnostics.getSkippedRecords().stream().map(SkippedRecord::getField).collect(Collectors.toList()));
        assertNull(diagnostics.getSkippedRecords().get(0).getRecordId());
        assertEquals("bad-oid", diagnostics.getSkippedRecords().get(1).getRecordId());
    }

    @Test
    void testAbortPolicy() {
        ReportPipeline pipeline = ReportPipeline.builder().errorPolicy(RecordErrorPolicy.ABORT).build();

        assertThrows(MissingIdentifierException.class,
            () -> pipeline.run(List.of(TestFixtures.report(TestFixtures.INVALID_RECORDS))));
    }

    @Test
    void testMalformedDocumentIsFatal() {
        ReportPipeline pipeline = ReportPipeline.builder().build();

        assertThrows(MalformedInputException.class, () -> pipeline.run(List.of(
            TestFixtures.report(TestFixtures.TWO_HOSTS),
            TestFixtures.report(TestFixtures.MALFORMED))));
    }

    @Test
    void testSeveralDocumentsShareOneRun() {
        PipelineResult result = ReportPipeline.builder().build().run(List.of(
            TestFixtures.report(TestFixtures.TWO_HOSTS),
            TestFixtures.report(TestFixtures.TWO_HOSTS)));

        assertEquals(2, result.getDiagnostics().getDocuments());
        assertEquals(4, result.getFindings().size());
        assertEquals(1, result.getDiagnostics().getDistinctVulnerabilities());
        assertSame(result.getFindings().get(0).getVulnerability(), result.getFindings().get(2).getVulnerability());
    }

    @Test
    void testRunsAreIndependent() {
        ReportPipeline pipeline = ReportPipeline.builder().build();

        PipelineResult first = pipeline.run(List.of(TestFixtures.report(TestFixtures.TWO_HOSTS)));
        PipelineResult second = pipeline.run(List.of(TestFixtures.report(TestFixtures.TWO_HOSTS)));

        assertNotSame(first.getFindings().get(0).getVulnerability(), second.getFindings().get(0).getVulnerability(),
            "Таблицы интернирования не переживают запуск");
    }

    @Test
    void testFilterAndSelection() {
        PipelineResult result = ReportPipeline.builder()
            .filter(FindingFilter.builder().includedLevels(List.of(RiskLevel.CRITICAL)).build())
            .selection(TableSelection.builder().includeByHost(false).includeSummary(false).build())
            .build()
            .run(List.of(TestFixtures.report(TestFixtures.SAMPLE_REPORT)));

        assertEquals(2, result.getFindings().size());
        assertEquals(3, result.getDiagnostics().getFilteredFindings());
        assertTrue(result.getByHost().isEmpty(), "Группировка по хостам не нужна");
        assertFalse(result.getReport().contains(TableKind.SUMMARY));
        assertEquals(1, result.getReport().getTable(TableKind.BY_VULNERABILITY).orElseThrow().size());
    }

    @Test
    void testObservedPortsOnlyFromAcceptedFindings() {
        PipelineResult result = ReportPipeline.builder()
            .filter(FindingFilter.builder().includedLevels(List.of(RiskLevel.CRITICAL)).build())
            .build()
            .run(List.of(TestFixtures.report(TestFixtures.SAMPLE_REPORT)));

        Host alpha = result.getFindings().get(0).getHost();
        assertEquals("10.0.0.1", alpha.getAddress());
        assertEquals(Set.of(Port.parse("22/tcp")), alpha.getObservedPorts(),
            "Порты 443 и 80 отфильтрованных находок не учитываются");
    }

    @Test
    void testEmptyResult() {
        String xml = "<report><report><results/></report></report>";
        PipelineResult result = ReportPipeline.builder().build()
            .run(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "empty");

        assertTrue(result.getFindings().isEmpty());
        ReportTable summary = result.getReport().getTable(TableKind.SUMMARY).orElseThrow();
        ReportRow total = summary.getRows().get(summary.size() - 1);
        assertEquals(ReportModelBuilder.TOTAL_LABEL, total.get("level"));
        assertEquals(0, total.get("finding_count"));
    }

    @Test
    void testFromConfig() {
        ReportingConfig config = ReportingConfig.defaults();
        config.getFilter().setExcludedHosts(List.of("B"));
        config.setErrorPolicy(RecordErrorPolicy.ABORT);

        ReportPipeline pipeline = ReportPipeline.fromConfig(config);
        PipelineResult result = pipeline.run(List.of(TestFixtures.report(TestFixtures.TWO_HOSTS)));

        assertEquals(RecordErrorPolicy.ABORT, pipeline.getErrorPolicy());
        assertEquals(1, result.getFindings().size());
        assertEquals("A", result.getFindings().get(0).getHost().getAddress());
    }

    @Test
    void testNoDocuments() {
        assertThrows(IllegalArgumentException.class, () -> ReportPipeline.builder().build().run(List.of()));
    }
}
