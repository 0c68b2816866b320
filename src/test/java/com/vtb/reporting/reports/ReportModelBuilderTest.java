package com.vtb.reporting.reports;

import com.vtb.reporting.TestFixtures;
import com.vtb.reporting.analysis.AggregatedGroup;
import com.vtb.reporting.analysis.AggregationResult;
import com.vtb.reporting.analysis.Aggregator;
import com.vtb.reporting.analysis.GroupingEngine;
import com.vtb.reporting.analysis.GroupingMode;
import com.vtb.reporting.core.ReportPipeline;
import com.vtb.reporting.models.Finding;
import com.vtb.reporting.models.Host;
import com.vtb.reporting.models.RiskLevel;
import com.vtb.reporting.models.Vulnerability;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для ReportModelBuilder
 */
class ReportModelBuilderTest {

    private final GroupingEngine engine = new GroupingEngine();
    private final Aggregator aggregator = new Aggregator();
    private final ReportModelBuilder builder = new ReportModelBuilder();

    private final Vulnerability v1 = TestFixtures.vulnerability("V1", "Critical Service Flaw", 9.5);
    private final Host a = TestFixtures.host("A");
    private final Host b = TestFixtures.host("B");

    private final List<Finding> findings = List.of(
        TestFixtures.finding("f1", v1, a, 9.5),
        TestFixtures.finding("f2", v1, b, 9.5));

    @Test
    void testTwoHostsOneVulnerability() {
        AggregationResult byVulnerability = aggregate(GroupingMode.BY_VULNERABILITY);
        AggregationResult byHost = aggregate(GroupingMode.BY_HOST);

        assertEquals(1, byVulnerability.getGroups().size());
        AggregatedGroup v1Group = byVulnerability.getGroups().get(0);
        assertEquals(2, v1Group.getStatistics().getFindingCount());
        assertEquals(9.5, v1Group.getStatistics().getMaxSeverity().orElseThrow());
        assertEquals(RiskLevel.CRITICAL, v1Group.getStatistics().getHighestRiskLevel());
        assertEquals(2, v1Group.getStatistics().getDistinctHosts().size());

        assertEquals(2, byHost.getGroups().size());
        for (AggregatedGroup hostGroup : byHost.getGroups()) {
            assertEquals(1, hostGroup.getStatistics().getFindingCount());
            assertEquals(RiskLevel.CRITICAL, hostGroup.getStatistics().getHighestRiskLevel());
        }

        Report report = builder.build(byVulnerability, byHost, TableSelection.all());

        ReportTable vulnerabilities = report.getTable(TableKind.BY_VULNERABILITY).orElseThrow();
        assertEquals(1, vulnerabilities.size());
        ReportRow row = vulnerabilities.getRows().get(0);
        assertEquals("Critical Service Flaw", row.get("name"));
        assertEquals("Critical", row.get("risk_level"));
        assertEquals(9.5, row.get("cvss"));
        assertEquals(2, row.get("affected_hosts"));

        ReportTable hosts = report.getTable(TableKind.BY_HOST).orElseThrow();
        assertEquals(List.of("A", "B"), hosts.getRows().stream().map(r -> r.get("hostname")).collect(Collectors.toList()));
        assertEquals(1, hosts.getRows().get(0).get("critical"));
        assertEquals(1, hosts.getRows().get(0).get("vulnerability_count"));

        ReportTable summary = report.getTable(TableKind.SUMMARY).orElseThrow();
        assertEquals(RiskLevel.values().length + 1, summary.size(), "Строка на уровень плюс итог");
        ReportRow criticalRow = summary.getRows().get(0);
        assertEquals("Critical", criticalRow.get("level"));
        assertEquals(2, criticalRow.get("finding_count"));
        assertEquals(2, criticalRow.get("host_count"));
        for (int i = 1; i < RiskLevel.values().length; i++) {
            assertEquals(0, summary.getRows().get(i).get("finding_count"));
        }
        ReportRow total = summary.getRows().get(summary.size() - 1);
        assertEquals(ReportModelBuilder.TOTAL_LABEL, total.get("level"));
        assertEquals(2, total.get("finding_count"));
        assertEquals(1, total.get("vulnerability_count"));
        assertEquals(2, total.get("host_count"));
    }

    @Test
    void testColumns() {
        Report report = builder.build(aggregate(GroupingMode.BY_VULNERABILITY), aggregate(GroupingMode.BY_HOST),
            TableSelection.all());

        List<String> vulnerabilityKeys = report.getTable(TableKind.BY_VULNERABILITY).orElseThrow().getColumns()
            .stream().map(ReportColumn::getKey).collect(Collectors.toList());
        assertTrue(vulnerabilityKeys.containsAll(List.of("name", "family", "summary", "detection",
            "insight", "impact", "affected", "risk_level", "cvss", "affected_hosts", "references", "solution")));

        List<String> hostKeys = report.getTable(TableKind.BY_HOST).orElseThrow().getColumns()
            .stream().map(ReportColumn::getKey).collect(Collectors.toList());
        assertTrue(hostKeys.containsAll(List.of("hostname", "asset_id", "vulnerability_count", "highest_risk_level", "open_ports")));
    }

    @Test
    void testVulnerabilityDetailColumns() {
        Report report = ReportPipeline.builder().build()
            .run(List.of(TestFixtures.report("sample-report.xml")))
            .getReport();

        ReportTable vulnerabilities = report.getTable(TableKind.BY_VULNERABILITY).orElseThrow();
        ReportRow openssh = vulnerabilities.getRows().get(0);
        assertEquals("OpenSSH Remote Code Execution", openssh.get("name"));
        assertEquals("Remote code execution in OpenSSH.", openssh.get("summary"));
        assertEquals("Checks the banner.", openssh.get("detection"), "Метод обнаружения из тега vuldetect");
        assertEquals("Race condition in the signal handler.", openssh.get("insight"));
        assertEquals("Full system compromise.", openssh.get("impact"));
        assertEquals("OpenSSH before 9.8", openssh.get("affected"));
        assertEquals(List.of("CVE-2024-6387"), openssh.get("cves"));
        assertEquals(List.of("https://www.openssh.com/txt/release-9.8"), openssh.get("references"),
            "CVE не дублируются в ссылках");

        ReportRow weakCipher = vulnerabilities.getRows().stream()
            .filter(row -> "SSL/TLS: Weak Cipher Suites".equals(row.get("name")))
            .findFirst()
            .orElseThrow();
        assertNull(weakCipher.get("insight"), "Отсутствующий тег дает пустую ячейку");
    }

    @Test
    void testSelection() {
        TableSelection onlySummary = TableSelection.builder()
            .includeByVulnerability(false)
            .includeByHost(false)
            .build();

        Report report = builder.build(aggregate(GroupingMode.BY_VULNERABILITY), null, onlySummary);

        assertEquals(1, report.size());
        assertTrue(report.contains(TableKind.SUMMARY));
        assertTrue(report.getTable(TableKind.BY_HOST).isEmpty());
    }

    @Test
    void testMissingAggregation() {
        assertThrows(IllegalArgumentException.class,
            () -> builder.build(aggregate(GroupingMode.BY_VULNERABILITY), null, TableSelection.all()),
            "Для таблицы хостов нужна агрегация BY_HOST");
        assertThrows(IllegalArgumentException.class,
            () -> builder.build(aggregate(GroupingMode.BY_HOST), aggregate(GroupingMode.BY_HOST), TableSelection.all()),
            "Агрегация не того режима");
    }

    private AggregationResult aggregate(GroupingMode mode) {
        return aggregator.aggregate(engine.group(findings, mode));
    }
}
