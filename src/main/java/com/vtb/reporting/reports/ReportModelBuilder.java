package com.vtb.reporting.reports;

import com.vtb.reporting.analysis.AggregatedGroup;
import com.vtb.reporting.analysis.AggregationResult;
import com.vtb.reporting.analysis.GroupStatistics;
import com.vtb.reporting.analysis.GroupingMode;
import com.vtb.reporting.analysis.ReportTotals;
import com.vtb.reporting.models.Host;
import com.vtb.reporting.models.Port;
import com.vtb.reporting.models.RiskLevel;
import com.vtb.reporting.models.Vulnerability;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Сборка таблиц отчета из упорядоченных агрегатов. Ничего не рендерит.
 *
 * <p>Сводка всегда строится по агрегации BY_VULNERABILITY: одна строка на уровень риска
 * (от CRITICAL до NONE) и итоговая строка.
 */
@Slf4j
public class ReportModelBuilder {

    public static final String TOTAL_LABEL = "Total";

    static final List<ReportColumn> VULNERABILITY_COLUMNS = List.of(
        new ReportColumn("name", "Vulnerability"),
        new ReportColumn("oid", "OID"),
        new ReportColumn("family", "Family"),
        new ReportColumn("summary", "Description"),
        new ReportColumn("detection", "Detection"),
        new ReportColumn("insight", "Insight"),
        new ReportColumn("impact", "Impact"),
        new ReportColumn("affected", "Affected"),
        new ReportColumn("risk_level", "Risk level"),
        new ReportColumn("cvss", "CVSS"),
        new ReportColumn("max_severity", "Max severity"),
        new ReportColumn("finding_count", "Findings"),
        new ReportColumn("affected_hosts", "Affected hosts"),
        new ReportColumn("cves", "CVE"),
        new ReportColumn("references", "References"),
        new ReportColumn("solution_type", "Solution type"),
        new ReportColumn("solution", "Solution"));

    static final List<ReportColumn> SUMMARY_COLUMNS = List.of(
        new ReportColumn("level", "Level"),
        new ReportColumn("finding_count", "Findings"),
        new ReportColumn("vulnerability_count", "Vulnerabilities"),
        new ReportColumn("host_count", "Hosts"));

    /**
     * Построить выбранные таблицы
     *
     * @param byVulnerability агрегация BY_VULNERABILITY (нужна для таблицы уязвимостей и сводки)
     * @param byHost агрегация BY_HOST (нужна для таблицы хостов)
     * @throws IllegalArgumentException если для выбранной таблицы нет подходящей агрегации
     */
    public Report build(AggregationResult byVulnerability, AggregationResult byHost, TableSelection selection) {
        if (selection == null) {
            throw new IllegalArgumentException("TableSelection не может быть null");
        }
        if (selection.needsVulnerabilityGrouping()) {
            requireMode(byVulnerability, GroupingMode.BY_VULNERABILITY);
        }
        if (selection.needsHostGrouping()) {
            requireMode(byHost, GroupingMode.BY_HOST);
        }

        EnumMap<TableKind, ReportTable> tables = new EnumMap<>(TableKind.class);
        if (selection.includes(TableKind.BY_VULNERABILITY)) {
            tables.put(TableKind.BY_VULNERABILITY, buildVulnerabilityTable(byVulnerability));
        }
        if (selection.includes(TableKind.BY_HOST)) {
            tables.put(TableKind.BY_HOST, buildHostTable(byHost));
        }
        if (selection.includes(TableKind.SUMMARY)) {
            tables.put(TableKind.SUMMARY, buildSummaryTable(byVulnerability.getTotals()));
        }
        log.info("Построено таблиц отчета: {} ({})", tables.size(), tables.keySet());
        return new Report(tables);
    }

    ReportTable buildVulnerabilityTable(AggregationResult aggregation) {
        ReportTable.ReportTableBuilder table = ReportTable.builder()
            .kind(TableKind.BY_VULNERABILITY)
            .title(TableKind.BY_VULNERABILITY.getTitle())
            .columns(VULNERABILITY_COLUMNS);
        for (AggregatedGroup aggregated : aggregation.getGroups()) {
            Vulnerability vulnerability = aggregated.getGroup().getVulnerability();
            GroupStatistics stats = aggregated.getStatistics();
            table.row(ReportRow.builder()
                .cell("name", vulnerability.getDisplayName())
                .cell("oid", vulnerability.getOid())
                .cell("family", vulnerability.getFamily().orElse(null))
                .cell("summary", vulnerability.getSummary().orElse(null))
                .cell("detection", vulnerability.getDetectionMethod().orElse(null))
                .cell("insight", vulnerability.getInsight().orElse(null))
                .cell("impact", vulnerability.getImpact().orElse(null))
                .cell("affected", vulnerability.getAffected().orElse(null))
                .cell("risk_level", stats.getHighestRiskLevel().getLabel())
                .cell("cvss", vulnerability.getCvssBase().orElse(null))
                .cell("max_severity", stats.getMaxSeverity().orElse(null))
                .cell("finding_count", stats.getFindingCount())
                .cell("affected_hosts", stats.getDistinctHosts().size())
                .cell("cves", vulnerability.getCves())
                .cell("references", vulnerability.getOtherReferences())
                .cell("solution_type", vulnerability.getSolutionType().orElse(null))
                .cell("solution", vulnerability.getSolution().orElse(null))
                .build());
        }
        return table.build();
    }

    ReportTable buildHostTable(AggregationResult aggregation) {
        ReportTable.ReportTableBuilder table = ReportTable.builder()
            .kind(TableKind.BY_HOST)
            .title(TableKind.BY_HOST.getTitle())
            .columns(hostColumns());
        for (AggregatedGroup aggregated : aggregation.getGroups()) {
            Host host = aggregated.getGroup().getHost();
            GroupStatistics stats = aggregated.getStatistics();
            ReportRow.Builder row = ReportRow.builder()
                .cell("hostname", host.getDisplayName())
                .cell("address", host.getAddress())
                .cell("asset_id", host.getAssetId().orElse(null))
                .cell("vulnerability_count", stats.getDistinctVulnerabilities().size())
                .cell("finding_count", stats.getFindingCount());
            for (RiskLevel level : RiskLevel.values()) {
                row.cell(levelKey(level), stats.countOf(level));
            }
            row.cell("highest_risk_level", stats.getHighestRiskLevel().getLabel())
                .cell("highest_severity", stats.getMaxSeverity().orElse(null))
                .cell("open_ports", stats.getDistinctPorts().stream()
                    .map(Port::getLabel)
                    .collect(Collectors.toList()));
            table.row(row.build());
        }
        return table.build();
    }

    ReportTable buildSummaryTable(ReportTotals totals) {
        ReportTable.ReportTableBuilder table = ReportTable.builder()
            .kind(TableKind.SUMMARY)
            .title(TableKind.SUMMARY.getTitle())
            .columns(SUMMARY_COLUMNS);
        for (RiskLevel level : RiskLevel.values()) {
            table.row(ReportRow.builder()
                .cell("level", level.getLabel())
                .cell("finding_count", totals.countOf(level))
                .cell("vulnerability_count", totals.vulnerabilitiesOf(level))
                .cell("host_count", totals.hostsOf(level))
                .build());
        }
        table.row(ReportRow.builder()
            .cell("level", TOTAL_LABEL)
            .cell("finding_count", totals.getTotalFindings())
            .cell("vulnerability_count", totals.getDistinctVulnerabilities())
            .cell("host_count", totals.getDistinctHosts())
            .build());
        return table.build();
    }

    static List<ReportColumn> hostColumns() {
        List<ReportColumn> columns = new ArrayList<>(List.of(
            new ReportColumn("hostname", "Hostname"),
            new ReportColumn("address", "IP"),
            new ReportColumn("asset_id", "Asset ID"),
            new ReportColumn("vulnerability_count", "Vulnerabilities"),
            new ReportColumn("finding_count", "Findings")));
        for (RiskLevel level : RiskLevel.values()) {
            columns.add(new ReportColumn(levelKey(level), level.getLabel()));
        }
        columns.add(new ReportColumn("highest_risk_level", "Highest risk"));
        columns.add(new ReportColumn("highest_severity", "Highest severity"));
        columns.add(new ReportColumn("open_ports", "Open ports"));
        return List.copyOf(columns);
    }

    static String levelKey(RiskLevel level) {
        return level.name().toLowerCase(Locale.ROOT);
    }

    private static void requireMode(AggregationResult aggregation, GroupingMode expected) {
        if (aggregation == null) {
            throw new IllegalArgumentException("Для выбранных таблиц нужна агрегация " + expected);
        }
        if (aggregation.getMode().isPresent() && aggregation.getMode().get() != expected) {
            throw new IllegalArgumentException(String.format(
                "Ожидалась агрегация %s, получена %s", expected, aggregation.getMode().get()));
        }
    }
}
