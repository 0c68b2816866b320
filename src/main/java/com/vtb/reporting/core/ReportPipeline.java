package com.vtb.reporting.core;

import com.vtb.reporting.analysis.AggregationResult;
import com.vtb.reporting.analysis.Aggregator;
import com.vtb.reporting.analysis.GroupingEngine;
import com.vtb.reporting.analysis.GroupingMode;
import com.vtb.reporting.config.ReportingConfig;
import com.vtb.reporting.errors.MissingIdentifierException;
import com.vtb.reporting.models.Finding;
import com.vtb.reporting.models.RiskThresholds;
import com.vtb.reporting.reports.Report;
import com.vtb.reporting.reports.ReportModelBuilder;
import com.vtb.reporting.reports.TableSelection;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * Конвейер построения отчета: Parser → Normalizer → Filter → Grouping → Aggregator → Report Builder.
 *
 * <p>Каждый запуск создает свой {@link FindingNormalizer} с пустыми таблицами интернирования,
 * поэтому независимые запуски можно выполнять параллельно. Отчет строится только после того,
 * как все этапы успешно завершены для всех оставшихся записей.
 */
@Slf4j
@Getter
public class ReportPipeline {

    private final ScanExportParser parser;
    private final RiskThresholds thresholds;
    private final FindingFilter filter;
    private final TableSelection selection;
    private final RecordErrorPolicy errorPolicy;

    private final GroupingEngine groupingEngine = new GroupingEngine();
    private final Aggregator aggregator = new Aggregator();
    private final ReportModelBuilder reportBuilder = new ReportModelBuilder();

    @Builder
    public ReportPipeline(ScanExportParser parser,
                          RiskThresholds thresholds,
                          FindingFilter filter,
                          TableSelection selection,
                          RecordErrorPolicy errorPolicy) {
        this.parser = parser != null ? parser : new ScanExportParser();
        this.thresholds = thresholds != null ? thresholds : RiskThresholds.defaults();
        this.filter = filter != null ? filter : FindingFilter.acceptAll();
        this.selection = selection != null ? selection : TableSelection.all();
        this.errorPolicy = errorPolicy != null ? errorPolicy : RecordErrorPolicy.SKIP;
    }

    public static ReportPipeline fromConfig(ReportingConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("ReportingConfig не может быть null");
        }
        config.ensureDefaults();
        return ReportPipeline.builder()
            .thresholds(config.toRiskThresholds())
            .filter(config.toFindingFilter())
            .selection(config.toTableSelection())
            .errorPolicy(config.getErrorPolicy())
            .build();
    }

    /**
     * Обработать один или несколько файлов экспорта в рамках одного запуска
     */
    public PipelineResult run(List<Path> documents) {
        if (documents == null || documents.isEmpty()) {
            throw new IllegalArgumentException("Нужен хотя бы один файл отчета");
        }
        List<Supplier<RawRecordSequence>> sources = new ArrayList<>();
        for (Path document : documents) {
            sources.add(() -> parser.parse(document));
        }
        return process(sources);
    }

    /**
     * Обработать один документ из потока
     */
    public PipelineResult run(InputStream document, String source) {
        return process(List.of(() -> parser.parse(document, source)));
    }

    private PipelineResult process(List<Supplier<RawRecordSequence>> sources) {
        FindingNormalizer normalizer = new FindingNormalizer(thresholds);
        RunDiagnostics.RunDiagnosticsBuilder diagnostics = RunDiagnostics.builder().documents(sources.size());
        List<Finding> findings = new ArrayList<>();
        int parsed = 0;
        int normalized = 0;
        int filtered = 0;

        for (Supplier<RawRecordSequence> source : sources) {
            RawRecordSequence records = source.get();
            for (RawRecord record : records) {
                parsed++;
                Finding finding;
                try {
                    finding = normalizer.normalize(record);
                } catch (MissingIdentifierException e) {
                    if (errorPolicy == RecordErrorPolicy.ABORT) {
                        log.error("Запуск прерван на записи из {}: {}", records.getSource(), e.getMessage());
                        throw e;
                    }
                    log.warn("Запись пропущена ({}): {}", records.getSource(), e.getMessage());
                    diagnostics.skippedRecord(new SkippedRecord(
                        records.getSource(), e.getRecordId().orElse(null), e.getField(), e.getMessage()));
                    continue;
                }
                normalized++;
                if (filter.accepts(finding)) {
                    finding.getHost().recordPort(finding.getPort());
                    findings.add(finding);
                } else {
                    filtered++;
                }
            }
        }

        log.info("Нормализовано находок: {} из {} записей, отфильтровано: {}", normalized, parsed, filtered);
        if (findings.isEmpty()) {
            log.warn("После фильтрации не осталось ни одной находки. Проверьте исключения и область сканирования");
        }

        AggregationResult byVulnerability = null;
        AggregationResult byHost = null;
        if (selection.needsVulnerabilityGrouping()) {
            byVulnerability = aggregator.aggregate(groupingEngine.group(findings, GroupingMode.BY_VULNERABILITY));
        }
        if (selection.needsHostGrouping()) {
            byHost = aggregator.aggregate(groupingEngine.group(findings, GroupingMode.BY_HOST));
        }
        Report report = reportBuilder.build(byVulnerability, byHost, selection);

        return PipelineResult.builder()
            .report(report)
            .findings(Collections.unmodifiableList(findings))
            .byVulnerability(byVulnerability)
            .byHost(byHost)
            .diagnostics(diagnostics
                .parsedRecords(parsed)
                .normalizedFindings(normalized)
                .filteredFindings(filtered)
                .distinctVulnerabilities(normalizer.getVulnerabilities().size())
                .distinctHosts(normalizer.getHosts().size())
                .build())
            .build();
    }
}
