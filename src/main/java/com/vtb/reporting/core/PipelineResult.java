package com.vtb.reporting.core;

import com.vtb.reporting.analysis.AggregationResult;
import com.vtb.reporting.models.Finding;
import com.vtb.reporting.reports.Report;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Результат запуска: таблицы отчета, агрегаты и диагностика
 */
@Value
@Builder
public class PipelineResult {
    Report report;
    List<Finding> findings;
    AggregationResult byVulnerability;
    AggregationResult byHost;
    RunDiagnostics diagnostics;

    public Optional<AggregationResult> getByVulnerability() {
        return Optional.ofNullable(byVulnerability);
    }

    public Optional<AggregationResult> getByHost() {
        return Optional.ofNullable(byHost);
    }
}
