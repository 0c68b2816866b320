package com.vtb.reporting.analysis;

import com.vtb.reporting.models.RiskLevel;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Итоги по всему отчету. Сумма countsByRiskLevel равна totalFindings.
 */
@Value
@Builder
public class ReportTotals {
    int totalFindings;
    int groupCount;
    Map<RiskLevel, Integer> countsByRiskLevel;
    /** Различные хосты, у которых есть находки данного уровня */
    Map<RiskLevel, Integer> hostsByRiskLevel;
    /** Различные уязвимости, у которых есть находки данного уровня */
    Map<RiskLevel, Integer> vulnerabilitiesByRiskLevel;
    /** Находки по семействам NVT, по алфавиту */
    Map<String, Integer> findingsByFamily;
    int distinctHosts;
    int distinctVulnerabilities;

    public int countOf(RiskLevel level) {
        return countsByRiskLevel.getOrDefault(level, 0);
    }

    public int hostsOf(RiskLevel level) {
        return hostsByRiskLevel.getOrDefault(level, 0);
    }

    public int vulnerabilitiesOf(RiskLevel level) {
        return vulnerabilitiesByRiskLevel.getOrDefault(level, 0);
    }
}
