package com.vtb.reporting.analysis;

import com.vtb.reporting.models.Host;
import com.vtb.reporting.models.Port;
import com.vtb.reporting.models.RiskLevel;
import com.vtb.reporting.models.Vulnerability;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Статистика одной группы
 */
@Value
@Builder
public class GroupStatistics {
    int findingCount;
    Double maxSeverity;
    RiskLevel highestRiskLevel;
    /** Все уровни присутствуют, отсутствующие заполнены нулем */
    Map<RiskLevel, Integer> countsByRiskLevel;
    List<Port> distinctPorts;
    /** Только для BY_HOST */
    List<Vulnerability> distinctVulnerabilities;
    /** Только для BY_VULNERABILITY */
    List<Host> distinctHosts;

    public Optional<Double> getMaxSeverity() {
        return Optional.ofNullable(maxSeverity);
    }

    public int countOf(RiskLevel level) {
        return countsByRiskLevel.getOrDefault(level, 0);
    }
}
