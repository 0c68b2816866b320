package com.vtb.reporting.analysis;

import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Упорядоченные группы со статистикой и итоги отчета.
 * Режим отсутствует только у пустого результата.
 */
@Value
public class AggregationResult {
    GroupingMode mode;
    List<AggregatedGroup> groups;
    ReportTotals totals;

    public Optional<GroupingMode> getMode() {
        return Optional.ofNullable(mode);
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }
}
