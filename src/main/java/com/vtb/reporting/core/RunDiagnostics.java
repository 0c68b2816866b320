package com.vtb.reporting.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Счетчики одного запуска конвейера
 */
@Value
@Builder
public class RunDiagnostics {
    int documents;
    int parsedRecords;
    int normalizedFindings;
    int filteredFindings;
    int distinctVulnerabilities;
    int distinctHosts;
    @Singular
    List<SkippedRecord> skippedRecords;

    public int getSkippedCount() {
        return skippedRecords.size();
    }
}
