package com.vtb.reporting.reports;

import lombok.Builder;
import lombok.Value;

/**
 * Какие таблицы строить
 */
@Value
@Builder
public class TableSelection {
    @Builder.Default
    boolean includeByVulnerability = true;
    @Builder.Default
    boolean includeByHost = true;
    @Builder.Default
    boolean includeSummary = true;

    public static TableSelection all() {
        return TableSelection.builder().build();
    }

    public boolean includes(TableKind kind) {
        return switch (kind) {
            case BY_VULNERABILITY -> includeByVulnerability;
            case BY_HOST -> includeByHost;
            case SUMMARY -> includeSummary;
        };
    }

    public boolean needsVulnerabilityGrouping() {
        return includeByVulnerability || includeSummary;
    }

    public boolean needsHostGrouping() {
        return includeByHost;
    }
}
