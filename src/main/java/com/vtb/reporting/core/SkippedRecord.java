package com.vtb.reporting.core;

import lombok.Value;

/**
 * Запись, пропущенная по политике SKIP
 */
@Value
public class SkippedRecord {
    String source;
    /** null, если у записи нет id */
    String recordId;
    String field;
    String reason;
}
