package com.vtb.reporting.models;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Запись блока &lt;nvt&gt;&lt;severities&gt;: источник, дата, оценка и вектор
 */
@Value
@Builder
public class SeverityEntry {
    String type;
    String origin;
    String date;
    Double score;
    String value;

    public Optional<Double> getScore() {
        return Optional.ofNullable(score);
    }
}
