package com.vtb.reporting.models;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * Пороги перевода оценки severity в уровень риска.
 *
 * <p>Интервалы включают нижнюю границу и исключают верхнюю, кроме CRITICAL:
 * {@code <= low -> NONE}, {@code (low, medium) -> LOW}, {@code [medium, high) -> MEDIUM},
 * {@code [high, critical) -> HIGH}, {@code [critical, 10.0] -> CRITICAL}.
 * Оценка ровно 0.0 дает NONE.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RiskThresholds {

    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 10.0;

    private static final RiskThresholds DEFAULTS = new RiskThresholds(0.0, 4.0, 7.0, 9.0);

    private final double low;
    private final double medium;
    private final double high;
    private final double critical;

    public RiskThresholds(double low, double medium, double high, double critical) {
        if (low < MIN_SCORE || critical > MAX_SCORE) {
            throw new IllegalArgumentException(String.format(
                "Пороги риска должны лежать в диапазоне [%.1f, %.1f]: %s/%s/%s/%s",
                MIN_SCORE, MAX_SCORE, low, medium, high, critical));
        }
        if (!(low < medium && medium < high && high < critical)) {
            throw new IllegalArgumentException(String.format(
                "Пороги риска должны строго возрастать: %s/%s/%s/%s", low, medium, high, critical));
        }
        this.low = low;
        this.medium = medium;
        this.high = high;
        this.critical = critical;
    }

    public static RiskThresholds defaults() {
        return DEFAULTS;
    }

    public RiskLevel classify(Double score) {
        if (score == null || score.isNaN() || score <= low) {
            return RiskLevel.NONE;
        }
        if (score < medium) {
            return RiskLevel.LOW;
        }
        if (score < high) {
            return RiskLevel.MEDIUM;
        }
        if (score < critical) {
            return RiskLevel.HIGH;
        }
        return RiskLevel.CRITICAL;
    }

    public RiskLevel classify(Optional<Double> score) {
        return classify(score.orElse(null));
    }
}
