package com.vtb.reporting.models;

import java.util.Locale;
import java.util.Optional;

/**
 * Уровень угрозы в том виде, в каком его сообщает сканер (элемент &lt;threat&gt;)
 */
public enum ThreatLevel {
    NONE("None"),
    LOG("Log"),
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High"),
    CRITICAL("Critical");

    private final String label;

    ThreatLevel(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Разбор метки сканера. Метки вне перечисления (Alarm, Debug, False Positive) не распознаются.
     */
    public static Optional<ThreatLevel> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (ThreatLevel level : values()) {
            if (level.name().equals(normalized)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    /**
     * Метка угрозы, производная от уровня риска
     */
    public static ThreatLevel fromRiskLevel(RiskLevel riskLevel) {
        if (riskLevel == null) {
            return NONE;
        }
        return switch (riskLevel) {
            case CRITICAL -> CRITICAL;
            case HIGH -> HIGH;
            case MEDIUM -> MEDIUM;
            case LOW -> LOW;
            case NONE -> NONE;
        };
    }
}
