package com.vtb.reporting.models;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для RiskThresholds
 */
class RiskThresholdsTest {

    private final RiskThresholds thresholds = RiskThresholds.defaults();

    @Test
    void testBoundaries() {
        assertEquals(RiskLevel.NONE, thresholds.classify(0.0), "0.0 - это NONE");
        assertEquals(RiskLevel.LOW, thresholds.classify(0.1));
        assertEquals(RiskLevel.LOW, thresholds.classify(3.9));
        assertEquals(RiskLevel.MEDIUM, thresholds.classify(4.0), "Нижняя граница включается");
        assertEquals(RiskLevel.MEDIUM, thresholds.classify(6.999), "Верхняя граница исключается");
        assertEquals(RiskLevel.HIGH, thresholds.classify(7.0));
        assertEquals(RiskLevel.HIGH, thresholds.classify(8.9));
        assertEquals(RiskLevel.CRITICAL, thresholds.classify(9.0));
        assertEquals(RiskLevel.CRITICAL, thresholds.classify(10.0), "10.0 входит в CRITICAL");
    }

    @Test
    void testAbsentScoreIsNone() {
        assertEquals(RiskLevel.NONE, thresholds.classify((Double) null));
        assertEquals(RiskLevel.NONE, thresholds.classify(Optional.empty()));
    }

    @Test
    void testCustomThresholds() {
        RiskThresholds strict = new RiskThresholds(0.0, 3.0, 6.0, 8.0);

        assertEquals(RiskLevel.MEDIUM, strict.classify(3.0));
        assertEquals(RiskLevel.CRITICAL, strict.classify(8.0));
    }

    @Test
    void testInvalidThresholds() {
        assertThrows(IllegalArgumentException.class, () -> new RiskThresholds(0.0, 7.0, 4.0, 9.0),
            "Пороги должны строго возрастать");
        assertThrows(IllegalArgumentException.class, () -> new RiskThresholds(-1.0, 4.0, 7.0, 9.0),
            "Пороги не могут быть меньше 0");
        assertThrows(IllegalArgumentException.class, () -> new RiskThresholds(0.0, 4.0, 7.0, 11.0),
            "Пороги не могут быть больше 10");
    }
}
