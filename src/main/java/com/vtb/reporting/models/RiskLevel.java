package com.vtb.reporting.models;

/**
 * Уровни риска, вычисляемые из числовой оценки severity
 */
public enum RiskLevel {
    CRITICAL("Critical", "Критический", 5),
    HIGH("High", "Высокий", 4),
    MEDIUM("Medium", "Средний", 3),
    LOW("Low", "Низкий", 2),
    NONE("None", "Нет", 1);

    private final String label;
    private final String russianName;
    private final int priority;

    RiskLevel(String label, String russianName, int priority) {
        this.label = label;
        this.russianName = russianName;
        this.priority = priority;
    }

    public String getLabel() {
        return label;
    }

    public String getRussianName() {
        return russianName;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Более высокий из двух уровней (null считается отсутствием уровня)
     */
    public static RiskLevel max(RiskLevel a, RiskLevel b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.priority >= b.priority ? a : b;
    }

    /**
     * Разбор уровня по имени без учета регистра
     *
     * @throws IllegalArgumentException если имя не является уровнем риска
     */
    public static RiskLevel fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Уровень риска не может быть пустым");
        }
        String normalized = name.trim();
        for (RiskLevel level : values()) {
            if (level.name().equalsIgnoreCase(normalized) || level.label.equalsIgnoreCase(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Неизвестный уровень риска: " + name);
    }
}
