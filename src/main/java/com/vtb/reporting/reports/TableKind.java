package com.vtb.reporting.reports;

/**
 * Вид логической таблицы отчета
 */
public enum TableKind {
    BY_VULNERABILITY("vulnerability", "Vulnerabilities"),
    BY_HOST("host", "Hosts"),
    SUMMARY("summary", "Summary");

    private final String slug;
    private final String title;

    TableKind(String slug, String title) {
        this.slug = slug;
        this.title = title;
    }

    /**
     * Короткое имя для файлов и параметров командной строки
     */
    public String getSlug() {
        return slug;
    }

    public String getTitle() {
        return title;
    }

    public static TableKind fromSlug(String value) {
        if (value != null) {
            for (TableKind kind : values()) {
                if (kind.slug.equalsIgnoreCase(value.trim()) || kind.name().equalsIgnoreCase(value.trim())) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Неизвестная таблица отчета: " + value);
    }
}
