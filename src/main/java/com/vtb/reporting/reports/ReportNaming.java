package com.vtb.reporting.reports;

import java.nio.file.Path;

/**
 * Имена выходных файлов: {@code <prefix>_<table>.<ext>}
 */
public final class ReportNaming {

    private ReportNaming() {
    }

    public static String fileName(String prefix, TableKind kind, String extension) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Префикс имени файла не может быть пустым");
        }
        return sanitize(prefix.trim()) + "_" + kind.getSlug() + "." + extension;
    }

    public static Path resolve(Path directory, String prefix, TableKind kind, String extension) {
        return directory.resolve(fileName(prefix, kind, extension));
    }

    private static String sanitize(String prefix) {
        return prefix.replaceAll("[\\\\/:*?\"<>|\\s]+", "_");
    }
}
