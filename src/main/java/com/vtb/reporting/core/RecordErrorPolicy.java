package com.vtb.reporting.core;

/**
 * Что делать с записью, которую не удалось нормализовать
 */
public enum RecordErrorPolicy {
    /** Пропустить запись с предупреждением и продолжить запуск */
    SKIP,
    /** Прервать весь запуск */
    ABORT
}
