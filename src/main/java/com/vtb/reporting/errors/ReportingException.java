package com.vtb.reporting.errors;

/**
 * Базовое исключение конвейера обработки отчетов
 */
public class ReportingException extends RuntimeException {

    public ReportingException(String message) {
        super(message);
    }

    public ReportingException(String message, Throwable cause) {
        super(message, cause);
    }
}
