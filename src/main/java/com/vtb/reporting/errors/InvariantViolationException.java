package com.vtb.reporting.errors;

/**
 * Нарушен внутренний контракт конвейера (например, находка без уязвимости дошла до группировки).
 * Всегда фатально.
 */
public class InvariantViolationException extends ReportingException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
