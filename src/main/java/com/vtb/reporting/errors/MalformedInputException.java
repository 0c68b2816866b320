package com.vtb.reporting.errors;

import lombok.Getter;

/**
 * Документ не удается разобрать как XML дерево. Фатально для всего документа.
 */
@Getter
public class MalformedInputException extends ReportingException {

    private final String source;

    public MalformedInputException(String source, String message, Throwable cause) {
        super(String.format("Некорректный документ %s: %s", source, message), cause);
        this.source = source;
    }
}
