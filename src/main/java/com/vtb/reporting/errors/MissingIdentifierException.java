package com.vtb.reporting.errors;

import lombok.Getter;

import java.util.Optional;

/**
 * У записи нет пригодного идентификатора (id находки, oid NVT или адреса хоста).
 * Восстановимо: вызывающий код решает, пропустить запись или прервать запуск.
 */
@Getter
public class MissingIdentifierException extends ReportingException {

    private final String recordId;
    private final String field;

    public MissingIdentifierException(String recordId, String field) {
        super(recordId == null
            ? String.format("Запись без идентификатора: отсутствует поле '%s'", field)
            : String.format("Запись %s: отсутствует поле '%s'", recordId, field));
        this.recordId = recordId;
        this.field = field;
    }

    public Optional<String> getRecordId() {
        return Optional.ofNullable(recordId);
    }
}
