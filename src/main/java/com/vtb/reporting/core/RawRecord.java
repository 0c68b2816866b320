package com.vtb.reporting.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Сырая запись &lt;result&gt; экспорта сканера. Все поля необязательны, включая id:
 * отсутствие id обнаруживает нормализатор.
 */
@Value
@Builder
public class RawRecord {

    @Builder.Default Optional<String> id = Optional.empty();
    @Builder.Default Optional<String> name = Optional.empty();
    @Builder.Default Optional<String> owner = Optional.empty();
    @Builder.Default Optional<String> creationTime = Optional.empty();
    @Builder.Default Optional<String> modificationTime = Optional.empty();
    @Builder.Default Optional<String> comment = Optional.empty();

    @Singular
    List<Detail> detectionDetails;

    @Builder.Default Optional<String> hostAddress = Optional.empty();
    @Builder.Default Optional<String> assetId = Optional.empty();
    @Builder.Default Optional<String> hostname = Optional.empty();
    @Builder.Default Optional<String> port = Optional.empty();

    @Builder.Default Optional<RawNvt> nvt = Optional.empty();

    @Builder.Default Optional<String> scanNvtVersion = Optional.empty();
    @Builder.Default Optional<String> threat = Optional.empty();
    @Builder.Default Optional<String> severity = Optional.empty();
    @Builder.Default Optional<String> qodValue = Optional.empty();
    @Builder.Default Optional<String> qodType = Optional.empty();
    @Builder.Default Optional<String> description = Optional.empty();
    @Builder.Default Optional<String> originalThreat = Optional.empty();
    @Builder.Default Optional<String> originalSeverity = Optional.empty();

    /**
     * Пара name/value из &lt;detection&gt;&lt;result&gt;&lt;details&gt;
     */
    @Value
    public static class Detail {
        String name;
        String value;
    }
}
