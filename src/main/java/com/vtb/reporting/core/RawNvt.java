package com.vtb.reporting.core;

import com.vtb.reporting.models.Reference;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Сырой блок &lt;nvt&gt; записи
 */
@Value
@Builder
public class RawNvt {

    @Builder.Default Optional<String> oid = Optional.empty();
    @Builder.Default Optional<String> type = Optional.empty();
    @Builder.Default Optional<String> name = Optional.empty();
    @Builder.Default Optional<String> family = Optional.empty();
    @Builder.Default Optional<String> cvssBase = Optional.empty();

    /** Атрибут score элемента &lt;severities&gt; */
    @Builder.Default Optional<String> severitiesScore = Optional.empty();

    @Singular
    List<RawSeverity> severities;

    @Singular
    Map<String, String> tags;

    @Builder.Default Optional<String> solutionType = Optional.empty();
    @Builder.Default Optional<String> solution = Optional.empty();

    @Singular
    List<Reference> references;

    /**
     * Запись &lt;severity&gt; внутри &lt;severities&gt; в исходном текстовом виде
     */
    @Value
    @Builder
    public static class RawSeverity {
        @Builder.Default Optional<String> type = Optional.empty();
        @Builder.Default Optional<String> origin = Optional.empty();
        @Builder.Default Optional<String> date = Optional.empty();
        @Builder.Default Optional<String> score = Optional.empty();
        @Builder.Default Optional<String> value = Optional.empty();
    }
}
