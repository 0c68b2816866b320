package com.vtb.reporting.models;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Уязвимость (NVT), идентифицируется по oid.
 * Экземпляр интернируется в рамках одного запуска и разделяется всеми находками с этим oid.
 */
@Getter
@Builder
@ToString(onlyExplicitlyIncluded = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class Vulnerability implements GroupKey {

    @ToString.Include
    @EqualsAndHashCode.Include
    private final String oid;

    @ToString.Include
    private final String name;

    private final String family;
    private final String type;
    private final Double cvssBase;
    private final String solution;
    private final String solutionType;

    @Singular
    private final List<SeverityEntry> severities;

    @Singular
    private final Map<String, String> tags;

    @Singular
    private final List<Reference> references;

    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    public Optional<String> getFamily() {
        return Optional.ofNullable(family);
    }

    public Optional<String> getType() {
        return Optional.ofNullable(type);
    }

    public Optional<Double> getCvssBase() {
        return Optional.ofNullable(cvssBase);
    }

    public Optional<String> getSolution() {
        return Optional.ofNullable(solution);
    }

    public Optional<String> getSolutionType() {
        return Optional.ofNullable(solutionType);
    }

    public Optional<String> getTag(String key) {
        String value = tags.get(key);
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    public Optional<String> getSummary() {
        return getTag("summary");
    }

    public Optional<String> getInsight() {
        return getTag("insight");
    }

    public Optional<String> getImpact() {
        return getTag("impact");
    }

    public Optional<String> getAffected() {
        return getTag("affected");
    }

    public Optional<String> getDetectionMethod() {
        return getTag("vuldetect");
    }

    public List<String> getCves() {
        return references.stream()
            .filter(Reference::isCve)
            .map(Reference::getId)
            .collect(Collectors.toList());
    }

    /**
     * Ссылки, кроме CVE (URL, CERT-Bund, DFN-CERT)
     */
    public List<String> getOtherReferences() {
        return references.stream()
            .filter(reference -> !reference.isCve())
            .map(Reference::getId)
            .collect(Collectors.toList());
    }

    public String getDisplayName() {
        return name != null ? name : oid;
    }

    @Override
    public String identity() {
        return oid;
    }

    @Override
    public String sortName() {
        return getDisplayName();
    }
}
