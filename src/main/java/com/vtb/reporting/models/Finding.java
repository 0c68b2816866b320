package com.vtb.reporting.models;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;

/**
 * Находка: одно сообщение об уязвимости на хосте.
 * Уровень риска вычисляется один раз при построении и кэшируется.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
public final class Finding {

    @ToString.Include
    private final String id;
    private final String name;
    private final String owner;

    @ToString.Include
    private final Vulnerability vulnerability;

    @ToString.Include
    private final Host host;

    private final Port port;
    private final ThreatLevel threat;
    private final Double severity;

    @ToString.Include
    private final RiskLevel riskLevel;

    private final QualityOfDetection qualityOfDetection;
    private final Map<String, String> detectionDetails;
    private final OffsetDateTime creationTime;
    private final OffsetDateTime modificationTime;
    private final String description;
    private final String comment;
    private final String scanNvtVersion;
    private final String originalThreat;
    private final String originalSeverity;

    @Builder
    private Finding(String id,
                    String name,
                    String owner,
                    Vulnerability vulnerability,
                    Host host,
                    Port port,
                    ThreatLevel threat,
                    Double severity,
                    RiskThresholds thresholds,
                    QualityOfDetection qualityOfDetection,
                    @Singular Map<String, String> detectionDetails,
                    OffsetDateTime creationTime,
                    OffsetDateTime modificationTime,
                    String description,
                    String comment,
                    String scanNvtVersion,
                    String originalThreat,
                    String originalSeverity) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Идентификатор находки не может быть пустым");
        }
        if (severity != null && (severity.isNaN()
                || severity < RiskThresholds.MIN_SCORE || severity > RiskThresholds.MAX_SCORE)) {
            throw new IllegalArgumentException("Severity вне диапазона [0.0, 10.0]: " + severity);
        }
        RiskThresholds effective = thresholds != null ? thresholds : RiskThresholds.defaults();
        this.id = id;
        this.name = name;
        this.owner = owner;
        this.vulnerability = vulnerability;
        this.host = host;
        this.port = port != null ? port : Port.UNKNOWN;
        this.severity = severity;
        this.riskLevel = effective.classify(severity);
        this.threat = threat != null ? threat : ThreatLevel.fromRiskLevel(riskLevel);
        this.qualityOfDetection = qualityOfDetection;
        this.detectionDetails = detectionDetails;
        this.creationTime = creationTime;
        this.modificationTime = modificationTime;
        this.description = description;
        this.comment = comment;
        this.scanNvtVersion = scanNvtVersion;
        this.originalThreat = originalThreat;
        this.originalSeverity = originalSeverity;
    }

    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    public Optional<String> getOwner() {
        return Optional.ofNullable(owner);
    }

    public Optional<Double> getSeverity() {
        return Optional.ofNullable(severity);
    }

    public Optional<QualityOfDetection> getQualityOfDetection() {
        return Optional.ofNullable(qualityOfDetection);
    }

    public Optional<OffsetDateTime> getCreationTime() {
        return Optional.ofNullable(creationTime);
    }

    public Optional<OffsetDateTime> getModificationTime() {
        return Optional.ofNullable(modificationTime);
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    public Optional<String> getComment() {
        return Optional.ofNullable(comment);
    }

    public Optional<String> getScanNvtVersion() {
        return Optional.ofNullable(scanNvtVersion);
    }

    public Optional<String> getOriginalThreat() {
        return Optional.ofNullable(originalThreat);
    }

    public Optional<String> getOriginalSeverity() {
        return Optional.ofNullable(originalSeverity);
    }
}
