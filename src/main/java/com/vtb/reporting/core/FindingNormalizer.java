package com.vtb.reporting.core;

import com.vtb.reporting.errors.MissingIdentifierException;
import com.vtb.reporting.models.Finding;
import com.vtb.reporting.models.Host;
import com.vtb.reporting.models.HostKey;
import com.vtb.reporting.models.Port;
import com.vtb.reporting.models.QualityOfDetection;
import com.vtb.reporting.models.RiskThresholds;
import com.vtb.reporting.models.SeverityEntry;
import com.vtb.reporting.models.ThreatLevel;
import com.vtb.reporting.models.Vulnerability;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * Нормализатор сырых записей в {@link Finding}.
 *
 * <p>Экземпляр принадлежит одному запуску: он владеет таблицами интернирования уязвимостей (по oid)
 * и хостов (по {@link HostKey}). Для уже встреченного ключа используются значения первой записи,
 * расходящиеся значения последующих записей игнорируются.
 *
 * <p>Приоритет severity: явный &lt;severity&gt;, затем наибольшая оценка из &lt;nvt&gt;&lt;severities&gt;,
 * затем cvss_base, иначе оценка отсутствует. Отрицательная явная severity (OpenVAS пишет -1 для
 * false positive и -99 для debug) означает отсутствие оценки и останавливает выбор источника.
 * Нечисловая явная severity или значение больше 10 пропускаются, и используется следующий источник.
 */
@Slf4j
public class FindingNormalizer {

    @Getter
    private final RiskThresholds thresholds;

    private final InternTable<String, Vulnerability> vulnerabilities = new InternTable<>();
    private final InternTable<HostKey, Host> hosts = new InternTable<>();

    public FindingNormalizer() {
        this(RiskThresholds.defaults());
    }

    public FindingNormalizer(RiskThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    /**
     * Нормализовать запись
     *
     * @throws MissingIdentifierException если нет id находки, oid уязвимости или адреса хоста
     */
    public Finding normalize(RawRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("RawRecord не может быть null");
        }

        // Вся проверка идентичности выполняется до обращения к таблицам интернирования
        String id = record.getId()
            .orElseThrow(() -> new MissingIdentifierException(null, "result@id"));
        RawNvt nvt = record.getNvt()
            .orElseThrow(() -> new MissingIdentifierException(id, "nvt"));
        String oid = nvt.getOid()
            .orElseThrow(() -> new MissingIdentifierException(id, "nvt@oid"));
        String address = record.getHostAddress()
            .or(record::getHostname)
            .orElseThrow(() -> new MissingIdentifierException(id, "host"));
        HostKey hostKey = new HostKey(record.getAssetId().orElse(null), address);

        Vulnerability vulnerability = internVulnerability(oid, nvt);
        Host host = internHost(hostKey, record);

        Port port = Port.parse(record.getPort().orElse(null));

        Double severity = resolveSeverity(id, record, nvt).orElse(null);
        ThreatLevel threat = record.getThreat()
            .flatMap(raw -> {
                Optional<ThreatLevel> parsed = ThreatLevel.parse(raw);
                if (parsed.isEmpty()) {
                    log.debug("Запись {}: неизвестная метка угрозы '{}', уровень вычисляется из severity", id, raw);
                }
                return parsed;
            })
            .orElse(null);

        Finding.FindingBuilder builder = Finding.builder()
            .id(id)
            .name(record.getName().orElse(null))
            .owner(record.getOwner().orElse(null))
            .vulnerability(vulnerability)
            .host(host)
            .port(port)
            .threat(threat)
            .severity(severity)
            .thresholds(thresholds)
            .creationTime(parseTimestamp(id, "creation_time", record.getCreationTime()).orElse(null))
            .modificationTime(parseTimestamp(id, "modification_time", record.getModificationTime()).orElse(null))
            .description(record.getDescription().orElse(null))
            .comment(record.getComment().orElse(null))
            .scanNvtVersion(record.getScanNvtVersion().orElse(null))
            .originalThreat(record.getOriginalThreat().orElse(null))
            .originalSeverity(record.getOriginalSeverity().orElse(null));

        if (record.getQodValue().isPresent() || record.getQodType().isPresent()) {
            builder.qualityOfDetection(new QualityOfDetection(
                parseInteger(id, record.getQodValue()).orElse(null),
                record.getQodType().orElse(null)));
        }
        for (RawRecord.Detail detail : record.getDetectionDetails()) {
            builder.detectionDetail(detail.getName(), detail.getValue());
        }
        return builder.build();
    }

    public Collection<Vulnerability> getVulnerabilities() {
        return vulnerabilities.values();
    }

    public Collection<Host> getHosts() {
        return hosts.values();
    }

    private Vulnerability internVulnerability(String oid, RawNvt nvt) {
        Optional<Vulnerability> known = vulnerabilities.find(oid);
        if (known.isPresent()) {
            Vulnerability existing = known.get();
            if (!existing.getName().equals(nvt.getName())) {
                log.debug("Уязвимость {}: название '{}' отличается от первого ('{}'), оставлено первое",
                    oid, nvt.getName().orElse(""), existing.getName().orElse(""));
            }
            return existing;
        }
        return vulnerabilities.intern(oid, key -> buildVulnerability(key, nvt));
    }

    private Vulnerability buildVulnerability(String oid, RawNvt nvt) {
        Vulnerability.VulnerabilityBuilder builder = Vulnerability.builder()
            .oid(oid)
            .name(nvt.getName().orElse(null))
            .family(nvt.getFamily().orElse(null))
            .type(nvt.getType().orElse(null))
            .cvssBase(parseScore(oid, "cvss_base", nvt.getCvssBase()).orElse(null))
            .solution(nvt.getSolution().orElse(null))
            .solutionType(nvt.getSolutionType().orElse(null))
            .tags(nvt.getTags())
            .references(nvt.getReferences());
        for (RawNvt.RawSeverity raw : nvt.getSeverities()) {
            builder.severity(SeverityEntry.builder()
                .type(raw.getType().orElse(null))
                .origin(raw.getOrigin().orElse(null))
                .date(raw.getDate().orElse(null))
                .score(parseScore(oid, "severities/score", raw.getScore()).orElse(null))
                .value(raw.getValue().orElse(null))
                .build());
        }
        return builder.build();
    }

    private Host internHost(HostKey key, RawRecord record) {
        Optional<Host> known = hosts.find(key);
        if (known.isPresent()) {
            Host existing = known.get();
            if (record.getHostname().isPresent() && !existing.getHostname().equals(record.getHostname())) {
                log.debug("Хост {}: имя '{}' отличается от первого ('{}'), оставлено первое",
                    key.asString(), record.getHostname().get(), existing.getHostname().orElse(""));
            }
            return existing;
        }
        return hosts.intern(key, k -> new Host(k, record.getHostname().orElse(null)));
    }

    private Optional<Double> resolveSeverity(String id, RawRecord record, RawNvt nvt) {
        if (isNegativeScore(record.getSeverity())) {
            // false positive (-1) и debug (-99): оценки нет, запасные источники не используются
            log.debug("Запись {}: отрицательная severity='{}', оценка отсутствует", id, record.getSeverity().get());
            return Optional.empty();
        }
        Optional<Double> explicit = parseScore(id, "severity", record.getSeverity());
        if (explicit.isPresent()) {
            return explicit;
        }
        Optional<Double> fromEntries = nvt.getSeverities().stream()
            .map(raw -> parseScore(id, "severities/score", raw.getScore()))
            .flatMap(Optional::stream)
            .max(Double::compare);
        if (fromEntries.isEmpty()) {
            fromEntries = parseScore(id, "severities@score", nvt.getSeveritiesScore());
        }
        if (fromEntries.isPresent()) {
            return fromEntries;
        }
        return parseScore(id, "cvss_base", nvt.getCvssBase());
    }

    private static boolean isNegativeScore(Optional<String> raw) {
        if (raw.isEmpty()) {
            return false;
        }
        try {
            return Double.parseDouble(raw.get()) < RiskThresholds.MIN_SCORE;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private Optional<Double> parseScore(String context, String field, Optional<String> raw) {
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            double value = Double.parseDouble(raw.get());
            if (Double.isNaN(value) || value < RiskThresholds.MIN_SCORE || value > RiskThresholds.MAX_SCORE) {
                log.debug("{}: значение {}='{}' вне диапазона [0, 10], пропущено", context, field, raw.get());
                return Optional.empty();
            }
            return Optional.of(value);
        } catch (NumberFormatException e) {
            log.debug("{}: нечисловое значение {}='{}', пропущено", context, field, raw.get());
            return Optional.empty();
        }
    }

    private Optional<Integer> parseInteger(String context, Optional<String> raw) {
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(raw.get()));
        } catch (NumberFormatException e) {
            log.debug("{}: нечисловое значение QoD '{}', пропущено", context, raw.get());
            return Optional.empty();
        }
    }

    private Optional<OffsetDateTime> parseTimestamp(String context, String field, Optional<String> raw) {
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(raw.get()));
        } catch (DateTimeParseException e) {
            log.debug("{}: не удалось разобрать {}='{}'", context, field, raw.get());
            return Optional.empty();
        }
    }
}
