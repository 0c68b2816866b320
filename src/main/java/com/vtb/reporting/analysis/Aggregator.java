package com.vtb.reporting.analysis;

import com.vtb.reporting.errors.InvariantViolationException;
import com.vtb.reporting.models.Finding;
import com.vtb.reporting.models.Host;
import com.vtb.reporting.models.Port;
import com.vtb.reporting.models.RiskLevel;
import com.vtb.reporting.models.Vulnerability;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Агрегатор: статистика по группам, итоги отчета и детерминированный порядок групп.
 *
 * <p>Порядок: максимальная severity по убыванию (группы без оценки в конце), число находок по
 * убыванию, имя ключа по возрастанию, затем идентичность ключа. Порядок не зависит от порядка
 * входных данных.
 */
@Slf4j
public class Aggregator {

    static final String UNKNOWN_FAMILY = "Unknown";

    static final Comparator<AggregatedGroup> GROUP_ORDER = Comparator
        .comparingDouble((AggregatedGroup g) -> g.getStatistics().getMaxSeverity().orElse(Double.NEGATIVE_INFINITY))
        .reversed()
        .thenComparing(Comparator.comparingInt((AggregatedGroup g) -> g.getStatistics().getFindingCount()).reversed())
        .thenComparing(g -> g.getGroup().getKey().sortName(), String.CASE_INSENSITIVE_ORDER)
        .thenComparing(g -> g.getGroup().getKey().sortName())
        .thenComparing(g -> g.getGroup().getKey().identity());

    private static final Comparator<Vulnerability> VULNERABILITY_ORDER = Comparator
        .comparing(Vulnerability::getDisplayName, String.CASE_INSENSITIVE_ORDER)
        .thenComparing(Vulnerability::getOid);

    private static final Comparator<Host> HOST_ORDER = Comparator
        .comparing(Host::getDisplayName, String.CASE_INSENSITIVE_ORDER)
        .thenComparing(Host::identity);

    /**
     * @throws InvariantViolationException если группы разных режимов или находка встречается в нескольких группах
     */
    public AggregationResult aggregate(List<Group> groups) {
        if (groups == null) {
            throw new IllegalArgumentException("Список групп не может быть null");
        }

        GroupingMode mode = null;
        Set<Finding> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<AggregatedGroup> aggregated = new ArrayList<>(groups.size());
        for (Group group : groups) {
            if (group == null) {
                throw new InvariantViolationException("Пустая группа в агрегации");
            }
            if (mode == null) {
                mode = group.getMode();
            } else if (mode != group.getMode()) {
                throw new InvariantViolationException(String.format(
                    "Смешаны режимы группировки: %s и %s", mode, group.getMode()));
            }
            for (Finding finding : group.getFindings()) {
                if (!seen.add(finding)) {
                    throw new InvariantViolationException(String.format(
                        "Находка %s входит в несколько групп", finding.getId()));
                }
            }
            aggregated.add(new AggregatedGroup(group, computeStatistics(group)));
        }

        aggregated.sort(GROUP_ORDER);
        ReportTotals totals = computeTotals(aggregated);
        log.info("Агрегация {}: {} групп, {} находок", mode, aggregated.size(), totals.getTotalFindings());
        return new AggregationResult(mode, Collections.unmodifiableList(aggregated), totals);
    }

    GroupStatistics computeStatistics(Group group) {
        Map<RiskLevel, Integer> counts = zeroCounts();
        Double maxSeverity = null;
        RiskLevel highest = RiskLevel.NONE;
        Set<Port> ports = new TreeSet<>();
        Set<Vulnerability> vulnerabilities = new LinkedHashSet<>();
        Set<Host> hosts = new LinkedHashSet<>();

        for (Finding finding : group.getFindings()) {
            counts.merge(finding.getRiskLevel(), 1, Integer::sum);
            highest = RiskLevel.max(highest, finding.getRiskLevel());
            Double severity = finding.getSeverity().orElse(null);
            if (severity != null && (maxSeverity == null || severity > maxSeverity)) {
                maxSeverity = severity;
            }
            if (finding.getPort() != null && finding.getPort() != Port.UNKNOWN) {
                ports.add(finding.getPort());
            }
            if (finding.getVulnerability() != null) {
                vulnerabilities.add(finding.getVulnerability());
            }
            if (finding.getHost() != null) {
                hosts.add(finding.getHost());
            }
        }

        List<Vulnerability> distinctVulnerabilities = List.of();
        List<Host> distinctHosts = List.of();
        if (group.getMode() == GroupingMode.BY_HOST) {
            List<Vulnerability> sorted = new ArrayList<>(vulnerabilities);
            sorted.sort(VULNERABILITY_ORDER);
            distinctVulnerabilities = List.copyOf(sorted);
        } else {
            List<Host> sorted = new ArrayList<>(hosts);
            sorted.sort(HOST_ORDER);
            distinctHosts = List.copyOf(sorted);
        }

        return GroupStatistics.builder()
            .findingCount(group.size())
            .maxSeverity(maxSeverity)
            .highestRiskLevel(highest)
            .countsByRiskLevel(Collections.unmodifiableMap(counts))
            .distinctPorts(List.copyOf(ports))
            .distinctVulnerabilities(distinctVulnerabilities)
            .distinctHosts(distinctHosts)
            .build();
    }

    private ReportTotals computeTotals(List<AggregatedGroup> groups) {
        Map<RiskLevel, Integer> counts = zeroCounts();
        Map<RiskLevel, Set<Host>> hostsByLevel = new EnumMap<>(RiskLevel.class);
        Map<RiskLevel, Set<Vulnerability>> vulnerabilitiesByLevel = new EnumMap<>(RiskLevel.class);
        Map<String, Integer> families = new TreeMap<>();
        Set<Host> allHosts = new LinkedHashSet<>();
        Set<Vulnerability> allVulnerabilities = new LinkedHashSet<>();
        int total = 0;

        for (AggregatedGroup aggregated : groups) {
            for (RiskLevel level : RiskLevel.values()) {
                counts.merge(level, aggregated.getStatistics().countOf(level), Integer::sum);
            }
            total += aggregated.getStatistics().getFindingCount();
            for (Finding finding : aggregated.getGroup().getFindings()) {
                RiskLevel level = finding.getRiskLevel();
                if (finding.getHost() != null) {
                    hostsByLevel.computeIfAbsent(level, l -> new LinkedHashSet<>()).add(finding.getHost());
                    allHosts.add(finding.getHost());
                }
                Vulnerability vulnerability = finding.getVulnerability();
                if (vulnerability != null) {
                    vulnerabilitiesByLevel.computeIfAbsent(level, l -> new LinkedHashSet<>()).add(vulnerability);
                    allVulnerabilities.add(vulnerability);
                    families.merge(vulnerability.getFamily().orElse(UNKNOWN_FAMILY), 1, Integer::sum);
                }
            }
        }

        Map<RiskLevel, Integer> hostCounts = zeroCounts();
        Map<RiskLevel, Integer> vulnerabilityCounts = zeroCounts();
        hostsByLevel.forEach((level, hosts) -> hostCounts.put(level, hosts.size()));
        vulnerabilitiesByLevel.forEach((level, vulns) -> vulnerabilityCounts.put(level, vulns.size()));

        int levelSum = counts.values().stream().mapToInt(Integer::intValue).sum();
        if (levelSum != total) {
            throw new InvariantViolationException(String.format(
                "Сумма по уровням риска (%d) не совпадает с числом находок (%d)", levelSum, total));
        }

        return ReportTotals.builder()
            .totalFindings(total)
            .groupCount(groups.size())
            .countsByRiskLevel(Collections.unmodifiableMap(counts))
            .hostsByRiskLevel(Collections.unmodifiableMap(hostCounts))
            .vulnerabilitiesByRiskLevel(Collections.unmodifiableMap(vulnerabilityCounts))
            .findingsByFamily(Collections.unmodifiableMap(families))
            .distinctHosts(allHosts.size())
            .distinctVulnerabilities(allVulnerabilities.size())
            .build();
    }

    private static Map<RiskLevel, Integer> zeroCounts() {
        Map<RiskLevel, Integer> counts = new EnumMap<>(RiskLevel.class);
        for (RiskLevel level : RiskLevel.values()) {
            counts.put(level, 0);
        }
        return counts;
    }
}
