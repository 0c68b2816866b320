package com.vtb.reporting.core;

import com.vtb.reporting.models.Finding;
import com.vtb.reporting.models.Host;
import com.vtb.reporting.models.RiskLevel;
import lombok.Builder;
import lombok.Getter;

import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Фильтр находок по уровню риска, области хостов и исключениям по названию уязвимости.
 * Пустой список включаемых хостов означает "все хосты"; исключение важнее включения.
 */
@Getter
public class FindingFilter {

    private final Set<RiskLevel> includedLevels;
    private final Set<String> includedHosts;
    private final Set<String> excludedHosts;
    private final List<Pattern> excludedNamePatterns;

    @Builder
    private FindingFilter(Collection<RiskLevel> includedLevels,
                          Collection<String> includedHosts,
                          Collection<String> excludedHosts,
                          Collection<String> excludedNamePatterns) {
        this.includedLevels = includedLevels == null || includedLevels.isEmpty()
            ? EnumSet.allOf(RiskLevel.class)
            : EnumSet.copyOf(includedLevels);
        this.includedHosts = normalize(includedHosts);
        this.excludedHosts = normalize(excludedHosts);
        this.excludedNamePatterns = excludedNamePatterns == null ? List.of() : excludedNamePatterns.stream()
            .filter(p -> p != null && !p.isBlank())
            .map(FindingFilter::compile)
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Фильтр, пропускающий все находки
     */
    public static FindingFilter acceptAll() {
        return FindingFilter.builder().build();
    }

    public boolean accepts(Finding finding) {
        if (!includedLevels.contains(finding.getRiskLevel())) {
            return false;
        }
        Host host = finding.getHost();
        if (host != null) {
            if (matchesHost(excludedHosts, host)) {
                return false;
            }
            if (!includedHosts.isEmpty() && !matchesHost(includedHosts, host)) {
                return false;
            }
        }
        if (finding.getVulnerability() != null && !excludedNamePatterns.isEmpty()) {
            String name = finding.getVulnerability().getDisplayName();
            for (Pattern pattern : excludedNamePatterns) {
                if (pattern.matcher(name).find()) {
                    return false;
                }
            }
        }
        return true;
    }

    private static boolean matchesHost(Set<String> hosts, Host host) {
        if (hosts.isEmpty()) {
            return false;
        }
        return hosts.contains(host.getAddress().toLowerCase(Locale.ROOT))
            || host.getHostname().map(name -> hosts.contains(name.toLowerCase(Locale.ROOT))).orElse(false);
    }

    private static Set<String> normalize(Collection<String> values) {
        if (values == null) {
            return Set.of();
        }
        return values.stream()
            .filter(v -> v != null && !v.isBlank())
            .map(v -> v.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static Pattern compile(String regex) {
        try {
            return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Некорректное регулярное выражение исключения: " + regex, e);
        }
    }
}
