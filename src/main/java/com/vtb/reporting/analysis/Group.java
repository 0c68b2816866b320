package com.vtb.reporting.analysis;

import com.vtb.reporting.models.Finding;
import com.vtb.reporting.models.GroupKey;
import com.vtb.reporting.models.Host;
import com.vtb.reporting.models.Vulnerability;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Группа находок с общим ключом. Неизменяема после построения; находки в порядке появления.
 */
@Getter
@ToString(of = {"mode", "key"})
public final class Group {

    private final GroupingMode mode;
    private final GroupKey key;
    private final List<Finding> findings;

    public Group(GroupingMode mode, GroupKey key, List<Finding> findings) {
        if (mode == null || key == null) {
            throw new IllegalArgumentException("Режим и ключ группы обязательны");
        }
        this.mode = mode;
        this.key = key;
        this.findings = List.copyOf(findings);
    }

    public int size() {
        return findings.size();
    }

    /**
     * Уязвимость ключа группы (только для BY_VULNERABILITY)
     */
    public Vulnerability getVulnerability() {
        if (mode != GroupingMode.BY_VULNERABILITY) {
            throw new IllegalStateException("Группа " + key.identity() + " сгруппирована не по уязвимости");
        }
        return (Vulnerability) key;
    }

    /**
     * Хост ключа группы (только для BY_HOST)
     */
    public Host getHost() {
        if (mode != GroupingMode.BY_HOST) {
            throw new IllegalStateException("Группа " + key.identity() + " сгруппирована не по хосту");
        }
        return (Host) key;
    }
}
