package com.vtb.reporting.analysis;

import com.vtb.reporting.errors.InvariantViolationException;
import com.vtb.reporting.models.Finding;
import com.vtb.reporting.models.GroupKey;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Разбиение находок на группы по уязвимости или по хосту.
 *
 * <p>Результат - разбиение: каждая находка попадает ровно в одну группу. Группы идут в порядке
 * первого появления ключа, находки внутри группы - в порядке появления. Дедупликации нет.
 */
@Slf4j
public class GroupingEngine {

    /**
     * @throws InvariantViolationException если у находки нет сущности ключа группировки
     */
    public List<Group> group(List<Finding> findings, GroupingMode mode) {
        if (findings == null) {
            throw new IllegalArgumentException("Список находок не может быть null");
        }
        if (mode == null) {
            throw new IllegalArgumentException("Режим группировки не может быть null");
        }

        Map<GroupKey, List<Finding>> buckets = new LinkedHashMap<>();
        int position = 0;
        for (Finding finding : findings) {
            GroupKey key = keyOf(finding, mode, position++);
            buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(finding);
        }

        List<Group> groups = new ArrayList<>(buckets.size());
        for (Map.Entry<GroupKey, List<Finding>> entry : buckets.entrySet()) {
            groups.add(new Group(mode, entry.getKey(), entry.getValue()));
        }
        log.debug("Группировка {}: {} находок -> {} групп", mode, findings.size(), groups.size());
        return groups;
    }

    private GroupKey keyOf(Finding finding, GroupingMode mode, int position) {
        if (finding == null) {
            throw new InvariantViolationException("Пустая находка на позиции " + position);
        }
        GroupKey key = mode == GroupingMode.BY_VULNERABILITY ? finding.getVulnerability() : finding.getHost();
        if (key == null) {
            throw new InvariantViolationException(String.format(
                "Находка %s дошла до группировки %s без %s",
                finding.getId(), mode, mode == GroupingMode.BY_VULNERABILITY ? "уязвимости" : "хоста"));
        }
        return key;
    }
}
