package com.vtb.reporting.analysis;

import lombok.Value;

/**
 * Группа вместе с вычисленной статистикой
 */
@Value
public class AggregatedGroup {
    Group group;
    GroupStatistics statistics;
}
