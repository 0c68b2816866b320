package com.vtb.reporting.analysis;

/**
 * Измерение группировки находок
 */
public enum GroupingMode {
    BY_VULNERABILITY,
    BY_HOST
}
