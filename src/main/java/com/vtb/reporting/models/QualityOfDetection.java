package com.vtb.reporting.models;

import lombok.Value;

import java.util.Optional;

/**
 * Качество обнаружения (QoD): процент уверенности и тип проверки
 */
@Value
public class QualityOfDetection {
    Integer value;
    String type;

    public Optional<Integer> getValue() {
        return Optional.ofNullable(value);
    }

    public Optional<String> getType() {
        return Optional.ofNullable(type);
    }
}
