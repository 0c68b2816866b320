package com.vtb.reporting.models;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Хост, интернируется по {@link HostKey} в рамках одного запуска.
 * Порты накапливаются только по находкам, прошедшим фильтр.
 */
@ToString(onlyExplicitlyIncluded = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class Host implements GroupKey {

    @Getter
    @ToString.Include
    @EqualsAndHashCode.Include
    private final HostKey key;

    @ToString.Include
    private final String hostname;

    private final Set<Port> observedPorts = new LinkedHashSet<>();

    public Host(HostKey key, String hostname) {
        if (key == null) {
            throw new IllegalArgumentException("HostKey не может быть null");
        }
        this.key = key;
        this.hostname = hostname == null || hostname.isBlank() ? null : hostname.trim();
    }

    public String getAddress() {
        return key.getAddress();
    }

    public Optional<String> getAssetId() {
        return key.getAssetId();
    }

    public Optional<String> getHostname() {
        return Optional.ofNullable(hostname);
    }

    public String getDisplayName() {
        return hostname != null ? hostname : key.getAddress();
    }

    public Set<Port> getObservedPorts() {
        return Collections.unmodifiableSet(observedPorts);
    }

    public void recordPort(Port port) {
        if (port != null && port != Port.UNKNOWN) {
            observedPorts.add(port);
        }
    }

    @Override
    public String identity() {
        return key.asString();
    }

    @Override
    public String sortName() {
        return getDisplayName();
    }
}
