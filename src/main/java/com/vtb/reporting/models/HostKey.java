package com.vtb.reporting.models;

import lombok.Value;

import java.util.Optional;

/**
 * Идентичность хоста: (asset_id, адрес). Без asset_id идентичность вырождается до адреса.
 */
@Value
public class HostKey implements Comparable<HostKey> {
    String assetId;
    String address;

    public HostKey(String assetId, String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Адрес хоста не может быть пустым");
        }
        this.assetId = assetId == null || assetId.isBlank() ? null : assetId.trim();
        this.address = address.trim();
    }

    public Optional<String> getAssetId() {
        return Optional.ofNullable(assetId);
    }

    public String asString() {
        return assetId == null ? address : assetId + "@" + address;
    }

    @Override
    public int compareTo(HostKey other) {
        return asString().compareTo(other.asString());
    }
}
