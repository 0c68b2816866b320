package com.vtb.reporting.models;

import lombok.Value;

import java.util.Comparator;

/**
 * Порт находки: номер + протокол ("443/tcp").
 * Нечисловые порты OpenVAS ("general/tcp", "package") сохраняют исходную метку с номером 0.
 */
@Value
public class Port implements Comparable<Port> {

    public static final Port UNKNOWN = new Port(0, "", "");

    private static final Comparator<Port> ORDER = Comparator
        .comparingInt(Port::getNumber)
        .thenComparing(Port::getProtocol)
        .thenComparing(Port::getLabel);

    int number;
    String protocol;
    String label;

    public static Port parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String value = raw.trim();
        int slash = value.indexOf('/');
        String head = slash >= 0 ? value.substring(0, slash) : value;
        String protocol = slash >= 0 ? value.substring(slash + 1).trim() : "";
        try {
            int number = Integer.parseInt(head.trim());
            if (number < 0 || number > 65535) {
                return new Port(0, protocol, value);
            }
            return new Port(number, protocol, value);
        } catch (NumberFormatException e) {
            return new Port(0, protocol, value);
        }
    }

    @Override
    public int compareTo(Port other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return label;
    }
}
