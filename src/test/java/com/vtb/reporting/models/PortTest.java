package com.vtb.reporting.models;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для Port
 */
class PortTest {

    @Test
    void testParseNumericPort() {
        Port port = Port.parse("443/tcp");

        assertEquals(443, port.getNumber());
        assertEquals("tcp", port.getProtocol());
        assertEquals("443/tcp", port.getLabel());
    }

    @Test
    void testParseGeneralPort() {
        Port port = Port.parse("general/tcp");

        assertEquals(0, port.getNumber());
        assertEquals("general/tcp", port.toString(), "Нечисловой порт сохраняет метку");
        assertEquals("tcp", port.getProtocol());
    }

    @Test
    void testEmptyPortIsUnknown() {
        assertSame(Port.UNKNOWN, Port.parse(null));
        assertSame(Port.UNKNOWN, Port.parse("  "));
    }

    @Test
    void testOrdering() {
        TreeSet<Port> ports = new TreeSet<>(List.of(Port.parse("443/tcp"), Port.parse("22/tcp"), Port.parse("80/tcp")));

        assertEquals(List.of("22/tcp", "80/tcp", "443/tcp"),
            ports.stream().map(Port::getLabel).collect(Collectors.toList()));
    }
}
