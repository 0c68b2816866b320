package com.vtb.reporting;

import com.vtb.reporting.models.Finding;
import com.vtb.reporting.models.Host;
import com.vtb.reporting.models.HostKey;
import com.vtb.reporting.models.Port;
import com.vtb.reporting.models.Vulnerability;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Общие тестовые данные: XML отчеты из src/test/resources/reports и фабрики моделей
 */
public final class TestFixtures {

    public static final String SAMPLE_REPORT = "sample-report.xml";
    public static final String TWO_HOSTS = "two-hosts.xml";
    public static final String INVALID_RECORDS = "invalid-records.xml";
    public static final String MALFORMED = "malformed.xml";

    private TestFixtures() {
    }

    public static Path report(String name) {
        URL url = TestFixtures.class.getClassLoader().getResource("reports/" + name);
        if (url == null) {
            throw new IllegalStateException("Тестовый отчет не найден: " + name);
        }
        try {
            return Paths.get(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static Vulnerability vulnerability(String oid, String name, Double cvss) {
        return Vulnerability.builder()
            .oid(oid)
            .name(name)
            .family("General")
            .cvssBase(cvss)
            .build();
    }

    public static Host host(String address) {
        return new Host(new HostKey(null, address), null);
    }

    public static Finding finding(String id, Vulnerability vulnerability, Host host, Double severity) {
        return finding(id, vulnerability, host, severity, "443/tcp");
    }

    public static Finding finding(String id, Vulnerability vulnerability, Host host, Double severity, String port) {
        return Finding.builder()
            .id(id)
            .vulnerability(vulnerability)
            .host(host)
            .severity(severity)
            .port(Port.parse(port))
            .build();
    }
}
