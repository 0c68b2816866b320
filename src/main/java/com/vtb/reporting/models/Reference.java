package com.vtb.reporting.models;

import lombok.Value;

/**
 * Ссылка NVT (&lt;ref type="cve" id="CVE-..."/&gt;)
 */
@Value
public class Reference {
    String type;
    String id;

    public boolean isCve() {
        return "cve".equalsIgnoreCase(type);
    }
}
