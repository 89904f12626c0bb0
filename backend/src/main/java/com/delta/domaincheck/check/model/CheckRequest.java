package com.delta.domaincheck.check.model;

import java.util.Locale;

public record CheckRequest(String name, String tld) {

    public CheckRequest {
        name = name == null ? "" : name.trim();
        tld = normalizeTld(tld);
    }

    public String fullDomain() {
        return name + tld;
    }

    /**
     * Lower-cases the extension and prefixes a dot when missing; blank input stays empty.
     */
    public static String normalizeTld(String tld) {
        if (tld == null || tld.isBlank()) {
            return "";
        }
        String value = tld.trim().toLowerCase(Locale.ROOT);
        return value.startsWith(".") ? value : "." + value;
    }
}
