package com.delta.domaincheck.check.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

public record BatchCheckApiRequest(
    List<String> names,
    List<String> tlds,
    Integer maxConcurrency,
    Integer retries,
    Long timeoutMs
) {
    public List<String> normalizedNames() {
        return normalize(names);
    }

    public List<String> normalizedTlds() {
        return normalize(tlds);
    }

    private static List<String> normalize(List<String> values) {
        if (values == null) {
            return List.of();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return new ArrayList<>(out);
    }
}
