package com.khaounen.botguard.security.reputation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ProviderResult(Verdict verdict, Map<String, Object> rawFields) {

    public ProviderResult {
        verdict = verdict == null ? Verdict.UNKNOWN : verdict;
        Map<String, Object> copy = new LinkedHashMap<>();
        if (rawFields != null) {
            rawFields.forEach((key, value) -> {
                if (key != null && value != null) {
                    copy.put(key, value);
                }
            });
        }
        rawFields = Collections.unmodifiableMap(copy);
    }

    public static ProviderResult unknown() {
        return new ProviderResult(Verdict.UNKNOWN, Map.of());
    }

    public static ProviderResult of(Verdict verdict) {
        return new ProviderResult(verdict, Map.of());
    }
}
