package com.khaounen.botguard.security.reputation;

import java.util.Map;

@FunctionalInterface
public interface ReputationListener {

    ReputationListener NONE = (provider, kind, ip, rawFields) -> {
    };

    void onFlagged(String provider, ReputationKind kind, String ip, Map<String, Object> rawFields);
}
