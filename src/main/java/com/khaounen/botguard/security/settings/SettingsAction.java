package com.khaounen.botguard.security.settings;

import java.util.Locale;

public enum SettingsAction {
    AUTO,
    ALLOW,
    BLOCK,
    FIGHT,
    BLOCK_IF_SUSPICIOUS;

    public static SettingsAction fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("action must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return SettingsAction.valueOf(normalized);
    }
}
