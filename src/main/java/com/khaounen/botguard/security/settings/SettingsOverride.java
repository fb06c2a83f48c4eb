package com.khaounen.botguard.security.settings;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Typed partial update produced by a rule. Keys and values are validated when
 * the ruleset is loaded, so applying an override never fails per request.
 */
public final class SettingsOverride {

    private final Map<SettingKey, Object> values;

    private SettingsOverride(Map<SettingKey, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static SettingsOverride parse(Map<String, String> raw) {
        EnumMap<SettingKey, Object> values = new EnumMap<>(SettingKey.class);
        if (raw != null) {
            raw.forEach((name, value) -> {
                SettingKey key = SettingKey.fromName(name);
                values.put(key, key.parse(value));
            });
        }
        return new SettingsOverride(values);
    }

    public Map<SettingKey, Object> values() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    void applyTo(GuardSettings.GuardSettingsBuilder builder) {
        values.forEach((key, value) -> key.write(builder, value));
    }

    @Override
    public String toString() {
        return "SettingsOverride" + values;
    }
}
