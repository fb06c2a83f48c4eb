package com.khaounen.botguard.security.fields;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Field values of one request. Values outside the eagerly built base set are
 * produced on first access by a {@link FieldLoader} and remembered, so each
 * field is computed at most once per request. Not thread-safe; a request owns
 * its map.
 */
@Slf4j
public final class FieldMap {

    private final Map<String, Object> values;
    private final Set<String> attempted = new HashSet<>();
    private final FieldLoader loader;

    FieldMap(Map<String, ?> base, FieldLoader loader) {
        this.values = new LinkedHashMap<>();
        base.forEach((name, value) -> {
            if (value != null) {
                values.put(name, value);
            }
        });
        this.loader = loader;
    }

    public static FieldMap of(Map<String, ?> values) {
        return new FieldMap(values, (name, fields) -> null);
    }

    /**
     * @return the field value, or empty when the field is unknown or could not be resolved
     */
    public Optional<Object> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Object present = values.get(name);
        if (present != null) {
            return Optional.of(present);
        }
        if (!attempted.add(name)) {
            return Optional.empty();
        }
        Object loaded;
        try {
            loaded = loader.load(name, this);
        } catch (RuntimeException ex) {
            log.debug("bot-guard field {} could not be resolved: {}", name, ex.getMessage());
            return Optional.empty();
        }
        if (loaded != null) {
            values.put(name, loaded);
        }
        return Optional.ofNullable(values.get(name));
    }

    /**
     * Like {@link #get(String)} but never triggers the loader.
     */
    public Optional<Object> peek(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(values.get(name));
    }

    /**
     * Records values that arrived alongside a requested field, e.g. a whole GeoIP record.
     * Already known fields keep their first value.
     */
    void merge(Map<String, ?> extra) {
        extra.forEach((name, value) -> {
            if (value != null) {
                values.putIfAbsent(name, value);
            }
        });
    }

    public Map<String, Object> resolved() {
        return Collections.unmodifiableMap(values);
    }

    @FunctionalInterface
    public interface FieldLoader {
        /**
         * @return the value, or {@code null} when the field is not available
         */
        Object load(String name, FieldMap fields);
    }
}
