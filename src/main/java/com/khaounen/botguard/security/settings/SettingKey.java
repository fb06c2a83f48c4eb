package com.khaounen.botguard.security.settings;

import com.khaounen.botguard.config.BotGuardConfigurationException;
import org.springframework.boot.convert.DurationStyle;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Every setting a rule may override, with its value parser and the builder
 * slot it writes to.
 */
public enum SettingKey {
    ACTION("action", SettingsAction::fromValue,
            (b, v) -> b.action((SettingsAction) v)),
    CAPTCHA_TYPE("captcha-type", SettingKey::text,
            (b, v) -> b.captchaType((String) v)),
    HARDNESS("hardness", Integer::parseInt,
            (b, v) -> b.hardness((Integer) v)),
    VERIFICATION_AGE("verification-age", DurationStyle::detectAndParse,
            (b, v) -> b.verificationAge((Duration) v)),
    STORE_ANONYMOUSLY("store-anonymously", SettingKey::bool,
            (b, v) -> b.storeAnonymously((Boolean) v)),
    DATASET("dataset", SettingKey::text,
            (b, v) -> b.dataset((String) v)),
    DATASET_MIN_SIZE("dataset-min-size", Integer::parseInt,
            (b, v) -> b.datasetMinSize((Integer) v)),
    DATASET_MAX_SIZE("dataset-max-size", Integer::parseInt,
            (b, v) -> b.datasetMaxSize((Integer) v)),
    ENABLE_RATE_LIMIT("enable-rate-limit", SettingKey::bool,
            (b, v) -> b.enableRateLimit((Boolean) v)),
    RATE_LIMIT_REQUESTS("rate-limit-requests", Integer::parseInt,
            (b, v) -> b.rateLimitRequests((Integer) v)),
    RATE_LIMIT_WINDOW("rate-limit-window", DurationStyle::detectAndParse,
            (b, v) -> b.rateLimitWindow((Duration) v)),
    ENABLE_CRAWLER_BLOCK("enable-crawler-block", SettingKey::bool,
            (b, v) -> b.enableCrawlerBlock((Boolean) v)),
    CRAWLER_HINTS("crawler-hints", SettingKey::bool,
            (b, v) -> b.crawlerHints((Boolean) v)),
    THEME("theme", SettingKey::text,
            (b, v) -> b.theme((String) v)),
    LANGUAGE("language", SettingKey::text,
            (b, v) -> b.language((String) v)),
    DEBUG("debug", SettingKey::bool,
            (b, v) -> b.debug((Boolean) v)),
    THIRD_PARTIES("third-parties", SettingKey::list,
            (b, v) -> b.thirdParties(stringList(v)));

    private final String propertyName;
    private final Function<String, Object> parser;
    private final BiConsumer<GuardSettings.GuardSettingsBuilder, Object> writer;

    SettingKey(
            String propertyName,
            Function<String, Object> parser,
            BiConsumer<GuardSettings.GuardSettingsBuilder, Object> writer
    ) {
        this.propertyName = propertyName;
        this.parser = parser;
        this.writer = writer;
    }

    public String propertyName() {
        return propertyName;
    }

    /**
     * Resolves a key as written in configuration; snake case and kebab case are both accepted.
     */
    public static SettingKey fromName(String name) {
        if (name == null) {
            throw new BotGuardConfigurationException("setting name must not be null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
                .filter(key -> key.propertyName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new BotGuardConfigurationException("unknown setting: " + name));
    }

    Object parse(String raw) {
        if (raw == null) {
            throw new BotGuardConfigurationException("setting " + propertyName + " has no value");
        }
        try {
            return parser.apply(raw.trim());
        } catch (RuntimeException ex) {
            throw new BotGuardConfigurationException(
                    "setting " + propertyName + " has an invalid value: " + raw, ex
            );
        }
    }

    void write(GuardSettings.GuardSettingsBuilder builder, Object value) {
        writer.accept(builder, value);
    }

    private static Object text(String raw) {
        if (raw.isEmpty()) {
            throw new IllegalArgumentException("empty value");
        }
        return raw;
    }

    private static Object bool(String raw) {
        if ("true".equalsIgnoreCase(raw)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(raw)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("not a boolean: " + raw);
    }

    private static Object list(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .toList();
    }

    private static List<String> stringList(Object value) {
        return ((List<?>) value).stream().map(String::valueOf).toList();
    }
}
