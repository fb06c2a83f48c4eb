package com.khaounen.botguard.security.settings;

import com.khaounen.botguard.config.BotGuardConfigurationException;
import com.khaounen.botguard.config.BotGuardProperties;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Effective configuration for one request: the defaults with every matching
 * rule override applied. Instances are immutable.
 */
@Value
@Builder(toBuilder = true)
public class GuardSettings {

    SettingsAction action;
    String captchaType;
    int hardness;
    Duration verificationAge;
    boolean storeAnonymously;
    String dataset;
    int datasetMinSize;
    int datasetMaxSize;
    boolean enableRateLimit;
    int rateLimitRequests;
    Duration rateLimitWindow;
    boolean enableCrawlerBlock;
    boolean crawlerHints;
    String theme;
    String language;
    boolean debug;
    List<String> thirdParties;

    /**
     * Builds the per-process baseline from bound properties, failing fast on
     * missing or out-of-range values.
     */
    public static GuardSettings from(BotGuardProperties.Defaults defaults) {
        if (defaults == null) {
            throw new BotGuardConfigurationException("bot-guard.defaults must be configured");
        }
        SettingsAction action;
        try {
            action = SettingsAction.fromValue(require(defaults.getAction(), "action"));
        } catch (IllegalArgumentException ex) {
            throw new BotGuardConfigurationException("bot-guard.defaults.action is invalid: " + defaults.getAction(), ex);
        }
        GuardSettings settings = GuardSettings.builder()
                .action(action)
                .captchaType(require(defaults.getCaptchaType(), "captcha-type"))
                .hardness(require(defaults.getHardness(), "hardness"))
                .verificationAge(require(defaults.getVerificationAge(), "verification-age"))
                .storeAnonymously(require(defaults.getStoreAnonymously(), "store-anonymously"))
                .dataset(require(defaults.getDataset(), "dataset"))
                .datasetMinSize(require(defaults.getDatasetMinSize(), "dataset-min-size"))
                .datasetMaxSize(require(defaults.getDatasetMaxSize(), "dataset-max-size"))
                .enableRateLimit(require(defaults.getEnableRateLimit(), "enable-rate-limit"))
                .rateLimitRequests(require(defaults.getRateLimitRequests(), "rate-limit-requests"))
                .rateLimitWindow(require(defaults.getRateLimitWindow(), "rate-limit-window"))
                .enableCrawlerBlock(require(defaults.getEnableCrawlerBlock(), "enable-crawler-block"))
                .crawlerHints(require(defaults.getCrawlerHints(), "crawler-hints"))
                .theme(require(defaults.getTheme(), "theme"))
                .language(require(defaults.getLanguage(), "language"))
                .debug(require(defaults.getDebug(), "debug"))
                .thirdParties(List.copyOf(require(defaults.getThirdParties(), "third-parties")))
                .build();
        settings.validate();
        return settings;
    }

    /**
     * Checks ranges that the type system cannot express.
     */
    public void validate() {
        if (hardness < 1 || hardness > 3) {
            throw new BotGuardConfigurationException("hardness must be between 1 and 3, got " + hardness);
        }
        if (datasetMinSize < 1 || datasetMaxSize < datasetMinSize) {
            throw new BotGuardConfigurationException(
                    "dataset size range is invalid: " + datasetMinSize + ".." + datasetMaxSize
            );
        }
        if (rateLimitRequests < 1) {
            throw new BotGuardConfigurationException("rate-limit-requests must be positive");
        }
        if (rateLimitWindow.isZero() || rateLimitWindow.isNegative()) {
            throw new BotGuardConfigurationException("rate-limit-window must be positive");
        }
        if (verificationAge.isNegative()) {
            throw new BotGuardConfigurationException("verification-age must not be negative");
        }
    }

    private static <T> T require(T value, String key) {
        if (value == null || (value instanceof String text && text.isBlank())) {
            throw new BotGuardConfigurationException("bot-guard.defaults." + key + " is required");
        }
        return value;
    }
}
