package com.khaounen.botguard.security.settings;

import com.khaounen.botguard.config.BotGuardConfigurationException;
import com.khaounen.botguard.config.BotGuardProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GuardSettingsTest {

    @Test
    void defaultsCarryEveryRecognizedSetting() {
        GuardSettings settings = GuardSettings.from(new BotGuardProperties.Defaults());

        assertEquals(SettingsAction.AUTO, settings.getAction());
        assertEquals("oneclick", settings.getCaptchaType());
        assertEquals(1, settings.getHardness());
        assertEquals(Duration.ofHours(1), settings.getVerificationAge());
        assertTrue(settings.isStoreAnonymously());
        assertEquals(Duration.ofSeconds(300), settings.getRateLimitWindow());
        assertEquals(List.of("ipapi", "ipintel", "hostnameresolve", "exonerator", "geoip"), settings.getThirdParties());
    }

    @Test
    void missingRequiredDefaultIsFatal() {
        BotGuardProperties.Defaults defaults = new BotGuardProperties.Defaults();
        defaults.setTheme(" ");

        BotGuardConfigurationException ex =
                assertThrows(BotGuardConfigurationException.class, () -> GuardSettings.from(defaults));
        assertTrue(ex.getMessage().contains("theme"));
    }

    @Test
    void invalidActionIsFatal() {
        BotGuardProperties.Defaults defaults = new BotGuardProperties.Defaults();
        defaults.setAction("surrender");

        assertThrows(BotGuardConfigurationException.class, () -> GuardSettings.from(defaults));
    }

    @Test
    void datasetRangeIsValidated() {
        BotGuardProperties.Defaults defaults = new BotGuardProperties.Defaults();
        defaults.setDatasetMinSize(50);
        defaults.setDatasetMaxSize(10);

        assertThrows(BotGuardConfigurationException.class, () -> GuardSettings.from(defaults));
    }

    @Test
    void actionAcceptsKebabCase() {
        assertEquals(SettingsAction.BLOCK_IF_SUSPICIOUS, SettingsAction.fromValue("block-if-suspicious"));
        assertEquals(SettingsAction.FIGHT, SettingsAction.fromValue(" Fight "));
    }

    @Test
    void settingKeyAcceptsSnakeAndKebabCase() {
        assertEquals(SettingKey.RATE_LIMIT_WINDOW, SettingKey.fromName("rate_limit_window"));
        assertEquals(SettingKey.THIRD_PARTIES, SettingKey.fromName("Third-Parties"));
        assertEquals(List.of("ipapi", "geoip"), SettingKey.THIRD_PARTIES.parse("ipapi, geoip,"));
    }
}
