package com.khaounen.botguard.security.settings;

import com.khaounen.botguard.config.BotGuardConfigurationException;
import com.khaounen.botguard.config.BotGuardProperties;
import com.khaounen.botguard.security.fields.FieldMap;
import com.khaounen.botguard.security.rules.GuardRule;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SettingsResolverTest {

    private static final GuardSettings DEFAULTS = GuardSettings.from(new BotGuardProperties.Defaults());

    @Test
    void laterMatchingRuleWinsOnCollision() {
        SettingsResolver resolver = new SettingsResolver(DEFAULTS, List.of(
                GuardRule.compile("path startswith /admin", Map.of("action", "fight", "theme", "dark")),
                GuardRule.compile("method == POST", Map.of("action", "block-if-suspicious")),
                GuardRule.compile("path == /nope", Map.of("action", "allow"))
        ));

        GuardSettings settings = resolver.resolve(FieldMap.of(Map.of("path", "/admin", "method", "POST")));

        assertEquals(SettingsAction.BLOCK_IF_SUSPICIOUS, settings.getAction());
        assertEquals("dark", settings.getTheme());
        assertEquals(DEFAULTS.getLanguage(), settings.getLanguage());
    }

    @Test
    void noMatchingRuleReturnsDefaults() {
        SettingsResolver resolver = new SettingsResolver(DEFAULTS, List.of(
                GuardRule.compile("path == /admin", Map.of("hardness", "3"))
        ));

        assertSame(DEFAULTS, resolver.resolve(FieldMap.of(Map.of("path", "/"))));
    }

    @Test
    void resolvingTwiceGivesEqualSnapshots() {
        SettingsResolver resolver = new SettingsResolver(DEFAULTS, List.of(
                GuardRule.compile("path == /login", Map.of("rate_limit_window", "60s", "enable_rate_limit", "true"))
        ));
        FieldMap fields = FieldMap.of(Map.of("path", "/login"));

        GuardSettings first = resolver.resolve(fields);
        GuardSettings second = resolver.resolve(fields);

        assertEquals(first, second);
        assertEquals(Duration.ofSeconds(60), first.getRateLimitWindow());
        assertTrue(first.isEnableRateLimit());
    }

    @Test
    void thirdPartiesOverrideBecomesOrderedProviderList() {
        SettingsResolver resolver = new SettingsResolver(DEFAULTS, List.of(
                GuardRule.compile("path == /api", Map.of("third_parties", "ipintel, ipapi,,exonerator"))
        ));

        GuardSettings settings = resolver.resolve(FieldMap.of(Map.of("path", "/api")));

        assertEquals(List.of("ipintel", "ipapi", "exonerator"), settings.getThirdParties());
    }

    @Test
    void referencedFieldsCoverEveryRule() {
        SettingsResolver resolver = new SettingsResolver(DEFAULTS, List.of(
                GuardRule.compile("path == / and is_ip_tor == true", Map.of("action", "block")),
                GuardRule.compile("country_code in CN,RU", Map.of("hardness", "2"))
        ));

        assertEquals(Set.of("path", "is_ip_tor", "country_code"), resolver.referencedFields());
    }

    @Test
    void unknownOverrideKeyIsRejected() {
        assertThrows(BotGuardConfigurationException.class,
                () -> GuardRule.compile("path == /", Map.of("colour", "blue")));
    }

    @Test
    void unparsableOverrideValueIsRejected() {
        assertThrows(BotGuardConfigurationException.class,
                () -> GuardRule.compile("path == /", Map.of("debug", "yes")));
        assertThrows(BotGuardConfigurationException.class,
                () -> GuardRule.compile("path == /", Map.of("action", "maybe")));
    }

    @Test
    void outOfRangeOverrideFailsAtLoad() {
        List<GuardRule> rules = List.of(GuardRule.compile("path == /", Map.of("hardness", "5")));

        assertThrows(BotGuardConfigurationException.class, () -> new SettingsResolver(DEFAULTS, rules));
    }

    @Test
    void malformedConditionLoadsButNeverMatches() {
        SettingsResolver resolver = new SettingsResolver(DEFAULTS, List.of(
                GuardRule.compile("path == / trailing", Map.of("action", "allow"))
        ));

        assertSame(DEFAULTS, resolver.resolve(FieldMap.of(Map.of("path", "/"))));
    }
}
