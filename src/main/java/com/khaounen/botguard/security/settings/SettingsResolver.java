package com.khaounen.botguard.security.settings;

import com.khaounen.botguard.config.BotGuardConfigurationException;
import com.khaounen.botguard.security.fields.FieldMap;
import com.khaounen.botguard.security.rules.GuardRule;
import com.khaounen.botguard.security.rules.RuleMatcher;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges the default settings with the overrides of every matching rule. Rules
 * are applied in declaration order, so a later rule wins when two rules set
 * the same key.
 */
@Slf4j
public class SettingsResolver {

    private final GuardSettings defaults;
    private final List<GuardRule> rules;
    private final Set<String> referencedFields;

    public SettingsResolver(GuardSettings defaults, List<GuardRule> rules) {
        if (defaults == null) {
            throw new BotGuardConfigurationException("default settings are required");
        }
        this.defaults = defaults;
        this.rules = rules == null ? List.of() : List.copyOf(rules);

        Set<String> fields = new LinkedHashSet<>();
        for (GuardRule rule : this.rules) {
            fields.addAll(rule.condition().fields());
            for (String problem : rule.problems()) {
                log.warn("bot-guard rule '{}' has a condition that never matches: {}", rule.source(), problem);
            }
            GuardSettings.GuardSettingsBuilder candidate = defaults.toBuilder();
            rule.overrides().applyTo(candidate);
            try {
                candidate.build().validate();
            } catch (BotGuardConfigurationException ex) {
                throw new BotGuardConfigurationException("rule '" + rule.source() + "': " + ex.getMessage(), ex);
            }
        }
        this.referencedFields = Collections.unmodifiableSet(fields);
        log.info("bot-guard loaded {} rule(s) referencing fields {}", this.rules.size(), referencedFields);
    }

    public GuardSettings defaults() {
        return defaults;
    }

    /**
     * @return every field name some rule condition reads
     */
    public Set<String> referencedFields() {
        return referencedFields;
    }

    public GuardSettings resolve(FieldMap fields) {
        if (rules.isEmpty()) {
            return defaults;
        }
        GuardSettings.GuardSettingsBuilder builder = defaults.toBuilder();
        boolean changed = false;
        for (GuardRule rule : rules) {
            if (!RuleMatcher.matches(rule.condition(), fields)) {
                continue;
            }
            log.debug("bot-guard rule '{}' matched, applying {}", rule.source(), rule.overrides());
            rule.overrides().applyTo(builder);
            changed = true;
        }
        return changed ? builder.build() : defaults;
    }
}
