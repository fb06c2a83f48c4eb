package com.khaounen.botguard.security.rules;

import com.khaounen.botguard.config.BotGuardConfigurationException;
import com.khaounen.botguard.security.settings.SettingsOverride;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One entry of the ruleset: a condition and the settings it overrides when matched.
 */
public record GuardRule(String source, RuleExpression condition, SettingsOverride overrides) {

    public static GuardRule compile(String when, Map<String, String> set) {
        RuleExpression condition = RuleParser.parse(when);
        SettingsOverride overrides;
        try {
            overrides = SettingsOverride.parse(set);
        } catch (BotGuardConfigurationException ex) {
            throw new BotGuardConfigurationException("rule '" + when + "': " + ex.getMessage(), ex);
        }
        return new GuardRule(when, condition, overrides);
    }

    /**
     * @return reasons parts of the condition can never match; empty for a well-formed rule
     */
    public List<String> problems() {
        return problems(condition);
    }

    static List<String> problems(RuleExpression expression) {
        List<String> problems = new ArrayList<>();
        collect(expression, problems);
        return problems;
    }

    private static void collect(RuleExpression expression, List<String> problems) {
        if (expression instanceof RuleExpression.And and) {
            collect(and.left(), problems);
            collect(and.right(), problems);
        } else if (expression instanceof RuleExpression.Or or) {
            collect(or.left(), problems);
            collect(or.right(), problems);
        } else if (expression instanceof RuleExpression.Invalid invalid) {
            problems.add(invalid.problem());
        } else if (expression instanceof RuleExpression.Atom atom && atom.operator() == Operator.UNKNOWN) {
            problems.add("unknown operator on field " + atom.field());
        }
    }
}
