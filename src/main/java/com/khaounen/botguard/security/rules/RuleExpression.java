package com.khaounen.botguard.security.rules;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Compiled form of a rule condition. Built once by {@link RuleParser} when the
 * ruleset loads and evaluated per request by {@link RuleMatcher}.
 */
public interface RuleExpression {

    Set<String> fields();

    record Atom(String field, Operator operator, Literal value) implements RuleExpression {
        @Override
        public Set<String> fields() {
            return Set.of(field);
        }
    }

    record And(RuleExpression left, RuleExpression right) implements RuleExpression {
        @Override
        public Set<String> fields() {
            return union(left, right);
        }
    }

    record Or(RuleExpression left, RuleExpression right) implements RuleExpression {
        @Override
        public Set<String> fields() {
            return union(left, right);
        }
    }

    /**
     * A condition that could not be parsed. It never matches.
     */
    record Invalid(String source, String problem) implements RuleExpression {
        @Override
        public Set<String> fields() {
            return Set.of();
        }
    }

    private static Set<String> union(RuleExpression left, RuleExpression right) {
        Set<String> fields = new LinkedHashSet<>(left.fields());
        fields.addAll(right.fields());
        return fields;
    }
}
