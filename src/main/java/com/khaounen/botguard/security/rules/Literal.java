package com.khaounen.botguard.security.rules;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

public record Literal(String text, List<String> items) {

    public Literal {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static Literal of(String text, boolean membership) {
        if (!membership) {
            return new Literal(text, List.of(text));
        }
        List<String> items = Arrays.stream(text.split(","))
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .toList();
        return new Literal(text, items);
    }

    /**
     * @return the literal as a number, or {@code null} when it is not numeric
     */
    public BigDecimal number() {
        return RuleMatcher.toNumber(text);
    }
}
