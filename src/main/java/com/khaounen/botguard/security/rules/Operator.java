package com.khaounen.botguard.security.rules;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Comparison operators understood in rule atoms. Each operator has a group of
 * interchangeable spellings; anything else resolves to {@link #UNKNOWN}.
 */
public enum Operator {
    EQUALS("==", "=", "equals", "equal", "is", "isthesameas"),
    NOT_EQUALS("!=", "doesnotequal", "doesnotequals", "notequals", "notequal", "notis", "isnot"),
    CONTAINS("contains", "contain"),
    NOT_CONTAINS("doesnotcontain", "doesnotcontains", "notcontain", "notcontains"),
    IN("isin", "in"),
    NOT_IN("isnotin", "notisin", "notin"),
    GREATER_THAN("greaterthan", "largerthan", ">"),
    LESS_THAN("lessthan", "smallerthan", "<"),
    STARTS_WITH("startswith", "beginswith"),
    ENDS_WITH("endswith", "concludeswith", "finisheswith"),
    UNKNOWN;

    private final List<String> spellings;

    Operator(String... spellings) {
        this.spellings = List.of(spellings);
    }

    public static Operator fromToken(String token) {
        if (token == null) {
            return UNKNOWN;
        }
        String normalized = token.strip().toLowerCase(Locale.ROOT)
                .replace("_", "")
                .replace("-", "")
                .replace(" ", "");
        return Arrays.stream(values())
                .filter(op -> op.spellings.contains(normalized))
                .findFirst()
                .orElse(UNKNOWN);
    }

    public boolean isMembership() {
        return this == IN || this == NOT_IN;
    }
}
