package com.khaounen.botguard.security.rules;

import com.khaounen.botguard.security.fields.FieldMap;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates compiled rule expressions against the fields of a request.
 * <p>
 * Evaluation fails closed: a missing field, an unknown operator, an operand of
 * the wrong type or an unparsable rule all make the atom {@code false}.
 */
@Slf4j
public final class RuleMatcher {

    private RuleMatcher() {
    }

    public static boolean matches(RuleExpression expression, FieldMap fields) {
        if (expression instanceof RuleExpression.And and) {
            return matches(and.left(), fields) && matches(and.right(), fields);
        }
        if (expression instanceof RuleExpression.Or or) {
            return matches(or.left(), fields) || matches(or.right(), fields);
        }
        if (expression instanceof RuleExpression.Atom atom) {
            return matchesAtom(atom, fields);
        }
        return false;
    }

    private static boolean matchesAtom(RuleExpression.Atom atom, FieldMap fields) {
        Optional<Object> fieldValue = fields.get(atom.field());
        if (fieldValue.isEmpty()) {
            return false;
        }
        try {
            return evaluate(fieldValue.get(), atom.operator(), atom.value());
        } catch (RuntimeException ex) {
            log.debug("bot-guard atom on field {} failed: {}", atom.field(), ex.getMessage());
            return false;
        }
    }

    static boolean evaluate(Object fieldValue, Operator operator, Literal literal) {
        switch (operator) {
            case EQUALS:
                return equalsWildcard(fieldValue, literal.text());
            case NOT_EQUALS:
                return scalar(fieldValue) != null && !equalsWildcard(fieldValue, literal.text());
            case CONTAINS:
                return supportsContainment(fieldValue) && contains(fieldValue, literal.text());
            case NOT_CONTAINS:
                return supportsContainment(fieldValue) && !contains(fieldValue, literal.text());
            case IN:
                return scalar(fieldValue) != null && literal.items().contains(scalar(fieldValue));
            case NOT_IN:
                return scalar(fieldValue) != null && !literal.items().contains(scalar(fieldValue));
            case GREATER_THAN:
                return compare(fieldValue, literal).map(result -> result > 0).orElse(false);
            case LESS_THAN:
                return compare(fieldValue, literal).map(result -> result < 0).orElse(false);
            case STARTS_WITH:
                return textOrNumber(fieldValue) != null && textOrNumber(fieldValue).startsWith(literal.text());
            case ENDS_WITH:
                return textOrNumber(fieldValue) != null && textOrNumber(fieldValue).endsWith(literal.text());
            default:
                return false;
        }
    }

    private static boolean equalsWildcard(Object fieldValue, String pattern) {
        String text = scalar(fieldValue);
        if (text == null) {
            return false;
        }
        if (fieldValue instanceof Boolean) {
            return text.equals(pattern.toLowerCase(Locale.ROOT));
        }
        return WildcardMatcher.matches(text, pattern);
    }

    private static boolean supportsContainment(Object fieldValue) {
        return fieldValue instanceof String || fieldValue instanceof Collection<?> || fieldValue instanceof Map<?, ?>;
    }

    private static boolean contains(Object fieldValue, String needle) {
        if (fieldValue instanceof String text) {
            return text.contains(needle);
        }
        if (fieldValue instanceof Collection<?> items) {
            return items.stream().anyMatch(item -> needle.equals(scalar(item)));
        }
        if (fieldValue instanceof Map<?, ?> map) {
            return map.containsKey(needle);
        }
        return false;
    }

    private static Optional<Integer> compare(Object fieldValue, Literal literal) {
        BigDecimal left = fieldValue instanceof Boolean ? null : toNumber(scalar(fieldValue));
        BigDecimal right = literal.number();
        if (left == null || right == null) {
            return Optional.empty();
        }
        return Optional.of(left.compareTo(right));
    }

    private static String textOrNumber(Object fieldValue) {
        if (fieldValue instanceof String || fieldValue instanceof Number) {
            return scalar(fieldValue);
        }
        return null;
    }

    /**
     * Canonical text of a scalar field value; {@code null} for structured values.
     */
    static String scalar(Object value) {
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof Boolean bool) {
            return bool.toString();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (number == Math.rint(number) && !Double.isInfinite(number)) {
                return Long.toString((long) number);
            }
            return Double.toString(number);
        }
        if (value instanceof Number number) {
            return number.toString();
        }
        return null;
    }

    static BigDecimal toNumber(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (!trimmed.matches("-?\\d+(\\.\\d+)?")) {
            return null;
        }
        try {
            return new BigDecimal(trimmed);
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
