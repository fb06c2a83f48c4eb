package com.khaounen.botguard.security.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a rule condition such as {@code path startswith /admin and is_ip_tor == true}
 * into a {@link RuleExpression}.
 * <p>
 * Tokens are separated by whitespace; a value containing spaces is wrapped in
 * single or double quotes. The expression is split at the first unquoted
 * {@code and}/{@code or} and both halves are parsed recursively, so
 * {@code A and B or C} reads as {@code A and (B or C)}. There are no parentheses.
 * A terminal part must be exactly {@code field operator value}; anything else
 * compiles to {@link RuleExpression.Invalid}.
 */
public final class RuleParser {

    private RuleParser() {
    }

    public static RuleExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return new RuleExpression.Invalid(String.valueOf(expression), "empty expression");
        }
        List<Token> tokens = tokenize(expression);
        return build(tokens, expression);
    }

    private static RuleExpression build(List<Token> tokens, String source) {
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.quoted()) {
                continue;
            }
            if ("and".equalsIgnoreCase(token.text())) {
                return new RuleExpression.And(
                        build(tokens.subList(0, i), source),
                        build(tokens.subList(i + 1, tokens.size()), source)
                );
            }
            if ("or".equalsIgnoreCase(token.text())) {
                return new RuleExpression.Or(
                        build(tokens.subList(0, i), source),
                        build(tokens.subList(i + 1, tokens.size()), source)
                );
            }
        }
        if (tokens.size() != 3) {
            return new RuleExpression.Invalid(source, "expected 'field operator value' but found " + tokens.size() + " token(s)");
        }
        Operator operator = Operator.fromToken(tokens.get(1).text());
        Literal literal = Literal.of(tokens.get(2).text(), operator.isMembership());
        return new RuleExpression.Atom(tokens.get(0).text(), operator, literal);
    }

    static List<Token> tokenize(String expression) {
        List<Token> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        boolean quoted = false;
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    current.append(c);
                }
                continue;
            }
            if (c == '\'' || c == '"') {
                quote = c;
                quoted = true;
                continue;
            }
            if (Character.isWhitespace(c)) {
                if (current.length() > 0 || quoted) {
                    tokens.add(new Token(current.toString(), quoted));
                    current.setLength(0);
                    quoted = false;
                }
                continue;
            }
            current.append(c);
        }
        if (current.length() > 0 || quoted) {
            tokens.add(new Token(current.toString(), quoted));
        }
        return tokens;
    }

    record Token(String text, boolean quoted) {
    }
}
