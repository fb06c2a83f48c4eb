package com.khaounen.botguard.security.rules;

/**
 * Equality with {@code *} wildcards. One star splits the pattern into a required
 * prefix and suffix; with several stars the text between the first and the last
 * star must also occur somewhere in the value.
 */
public final class WildcardMatcher {

    private WildcardMatcher() {
    }

    public static boolean matches(String value, String pattern) {
        if (value == null || pattern == null) {
            return false;
        }
        int first = pattern.indexOf('*');
        if (first < 0) {
            return value.equals(pattern);
        }
        int last = pattern.lastIndexOf('*');
        String start = pattern.substring(0, first);
        String end = pattern.substring(last + 1);
        if (value.length() < start.length() + end.length()) {
            return false;
        }
        if (!value.startsWith(start) || !value.endsWith(end)) {
            return false;
        }
        if (first == last) {
            return true;
        }
        String middle = pattern.substring(first + 1, last);
        return value.contains(middle);
    }
}
