package com.khaounen.botguard.security.rules;

import com.khaounen.botguard.security.fields.FieldMap;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuleMatcherTest {

    private static final FieldMap FIELDS = FieldMap.of(Map.of(
            "path", "/admin/users",
            "method", "POST",
            "asn", 13335,
            "score", 0.75,
            "is_json", true,
            "args", Map.of("page", "2"),
            "tags", List.of("a", "b")
    ));

    private static boolean matches(String rule) {
        return RuleMatcher.matches(RuleParser.parse(rule), FIELDS);
    }

    @Test
    void missingFieldsNeverMatch() {
        FieldMap empty = FieldMap.of(Map.of());

        assertFalse(RuleMatcher.matches(RuleParser.parse("path == /"), empty));
        assertFalse(RuleMatcher.matches(RuleParser.parse("path != /"), empty));
        assertFalse(RuleMatcher.matches(RuleParser.parse("path != / or host != x"), empty));
        assertFalse(RuleMatcher.matches(RuleParser.parse("path not_in /a,/b and host doesnotcontain x"), empty));
    }

    @Test
    void equalityAndWildcards() {
        assertTrue(matches("path == /admin/users"));
        assertTrue(matches("path == /admin/*"));
        assertTrue(matches("path == */users"));
        assertTrue(matches("path == /*min*rs"));
        assertFalse(matches("path == /admin"));
        assertTrue(matches("path != /public/*"));
        assertTrue(matches("is_json == True"));
        assertTrue(matches("asn == 13335"));
    }

    @Test
    void wildcardRequiresPrefixSuffixAndMiddle() {
        assertTrue(WildcardMatcher.matches("abc123xyz", "abc*xyz"));
        assertFalse(WildcardMatcher.matches("abcxyz", "abc*123*xyz"));
        assertTrue(WildcardMatcher.matches("abc-123-xyz", "abc*123*xyz"));
        assertFalse(WildcardMatcher.matches("abxyz", "abc*xyz"));
        assertFalse(WildcardMatcher.matches("abc", "abc*c"));
        assertTrue(WildcardMatcher.matches("anything", "*"));
    }

    @Test
    void containment() {
        assertTrue(matches("path contains admin"));
        assertTrue(matches("tags contains a"));
        assertTrue(matches("args contains page"));
        assertTrue(matches("path doesnotcontain login"));
        assertFalse(matches("asn contains 133"));
        assertFalse(matches("asn not_contains 133"));
    }

    @Test
    void membership() {
        assertTrue(matches("method in GET,POST"));
        assertFalse(matches("method in GET,HEAD"));
        assertTrue(matches("method not_in GET,HEAD"));
        assertTrue(matches("asn in 13335,15169"));
        assertFalse(matches("tags in a,b"));
    }

    @Test
    void numericComparisonsFailClosedOnText() {
        assertTrue(matches("asn > 1000"));
        assertTrue(matches("score lessthan 0.9"));
        assertFalse(matches("score > 0.9"));
        assertFalse(matches("path > 5"));
        assertFalse(matches("asn > many"));
        assertFalse(matches("is_json > 0"));
    }

    @Test
    void prefixAndSuffix() {
        assertTrue(matches("path startswith /admin"));
        assertTrue(matches("path endswith users"));
        assertTrue(matches("asn beginswith 133"));
        assertFalse(matches("tags startswith a"));
    }

    @Test
    void unknownOperatorAndInvalidRuleNeverMatch() {
        assertFalse(matches("path roughly /admin"));
        assertFalse(matches("path == /admin/users extra"));
        assertFalse(matches("path roughly /admin or method != POST"));
    }

    @Test
    void connectivesEvaluateRightNested() {
        // false and (true or true)
        assertFalse(matches("method == GET and path startswith /admin or asn > 1"));
        // true or (false and false)
        assertTrue(matches("method == POST or path == / and asn < 1"));
    }
}
