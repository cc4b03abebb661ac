package org.pikematch.regex;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.pikematch.lexer.PatternLexer;
import org.pikematch.lexer.TokenizedPattern;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BacktrackMatcherTest {

    private static int endOf(String pattern, String text, int position) {
        TokenizedPattern tokenized = PatternLexer.tokenize(pattern, PatternOptions.strict());
        return new BacktrackMatcher(tokenized, text, MatchBudget.unlimited()).matchAt(position);
    }

    @ParameterizedTest(name = "matchHere(''{0}'', ''{1}'') = {2}")
    @CsvSource({
            "'',       '',      true",
            "'',       abc,     true",
            "abc,      abcdef,  true",
            "abc,      xabc,    false",
            "a.c,      abc,     true",
            "a.c,      ac,      false",
            "'a\\.c',  a.c,     true",
            "'a\\.c',  abc,     false",
            "a*b,      b,       true",
            "a*b,      aaab,    true",
            "a+b,      b,       false",
            "a+b,      ab,      true",
            "colou?r,  color,   true",
            "colou?r,  colour,  true",
            "[a-c]+,   cab,     true",
            "[a-c]+,   dab,     false",
            "ab$,      ab,      true",
            "ab$,      abc,     false",
            "^ab,      abc,     true",
            "'$',      '',      true",
            "'$',      a,       false",
            "'.',      '',      false"
    })
    void testMatchHere(String pattern, String text, boolean expected) {
        assertEquals(expected, BacktrackMatcher.matchHere(pattern, text));
    }

    @Test
    void testStarIsGreedy() {
        assertEquals(3, endOf("a*", "aaab", 0));
        assertEquals(4, endOf(".*", "abcd", 0));
    }

    @Test
    void testStarGivesBackCharacters() {
        // The maximal run of a's must shrink by one for the trailing "ab" to fit
        assertEquals(4, endOf("a*ab", "aaab", 0));
        assertEquals(5, endOf(".*c", "abcbc", 0));
        assertEquals(3, endOf("[0-9]*9", "999", 0));
    }

    @Test
    void testStarMatchesZeroTimes() {
        assertEquals(0, endOf("x*", "abc", 0));
        assertEquals(1, endOf("x*a", "abc", 0));
    }

    @Test
    void testPlusNeedsOneOccurrence() {
        assertEquals(BacktrackMatcher.NO_MATCH, endOf("x+", "abc", 0));
        assertEquals(2, endOf("a+", "aab", 0));
        assertEquals(3, endOf("a+ab", "aab", 0));
        assertEquals(BacktrackMatcher.NO_MATCH, endOf("a+ab", "ab", 0));
        assertEquals(4, endOf("a+ab", "aaab", 0));
    }

    @Test
    void testQuestionPrefersZero() {
        // Zero occurrences already satisfy the empty remainder
        assertEquals(1, endOf("ab?", "ab", 0));
        // Zero occurrences win even where one more would also fit
        assertEquals(2, endOf("ab?b", "abb", 0));
        assertEquals(2, endOf("ab?b", "ab", 0));
        // Zero occurrences fail against the trailing c, one occurrence succeeds
        assertEquals(3, endOf("ab?c", "abc", 0));
    }

    @Test
    void testQuestionAgainstEndAnchor() {
        assertEquals(2, endOf("ab?$", "ab", 0));
        assertEquals(BacktrackMatcher.NO_MATCH, endOf("ab?$", "abc", 0));
    }

    @Test
    void testQuantifiedClassFollowedByLiteral() {
        assertEquals(3, endOf("[0-9]+x", "12x", 0));
        assertEquals(BacktrackMatcher.NO_MATCH, endOf("[0-9]+x", "12y", 0));
        assertEquals(1, endOf("[0-9]?x", "x", 0));
        assertEquals(4, endOf("[^x]*x", "abcx", 0));
    }

    @Test
    void testMatchAtLaterPosition() {
        assertEquals(BacktrackMatcher.NO_MATCH, endOf("bc", "abcbc", 2));
        assertEquals(5, endOf("bc", "abcbc", 3));
        assertEquals(5, endOf("$", "abcbc", 5));
    }

    @Test
    void testStepLimit() {
        TokenizedPattern tokenized = PatternLexer.tokenize("a*a*a*a*a*a*a*a*b", PatternOptions.strict());
        BacktrackMatcher matcher = new BacktrackMatcher(tokenized, "a".repeat(30), new MatchBudget(1000, 100));
        MatchBudgetExceededException e = assertThrows(MatchBudgetExceededException.class, () -> matcher.matchAt(0));
        assertEquals("step", e.getLimitName());
        assertEquals(1000, e.getLimit());
        assertTrue(matcher.getSteps() > 1000);
    }

    @Test
    void testDepthLimit() {
        TokenizedPattern tokenized = PatternLexer.tokenize("abcdefgh", PatternOptions.strict());
        BacktrackMatcher matcher = new BacktrackMatcher(tokenized, "abcdefgh", new MatchBudget(1000, 4));
        MatchBudgetExceededException e = assertThrows(MatchBudgetExceededException.class, () -> matcher.matchAt(0));
        assertEquals("depth", e.getLimitName());
        assertTrue(e.getMessage().contains("m/abcdefgh/"), e.getMessage());
    }

    @Test
    void testDefaultDepthLimitIsReachable() {
        String literal = "a".repeat(MatchBudget.DEFAULT_DEPTH_LIMIT);
        assertEquals(List.of(0), PatternScanner.match(literal, literal));
        String optional = "a?".repeat(MatchBudget.DEFAULT_DEPTH_LIMIT);
        // Every a? takes zero occurrences first, so each offset yields an empty match
        assertEquals(literal.length() + 1, PatternScanner.match(optional, literal).size());
    }

    @Test
    void testDefaultBudgetStopsLongPattern() {
        String literal = "a".repeat(6000);
        MatchBudgetExceededException e = assertThrows(MatchBudgetExceededException.class,
                () -> PatternScanner.match(literal, literal));
        assertEquals("depth", e.getLimitName());
        assertEquals(MatchBudget.DEFAULT_DEPTH_LIMIT, e.getLimit());

        String optional = "a?".repeat(6000);
        assertThrows(MatchBudgetExceededException.class, () -> PatternScanner.match(optional, literal));
    }

    @Test
    void testStackExhaustionIsReportedAsDepth() {
        String literal = "a".repeat(300_000);
        TokenizedPattern tokenized = PatternLexer.tokenize(literal, PatternOptions.strict());
        BacktrackMatcher matcher = new BacktrackMatcher(tokenized, literal, MatchBudget.unlimited());
        MatchBudgetExceededException e = assertThrows(MatchBudgetExceededException.class, () -> matcher.matchAt(0));
        assertEquals("depth", e.getLimitName());
        assertTrue(e.getLimit() > 0 && e.getLimit() < 300_000, "deepest frame " + e.getLimit());
        assertInstanceOf(StackOverflowError.class, e.getCause());
    }

    @Test
    void testUnlimitedBudgetFinishesPathologicalInput() {
        TokenizedPattern tokenized = PatternLexer.tokenize("a*a*a*b", PatternOptions.strict());
        BacktrackMatcher matcher = new BacktrackMatcher(tokenized, "a".repeat(20), MatchBudget.unlimited());
        assertEquals(BacktrackMatcher.NO_MATCH, matcher.matchAt(0));
    }
}
