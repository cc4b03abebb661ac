package org.pikematch.regex;

import org.pikematch.lexer.PatternLexer;
import org.pikematch.lexer.TokenizedPattern;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds every non-overlapping match of a pattern in a subject.
 * <p>
 * Start offsets are tried from 0 up to and including the subject length, so
 * a pattern that can match the empty string is also tried at the end. After a
 * match the scan resumes at its end, or one past its start if it was empty.
 * A pattern starting with {@code ^} is tried at offset 0 only.
 */
public final class PatternScanner {

    private PatternScanner() {
    }

    /**
     * Start offsets of all matches, strict syntax, default budget.
     *
     * @param pattern the pattern
     * @param text    the subject
     * @return increasing match offsets, empty if nothing matched
     * @throws PatternSyntaxError           if the pattern is malformed
     * @throws MatchBudgetExceededException if the default budget runs out
     */
    public static List<Integer> match(String pattern, String text) {
        return match(pattern, text, PatternOptions.strict(), MatchBudget.defaults());
    }

    public static List<Integer> match(String pattern, String text, PatternOptions options, MatchBudget budget) {
        List<Integer> offsets = new ArrayList<>();
        for (MatchSpan span : findAll(pattern, text, options, budget)) {
            offsets.add(span.offset());
        }
        return offsets;
    }

    public static List<MatchSpan> findAll(String pattern, String text) {
        return findAll(pattern, text, PatternOptions.strict(), MatchBudget.defaults());
    }

    /**
     * All matches with their extents.
     *
     * @param pattern the pattern
     * @param text    the subject
     * @param options lexer options
     * @param budget  limits for this scan
     * @return matches in increasing, non-overlapping order
     */
    public static List<MatchSpan> findAll(String pattern, String text, PatternOptions options, MatchBudget budget) {
        TokenizedPattern tokenized = PatternLexer.tokenize(pattern, options);
        BacktrackMatcher matcher = new BacktrackMatcher(tokenized, text, budget);
        List<MatchSpan> spans = new ArrayList<>();

        if (tokenized.anchoredStart()) {
            int end = matcher.matchAt(0);
            if (end != BacktrackMatcher.NO_MATCH) {
                addMatch(spans, new MatchSpan(0, end), options);
            }
            return spans;
        }

        int offset = 0;
        final int length = text.length();
        while (offset <= length) {
            int end = matcher.matchAt(offset);
            if (end == BacktrackMatcher.NO_MATCH) {
                offset++;
                continue;
            }
            addMatch(spans, new MatchSpan(offset, end - offset), options);
            // Never step back into the match, always move forward
            offset = Math.max(end, offset + 1);
        }

        if (options.debugEnabled()) {
            System.err.println("scan: m/" + pattern + "/" + options.toFlagString() + " took "
                    + matcher.getSteps() + " steps");
        }
        return spans;
    }

    private static void addMatch(List<MatchSpan> spans, MatchSpan span, PatternOptions options) {
        if (options.debugEnabled()) {
            System.err.println("scan: match at " + span.offset() + " length " + span.length());
        }
        spans.add(span);
    }
}
