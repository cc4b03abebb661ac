package org.pikematch.regex;

import org.pikematch.lexer.PatternLexer;
import org.pikematch.lexer.PatternToken;
import org.pikematch.lexer.TokenizedPattern;

/**
 * Recursive backtracking matcher over a {@link TokenizedPattern}.
 * <p>
 * {@link #matchHere(int, int, int)} answers whether the tokens from
 * {@code tokenIndex} on match a prefix of the subject starting at
 * {@code position}, and returns the end of that prefix. The first successful
 * path wins, so the quantifier handlers fix which prefix is reported:
 * <pre>
 *   c*   longest run first, then one character shorter, down to zero
 *   c+   one mandatory occurrence, then as c*
 *   c?   zero occurrences first, then one
 * </pre>
 * A matcher instance serves one scan of one subject; its step counter is
 * shared by every start offset tried during that scan.
 * <p>
 * Each matcher frame is a Java call. A thread stack that runs out before the
 * depth limit is reported as the depth limit exceeded at the deepest frame
 * reached.
 */
public class BacktrackMatcher {

    public static final int NO_MATCH = -1;

    private final TokenizedPattern pattern;
    private final String text;
    private final MatchBudget budget;
    private long steps;
    private int deepest;

    public BacktrackMatcher(TokenizedPattern pattern, String text, MatchBudget budget) {
        this.pattern = pattern;
        this.text = text;
        this.budget = budget;
    }

    /**
     * Tests whether {@code pattern} matches a prefix of {@code text}.
     * A leading {@code ^} changes nothing here since the prefix already starts at 0.
     *
     * @param pattern the pattern, in strict syntax
     * @param text    the subject
     * @return true if some prefix of {@code text}, possibly empty, matches
     * @throws PatternSyntaxError if the pattern is malformed
     */
    public static boolean matchHere(String pattern, String text) {
        TokenizedPattern tokenized = PatternLexer.tokenize(pattern, PatternOptions.strict());
        return new BacktrackMatcher(tokenized, text, MatchBudget.unlimited()).matchAt(0) != NO_MATCH;
    }

    /**
     * Matches the whole token list at one subject position.
     *
     * @param position start position in the subject
     * @return end position of the match, or {@link #NO_MATCH}
     */
    public int matchAt(int position) {
        try {
            return matchHere(0, position, 0);
        } catch (StackOverflowError e) {
            throw new MatchBudgetExceededException("depth", deepest, pattern.source(), e);
        }
    }

    public long getSteps() {
        return steps;
    }

    int matchHere(int tokenIndex, int position, int depth) {
        step();
        deepest = Math.max(deepest, depth);
        if (depth > budget.depthLimit()) {
            throw new MatchBudgetExceededException("depth", budget.depthLimit(), pattern.source());
        }

        if (tokenIndex == pattern.size()) {
            // A trailing $ only lets the match end at the end of the subject
            if (pattern.anchoredEnd() && position != text.length()) {
                return NO_MATCH;
            }
            return position;
        }

        PatternToken token = pattern.get(tokenIndex);
        switch (token.quantifier) {
            case QUESTION:
                return matchQuestion(token, tokenIndex + 1, position, depth);
            case STAR:
                return matchStar(token, tokenIndex + 1, position, depth);
            case PLUS:
                return matchPlus(token, tokenIndex + 1, position, depth);
            default:
                if (matchesOne(token, position)) {
                    return matchHere(tokenIndex + 1, position + 1, depth + 1);
                }
                return NO_MATCH;
        }
    }

    private int matchStar(PatternToken token, int next, int position, int depth) {
        int run = position;
        while (matchesOne(token, run)) {
            run++;
        }
        for (int end = run; end >= position; end--) {
            int result = matchHere(next, end, depth + 1);
            if (result != NO_MATCH) {
                return result;
            }
        }
        return NO_MATCH;
    }

    private int matchPlus(PatternToken token, int next, int position, int depth) {
        if (!matchesOne(token, position)) {
            return NO_MATCH;
        }
        return matchStar(token, next, position + 1, depth);
    }

    private int matchQuestion(PatternToken token, int next, int position, int depth) {
        int result = matchHere(next, position, depth + 1);
        if (result != NO_MATCH) {
            return result;
        }
        if (matchesOne(token, position)) {
            return matchHere(next, position + 1, depth + 1);
        }
        return NO_MATCH;
    }

    private boolean matchesOne(PatternToken token, int position) {
        step();
        return position < text.length() && token.matches(text.charAt(position));
    }

    private void step() {
        if (++steps > budget.stepLimit()) {
            throw new MatchBudgetExceededException("step", budget.stepLimit(), pattern.source());
        }
    }
}
