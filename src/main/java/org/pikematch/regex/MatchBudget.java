package org.pikematch.regex;

/**
 * Limits for one scan of a subject. Backtracking is exponential in the worst
 * case, so callers that need bounded latency pass a finite budget.
 *
 * @param stepLimit  maximum number of matcher steps (atom tests and matcher entries)
 * @param depthLimit maximum nesting of matcher frames
 */
public record MatchBudget(long stepLimit, int depthLimit) {

    public static final long DEFAULT_STEP_LIMIT = 10_000_000L;
    public static final int DEFAULT_DEPTH_LIMIT = 1_000;

    public MatchBudget {
        if (stepLimit <= 0) {
            throw new IllegalArgumentException("Step limit must be positive: " + stepLimit);
        }
        if (depthLimit <= 0) {
            throw new IllegalArgumentException("Depth limit must be positive: " + depthLimit);
        }
    }

    public static MatchBudget defaults() {
        return new MatchBudget(DEFAULT_STEP_LIMIT, DEFAULT_DEPTH_LIMIT);
    }

    public static MatchBudget unlimited() {
        return new MatchBudget(Long.MAX_VALUE, Integer.MAX_VALUE);
    }
}
