package org.pikematch.regex;

import java.io.Serial;

/**
 * Thrown when a scan runs past the step or depth limit of its {@link MatchBudget}.
 */
public class MatchBudgetExceededException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final String limitName;
    private final long limit;

    public MatchBudgetExceededException(String limitName, long limit, String pattern) {
        super("Match " + limitName + " limit of " + limit + " exceeded in regex m/" + pattern + "/");
        this.limitName = limitName;
        this.limit = limit;
    }

    public MatchBudgetExceededException(String limitName, long limit, String pattern, Throwable cause) {
        super("Match " + limitName + " limit of " + limit + " exceeded in regex m/" + pattern + "/", cause);
        this.limitName = limitName;
        this.limit = limit;
    }

    /**
     * Either {@code "step"} or {@code "depth"}.
     */
    public String getLimitName() {
        return limitName;
    }

    public long getLimit() {
        return limit;
    }
}
