package org.pikematch.regex;

import java.io.Serial;

/**
 * Thrown for a malformed pattern when the lexer runs in strict mode.
 * The message marks the offending position:
 * <pre>
 *   Unmatched [ in regex; marked by &lt;-- HERE in m/ab[ &lt;-- HERE cd/
 * </pre>
 */
public class PatternSyntaxError extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final String pattern;
    private final int offset;
    private final String reason;

    public PatternSyntaxError(String pattern, int offset, String reason) {
        super(formatMessage(pattern, offset, reason));
        this.pattern = pattern;
        this.offset = Math.min(offset, pattern.length());
        this.reason = reason;
    }

    private static String formatMessage(String pattern, int offset, String reason) {
        if (offset > pattern.length()) {
            offset = pattern.length();
        }
        String before = pattern.substring(0, offset);
        String after = pattern.substring(offset);

        // When marker is at the end, no space before <-- HERE
        String marker = after.isEmpty() ? " <-- HERE" : " <-- HERE ";
        return reason + " in regex; marked by <-- HERE in m/" + before + marker + after + "/";
    }

    public String getPattern() {
        return pattern;
    }

    /**
     * Position just past the offending construct.
     */
    public int getOffset() {
        return offset;
    }

    /**
     * The bare reason, without the marked-up pattern.
     */
    public String getReason() {
        return reason;
    }
}
