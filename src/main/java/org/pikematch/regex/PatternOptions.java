package org.pikematch.regex;

/**
 * @param lenient      degrade malformed constructs to literal characters instead of
 *                     throwing {@link PatternSyntaxError}
 * @param debugEnabled trace tokenizing and every reported match to standard error
 */
public record PatternOptions(boolean lenient, boolean debugEnabled) {

    public static PatternOptions strict() {
        return new PatternOptions(false, false);
    }

    public static PatternOptions lenientMode() {
        return new PatternOptions(true, false);
    }

    public String toFlagString() {
        StringBuilder flagString = new StringBuilder();

        if (lenient) flagString.append('l');
        if (debugEnabled) flagString.append('d');

        return flagString.toString();
    }
}
