package org.pikematch.regex;

/**
 * A bracket expression such as {@code [a-z_]} or {@code [^0-9]}.
 *
 * <p>Syntax accepted between the brackets:</p>
 * <pre>
 *   ^        negates the class, only as the first character
 *   x        literal character
 *   a-z      ascending range, inclusive by char code
 *   \x       literal x, so ] - ^ \ can be written
 *   []  [^]  empty class; [] matches nothing, [^] matches any character
 * </pre>
 * A range whose end sorts below its start, or whose end would be {@code ]} or
 * {@code \}, is read as separate literals instead.
 */
public class CharacterClass {

    private final boolean negated;
    // Parallel arrays; a literal is stored as a one-character range
    private final char[] lows;
    private final char[] highs;
    private final String source;

    private CharacterClass(boolean negated, char[] lows, char[] highs, String source) {
        this.negated = negated;
        this.lows = lows;
        this.highs = highs;
        this.source = source;
    }

    /**
     * Finds the {@code ]} that closes the class opened at {@code offset}.
     *
     * @param s      the pattern
     * @param offset position of the opening {@code [}
     * @return position of the closing {@code ]}, or -1 if the class is unterminated
     */
    public static int findClassEnd(String s, int offset) {
        final int length = s.length();
        int i = offset + 1;
        if (i < length && s.charAt(i) == '^') {
            i++;
        }
        while (i < length) {
            char c = s.charAt(i);
            if (c == ']') {
                return i;
            }
            if (c == '\\') {
                if (i + 1 >= length) {
                    return -1;
                }
                i += 2;
            } else {
                i++;
            }
        }
        return -1;
    }

    /**
     * Parses the bracket expression between {@code offset} and {@code end}.
     *
     * @param s      the pattern
     * @param offset position of the opening {@code [}
     * @param end    position of the closing {@code ]}, as returned by {@link #findClassEnd}
     * @return the parsed class
     */
    public static CharacterClass parse(String s, int offset, int end) {
        int i = offset + 1;
        boolean negated = false;
        if (i < end && s.charAt(i) == '^') {
            negated = true;
            i++;
        }

        StringBuilder lows = new StringBuilder();
        StringBuilder highs = new StringBuilder();
        while (i < end) {
            char c = s.charAt(i);
            if (c == '\\') {
                // Escaped member, never the start of a range
                char escaped = s.charAt(i + 1);
                lows.append(escaped);
                highs.append(escaped);
                i += 2;
                continue;
            }
            if (i + 2 < end && s.charAt(i + 1) == '-' && isRangeEnd(s.charAt(i + 2)) && s.charAt(i + 2) >= c) {
                lows.append(c);
                highs.append(s.charAt(i + 2));
                i += 3;
            } else {
                lows.append(c);
                highs.append(c);
                i++;
            }
        }
        return new CharacterClass(negated, lows.toString().toCharArray(), highs.toString().toCharArray(),
                s.substring(offset, end + 1));
    }

    private static boolean isRangeEnd(char c) {
        return c != ']' && c != '\\';
    }

    /**
     * Tests one subject character for membership.
     *
     * @param c the subject character
     * @return true if {@code c} is in the class, or not in it for a negated class
     */
    public boolean matches(char c) {
        boolean member = false;
        for (int i = 0; i < lows.length; i++) {
            if (c >= lows[i] && c <= highs[i]) {
                member = true;
                break;
            }
        }
        return member != negated;
    }

    public boolean isNegated() {
        return negated;
    }

    /**
     * Number of members, counting each range once.
     */
    public int itemCount() {
        return lows.length;
    }

    /**
     * Number of pattern characters the class spans, brackets included.
     */
    public int span() {
        return source.length();
    }

    @Override
    public String toString() {
        return source;
    }
}
