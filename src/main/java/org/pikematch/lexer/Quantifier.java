package org.pikematch.lexer;

/**
 * Repetition attached to a single atom. {@link #ONE} is the implicit
 * "exactly once" of an atom written without a quantifier.
 */
public enum Quantifier {
    ONE,
    STAR,
    PLUS,
    QUESTION;

    /**
     * Maps a pattern character to its quantifier.
     *
     * @param c the pattern character
     * @return the quantifier, or {@code null} if {@code c} is not one
     */
    public static Quantifier fromChar(char c) {
        switch (c) {
            case '*':
                return STAR;
            case '+':
                return PLUS;
            case '?':
                return QUESTION;
            default:
                return null;
        }
    }
}
