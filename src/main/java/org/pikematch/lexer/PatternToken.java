package org.pikematch.lexer;

import org.pikematch.regex.CharacterClass;

/**
 * The PatternToken class represents one atom of a pattern together with the
 * quantifier that follows it.
 *
 * <p>An atom always consumes exactly one character of the subject per
 * repetition: a literal, an escaped literal, the {@code .} wildcard, or a
 * bracket class. The quantifier says how many repetitions are allowed.</p>
 */
public class PatternToken {
    public final AtomType type;
    // The character for LITERAL and ESCAPED atoms
    public final char literal;
    // Only set for CHAR_CLASS atoms
    public final CharacterClass charClass;
    public final Quantifier quantifier;
    // Pattern text of this token, quantifier included
    public final String text;
    // Position of the token in the pattern
    public final int offset;

    PatternToken(AtomType type, char literal, CharacterClass charClass, Quantifier quantifier,
                 String text, int offset) {
        this.type = type;
        this.literal = literal;
        this.charClass = charClass;
        this.quantifier = quantifier;
        this.text = text;
        this.offset = offset;
    }

    /**
     * Tests the atom against one subject character.
     *
     * @param c the subject character
     * @return true if one repetition of the atom consumes {@code c}
     */
    public boolean matches(char c) {
        switch (type) {
            case ANY:
                return true;
            case CHAR_CLASS:
                return charClass.matches(c);
            default:
                return literal == c;
        }
    }

    /**
     * Returns a string representation of the token.
     *
     * @return a string representation of the token
     */
    @Override
    public String toString() {
        return "PatternToken{" + "type=" + type + ", text='" + text + '\'' + ", quantifier=" + quantifier
                + ", offset=" + offset + '}';
    }
}
