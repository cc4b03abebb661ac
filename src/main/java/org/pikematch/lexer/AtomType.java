package org.pikematch.lexer;

/**
 * The kinds of atom a pattern token can hold.
 */
public enum AtomType {
    LITERAL,     // plain character
    ESCAPED,     // \x, always the literal x
    ANY,         // .
    CHAR_CLASS   // [...] or [^...]
}
