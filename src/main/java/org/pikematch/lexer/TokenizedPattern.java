package org.pikematch.lexer;

import java.util.List;

/**
 * Output of {@link PatternLexer#tokenize()}: the anchors and the atom tokens
 * between them. Built for one matching call and discarded afterwards.
 *
 * @param source        the pattern as written
 * @param anchoredStart leading {@code ^}, the match may only start at offset 0
 * @param anchoredEnd   trailing {@code $}, the match must end at the end of the subject
 * @param tokens        the atoms in pattern order
 */
public record TokenizedPattern(String source, boolean anchoredStart, boolean anchoredEnd,
                               List<PatternToken> tokens) {

    public TokenizedPattern {
        tokens = List.copyOf(tokens);
    }

    public int size() {
        return tokens.size();
    }

    public PatternToken get(int index) {
        return tokens.get(index);
    }
}
