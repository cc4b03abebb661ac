package org.pikematch.lexer;

import org.pikematch.regex.CharacterClass;
import org.pikematch.regex.PatternOptions;
import org.pikematch.regex.PatternSyntaxError;

import java.util.ArrayList;
import java.util.List;

/**
 * The PatternLexer class converts a pattern string into a sequence of
 * {@link PatternToken}s, one per atom, each carrying the quantifier written
 * after it.
 * <p>
 * Grammar handled here:
 * <pre>
 *   pattern    := '^'? token* '$'?
 *   token      := atom quantifier?
 *   atom       := '.' | '\' char | '[' class ']' | char
 *   quantifier := '*' | '+' | '?'
 * </pre>
 * {@code ^} is an anchor only as the first character of the pattern and
 * {@code $} only as the last one; anywhere else both are literals.
 * <p>
 * In strict mode malformed input raises {@link PatternSyntaxError}. In lenient
 * mode the offending character is taken as a literal and lexing goes on.
 */
public class PatternLexer {
    private final String input;
    private final int length;
    private final PatternOptions options;
    // Current position in the input
    private int position;

    public PatternLexer(String input, PatternOptions options) {
        this.input = input;
        this.length = input.length();
        this.options = options;
        this.position = 0;
    }

    public static TokenizedPattern tokenize(String pattern, PatternOptions options) {
        return new PatternLexer(pattern, options).tokenize();
    }

    public TokenizedPattern tokenize() {
        List<PatternToken> tokens = new ArrayList<>();
        boolean anchoredStart = false;
        boolean anchoredEnd = false;

        if (length > 0 && input.charAt(0) == '^') {
            anchoredStart = true;
            position = 1;
        }

        while (position < length) {
            if (input.charAt(position) == '$' && position == length - 1) {
                anchoredEnd = true;
                position++;
                break;
            }
            PatternToken token = nextToken(tokens);
            if (options.debugEnabled()) {
                System.err.println("tokenize: " + token);
            }
            tokens.add(token);
        }

        return new TokenizedPattern(input, anchoredStart, anchoredEnd, tokens);
    }

    private PatternToken nextToken(List<PatternToken> previous) {
        final int start = position;
        final char c = input.charAt(position);

        AtomType type;
        char literal = c;
        CharacterClass charClass = null;

        switch (c) {
            case '*':
            case '+':
            case '?':
                // A quantifier here has no atom in front of it
                if (!options.lenient()) {
                    boolean afterQuantifier = !previous.isEmpty()
                            && previous.get(previous.size() - 1).quantifier != Quantifier.ONE;
                    throw new PatternSyntaxError(input, position + 1,
                            afterQuantifier ? "Nested quantifiers" : "Quantifier follows nothing");
                }
                type = AtomType.LITERAL;
                position++;
                break;

            case '\\':
                if (position + 1 >= length) {
                    if (!options.lenient()) {
                        throw new PatternSyntaxError(input, position + 1, "Trailing \\");
                    }
                    type = AtomType.LITERAL;
                    position++;
                } else {
                    type = AtomType.ESCAPED;
                    literal = input.charAt(position + 1);
                    position += 2;
                }
                break;

            case '[':
                int end = CharacterClass.findClassEnd(input, position);
                if (end < 0) {
                    if (!options.lenient()) {
                        throw new PatternSyntaxError(input, position + 1, "Unmatched [");
                    }
                    type = AtomType.LITERAL;
                    position++;
                } else {
                    type = AtomType.CHAR_CLASS;
                    charClass = CharacterClass.parse(input, position, end);
                    position = end + 1;
                }
                break;

            case '.':
                type = AtomType.ANY;
                position++;
                break;

            default:
                type = AtomType.LITERAL;
                position++;
                break;
        }

        Quantifier quantifier = Quantifier.ONE;
        if (position < length) {
            Quantifier q = Quantifier.fromChar(input.charAt(position));
            if (q != null) {
                quantifier = q;
                position++;
            }
        }

        return new PatternToken(type, literal, charClass, quantifier, input.substring(start, position), start);
    }
}
