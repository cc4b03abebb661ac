package org.pikematch.regex;

/**
 * One reported match.
 *
 * @param offset start position in the subject
 * @param length number of subject characters matched, possibly zero
 */
public record MatchSpan(int offset, int length) {

    public int end() {
        return offset + length;
    }

    public String matchedText(String subject) {
        return subject.substring(offset, end());
    }
}
