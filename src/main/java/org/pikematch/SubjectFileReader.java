package org.pikematch;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * Reads the pattern and the subject from the input file: the pattern on the
 * first line, the subject on the second. One trailing line terminator,
 * {@code \n} or {@code \r\n}, is stripped from each line; anything after the
 * second line is ignored. The file name {@code -} reads standard input.
 * Input is decoded as UTF-8, with malformed bytes replaced by U+FFFD.
 */
public class SubjectFileReader {

    /**
     * @param pattern the pattern line
     * @param subject the subject line
     */
    public record InputLines(String pattern, String subject) {
    }

    /**
     * Reads the pattern line and the subject line.
     *
     * @param fileName the input file, or {@code -} for standard input
     * @return both lines
     * @throws IOException if the file cannot be opened or a line is missing
     */
    public static InputLines readPatternAndSubject(String fileName) throws IOException {
        String content = readContent(fileName);
        int firstEnd = content.indexOf('\n');
        if (content.isEmpty()) {
            throw new IOException("Error reading the first line from the file");
        }
        if (firstEnd < 0 || firstEnd + 1 >= content.length()) {
            throw new IOException("Error reading the second line from the file");
        }
        String pattern = stripLineEnd(content.substring(0, firstEnd));
        return new InputLines(pattern, firstLine(content.substring(firstEnd + 1)));
    }

    /**
     * Reads only the subject line, for a pattern given on the command line.
     *
     * @param fileName the input file, or {@code -} for standard input
     * @return the first line of the file
     * @throws IOException if the file cannot be opened or is empty
     */
    public static String readSubject(String fileName) throws IOException {
        String content = readContent(fileName);
        if (content.isEmpty()) {
            throw new IOException("Error reading the first line from the file");
        }
        return firstLine(content);
    }

    private static String readContent(String fileName) throws IOException {
        byte[] bytes;
        try {
            if (fileName.equals("-")) {
                InputStream in = System.in;
                bytes = in.readAllBytes();
            } else {
                bytes = Files.readAllBytes(Paths.get(fileName));
            }
        } catch (IOException e) {
            throw new IOException("Error opening file " + fileName, e);
        }
        // Malformed UTF-8 decodes to U+FFFD rather than failing
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static String firstLine(String s) {
        int end = s.indexOf('\n');
        return stripLineEnd(end < 0 ? s : s.substring(0, end));
    }

    private static String stripLineEnd(String line) {
        if (line.endsWith("\r")) {
            return line.substring(0, line.length() - 1);
        }
        return line;
    }
}
