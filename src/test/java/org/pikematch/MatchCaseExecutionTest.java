package org.pikematch;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs every two-line input under {@code src/test/resources/cases} through the
 * command-line entry point and compares standard output with the
 * {@code .expected} file next to it.
 */
public class MatchCaseExecutionTest {

    static Stream<String> provideMatchCases() throws URISyntaxException, IOException {
        URI uri = MatchCaseExecutionTest.class.getResource("/cases").toURI();
        Path casesDir = Paths.get(uri);
        return Files.list(casesDir)
                .filter(path -> path.toString().endsWith(".txt"))
                .map(path -> path.getFileName().toString())
                .sorted();
    }

    @ParameterizedTest(name = "Match case: {0}")
    @MethodSource("provideMatchCases")
    void testUsingResourceFile(String filename) throws Exception {
        Path casesDir = Paths.get(MatchCaseExecutionTest.class.getResource("/cases").toURI());
        Path input = casesDir.resolve(filename);
        Path expectedFile = casesDir.resolve(filename.replaceAll("\\.txt$", ".expected"));
        assertTrue(Files.exists(expectedFile), "Missing expected output for " + filename);

        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        ByteArrayOutputStream errorStream = new ByteArrayOutputStream();
        int status = Main.run(new String[]{input.toString()},
                new PrintStream(outputStream, true, StandardCharsets.UTF_8),
                new PrintStream(errorStream, true, StandardCharsets.UTF_8));

        assertEquals(Configuration.EXIT_OK, status,
                "Unexpected exit status for " + filename + ": " + errorStream.toString(StandardCharsets.UTF_8));
        String expected = Files.readString(expectedFile, StandardCharsets.UTF_8);
        assertEquals(expected, outputStream.toString(StandardCharsets.UTF_8), "Output of " + filename);
    }
}
