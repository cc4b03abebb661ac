package org.pikematch;

import org.pikematch.lexer.PatternLexer;
import org.pikematch.lexer.PatternToken;
import org.pikematch.lexer.TokenizedPattern;
import org.pikematch.regex.MatchBudgetExceededException;
import org.pikematch.regex.MatchSpan;
import org.pikematch.regex.PatternOptions;
import org.pikematch.regex.PatternScanner;
import org.pikematch.regex.PatternSyntaxError;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command-line entry point: reads the pattern and the subject, runs the scan
 * and prints the matches.
 * <p>
 * Exit status is {@link Configuration#EXIT_OK} whether or not anything
 * matched, {@link Configuration#EXIT_USAGE} for bad arguments, configuration
 * or input, and {@link Configuration#EXIT_PATTERN} for a malformed pattern or
 * an exhausted match budget.
 */
public class Main {

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    public static int run(String[] args, PrintStream out, PrintStream err) {
        ArgumentParser.MatcherOptions options;
        try {
            options = ArgumentParser.parseArguments(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage() + "  (-h will show valid options)");
            return Configuration.EXIT_USAGE;
        }

        if (options.helpRequested) {
            ArgumentParser.printHelp(out);
            return Configuration.EXIT_OK;
        }
        if (options.versionRequested) {
            out.println(Configuration.getVersionString());
            return Configuration.EXIT_OK;
        }
        if (options.debugEnabled) {
            err.println(options);
        }

        EngineSettings settings;
        try {
            EngineSettings base = options.configFile != null
                    ? EngineSettings.load(Paths.get(options.configFile))
                    : EngineSettings.defaults();
            settings = base.merge(options);
        } catch (ConfigurationException e) {
            err.println(e.getMessage());
            return Configuration.EXIT_USAGE;
        }
        if (options.debugEnabled) {
            err.println(settings);
        }
        PatternOptions patternOptions = settings.toPatternOptions(options.debugEnabled);

        String pattern;
        String subject = null;
        try {
            if (options.pattern != null) {
                pattern = options.pattern;
                if (options.fileName != null) {
                    subject = SubjectFileReader.readSubject(options.fileName);
                }
            } else {
                SubjectFileReader.InputLines lines = SubjectFileReader.readPatternAndSubject(options.fileName);
                pattern = lines.pattern();
                subject = lines.subject();
            }
        } catch (IOException e) {
            err.println(e.getMessage());
            return Configuration.EXIT_USAGE;
        }

        try {
            if (options.tokenizeOnly) {
                printTokens(PatternLexer.tokenize(pattern, patternOptions), out);
                return Configuration.EXIT_OK;
            }

            List<MatchSpan> spans = PatternScanner.findAll(pattern, subject, patternOptions, settings.toBudget());
            MatchReport report = new MatchReport(pattern, subject, spans);
            if (settings.isJsonOutput()) {
                out.println(report.toJson(settings.pretty()));
            } else {
                out.print(report.toText());
            }
            return Configuration.EXIT_OK;
        } catch (PatternSyntaxError | MatchBudgetExceededException e) {
            err.println(e.getMessage());
            return Configuration.EXIT_PATTERN;
        }
    }

    private static void printTokens(TokenizedPattern tokenized, PrintStream out) {
        if (tokenized.anchoredStart()) {
            printTokenLine(out, "ANCHOR", "", "^");
        }
        for (PatternToken token : tokenized.tokens()) {
            printTokenLine(out, token.type.name(), token.quantifier.name(), token.text);
        }
        if (tokenized.anchoredEnd()) {
            printTokenLine(out, "ANCHOR", "", "$");
        }
    }

    private static void printTokenLine(PrintStream out, String type, String quantifier, String text) {
        out.println(String.format("%-10s %-8s %s", type, quantifier, text));
    }
}
