package org.pikematch;

import java.io.PrintStream;

/**
 * The ArgumentParser class is responsible for parsing command-line arguments
 * and configuring the MatcherOptions accordingly. It handles the switches that
 * select the input, the output format, the pattern dialect and the match
 * budget.
 * <p>
 * Invalid arguments raise {@link IllegalArgumentException}; the caller prints
 * the message and exits with a usage error.
 */
public class ArgumentParser {

    /**
     * Parses the command-line arguments and returns a MatcherOptions object
     * configured based on the provided arguments.
     *
     * @param args The command-line arguments to parse.
     * @return A MatcherOptions object with settings derived from the arguments.
     * @throws IllegalArgumentException if a switch is unknown, incomplete or conflicting
     */
    public static MatcherOptions parseArguments(String[] args) {
        MatcherOptions parsedArgs = new MatcherOptions();

        processArgs(args, parsedArgs);

        if (!parsedArgs.helpRequested && !parsedArgs.versionRequested) {
            validateInputSource(parsedArgs);
        }
        return parsedArgs;
    }

    /**
     * Processes the command-line arguments, distinguishing between switch and non-switch arguments.
     *
     * @param args       The command-line arguments.
     * @param parsedArgs The MatcherOptions object to configure.
     */
    private static void processArgs(String[] args, MatcherOptions parsedArgs) {
        boolean readingFiles = false; // Set once "--" has been seen

        for (int i = 0; i < args.length; i++) {
            if (readingFiles || !args[i].startsWith("-") || args[i].equals("-")) {
                processNonSwitchArgument(args, parsedArgs, i);
            } else {
                String arg = args[i];

                if (arg.equals("--")) {
                    // "--" indicates the end of switch arguments; subsequent arguments are treated as file names
                    readingFiles = true;
                    continue;
                }

                if (!arg.startsWith("--")) {
                    // Process clustered single-character switches (e.g., -je)
                    i = processClusteredSwitches(args, parsedArgs, arg, i);
                } else {
                    // Process long-form switches (e.g., --json, --step-limit 100)
                    i = processLongSwitches(args, parsedArgs, arg, i);
                }
            }
        }
    }

    /**
     * Processes non-switch arguments: the one input file name.
     *
     * @param args       The command-line arguments.
     * @param parsedArgs The MatcherOptions object to configure.
     * @param index      The current index in the arguments array.
     */
    private static void processNonSwitchArgument(String[] args, MatcherOptions parsedArgs, int index) {
        if (parsedArgs.fileName != null) {
            throw new IllegalArgumentException("Unexpected argument: " + args[index]);
        }
        parsedArgs.fileName = args[index];
    }

    /**
     * Processes clustered single-character switches (e.g., -j, -l, -e pattern).
     *
     * @param args       The command-line arguments.
     * @param parsedArgs The MatcherOptions object to configure.
     * @param arg        The current argument being processed.
     * @param index      The current index in the arguments array.
     * @return The updated index after processing the switches.
     */
    private static int processClusteredSwitches(String[] args, MatcherOptions parsedArgs, String arg, int index) {
        for (int j = 1; j < arg.length(); j++) {
            char switchChar = arg.charAt(j);

            switch (switchChar) {
                case 'e':
                    // Pattern given inline; the rest of the cluster or the next argument
                    return handleInlinePattern(args, parsedArgs, index, j, arg);
                case 'j':
                    validateExclusiveOptions(parsedArgs, "json");
                    parsedArgs.json = true;
                    break;
                case 'l':
                    parsedArgs.lenient = true;
                    break;
                case 'd':
                    parsedArgs.debugEnabled = true;
                    break;
                case 'h':
                case '?':
                    parsedArgs.helpRequested = true;
                    break;
                default:
                    throw new IllegalArgumentException("Unrecognized switch: -" + switchChar);
            }
        }
        return index;
    }

    /**
     * Handles the pattern specified with the -e switch.
     *
     * @param args       The command-line arguments.
     * @param parsedArgs The MatcherOptions object to configure.
     * @param index      The current index in the arguments array.
     * @param j          The current position in the clustered switch string.
     * @param arg        The current argument being processed.
     * @return The updated index after processing the pattern.
     */
    private static int handleInlinePattern(String[] args, MatcherOptions parsedArgs, int index, int j, String arg) {
        if (j < arg.length() - 1) {
            // -ePATTERN
            parsedArgs.pattern = arg.substring(j + 1);
        } else if (index + 1 < args.length) {
            // The next argument is the pattern, even if it starts with a dash
            parsedArgs.pattern = args[++index];
        } else {
            throw new IllegalArgumentException("No pattern specified for -e.");
        }
        return index;
    }

    /**
     * Processes long-form switches (e.g., --debug, --tokenize).
     * Switches that take a value accept both {@code --name value} and {@code --name=value}.
     *
     * @param args       The command-line arguments.
     * @param parsedArgs The MatcherOptions object to configure.
     * @param arg        The current argument being processed.
     * @param index      The current index in the arguments array.
     * @return The updated index after processing the long-form switch.
     */
    private static int processLongSwitches(String[] args, MatcherOptions parsedArgs, String arg, int index) {
        String name = arg;
        String inlineValue = null;
        int equalsIndex = arg.indexOf('=');
        if (equalsIndex != -1) {
            name = arg.substring(0, equalsIndex);
            inlineValue = arg.substring(equalsIndex + 1);
        }

        switch (name) {
            case "--json":
                validateExclusiveOptions(parsedArgs, "json");
                parsedArgs.json = true;
                break;
            case "--pretty":
                parsedArgs.pretty = true;
                break;
            case "--tokenize":
                // Print the token list and stop
                validateExclusiveOptions(parsedArgs, "tokenize");
                parsedArgs.tokenizeOnly = true;
                break;
            case "--debug":
                parsedArgs.debugEnabled = true;
                break;
            case "--lenient":
                parsedArgs.lenient = true;
                break;
            case "--strict":
                parsedArgs.lenient = false;
                break;
            case "--step-limit": {
                String value = inlineValue != null ? inlineValue : requireValue(args, index++, name);
                parsedArgs.stepLimit = parsePositiveLong(value, "step limit");
                break;
            }
            case "--depth-limit": {
                String value = inlineValue != null ? inlineValue : requireValue(args, index++, name);
                parsedArgs.depthLimit = (int) Math.min(Integer.MAX_VALUE, parsePositiveLong(value, "depth limit"));
                break;
            }
            case "--config":
                parsedArgs.configFile = inlineValue != null ? inlineValue : requireValue(args, index++, name);
                break;
            case "--help":
                parsedArgs.helpRequested = true;
                break;
            case "--version":
                parsedArgs.versionRequested = true;
                break;
            default:
                throw new IllegalArgumentException("Unrecognized switch: " + arg);
        }
        return index;
    }

    private static String requireValue(String[] args, int index, String name) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException("No value specified for " + name + ".");
        }
        return args[index + 1];
    }

    private static long parsePositiveLong(String value, String what) {
        try {
            long parsed = Long.parseLong(value.trim());
            if (parsed <= 0) {
                throw new IllegalArgumentException("Invalid " + what + ": " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + what + ": " + value, e);
        }
    }

    /**
     * Validates that exclusive options are not combined.
     *
     * @param parsedArgs The MatcherOptions object to check.
     * @param option     The option being validated.
     */
    private static void validateExclusiveOptions(MatcherOptions parsedArgs, String option) {
        boolean conflict = option.equals("json") ? parsedArgs.tokenizeOnly : Boolean.TRUE.equals(parsedArgs.json);
        if (conflict) {
            throw new IllegalArgumentException("--" + option + " cannot be combined with other exclusive options");
        }
    }

    /**
     * Checks that the arguments name somewhere to read the pattern and subject from.
     *
     * @param parsedArgs The MatcherOptions object to check.
     */
    private static void validateInputSource(MatcherOptions parsedArgs) {
        if (parsedArgs.fileName == null && !(parsedArgs.tokenizeOnly && parsedArgs.pattern != null)) {
            throw new IllegalArgumentException("Usage: " + Configuration.programName + " [options] filename");
        }
    }

    /**
     * Prints the help message detailing the usage of the program and its options.
     *
     * @param out where to print
     */
    public static void printHelp(PrintStream out) {
        out.println("Usage: java -jar target/pikematch-" + Configuration.jarVersion + ".jar [options] filename");
        out.println();
        out.println("The file holds the pattern on its first line and the subject on its second.");
        out.println();
        out.println("  -e pattern            take the pattern from the command line; the file holds only the subject");
        out.println("  -j, --json            print the result as JSON");
        out.println("  --pretty              indent JSON output");
        out.println("  -l, --lenient         read malformed pattern constructs as literal characters");
        out.println("  --strict              reject malformed patterns (default)");
        out.println("  --step-limit N        give up after N matcher steps");
        out.println("  --depth-limit N       give up when matcher recursion gets deeper than N");
        out.println("  --config file.yml     read defaults from a YAML file");
        out.println("  --tokenize            print the pattern tokens and stop");
        out.println("  -d, --debug           trace tokenizing and matching to standard error");
        out.println("  --version             print the version and stop");
        out.println("  -h, --help            displays this help message");
    }

    /**
     * MatcherOptions holds the settings given on the command line.
     * <p>
     * The boxed fields stay {@code null} when the switch was not given, so a
     * YAML configuration file can supply them; see {@link EngineSettings#merge}.
     * <p>
     * Fields:
     * - debugEnabled: trace tokenizing and matching to standard error.
     * - tokenizeOnly: print the token list and stop.
     * - helpRequested / versionRequested: print and stop.
     * - fileName: the input file.
     * - pattern: pattern given with -e; the file then holds only the subject.
     * - configFile: YAML configuration file.
     * - lenient, json, pretty, stepLimit, depthLimit: overrides of the configured values.
     */
    public static class MatcherOptions {
        public boolean debugEnabled = false;
        public boolean tokenizeOnly = false;
        public boolean helpRequested = false;
        public boolean versionRequested = false;
        public String fileName = null;
        public String pattern = null;
        public String configFile = null;
        public Boolean lenient = null;
        public Boolean json = null;
        public Boolean pretty = null;
        public Long stepLimit = null;
        public Integer depthLimit = null;

        @Override
        public String toString() {
            return "MatcherOptions{\n" +
                    "    debugEnabled=" + debugEnabled + ",\n" +
                    "    tokenizeOnly=" + tokenizeOnly + ",\n" +
                    "    helpRequested=" + helpRequested + ",\n" +
                    "    versionRequested=" + versionRequested + ",\n" +
                    "    fileName='" + fileName + "',\n" +
                    "    pattern='" + pattern + "',\n" +
                    "    configFile='" + configFile + "',\n" +
                    "    lenient=" + lenient + ",\n" +
                    "    json=" + json + ",\n" +
                    "    pretty=" + pretty + ",\n" +
                    "    stepLimit=" + stepLimit + ",\n" +
                    "    depthLimit=" + depthLimit + "\n" +
                    "}";
        }
    }
}
