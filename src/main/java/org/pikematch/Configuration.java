package org.pikematch;

import org.pikematch.regex.MatchBudget;

/**
 * Central configuration class for the pikematch command-line tool.
 * Contains the constants that hold when neither a YAML configuration file
 * nor a command-line switch says otherwise.
 * <p>
 * Precedence, lowest first: these constants, the file given with
 * {@code --config}, the command-line switches.
 */
public final class Configuration {

    public static final String jarVersion = "1.0.0";
    public static final String programName = "pikematch";

    public static final long defaultStepLimit = MatchBudget.DEFAULT_STEP_LIMIT;
    public static final int defaultDepthLimit = MatchBudget.DEFAULT_DEPTH_LIMIT;
    public static final boolean defaultLenient = false;
    public static final String defaultOutputFormat = "text";

    // Exit codes
    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_PATTERN = 2;

    // Prevent instantiation
    private Configuration() {
    }

    public static String getVersionString() {
        return programName + " " + jarVersion;
    }
}
