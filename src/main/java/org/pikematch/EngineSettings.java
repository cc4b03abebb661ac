package org.pikematch;

import org.pikematch.regex.MatchBudget;
import org.pikematch.regex.PatternOptions;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Effective settings of one run, built from {@link Configuration} defaults, an
 * optional YAML file and the command-line switches.
 * <p>
 * Recognized YAML keys:
 * <pre>
 * lenient: false      # read malformed pattern constructs as literals
 * stepLimit: 10000000
 * depthLimit: 10000
 * output: text        # or json
 * pretty: false       # indent json output
 * </pre>
 *
 * @param lenient      lenient pattern dialect
 * @param stepLimit    matcher step limit
 * @param depthLimit   matcher depth limit
 * @param outputFormat {@code "text"} or {@code "json"}
 * @param pretty       indent JSON output
 */
public record EngineSettings(boolean lenient, long stepLimit, int depthLimit, String outputFormat,
                             boolean pretty) {

    public static EngineSettings defaults() {
        return new EngineSettings(Configuration.defaultLenient, Configuration.defaultStepLimit,
                Configuration.defaultDepthLimit, Configuration.defaultOutputFormat, false);
    }

    /**
     * Reads settings from a YAML file; keys the file leaves out keep their defaults.
     *
     * @param path the YAML file
     * @return the settings
     * @throws ConfigurationException if the file cannot be read or holds an invalid setting
     */
    public static EngineSettings load(Path path) {
        String content;
        try {
            content = Files.readString(path);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration file: " + path, e);
        }
        return fromYaml(content, path.toString());
    }

    public static EngineSettings fromYaml(String yaml, String sourceName) {
        LoadSettings loadSettings = LoadSettings.builder()
                .setLabel(sourceName)
                .setAllowDuplicateKeys(false)
                .build();
        Object document;
        try {
            document = new Load(loadSettings).loadFromString(yaml);
        } catch (YamlEngineException e) {
            throw new ConfigurationException("Invalid YAML in " + sourceName + ": " + e.getMessage(), e);
        }

        EngineSettings settings = defaults();
        if (document == null) {
            // Empty file
            return settings;
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new ConfigurationException("Configuration in " + sourceName + " must be a mapping");
        }

        boolean lenient = settings.lenient;
        long stepLimit = settings.stepLimit;
        int depthLimit = settings.depthLimit;
        String outputFormat = settings.outputFormat;
        boolean pretty = settings.pretty;

        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            switch (key) {
                case "lenient" -> lenient = requireBoolean(key, value, sourceName);
                case "stepLimit" -> stepLimit = requirePositive(key, value, sourceName);
                case "depthLimit" -> depthLimit = (int) Math.min(Integer.MAX_VALUE,
                        requirePositive(key, value, sourceName));
                case "output" -> outputFormat = requireOutputFormat(key, value, sourceName);
                case "pretty" -> pretty = requireBoolean(key, value, sourceName);
                default -> throw new ConfigurationException(
                        "Unknown configuration key '" + key + "' in " + sourceName);
            }
        }
        return new EngineSettings(lenient, stepLimit, depthLimit, outputFormat, pretty);
    }

    private static boolean requireBoolean(String key, Object value, String sourceName) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new ConfigurationException("'" + key + "' in " + sourceName + " must be true or false, got: " + value);
    }

    private static long requirePositive(String key, Object value, String sourceName) {
        // Whole numbers that fit in a long
        if ((value instanceof Integer || value instanceof Long) && ((Number) value).longValue() > 0) {
            return ((Number) value).longValue();
        }
        throw new ConfigurationException("'" + key + "' in " + sourceName + " must be a positive integer, got: " + value);
    }

    private static String requireOutputFormat(String key, Object value, String sourceName) {
        String format = String.valueOf(value).toLowerCase(Locale.ROOT);
        if (format.equals("text") || format.equals("json")) {
            return format;
        }
        throw new ConfigurationException("'" + key + "' in " + sourceName + " must be text or json, got: " + value);
    }

    /**
     * Applies the switches given on the command line on top of these settings.
     *
     * @param options the parsed command line
     * @return the effective settings
     */
    public EngineSettings merge(ArgumentParser.MatcherOptions options) {
        return new EngineSettings(
                options.lenient != null ? options.lenient : lenient,
                options.stepLimit != null ? options.stepLimit : stepLimit,
                options.depthLimit != null ? options.depthLimit : depthLimit,
                Boolean.TRUE.equals(options.json) ? "json" : outputFormat,
                options.pretty != null ? options.pretty : pretty
        );
    }

    public boolean isJsonOutput() {
        return outputFormat.equals("json");
    }

    public PatternOptions toPatternOptions(boolean debugEnabled) {
        return new PatternOptions(lenient, debugEnabled);
    }

    public MatchBudget toBudget() {
        return new MatchBudget(stepLimit, depthLimit);
    }
}
