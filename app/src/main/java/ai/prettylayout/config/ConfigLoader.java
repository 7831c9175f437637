package ai.prettylayout.config;

import ai.prettylayout.cli.CliArguments;
import ai.prettylayout.engine.LayoutOptions;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} by combining CLI arguments with environment variables and defaults. A value given on
 * the command line wins over the environment, which wins over the default.
 */
public class ConfigLoader {

    static final String ENV_MAX_WIDTH = "PRETTY_LAYOUT_MAX_WIDTH";
    static final String ENV_INDENT_UNIT = "PRETTY_LAYOUT_INDENT_UNIT";
    static final String ENV_MIN_SPACE = "PRETTY_LAYOUT_MIN_SPACE";
    static final String ENV_DEBUG_MARKERS = "PRETTY_LAYOUT_DEBUG_MARKERS";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final String STANDARD_INPUT = "-";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        int maxWidth = resolveInt(arguments.maxWidth(), ENV_MAX_WIDTH, "--width", LayoutOptions.DEFAULT_MAX_WIDTH);
        int indentUnit = resolveInt(arguments.indentUnit(), ENV_INDENT_UNIT, "--indent-unit",
                LayoutOptions.DEFAULT_INDENT_UNIT);
        int minSpace = resolveInt(arguments.minSpace(), ENV_MIN_SPACE, "--min-space", 0);
        boolean debugMarkers = resolveDebugMarkers(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        if (maxWidth < 1) {
            throw new IllegalArgumentException("--width must be at least 1");
        }
        if (minSpace > maxWidth) {
            throw new IllegalArgumentException("--min-space must not exceed --width");
        }
        LayoutOptions layoutOptions = new LayoutOptions(maxWidth, indentUnit, minSpace, debugMarkers, true);

        List<Path> inputs = arguments.inputs().stream()
                .filter(ConfigLoader::isNotBlank)
                .filter(value -> !STANDARD_INPUT.equals(value))
                .map(Path::of)
                .collect(Collectors.toList());
        Optional<Path> output = Optional.ofNullable(arguments.output())
                .filter(ConfigLoader::isNotBlank)
                .map(Path::of);

        return new Config(layoutOptions, logFormat, inputs, output);
    }

    private int resolveInt(Integer cliValue, String envKey, String option, int defaultValue) {
        if (cliValue != null) {
            return requireNonNegative(cliValue, option);
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(raw -> parseNonNegativeInteger(raw, envKey))
                .orElse(defaultValue);
    }

    private boolean resolveDebugMarkers(CliArguments arguments) {
        if (arguments.debugMarkers()) {
            return true;
        }
        return environmentReader.get(ENV_DEBUG_MARKERS)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private static int requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be zero or greater");
        }
        return value;
    }

    private static int parseNonNegativeInteger(String raw, String name) {
        try {
            return requireNonNegative(Integer.parseInt(raw), name);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
