package ai.prettylayout.config;

import ai.prettylayout.engine.LayoutOptions;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration of the command-line renderer, assembled from CLI arguments and environment
 * values.
 *
 * @param layoutOptions options handed to the layout engine
 * @param logFormat log encoder to install
 * @param inputs notation files to render, empty for standard input
 * @param output file receiving the rendered text, empty for standard output
 */
public record Config(LayoutOptions layoutOptions, LogFormat logFormat, List<Path> inputs, Optional<Path> output) {

    public Config {
        Objects.requireNonNull(layoutOptions, "layoutOptions");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        output = output == null ? Optional.empty() : output;
        if (output.isPresent() && inputs.contains(output.get())) {
            throw new IllegalArgumentException("--output must not overwrite an input file: " + output.get());
        }
    }

    public boolean readsStandardInput() {
        return inputs.isEmpty();
    }
}
