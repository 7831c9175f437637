package ai.prettylayout.writer;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes rendered text to a file, creating missing directories, or to standard output when no file is given.
 */
public class RenderedOutputWriter {

    private final PrintStream standardOutput;

    public RenderedOutputWriter() {
        this(System.out);
    }

    public RenderedOutputWriter(PrintStream standardOutput) {
        this.standardOutput = Objects.requireNonNull(standardOutput, "standardOutput");
    }

    public void write(Optional<Path> target, String text) {
        Objects.requireNonNull(text, "text");
        if (target == null || target.isEmpty()) {
            standardOutput.print(text);
            standardOutput.flush();
            return;
        }
        Path path = target.get();
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, text, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write rendered output: " + path, ex);
        }
    }
}
