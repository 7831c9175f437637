package ai.prettylayout.writer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RenderedOutputWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesToStandardOutputWithoutTarget() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        RenderedOutputWriter writer = new RenderedOutputWriter(new PrintStream(buffer, true, StandardCharsets.UTF_8));

        writer.write(Optional.empty(), "línea\n");

        assertThat(buffer.toString(StandardCharsets.UTF_8)).isEqualTo("línea\n");
    }

    @Test
    void createsParentDirectoriesAndReplacesContent() throws IOException {
        Path target = tempDir.resolve("nested/dir/out.txt");
        RenderedOutputWriter writer = new RenderedOutputWriter();

        writer.write(Optional.of(target), "a much longer first version\n");
        writer.write(Optional.of(target), "short\n");

        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("short\n");
    }

    @Test
    void failureIsReportedWithThePath() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "file, not a directory");
        Path target = blocker.resolve("out.txt");

        assertThatThrownBy(() -> new RenderedOutputWriter().write(Optional.of(target), "x"))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("Failed to write rendered output")
                .hasMessageContaining("out.txt");
    }
}
