package ai.prettylayout.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.prettylayout.config.ConfigLoader;
import ai.prettylayout.writer.RenderedOutputWriter;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    private static final String SIGNATURE = """
            (cbox "fn f(" (zerobreak 4) "a: i32," (space 4) "b: i32," zerobreak ")")
            """;

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

    private CliApplication application(String standardInput) {
        return new CliApplication(
                new ConfigLoader(key -> Optional.empty()),
                new ByteArrayInputStream(standardInput.getBytes(StandardCharsets.UTF_8)),
                new RenderedOutputWriter(new PrintStream(stdout, true, StandardCharsets.UTF_8)));
    }

    private String stdout() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    @Test
    void rendersStandardInputToStandardOutput() {
        int exitCode = application(SIGNATURE).run(new String[] {"--width", "10"});

        assertThat(exitCode).isZero();
        assertThat(stdout()).isEqualTo("fn f(\n    a: i32,\n    b: i32,\n)\n");
    }

    @Test
    void rendersFilesInOrderIntoOutputFile() throws IOException {
        Path first = Files.writeString(tempDir.resolve("first.layout"), SIGNATURE);
        Path second = Files.writeString(tempDir.resolve("second.layout"), "\"done\"");
        Path output = tempDir.resolve("out/rendered.txt");

        int exitCode = application("").run(new String[] {
                "-o", output.toString(), first.toString(), second.toString()
        });

        assertThat(exitCode).isZero();
        assertThat(Files.readString(output)).isEqualTo("fn f(a: i32, b: i32,)\ndone\n");
        assertThat(stdout()).isEmpty();
    }

    @Test
    void dashReadsStandardInput() {
        int exitCode = application("\"from stdin\"").run(new String[] {"-"});

        assertThat(exitCode).isZero();
        assertThat(stdout()).isEqualTo("from stdin\n");
    }

    @Test
    void notationErrorFailsWithoutWritingOutput() throws IOException {
        Path broken = Files.writeString(tempDir.resolve("broken.layout"), "(cbox \"unclosed\"");
        Path output = tempDir.resolve("rendered.txt");

        int exitCode = application("").run(new String[] {"--output", output.toString(), broken.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
        assertThat(output).doesNotExist();
    }

    @Test
    void missingInputFileFails() {
        int exitCode = application("").run(new String[] {tempDir.resolve("absent.layout").toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
        assertThat(stdout()).isEmpty();
    }

    @Test
    void invalidArgumentsReturnUsageError() {
        assertThat(application("").run(new String[] {"--width", "wide"})).isEqualTo(2);
        assertThat(application("").run(new String[] {"--width", "0"})).isEqualTo(2);
        assertThat(application("").run(new String[] {"--log-format", "xml"})).isEqualTo(2);
    }

    @Test
    void helpAndVersionExitSuccessfully() {
        assertThat(application("").run(new String[] {"--help"})).isZero();
        assertThat(application("").run(new String[] {"--version"})).isZero();
        assertThat(stdout()).isEmpty();
    }
}
