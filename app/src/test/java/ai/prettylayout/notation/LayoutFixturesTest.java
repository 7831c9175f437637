package ai.prettylayout.notation;

import static org.assertj.core.api.Assertions.assertThat;

import ai.prettylayout.engine.LayoutEngine;
import ai.prettylayout.engine.LayoutOptions;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Renders the notation files under {@code layouts/} and compares them with the expected output stored next
 * to them as {@code <name>.w<width>.txt}.
 */
class LayoutFixturesTest {

    @ParameterizedTest(name = "{0} at width {1}")
    @CsvSource({
            "signature, 10",
            "signature, 80",
            "call, 40",
            "call, 80",
            "sections, 80",
            "words, 20",
            "words, 80"
    })
    void rendersFixtureAsExpected(String name, int width) throws IOException {
        String source = resource("layouts/" + name + ".layout");
        String expected = resource("layouts/" + name + ".w" + width + ".txt");

        String rendered = new LayoutEngine(LayoutOptions.ofWidth(width)).render(new DocumentReader().read(source));

        assertThat(rendered).isEqualTo(expected);
    }

    private static String resource(String path) throws IOException {
        try (InputStream in = LayoutFixturesTest.class.getClassLoader().getResourceAsStream(path)) {
            assertThat(in).as("fixture %s", path).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
