package ai.prettylayout.cli;

import ai.prettylayout.config.LogFormat;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "pretty-layout", mixinStandardHelpOptions = true, version = "pretty-layout 0.1.0",
        description = "Renders layout documents written in box notation to width-limited text")
public class CliArguments {

    @CommandLine.Option(names = {"-w", "--width"}, description = "Maximum line width (default 80)", paramLabel = "COLUMNS")
    private Integer maxWidth;

    @CommandLine.Option(names = "--indent-unit", description = "Columns per indent level (default 4)", paramLabel = "COLUMNS")
    private Integer indentUnit;

    @CommandLine.Option(names = "--min-space", description = "Columns granted to every line regardless of indentation (default 0)", paramLabel = "COLUMNS")
    private Integer minSpace;

    @CommandLine.Option(names = "--debug-markers", description = "Mark group boundaries and breaks in the output")
    private boolean debugMarkers;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Write rendered text to FILE instead of standard output", paramLabel = "FILE")
    private String output;

    @CommandLine.Parameters(arity = "0..*", description = "Notation files to render; '-' or none reads standard input", paramLabel = "FILE")
    private List<String> inputs = new ArrayList<>();

    public Integer maxWidth() {
        return maxWidth;
    }

    public Integer indentUnit() {
        return indentUnit;
    }

    public Integer minSpace() {
        return minSpace;
    }

    public boolean debugMarkers() {
        return debugMarkers;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public String output() {
        return output;
    }

    public List<String> inputs() {
        return inputs == null ? List.of() : inputs;
    }
}
