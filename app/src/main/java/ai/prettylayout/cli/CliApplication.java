package ai.prettylayout.cli;

import ai.prettylayout.config.Config;
import ai.prettylayout.config.ConfigLoader;
import ai.prettylayout.config.SystemEnvironmentReader;
import ai.prettylayout.document.Document;
import ai.prettylayout.document.MalformedDocumentException;
import ai.prettylayout.engine.LayoutEngine;
import ai.prettylayout.engine.LayoutResult;
import ai.prettylayout.logging.LoggingConfigurator;
import ai.prettylayout.notation.DocumentReader;
import ai.prettylayout.notation.NotationException;
import ai.prettylayout.writer.RenderedOutputWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and layout engine.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    private static final String STANDARD_INPUT_NAME = "<stdin>";
    static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final InputStream standardInput;
    private final RenderedOutputWriter outputWriter;
    private final DocumentReader documentReader = new DocumentReader();

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), System.in, new RenderedOutputWriter());
    }

    CliApplication(ConfigLoader configLoader, InputStream standardInput, RenderedOutputWriter outputWriter) {
        this.configLoader = configLoader;
        this.standardInput = standardInput;
        this.outputWriter = outputWriter;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Rendering {} input(s) at width {} (indent unit {})",
                config.readsStandardInput() ? 1 : config.inputs().size(),
                config.layoutOptions().maxWidth(), config.layoutOptions().indentUnit());

        LayoutEngine engine = new LayoutEngine(config.layoutOptions());
        StringBuilder rendered = new StringBuilder();
        try {
            if (config.readsStandardInput()) {
                rendered.append(renderOne(engine, STANDARD_INPUT_NAME, readStandardInput()));
            } else {
                for (Path input : config.inputs()) {
                    rendered.append(renderOne(engine, input.toString(), readFile(input)));
                }
            }
            outputWriter.write(config.output(), rendered.toString());
        } catch (NotationException | MalformedDocumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return EXIT_FAILURE;
        } catch (UncheckedIOException ex) {
            LOGGER.error("Rendering failed: {}", ex.getMessage(), ex);
            commandLine.getErr().println(ex.getMessage());
            return EXIT_FAILURE;
        }
        config.output().ifPresent(path -> LOGGER.info("Wrote rendered output to {}", path));
        return 0;
    }

    private String renderOne(LayoutEngine engine, String name, String source) {
        MDC.put("input", name);
        try {
            Document document = documentReader.read(source);
            LayoutResult result = engine.layout(document);
            LOGGER.info("Rendered {} into {} line(s)", name, result.lineCount());
            return result.text();
        } catch (NotationException | MalformedDocumentException ex) {
            LOGGER.error("Failed to render {}: {}", name, ex.getMessage());
            throw ex;
        } finally {
            MDC.remove("input");
        }
    }

    private String readStandardInput() {
        try {
            return new String(standardInput.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read standard input", ex);
        }
    }

    private static String readFile(Path input) {
        try {
            return Files.readString(input, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + input, ex);
        }
    }
}
