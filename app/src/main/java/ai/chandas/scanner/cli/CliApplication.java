package ai.chandas.scanner.cli;

import ai.chandas.scanner.config.ConfigLoader;
import ai.chandas.scanner.config.ScannerConfig;
import ai.chandas.scanner.config.SystemEnvironmentReader;
import ai.chandas.scanner.dataset.AnnotationExporter;
import ai.chandas.scanner.dataset.SilverDatasetBuilder;
import ai.chandas.scanner.inference.InferenceResult;
import ai.chandas.scanner.inference.InferenceSettings;
import ai.chandas.scanner.inference.MeterInferenceService;
import ai.chandas.scanner.lexicon.Lexicon;
import ai.chandas.scanner.lexicon.LexiconLoader;
import ai.chandas.scanner.logging.LoggingConfigurator;
import ai.chandas.scanner.meter.MeterLibrary;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and analysis pipeline.
 * <p>
 * Results go to standard output as JSON; logs go to standard error.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final LexiconLoader lexiconLoader;
    private final PrintWriter out;
    private final PrintWriter err;
    private final ObjectMapper objectMapper;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new LexiconLoader(),
                utf8Writer(System.out), utf8Writer(System.err));
    }

    CliApplication(ConfigLoader configLoader, LexiconLoader lexiconLoader, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.lexiconLoader = lexiconLoader;
        this.out = out;
        this.err = err;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            return rejectInput(commandLine, ex.getMessage());
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        ScannerConfig config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            return rejectInput(commandLine, ex.getMessage());
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());

        try {
            execute(config);
            return 0;
        } catch (RuntimeException ex) {
            LOGGER.error("Run in {} mode failed", config.mode(), ex);
            err.println("chandas-scanner: analysis failed; see log output for details");
            err.flush();
            return commandLine.getCommandSpec().exitCodeOnExecutionException();
        }
    }

    private void execute(ScannerConfig config) {
        switch (config.mode()) {
            case SCAN -> {
                InferenceResult result = createService(config).infer(config.text().orElseThrow(), config.useSandhi());
                LOGGER.info("Chose '{}' for '{}'", result.chosenCandidate().candidate(), result.line());
                print(result);
            }
            case SYLLABIFY -> {
                List<String> syllables = createService(config).syllabify(config.text().orElseThrow());
                print(syllables);
            }
            case SILVER -> {
                Path output = config.output().orElseThrow();
                int written = new SilverDatasetBuilder(createService(config))
                        .build(config.input().orElseThrow(), output, config.useSandhi());
                out.println("Wrote " + written + " records to " + output);
                out.flush();
            }
            case EXPORT -> {
                Path output = config.output().orElseThrow();
                int exported = new AnnotationExporter().export(config.input().orElseThrow(), output);
                out.println("Exported " + exported + " rows to " + output);
                out.flush();
            }
        }
    }

    private MeterInferenceService createService(ScannerConfig config) {
        Lexicon lexicon = lexiconLoader.load(config.lexiconPath());
        InferenceSettings settings = new InferenceSettings(config.maxCandidates(), config.allowAggressive(), config.topMeters());
        LOGGER.info("Using {} lexicon file entries (sandhi={}, aggressive={}, maxCandidates={})",
                lexicon.size(), config.useSandhi(), config.allowAggressive(), config.maxCandidates());
        return new MeterInferenceService(lexicon, MeterLibrary.classical(), settings);
    }

    private void print(Object value) {
        try {
            out.println(objectMapper.writeValueAsString(value));
            out.flush();
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize result", ex);
        }
    }

    private int rejectInput(CommandLine commandLine, String message) {
        err.println(message);
        commandLine.usage(err);
        err.flush();
        return commandLine.getCommandSpec().exitCodeOnInvalidInput();
    }

    private static PrintWriter utf8Writer(OutputStream stream) {
        return new PrintWriter(new OutputStreamWriter(stream, StandardCharsets.UTF_8), true);
    }
}
