package ai.chandas.scanner.config;

import ai.chandas.scanner.cli.CliArguments;
import ai.chandas.scanner.meter.MeterMatcher;
import ai.chandas.scanner.sandhi.SandhiCandidateGenerator;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link ScannerConfig} by combining CLI arguments with environment variables and defaults.
 * CLI values win over environment values, which win over defaults.
 */
public class ConfigLoader {

    static final String ENV_MODE = "CHANDAS_MODE";
    static final String ENV_LEXICON_PATH = "CHANDAS_LEXICON_PATH";
    static final String ENV_MAX_CANDIDATES = "CHANDAS_MAX_CANDIDATES";
    static final String ENV_TOP_K = "CHANDAS_TOP_K";
    static final String ENV_USE_SANDHI = "CHANDAS_USE_SANDHI";
    static final String ENV_AGGRESSIVE = "CHANDAS_AGGRESSIVE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_VERBOSE = "CHANDAS_VERBOSE";

    static final Path DEFAULT_LEXICON_PATH = Path.of("data", "lexicon.txt");
    static final Path DEFAULT_SILVER_OUTPUT = Path.of("train", "hf_silver.jsonl");

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public ScannerConfig load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Mode mode = resolveMode(arguments);
        Optional<String> text = joinText(arguments.text());
        Optional<Path> input = Optional.ofNullable(arguments.input());
        Optional<Path> output = Optional.ofNullable(arguments.output())
                .or(() -> mode == Mode.SILVER ? Optional.of(DEFAULT_SILVER_OUTPUT) : Optional.empty());

        Path lexiconPath = Optional.ofNullable(arguments.lexiconPath())
                .or(() -> environmentReader.get(ENV_LEXICON_PATH)
                        .filter(ConfigLoader::isNotBlank)
                        .map(String::trim)
                        .map(Path::of))
                .orElse(DEFAULT_LEXICON_PATH);

        boolean useSandhi = !arguments.noSandhi() && resolveFlag(ENV_USE_SANDHI, true);
        boolean allowAggressive = arguments.aggressive() || resolveFlag(ENV_AGGRESSIVE, false);

        int maxCandidates = resolveCount(arguments.maxCandidates(), ENV_MAX_CANDIDATES,
                SandhiCandidateGenerator.DEFAULT_MAX_CANDIDATES, "--max-candidates");
        int topMeters = resolveCount(arguments.topK(), ENV_TOP_K, MeterMatcher.DEFAULT_TOP_K, "--top-k");
        LogFormat logFormat = resolveLogFormat(arguments);
        boolean verbose = arguments.verbose() || resolveFlag(ENV_VERBOSE, false);

        return new ScannerConfig(mode, text, input, output, lexiconPath, useSandhi, allowAggressive,
                maxCandidates, topMeters, logFormat, verbose);
    }

    private Mode resolveMode(CliArguments arguments) {
        Mode cliMode = arguments.mode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.get(ENV_MODE)
                .map(Mode::from)
                .orElse(Mode.SCAN);
    }

    private boolean resolveFlag(String envKey, boolean defaultValue) {
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(defaultValue);
    }

    private int resolveCount(Integer cliValue, String envKey, int defaultValue, String optionName) {
        if (cliValue != null) {
            if (cliValue < 1) {
                throw new IllegalArgumentException(optionName + " must be at least 1");
            }
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(raw -> parsePositiveInteger(raw, envKey))
                .orElse(defaultValue);
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

    private static Optional<String> joinText(List<String> words) {
        if (words == null || words.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(String.join(" ", words)).filter(ConfigLoader::isNotBlank);
    }

    private static int parsePositiveInteger(String raw, String envKey) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(envKey + " must be at least 1");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(envKey + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
