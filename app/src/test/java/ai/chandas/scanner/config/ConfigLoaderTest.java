package ai.chandas.scanner.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.chandas.scanner.cli.CliArguments;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--mode", "syllabify",
                "--lexicon", "words.txt",
                "--no-sandhi",
                "--aggressive",
                "--max-candidates", "4",
                "--top-k", "2",
                "--log-format", "json",
                "--verbose",
                "रामोऽस्ति", "बलवान्");

        ScannerConfig config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.SYLLABIFY);
        assertThat(config.text()).contains("रामोऽस्ति बलवान्");
        assertThat(config.lexiconPath()).isEqualTo(Path.of("words.txt"));
        assertThat(config.useSandhi()).isFalse();
        assertThat(config.allowAggressive()).isTrue();
        assertThat(config.maxCandidates()).isEqualTo(4);
        assertThat(config.topMeters()).isEqualTo(2);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.verbose()).isTrue();
        assertThat(config.input()).isEmpty();
        assertThat(config.output()).isEmpty();
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_LEXICON_PATH, " /srv/lexicon.txt ");
        envValues.put(ConfigLoader.ENV_MAX_CANDIDATES, "12");
        envValues.put(ConfigLoader.ENV_TOP_K, "5");
        envValues.put(ConfigLoader.ENV_USE_SANDHI, "false");
        envValues.put(ConfigLoader.ENV_AGGRESSIVE, "1");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "JSON");
        envValues.put(ConfigLoader.ENV_VERBOSE, "true");

        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(envValues);
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "राम");

        ScannerConfig config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.SCAN);
        assertThat(config.lexiconPath()).isEqualTo(Path.of("/srv/lexicon.txt"));
        assertThat(config.maxCandidates()).isEqualTo(12);
        assertThat(config.topMeters()).isEqualTo(5);
        assertThat(config.useSandhi()).isFalse();
        assertThat(config.allowAggressive()).isTrue();
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.verbose()).isTrue();
        assertThat(environmentReader.requestedKeys()).contains(ConfigLoader.ENV_MODE, ConfigLoader.ENV_LEXICON_PATH);
    }

    @Test
    void appliesDefaultsWhenNothingIsConfigured() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "राम");

        ScannerConfig config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.SCAN);
        assertThat(config.lexiconPath()).isEqualTo(ConfigLoader.DEFAULT_LEXICON_PATH);
        assertThat(config.useSandhi()).isTrue();
        assertThat(config.allowAggressive()).isFalse();
        assertThat(config.maxCandidates()).isEqualTo(8);
        assertThat(config.topMeters()).isEqualTo(3);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.verbose()).isFalse();
    }

    @Test
    void cliValuesWinOverEnvironment() {
        Map<String, String> envValues = Map.of(
                ConfigLoader.ENV_MODE, "export",
                ConfigLoader.ENV_MAX_CANDIDATES, "12");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--mode", "scan", "--max-candidates", "2", "राम");

        ScannerConfig config = new ConfigLoader(key -> Optional.ofNullable(envValues.get(key))).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.SCAN);
        assertThat(config.maxCandidates()).isEqualTo(2);
    }

    @Test
    void silverModeDefaultsOutputPath() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--mode", "silver", "--input", "data/verses.txt");

        ScannerConfig config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.input()).contains(Path.of("data/verses.txt"));
        assertThat(config.output()).contains(ConfigLoader.DEFAULT_SILVER_OUTPUT);
        assertThat(config.text()).isEmpty();
    }

    @Test
    void scanWithoutTextIsRejected() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("text must not be blank");
    }

    @Test
    void exportRequiresInputAndOutput() {
        ConfigLoader loader = new ConfigLoader(key -> Optional.empty());

        Throwable missingInput = catchThrowable(() -> loader.load(
                CommandLine.populateCommand(new CliArguments(), "--mode", "export", "--output", "out.csv")));
        Throwable missingOutput = catchThrowable(() -> loader.load(
                CommandLine.populateCommand(new CliArguments(), "--mode", "export", "--input", "silver.jsonl")));

        assertThat(missingInput).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--input");
        assertThat(missingOutput).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--output");
    }

    @Test
    void rejectsNonPositiveCounts() {
        ConfigLoader loader = new ConfigLoader(key -> ConfigLoader.ENV_TOP_K.equals(key) ? Optional.of("abc") : Optional.empty());

        Throwable cliValue = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(
                CommandLine.populateCommand(new CliArguments(), "--max-candidates", "0", "राम")));
        Throwable envValue = catchThrowable(() -> loader.load(CommandLine.populateCommand(new CliArguments(), "राम")));

        assertThat(cliValue).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--max-candidates");
        assertThat(envValue).isInstanceOf(IllegalArgumentException.class).hasMessageContaining(ConfigLoader.ENV_TOP_K);
    }

    @Test
    void unknownModeIsRejected() {
        Throwable thrown = catchThrowable(() -> Mode.from("translate"));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("translate");
        assertThat(Mode.from(" Export ")).isEqualTo(Mode.EXPORT);
    }

    @Test
    void noBreakSpaceOnlyTextIsRejected() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "\u00A0");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("text must not be blank");
    }

    private static final class RecordingEnvironmentReader implements EnvironmentReader {

        private final Map<String, String> values;
        private final List<String> requestedKeys = new ArrayList<>();

        private RecordingEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            requestedKeys.add(key);
            return Optional.ofNullable(values.get(key));
        }

        List<String> requestedKeys() {
            return requestedKeys;
        }
    }
}
