package ai.chandas.scanner.config;

import ai.chandas.scanner.text.TextNormalizer;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments, environment values and defaults.
 *
 * @param text   the verse line for {@link Mode#SCAN} and {@link Mode#SYLLABIFY}, already joined
 * @param input  source file for {@link Mode#SILVER} and {@link Mode#EXPORT}
 * @param output destination file for {@link Mode#SILVER} and {@link Mode#EXPORT}
 */
public record ScannerConfig(
        Mode mode,
        Optional<String> text,
        Optional<Path> input,
        Optional<Path> output,
        Path lexiconPath,
        boolean useSandhi,
        boolean allowAggressive,
        int maxCandidates,
        int topMeters,
        LogFormat logFormat,
        boolean verbose
) {

    public ScannerConfig {
        Objects.requireNonNull(mode, "mode");
        text = text == null ? Optional.empty() : text.map(TextNormalizer::trim).filter(value -> !value.isEmpty());
        input = input == null ? Optional.empty() : input;
        output = output == null ? Optional.empty() : output;
        Objects.requireNonNull(lexiconPath, "lexiconPath");
        Objects.requireNonNull(logFormat, "logFormat");
        if (maxCandidates < 1) {
            throw new IllegalArgumentException("maxCandidates must be at least 1");
        }
        if (topMeters < 1) {
            throw new IllegalArgumentException("topMeters must be at least 1");
        }
        if (mode.needsText() && text.isEmpty()) {
            throw new IllegalArgumentException("text must not be blank in " + mode.name().toLowerCase(Locale.ROOT) + " mode");
        }
        if (mode.needsInputFile() && input.isEmpty()) {
            throw new IllegalArgumentException("--input must be provided in " + mode.name().toLowerCase(Locale.ROOT) + " mode");
        }
        if (mode == Mode.EXPORT && output.isEmpty()) {
            throw new IllegalArgumentException("--output must be provided in export mode");
        }
    }
}
