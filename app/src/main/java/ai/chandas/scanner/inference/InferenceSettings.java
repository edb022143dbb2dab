package ai.chandas.scanner.inference;

import ai.chandas.scanner.meter.MeterMatcher;
import ai.chandas.scanner.sandhi.SandhiCandidateGenerator;

/**
 * Tunables of a single inference call.
 */
public record InferenceSettings(int maxCandidates, boolean allowAggressive, int topMeters) {

    public InferenceSettings {
        if (maxCandidates < 1) {
            throw new IllegalArgumentException("maxCandidates must be at least 1");
        }
        if (topMeters < 1) {
            throw new IllegalArgumentException("topMeters must be at least 1");
        }
    }

    public static InferenceSettings defaults() {
        return new InferenceSettings(SandhiCandidateGenerator.DEFAULT_MAX_CANDIDATES, false, MeterMatcher.DEFAULT_TOP_K);
    }
}
