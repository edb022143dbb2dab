package ai.chandas.scanner.inference;

import ai.chandas.scanner.meter.MeterMatch;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of analysing one line: every scored candidate, the chosen one and its best meter matches.
 */
public record InferenceResult(
        @JsonProperty("line") String line,
        @JsonProperty("candidates") List<CandidateAnalysis> candidates,
        @JsonProperty("chosen_candidate") CandidateAnalysis chosenCandidate,
        @JsonProperty("top_chanda") List<MeterMatch> topMeters) {

    public InferenceResult {
        Objects.requireNonNull(line, "line");
        candidates = List.copyOf(Objects.requireNonNull(candidates, "candidates"));
        Objects.requireNonNull(chosenCandidate, "chosenCandidate");
        topMeters = List.copyOf(Objects.requireNonNull(topMeters, "topMeters"));
    }
}
