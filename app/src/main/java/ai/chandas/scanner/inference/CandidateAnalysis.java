package ai.chandas.scanner.inference;

import ai.chandas.scanner.syllable.Weight;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

/**
 * Syllabification, weights and scores computed for one sandhi candidate.
 *
 * @param generatorScore score assigned by the sandhi generator, {@code null} when sandhi reversal was disabled
 */
public record CandidateAnalysis(
        @JsonProperty("candidate") String candidate,
        @JsonProperty("syllables") List<String> syllables,
        @JsonProperty("silver_labels") List<Weight> labels,
        @JsonProperty("silver_conf") List<Double> confidences,
        @JsonProperty("silver_reasons") List<String> reasons,
        @JsonProperty("meta_rules") List<String> rules,
        @JsonProperty("meta_score") Double generatorScore,
        @JsonProperty("avg_conf") double averageConfidence,
        @JsonProperty("lex_score") double lexiconScore,
        @JsonProperty("iso_frac") double isolatedVowelFraction,
        @JsonProperty("meter_bonus") double meterBonus,
        @JsonProperty("combined_score") double combinedScore) {

    public CandidateAnalysis {
        Objects.requireNonNull(candidate, "candidate");
        syllables = List.copyOf(Objects.requireNonNull(syllables, "syllables"));
        labels = List.copyOf(Objects.requireNonNull(labels, "labels"));
        confidences = List.copyOf(Objects.requireNonNull(confidences, "confidences"));
        reasons = List.copyOf(Objects.requireNonNull(reasons, "reasons"));
        rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        if (labels.size() != syllables.size()) {
            throw new IllegalArgumentException("labels must align with syllables");
        }
    }

    public List<String> labelCodes() {
        return labels.stream().map(Weight::code).toList();
    }
}
