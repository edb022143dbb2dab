package ai.chandas.scanner.meter;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Every intermediate value that went into a template's composite score.
 *
 * @param padaDetails          per-pada breakdown, empty unless the line split exactly into the template's padas
 * @param padaMismatchFraction normalized total difference, set only when padas are declared but totals differ
 */
public record MeterMatchDetails(
        @JsonProperty("total") int total,
        @JsonProperty("expected_total") int expectedTotal,
        @JsonProperty("total_score") double totalScore,
        @JsonProperty("exact_total_bonus") double exactTotalBonus,
        @JsonProperty("guru_frac") double guruFraction,
        @JsonProperty("expected_guru_frac_whole") double expectedGuruFraction,
        @JsonProperty("guru_score") double guruScore,
        @JsonProperty("pada_score") double padaScore,
        @JsonProperty("pada_details") List<PadaDetail> padaDetails,
        @JsonInclude(JsonInclude.Include.NON_NULL)
        @JsonProperty("pada_mismatch_frac") Double padaMismatchFraction) {

    public MeterMatchDetails {
        padaDetails = padaDetails == null ? List.of() : List.copyOf(padaDetails);
    }

    public boolean padasAligned() {
        return !padaDetails.isEmpty();
    }
}
