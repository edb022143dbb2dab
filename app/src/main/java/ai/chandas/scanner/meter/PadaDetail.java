package ai.chandas.scanner.meter;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Heavy-syllable fraction of one pada when a line splits cleanly into a template's padas.
 */
public record PadaDetail(
        @JsonProperty("pada_index") int padaIndex,
        @JsonProperty("length") int length,
        @JsonProperty("guru_frac") double guruFraction) {
}
