package ai.chandas.scanner.meter;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Composite score of one template against a line, with its diagnostic breakdown.
 */
public record MeterMatch(
        @JsonProperty("meter") String meter,
        @JsonProperty("score") double score,
        @JsonProperty("details") MeterMatchDetails details) {

    public MeterMatch {
        Objects.requireNonNull(meter, "meter");
        Objects.requireNonNull(details, "details");
    }
}
