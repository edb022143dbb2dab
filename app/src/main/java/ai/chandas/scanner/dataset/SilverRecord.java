package ai.chandas.scanner.dataset;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Objects;

/**
 * One line of the silver-labelled dataset. Field names and the {@code L}/{@code G} labels are consumed by
 * downstream training tools and must not change.
 */
@JsonPropertyOrder({"id", "text", "syllables", "labels"})
public record SilverRecord(
        @JsonProperty("id") int id,
        @JsonProperty("text") String text,
        @JsonProperty("syllables") List<String> syllables,
        @JsonProperty("labels") List<String> labels) {

    public SilverRecord {
        Objects.requireNonNull(text, "text");
        syllables = List.copyOf(Objects.requireNonNull(syllables, "syllables"));
        labels = List.copyOf(Objects.requireNonNull(labels, "labels"));
        if (syllables.size() != labels.size()) {
            throw new IllegalArgumentException("labels must align with syllables");
        }
    }
}
