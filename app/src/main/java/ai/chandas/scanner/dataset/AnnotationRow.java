package ai.chandas.scanner.dataset;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Flattened silver record as shown to annotators; syllables and labels are pipe-joined.
 */
@JsonPropertyOrder({"id", "text", "syllables", "labels"})
public record AnnotationRow(String id, String text, String syllables, String labels) {
}
