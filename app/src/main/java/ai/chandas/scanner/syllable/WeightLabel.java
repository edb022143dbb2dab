package ai.chandas.scanner.syllable;

import java.util.Objects;

/**
 * Weight assigned to one syllable unit together with the classifier's confidence and the rule that fired.
 */
public record WeightLabel(Weight weight, double confidence, String reason) {

    public WeightLabel {
        Objects.requireNonNull(weight, "weight");
        Objects.requireNonNull(reason, "reason");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
    }
}
