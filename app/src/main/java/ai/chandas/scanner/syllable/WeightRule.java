package ai.chandas.scanner.syllable;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * One step of the weight cascade: the label produced when the predicate accepts the unit.
 */
record WeightRule(Predicate<String> condition, WeightLabel label) {

    WeightRule {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(label, "label");
    }

    boolean matches(String unit) {
        return condition.test(unit);
    }
}
