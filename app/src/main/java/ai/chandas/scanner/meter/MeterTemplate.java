package ai.chandas.scanner.meter;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named meter: expected syllable count and, optionally, the lengths of its padas in order.
 */
public record MeterTemplate(String name, int total, List<Integer> padas) {

    public MeterTemplate {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (total <= 0) {
            throw new IllegalArgumentException("total must be positive for meter " + name);
        }
        padas = padas == null ? List.of() : List.copyOf(padas);
        for (Integer length : padas) {
            if (Objects.requireNonNull(length, "pada length") <= 0) {
                throw new IllegalArgumentException("pada lengths must be positive for meter " + name);
            }
        }
    }

    public static MeterTemplate withoutPadas(String name, int total) {
        return new MeterTemplate(name, total, List.of());
    }

    public static MeterTemplate evenPadas(String name, int padaLength, int padaCount) {
        return new MeterTemplate(name, padaLength * padaCount, Collections.nCopies(padaCount, padaLength));
    }

    public boolean hasPadas() {
        return !padas.isEmpty();
    }

    public int padaTotal() {
        return padas.stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Heavy-syllable fraction a line of this meter is expected to show.
     */
    public double expectedHeavyFraction() {
        return Math.min(0.6, total / 100.0 + 0.4);
    }
}
