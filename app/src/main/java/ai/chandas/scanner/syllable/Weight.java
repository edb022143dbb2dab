package ai.chandas.scanner.syllable;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Binary prosodic weight of a syllable unit. The codes are the label vocabulary of the silver dataset.
 */
public enum Weight {
    LIGHT("L"),
    HEAVY("G");

    private final String code;

    Weight(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean isHeavy() {
        return this == HEAVY;
    }

    public static Weight fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Weight code must be provided");
        }
        for (Weight weight : values()) {
            if (weight.code.equalsIgnoreCase(raw.trim())) {
                return weight;
            }
        }
        throw new IllegalArgumentException("Unsupported weight code: " + raw);
    }
}
