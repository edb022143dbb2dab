package ai.chandas.scanner.config;

/**
 * What a single CLI invocation does.
 */
public enum Mode {
    /** Infer the meter of one line. */
    SCAN,
    /** Print the syllable units of one line. */
    SYLLABIFY,
    /** Label a file of verse lines into silver JSONL. */
    SILVER,
    /** Convert silver JSONL into an annotation CSV. */
    EXPORT;

    public static Mode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return SCAN;
        }
        for (Mode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported mode: " + raw);
    }

    public boolean needsText() {
        return this == SCAN || this == SYLLABIFY;
    }

    public boolean needsInputFile() {
        return this == SILVER || this == EXPORT;
    }
}
