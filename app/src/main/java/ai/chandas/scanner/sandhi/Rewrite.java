package ai.chandas.scanner.sandhi;

import java.util.Objects;

/**
 * Text produced by a single rule application, tagged with the rule name.
 */
public record Rewrite(String text, String ruleName) {

    public Rewrite {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(ruleName, "ruleName");
    }
}
