package ai.chandas.scanner.sandhi;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

/**
 * A plausible pre-sandhi rewrite of a line, its plausibility score and the rules that produced it, in order.
 */
public record SandhiCandidate(
        @JsonProperty("cand") String text,
        @JsonProperty("score") double score,
        @JsonProperty("rules") List<String> rules) {

    public static final String IDENTITY_RULE = "identity";

    public SandhiCandidate {
        Objects.requireNonNull(text, "text");
        rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    public boolean isIdentity() {
        return rules.equals(List.of(IDENTITY_RULE));
    }

    SandhiCandidate withText(String newText) {
        return new SandhiCandidate(newText, score, rules);
    }

    SandhiCandidate withScore(double newScore) {
        return new SandhiCandidate(text, newScore, rules);
    }
}
