package ai.chandas.scanner.sandhi;

import ai.chandas.scanner.lexicon.Lexicon;
import ai.chandas.scanner.text.Devanagari;
import java.util.List;
import java.util.Objects;

/**
 * Plausibility score of a single rewrite relative to the line it came from.
 * <p>
 * Starts at 1.0, penalizes isolated independent vowels, rewards lexicon hits, penalizes length drift,
 * taxes aggressive and named rules, and clamps to [-2.0, 2.0].
 */
public class SandhiScorer {

    static final double BASE_SCORE = 1.0;
    static final double ISOLATED_VOWEL_PENALTY = 0.25;
    static final double LEXICON_WEIGHT = 0.7;
    static final double LENGTH_DRIFT_PENALTY = 0.02;
    static final double AGGRESSIVE_RULE_PENALTY = 0.1;
    static final double RULE_PENALTY = 0.03;
    static final double MIN_SCORE = -2.0;
    static final double MAX_SCORE = 2.0;

    private static final List<String> AGGRESSIVE_MARKERS = List.of("ai->", "a+u", "ū");

    private final Lexicon lexicon;

    public SandhiScorer(Lexicon lexicon) {
        this.lexicon = Objects.requireNonNull(lexicon, "lexicon");
    }

    public double score(String original, String candidate, String ruleName) {
        List<String> tokens = Lexicon.tokens(candidate);
        double score = BASE_SCORE;

        long isolatedVowels = tokens.stream().filter(Devanagari::isIsolatedVowel).count();
        score -= ISOLATED_VOWEL_PENALTY * isolatedVowels;

        if (!tokens.isEmpty()) {
            score += LEXICON_WEIGHT * lexicon.coverage(candidate);
        }

        int drift = Math.abs(codePointLength(candidate) - codePointLength(original));
        score -= LENGTH_DRIFT_PENALTY * drift;

        if (ruleName != null && AGGRESSIVE_MARKERS.stream().anyMatch(ruleName::contains)) {
            score -= AGGRESSIVE_RULE_PENALTY;
        }
        if (ruleName != null && !ruleName.isEmpty()) {
            score -= RULE_PENALTY;
        }
        return clamp(score);
    }

    static double clamp(double score) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }

    private static int codePointLength(String text) {
        return text.codePointCount(0, text.length());
    }
}
