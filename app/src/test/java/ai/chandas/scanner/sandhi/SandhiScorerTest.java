package ai.chandas.scanner.sandhi;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import ai.chandas.scanner.lexicon.Lexicon;
import org.junit.jupiter.api.Test;

class SandhiScorerTest {

    private static final double EPSILON = 1e-9;

    @Test
    void identityPaysOnlyTheRuleTax() {
        SandhiScorer scorer = new SandhiScorer(Lexicon.empty());

        assertThat(scorer.score("कमल", "कमल", SandhiCandidate.IDENTITY_RULE)).isCloseTo(0.97, within(EPSILON));
    }

    @Test
    void rewardsLexiconCoverage() {
        SandhiScorer scorer = new SandhiScorer(Lexicon.of("राम"));

        assertThat(scorer.score("राम", "राम", "identity")).isCloseTo(1.67, within(EPSILON));
    }

    @Test
    void penalizesIsolatedVowelsAndLengthDrift() {
        SandhiScorer scorer = new SandhiScorer(Lexicon.empty());

        double score = scorer.score("कक", "अ इ", "split");

        assertThat(score).isCloseTo(1.0 - 0.5 - 0.02 - 0.03, within(EPSILON));
    }

    @Test
    void taxesAggressiveRuleNames() {
        SandhiScorer scorer = new SandhiScorer(Lexicon.empty());

        assertThat(scorer.score("क", "क", "au -> a+u (reverse)")).isCloseTo(0.87, within(EPSILON));
        assertThat(scorer.score("क", "क", "o->a+ū")).isCloseTo(0.87, within(EPSILON));
        assertThat(scorer.score("क", "क", "ai -> a+i (reverse)")).isCloseTo(0.97, within(EPSILON));
        assertThat(scorer.score("क", "क", "ai->a+i")).isCloseTo(0.87, within(EPSILON));
    }

    @Test
    void clampsToScoreBounds() {
        assertThat(SandhiScorer.clamp(5.0)).isEqualTo(2.0);
        assertThat(SandhiScorer.clamp(-7.5)).isEqualTo(-2.0);
        assertThat(SandhiScorer.clamp(0.3)).isEqualTo(0.3);
    }
}
