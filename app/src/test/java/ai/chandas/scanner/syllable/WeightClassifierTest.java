package ai.chandas.scanner.syllable;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;
import org.junit.jupiter.api.Test;

class WeightClassifierTest {

    private final WeightClassifier classifier = new WeightClassifier();

    @Test
    void appliesCascadeInOrder() {
        List<WeightLabel> labels = classifier.classifyAll(List.of("मः", "रा", "आ", "न्", "ब"));

        assertThat(labels)
                .extracting(WeightLabel::weight, WeightLabel::confidence, WeightLabel::reason)
                .containsExactly(
                        tuple(Weight.HEAVY, 0.95, WeightClassifier.REASON_COMBINING_MARK),
                        tuple(Weight.HEAVY, 0.95, WeightClassifier.REASON_LONG_VOWEL),
                        tuple(Weight.HEAVY, 0.95, WeightClassifier.REASON_LONG_VOWEL),
                        tuple(Weight.HEAVY, 0.90, WeightClassifier.REASON_CONJUNCT),
                        tuple(Weight.LIGHT, 0.95, WeightClassifier.REASON_DEFAULT));
    }

    @Test
    void combiningMarkWinsOverLongVowel() {
        assertThat(classifier.classify("रां").reason()).isEqualTo(WeightClassifier.REASON_COMBINING_MARK);
    }

    @Test
    void shortVowelSignsAndUnknownUnitsAreLight() {
        assertThat(classifier.classify("कि").weight()).isEqualTo(Weight.LIGHT);
        assertThat(classifier.classify("x").weight()).isEqualTo(Weight.LIGHT);
        assertThat(classifier.classify(null).weight()).isEqualTo(Weight.LIGHT);
    }

    @Test
    void weightCodesMatchSilverLabels() {
        assertThat(Weight.HEAVY.code()).isEqualTo("G");
        assertThat(Weight.LIGHT.code()).isEqualTo("L");
        assertThat(Weight.fromCode("G")).isEqualTo(Weight.HEAVY);
    }
}
