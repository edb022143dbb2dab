package ai.chandas.scanner.syllable;

import ai.chandas.scanner.text.Devanagari;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Assigns light/heavy weight to syllable units with an ordered rule cascade; the first matching rule wins.
 * <p>
 * The weight of a line-final syllable is not promoted, so scores stay comparable with existing silver data.
 */
public class WeightClassifier {

    static final String REASON_COMBINING_MARK = "anusvara/visarga/chandrabindu present (rule)";
    static final String REASON_LONG_VOWEL = "long vowel matra/indep vowel (rule)";
    static final String REASON_CONJUNCT = "consonant conjunct / halant (rule)";
    static final String REASON_DEFAULT = "short vowel / open syllable (rule)";

    private static final List<WeightRule> CASCADE = List.of(
            new WeightRule(unit -> containsAny(unit, Devanagari::isCombiningMark),
                    new WeightLabel(Weight.HEAVY, 0.95, REASON_COMBINING_MARK)),
            new WeightRule(unit -> containsAny(unit, Devanagari::isLongVowel),
                    new WeightLabel(Weight.HEAVY, 0.95, REASON_LONG_VOWEL)),
            new WeightRule(unit -> containsAny(unit, Devanagari::isVirama),
                    new WeightLabel(Weight.HEAVY, 0.90, REASON_CONJUNCT)),
            new WeightRule(unit -> true,
                    new WeightLabel(Weight.LIGHT, 0.95, REASON_DEFAULT)));

    public WeightLabel classify(String unit) {
        String value = unit == null ? "" : unit;
        for (WeightRule rule : CASCADE) {
            if (rule.matches(value)) {
                return rule.label();
            }
        }
        throw new IllegalStateException("Weight cascade must end with a catch-all rule");
    }

    public List<WeightLabel> classifyAll(List<String> units) {
        return units.stream().map(this::classify).toList();
    }

    private static boolean containsAny(String unit, IntPredicate predicate) {
        return unit.chars().anyMatch(predicate);
    }
}
