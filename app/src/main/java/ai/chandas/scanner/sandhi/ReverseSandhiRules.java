package ai.chandas.scanner.sandhi;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered catalog of reverse-sandhi rules.
 * <p>
 * Order matters: within one expansion step, when two rules produce the same text only the first is kept,
 * and rule names are part of the silver-data contract.
 */
public final class ReverseSandhiRules {

    private static final List<SandhiRule> SUBSTITUTIONS = List.of(
            SubstitutionRule.literal("ा", "अअ", "savarṇa-dīrgha"),
            SubstitutionRule.literal("े", "अइ", "a+i -> e (guṇa/saṃyoga reverse)"),
            SubstitutionRule.literal("ो", "अउ", "a+u -> o"),
            SubstitutionRule.literal("ी", "इइ", "ī -> i+i (conservative)"),
            SubstitutionRule.literal("ू", "उउ", "ū -> u+u (conservative)"),
            SubstitutionRule.literal("ः", " ः ", "visarga-space"),
            SubstitutionRule.literal("ं", " ं ", "anusvara-space"),
            SubstitutionRule.literal("ऽ", " ", "avagraha-split"),
            new SubstitutionRule("([क-ह])\\1", "$1 $1", "double-consonant-split"),
            SubstitutionRule.literal("ौ", "अउ", "au -> a+u (reverse)"),
            SubstitutionRule.literal("ै", "अइ", "ai -> a+i (reverse)"));

    private static final List<SandhiRule> VOWEL_VARIANTS = List.of(
            SubstitutionRule.literal("े", "अइ", "e->a+i"),
            SubstitutionRule.literal("े", "अी", "e->a+ī"),
            SubstitutionRule.literal("ो", "अउ", "o->a+u"),
            SubstitutionRule.literal("ो", "अू", "o->a+ū"),
            SubstitutionRule.literal("ौ", "अउ", "au->a+u"),
            SubstitutionRule.literal("ै", "अइ", "ai->a+i"),
            SubstitutionRule.literal("ा", "अअ", "ā->a+a"));

    private static final List<SandhiRule> VISARGA_VARIANTS = List.of(
            SubstitutionRule.literal("ः", "स् ", "visarga->s + space (conservative)"),
            SubstitutionRule.literal("ः", "त् ", "visarga->t + space (conservative)"));

    private static final List<SandhiRule> AGGRESSIVE = List.of(
            SubstitutionRule.literal("े", "अइ", "aggr-e->a+i"),
            SubstitutionRule.literal("ो", "अउ", "aggr-o->a+u"));

    private static final List<SandhiRule> DEFAULTS = buildDefaults();

    private ReverseSandhiRules() {
    }

    /**
     * Rules tried on every expansion step: plain substitutions, vowel, visarga and anusvara variants, then cluster splits.
     */
    public static List<SandhiRule> defaults() {
        return DEFAULTS;
    }

    /**
     * Unconditional vowel splits added only when aggressive generation is requested.
     */
    public static List<SandhiRule> aggressive() {
        return AGGRESSIVE;
    }

    private static List<SandhiRule> buildDefaults() {
        List<SandhiRule> rules = new ArrayList<>(SUBSTITUTIONS);
        rules.addAll(VOWEL_VARIANTS);
        rules.addAll(VISARGA_VARIANTS);
        rules.add(new AnusvaraRule());
        rules.add(new ConsonantClusterRule());
        return List.copyOf(rules);
    }
}
