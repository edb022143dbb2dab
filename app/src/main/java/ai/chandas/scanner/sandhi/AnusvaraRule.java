package ai.chandas.scanner.sandhi;

import ai.chandas.scanner.text.Devanagari;
import java.util.ArrayList;
import java.util.List;

/**
 * Expands an anusvara into the nasal consonant homorganic with the following letter.
 * <p>
 * Each anusvara that is followed by another character yields its own rewrite. When the following
 * character belongs to no stop class, the whole line gets its anusvaras spaced out instead.
 */
final class AnusvaraRule implements SandhiRule {

    static final String SPACING_RULE = "anusvara->space";

    private enum NasalClass {
        VELAR("कखगघङ", "ङ्", "anusvara->ṅ (velar)"),
        PALATAL("चछजझञ", "ञ्", "anusvara->ñ (palatal)"),
        RETROFLEX("टठडढण", "ण्", "anusvara->ṇ (retroflex)"),
        DENTAL("तथदधन", "न्", "anusvara->n (dental)"),
        LABIAL("पफबभम", "म्", "anusvara->m (labial)");

        private final String stops;
        private final String nasal;
        private final String ruleName;

        NasalClass(String stops, String nasal, String ruleName) {
            this.stops = stops;
            this.nasal = nasal;
            this.ruleName = ruleName;
        }

        static NasalClass of(char next) {
            for (NasalClass nasalClass : values()) {
                if (nasalClass.stops.indexOf(next) >= 0) {
                    return nasalClass;
                }
            }
            return null;
        }
    }

    @Override
    public List<Rewrite> apply(String text) {
        List<Rewrite> rewrites = new ArrayList<>();
        for (int index = 0; index + 1 < text.length(); index++) {
            if (text.charAt(index) != Devanagari.ANUSVARA) {
                continue;
            }
            NasalClass nasalClass = NasalClass.of(text.charAt(index + 1));
            if (nasalClass != null) {
                String expanded = text.substring(0, index) + nasalClass.nasal + text.substring(index + 1);
                rewrites.add(new Rewrite(expanded, nasalClass.ruleName));
            } else {
                rewrites.add(new Rewrite(text.replace("ं", " ं "), SPACING_RULE));
            }
        }
        return rewrites;
    }
}
