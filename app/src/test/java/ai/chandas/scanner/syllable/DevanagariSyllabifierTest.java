package ai.chandas.scanner.syllable;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class DevanagariSyllabifierTest {

    private final Syllabifier syllabifier = new DevanagariSyllabifier();

    @Test
    void splitsConjunctsVowelSignsAndFinalHalant() {
        assertThat(syllabifier.syllabify("रामोऽस्ति बलवान्"))
                .containsExactly("रा", "मो", "ऽ", "स्ति", "ब", "ल", "वा", "न्");
    }

    @Test
    void foldsCombiningMarksIntoPrecedingUnit() {
        assertThat(syllabifier.syllabify("रामः अं हँस")).containsExactly("रा", "मः", "अं", "हँ", "स");
    }

    @Test
    void keepsLongConjunctChainsTogether() {
        assertThat(syllabifier.syllabify("स्त्री")).containsExactly("स्त्री");
    }

    @Test
    void treatsOtherCharactersAsSingleUnits() {
        List<String> units = syllabifier.syllabify("hello world");

        assertThat(units).hasSize(10);
        assertThat(String.join("", units)).isEqualTo("helloworld");
    }

    @Test
    void leadingCombiningMarkStandsAlone() {
        assertThat(syllabifier.syllabify("ंक")).containsExactly("ं", "क");
    }

    @Test
    void concatenationReconstructsInputWithoutWhitespace() {
        String line = "धर्मक्षेत्रे कुरुक्षेत्रे समवेता युयुत्सवः";

        List<String> units = syllabifier.syllabify(line);

        assertThat(String.join("", units)).isEqualTo(line.replace(" ", ""));
        assertThat(units).allSatisfy(unit -> assertThat(unit).isNotBlank());
    }

    @Test
    void returnsEmptyListForBlankInput() {
        assertThat(syllabifier.syllabify("   ")).isEmpty();
        assertThat(syllabifier.syllabify(null)).isEmpty();
    }

    @Test
    void noBreakSpaceSeparatesUnitsWithoutBecomingOne() {
        assertThat(syllabifier.syllabify("राम\u00A0अस्ति")).containsExactly("रा", "म", "अ", "स्ति");
        assertThat(syllabifier.syllabify("\u00A0\u202F")).isEmpty();
    }
}
