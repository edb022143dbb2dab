package ai.chandas.scanner.syllable;

import ai.chandas.scanner.text.Devanagari;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Single-pass grapheme segmenter for Devanagari.
 * <p>
 * A unit is a consonant conjunct chain with an optional vowel sign, an independent vowel with an
 * optional combining mark, or any other single code point. A combining mark directly after a unit is
 * folded into it. Whitespace only separates units; no other character is ever dropped.
 */
public class DevanagariSyllabifier implements Syllabifier {

    @Override
    public List<String> syllabify(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptyList();
        }
        String line = text;
        int length = line.length();
        List<String> units = new ArrayList<>();
        int index = 0;
        while (index < length) {
            char current = line.charAt(index);
            if (isSeparator(current)) {
                index++;
                continue;
            }
            int start = index;
            if (Devanagari.isConsonant(current)) {
                index = consumeConjunct(line, index);
                if (index < length && Devanagari.isVowelSign(line.charAt(index))) {
                    index++;
                }
            } else if (Devanagari.isIndependentVowel(current)) {
                index++;
                if (index < length && Devanagari.isCombiningMark(line.charAt(index))) {
                    index++;
                }
            } else {
                index += Character.charCount(line.codePointAt(index));
            }
            if (index < length && Devanagari.isCombiningMark(line.charAt(index))) {
                index++;
            }
            units.add(line.substring(start, index));
        }
        return units;
    }

    private static boolean isSeparator(char ch) {
        return Character.isWhitespace(ch) || Character.isSpaceChar(ch);
    }

    private int consumeConjunct(String line, int index) {
        int length = line.length();
        while (index < length && Devanagari.isConsonant(line.charAt(index))) {
            index++;
            if (index < length && Devanagari.isVirama(line.charAt(index))) {
                index++;
                continue;
            }
            break;
        }
        return index;
    }
}
