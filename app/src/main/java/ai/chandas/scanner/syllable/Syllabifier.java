package ai.chandas.scanner.syllable;

import java.util.List;

/**
 * Splits a line of text into ordered prosodic units.
 */
public interface Syllabifier {

    List<String> syllabify(String text);
}
