package ai.chandas.scanner.lexicon;

import ai.chandas.scanner.text.TextNormalizer;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable set of known word forms used to reward recognizable tokens in candidate splits.
 */
public final class Lexicon {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final List<String> BOOTSTRAP_WORDS = List.of(
            "राम", "रामः", "रामो", "सीता", "सीतायै", "सीताम्", "कृष्ण", "कृष्णः", "गुरु",
            "शिष्य", "विद्या", "धर्म", "धर्मः", "सत्यम्", "अहम्", "पाण्डव", "हनुमान", "लङ्का",
            "अर्जुन", "भीम", "गद", "वेद", "ज्ञान", "शिव", "शिवः", "लोका", "सुख", "बलवान्",
            "अस्ति", "गच्छति", "व्रज", "गगन", "सागर");

    private static final Lexicon EMPTY = new Lexicon(Set.of());

    private final Set<String> words;

    private Lexicon(Set<String> words) {
        this.words = words;
    }

    public static Lexicon empty() {
        return EMPTY;
    }

    public static Lexicon of(Collection<String> words) {
        Objects.requireNonNull(words, "words");
        Set<String> copy = new LinkedHashSet<>();
        for (String word : words) {
            String trimmed = word == null ? "" : TextNormalizer.trim(word);
            if (!trimmed.isEmpty()) {
                copy.add(trimmed);
            }
        }
        return new Lexicon(Set.copyOf(copy));
    }

    public static Lexicon of(String... words) {
        return of(Arrays.asList(words));
    }

    /**
     * Small built-in word list that seeds ranking before any lexicon file is available.
     */
    public static Lexicon bootstrap() {
        return of(BOOTSTRAP_WORDS);
    }

    public Lexicon union(Lexicon other) {
        Objects.requireNonNull(other, "other");
        if (other.words.isEmpty()) {
            return this;
        }
        Set<String> merged = new LinkedHashSet<>(words);
        merged.addAll(other.words);
        return new Lexicon(Set.copyOf(merged));
    }

    public boolean contains(String word) {
        return word != null && words.contains(word);
    }

    public int size() {
        return words.size();
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }

    /**
     * Fraction of whitespace-delimited tokens of {@code text} found in this lexicon; zero for blank text.
     */
    public double coverage(String text) {
        List<String> tokens = tokens(text);
        if (tokens.isEmpty()) {
            return 0.0;
        }
        long found = tokens.stream().filter(words::contains).count();
        return (double) found / tokens.size();
    }

    public static List<String> tokens(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(WHITESPACE.split(text))
                .filter(token -> !token.isEmpty())
                .toList();
    }
}
