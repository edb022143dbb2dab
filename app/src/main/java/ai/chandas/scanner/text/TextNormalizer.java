package ai.chandas.scanner.text;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Canonicalizes raw verse text before analysis.
 * <p>
 * Dandas and punctuation become whitespace so that pada boundaries survive as word breaks,
 * while anusvara, visarga, chandrabindu, virama and avagraha are left untouched.
 */
public class TextNormalizer {

    private static final Pattern DANDA_RUN = Pattern.compile("[" + Devanagari.DANDA + Devanagari.DOUBLE_DANDA + "]+");
    private static final Pattern OM_SIGN = Pattern.compile(String.valueOf(Devanagari.OM));
    private static final Pattern PUNCTUATION = Pattern.compile(
            "[\\u2000-\\u206F\\u2E00-\\u2E7F.,;:\"?!()\\[\\]{}—\\-–/\\\\|<>@#$%^&*+=_`~]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern EDGE_WHITESPACE = Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);

    public String normalize(String text) {
        if (text == null) {
            return "";
        }
        String normalized = Normalizer.normalize(text, Normalizer.Form.NFC);
        normalized = DANDA_RUN.matcher(normalized).replaceAll(" ");
        normalized = OM_SIGN.matcher(normalized).replaceAll(" " + Devanagari.OM + " ");
        normalized = PUNCTUATION.matcher(normalized).replaceAll(" ");
        normalized = stripControlCharacters(normalized);
        return collapseWhitespace(normalized);
    }

    /**
     * Collapses whitespace runs to a single space and trims, without touching any other character.
     */
    public static String collapseWhitespace(String text) {
        return trim(WHITESPACE_RUN.matcher(text).replaceAll(" "));
    }

    /**
     * Removes leading and trailing Unicode white space, no-break spaces included.
     */
    public static String trim(String text) {
        return EDGE_WHITESPACE.matcher(text).replaceAll("");
    }

    private static String stripControlCharacters(String text) {
        StringBuilder builder = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch >= 0x20) {
                builder.append(ch);
            } else if (Character.isWhitespace(ch)) {
                // tabs and newlines still separate words
                builder.append(' ');
            }
        }
        return builder.toString();
    }
}
