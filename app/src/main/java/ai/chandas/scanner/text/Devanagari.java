package ai.chandas.scanner.text;

/**
 * Character classes of the Devanagari block used by segmentation, weighting and sandhi rules.
 */
public final class Devanagari {

    public static final char CHANDRABINDU = 'ँ';
    public static final char ANUSVARA = 'ं';
    public static final char VISARGA = 'ः';
    public static final char VIRAMA = '्';
    public static final char OM = 'ॐ';
    public static final char DANDA = '।';
    public static final char DOUBLE_DANDA = '॥';

    private static final String VOWEL_SIGNS = "ािीुूृेैोौ";
    private static final String LONG_VOWEL_SIGNS = "ाीूेैोौ";
    private static final String LONG_INDEPENDENT_VOWELS = "आईऊएऐओऔ";

    private Devanagari() {
    }

    public static boolean isConsonant(int ch) {
        return ch >= 'क' && ch <= 'ह';
    }

    public static boolean isIndependentVowel(int ch) {
        return ch >= 'अ' && ch <= 'औ';
    }

    public static boolean isVowelSign(int ch) {
        return VOWEL_SIGNS.indexOf(ch) >= 0;
    }

    public static boolean isLongVowel(int ch) {
        return LONG_VOWEL_SIGNS.indexOf(ch) >= 0 || LONG_INDEPENDENT_VOWELS.indexOf(ch) >= 0;
    }

    public static boolean isCombiningMark(int ch) {
        return ch == ANUSVARA || ch == VISARGA || ch == CHANDRABINDU;
    }

    public static boolean isVirama(int ch) {
        return ch == VIRAMA;
    }

    /**
     * @return true when the token is exactly one independent vowel letter
     */
    public static boolean isIsolatedVowel(String token) {
        return token.length() == 1 && isIndependentVowel(token.charAt(0));
    }
}
