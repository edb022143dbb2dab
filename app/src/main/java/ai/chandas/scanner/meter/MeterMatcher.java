package ai.chandas.scanner.meter;

import ai.chandas.scanner.syllable.Weight;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Scores a syllable sequence against every template of a {@link MeterLibrary}.
 * <p>
 * The total syllable count dominates: its mismatch is penalized nonlinearly and an exact count earns a bonus.
 * When the line splits exactly into the template's padas, pada structure and heavy-syllable agreement take a
 * larger share of the composite. Heavy-fraction agreement over the whole line is a secondary signal.
 */
public class MeterMatcher {

    public static final int DEFAULT_TOP_K = 3;

    static final double EXACT_TOTAL_BONUS = 0.12;
    static final double NEUTRAL_PADA_SCORE = 0.4;
    static final double MISALIGNED_PADA_WEIGHT = 0.25;

    private final MeterLibrary library;

    public MeterMatcher(MeterLibrary library) {
        this.library = Objects.requireNonNull(library, "library");
    }

    public List<MeterMatch> match(List<String> syllables, List<Weight> weights) {
        return match(syllables, weights, DEFAULT_TOP_K);
    }

    public List<MeterMatch> match(List<String> syllables, List<Weight> weights, int topK) {
        Objects.requireNonNull(syllables, "syllables");
        Objects.requireNonNull(weights, "weights");
        if (syllables.size() != weights.size()) {
            throw new IllegalArgumentException("syllables and weights must have the same length");
        }
        if (topK < 0) {
            throw new IllegalArgumentException("topK must be zero or greater");
        }
        int total = syllables.size();
        double guruFraction = heavyFraction(weights);

        List<MeterMatch> matches = new ArrayList<>(library.size());
        for (MeterTemplate template : library.templates()) {
            matches.add(score(template, total, weights, guruFraction));
        }
        matches.sort(Comparator.comparingDouble(MeterMatch::score).reversed());
        return List.copyOf(matches.subList(0, Math.min(topK, matches.size())));
    }

    private MeterMatch score(MeterTemplate template, int total, List<Weight> weights, double guruFraction) {
        int expectedTotal = template.total();
        double totalDiff = normalizedDifference(total, expectedTotal);
        double exactBonus = total == expectedTotal ? EXACT_TOTAL_BONUS : 0.0;
        double totalScore = Math.min(1.0, clamp01(1.0 - Math.pow(totalDiff, 1.5)) + exactBonus);

        double expectedHeavy = template.expectedHeavyFraction();
        boolean aligned = template.hasPadas() && total == template.padaTotal();

        double padaScore;
        List<PadaDetail> padaDetails = List.of();
        Double mismatchFraction = null;
        if (aligned) {
            padaDetails = splitIntoPadas(template.padas(), weights);
            double averageHeavy = padaDetails.stream().mapToDouble(PadaDetail::guruFraction).average().orElse(0.0);
            padaScore = 0.9 + 0.1 * agreement(averageHeavy, expectedHeavy);
        } else if (template.hasPadas()) {
            mismatchFraction = normalizedDifference(total, template.padaTotal());
            padaScore = Math.max(0.0, MISALIGNED_PADA_WEIGHT * (1.0 - mismatchFraction));
        } else {
            padaScore = NEUTRAL_PADA_SCORE;
        }

        double guruScore = agreement(guruFraction, expectedHeavy);
        double combined = aligned
                ? 0.70 * totalScore + 0.20 * padaScore + 0.10 * guruScore
                : 0.80 * totalScore + 0.10 * padaScore + 0.10 * guruScore;

        MeterMatchDetails details = new MeterMatchDetails(total, expectedTotal, totalScore, exactBonus,
                guruFraction, expectedHeavy, guruScore, padaScore, padaDetails, mismatchFraction);
        return new MeterMatch(template.name(), combined, details);
    }

    private static List<PadaDetail> splitIntoPadas(List<Integer> padas, List<Weight> weights) {
        List<PadaDetail> details = new ArrayList<>(padas.size());
        int start = 0;
        for (int index = 0; index < padas.size(); index++) {
            int length = padas.get(index);
            List<Weight> pada = weights.subList(start, start + length);
            details.add(new PadaDetail(index + 1, length, heavyFraction(pada)));
            start += length;
        }
        return details;
    }

    static double heavyFraction(List<Weight> weights) {
        long heavy = weights.stream().filter(Weight::isHeavy).count();
        return (double) heavy / Math.max(1, weights.size());
    }

    /**
     * |actual - expected| / max(actual, expected); zero when both are zero.
     */
    static double normalizedDifference(int actual, int expected) {
        int denominator = Math.max(actual, expected);
        return denominator == 0 ? 0.0 : (double) Math.abs(actual - expected) / denominator;
    }

    private static double agreement(double actual, double expected) {
        return 1.0 - Math.min(1.0, Math.abs(actual - expected));
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
