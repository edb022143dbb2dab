package ai.chandas.scanner.inference;

import ai.chandas.scanner.lexicon.Lexicon;
import ai.chandas.scanner.meter.MeterLibrary;
import ai.chandas.scanner.meter.MeterMatch;
import ai.chandas.scanner.meter.MeterMatcher;
import ai.chandas.scanner.meter.MeterTemplate;
import ai.chandas.scanner.sandhi.SandhiCandidate;
import ai.chandas.scanner.sandhi.SandhiCandidateGenerator;
import ai.chandas.scanner.syllable.DevanagariSyllabifier;
import ai.chandas.scanner.syllable.Syllabifier;
import ai.chandas.scanner.syllable.Weight;
import ai.chandas.scanner.syllable.WeightClassifier;
import ai.chandas.scanner.syllable.WeightLabel;
import ai.chandas.scanner.text.Devanagari;
import ai.chandas.scanner.text.TextNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the full analysis of one verse line: normalization, sandhi candidates, syllabification and weighting
 * of every candidate, candidate ranking, then meter matching of the best candidate.
 * <p>
 * Instances are immutable and may be shared between threads.
 */
public class MeterInferenceService {

    private static final Logger LOGGER = LoggerFactory.getLogger(MeterInferenceService.class);

    static final double CONFIDENCE_WEIGHT = 0.55;
    static final double LEXICON_WEIGHT = 0.15;
    static final double ISOLATED_VOWEL_WEIGHT = 0.9;
    static final double CANDIDATE_WEIGHT = 0.9;
    static final double GENERATOR_WEIGHT = 0.1;
    static final double EXACT_METER_BONUS = 0.30;
    static final double NEAR_METER_BONUS = 0.20;

    private final TextNormalizer normalizer;
    private final SandhiCandidateGenerator generator;
    private final Syllabifier syllabifier;
    private final WeightClassifier classifier;
    private final MeterMatcher matcher;
    private final MeterLibrary library;
    private final Lexicon lexicon;
    private final InferenceSettings settings;

    public MeterInferenceService(Lexicon lexicon) {
        this(lexicon, MeterLibrary.classical(), InferenceSettings.defaults());
    }

    /**
     * @param lexicon words read from the lexicon file. Candidate overlap is scored against these words only;
     *                the sandhi generator also knows the bootstrap words.
     */
    public MeterInferenceService(Lexicon lexicon, MeterLibrary library, InferenceSettings settings) {
        this(new TextNormalizer(), new SandhiCandidateGenerator(Lexicon.bootstrap().union(lexicon)),
                new DevanagariSyllabifier(), new WeightClassifier(), library, lexicon, settings);
    }

    public MeterInferenceService(TextNormalizer normalizer,
                                 SandhiCandidateGenerator generator,
                                 Syllabifier syllabifier,
                                 WeightClassifier classifier,
                                 MeterLibrary library,
                                 Lexicon lexicon,
                                 InferenceSettings settings) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.generator = Objects.requireNonNull(generator, "generator");
        this.syllabifier = Objects.requireNonNull(syllabifier, "syllabifier");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.library = Objects.requireNonNull(library, "library");
        this.lexicon = Objects.requireNonNull(lexicon, "lexicon");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.matcher = new MeterMatcher(library);
    }

    public InferenceResult infer(String text, boolean useSandhi) {
        String line = normalizer.normalize(text);
        List<SandhiCandidate> sandhiCandidates = useSandhi
                ? generator.generate(line, settings.maxCandidates(), settings.allowAggressive())
                : List.of();

        List<CandidateAnalysis> analyses = new ArrayList<>();
        if (useSandhi) {
            for (SandhiCandidate candidate : sandhiCandidates) {
                analyses.add(analyse(candidate.text(), candidate.rules(), candidate.score()));
            }
        } else {
            analyses.add(analyse(line, List.of(), null));
        }

        CandidateAnalysis chosen = analyses.get(0);
        for (CandidateAnalysis analysis : analyses) {
            if (analysis.combinedScore() > chosen.combinedScore()) {
                chosen = analysis;
            }
        }

        List<MeterMatch> topMeters = matcher.match(chosen.syllables(), chosen.labels(), settings.topMeters());
        LOGGER.debug("Scored {} candidates for '{}'; chose '{}' ({} syllables, best meter {})",
                analyses.size(), line, chosen.candidate(), chosen.syllables().size(),
                topMeters.isEmpty() ? "none" : topMeters.get(0).meter());
        return new InferenceResult(line, analyses, chosen, topMeters);
    }

    public List<String> syllabify(String text) {
        return syllabifier.syllabify(normalizer.normalize(text));
    }

    private CandidateAnalysis analyse(String candidate, List<String> rules, Double generatorScore) {
        List<String> syllables = syllabifier.syllabify(candidate);
        List<WeightLabel> labels = classifier.classifyAll(syllables);
        List<Weight> weights = labels.stream().map(WeightLabel::weight).toList();
        List<Double> confidences = labels.stream().map(WeightLabel::confidence).toList();
        List<String> reasons = labels.stream().map(WeightLabel::reason).toList();

        double averageConfidence = confidences.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        long isolatedVowels = syllables.stream().filter(Devanagari::isIsolatedVowel).count();
        double isolatedFraction = (double) isolatedVowels / Math.max(1, syllables.size());
        double lexiconScore = lexicon.coverage(candidate);
        double meterBonus = meterBonus(syllables.size());

        double combined = CONFIDENCE_WEIGHT * averageConfidence
                + LEXICON_WEIGHT * lexiconScore
                + meterBonus
                - ISOLATED_VOWEL_WEIGHT * isolatedFraction;
        if (generatorScore != null) {
            combined = CANDIDATE_WEIGHT * combined + GENERATOR_WEIGHT * generatorScore;
        }
        return new CandidateAnalysis(candidate, syllables, weights, confidences, reasons, rules, generatorScore,
                averageConfidence, lexiconScore, isolatedFraction, meterBonus, combined);
    }

    /**
     * Bonus for a syllable count that fits some template: full bonus on an exact total, graded otherwise.
     */
    double meterBonus(int syllableCount) {
        if (library.hasTotal(syllableCount)) {
            return EXACT_METER_BONUS;
        }
        double best = 0.0;
        for (MeterTemplate template : library.templates()) {
            int expected = template.total();
            double diff = (double) Math.abs(syllableCount - expected) / Math.max(syllableCount, expected);
            best = Math.max(best, Math.max(0.0, NEAR_METER_BONUS * (1.0 - diff)));
        }
        return best;
    }
}
