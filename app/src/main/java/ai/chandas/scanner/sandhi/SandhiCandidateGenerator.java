package ai.chandas.scanner.sandhi;

import ai.chandas.scanner.lexicon.Lexicon;
import ai.chandas.scanner.text.TextNormalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Proposes ranked reverse-sandhi rewrites of a line.
 * <p>
 * The search is bounded: every rule is tried once on the line (one step), and each one-step result is
 * expanded once more (two steps). Two-step candidates average parent and child scores and concatenate
 * their rule names. Nothing recurses deeper.
 */
public class SandhiCandidateGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(SandhiCandidateGenerator.class);

    public static final int DEFAULT_MAX_CANDIDATES = 8;
    static final double TOKEN_BONUS = 0.01;

    private final List<SandhiRule> rules;
    private final List<SandhiRule> aggressiveRules;
    private final SandhiScorer scorer;

    public SandhiCandidateGenerator(Lexicon lexicon) {
        this(lexicon, ReverseSandhiRules.defaults(), ReverseSandhiRules.aggressive());
    }

    public SandhiCandidateGenerator(Lexicon lexicon, List<SandhiRule> rules, List<SandhiRule> aggressiveRules) {
        this.scorer = new SandhiScorer(Objects.requireNonNull(lexicon, "lexicon"));
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        this.aggressiveRules = List.copyOf(Objects.requireNonNull(aggressiveRules, "aggressiveRules"));
    }

    public List<SandhiCandidate> generate(String line) {
        return generate(line, DEFAULT_MAX_CANDIDATES, false);
    }

    public List<SandhiCandidate> generate(String line, int maxCandidates, boolean allowAggressive) {
        if (maxCandidates < 1) {
            throw new IllegalArgumentException("maxCandidates must be at least 1");
        }
        String original = line == null ? "" : TextNormalizer.trim(line);

        List<SandhiCandidate> pool = new ArrayList<>();
        SandhiCandidate identity = new SandhiCandidate(original,
                scorer.score(original, original, SandhiCandidate.IDENTITY_RULE),
                List.of(SandhiCandidate.IDENTITY_RULE));
        pool.add(identity);

        List<SandhiCandidate> oneStep = expandOnce(original, rules);
        pool.addAll(oneStep);

        if (allowAggressive) {
            pool.addAll(expandOnce(original, aggressiveRules));
        }

        for (SandhiCandidate parent : oneStep) {
            for (SandhiCandidate child : expandOnce(parent.text(), rules)) {
                List<String> chain = new ArrayList<>(parent.rules());
                chain.addAll(child.rules());
                double averaged = (parent.score() + child.score()) / 2.0;
                pool.add(new SandhiCandidate(child.text(), averaged, chain));
            }
        }

        List<SandhiCandidate> ranked = rank(deduplicate(pool));
        List<SandhiCandidate> result = truncate(ranked, maxCandidates, TextNormalizer.collapseWhitespace(original));
        LOGGER.debug("Generated {} sandhi candidates ({} one-step, {} distinct) for '{}'",
                result.size(), oneStep.size(), ranked.size(), original);
        return result;
    }

    /**
     * Applies every rule once to {@code text}; a text already produced by an earlier rule is skipped.
     */
    public List<SandhiCandidate> expandOnce(String text, List<SandhiRule> ruleSet) {
        List<SandhiCandidate> candidates = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (SandhiRule rule : ruleSet) {
            for (Rewrite rewrite : rule.apply(text)) {
                if (seen.add(rewrite.text())) {
                    double score = scorer.score(text, rewrite.text(), rewrite.ruleName());
                    candidates.add(new SandhiCandidate(rewrite.text(), score, List.of(rewrite.ruleName())));
                }
            }
        }
        return candidates;
    }

    private static Map<String, SandhiCandidate> deduplicate(List<SandhiCandidate> pool) {
        Map<String, SandhiCandidate> best = new LinkedHashMap<>();
        for (SandhiCandidate candidate : pool) {
            String key = TextNormalizer.collapseWhitespace(candidate.text());
            SandhiCandidate existing = best.get(key);
            if (existing == null || candidate.score() > existing.score()) {
                best.put(key, candidate.withText(key));
            }
        }
        return best;
    }

    private static List<SandhiCandidate> rank(Map<String, SandhiCandidate> distinct) {
        List<SandhiCandidate> ranked = new ArrayList<>(distinct.size());
        for (SandhiCandidate candidate : distinct.values()) {
            double boosted = candidate.score() + TOKEN_BONUS * Lexicon.tokens(candidate.text()).size();
            ranked.add(candidate.withScore(SandhiScorer.clamp(boosted)));
        }
        ranked.sort(Comparator.comparingDouble(SandhiCandidate::score).reversed());
        return ranked;
    }

    private static List<SandhiCandidate> truncate(List<SandhiCandidate> ranked, int maxCandidates, String identityText) {
        List<SandhiCandidate> kept = new ArrayList<>(ranked.subList(0, Math.min(maxCandidates, ranked.size())));
        boolean identityKept = kept.stream().anyMatch(candidate -> candidate.text().equals(identityText));
        if (!identityKept) {
            ranked.stream()
                    .filter(candidate -> candidate.text().equals(identityText))
                    .findFirst()
                    .ifPresent(identity -> kept.set(kept.size() - 1, identity));
        }
        return List.copyOf(kept);
    }
}
