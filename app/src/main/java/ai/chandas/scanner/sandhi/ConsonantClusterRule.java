package ai.chandas.scanner.sandhi;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Proposes a word boundary in front of every run of two or more bare consonant letters, except at the line start.
 */
final class ConsonantClusterRule implements SandhiRule {

    static final String NAME = "consonant-cluster-split";

    private static final Pattern CLUSTER = Pattern.compile("[क-ह]{2,}");

    @Override
    public List<Rewrite> apply(String text) {
        List<Rewrite> rewrites = new ArrayList<>();
        Matcher matcher = CLUSTER.matcher(text);
        while (matcher.find()) {
            int start = matcher.start();
            if (start > 0) {
                rewrites.add(new Rewrite(text.substring(0, start) + " " + text.substring(start), NAME));
            }
        }
        return rewrites;
    }
}
