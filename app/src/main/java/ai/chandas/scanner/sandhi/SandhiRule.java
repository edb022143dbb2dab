package ai.chandas.scanner.sandhi;

import java.util.List;

/**
 * A reverse-sandhi rewrite. Returns one rewrite per way the rule fires on the text, or nothing when it does not apply.
 */
public interface SandhiRule {

    List<Rewrite> apply(String text);
}
