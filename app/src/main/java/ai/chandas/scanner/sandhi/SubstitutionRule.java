package ai.chandas.scanner.sandhi;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces every match of a pattern at once. Fires only when the pattern occurs in the text.
 */
public final class SubstitutionRule implements SandhiRule {

    private final Pattern pattern;
    private final String replacement;
    private final String name;

    /**
     * @param regex       pattern to look for
     * @param replacement {@link Matcher#replaceAll(String)} replacement, group references allowed
     * @param name        rule name recorded on produced candidates
     */
    public SubstitutionRule(String regex, String replacement, String name) {
        this.pattern = Pattern.compile(Objects.requireNonNull(regex, "regex"));
        this.replacement = Objects.requireNonNull(replacement, "replacement");
        this.name = Objects.requireNonNull(name, "name");
    }

    public static SubstitutionRule literal(String target, String replacement, String name) {
        return new SubstitutionRule(Pattern.quote(target), Matcher.quoteReplacement(replacement), name);
    }

    @Override
    public List<Rewrite> apply(String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return List.of();
        }
        return List.of(new Rewrite(matcher.replaceAll(replacement), name));
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "SubstitutionRule[" + name + "]";
    }
}
