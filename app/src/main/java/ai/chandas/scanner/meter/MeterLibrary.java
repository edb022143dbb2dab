package ai.chandas.scanner.meter;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only table of meter templates, iterated in declaration order.
 */
public final class MeterLibrary {

    private static final MeterLibrary CLASSICAL = new MeterLibrary(List.of(
            MeterTemplate.evenPadas("Gayatri", 8, 3),
            MeterTemplate.evenPadas("Anushtubh", 8, 4),
            MeterTemplate.evenPadas("Tristubh", 11, 4),
            MeterTemplate.evenPadas("Jagati", 12, 4),
            MeterTemplate.evenPadas("Pankti", 5, 5),
            MeterTemplate.evenPadas("Vasantatilaka", 14, 4),
            MeterTemplate.evenPadas("Mandakranta", 17, 4),
            MeterTemplate.evenPadas("ShardulaVikridita", 19, 4)));

    private final List<MeterTemplate> templates;

    public MeterLibrary(List<MeterTemplate> templates) {
        this.templates = List.copyOf(Objects.requireNonNull(templates, "templates"));
        if (this.templates.isEmpty()) {
            throw new IllegalArgumentException("meter library must contain at least one template");
        }
    }

    /**
     * Gayatri, Anushtubh, Tristubh, Jagati, Pankti, Vasantatilaka, Mandakranta and Shardulavikridita.
     */
    public static MeterLibrary classical() {
        return CLASSICAL;
    }

    public List<MeterTemplate> templates() {
        return templates;
    }

    public Optional<MeterTemplate> find(String name) {
        return templates.stream().filter(template -> template.name().equalsIgnoreCase(name)).findFirst();
    }

    public boolean hasTotal(int syllableCount) {
        return templates.stream().anyMatch(template -> template.total() == syllableCount);
    }

    public int size() {
        return templates.size();
    }
}
