package ai.chandas.scanner.lexicon;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads newline-delimited word lists. A missing or unreadable file yields an empty lexicon.
 */
public class LexiconLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(LexiconLoader.class);

    public Lexicon load(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            LOGGER.info("Lexicon file {} not found; continuing without external lexicon", path);
            return Lexicon.empty();
        }
        try {
            List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
            Lexicon lexicon = Lexicon.of(lines);
            LOGGER.info("Loaded {} lexicon entries from {}", lexicon.size(), path);
            return lexicon;
        } catch (IOException ex) {
            LOGGER.warn("Failed to read lexicon file {}: {}", path, ex.getMessage());
            return Lexicon.empty();
        }
    }
}
