package ai.chandas.scanner.lexicon;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LexiconLoaderTest {

    private final LexiconLoader loader = new LexiconLoader();

    @Test
    void readsOneWordPerLine(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("lexicon.txt");
        Files.write(file, List.of("नमः", "", "शिवाय"), StandardCharsets.UTF_8);

        Lexicon lexicon = loader.load(file);

        assertThat(lexicon.size()).isEqualTo(2);
        assertThat(lexicon.contains("शिवाय")).isTrue();
    }

    @Test
    void missingFileYieldsEmptyLexicon(@TempDir Path tempDir) {
        assertThat(loader.load(tempDir.resolve("absent.txt")).isEmpty()).isTrue();
    }

    @Test
    void fileContentsAreNotMixedWithBootstrapWords(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("lexicon.txt");
        Files.write(file, List.of("नमः"), StandardCharsets.UTF_8);

        Lexicon lexicon = loader.load(file);

        assertThat(lexicon.contains("नमः")).isTrue();
        assertThat(lexicon.contains("बलवान्")).isFalse();
    }
}
