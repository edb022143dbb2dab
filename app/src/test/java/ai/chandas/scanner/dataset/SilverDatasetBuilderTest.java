package ai.chandas.scanner.dataset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.chandas.scanner.inference.MeterInferenceService;
import ai.chandas.scanner.lexicon.Lexicon;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SilverDatasetBuilderTest {

    private final SilverDatasetBuilder builder = new SilverDatasetBuilder(new MeterInferenceService(Lexicon.bootstrap()));
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void labelsNonBlankLinesWithSequentialIds() {
        List<SilverRecord> records = builder.label(Arrays.asList("रामः।", "   ", null, "hello world"), false);

        assertThat(records).extracting(SilverRecord::id).containsExactly(0, 1);
        assertThat(records.get(0).text()).isEqualTo("रामः");
        assertThat(records.get(0).syllables()).containsExactly("रा", "मः");
        assertThat(records.get(0).labels()).containsExactly("G", "G");
        assertThat(records.get(1).labels()).hasSize(10).containsOnly("L");
    }

    @Test
    void writesOneJsonObjectPerLine(@TempDir Path tempDir) throws IOException {
        Path input = tempDir.resolve("verses.txt");
        Path output = tempDir.resolve("train").resolve("silver.jsonl");
        Files.write(input, List.of("रामोऽस्ति बलवान्", "", "सत्यम् वद"), StandardCharsets.UTF_8);

        int written = builder.build(input, output, true);

        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertThat(written).isEqualTo(2);
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).startsWith("{\"id\":0,\"text\":\"रामोऽस्ति बलवान्\",\"syllables\":[");

        JsonNode second = objectMapper.readTree(lines.get(1));
        assertThat(second.path("id").asInt()).isEqualTo(1);
        assertThat(second.path("text").asText()).isEqualTo("सत्यम् वद");
        assertThat(second.path("labels").size()).isEqualTo(second.path("syllables").size());
    }

    @Test
    void missingInputFailsWithDatasetException(@TempDir Path tempDir) {
        Throwable thrown = catchThrowable(() -> builder.build(tempDir.resolve("absent.txt"), tempDir.resolve("out.jsonl"), true));

        assertThat(thrown)
                .isInstanceOf(DatasetException.class)
                .hasMessageContaining("absent.txt")
                .hasCauseInstanceOf(IOException.class);
    }
}
