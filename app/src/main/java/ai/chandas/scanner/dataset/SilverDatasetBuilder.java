package ai.chandas.scanner.dataset;

import ai.chandas.scanner.inference.CandidateAnalysis;
import ai.chandas.scanner.inference.InferenceResult;
import ai.chandas.scanner.inference.MeterInferenceService;
import ai.chandas.scanner.text.TextNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a plain-text file of verse lines into silver-labelled JSONL, one {@link SilverRecord} per non-blank line.
 */
public class SilverDatasetBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(SilverDatasetBuilder.class);

    private final MeterInferenceService inferenceService;
    private final TextNormalizer normalizer;
    private final ObjectMapper objectMapper;

    public SilverDatasetBuilder(MeterInferenceService inferenceService) {
        this(inferenceService, new TextNormalizer(), new ObjectMapper());
    }

    public SilverDatasetBuilder(MeterInferenceService inferenceService, TextNormalizer normalizer, ObjectMapper objectMapper) {
        this.inferenceService = Objects.requireNonNull(inferenceService, "inferenceService");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public List<SilverRecord> label(List<String> rawLines, boolean useSandhi) {
        List<SilverRecord> records = new ArrayList<>();
        for (String raw : rawLines) {
            String line = normalizer.normalize(raw);
            if (line.isEmpty()) {
                continue;
            }
            InferenceResult result = inferenceService.infer(line, useSandhi);
            CandidateAnalysis chosen = result.chosenCandidate();
            records.add(new SilverRecord(records.size(), line, chosen.syllables(), chosen.labelCodes()));
        }
        return records;
    }

    /**
     * @return number of records written
     */
    public int build(Path input, Path output, boolean useSandhi) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
        List<String> lines;
        try {
            lines = Files.readAllLines(input, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new DatasetException("Failed to read verse lines from " + input, ex);
        }

        List<SilverRecord> records = label(lines, useSandhi);
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
                for (SilverRecord record : records) {
                    writer.write(toJsonLine(record));
                    writer.newLine();
                }
            }
        } catch (IOException ex) {
            throw new DatasetException("Failed to write silver dataset to " + output, ex);
        }
        LOGGER.info("Wrote {} records to {}", records.size(), output);
        return records.size();
    }

    private String toJsonLine(SilverRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException ex) {
            throw new DatasetException("Failed to serialize silver record " + record.id(), ex);
        }
    }
}
