package ai.chandas.scanner.dataset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts silver JSONL into a CSV sheet for human annotators.
 */
public class AnnotationExporter {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnnotationExporter.class);
    private static final String JOINER = "|";

    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper;

    public AnnotationExporter() {
        this(new ObjectMapper(), new CsvMapper());
    }

    public AnnotationExporter(ObjectMapper objectMapper, CsvMapper csvMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.csvMapper = Objects.requireNonNull(csvMapper, "csvMapper");
    }

    /**
     * @return number of rows written, header excluded
     */
    public int export(Path jsonl, Path csv) {
        Objects.requireNonNull(jsonl, "jsonl");
        Objects.requireNonNull(csv, "csv");
        List<AnnotationRow> rows = readRows(jsonl);

        CsvSchema schema = csvMapper.schemaFor(AnnotationRow.class).withHeader();
        try {
            Path parent = csv.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(csv, StandardCharsets.UTF_8);
                 SequenceWriter sequence = csvMapper.writer(schema).writeValues(writer)) {
                sequence.writeAll(rows);
            }
        } catch (IOException ex) {
            throw new DatasetException("Failed to write annotation sheet to " + csv, ex);
        }
        LOGGER.info("Exported {} rows to {}", rows.size(), csv);
        return rows.size();
    }

    List<AnnotationRow> readRows(Path jsonl) {
        List<String> lines;
        try {
            lines = Files.readAllLines(jsonl, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new DatasetException("Failed to read silver dataset from " + jsonl, ex);
        }
        List<AnnotationRow> rows = new ArrayList<>();
        for (int index = 0; index < lines.size(); index++) {
            String line = lines.get(index);
            if (line.isBlank()) {
                continue;
            }
            try {
                rows.add(toRow(objectMapper.readTree(line)));
            } catch (IOException ex) {
                throw new DatasetException("Malformed JSON on line " + (index + 1) + " of " + jsonl, ex);
            }
        }
        return rows;
    }

    private static AnnotationRow toRow(JsonNode node) {
        return new AnnotationRow(
                scalar(node.path("id")),
                scalar(node.path("text")),
                joined(node.path("syllables")),
                joined(node.path("labels")));
    }

    private static String scalar(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? "" : node.asText();
    }

    private static String joined(JsonNode node) {
        if (!node.isArray()) {
            return "";
        }
        return StreamSupport.stream(node.spliterator(), false)
                .map(JsonNode::asText)
                .collect(Collectors.joining(JOINER));
    }
}
