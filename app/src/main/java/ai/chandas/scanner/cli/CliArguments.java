package ai.chandas.scanner.cli;

import ai.chandas.scanner.config.LogFormat;
import ai.chandas.scanner.config.Mode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "chandas-scanner", mixinStandardHelpOptions = true, version = "chandas-scanner 0.1.0",
        description = "Infers the classical meter of a Devanagari verse line")
public class CliArguments {

    @CommandLine.Parameters(arity = "0..*", paramLabel = "TEXT", description = "Verse line for scan and syllabify modes")
    private List<String> text = new ArrayList<>();

    @CommandLine.Option(names = "--mode", converter = ModeConverter.class, description = "Execution mode: scan, syllabify, silver or export")
    private Mode mode;

    @CommandLine.Option(names = "--input", description = "Verse file (silver) or silver JSONL file (export)", paramLabel = "FILE")
    private Path input;

    @CommandLine.Option(names = "--output", description = "Destination JSONL (silver) or CSV (export) file", paramLabel = "FILE")
    private Path output;

    @CommandLine.Option(names = "--lexicon", description = "Newline-delimited word list", paramLabel = "FILE")
    private Path lexiconPath;

    @CommandLine.Option(names = "--no-sandhi", description = "Analyse the line as written, without sandhi reversal")
    private boolean noSandhi;

    @CommandLine.Option(names = "--aggressive", description = "Also try unconditional vowel splits")
    private boolean aggressive;

    @CommandLine.Option(names = "--max-candidates", description = "Maximum number of sandhi candidates to score", paramLabel = "COUNT")
    private Integer maxCandidates;

    @CommandLine.Option(names = "--top-k", description = "Number of meter matches to report", paramLabel = "COUNT")
    private Integer topK;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log scoring details")
    private boolean verbose;

    public List<String> text() {
        return text;
    }

    public Mode mode() {
        return mode;
    }

    public Path input() {
        return input;
    }

    public Path output() {
        return output;
    }

    public Path lexiconPath() {
        return lexiconPath;
    }

    public boolean noSandhi() {
        return noSandhi;
    }

    public boolean aggressive() {
        return aggressive;
    }

    public Integer maxCandidates() {
        return maxCandidates;
    }

    public Integer topK() {
        return topK;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
