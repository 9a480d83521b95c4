package org.dxworks.blockframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.blockframe.analyzer.LanguageAnalyzer;
import org.dxworks.blockframe.analyzer.markdown.MarkdownAnalyzer;
import org.dxworks.blockframe.analyzer.markdown.format.MarkdownFormatter;
import org.dxworks.blockframe.model.Analysis;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String FORMAT_FLAG = "--format";

    public static void main(String[] args) throws Exception {
        if (args.length >= 2 && FORMAT_FLAG.equals(args[0])) {
            Path input = Paths.get(args[1]);
            if (!Files.isRegularFile(input)) {
                System.err.println("Error: Input file does not exist: " + input);
                System.exit(1);
            }
            Path output = args.length >= 3 ? Paths.get(args[2]) : null;
            formatFile(input, output);
            return;
        }

        if (args.length < 2 || args[0].startsWith("--")) {
            printUsage();
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        // Create parent directories if they don't exist
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting markdown segmentation...");
        System.out.println("Input: " + input.toAbsolutePath());

        RunSummary summary = segmentAll(input, jsonlOutput, BlockframeConfig.load());

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Segmentation complete!");
        System.out.println("Successfully segmented: " + summary.succeeded() + " files");
        if (summary.failed() > 0) {
            System.out.println("Errors: " + summary.failed());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar blockframe.jar <input-folder> <output-file>");
        System.err.println("       java -jar blockframe.jar --format <input-file> [<output-file>]");
        System.err.println("  <input-folder>: Path to a markdown file or a directory of markdown files");
        System.err.println("  <output-file>:  Path to output JSONL file");
        System.err.println("  --format:       Normalize a markdown file (stdout when no output file is given)");
    }

    /**
     * Segments every markdown file under {@code input} and writes one JSONL record per file,
     * framed by a {@code run} header and a {@code done} footer. Failing files produce an
     * {@code error} record and do not stop the run.
     */
    public static RunSummary segmentAll(Path input, Path jsonlOutput, BlockframeConfig config) throws IOException {
        List<Path> files = collectMarkdownFiles(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " markdown files");

        LanguageAnalyzer analyzer = new MarkdownAnalyzer(config.isNormalizeBeforeSegmenting());
        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            files.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Segmenting: " + file.getFileName());
                }

                try {
                    Analysis analysis = analyzeFile(file, analyzer);

                    // Write result immediately (synchronized to avoid concurrent writes)
                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(analysis));
                        writer.newLine();
                        writer.flush();
                    }

                    successCount.incrementAndGet();
                } catch (Exception e) {
                    Map<String, String> error = new HashMap<>();
                    error.put("kind", "error");
                    error.put("file", file.toString());
                    error.put("error", String.valueOf(e.getMessage()));

                    try {
                        synchronized (writer) {
                            writer.write(MAPPER.writeValueAsString(error));
                            writer.newLine();
                            writer.flush();
                        }
                    } catch (IOException ioException) {
                        System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                    }

                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error segmenting " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_segmented", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        return new RunSummary(files.size(), successCount.get(), errorCount.get());
    }

    static List<Path> collectMarkdownFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(MarkdownFileDetector::isMarkdown)
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted(Comparator.naturalOrder())
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (MarkdownFileDetector.isMarkdown(input) && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (Exception e) {
            // unreadable here means unreadable later too; let analyzeFile report it
            return true;
        }
    }

    public static Analysis analyzeFile(Path filePath, LanguageAnalyzer analyzer) throws IOException {
        return analyzer.analyze(filePath.toString(), readMarkdown(filePath));
    }

    static String readMarkdown(Path filePath) throws IOException {
        String source = Files.readString(filePath, StandardCharsets.UTF_8);

        // Remove BOM if present
        if (source.startsWith("\uFEFF")) {
            source = source.substring(1);
        }
        return source;
    }

    static void formatFile(Path input, Path output) throws IOException {
        String formatted = MarkdownFormatter.format(readMarkdown(input));
        if (output == null) {
            System.out.println(formatted);
            return;
        }
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        Files.writeString(output, formatted + "\n", StandardCharsets.UTF_8);
    }

    public record RunSummary(int totalFiles, int succeeded, int failed) {
    }
}
