package org.dxworks.metamark;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.metamark.error.MetaMarkException;
import org.dxworks.metamark.json.DocumentJson;
import org.dxworks.metamark.model.Document;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = DocumentJson.mapper();
    private static final String EXTENSION = ".mmk";

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar metamark.jar <input> <output-file>");
            System.err.println("  <input>:       MetaMark file or a directory searched for *" + EXTENSION + " files");
            System.err.println("  <output-file>: Path to output JSONL file");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting MetaMark parsing...");
        System.out.println("Input: " + input.toAbsolutePath());

        MetamarkConfig config = MetamarkConfig.load();
        List<Path> files = collectDocuments(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " MetaMark files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            files.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Parsing " + file.getFileName());
                }

                Map<String, Object> result;
                try {
                    Document document = parseFile(file, config);
                    result = documentRecord(file, document);
                    successCount.incrementAndGet();
                } catch (MetaMarkException e) {
                    result = errorRecord(file, e.getKind().getName(), e.getLine(), e.getColumn(), e.getMessage());
                    reportFailure(file, e.getMessage(), errorCount);
                } catch (IOException e) {
                    result = errorRecord(file, "io", 0, 0, e.getMessage());
                    reportFailure(file, e.getMessage(), errorCount);
                }

                try {
                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(result));
                        writer.newLine();
                        writer.flush();
                    }
                } catch (IOException ioException) {
                    System.err.println("Failed to write result for " + file + ": " + ioException.getMessage());
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_parsed", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Parsing complete!");
        System.out.println("Successfully parsed: " + successCount.get() + " files");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    private static Map<String, Object> documentRecord(Path file, Document document) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("kind", "document");
        record.put("filePath", file.toString());
        record.put("document", document);
        return record;
    }

    private static Map<String, Object> errorRecord(Path file, String errorKind, int line, int column, String message) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("kind", "error");
        record.put("file", file.toString());
        record.put("errorKind", errorKind);
        record.put("line", line);
        record.put("column", column);
        record.put("error", message);
        return record;
    }

    private static void reportFailure(Path file, String message, AtomicInteger errorCount) {
        errorCount.incrementAndGet();
        synchronized (System.err) {
            System.err.println("  Error parsing " + file.getFileName() + ": " + message);
        }
    }

    static List<Path> collectDocuments(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(App::isMetaMarkFile)
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (isMetaMarkFile(input) && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean isMetaMarkFile(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(EXTENSION);
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | UncheckedIOException e) {
            return true;
        }
    }

    public static Document parseFile(Path filePath, MetamarkConfig config) throws IOException, MetaMarkException {
        String source = Files.readString(filePath, StandardCharsets.UTF_8);

        // Editors on Windows like to prepend a BOM
        if (source.startsWith("\uFEFF")) {
            source = source.substring(1);
        }

        return MetaMark.parseDocument(source, config);
    }
}
