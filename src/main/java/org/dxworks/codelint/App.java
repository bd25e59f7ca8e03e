package org.dxworks.codelint;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.codelint.linter.Linter;
import org.dxworks.codelint.model.FileLintResult;
import org.dxworks.codelint.model.FixResult;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar codelint.jar <input-folder> <output-file> [--fix]");
            System.err.println("  <input-folder>: Path to a TypeScript source directory or file");
            System.err.println("  <output-file>:  Path to output JSONL file");
            System.err.println("  --fix:          Write fixed sources back to disk");
            System.err.println("Rules: " + String.join(", ", RuleRegistry.ruleNames()));
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }
        boolean fix = args.length > 2 && "--fix".equals(args[2]);

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        CodelintConfig config;
        try {
            config = CodelintConfig.load();
        } catch (CodelintConfigException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
            return;
        }
        Linter linter = config.createLinter();

        System.out.println("Starting lint" + (fix ? " with fixes" : "") + "...");
        System.out.println("Input: " + input.toAbsolutePath());

        List<Path> files = collectSourceFiles(input, config);
        System.out.println("Found " + files.size() + " TypeScript files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);
        AtomicLong violationCount = new AtomicLong(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            runInfo.put("fix", fix);
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            files.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Linting " + file.getFileName());
                }

                try {
                    FileLintResult result = lintFile(file, linter, fix);
                    violationCount.addAndGet(result.violations.size());

                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(result));
                        writer.newLine();
                        writer.flush();
                    }
                    successCount.incrementAndGet();
                } catch (Exception e) {
                    Map<String, String> error = new HashMap<>();
                    error.put("kind", "error");
                    error.put("file", file.toString());
                    error.put("error", e.getMessage());

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
                        System.err.println("  Error linting " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_linted", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("violations", violationCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Lint complete!");
        System.out.println("Successfully linted: " + successCount.get() + " files");
        System.out.println("Violations: " + violationCount.get());
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    static List<Path> collectSourceFiles(Path input, CodelintConfig config) throws IOException {
        List<Path> files = new ArrayList<>();
        SourceFileDetector detector = new SourceFileDetector(config.getExcludes());
        int maxFileLines = config.getMaxFileLines();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(p -> detector.accepts(input, p))
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (detector.accepts(input, input) && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (Exception e) {
            // unreadable or not UTF-8: let lintFile report it
            return true;
        }
    }

    public static FileLintResult lintFile(Path filePath, Linter linter, boolean fix) throws IOException {
        String sourceCode = Files.readString(filePath, StandardCharsets.UTF_8);

        // Remove BOM if present
        boolean hasBom = sourceCode.startsWith("\uFEFF");
        if (hasBom) {
            sourceCode = sourceCode.substring(1);
        }

        FileLintResult result = new FileLintResult();
        result.filePath = filePath.toString();
        if (!fix) {
            result.violations = linter.lint(filePath.toString(), sourceCode);
            return result;
        }

        FixResult fixResult = linter.fix(filePath.toString(), sourceCode);
        if (fixResult.isChanged(sourceCode)) {
            String output = hasBom ? "\uFEFF" + fixResult.output : fixResult.output;
            Files.writeString(filePath, output, StandardCharsets.UTF_8);
        }
        result.violations = fixResult.remaining;
        result.fixPasses = fixResult.passes;
        return result;
    }
}
