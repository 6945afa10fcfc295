package org.dxworks.tagframe;

import org.dxworks.tagframe.analyzer.MarkupAnalyzer;
import org.dxworks.tagframe.model.Analysis;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final String IGNORE_FILE_NAME = ".ignore";

    private static volatile TagframeConfig config = TagframeConfig.defaults();
    private static volatile Map<Language, MarkupAnalyzer> analyzers = LanguageRegistry.buildAnalyzers(config);

    public static void main(String[] args) throws IOException {
        if (args.length < 2) {
            System.err.println("Usage: java -jar tagframe.jar <input> <output.jsonl>");
            System.err.println("  <input>:        a markup file, or a directory searched recursively");
            System.err.println("  <output.jsonl>: one element outline per line, between run and done records");
            System.err.println("Recognized files: .html .htm .xhtml, .cshtml .razor, .md .markdown");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Input not found: " + input);
            System.exit(1);
        }

        Path output = Paths.get(args[1]);
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }

        init(TagframeConfig.load());
        List<Path> files = collectSourceFiles(input, config.getMaxFileLines(), IgnoreFile.load(Paths.get(IGNORE_FILE_NAME)));
        System.out.println("tagframe: " + files.size() + " markup files under " + input.toAbsolutePath());

        try (JsonlReport report = new JsonlReport(Files.newBufferedWriter(output, StandardCharsets.UTF_8))) {
            run(files, input, report);

            System.out.println("Folded " + report.getFilesAnalyzed() + " files"
                    + (report.getFilesWithErrors() > 0 ? ", " + report.getFilesWithErrors() + " failed" : "")
                    + (report.getRoundTripFailures() > 0 ? ", " + report.getRoundTripFailures() + " did not round-trip" : ""));
        }
        System.out.println("Outlines written to " + output.toAbsolutePath());
    }

    static void run(List<Path> files, Path input, JsonlReport report) throws IOException {
        report.runStarted(input, files.size(), config);
        AtomicInteger progress = new AtomicInteger();

        files.parallelStream().forEach(file -> {
            Optional<Language> language = LanguageDetector.detectLanguage(file);
            if (language.isEmpty()) {
                return;
            }
            int current = progress.incrementAndGet();
            synchronized (System.out) {
                System.out.println("[" + current + "/" + files.size() + "] " + language.get().getName() + " " + file);
            }

            try {
                report.fileAnalyzed(analyzeFile(file, language.get()));
            } catch (Exception | StackOverflowError e) {
                synchronized (System.err) {
                    System.err.println("  " + file.getFileName() + " failed: " + e);
                }
                try {
                    report.fileFailed(file, language.get(), e);
                } catch (IOException writeError) {
                    throw new UncheckedIOException(writeError);
                }
            }
        });

        report.runDone();
    }

    /**
     * Replaces the configuration and rebuilds the analyzers. Used by the CLI after loading
     * the config file and by tests that need non-default settings.
     */
    public static void init(TagframeConfig newConfig) {
        config = newConfig;
        analyzers = LanguageRegistry.buildAnalyzers(newConfig);
    }

    static List<Path> collectSourceFiles(Path input, int maxFileLines) throws IOException {
        return collectSourceFiles(input, maxFileLines, IgnoreFile.empty());
    }

    static List<Path> collectSourceFiles(Path input, int maxFileLines, IgnoreFile ignoreFile) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(p -> LanguageDetector.detectLanguage(p).isPresent())
                      .filter(ignoreFile::accepts)
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (LanguageDetector.detectLanguage(input).isPresent()
                    && ignoreFile.accepts(input)
                    && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | UncheckedIOException e) {
            // Unreadable or not valid UTF-8: let the analysis report it.
            return true;
        }
    }

    public static Analysis analyzeFile(Path filePath, Language language) throws IOException {
        String sourceCode = Files.readString(filePath, StandardCharsets.UTF_8);

        // Remove BOM if present
        if (sourceCode.startsWith("\uFEFF")) {
            sourceCode = sourceCode.substring(1);
        }

        MarkupAnalyzer analyzer = analyzers.get(language);
        if (analyzer == null) {
            throw new IllegalArgumentException("No analyzer available for: " + language);
        }

        return analyzer.analyze(filePath.toString(), sourceCode);
    }
}
