package org.dxworks.tagframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.tagframe.model.Analysis;
import org.dxworks.tagframe.model.MarkupFileAnalysis;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSONL output of one run: a {@code run} header, one line per analyzed file or error,
 * and a {@code done} trailer with totals. Safe to call from parallel analysis threads.
 */
final class JsonlReport implements Closeable {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Writer writer;
    private final Instant startedAt = Instant.now();
    private final AtomicInteger filesAnalyzed = new AtomicInteger();
    private final AtomicInteger filesWithErrors = new AtomicInteger();
    private final AtomicInteger elementsTotal = new AtomicInteger();
    private final AtomicInteger roundTripFailures = new AtomicInteger();

    JsonlReport(Writer writer) {
        this.writer = writer;
    }

    void runStarted(Path input, int totalFiles, TagframeConfig config) throws IOException {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("kind", "run");
        record.put("started_at", startedAt.toString());
        record.put("input_path", input.toString());
        record.put("total_files", totalFiles);
        record.put("max_file_lines", config.getMaxFileLines());
        record.put("verify_round_trip", config.isVerifyRoundTrip());
        record.put("raw_text_elements", config.isRawTextElements());
        write(record);
    }

    void fileAnalyzed(Analysis analysis) throws IOException {
        write(analysis);
        filesAnalyzed.incrementAndGet();
        if (analysis instanceof MarkupFileAnalysis markup) {
            elementsTotal.addAndGet(markup.elementCount);
            if (Boolean.FALSE.equals(markup.roundTripVerified)) {
                roundTripFailures.incrementAndGet();
            }
        }
    }

    void fileFailed(Path file, Language language, Throwable error) throws IOException {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("kind", "error");
        record.put("file", file.toString());
        record.put("language", language.getName());
        record.put("error", error.getClass().getSimpleName() + ": " + error.getMessage());
        filesWithErrors.incrementAndGet();
        write(record);
    }

    void runDone() throws IOException {
        Instant endedAt = Instant.now();
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("kind", "done");
        record.put("ended_at", endedAt.toString());
        record.put("files_analyzed", filesAnalyzed.get());
        record.put("files_with_errors", filesWithErrors.get());
        record.put("elements_total", elementsTotal.get());
        record.put("round_trip_failures", roundTripFailures.get());
        record.put("duration_seconds", Duration.between(startedAt, endedAt).getSeconds());
        write(record);
    }

    int getFilesAnalyzed() {
        return filesAnalyzed.get();
    }

    int getFilesWithErrors() {
        return filesWithErrors.get();
    }

    int getRoundTripFailures() {
        return roundTripFailures.get();
    }

    private synchronized void write(Object record) throws IOException {
        writer.write(MAPPER.writeValueAsString(record));
        writer.write('\n');
        writer.flush();
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
