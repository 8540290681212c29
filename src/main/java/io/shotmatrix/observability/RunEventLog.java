package io.shotmatrix.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.shotmatrix.util.Hashing;
import io.shotmatrix.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL log of run and job transitions. Each row carries the hash of the previous
 * row, so truncation or edits show up in {@link #verify(Path)}.
 */
public final class RunEventLog {
    public static final String FILE_NAME = "run-events.jsonl";

    private final Path file;
    private final String runId;
    private String previousHash;

    public RunEventLog(Path file, String runId) {
        this.file = file;
        this.runId = runId == null || runId.isBlank() ? "unknown" : runId.trim();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(file)) {
                try {
                    Files.createFile(file);
                } catch (FileAlreadyExistsException ignored) {
                    // Created concurrently between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize run event log: " + file, e);
        }
        this.previousHash = loadLastHash();
    }

    public Path file() {
        return file;
    }

    public synchronized void log(RunEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("run_id", runId);
        row.put("action", event.action());
        row.put("job_id", event.jobId());
        row.put("result", event.result());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write run event log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Recomputes the chain.
     *
     * @return number of rows checked
     * @throws IllegalStateException at the first row whose hash or back-link does not match
     */
    public static int verify(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        String expectedPrev = null;
        int rows = 0;
        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            JsonNode node = Jsons.mapper().readTree(line);
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("timestamp", node.path("timestamp").asText());
            row.put("run_id", node.path("run_id").asText());
            row.put("action", node.path("action").asText());
            row.put("job_id", node.path("job_id").isNull() ? null : node.path("job_id").asText());
            row.put("result", node.path("result").asText());
            row.put("details", node.path("details"));
            row.put("prev_hash", node.path("prev_hash").asText());
            String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(row));
            if (!recomputed.equals(node.path("hash").asText())) {
                throw new IllegalStateException("Hash mismatch at row " + (rows + 1));
            }
            if (expectedPrev != null && !expectedPrev.equals(node.path("prev_hash").asText())) {
                throw new IllegalStateException("Broken chain at row " + (rows + 1));
            }
            expectedPrev = recomputed;
            rows++;
        }
        return rows;
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read run event log: " + file, e);
        }
    }

    public record RunEvent(
            String action,
            String jobId,
            String result,
            Map<String, Object> details
    ) {
        public RunEvent {
            action = action == null ? "" : action;
            result = result == null ? "" : result;
            details = details == null ? Map.of() : details;
        }

        public static RunEvent run(String action, String result, Map<String, Object> details) {
            return new RunEvent(action, null, result, details);
        }

        public static RunEvent job(String action, String jobId, String result, Map<String, Object> details) {
            return new RunEvent(action, jobId, result, details);
        }
    }
}
