package io.partiscan.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.partiscan.util.Hashing;
import io.partiscan.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines event log. Each row carries the hash of the previous row,
 * so {@link #verify()} can detect edited or dropped lines.
 *
 * <p>CAS rejections from the progress tracker are logged with result {@code rejected};
 * {@code failed} is reserved for real errors.
 */
public final class AuditLogger {
    public static final String RESULT_OK = "ok";
    public static final String RESULT_REJECTED = "rejected";
    public static final String RESULT_FAILED = "failed";

    private final Path auditFile;
    private final String feed;
    private String previousHash;

    public AuditLogger(Path auditFile, String feed) {
        this.auditFile = auditFile;
        this.feed = feed == null || feed.isBlank() ? "default" : feed.trim();
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("feed", feed);
        row.put("action", event.action());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("run_id", event.runId());
        row.put("partition_id", event.partitionId());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path auditFile() {
        return auditFile;
    }

    public List<JsonNode> tail(int limit) {
        List<JsonNode> rows = readRows();
        int from = Math.max(0, rows.size() - Math.max(1, limit));
        return List.copyOf(rows.subList(from, rows.size()));
    }

    public synchronized IntegrityReport verify() {
        List<JsonNode> rows = readRows();
        String expectedPrev = "";
        int checked = 0;
        for (JsonNode node : rows) {
            checked++;
            String prev = node.path("prev_hash").asText("");
            String hash = node.path("hash").asText("");
            if (!expectedPrev.equals(prev)) {
                return new IntegrityReport(false, checked, checked, "prev_hash mismatch");
            }
            ObjectNode canonical = node.deepCopy();
            canonical.remove("hash");
            String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(canonical));
            if (!recomputed.equals(hash)) {
                return new IntegrityReport(false, checked, checked, "hash mismatch");
            }
            expectedPrev = hash;
        }
        return new IntegrityReport(true, checked, 0, "");
    }

    private List<JsonNode> readRows() {
        List<JsonNode> out = new ArrayList<>();
        try {
            if (!Files.exists(auditFile)) {
                return out;
            }
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line == null || line.isBlank()) {
                    continue;
                }
                out.add(Jsons.mapper().readTree(line));
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        List<JsonNode> rows = readRows();
        if (rows.isEmpty()) {
            return "";
        }
        return rows.get(rows.size() - 1).path("hash").asText("");
    }

    public record IntegrityReport(boolean ok, int checkedRows, int brokenAtRow, String reason) {
    }

    public record AuditEvent(
            String action,
            String resource,
            String result,
            String runId,
            String partitionId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, resource, result, null, null, details == null ? Map.of() : details);
        }

        public static AuditEvent ofPartition(
                String action,
                String result,
                String runId,
                String partitionId,
                Map<String, Object> details
        ) {
            return new AuditEvent(
                    action,
                    "progress/" + runId + "/" + partitionId,
                    result,
                    runId,
                    partitionId,
                    details == null ? Map.of() : details
            );
        }
    }
}
