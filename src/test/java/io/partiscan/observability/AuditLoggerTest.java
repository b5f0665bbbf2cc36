package io.partiscan.observability;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void chainSurvivesReopenAndDetectsTampering() throws Exception {
        Path root = Files.createTempDirectory("partiscan-test-audit-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger first = new AuditLogger(file, "feed-a");
            first.log(AuditLogger.AuditEvent.of("scan.start", "scan/feed-a/run", AuditLogger.RESULT_OK, Map.of("max_value", 1000)));
            first.log(AuditLogger.AuditEvent.ofPartition("progress.advance", AuditLogger.RESULT_REJECTED, "run-1", "partition-0", null));

            AuditLogger reopened = new AuditLogger(file, "feed-a");
            Assertions.assertEquals(first.currentHash(), reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.of("scan.complete", "scan/feed-a/run", AuditLogger.RESULT_OK, Map.of()));

            AuditLogger.IntegrityReport report = reopened.verify();
            Assertions.assertTrue(report.ok());
            Assertions.assertEquals(3, report.checkedRows());

            List<JsonNode> tail = reopened.tail(2);
            Assertions.assertEquals("progress/run-1/partition-0", tail.get(0).path("resource").asText());
            Assertions.assertEquals("feed-a", tail.get(1).path("feed").asText());

            String content = Files.readString(file, StandardCharsets.UTF_8);
            Files.writeString(file, content.replace("\"rejected\"", "\"ok\""), StandardCharsets.UTF_8);
            AuditLogger.IntegrityReport tampered = new AuditLogger(file, "feed-a").verify();
            Assertions.assertFalse(tampered.ok());
            Assertions.assertEquals(2, tampered.brokenAtRow());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
