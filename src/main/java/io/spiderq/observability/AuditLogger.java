package io.spiderq.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.spiderq.util.Hashing;
import io.spiderq.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL trail of queue and task transitions. Each row carries the hash of the previous one, so edits
 * and deletions in the middle of the file are detectable with {@link #verifyChain()}.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this(auditFile, Clock.systemUTC());
    }

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
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
        row.put("timestamp", clock.instant().toString());
        row.put("action", event.action());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("task_id", event.taskId());
        row.put("queue_id", event.queueId());
        row.put("details", event.details() == null ? Map.of() : event.details());
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

    /**
     * Recomputes every row hash and checks each row points at its predecessor.
     *
     * @return the number of valid rows, or {@code -(lineNumber)} of the first broken row
     */
    public synchronized int verifyChain() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
        String prev = "";
        int count = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            JsonNode node;
            try {
                node = Jsons.readTree(line);
            } catch (IllegalArgumentException e) {
                return -(i + 1);
            }
            if (!(node instanceof ObjectNode row)) {
                return -(i + 1);
            }
            String hash = row.path("hash").asText("");
            if (!prev.equals(row.path("prev_hash").asText(""))) {
                return -(i + 1);
            }
            ObjectNode unhashed = row.deepCopy();
            unhashed.remove("hash");
            if (!hash.equals(Hashing.sha256Hex(Jsons.toCompactJson(unhashed)))) {
                return -(i + 1);
            }
            prev = hash;
            count++;
        }
        return count;
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = Jsons.readTree(last);
            return node == null ? "" : node.path("hash").asText("");
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Audit log {} has an unreadable tail, starting a new chain: {}", auditFile, e.getMessage());
            return "";
        }
    }

    public record AuditEvent(
            String action,
            String resource,
            String result,
            Long taskId,
            Long queueId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String resource, String result, Long taskId, Long queueId,
                                    Map<String, Object> details) {
            return new AuditEvent(action, resource, result, taskId, queueId, details);
        }

        public static AuditEvent of(String action, String resource, String result) {
            return new AuditEvent(action, resource, result, null, null, Map.of());
        }
    }
}
