package io.fleetgate.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fleetgate.security.SensitiveDataMasker;
import io.fleetgate.util.Hashing;
import io.fleetgate.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

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
 * Append-only JSONL audit trail. Each row carries the hash of the previous row, so truncation or
 * in-place edits show up in {@link #verify()}. Rows are optionally HMAC-signed.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);
    private static final ObjectMapper COMPACT_MAPPER = new ObjectMapper().findAndRegisterModules();

    private final Path auditFile;
    private final String signingSecret;
    private String previousHash;

    public AuditLogger(Path auditFile, String signingSecret) {
        this.auditFile = auditFile;
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException e) {
                    log.debug("Audit file created concurrently: {}", auditFile);
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
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = toCompactJson(row) + System.lineSeparator();
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

    /** Last {@code limit} rows, oldest first. */
    public synchronized List<JsonNode> tail(int limit) {
        List<String> lines = readLines();
        int from = Math.max(0, lines.size() - Math.max(1, limit));
        List<JsonNode> out = new ArrayList<>();
        for (String line : lines.subList(from, lines.size())) {
            try {
                out.add(Jsons.mapper().readTree(line));
            } catch (JsonProcessingException e) {
                throw new RuntimeException("Corrupt audit row in " + auditFile, e);
            }
        }
        return out;
    }

    /** Recomputes the hash chain (and signatures when a secret is configured) from the first row. */
    public synchronized Verification verify() {
        String expectedPrev = "";
        int row = 0;
        for (String line : readLines()) {
            row++;
            JsonNode node;
            try {
                node = Jsons.mapper().readTree(line);
            } catch (JsonProcessingException e) {
                return new Verification(false, row, "unparseable row");
            }
            String prev = node.path("prev_hash").asText("");
            if (!prev.equals(expectedPrev)) {
                return new Verification(false, row, "prev_hash does not link to previous row");
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("timestamp", node.path("timestamp").asText(null));
            body.put("action", textOrNull(node, "action"));
            body.put("actor", textOrNull(node, "actor"));
            body.put("resource", textOrNull(node, "resource"));
            body.put("result", textOrNull(node, "result"));
            body.put("details", Jsons.mapper().convertValue(node.path("details"), Map.class));
            body.put("prev_hash", prev);
            String hash = Hashing.sha256Hex(toCompactJson(body));
            if (!hash.equals(node.path("hash").asText(""))) {
                return new Verification(false, row, "hash mismatch");
            }
            if (!signingSecret.isBlank()
                    && !Hashing.constantTimeEquals(Hashing.hmacSha256Hex(signingSecret, hash), node.path("signature").asText(""))) {
                return new Verification(false, row, "signature mismatch");
            }
            expectedPrev = hash;
        }
        return new Verification(true, row, "");
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private List<String> readLines() {
        try {
            List<String> out = new ArrayList<>();
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    out.add(line);
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        List<String> lines = readLines();
        if (lines.isEmpty()) {
            return "";
        }
        try {
            return Jsons.mapper().readTree(lines.get(lines.size() - 1)).path("hash").asText("");
        } catch (JsonProcessingException e) {
            log.warn("Last audit row is unparseable, starting a new hash chain: {}", auditFile);
            return "";
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, Map.class);
    }

    private String toCompactJson(Map<String, Object> row) {
        try {
            return COMPACT_MAPPER.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize audit row", e);
        }
    }

    public record Verification(boolean valid, int rows, String problem) {
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, details == null ? Map.of() : details);
        }
    }
}
