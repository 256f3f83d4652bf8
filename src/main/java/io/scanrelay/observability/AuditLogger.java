package io.scanrelay.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.scanrelay.security.SensitiveDataMasker;
import io.scanrelay.util.Hashing;
import io.scanrelay.util.Jsons;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Append-only JSON-lines audit trail. Each row carries the hash of the
 * previous row so that edits or truncation in the middle are detectable.
 * Appends hold an exclusive lock on the file and chain onto whatever row is
 * last at that moment, so several processes can share one log.
 */
public final class AuditLogger {
    // FileChannel locks are per JVM; in-process writers queue on this monitor first.
    private static final ConcurrentMap<Path, Object> APPEND_MONITORS = new ConcurrentHashMap<>();
    private static final int TAIL_CHUNK = 8192;

    private final Path auditFile;
    private final String namespace;
    private final Clock clock;
    private final Object appendMonitor;

    public AuditLogger(Path auditFile, String namespace, Clock clock) {
        this.auditFile = auditFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.clock = clock == null ? Clock.systemUTC() : clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // created by another process in between
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.appendMonitor = APPEND_MONITORS.computeIfAbsent(auditFile.toAbsolutePath().normalize(),
                key -> new Object());
    }

    public void log(AuditEvent event) {
        Map<String, Object> details = sanitizeDetails(event.details());
        synchronized (appendMonitor) {
            try (FileChannel channel = FileChannel.open(auditFile,
                    StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                String line = Jsons.toCompactJson(chainedRow(event, details, lastHash(channel)))
                        + System.lineSeparator();
                ByteBuffer buffer = ByteBuffer.wrap(line.getBytes(StandardCharsets.UTF_8));
                long position = channel.size();
                while (buffer.hasRemaining()) {
                    position += channel.write(buffer, position);
                }
                channel.force(false);
            } catch (IOException e) {
                throw new RuntimeException("Failed to write audit log", e);
            }
        }
    }

    private Map<String, Object> chainedRow(AuditEvent event, Map<String, Object> details, String previousHash) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("job_id", event.jobId());
        row.put("finding_id", event.findingId());
        row.put("tenant_id", event.tenantId());
        row.put("details", details);
        row.put("prev_hash", previousHash);
        row.put("hash", Hashing.sha256Hex(Jsons.toCompactJson(row)));
        return row;
    }

    /**
     * Hash of the last row currently in the file, or an empty string for an empty log.
     */
    public String currentHash() {
        List<String> lines = readLines();
        if (lines.isEmpty()) {
            return "";
        }
        return hashOf(lines.get(lines.size() - 1));
    }

    public Path auditFile() {
        return auditFile;
    }

    /**
     * Returns the last {@code limit} rows, oldest first.
     */
    public List<JsonNode> tail(int limit) {
        List<String> lines = readLines();
        int safeLimit = Math.max(1, limit);
        int from = Math.max(0, lines.size() - safeLimit);
        List<JsonNode> out = new ArrayList<>(lines.size() - from);
        for (String line : lines.subList(from, lines.size())) {
            out.add(Jsons.parse(line));
        }
        return out;
    }

    /**
     * Recomputes the hash chain. Returns the 1-based line number of the first
     * broken row, or 0 when the whole file verifies.
     */
    @SuppressWarnings("unchecked")
    public int verifyChain() {
        String expectedPrev = "";
        int lineNo = 0;
        for (String line : readLines()) {
            lineNo++;
            JsonNode node;
            try {
                node = Jsons.parse(line);
            } catch (IllegalArgumentException e) {
                return lineNo;
            }
            String hash = node.path("hash").asText("");
            if (!expectedPrev.equals(node.path("prev_hash").asText(""))) {
                return lineNo;
            }
            Map<String, Object> row = Jsons.mapper().convertValue(node, LinkedHashMap.class);
            row.remove("hash");
            if (!Hashing.sha256Hex(Jsons.toCompactJson(row)).equals(hash)) {
                return lineNo;
            }
            expectedPrev = hash;
        }
        return 0;
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

    private String lastHash(FileChannel channel) throws IOException {
        String line = lastLine(channel);
        return line.isEmpty() ? "" : hashOf(line);
    }

    private String hashOf(String line) {
        try {
            return Jsons.parse(line).path("hash").asText("");
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Audit log tail is not valid JSON: " + auditFile, e);
        }
    }

    /**
     * Reads the last non-empty line by scanning backwards from the end of the file.
     */
    static String lastLine(FileChannel channel) throws IOException {
        long position = channel.size();
        byte[] tail = new byte[0];
        while (position > 0) {
            int n = (int) Math.min(TAIL_CHUNK, position);
            position -= n;
            ByteBuffer chunk = ByteBuffer.allocate(n);
            while (chunk.hasRemaining()) {
                if (channel.read(chunk, position + chunk.position()) < 0) {
                    break;
                }
            }
            byte[] merged = new byte[n + tail.length];
            System.arraycopy(chunk.array(), 0, merged, 0, n);
            System.arraycopy(tail, 0, merged, n, tail.length);
            tail = merged;

            int last = tail.length - 1;
            while (last >= 0 && (tail[last] == '\n' || tail[last] == '\r' || tail[last] == ' ')) {
                last--;
            }
            if (last < 0) {
                continue;
            }
            int start = last;
            while (start > 0 && tail[start - 1] != '\n') {
                start--;
            }
            if (start > 0 || position == 0) {
                return new String(tail, start, last - start + 1, StandardCharsets.UTF_8);
            }
        }
        return "";
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, LinkedHashMap.class);
    }
}
