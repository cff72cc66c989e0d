package com.zzf.agentdock.usage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.agentdock.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads the rate limits Codex reports in its {@code token_count} events from the newest rollout file.
 */
@Slf4j
public class RolloutRateLimitSource implements UsageSource {
    private static final int TAIL_BYTES = 256 * 1024;
    private static final int MAX_DEPTH = 5;

    private final Path codexRoot;
    private final ObjectMapper objectMapper;

    public RolloutRateLimitSource(Path codexRoot, ObjectMapper objectMapper) {
        this.codexRoot = codexRoot;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "codex";
    }

    /**
     * @return the latest reported limits, or null when no rollout carries any yet
     */
    @Override
    public UsageSnapshot fetchUsage() throws IOException {
        if (codexRoot == null || !Files.isDirectory(codexRoot)) {
            return null;
        }
        Optional<Path> newest = newestRollout();
        if (newest.isEmpty()) {
            return null;
        }
        String[] lines = readTail(newest.get()).split("\n");
        for (int i = lines.length - 1; i >= 0; i--) {
            UsageSnapshot snapshot = parseLine(lines[i]);
            if (snapshot != null) {
                return snapshot;
            }
        }
        log.debug("usage.rollout no_rate_limits path={}", newest.get());
        return null;
    }

    UsageSnapshot parseLine(String line) {
        if (line.isBlank() || !line.contains("rate_limits")) {
            return null;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(line);
        } catch (IOException e) {
            return null;
        }
        JsonNode payload = root.path("payload");
        if (!"token_count".equals(payload.path("type").asText())) {
            return null;
        }
        JsonNode limits = payload.path("rate_limits");
        if (!limits.isObject()) {
            return null;
        }
        Instant at = JsonUtils.instantOrNull(root, "timestamp");
        Instant fetchedAt = at != null ? at : Instant.now();
        return new UsageSnapshot(name(), window(limits.path("primary"), fetchedAt),
                window(limits.path("secondary"), fetchedAt), fetchedAt);
    }

    private static UsageSnapshot.RateWindow window(JsonNode node, Instant reportedAt) {
        if (!node.isObject()) {
            return null;
        }
        Integer minutes = JsonUtils.intOrNull(node, "window_minutes", "window_duration_mins");
        Instant resetsAt = null;
        if (node.path("resets_at").isNumber()) {
            resetsAt = Instant.ofEpochSecond(node.path("resets_at").asLong());
        } else if (node.path("resets_in_seconds").isNumber()) {
            resetsAt = reportedAt.plusSeconds(node.path("resets_in_seconds").asLong());
        }
        return new UsageSnapshot.RateWindow(node.path("used_percent").asDouble(0d), minutes, resetsAt);
    }

    private Optional<Path> newestRollout() throws IOException {
        try (Stream<Path> walk = Files.walk(codexRoot, MAX_DEPTH)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.startsWith("rollout-") && name.endsWith(".jsonl");
                    })
                    .max(Comparator.comparing(RolloutRateLimitSource::modifiedTime));
        }
    }

    private static FileTime modifiedTime(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }

    private static String readTail(Path path) throws IOException {
        try (RandomAccessFile file = new RandomAccessFile(path.toFile(), "r")) {
            long length = file.length();
            long from = Math.max(0, length - TAIL_BYTES);
            byte[] buf = new byte[(int) (length - from)];
            file.seek(from);
            file.readFully(buf);
            return new String(buf, StandardCharsets.UTF_8);
        }
    }
}
