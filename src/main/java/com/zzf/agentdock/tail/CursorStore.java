package com.zzf.agentdock.tail;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Cursor 持久化 (JSON 文件，整文件原子替换)。
 * <p>
 * Only the committed offset and a partial-tail flag are stored; an unfinished trailing line is read
 * again after restart.
 */
@Slf4j
public class CursorStore {
    static final int VERSION = 1;

    private final Path file;
    private final ObjectMapper objectMapper;

    public CursorStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    public static CursorStore inMemory(ObjectMapper objectMapper) {
        return new CursorStore(null, objectMapper);
    }

    public synchronized Map<Path, TranscriptCursor> load() {
        Map<Path, TranscriptCursor> out = new LinkedHashMap<>();
        if (file == null || !Files.exists(file)) {
            return out;
        }
        try {
            CursorFile state = objectMapper.readValue(file.toFile(), CursorFile.class);
            if (state.getVersion() != VERSION) {
                log.warn("cursor.load skip reason=version_mismatch file={} version={}", file, state.getVersion());
                return out;
            }
            for (Map.Entry<String, CursorRecord> e : state.getFiles().entrySet()) {
                CursorRecord r = e.getValue();
                Path p = Paths.get(e.getKey());
                out.put(p, TranscriptCursor.restored(p, Math.max(0, r.getOffset()), r.getSessionId(),
                        r.getProjectPath(), r.isIgnoreExisting()));
            }
            log.info("cursor.load ok file={} cursors={}", file, out.size());
        } catch (IOException e) {
            log.warn("cursor.load failed file={} err={}", file, e.toString());
        }
        return out;
    }

    public synchronized void save(Collection<TranscriptCursor> cursors) {
        if (file == null) {
            return;
        }
        CursorFile state = new CursorFile();
        state.setVersion(VERSION);
        for (TranscriptCursor c : cursors) {
            CursorRecord r = new CursorRecord();
            r.setOffset(c.committedOffset());
            r.setPartialTail(c.hasPartialTail());
            r.setSessionId(c.getSessionId());
            r.setProjectPath(c.getProjectPath());
            r.setIgnoreExisting(c.isIgnoreExisting());
            state.getFiles().put(c.getPath().toString(), r);
        }
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(state);
            overwrite(json);
        } catch (IOException e) {
            throw new TranscriptReadException(file, e);
        }
    }

    private void overwrite(String content) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        Path temp = Files.createTempFile(dir, "cursor-", ".tmp");
        try {
            Files.write(temp, content.getBytes(StandardCharsets.UTF_8));
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CursorFile {
        private int version;
        private Map<String, CursorRecord> files = new TreeMap<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CursorRecord {
        private long offset;
        private boolean partialTail;
        private String sessionId;
        private String projectPath;
        private boolean ignoreExisting;
    }
}
