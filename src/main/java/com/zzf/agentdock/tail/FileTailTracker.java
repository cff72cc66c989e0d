package com.zzf.agentdock.tail;

import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Tracks how far each transcript has been read and hands out only the newly appended lines.
 * <p>
 * Bytes are split on {@code '\n'} before UTF-8 decoding, so a multi-byte character cut by a read
 * boundary stays in the partial tail until its line completes. Callers must serialize calls per path.
 */
@Slf4j
public class FileTailTracker {
    private static final int READ_CHUNK = 64 * 1024;
    private static final int BOOTSTRAP_LINE_LIMIT = 64 * 1024;

    private final CursorStore cursorStore;
    private final ConcurrentMap<Path, TranscriptCursor> cursors = new ConcurrentHashMap<>();

    public FileTailTracker(CursorStore cursorStore) {
        this.cursorStore = cursorStore;
        cursors.putAll(cursorStore.load());
    }

    public Optional<TailBatch> onChangeSignal(Path rawPath) {
        Path path = normalize(rawPath);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            long size = Files.size(path);
            TranscriptCursor cursor = cursors.get(path);
            if (cursor == null) {
                cursor = TranscriptCursor.start(path);
            }

            boolean truncated = false;
            if (size < cursor.getOffset()) {
                log.info("tail.truncated path={} size={} offset={}", path, size, cursor.getOffset());
                cursor = cursor.rewind();
                truncated = true;
            }
            if (size == cursor.getOffset() && !truncated) {
                return Optional.empty();
            }

            String bootstrapLine = null;
            if (cursor.isIgnoreExisting() && size > cursor.getOffset()) {
                bootstrapLine = readFirstLine(path);
            }

            byte[] appended = readRange(path, cursor.getOffset(), size);
            List<TranscriptLine> lines = new ArrayList<>();
            byte[] newTail = TranscriptLine.split(cursor.getPartialTail(), cursor.committedOffset(), appended, lines);
            TranscriptCursor next = cursor.advance(cursor.getOffset() + appended.length, newTail);
            log.debug("tail.read path={} from={} to={} lines={} tailBytes={}",
                    path, cursor.getOffset(), next.getOffset(), lines.size(), newTail.length);
            return Optional.of(new TailBatch(path, cursor.committedOffset(), lines, truncated, bootstrapLine, next));
        } catch (IOException e) {
            throw new TranscriptReadException(path, e);
        }
    }

    /**
     * Marks files found by the startup scan: a file without a cursor is positioned at its current end with
     * {@code ignoreExisting}, so only lines appended afterwards are read. Returns the number of files seeded.
     */
    public int seedExisting(Collection<Path> rawPaths) {
        int seeded = 0;
        for (Path rawPath : rawPaths) {
            Path path = normalize(rawPath);
            if (cursors.containsKey(path) || !Files.isRegularFile(path)) {
                continue;
            }
            try {
                long size = Files.size(path);
                if (cursors.putIfAbsent(path, TranscriptCursor.ignoringHistory(path, size)) != null) {
                    continue;
                }
                seeded++;
                log.debug("tail.seed path={} size={} ignoreExisting=true", path, size);
            } catch (IOException e) {
                throw new TranscriptReadException(path, e);
            }
        }
        if (seeded > 0) {
            persist();
        }
        return seeded;
    }

    /**
     * Makes a batch's cursor durable. Call only after the batch has been fully processed downstream.
     */
    public void commit(TailBatch batch, String sessionId, String projectPath) {
        TranscriptCursor cursor = batch.getCursor().withIdentity(sessionId, projectPath);
        cursors.put(batch.getPath(), cursor);
        persist();
    }

    /**
     * Reads every complete line currently in the file, independent of the stored cursor. The returned
     * batch positions the cursor after the last complete line when committed.
     */
    public TailBatch readAll(Path rawPath) {
        Path path = normalize(rawPath);
        try {
            long size = Files.size(path);
            byte[] all = readRange(path, 0, size);
            List<TranscriptLine> lines = new ArrayList<>();
            byte[] tail = TranscriptLine.split(new byte[0], 0, all, lines);
            TranscriptCursor base = cursors.getOrDefault(path, TranscriptCursor.start(path)).rewind();
            return new TailBatch(path, 0, lines, false, null, base.advance(all.length, tail));
        } catch (IOException e) {
            throw new TranscriptReadException(path, e);
        }
    }

    /**
     * Complete lines that lie before the committed offset, used to rebuild in-memory state after restart.
     */
    public List<TranscriptLine> readCommittedLines(Path rawPath) {
        Path path = normalize(rawPath);
        TranscriptCursor cursor = cursors.get(path);
        if (cursor == null || cursor.committedOffset() == 0 || !Files.isRegularFile(path)) {
            return Collections.emptyList();
        }
        try {
            long end = Math.min(cursor.committedOffset(), Files.size(path));
            List<TranscriptLine> lines = new ArrayList<>();
            TranscriptLine.split(new byte[0], 0, readRange(path, 0, end), lines);
            return lines;
        } catch (IOException e) {
            throw new TranscriptReadException(path, e);
        }
    }

    public Optional<TranscriptCursor> cursor(Path rawPath) {
        return Optional.ofNullable(cursors.get(normalize(rawPath)));
    }

    public Set<Path> knownPaths() {
        return Collections.unmodifiableSet(cursors.keySet());
    }

    public void forget(Path rawPath) {
        if (cursors.remove(normalize(rawPath)) != null) {
            persist();
        }
    }

    private void persist() {
        cursorStore.save(new ArrayList<>(cursors.values()));
    }

    private static byte[] readRange(Path path, long from, long to) throws IOException {
        if (to <= from) {
            return new byte[0];
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream((int) Math.min(to - from, Integer.MAX_VALUE - 8));
        try (FileChannel ch = FileChannel.open(path, StandardOpenOption.READ)) {
            ByteBuffer buf = ByteBuffer.allocate(READ_CHUNK);
            long pos = from;
            while (pos < to) {
                buf.clear();
                buf.limit((int) Math.min(READ_CHUNK, to - pos));
                int n = ch.read(buf, pos);
                if (n < 0) {
                    break;
                }
                out.write(buf.array(), 0, n);
                pos += n;
            }
        }
        return out.toByteArray();
    }

    private static String readFirstLine(Path path) throws IOException {
        long size = Files.size(path);
        byte[] head = readRange(path, 0, Math.min(size, BOOTSTRAP_LINE_LIMIT));
        int end = 0;
        while (end < head.length && head[end] != '\n') {
            end++;
        }
        if (end == head.length && head.length == BOOTSTRAP_LINE_LIMIT) {
            return null;
        }
        String line = new String(head, 0, end, StandardCharsets.UTF_8).trim();
        return line.isEmpty() ? null : line;
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
