package com.zzf.agentdock.tail;

import lombok.Value;

import java.nio.file.Path;

/**
 * Read position of one tailed transcript.
 * <p>
 * {@code offset} is the byte position already read; {@code partialTail} holds the bytes after the last
 * newline, so {@link #committedOffset()} is where the next complete line starts.
 */
@Value
public class TranscriptCursor {
    private static final byte[] EMPTY = new byte[0];

    Path path;
    long offset;
    byte[] partialTail;
    String sessionId;
    String projectPath;
    boolean ignoreExisting;

    public static TranscriptCursor start(Path path) {
        return new TranscriptCursor(path, 0, EMPTY, null, null, false);
    }

    public static TranscriptCursor ignoringHistory(Path path, long size) {
        return new TranscriptCursor(path, size, EMPTY, null, null, true);
    }

    public static TranscriptCursor restored(Path path, long committedOffset, String sessionId, String projectPath,
                                            boolean ignoreExisting) {
        return new TranscriptCursor(path, committedOffset, EMPTY, sessionId, projectPath, ignoreExisting);
    }

    public long committedOffset() {
        return offset - partialTail.length;
    }

    public boolean hasPartialTail() {
        return partialTail.length > 0;
    }

    public TranscriptCursor advance(long newOffset, byte[] newTail) {
        return new TranscriptCursor(path, newOffset, newTail, sessionId, projectPath, false);
    }

    public TranscriptCursor rewind() {
        return new TranscriptCursor(path, 0, EMPTY, sessionId, projectPath, false);
    }

    public TranscriptCursor withIdentity(String newSessionId, String newProjectPath) {
        return new TranscriptCursor(path, offset, partialTail,
                newSessionId != null ? newSessionId : sessionId,
                newProjectPath != null ? newProjectPath : projectPath,
                ignoreExisting);
    }
}
