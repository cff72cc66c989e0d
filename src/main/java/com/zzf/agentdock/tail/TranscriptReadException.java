package com.zzf.agentdock.tail;

import java.nio.file.Path;

/**
 * A transcript could not be read. Callers treat this as transient and retry on the next signal.
 */
public class TranscriptReadException extends RuntimeException {
    private final Path path;

    public TranscriptReadException(Path path, Throwable cause) {
        super("failed to read transcript " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
