package com.zzf.agentdock.tail;

import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Complete lines read from one transcript since the last committed cursor.
 * The cursor is only advanced when the batch is handed back to {@link FileTailTracker#commit}.
 */
@Value
public class TailBatch {
    Path path;
    long startOffset;
    List<TranscriptLine> lines;
    boolean truncated;
    /** First line of the file, present only when a file skipped at startup grows for the first time. */
    String bootstrapLine;
    TranscriptCursor cursor;

    public boolean isEmpty() {
        return lines.isEmpty() && bootstrapLine == null && !truncated;
    }
}
