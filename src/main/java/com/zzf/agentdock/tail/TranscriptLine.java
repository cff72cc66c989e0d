package com.zzf.agentdock.tail;

import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * One complete, non-blank transcript line and the byte offset where it starts in its file.
 */
@Value
public class TranscriptLine {
    long offset;
    String text;

    /**
     * Splits {@code carried + appended} on {@code '\n'}, where {@code carried} starts at {@code carriedOffset}.
     * Complete lines go to {@code out}; the bytes after the last newline are returned.
     */
    public static byte[] split(byte[] carried, long carriedOffset, byte[] appended, List<TranscriptLine> out) {
        byte[] buf;
        if (carried.length == 0) {
            buf = appended;
        } else {
            buf = Arrays.copyOf(carried, carried.length + appended.length);
            System.arraycopy(appended, 0, buf, carried.length, appended.length);
        }
        int start = 0;
        for (int i = 0; i < buf.length; i++) {
            if (buf[i] != '\n') {
                continue;
            }
            int end = i;
            if (end > start && buf[end - 1] == '\r') {
                end--;
            }
            String line = new String(buf, start, end - start, StandardCharsets.UTF_8);
            if (!line.isBlank()) {
                out.add(new TranscriptLine(carriedOffset + start, line));
            }
            start = i + 1;
        }
        return Arrays.copyOfRange(buf, start, buf.length);
    }
}
