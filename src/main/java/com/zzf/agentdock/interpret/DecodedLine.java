package com.zzf.agentdock.interpret;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.time.Instant;

/**
 * One transcript line parsed once and tagged with its event kind.
 *
 * @param <K> the closed event vocabulary of the line's format
 */
@Value
public class DecodedLine<K extends Enum<K>> {
    K kind;
    JsonNode root;
    /** {@code message} for Claude lines, {@code payload} for Codex lines; never null. */
    JsonNode body;
    Instant timestamp;
    /** The line's own uuid or, failing that, an id derived from where the line starts in its file. */
    String lineId;

    /** Id for a line without a uuid: its starting byte offset, which tailing and full parses agree on. */
    static String offsetId(long offset) {
        return "line-" + offset;
    }
}
