package com.zzf.agentdock.interpret;

import com.zzf.agentdock.model.Message;
import com.zzf.agentdock.model.TranscriptFormat;

import java.util.List;
import java.util.Optional;

/**
 * Applies one decoded transcript line to a session and returns the messages it produces.
 * Messages returned for a line that completes an earlier call carry the earlier message's id.
 *
 * @param <K> event vocabulary of the format
 */
public interface LineEventInterpreter<K extends Enum<K>> {

    TranscriptFormat format();

    /**
     * Empty for malformed JSON and for lines that are not JSON objects.
     *
     * @param offset byte offset where the line starts in its file
     */
    Optional<DecodedLine<K>> decode(String rawLine, long offset);

    List<Message> apply(DecodedLine<K> line, SessionState state);
}
