package com.zzf.agentdock.parse;

import com.zzf.agentdock.interpret.DecodedLine;
import com.zzf.agentdock.interpret.LineEventInterpreter;

/**
 * Format-specific half of the two-pass parse.
 */
interface TranscriptDialect<K extends Enum<K>> {

    LineEventInterpreter<K> interpreter();

    /** Pass one: identity plus call starts and results. */
    void index(DecodedLine<K> line, ParseContext ctx);

    /** Pass two: messages, usage and last prompt/tool. */
    void emit(DecodedLine<K> line, ParseContext ctx);
}
