package com.zzf.agentdock.parse;

import com.zzf.agentdock.interpret.ClaudeLineInterpreter;
import com.zzf.agentdock.interpret.CodexLineInterpreter;
import com.zzf.agentdock.interpret.DecodedLine;
import com.zzf.agentdock.interpret.SessionState;
import com.zzf.agentdock.model.TranscriptFormat;
import com.zzf.agentdock.tail.TranscriptLine;
import com.zzf.agentdock.tail.TranscriptReadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Full two-pass parse of a transcript. Nothing is carried between invocations, so parsing the same
 * bytes twice gives equal results.
 */
@Slf4j
@Component
public class TranscriptParser {
    private static final long SLOW_PARSE_MS = 500;

    private final ClaudeDialect claude;
    private final CodexDialect codex;

    public TranscriptParser(ClaudeLineInterpreter claudeInterpreter, CodexLineInterpreter codexInterpreter) {
        this.claude = new ClaudeDialect(claudeInterpreter);
        this.codex = new CodexDialect(codexInterpreter);
    }

    public ParseResult parseAll(Path path) {
        return parseAll(path, TranscriptFormat.forPath(path));
    }

    public ParseResult parseAll(Path path, TranscriptFormat format) {
        long start = System.nanoTime();
        List<TranscriptLine> lines = readLines(path);
        ParseResult result = format == TranscriptFormat.CODEX
                ? run(codex, path, format, lines)
                : run(claude, path, format, lines);
        long ms = (System.nanoTime() - start) / 1_000_000L;
        if (ms > SLOW_PARSE_MS) {
            log.info("parse.slow path={} lines={} messages={} ms={}", path, lines.size(), result.getMessages().size(), ms);
        } else {
            log.debug("parse.ok path={} lines={} messages={} ms={}", path, lines.size(), result.getMessages().size(), ms);
        }
        return result;
    }

    private static <K extends Enum<K>> ParseResult run(TranscriptDialect<K> dialect, Path path,
                                                       TranscriptFormat format, List<TranscriptLine> lines) {
        List<DecodedLine<K>> decoded = new ArrayList<>(lines.size());
        for (TranscriptLine raw : lines) {
            Optional<DecodedLine<K>> line = dialect.interpreter().decode(raw.getText(), raw.getOffset());
            line.ifPresent(decoded::add);
        }

        ParseContext ctx = new ParseContext();
        for (DecodedLine<K> line : decoded) {
            dialect.index(line, ctx);
        }
        if (ctx.sessionId == null) {
            ctx.sessionId = SessionState.fallbackSessionId(path);
        }
        for (DecodedLine<K> line : decoded) {
            dialect.emit(line, ctx);
        }

        return new ParseResult(format, ctx.sessionId, ctx.projectPath, ctx.sequencedMessages(), ctx.stats,
                ctx.lastUserPrompt, ctx.lastTool, ModelPricing.estimateCost(ctx.stats));
    }

    private static List<TranscriptLine> readLines(Path path) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new TranscriptReadException(path, e);
        }
        List<TranscriptLine> out = new ArrayList<>();
        byte[] last = TranscriptLine.split(new byte[0], 0, bytes, out);
        String unterminated = new String(last, StandardCharsets.UTF_8).trim();
        if (!unterminated.isEmpty()) {
            out.add(new TranscriptLine(bytes.length - last.length, unterminated));
        }
        return out;
    }
}
