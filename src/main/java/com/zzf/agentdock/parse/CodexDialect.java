package com.zzf.agentdock.parse;

import com.zzf.agentdock.interpret.CodexEventKind;
import com.zzf.agentdock.interpret.CodexLineInterpreter;
import com.zzf.agentdock.interpret.CodexMessages;
import com.zzf.agentdock.interpret.DecodedLine;
import com.zzf.agentdock.interpret.LineEventInterpreter;
import com.zzf.agentdock.model.Message;
import com.zzf.agentdock.util.JsonUtils;

import java.util.List;

final class CodexDialect implements TranscriptDialect<CodexEventKind> {
    private final CodexLineInterpreter interpreter;

    CodexDialect(CodexLineInterpreter interpreter) {
        this.interpreter = interpreter;
    }

    @Override
    public LineEventInterpreter<CodexEventKind> interpreter() {
        return interpreter;
    }

    @Override
    public void index(DecodedLine<CodexEventKind> line, ParseContext ctx) {
        switch (line.getKind()) {
            case SESSION_META:
                ctx.identify(JsonUtils.textOrNull(line.getBody(), "id"), JsonUtils.textOrNull(line.getBody(), "cwd"));
                break;
            case FUNCTION_CALL:
                ctx.index.started(CodexMessages.callId(line), line.getTimestamp());
                break;
            case FUNCTION_CALL_OUTPUT:
            case TOOL_END:
                ctx.index.finished(CodexMessages.callId(line), interpreter.messages().result(line));
                break;
            default:
                break;
        }
    }

    @Override
    public void emit(DecodedLine<CodexEventKind> line, ParseContext ctx) {
        switch (line.getKind()) {
            case TURN_CONTEXT: {
                String model = JsonUtils.textOrNull(line.getBody(), "model");
                if (model != null) {
                    ctx.stats.setModel(model);
                }
                break;
            }
            case USER_MESSAGE: {
                String text = JsonUtils.textOrNull(line.getBody(), "message");
                if (text != null) {
                    ctx.lastUserPrompt = text;
                }
                break;
            }
            case TOKEN_COUNT:
                CodexMessages.applyTokenCount(line, ctx.stats);
                break;
            default:
                break;
        }
        List<Message> messages = interpreter.messages().messages(line, ctx.sessionId, ctx.index);
        for (Message m : messages) {
            if (m.getToolName() != null) {
                ctx.lastTool = m.getToolName();
            }
        }
        ctx.emit(messages);
    }
}
