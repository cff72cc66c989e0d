package com.zzf.agentdock.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.agentdock.interpret.ClaudeEventKind;
import com.zzf.agentdock.interpret.ClaudeLineInterpreter;
import com.zzf.agentdock.interpret.ClaudeMessages;
import com.zzf.agentdock.interpret.DecodedLine;
import com.zzf.agentdock.interpret.LineEventInterpreter;
import com.zzf.agentdock.interpret.ToolResult;
import com.zzf.agentdock.model.Message;
import com.zzf.agentdock.util.JsonUtils;

import java.util.List;
import java.util.Map;

final class ClaudeDialect implements TranscriptDialect<ClaudeEventKind> {
    private final ClaudeLineInterpreter interpreter;

    ClaudeDialect(ClaudeLineInterpreter interpreter) {
        this.interpreter = interpreter;
    }

    @Override
    public LineEventInterpreter<ClaudeEventKind> interpreter() {
        return interpreter;
    }

    @Override
    public void index(DecodedLine<ClaudeEventKind> line, ParseContext ctx) {
        ctx.identify(JsonUtils.textOrNull(line.getRoot(), "sessionId"), JsonUtils.textOrNull(line.getRoot(), "cwd"));
        if (line.getKind() == ClaudeEventKind.ASSISTANT) {
            for (JsonNode block : ClaudeMessages.toolUseBlocks(line)) {
                ctx.index.started(JsonUtils.textOrNull(block, "id"), line.getTimestamp());
            }
        } else if (line.getKind() == ClaudeEventKind.TOOL_RESULT) {
            for (Map.Entry<String, ToolResult> e : ClaudeMessages.toolResults(line).entrySet()) {
                ctx.index.finished(e.getKey(), e.getValue());
            }
        }
    }

    @Override
    public void emit(DecodedLine<ClaudeEventKind> line, ParseContext ctx) {
        switch (line.getKind()) {
            case USER_PROMPT: {
                Message m = ClaudeMessages.userPrompt(line, ctx.sessionId);
                if (m != null) {
                    ctx.emit(List.of(m));
                    ctx.lastUserPrompt = m.getContent();
                }
                break;
            }
            case ASSISTANT: {
                String model = ClaudeMessages.model(line);
                if (model != null && ctx.stats.getModel() == null) {
                    ctx.stats.setModel(model);
                }
                ClaudeMessages.accumulateUsage(line, ctx.stats);
                List<Message> messages = ClaudeMessages.assistant(line, ctx.sessionId, ctx.index);
                for (Message m : messages) {
                    if (m.getToolName() != null) {
                        ctx.lastTool = m.getToolName();
                    }
                }
                ctx.emit(messages);
                break;
            }
            default:
                break;
        }
    }
}
