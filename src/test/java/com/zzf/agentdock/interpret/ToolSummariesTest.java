package com.zzf.agentdock.interpret;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ToolSummariesTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void filePathsAreShortened() throws Exception {
        assertEquals(".../src/Main.java", ToolSummaries.summarize("Read", json("{\"file_path\":\"/home/dev/src/Main.java\"}")));
        assertEquals("a/b.txt", ToolSummaries.summarize("Write", json("{\"file_path\":\"a/b.txt\"}")));
        assertEquals(".../app/Edit.kt", ToolSummaries.summarize("Edit", json("{\"file_path\":\"/x/y/app/Edit.kt\"}")));
    }

    @Test
    void patchSummaryUsesFirstFileHeader() throws Exception {
        String patch = "*** Begin Patch\\n*** Update File: /repo/src/lib/util.py\\n@@\\n-a\\n+b\\n*** End Patch";
        assertEquals(".../lib/util.py", ToolSummaries.summarize("apply_patch", json("{\"input\":\"" + patch + "\"}")));
        assertEquals("new.txt", ToolSummaries.patchTarget("*** Begin Patch\n*** Add File: new.txt\n+x"));
        assertNull(ToolSummaries.patchTarget("no headers"));
    }

    @Test
    void commandsAreTruncatedAndFlattened() throws Exception {
        assertEquals("ls -la", ToolSummaries.summarize("Bash", json("{\"command\":\"ls -la\"}")));
        assertEquals("echo a echo b", ToolSummaries.summarize("Bash", json("{\"command\":\"echo a\\necho b\"}")));
        assertEquals("bash -lc make", ToolSummaries.summarize("shell", json("{\"command\":[\"bash\",\"-lc\",\"make\"]}")));

        String longCommand = "x".repeat(70);
        String summary = ToolSummaries.summarize("Bash", json("{\"command\":\"" + longCommand + "\"}"));
        assertEquals("x".repeat(60) + "...", summary);
    }

    @Test
    void searchAndTaskSummaries() throws Exception {
        assertEquals("**/*.java", ToolSummaries.summarize("Glob", json("{\"pattern\":\"**/*.java\"}")));
        assertEquals("Pattern: TODO", ToolSummaries.summarize("Grep", json("{\"pattern\":\"TODO\"}")));
        assertEquals("https://example.com", ToolSummaries.summarize("WebFetch", json("{\"url\":\"https://example.com\"}")));
        assertEquals("y".repeat(50) + "...", ToolSummaries.summarize("Task", json("{\"prompt\":\"" + "y".repeat(51) + "\"}")));
    }

    @Test
    void unknownToolsAndMissingInputFallBackToName() throws Exception {
        assertEquals("TodoWrite", ToolSummaries.summarize("TodoWrite", json("{\"todos\":[]}")));
        assertEquals("Read", ToolSummaries.summarize("Read", MissingNode.getInstance()));
        assertEquals("Read", ToolSummaries.summarize("Read", json("{}")));
        assertEquals("", ToolSummaries.summarize(null, json("{}")));
    }

    @Test
    void labelsForCodexTools() throws Exception {
        assertEquals("Shell", ToolLabels.label("exec_command"));
        assertEquals("Edit", ToolLabels.label("apply_patch"));
        assertEquals("update_plan", ToolLabels.label("update_plan"));
        assertEquals("Edit", ToolLabels.forEvent("patch_apply_end", json("{}")));
        assertEquals("MCP", ToolLabels.forEvent("mcp_tool_call_begin", json("{}")));
    }

    private JsonNode json(String raw) throws Exception {
        return mapper.readTree(raw);
    }
}
