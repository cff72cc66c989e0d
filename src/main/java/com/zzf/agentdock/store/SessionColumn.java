package com.zzf.agentdock.store;

/**
 * Updatable columns of the sessions table.
 */
public enum SessionColumn {
    PROJECT_PATH("project_path"),
    PROJECT_NAME("project_name"),
    MODEL("model"),
    MODEL_PROVIDER("model_provider"),
    CUSTOM_NAME("custom_name"),
    SUMMARY("summary"),
    FIRST_PROMPT("first_prompt"),
    TRANSCRIPT_PATH("transcript_path"),
    STATUS("status"),
    WORK_STATUS("work_status"),
    ATTENTION_REASON("attention_reason"),
    PENDING_TOOL_NAME("pending_tool_name"),
    PENDING_TOOL_INPUT("pending_tool_input"),
    PENDING_QUESTION("pending_question"),
    PROMPT_COUNT("prompt_count"),
    TOOL_COUNT("tool_count"),
    TOTAL_TOKENS("total_tokens"),
    TOTAL_COST_USD("total_cost_usd"),
    LAST_TOOL("last_tool"),
    LAST_TOOL_AT("last_tool_at"),
    STARTED_AT("started_at"),
    LAST_ACTIVITY_AT("last_activity_at"),
    ENDED_AT("ended_at"),
    END_REASON("end_reason");

    private final String column;

    SessionColumn(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
