package com.zzf.agentdock.model;

import java.nio.file.Path;

/**
 * 上游 agent 的两种 transcript 词汇表。
 */
public enum TranscriptFormat {
    CLAUDE("claude"),
    CODEX("codex");

    private final String id;

    TranscriptFormat(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static TranscriptFormat fromId(String raw) {
        for (TranscriptFormat f : values()) {
            if (f.id.equalsIgnoreCase(raw) || f.name().equalsIgnoreCase(raw)) {
                return f;
            }
        }
        throw new IllegalArgumentException("unknown transcript format: " + raw);
    }

    /**
     * Rollout files are named {@code rollout-<date>-<uuid>.jsonl}; everything else is treated as a Claude
     * project transcript.
     */
    public static TranscriptFormat forPath(Path path) {
        Path name = path.getFileName();
        if (name != null && name.toString().startsWith("rollout-")) {
            return CODEX;
        }
        return CLAUDE;
    }
}
