package com.zzf.agentdock.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One rendered transcript entry. {@code id} is derived from the source line so re-parses keep it;
 * {@code sequence} is the only stable ordering key.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Message {
    private String id;
    private String sessionId;
    private MessageType type;
    private String content;
    private Instant timestamp;
    private int sequence;
    private String toolName;
    private String toolInput;
    private String toolOutput;
    /** Seconds between call begin and result, null when unknown or not positive. */
    private Double toolDuration;
    private Integer inputTokens;
    private Integer outputTokens;
    @Builder.Default
    private List<ImageAttachment> images = new ArrayList<>();
    private boolean inProgress;
    private String thinking;
}
