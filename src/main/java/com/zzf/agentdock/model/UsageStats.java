package com.zzf.agentdock.model;

import lombok.Data;

/**
 * Token totals over a whole transcript. {@code contextUsed} tracks the latest report only.
 */
@Data
public class UsageStats {
    public static final long DEFAULT_CONTEXT_LIMIT = 200_000L;

    private long inputTokens;
    private long outputTokens;
    private long cacheReadTokens;
    private long cacheCreationTokens;
    private String model;
    private long contextUsed;
    private long contextLimit = DEFAULT_CONTEXT_LIMIT;

    public void accumulate(long input, long output, long cacheRead, long cacheCreation) {
        inputTokens += input;
        outputTokens += output;
        cacheReadTokens += cacheRead;
        cacheCreationTokens += cacheCreation;
        long occupancy = input + cacheRead + cacheCreation;
        if (occupancy > 0) {
            contextUsed = occupancy;
        }
    }

    public long totalTokens() {
        return inputTokens + outputTokens;
    }

    public double contextPercent() {
        if (contextLimit <= 0) {
            return 0;
        }
        return Math.min(100.0, contextUsed * 100.0 / contextLimit);
    }
}
