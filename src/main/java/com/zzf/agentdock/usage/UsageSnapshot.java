package com.zzf.agentdock.usage;

import lombok.Value;

import java.time.Instant;

/**
 * Subscription rate-limit usage as last reported by a provider.
 */
@Value
public class UsageSnapshot {
    String provider;
    RateWindow primary;
    RateWindow secondary;
    Instant fetchedAt;

    @Value
    public static class RateWindow {
        double usedPercent;
        Integer windowMinutes;
        Instant resetsAt;
    }
}
