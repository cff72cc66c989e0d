package com.zzf.agentdock.usage;

import java.io.IOException;

/**
 * Best-effort source of subscription usage. Implementations may block; callers bound them with a timeout.
 */
public interface UsageSource {

    String name();

    UsageSnapshot fetchUsage() throws IOException;
}
