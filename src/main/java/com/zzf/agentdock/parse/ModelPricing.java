package com.zzf.agentdock.parse;

import com.zzf.agentdock.model.UsageStats;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Static per-model rates in USD per million tokens. Unknown models cost nothing.
 */
public final class ModelPricing {

    public static final class Rates {
        final double input;
        final double output;
        final double cacheRead;
        final double cacheWrite;

        Rates(double input, double output, double cacheRead, double cacheWrite) {
            this.input = input;
            this.output = output;
            this.cacheRead = cacheRead;
            this.cacheWrite = cacheWrite;
        }
    }

    private static final Map<String, Rates> RATES = new LinkedHashMap<>();

    static {
        RATES.put("claude-3-5-haiku", new Rates(0.80, 4.00, 0.08, 1.00));
        RATES.put("claude-sonnet-4", new Rates(3.00, 15.00, 0.30, 3.75));
        RATES.put("claude-opus-4", new Rates(15.00, 75.00, 1.875, 18.75));
        RATES.put("gpt-5", new Rates(2.00, 10.00, 0.0, 0.0));
    }

    private ModelPricing() {}

    public static Rates ratesFor(String model) {
        if (model == null) {
            return null;
        }
        String m = model.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Rates> e : RATES.entrySet()) {
            if (m.startsWith(e.getKey())) {
                return e.getValue();
            }
        }
        if (m.contains("opus")) {
            return RATES.get("claude-opus-4");
        }
        if (m.contains("sonnet")) {
            return RATES.get("claude-sonnet-4");
        }
        if (m.contains("haiku")) {
            return RATES.get("claude-3-5-haiku");
        }
        if (m.contains("gpt-5")) {
            return RATES.get("gpt-5");
        }
        return null;
    }

    public static double estimateCost(String model, long input, long output, long cacheRead, long cacheWrite) {
        Rates r = ratesFor(model);
        if (r == null) {
            return 0.0;
        }
        return (input * r.input + output * r.output + cacheRead * r.cacheRead + cacheWrite * r.cacheWrite) / 1_000_000.0;
    }

    public static double estimateCost(UsageStats stats) {
        return estimateCost(stats.getModel(), stats.getInputTokens(), stats.getOutputTokens(),
                stats.getCacheReadTokens(), stats.getCacheCreationTokens());
    }
}
