package com.zzf.agentdock.interpret;

import java.nio.charset.StandardCharsets;

/**
 * Display-name helpers: first-prompt cleanup and the fallback "Adjective Verb Noun" slug.
 */
public final class SessionNames {
    static final int FIRST_PROMPT_LIMIT = 80;

    private static final String[] ADJECTIVES = {
            "Dapper", "Stellar", "Brisk", "Golden", "Gentle", "Clever", "Nimble", "Radiant",
            "Bold", "Quiet", "Swift", "Witty", "Bright", "Calm", "Lucky", "Focused"
    };
    private static final String[] VERBS = {
            "Soaring", "Gliding", "Orbiting", "Cruising", "Humming", "Tuning", "Weaving", "Drifting",
            "Climbing", "Sailing", "Skimming", "Shaping", "Guiding", "Tracing", "Nesting", "Rolling"
    };
    private static final String[] NOUNS = {
            "Spindle", "Comet", "Beacon", "Canvas", "Signal", "Compass", "Workshop", "Harbor",
            "Circuit", "Pioneer", "Atlas", "Voyager", "Relay", "Forge", "Station", "Rocket"
    };

    private SessionNames() {}

    /**
     * Whitespace-collapsed prompt, cut to at most 80 characters. Null for blank input and for the
     * context preambles agents inject before the real first prompt.
     */
    public static String firstPrompt(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = raw.replaceAll("\\s+", " ").trim();
        if (cleaned.isEmpty() || isBootstrapPrompt(cleaned)) {
            return null;
        }
        if (cleaned.length() > FIRST_PROMPT_LIMIT) {
            return cleaned.substring(0, FIRST_PROMPT_LIMIT - 3) + "...";
        }
        return cleaned;
    }

    public static boolean isBootstrapPrompt(String message) {
        return message.contains("<environment_context>")
                || message.contains("<permissions instructions>")
                || message.contains("AGENTS.md instructions for");
    }

    public static String slug(String seed) {
        long hash = djb2(seed);
        String adjective = ADJECTIVES[(int) Long.remainderUnsigned(hash, ADJECTIVES.length)];
        String verb = VERBS[(int) Long.remainderUnsigned(Long.divideUnsigned(hash, 7), VERBS.length)];
        String noun = NOUNS[(int) Long.remainderUnsigned(Long.divideUnsigned(hash, 31), NOUNS.length)];
        return adjective + " " + verb + " " + noun;
    }

    static long djb2(String value) {
        long hash = 5381L;
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            hash = (hash << 5) + hash + (b & 0xFF);
        }
        return hash;
    }
}
