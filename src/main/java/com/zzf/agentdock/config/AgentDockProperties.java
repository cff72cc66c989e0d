package com.zzf.agentdock.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;

@Configuration
@ConfigurationProperties(prefix = "agentdock")
public class AgentDockProperties {
    private String claudeRoot = "~/.claude/projects";
    private String codexRoot = "~/.codex/sessions";
    private String databasePath = "~/.agentdock/agentdock.db";
    private String cursorStatePath = "~/.agentdock/cursor-state.json";
    private long debounceMs = 150;
    private long sessionNotifyDebounceMs = 100;
    private long cacheValidityMs = 100;
    private int workerThreads = 2;
    private long sweepIntervalMs = 3000;
    private long sessionTimeoutSeconds = 120;
    private boolean watcherEnabled = true;
    private long usageTimeoutMs = 5000;

    public static Path expand(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.equals("~") || trimmed.startsWith("~/")) {
            trimmed = System.getProperty("user.home") + trimmed.substring(1);
        }
        return Paths.get(trimmed).toAbsolutePath().normalize();
    }

    public String getClaudeRoot() {
        return claudeRoot;
    }

    public void setClaudeRoot(String claudeRoot) {
        this.claudeRoot = claudeRoot;
    }

    public String getCodexRoot() {
        return codexRoot;
    }

    public void setCodexRoot(String codexRoot) {
        this.codexRoot = codexRoot;
    }

    public String getDatabasePath() {
        return databasePath;
    }

    public void setDatabasePath(String databasePath) {
        this.databasePath = databasePath;
    }

    public String getCursorStatePath() {
        return cursorStatePath;
    }

    public void setCursorStatePath(String cursorStatePath) {
        this.cursorStatePath = cursorStatePath;
    }

    public long getDebounceMs() {
        return debounceMs;
    }

    public void setDebounceMs(long debounceMs) {
        this.debounceMs = debounceMs;
    }

    public long getSessionNotifyDebounceMs() {
        return sessionNotifyDebounceMs;
    }

    public void setSessionNotifyDebounceMs(long sessionNotifyDebounceMs) {
        this.sessionNotifyDebounceMs = sessionNotifyDebounceMs;
    }

    public long getCacheValidityMs() {
        return cacheValidityMs;
    }

    public void setCacheValidityMs(long cacheValidityMs) {
        this.cacheValidityMs = cacheValidityMs;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        this.sweepIntervalMs = sweepIntervalMs;
    }

    public long getSessionTimeoutSeconds() {
        return sessionTimeoutSeconds;
    }

    public void setSessionTimeoutSeconds(long sessionTimeoutSeconds) {
        this.sessionTimeoutSeconds = sessionTimeoutSeconds;
    }

    public boolean isWatcherEnabled() {
        return watcherEnabled;
    }

    public void setWatcherEnabled(boolean watcherEnabled) {
        this.watcherEnabled = watcherEnabled;
    }

    public long getUsageTimeoutMs() {
        return usageTimeoutMs;
    }

    public void setUsageTimeoutMs(long usageTimeoutMs) {
        this.usageTimeoutMs = usageTimeoutMs;
    }
}
