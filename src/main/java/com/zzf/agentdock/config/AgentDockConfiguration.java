package com.zzf.agentdock.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.agentdock.bus.AgentBus;
import com.zzf.agentdock.bus.ChangeNotifier;
import com.zzf.agentdock.cache.FreshnessCache;
import com.zzf.agentdock.ingest.TranscriptIngestionService;
import com.zzf.agentdock.interpret.ClaudeLineInterpreter;
import com.zzf.agentdock.interpret.CodexLineInterpreter;
import com.zzf.agentdock.parse.ParseResult;
import com.zzf.agentdock.parse.TranscriptParser;
import com.zzf.agentdock.store.SessionStore;
import com.zzf.agentdock.store.StoreUnavailableException;
import com.zzf.agentdock.tail.CursorStore;
import com.zzf.agentdock.tail.FileTailTracker;
import com.zzf.agentdock.usage.CachedUsageClient;
import com.zzf.agentdock.usage.RolloutRateLimitSource;
import com.zzf.agentdock.watch.TranscriptWatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;

@Configuration
public class AgentDockConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(AgentDockConfiguration.class);

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper().findAndRegisterModules();
    }

    @Bean
    public AgentBus agentBus() {
        return new AgentBus();
    }

    @Bean(destroyMethod = "close")
    public ChangeNotifier changeNotifier(AgentBus bus, AgentDockProperties props) {
        return new ChangeNotifier(bus, Duration.ofMillis(props.getSessionNotifyDebounceMs()),
                Duration.ofMillis(props.getDebounceMs()));
    }

    @Bean
    public FileTailTracker fileTailTracker(ObjectMapper mapper, AgentDockProperties props) {
        Path file = AgentDockProperties.expand(props.getCursorStatePath());
        CursorStore cursors = file == null ? CursorStore.inMemory(mapper) : new CursorStore(file, mapper);
        return new FileTailTracker(cursors);
    }

    @Bean
    public FreshnessCache<Path, ParseResult> parseCache(AgentDockProperties props) {
        return new FreshnessCache<>(Duration.ofMillis(props.getCacheValidityMs()));
    }

    @Bean
    public TranscriptIngestionService transcriptIngestionService(
            FileTailTracker tracker,
            TranscriptParser parser,
            ClaudeLineInterpreter claude,
            CodexLineInterpreter codex,
            FreshnessCache<Path, ParseResult> parseCache,
            ChangeNotifier notifier,
            ObjectMapper mapper,
            AgentDockProperties props
    ) {
        SessionStore store = null;
        Path db = AgentDockProperties.expand(props.getDatabasePath());
        try {
            store = SessionStore.open(db, mapper);
        } catch (StoreUnavailableException e) {
            logger.error("store.unavailable path={} ingest=disabled", db, e);
        }
        return new TranscriptIngestionService(tracker, parser, claude, codex, parseCache, store, notifier,
                Duration.ofSeconds(props.getSessionTimeoutSeconds()), Duration.ofMillis(props.getSweepIntervalMs()));
    }

    @Bean
    public TranscriptWatcher transcriptWatcher(TranscriptIngestionService ingestion, AgentDockProperties props) {
        return new TranscriptWatcher(
                Arrays.asList(AgentDockProperties.expand(props.getClaudeRoot()),
                        AgentDockProperties.expand(props.getCodexRoot())),
                ingestion, props.isWatcherEnabled(), Duration.ofMillis(props.getDebounceMs()),
                props.getWorkerThreads());
    }

    @Bean(destroyMethod = "close")
    public CachedUsageClient usageClient(ObjectMapper mapper, AgentDockProperties props) {
        RolloutRateLimitSource source = new RolloutRateLimitSource(AgentDockProperties.expand(props.getCodexRoot()), mapper);
        logger.info("usage.source selected={} timeoutMs={}", source.name(), props.getUsageTimeoutMs());
        return new CachedUsageClient(source, Duration.ofMillis(props.getUsageTimeoutMs()));
    }
}
