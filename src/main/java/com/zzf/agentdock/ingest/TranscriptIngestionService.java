package com.zzf.agentdock.ingest;

import com.zzf.agentdock.bus.ChangeNotifier;
import com.zzf.agentdock.cache.FreshnessCache;
import com.zzf.agentdock.cache.KeyedLocks;
import com.zzf.agentdock.interpret.ClaudeLineInterpreter;
import com.zzf.agentdock.interpret.CodexLineInterpreter;
import com.zzf.agentdock.interpret.DecodedLine;
import com.zzf.agentdock.interpret.LineEventInterpreter;
import com.zzf.agentdock.interpret.SessionState;
import com.zzf.agentdock.model.Message;
import com.zzf.agentdock.model.Session;
import com.zzf.agentdock.model.SessionStatus;
import com.zzf.agentdock.model.TranscriptFormat;
import com.zzf.agentdock.parse.ModelPricing;
import com.zzf.agentdock.parse.ParseResult;
import com.zzf.agentdock.parse.TranscriptParser;
import com.zzf.agentdock.store.SessionStore;
import com.zzf.agentdock.tail.FileTailTracker;
import com.zzf.agentdock.tail.TailBatch;
import com.zzf.agentdock.tail.TranscriptCursor;
import com.zzf.agentdock.tail.TranscriptLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives transcripts from change signal to store: tail, interpret, persist, notify, then commit the cursor.
 * <p>
 * Work for one path is serialized by a per-path lock; different paths proceed in parallel. Public methods
 * never throw: failures are counted, logged and retried on the next signal because the cursor is only
 * committed after the store write succeeded.
 */
public class TranscriptIngestionService implements InitializingBean, DisposableBean {
    private static final Logger logger = LoggerFactory.getLogger(TranscriptIngestionService.class);

    private final FileTailTracker tracker;
    private final TranscriptParser parser;
    private final ClaudeLineInterpreter claude;
    private final CodexLineInterpreter codex;
    private final FreshnessCache<Path, ParseResult> parseCache;
    private final SessionStore store;
    private final ChangeNotifier notifier;
    private final Duration sessionTimeout;
    private final Duration sweepInterval;

    private final KeyedLocks<Path> pathLocks = new KeyedLocks<>();
    private final ConcurrentMap<Path, SessionState> states = new ConcurrentHashMap<>();
    private ScheduledExecutorService sweeper;

    private final AtomicLong batches = new AtomicLong(0);
    private final AtomicLong lines = new AtomicLong(0);
    private final AtomicLong messages = new AtomicLong(0);
    private final AtomicLong resyncs = new AtomicLong(0);
    private final AtomicLong failed = new AtomicLong(0);
    private volatile String lastError;

    /**
     * @param store null when the store could not be opened; ingestion is then disabled
     */
    public TranscriptIngestionService(FileTailTracker tracker, TranscriptParser parser,
                                      ClaudeLineInterpreter claude, CodexLineInterpreter codex,
                                      FreshnessCache<Path, ParseResult> parseCache, SessionStore store,
                                      ChangeNotifier notifier, Duration sessionTimeout, Duration sweepInterval) {
        this.tracker = tracker;
        this.parser = parser;
        this.claude = claude;
        this.codex = codex;
        this.parseCache = parseCache;
        this.store = store;
        this.notifier = notifier;
        this.sessionTimeout = sessionTimeout;
        this.sweepInterval = sweepInterval;
    }

    @Override
    public void afterPropertiesSet() {
        if (!isEnabled()) {
            logger.warn("ingest.disabled reason=store_unavailable");
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agentdock-sweep");
            t.setDaemon(true);
            return t;
        });
        long ms = Math.max(100L, sweepInterval.toMillis());
        sweeper.scheduleWithFixedDelay(this::sweep, ms, ms, TimeUnit.MILLISECONDS);
        logger.info("ingest.start ok sweepMs={} sessionTimeoutSec={}", ms, sessionTimeout.getSeconds());
    }

    @Override
    public void destroy() {
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
        if (store != null) {
            store.close();
        }
        logger.info("ingest.stop ok");
    }

    public boolean isEnabled() {
        return store != null;
    }

    /**
     * Positions transcripts found by the startup scan at their end, so their history is not replayed.
     */
    public void seedExisting(Collection<Path> paths) {
        if (!isEnabled() || paths.isEmpty()) {
            return;
        }
        try {
            int seeded = tracker.seedExisting(paths);
            logger.info("ingest.seed ok scanned={} seeded={}", paths.size(), seeded);
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            lastError = e.getMessage();
            logger.warn("ingest.seed.failed err={}", e.toString());
        }
    }

    /**
     * Processes whatever was appended to {@code path} since its committed cursor.
     */
    public void onFileChanged(Path path) {
        if (!isEnabled() || path == null) {
            return;
        }
        Path key = path.toAbsolutePath().normalize();
        ReentrantLock lock = pathLocks.lockFor(key);
        lock.lock();
        try {
            ingest(key);
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            lastError = e.getMessage();
            logger.warn("ingest.failed path={} err={}", key, e.toString());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Re-derives the whole message set of {@code path} with a full parse and replaces the stored one.
     *
     * @return the persisted session, empty when the file holds no session or the resync failed
     */
    public Optional<Session> resync(Path path) {
        if (!isEnabled() || path == null) {
            return Optional.empty();
        }
        Path key = path.toAbsolutePath().normalize();
        ReentrantLock lock = pathLocks.lockFor(key);
        lock.lock();
        try {
            return resyncLocked(key, false);
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            lastError = e.getMessage();
            logger.warn("ingest.resync.failed path={} err={}", key, e.toString());
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Full message history of a transcript, resynced on demand.
     */
    public List<Message> loadHistory(Path path) {
        return resync(path).map(s -> readMessages(s.getId())).orElse(Collections.emptyList());
    }

    public List<Session> listSessions() {
        if (!isEnabled()) {
            return Collections.emptyList();
        }
        try {
            return store.listSessions();
        } catch (RuntimeException e) {
            logger.warn("ingest.read.failed op=listSessions err={}", e.toString());
            return Collections.emptyList();
        }
    }

    public Optional<Session> readSession(String sessionId) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            return store.readSession(sessionId);
        } catch (RuntimeException e) {
            logger.warn("ingest.read.failed op=readSession id={} err={}", sessionId, e.toString());
            return Optional.empty();
        }
    }

    public List<Message> readMessages(String sessionId) {
        if (!isEnabled()) {
            return Collections.emptyList();
        }
        try {
            return store.readMessages(sessionId);
        } catch (RuntimeException e) {
            logger.warn("ingest.read.failed op=readMessages id={} err={}", sessionId, e.toString());
            return Collections.emptyList();
        }
    }

    /**
     * Re-signals every known transcript to recover dropped file events, then ends idle sessions.
     */
    public void sweep() {
        try {
            for (Path path : new ArrayList<>(tracker.knownPaths())) {
                onFileChanged(path);
            }
            expireIdle(Instant.now());
        } catch (RuntimeException e) {
            logger.warn("ingest.sweep.failed err={}", e.toString());
        }
    }

    /**
     * Ends active sessions whose last activity is older than the timeout.
     */
    public void expireIdle(Instant now) {
        if (!isEnabled()) {
            return;
        }
        Instant cutoff = now.minus(sessionTimeout);
        for (Map.Entry<Path, SessionState> e : states.entrySet()) {
            if (isIdle(e.getValue(), cutoff)) {
                expireIfIdle(e.getKey(), cutoff, now);
            }
        }
    }

    /**
     * Ends the session of {@code path} if it is still idle once the path lock is held; a batch may have
     * landed since the unlocked scan.
     */
    boolean expireIfIdle(Path path, Instant cutoff, Instant now) {
        ReentrantLock lock = pathLocks.lockFor(path);
        lock.lock();
        try {
            SessionState state = states.get(path);
            if (state == null || !isIdle(state, cutoff)) {
                return false;
            }
            Session s = state.currentSession();
            try {
                state.end("timeout", now);
                store.endSession(s.getId(), "timeout", now);
                notifier.sessionChanged(s.getId());
                logger.info("ingest.session.timeout id={} lastActivity={}", s.getId(), s.getLastActivityAt());
                return true;
            } catch (RuntimeException ex) {
                logger.warn("ingest.session.timeout.failed id={} err={}", s.getId(), ex.toString());
                return false;
            }
        } finally {
            lock.unlock();
        }
    }

    private static boolean isIdle(SessionState state, Instant cutoff) {
        Session s = state.currentSession();
        return s != null && s.getStatus() == SessionStatus.ACTIVE && s.getLastActivityAt() != null
                && s.getLastActivityAt().isBefore(cutoff);
    }

    public Status snapshot() {
        Status s = new Status();
        s.batches = batches.get();
        s.lines = lines.get();
        s.messages = messages.get();
        s.resyncs = resyncs.get();
        s.failed = failed.get();
        s.trackedFiles = tracker.knownPaths().size();
        s.lastError = lastError;
        return s;
    }

    private void ingest(Path path) {
        if (!Files.exists(path)) {
            if (states.remove(path) != null || tracker.cursor(path).isPresent()) {
                tracker.forget(path);
                logger.info("ingest.forget path={} reason=deleted", path);
            }
            return;
        }
        Optional<TailBatch> read = tracker.onChangeSignal(path);
        if (read.isEmpty() || read.get().isEmpty()) {
            return;
        }
        TailBatch batch = read.get();
        if (batch.isTruncated()) {
            states.remove(path);
            resyncLocked(path, true);
            return;
        }

        SessionState state = states.computeIfAbsent(path, this::rehydrate);
        List<Message> produced;
        Session session;
        try {
            if (batch.getBootstrapLine() != null && !state.hasSession()) {
                apply(Collections.singletonList(new TranscriptLine(0, batch.getBootstrapLine())), state);
            }
            produced = apply(batch.getLines(), state);
            if (!state.hasSession()) {
                tracker.commit(batch, null, null);
                return;
            }
            session = state.currentSession();
            session.setTotalCostUsd(ModelPricing.estimateCost(state.getUsage()));
            store.persistBatch(session, produced);
            tracker.commit(batch, session.getId(), session.getProjectPath());
        } catch (RuntimeException e) {
            // the batch is re-read on the next signal; drop what it did to the in-memory state
            states.remove(path);
            throw e;
        }
        parseCache.invalidate(path);

        notifier.sessionChanged(session.getId());
        if (!produced.isEmpty()) {
            notifier.transcriptChanged(path);
        }
        batches.incrementAndGet();
        lines.addAndGet(batch.getLines().size());
        messages.addAndGet(produced.size());
        logger.debug("ingest.batch ok path={} session={} from={} lines={} messages={}",
                path, session.getId(), batch.getStartOffset(), batch.getLines().size(), produced.size());
    }

    private Optional<Session> resyncLocked(Path path, boolean fresh) {
        if (fresh) {
            parseCache.invalidate(path);
        }
        TranscriptFormat format = TranscriptFormat.forPath(path);
        TailBatch all = tracker.readAll(path);
        SessionState state = new SessionState(format, path);
        apply(all.getLines(), state);
        if (!state.hasSession()) {
            tracker.commit(all, null, null);
            return Optional.empty();
        }
        ParseResult result = parseCache.getOrCompute(path, () -> parser.parseAll(path, format));

        Session session = state.currentSession();
        session.setTotalCostUsd(result.getEstimatedCostUsd());
        store.persistSnapshot(session, result.getMessages());
        states.put(path, state);
        tracker.commit(all, session.getId(), session.getProjectPath());

        notifier.sessionChanged(session.getId());
        notifier.transcriptChanged(path);
        resyncs.incrementAndGet();
        logger.info("ingest.resync ok path={} session={} messages={} fresh={}",
                path, session.getId(), result.getMessages().size(), fresh);
        return Optional.of(session);
    }

    /**
     * Rebuilds in-memory state after a restart from the lines before the committed cursor. Files whose
     * history was skipped at startup fall back to the stored session row.
     */
    private SessionState rehydrate(Path path) {
        SessionState state = new SessionState(TranscriptFormat.forPath(path), path);
        Optional<TranscriptCursor> cursor = tracker.cursor(path);
        if (cursor.isEmpty()) {
            return state;
        }
        if (!cursor.get().isIgnoreExisting()) {
            List<TranscriptLine> committed = tracker.readCommittedLines(path);
            apply(committed, state);
            logger.debug("ingest.rehydrate path={} lines={}", path, committed.size());
        }
        if (!state.hasSession() && cursor.get().getSessionId() != null) {
            store.readSession(cursor.get().getSessionId()).ifPresent(state::restore);
        }
        return state;
    }

    private List<Message> apply(List<TranscriptLine> raw, SessionState state) {
        return state.getFormat() == TranscriptFormat.CODEX
                ? apply(codex, raw, state)
                : apply(claude, raw, state);
    }

    /**
     * Runs lines through the interpreter. A message produced twice in one batch keeps its first position
     * and its latest content.
     */
    private static <K extends Enum<K>> List<Message> apply(LineEventInterpreter<K> interpreter,
                                                           List<TranscriptLine> raw, SessionState state) {
        Map<String, Message> out = new LinkedHashMap<>();
        for (TranscriptLine rawLine : raw) {
            Optional<DecodedLine<K>> line = interpreter.decode(rawLine.getText(), rawLine.getOffset());
            if (line.isEmpty()) {
                continue;
            }
            for (Message m : interpreter.apply(line.get(), state)) {
                out.put(m.getId(), m);
            }
        }
        return new ArrayList<>(out.values());
    }

    public static final class Status {
        public long batches;
        public long lines;
        public long messages;
        public long resyncs;
        public long failed;
        public int trackedFiles;
        public String lastError;
    }
}
