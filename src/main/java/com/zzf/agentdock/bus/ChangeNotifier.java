package com.zzf.agentdock.bus;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Debounces change signals and publishes them on {@link AgentBus} from one dedicated thread.
 * <p>
 * Session signals share one trailing window; transcript signals get a window per path.
 */
@Slf4j
public class ChangeNotifier implements AutoCloseable {
    private final AgentBus bus;
    private final long sessionDebounceMs;
    private final long transcriptDebounceMs;
    private final ScheduledExecutorService dispatcher;

    private final Object lock = new Object();
    private final Set<String> pendingSessionIds = new LinkedHashSet<>();
    private boolean pendingBroadcast;
    private ScheduledFuture<?> sessionFlush;
    private final Map<Path, ScheduledFuture<?>> transcriptFlushes = new HashMap<>();

    public ChangeNotifier(AgentBus bus, Duration sessionDebounce, Duration transcriptDebounce) {
        this.bus = bus;
        this.sessionDebounceMs = sessionDebounce.toMillis();
        this.transcriptDebounceMs = transcriptDebounce.toMillis();
        this.dispatcher = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agentdock-notify");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @param sessionId the changed session, or null for a full refresh
     */
    public void sessionChanged(String sessionId) {
        synchronized (lock) {
            if (sessionId == null) {
                pendingBroadcast = true;
            } else {
                pendingSessionIds.add(sessionId);
            }
            if (sessionFlush != null) {
                sessionFlush.cancel(false);
            }
            sessionFlush = dispatcher.schedule(this::flushSessions, sessionDebounceMs, TimeUnit.MILLISECONDS);
        }
    }

    public void transcriptChanged(Path path) {
        synchronized (lock) {
            ScheduledFuture<?> previous = transcriptFlushes.get(path);
            if (previous != null) {
                previous.cancel(false);
            }
            transcriptFlushes.put(path, dispatcher.schedule(() -> flushTranscript(path),
                    transcriptDebounceMs, TimeUnit.MILLISECONDS));
        }
    }

    private void flushSessions() {
        List<DockEvents.SessionChanged> events = new ArrayList<>();
        synchronized (lock) {
            if (pendingBroadcast) {
                events.add(new DockEvents.SessionChanged(null));
            } else {
                for (String id : pendingSessionIds) {
                    events.add(new DockEvents.SessionChanged(id));
                }
            }
            pendingBroadcast = false;
            pendingSessionIds.clear();
            sessionFlush = null;
        }
        for (DockEvents.SessionChanged event : events) {
            deliver(DockEvents.SESSION_UPDATED, event);
        }
    }

    private void flushTranscript(Path path) {
        synchronized (lock) {
            transcriptFlushes.remove(path);
        }
        deliver(DockEvents.TRANSCRIPT_UPDATED, new DockEvents.TranscriptChanged(path));
    }

    private <T> void deliver(AgentBus.Topic<T> topic, T payload) {
        bus.publish(topic, payload).whenComplete((ok, err) -> {
            if (err != null) {
                log.warn("notify.subscriber.failed topic={} payload={} err={}", topic.getName(), payload, err.toString());
            }
        });
    }

    @Override
    public void close() {
        dispatcher.shutdownNow();
    }
}
