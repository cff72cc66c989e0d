package com.zzf.agentdock.watch;

import com.zzf.agentdock.ingest.TranscriptIngestionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Watches the transcript roots recursively and turns file events into debounced ingestion signals.
 * <p>
 * Signals for one path within the debounce window collapse into one; the ingestion itself runs on a
 * small worker pool, never on the watch thread.
 */
@Slf4j
public class TranscriptWatcher implements InitializingBean, DisposableBean {
    private static final String SUFFIX = ".jsonl";
    private static final long POLL_MS = 500;

    private final List<Path> roots;
    private final TranscriptIngestionService ingestion;
    private final boolean enabled;
    private final long debounceMs;
    private final int workerThreads;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object debounceLock = new Object();
    private final Map<Path, ScheduledFuture<?>> pending = new HashMap<>();
    private WatchService watchService;
    private Thread thread;
    private ScheduledExecutorService debouncer;
    private ExecutorService workers;

    public TranscriptWatcher(List<Path> roots, TranscriptIngestionService ingestion, boolean enabled,
                             Duration debounce, int workerThreads) {
        this.roots = new ArrayList<>(roots);
        this.ingestion = ingestion;
        this.enabled = enabled;
        this.debounceMs = debounce.toMillis();
        this.workerThreads = Math.max(1, workerThreads);
    }

    @Override
    public void afterPropertiesSet() throws IOException {
        if (!enabled) {
            log.info("watch.autostart enabled=false");
            return;
        }
        if (!ingestion.isEnabled()) {
            log.info("watch.autostart skip reason=ingest_disabled");
            return;
        }
        start();
    }

    @Override
    public void destroy() {
        stop();
    }

    public void start() throws IOException {
        if (running.getAndSet(true)) {
            log.info("watch.start skip reason=already_running");
            return;
        }
        AtomicInteger n = new AtomicInteger();
        workers = Executors.newFixedThreadPool(workerThreads, r -> {
            Thread t = new Thread(r, "agentdock-ingest-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        debouncer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agentdock-debounce");
            t.setDaemon(true);
            return t;
        });
        watchService = FileSystems.getDefault().newWatchService();
        List<Path> existing = new ArrayList<>();
        for (Path root : roots) {
            if (root == null || !Files.isDirectory(root)) {
                log.info("watch.root.missing path={}", root);
                continue;
            }
            registerAll(root);
            existing.addAll(transcriptsUnder(root));
        }
        ingestion.seedExisting(existing);
        existing.forEach(this::signal);
        // non-daemon: keeps the process alive while watching
        thread = new Thread(this::runLoop, "agentdock-watch");
        thread.start();
        log.info("watch.start ok roots={} debounceMs={} workers={}", roots, debounceMs, workerThreads);
    }

    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("watch.close failed err={}", e.toString());
        }
        if (thread != null) {
            try {
                thread.join(3000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        debouncer.shutdownNow();
        workers.shutdown();
        log.info("watch.stop ok");
    }

    /**
     * Schedules ingestion of {@code path} after the debounce window, replacing any signal still waiting.
     */
    void signal(Path path) {
        Path key = path.toAbsolutePath().normalize();
        synchronized (debounceLock) {
            ScheduledFuture<?> previous = pending.get(key);
            if (previous != null) {
                previous.cancel(false);
            }
            pending.put(key, debouncer.schedule(() -> dispatch(key), debounceMs, TimeUnit.MILLISECONDS));
        }
    }

    private void dispatch(Path path) {
        synchronized (debounceLock) {
            pending.remove(path);
        }
        if (!workers.isShutdown()) {
            workers.execute(() -> ingestion.onFileChanged(path));
        }
    }

    private void runLoop() {
        while (running.get()) {
            WatchKey key;
            try {
                key = watchService.poll(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ClosedWatchServiceException e) {
                break;
            }
            if (key == null) {
                continue;
            }
            Path dir = (Path) key.watchable();
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    log.warn("watch.overflow dir={}", dir);
                    signalExisting(dir);
                    continue;
                }
                if (!(event.context() instanceof Path)) {
                    continue;
                }
                Path child = dir.resolve((Path) event.context());
                if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE && Files.isDirectory(child)) {
                    registerAll(child);
                    signalExisting(child);
                } else if (isTranscript(child) && event.kind() != StandardWatchEventKinds.ENTRY_DELETE) {
                    signal(child);
                }
            }
            if (!key.reset()) {
                log.debug("watch.key.invalid dir={}", dir);
            }
        }
        log.info("watch.loop.exit");
    }

    private void registerAll(Path start) {
        try (Stream<Path> walk = Files.walk(start)) {
            walk.filter(Files::isDirectory).forEach(dir -> {
                try {
                    dir.register(watchService, StandardWatchEventKinds.ENTRY_CREATE,
                            StandardWatchEventKinds.ENTRY_MODIFY, StandardWatchEventKinds.ENTRY_DELETE);
                } catch (IOException e) {
                    log.warn("watch.register failed dir={} err={}", dir, e.toString());
                } catch (ClosedWatchServiceException e) {
                    log.debug("watch.register skip dir={} reason=closed", dir);
                }
            });
        } catch (IOException | UncheckedIOException e) {
            log.warn("watch.walk failed dir={} err={}", start, e.toString());
        }
    }

    private void signalExisting(Path start) {
        transcriptsUnder(start).forEach(this::signal);
    }

    private static List<Path> transcriptsUnder(Path start) {
        try (Stream<Path> walk = Files.walk(start)) {
            return walk.filter(TranscriptWatcher::isTranscript).collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            log.warn("watch.scan failed dir={} err={}", start, e.toString());
            return Collections.emptyList();
        }
    }

    static boolean isTranscript(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().endsWith(SUFFIX) && !Files.isDirectory(path);
    }
}
