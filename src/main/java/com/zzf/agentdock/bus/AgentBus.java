package com.zzf.agentdock.bus;

import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process change bus. Listeners register per {@link Topic} and run on the publishing thread.
 */
public class AgentBus {
    private final ConcurrentMap<Topic<?>, List<Consumer<?>>> listeners = new ConcurrentHashMap<>();

    /**
     * A named channel and the payload type it carries.
     */
    @Value
    public static class Topic<T> {
        String name;
        Class<T> payloadType;
    }

    /**
     * @return handle that removes the listener again
     */
    public <T> Runnable subscribe(Topic<T> topic, Consumer<T> listener) {
        List<Consumer<?>> registered = listeners.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>());
        registered.add(listener);
        return () -> registered.remove(listener);
    }

    /**
     * Runs every listener of {@code topic}. A failing listener does not stop the rest: the returned future
     * fails with the first error, later ones attached as suppressed.
     */
    @SuppressWarnings("unchecked")
    public <T> CompletableFuture<Void> publish(Topic<T> topic, T payload) {
        T checked = topic.getPayloadType().cast(payload);
        RuntimeException failure = null;
        for (Consumer<?> listener : listeners.getOrDefault(topic, Collections.emptyList())) {
            try {
                ((Consumer<T>) listener).accept(checked);
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        return failure == null ? CompletableFuture.completedFuture(null) : CompletableFuture.failedFuture(failure);
    }
}
