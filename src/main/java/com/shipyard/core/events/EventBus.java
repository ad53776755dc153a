package com.shipyard.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process event bus for pipeline lifecycle events, keyed by event type.
 * <p>
 * Listeners for a type are called synchronously on the publishing thread, in
 * the order they subscribed. A listener that throws is logged and skipped;
 * later listeners and the publisher are unaffected.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, List<Consumer<PipelineEvent>>> listeners = new ConcurrentHashMap<>();

    public void publish(PipelineEvent event) {
        List<Consumer<PipelineEvent>> forType = listeners.get(event.eventType());
        if (forType == null || forType.isEmpty()) {
            return;
        }
        log.debug("{} for run {} -> {} listener(s)", event.eventType(), event.runId(), forType.size());
        for (Consumer<PipelineEvent> listener : forType) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {} for run {}: {}", event.eventType(), event.runId(),
                        e.getMessage(), e);
            }
        }
    }

    /**
     * Registers a listener for one event type, e.g. {@link PipelineEvent#PIPELINE_COMPLETED}.
     *
     * @return handle that removes the listener again
     */
    public Subscription on(String eventType, Consumer<PipelineEvent> listener) {
        listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> listeners.getOrDefault(eventType, List.of()).remove(listener);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
