package com.formwright.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for build events.
 * <p>
 * Supports per-run subscriptions (the CLI watch mode follows one run) and global
 * subscriptions that receive every event. Publishing happens on the building thread;
 * a subscriber that throws is logged and skipped, never seen by the build.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-run subscribers keyed by run id. Emptied lists are dropped on unsubscribe. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<BuildEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    /** Subscribers that receive events from every run. */
    private final CopyOnWriteArrayList<Consumer<BuildEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Delivers an event to the subscribers of its run, then to the global subscribers.
     *
     * @param event the event to publish
     */
    public void publish(BuildEvent event) {
        log.debug("Publishing {} for run {} (activity {})", event.eventType(), event.runId(),
                event.activityCode() == null ? "-" : event.activityCode());

        List<Consumer<BuildEvent>> runSubs = event.runId() == null ? null : runSubscribers.get(event.runId());
        if (runSubs != null) {
            for (Consumer<BuildEvent> subscriber : runSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<BuildEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to the events of one run, including its activities' events.
     *
     * @param runId    the run to follow
     * @param consumer callback invoked for each event of that run
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String runId, Consumer<BuildEvent> consumer) {
        runSubscribers.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to run {}", runId);
        return () -> runSubscribers.computeIfPresent(runId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    /**
     * Subscribe to events from every run.
     *
     * @param consumer callback invoked for each event regardless of run
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<BuildEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all build events");
        return () -> globalSubscribers.remove(consumer);
    }

    /** Number of runs that currently have at least one subscriber. */
    int followedRuns() {
        return runSubscribers.size();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<BuildEvent> subscriber, BuildEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber failed on {} for run {}: {}", event.eventType(), event.runId(),
                    e.getMessage(), e);
        }
    }
}
