package com.clawkeep.gateway.session;

import com.clawkeep.common.infra.TimerHandle;
import com.clawkeep.common.infra.TimerScheduler;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Keeps a disconnected session's identity and outbound backlog alive for a
 * grace window so a prompt reconnect can resume it.
 * <p>
 * {@link #markZombie(String)} starts (or restarts) a reaper. Until it fires,
 * payloads for the session are buffered and {@link #reBind(String)} hands them
 * back in order. If the reaper fires first, the backlog is dropped and the
 * {@code onReap} callback is notified.
 *
 * @param <T> buffered payload type
 */
@Slf4j
public class ZombieSessionBuffer<T> {

    public static final long DEFAULT_GRACE_MS = 30_000;
    public static final int DEFAULT_MAX_QUEUED_PAYLOADS = 500;

    /** A buffered payload with the time it was queued. */
    public record QueuedPayload<T>(T payload, long queuedAt) {
    }

    private static final class ZombieEntry {
        private long disconnectedAt;
        private long generation;
        private TimerHandle reaper;
    }

    private final TimerScheduler timers;
    private final long graceMs;
    private final int maxQueuedPayloads;
    private final Map<String, ZombieEntry> zombies = new HashMap<>();
    private final Map<String, Deque<QueuedPayload<T>>> queues = new HashMap<>();
    private long generationSeq;

    private volatile Consumer<String> onReap;
    private volatile BiConsumer<String, Integer> onReBind;

    public ZombieSessionBuffer(TimerScheduler timers) {
        this(timers, DEFAULT_GRACE_MS, DEFAULT_MAX_QUEUED_PAYLOADS);
    }

    public ZombieSessionBuffer(TimerScheduler timers, long graceMs, int maxQueuedPayloads) {
        if (graceMs <= 0) {
            throw new IllegalArgumentException("graceMs must be positive: " + graceMs);
        }
        if (maxQueuedPayloads <= 0) {
            throw new IllegalArgumentException("maxQueuedPayloads must be positive: " + maxQueuedPayloads);
        }
        this.timers = Objects.requireNonNull(timers, "timers");
        this.graceMs = graceMs;
        this.maxQueuedPayloads = maxQueuedPayloads;
    }

    /**
     * Register lifecycle callbacks.
     *
     * @param onReap   called with the session key after its grace window lapsed
     * @param onReBind called with the session key and number of replayed payloads
     */
    public void setCallbacks(Consumer<String> onReap, BiConsumer<String, Integer> onReBind) {
        this.onReap = onReap;
        this.onReBind = onReBind;
    }

    /**
     * Mark a session as disconnected. Marking an existing zombie again resets
     * its reaper instead of creating a second one.
     */
    public synchronized void markZombie(String sessionKey) {
        String key = normalizeKey(sessionKey);
        if (key == null)
            return;

        ZombieEntry entry = zombies.get(key);
        if (entry != null) {
            cancel(entry.reaper);
            log.debug("zombie: reaper reset for session {}", key);
        } else {
            entry = new ZombieEntry();
            zombies.put(key, entry);
            queues.put(key, new ArrayDeque<>());
            log.info("zombie: session {} detached, holding for {}ms", key, graceMs);
        }
        entry.disconnectedAt = timers.nowMs();
        long generation = ++generationSeq;
        entry.generation = generation;
        entry.reaper = timers.schedule(() -> reap(key, generation), graceMs);
    }

    public synchronized boolean isZombie(String sessionKey) {
        String key = normalizeKey(sessionKey);
        return key != null && zombies.containsKey(key);
    }

    /**
     * Buffer a payload for a zombie session. Once the backlog is full the
     * oldest entry is dropped.
     *
     * @return false if the session is not a zombie
     */
    public synchronized boolean queuePayload(String sessionKey, T payload) {
        String key = normalizeKey(sessionKey);
        if (key == null || !zombies.containsKey(key))
            return false;
        Deque<QueuedPayload<T>> queue = queues.computeIfAbsent(key, k -> new ArrayDeque<>());
        if (queue.size() >= maxQueuedPayloads) {
            queue.removeFirst();
            log.warn("zombie: backlog full for session {} ({}), dropping oldest payload", key, maxQueuedPayloads);
        }
        queue.addLast(new QueuedPayload<>(payload, timers.nowMs()));
        return true;
    }

    /**
     * Re-attach a zombie session: cancels its reaper and returns the backlog in
     * the order it was queued. Returns an empty list for a live or unknown key.
     */
    public List<QueuedPayload<T>> reBind(String sessionKey) {
        String key = normalizeKey(sessionKey);
        if (key == null)
            return Collections.emptyList();

        List<QueuedPayload<T>> backlog;
        synchronized (this) {
            ZombieEntry entry = zombies.remove(key);
            Deque<QueuedPayload<T>> queue = queues.remove(key);
            if (entry == null)
                return Collections.emptyList();
            cancel(entry.reaper);
            backlog = queue == null ? new ArrayList<>() : new ArrayList<>(queue);
            log.info("zombie: session {} re-bound after {}ms, replaying {} payload(s)",
                    key, timers.nowMs() - entry.disconnectedAt, backlog.size());
        }

        BiConsumer<String, Integer> callback = onReBind;
        if (callback != null) {
            try {
                callback.accept(key, backlog.size());
            } catch (Exception e) {
                log.warn("zombie: onReBind callback failed for session {}: {}", key, e.getMessage());
            }
        }
        return backlog;
    }

    public synchronized int getQueuedCount(String sessionKey) {
        String key = normalizeKey(sessionKey);
        if (key == null)
            return 0;
        Deque<QueuedPayload<T>> queue = queues.get(key);
        return queue == null ? 0 : queue.size();
    }

    public synchronized int zombieCount() {
        return zombies.size();
    }

    /**
     * Cancel every reaper and drop all state. Used at shutdown.
     */
    public synchronized void clearZombieBuffer() {
        for (ZombieEntry entry : zombies.values()) {
            cancel(entry.reaper);
        }
        if (!zombies.isEmpty()) {
            log.info("zombie: cleared {} pending session(s)", zombies.size());
        }
        zombies.clear();
        queues.clear();
    }

    private void reap(String key, long generation) {
        int dropped;
        synchronized (this) {
            ZombieEntry entry = zombies.get(key);
            if (entry == null || entry.generation != generation)
                return;
            zombies.remove(key);
            Deque<QueuedPayload<T>> queue = queues.remove(key);
            dropped = queue == null ? 0 : queue.size();
        }
        log.info("zombie: grace window lapsed for session {}, dropped {} payload(s)", key, dropped);

        Consumer<String> callback = onReap;
        if (callback != null) {
            try {
                callback.accept(key);
            } catch (Exception e) {
                log.error("zombie: onReap callback failed for session {}: {}", key, e.getMessage(), e);
            }
        }
    }

    private static String normalizeKey(String sessionKey) {
        if (sessionKey == null)
            return null;
        String trimmed = sessionKey.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static void cancel(TimerHandle handle) {
        if (handle != null)
            handle.cancel();
    }
}
