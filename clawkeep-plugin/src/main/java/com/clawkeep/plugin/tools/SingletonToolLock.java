package com.clawkeep.plugin.tools;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.stream.Collectors;

/**
 * Per-tool FIFO lock for tools backed by host singletons (CLIs that own a
 * local config file, database or socket).
 * <p>
 * Only names in the configured set are serialized; every other name passes
 * straight through. Release hands ownership directly to the oldest waiter,
 * so the key never looks free while someone is queued. A key's state is
 * dropped as soon as it is neither running nor contended.
 */
@Slf4j
public class SingletonToolLock {

    private final Set<String> singletonNames;
    private final Map<String, LockState> locks = new HashMap<>();

    private static final class LockState {
        private boolean running;
        private final ArrayDeque<CountDownLatch> queue = new ArrayDeque<>();
    }

    /**
     * @param toolNames tool names to serialize; normalized with
     *                  {@link PluginToolResolver#normalizeToolName(String)}
     */
    public SingletonToolLock(Collection<String> toolNames) {
        this.singletonNames = toolNames == null ? Set.of()
                : toolNames.stream()
                        .map(PluginToolResolver::normalizeToolName)
                        .filter(n -> !n.isEmpty())
                        .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isSingleton(String toolName) {
        return singletonNames.contains(PluginToolResolver.normalizeToolName(toolName));
    }

    public Set<String> getSingletonNames() {
        return singletonNames;
    }

    /**
     * Run {@code fn} holding the lock for {@code toolName}, or directly when the
     * tool is not a singleton.
     */
    public <T> T withLock(String toolName, Callable<T> fn) throws Exception {
        try (Permit ignored = acquire(toolName)) {
            return fn.call();
        }
    }

    /**
     * Block until the caller owns {@code toolName}. For non-singleton tools the
     * returned permit is a no-op.
     *
     * @throws InterruptedException if interrupted while queued; the caller
     *                              then owns nothing
     */
    public Permit acquire(String toolName) throws InterruptedException {
        String key = PluginToolResolver.normalizeToolName(toolName);
        if (!singletonNames.contains(key)) {
            return Permit.NOOP;
        }

        CountDownLatch turn;
        synchronized (locks) {
            LockState state = locks.computeIfAbsent(key, k -> new LockState());
            if (!state.running) {
                state.running = true;
                return new Permit(this, key);
            }
            turn = new CountDownLatch(1);
            state.queue.addLast(turn);
        }

        try {
            turn.await();
        } catch (InterruptedException e) {
            boolean handedOff;
            synchronized (locks) {
                LockState state = locks.get(key);
                handedOff = state == null || !state.queue.remove(turn);
            }
            if (handedOff) {
                // ownership arrived together with the interrupt; pass it on
                release(key);
            }
            throw e;
        }
        return new Permit(this, key);
    }

    private void release(String key) {
        synchronized (locks) {
            LockState state = locks.get(key);
            if (state == null || !state.running) {
                log.error("Singleton tool lock released without being held: {}", key);
                return;
            }
            CountDownLatch next = state.queue.pollFirst();
            if (next != null) {
                next.countDown();
            } else {
                state.running = false;
                locks.remove(key);
            }
        }
    }

    /** Keys currently held or contended. */
    public Set<String> activeKeys() {
        synchronized (locks) {
            return new TreeSet<>(locks.keySet());
        }
    }

    /** Number of callers queued behind the current holder of {@code toolName}. */
    public int queuedCount(String toolName) {
        synchronized (locks) {
            LockState state = locks.get(PluginToolResolver.normalizeToolName(toolName));
            return state != null ? state.queue.size() : 0;
        }
    }

    /**
     * Ownership of one singleton key. Closing more than once is a no-op.
     */
    public static final class Permit implements AutoCloseable {

        static final Permit NOOP = new Permit(null, null);

        private final SingletonToolLock owner;
        private final String key;
        private boolean closed;

        private Permit(SingletonToolLock owner, String key) {
            this.owner = owner;
            this.key = key;
        }

        @Override
        public void close() {
            if (owner == null) {
                return;
            }
            synchronized (this) {
                if (closed) {
                    log.warn("Singleton tool permit closed twice: {}", key);
                    return;
                }
                closed = true;
            }
            owner.release(key);
        }
    }
}
