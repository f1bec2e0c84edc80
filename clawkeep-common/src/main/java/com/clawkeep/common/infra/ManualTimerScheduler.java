package com.clawkeep.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Deterministic {@link TimerScheduler} whose clock only moves when
 * {@link #advance(long)} is called. Due tasks run on the calling thread in
 * fire-time order; tasks scheduled while advancing fire in the same call if
 * they fall inside the window.
 */
@Slf4j
public class ManualTimerScheduler implements TimerScheduler {

    private final List<Entry> entries = new ArrayList<>();
    private long nowMs;
    private long sequence;

    public ManualTimerScheduler(long startMs) {
        this.nowMs = startMs;
    }

    @Override
    public synchronized long nowMs() {
        return nowMs;
    }

    public synchronized void setNowMs(long nowMs) {
        this.nowMs = nowMs;
    }

    @Override
    public synchronized TimerHandle schedule(Runnable task, long delayMs) {
        Entry entry = new Entry(task, nowMs + Math.max(0, delayMs), 0, sequence++);
        entries.add(entry);
        return entry;
    }

    @Override
    public synchronized TimerHandle scheduleAtFixedRate(Runnable task, long periodMs) {
        long period = Math.max(1, periodMs);
        Entry entry = new Entry(task, nowMs + period, period, sequence++);
        entries.add(entry);
        return entry;
    }

    /**
     * Move the clock forward by {@code ms}, running every task that becomes due.
     */
    public void advance(long ms) {
        long target;
        synchronized (this) {
            target = nowMs + Math.max(0, ms);
        }
        while (true) {
            Entry next;
            synchronized (this) {
                entries.removeIf(e -> e.cancelled);
                next = entries.stream()
                        .filter(e -> e.fireAtMs <= target)
                        .min(Comparator.comparingLong((Entry e) -> e.fireAtMs).thenComparingLong(e -> e.seq))
                        .orElse(null);
                if (next == null) {
                    nowMs = target;
                    return;
                }
                nowMs = Math.max(nowMs, next.fireAtMs);
                if (next.periodMs > 0) {
                    next.fireAtMs += next.periodMs;
                } else {
                    next.cancelled = true;
                }
            }
            try {
                next.task.run();
            } catch (Exception e) {
                log.error("Timer task failed: {}", e.getMessage(), e);
            }
        }
    }

    /** Number of tasks that may still fire. */
    public synchronized int pendingCount() {
        return (int) entries.stream().filter(e -> !e.cancelled).count();
    }

    private final class Entry implements TimerHandle {
        private final Runnable task;
        private final long periodMs;
        private final long seq;
        private long fireAtMs;
        private boolean cancelled;

        private Entry(Runnable task, long fireAtMs, long periodMs, long seq) {
            this.task = task;
            this.fireAtMs = fireAtMs;
            this.periodMs = periodMs;
            this.seq = seq;
        }

        @Override
        public void cancel() {
            synchronized (ManualTimerScheduler.this) {
                cancelled = true;
            }
        }

        @Override
        public boolean isActive() {
            synchronized (ManualTimerScheduler.this) {
                return !cancelled;
            }
        }
    }
}
