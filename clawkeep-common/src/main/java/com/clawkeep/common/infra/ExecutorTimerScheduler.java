package com.clawkeep.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link TimerScheduler} backed by a daemon {@link ScheduledExecutorService}.
 * <p>
 * Task exceptions are logged and swallowed at the task boundary; a failing
 * periodic task keeps its schedule.
 */
@Slf4j
public class ExecutorTimerScheduler implements TimerScheduler, AutoCloseable {

    private final ScheduledExecutorService executor;

    public ExecutorTimerScheduler(String threadName, int poolSize) {
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newScheduledThreadPool(Math.max(1, poolSize), r -> {
            Thread t = new Thread(r, threadName + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public long nowMs() {
        return System.currentTimeMillis();
    }

    @Override
    public TimerHandle schedule(Runnable task, long delayMs) {
        return new FutureHandle(executor.schedule(guarded(task), Math.max(0, delayMs), TimeUnit.MILLISECONDS));
    }

    @Override
    public TimerHandle scheduleAtFixedRate(Runnable task, long periodMs) {
        long period = Math.max(1, periodMs);
        return new FutureHandle(
                executor.scheduleAtFixedRate(guarded(task), period, period, TimeUnit.MILLISECONDS));
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Timer task failed: {}", e.getMessage(), e);
            }
        };
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private record FutureHandle(ScheduledFuture<?> future) implements TimerHandle {
        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isActive() {
            return !future.isDone();
        }
    }
}
