package com.clawkeep.common.infra;

/**
 * Clock plus delayed/periodic task scheduling.
 * <p>
 * Components take this instead of a raw executor so that tests can drive time
 * explicitly (see {@link ManualTimerScheduler}).
 */
public interface TimerScheduler {

    /** Current wall-clock time in epoch milliseconds. */
    long nowMs();

    /**
     * Run {@code task} once after {@code delayMs} (negative delays fire
     * immediately).
     */
    TimerHandle schedule(Runnable task, long delayMs);

    /**
     * Run {@code task} every {@code periodMs}, first run one period from now.
     */
    TimerHandle scheduleAtFixedRate(Runnable task, long periodMs);
}
