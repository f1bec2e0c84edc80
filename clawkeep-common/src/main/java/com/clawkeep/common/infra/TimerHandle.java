package com.clawkeep.common.infra;

/**
 * Handle to a task registered with a {@link TimerScheduler}.
 * Cancelling is idempotent.
 */
public interface TimerHandle {

    void cancel();

    /** True while the task may still fire. */
    boolean isActive();
}
