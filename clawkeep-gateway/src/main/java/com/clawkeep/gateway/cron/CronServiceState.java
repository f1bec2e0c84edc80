package com.clawkeep.gateway.cron;

import com.clawkeep.common.infra.TimerHandle;
import com.clawkeep.gateway.cron.CronTypes.CronStoreFile;
import lombok.Data;

/**
 * In-memory runtime state of a {@link CronService}; never persisted.
 * Guarded by the service lock.
 */
@Data
class CronServiceState {
    private CronStoreFile store;
    private Long storeFileMtimeMs;

    /** The armed wake timer and the wake instant it was armed for. */
    private TimerHandle timer;
    private Long timerTargetMs;
    private TimerHandle watchdogTimer;
    private TimerHandle antiZombieTimer;

    private long startedAtMs;
    private Long lastTimerTickAtMs;
    private boolean running;
    private Long runningStartedAtMs;
    private boolean warnedDisabled;

    // Diagnostics
    private int timerArmCount;
    private int antiZombieReinitCount;
    private int watchdogRearmCount;
}
