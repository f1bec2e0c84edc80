package com.clawkeep.common.config;

import lombok.Data;

import java.util.List;

/**
 * Root configuration type for the resilience core.
 */
@Data
public class ClawkeepConfig {

    /** Cron/scheduling settings. */
    private CronConfig cron;

    /** Channel connection-recovery settings. */
    private RecoveryConfig recovery;

    /** Zombie session buffer settings. */
    private ZombieConfig zombie;

    /** Tools settings. */
    private ToolsConfig tools;

    // --- Nested config types ---

    @Data
    public static class CronConfig {
        private boolean enabled = true;
        /** Path of the job store file; "~" is expanded. */
        private String store;
        /** Age after which a running marker is presumed dead. */
        private long staleRunningMs = 60 * 60_000L;
        private long antiZombieIntervalMs = 60_000L;
        private long antiZombieThresholdMs = 60_000L;
        private long watchdogIntervalMs = 120_000L;
        /** Upper bound for a single armed timer delay. */
        private long maxTimerDelayMs = 30_000L;
    }

    @Data
    public static class RecoveryConfig {
        private long windowMs = 30_000L;
    }

    @Data
    public static class ZombieConfig {
        private long graceMs = 30_000L;
        private int maxQueuedPayloads = 500;
    }

    @Data
    public static class ToolsConfig {
        /** Tool names whose invocations run strictly one at a time. */
        private List<String> singleton;
    }
}
