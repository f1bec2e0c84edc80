package com.clawkeep.gateway.cron;

import com.clawkeep.common.infra.TimerScheduler;
import com.clawkeep.gateway.cron.CronTypes.CronRunStatus;
import lombok.Builder;
import lombok.Data;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Cron service event, dependency and result types.
 */
public final class CronState {

    private CronState() {
    }

    // =========================================================================
    // Event types
    // =========================================================================

    public enum CronEventAction {
        ADDED, UPDATED, REMOVED, STARTED, FINISHED
    }

    /**
     * Cron lifecycle event.
     */
    @Data
    @Builder
    public static class CronEvent {
        private String jobId;
        private CronEventAction action;
        private Long runAtMs;
        private Long durationMs;
        private CronRunStatus status;
        private String error;
        private String summary;
        private String sessionId;
        private String sessionKey;
        private Long nextRunAtMs;
    }

    // =========================================================================
    // Host collaborators
    // =========================================================================

    /** Outcome of a synchronous heartbeat run. */
    public record HeartbeatRunResult(String status, String reason) {

        public static HeartbeatRunResult ran() {
            return new HeartbeatRunResult("ran", null);
        }

        public boolean isRan() {
            return "ran".equals(status);
        }

        public boolean isFailed() {
            return "failed".equals(status);
        }
    }

    /** Outcome of an isolated agent turn. */
    @Data
    @Builder
    public static class IsolatedAgentRunResult {
        private CronRunStatus status;
        private String summary;
        private String outputText;
        private String error;
        private String sessionId;
        private String sessionKey;

        public static IsolatedAgentRunResult ok(String summary) {
            return IsolatedAgentRunResult.builder().status(CronRunStatus.OK).summary(summary).build();
        }
    }

    /**
     * Runs an agent turn for an isolated job in a fresh session.
     */
    @FunctionalInterface
    public interface IsolatedAgentJobRunner {
        CompletableFuture<IsolatedAgentRunResult> run(CronJob job, String message);
    }

    // =========================================================================
    // Dependencies
    // =========================================================================

    /**
     * Dependencies and tuning for cron service initialization.
     */
    @Data
    @Builder
    public static class CronServiceDeps {
        private String storePath;
        @Builder.Default
        private boolean cronEnabled = true;
        private String agentId;
        private TimerScheduler timers;

        /** (text, agentId) posted into the main session's queue. */
        private BiConsumer<String, String> enqueueSystemEvent;
        /** Asks the heartbeat loop to wake soon; argument is the reason. */
        private Consumer<String> requestHeartbeatNow;
        /** Optional synchronous heartbeat run; argument is the reason. */
        private Function<String, HeartbeatRunResult> runHeartbeatOnce;
        private IsolatedAgentJobRunner runIsolatedAgentJob;
        private Consumer<CronEvent> onEvent;
        /** Runs timer ticks off the timer thread; null runs them inline. */
        private Executor tickExecutor;

        @Builder.Default
        private long staleRunningMs = 60 * 60_000L;
        @Builder.Default
        private long antiZombieIntervalMs = 60_000L;
        @Builder.Default
        private long antiZombieThresholdMs = 60_000L;
        @Builder.Default
        private long watchdogIntervalMs = 120_000L;
        @Builder.Default
        private long maxTimerDelayMs = 30_000L;
    }

    // =========================================================================
    // Result types
    // =========================================================================

    /** Result of running a cron job. */
    public sealed interface CronRunResult {
        boolean ok();

        default boolean ran() {
            return this instanceof CronRanOk;
        }
    }

    public record CronRanOk(CronRunStatus status) implements CronRunResult {
        @Override
        public boolean ok() {
            return true;
        }
    }

    public enum CronSkipReason {
        NOT_DUE, ALREADY_RUNNING
    }

    public record CronNotRan(CronSkipReason reason) implements CronRunResult {
        @Override
        public boolean ok() {
            return true;
        }
    }

    public record CronRunFailed(Exception error) implements CronRunResult {
        @Override
        public boolean ok() {
            return false;
        }
    }

    /** Result of removing a cron job. */
    public record CronRemoveResult(boolean ok, boolean removed) {
    }

    // =========================================================================
    // Enums
    // =========================================================================

    public enum CronRunMode {
        DUE, FORCE
    }

    public enum CronWakeMode {
        NOW, NEXT_HEARTBEAT
    }

    // =========================================================================
    // Status
    // =========================================================================

    /**
     * Cron status summary for diagnostics.
     */
    @Data
    @Builder
    public static class CronStatusSummary {
        private boolean enabled;
        private String storePath;
        private int jobs;
        private Long nextWakeAtMs;
    }
}
