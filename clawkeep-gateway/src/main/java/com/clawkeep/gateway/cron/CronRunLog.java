package com.clawkeep.gateway.cron;

import com.clawkeep.gateway.cron.CronTypes.CronRunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One finished execution, kept in the scheduler's in-memory run history.
 * <p>
 * The history is bounded (oldest entries are evicted first), is not persisted,
 * and is read newest-first through {@link CronService#getRunLogs(String, int)}.
 * Skipped runs are recorded too, with {@link CronRunStatus#SKIPPED} and the
 * reason in {@code error}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CronRunLog {
    private String jobId;
    private String jobName;
    private String agentId;
    /** Epoch millis when the job was marked running. */
    private long startedAtMs;
    private long finishedAtMs;
    private long durationMs;
    private CronRunStatus status;
    /** Summary reported by an isolated agent run; null for main-session jobs. */
    private String summary;
    private String error;
}
