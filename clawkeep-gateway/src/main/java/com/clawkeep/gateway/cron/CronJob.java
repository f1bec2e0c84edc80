package com.clawkeep.gateway.cron;

import com.clawkeep.gateway.cron.CronTypes.CronDelivery;
import com.clawkeep.gateway.cron.CronTypes.CronJobState;
import com.clawkeep.gateway.cron.CronTypes.CronPayload;
import com.clawkeep.gateway.cron.CronTypes.CronSchedule;
import com.clawkeep.gateway.cron.CronTypes.SessionTarget;
import com.clawkeep.gateway.cron.CronTypes.WakeMode;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A persisted unit of scheduled work.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CronJob {
    private String id;
    private String agentId;
    private String name;
    private String description;
    @Builder.Default
    private boolean enabled = true;
    private Boolean deleteAfterRun;
    private long createdAtMs;
    private long updatedAtMs;
    private CronSchedule schedule;
    private SessionTarget sessionTarget;
    private WakeMode wakeMode;
    private CronPayload payload;
    private CronDelivery delivery;
    @Builder.Default
    private CronJobState state = new CronJobState();

    @JsonIgnore
    public boolean isDeleteAfterRunEnabled() {
        return Boolean.TRUE.equals(deleteAfterRun);
    }

    @JsonIgnore
    public boolean isRunning() {
        return state != null && state.getRunningAtMs() != null;
    }
}
