package com.clawkeep.gateway.cron;

import com.clawkeep.gateway.cron.CronTypes.CronDelivery;
import com.clawkeep.gateway.cron.CronTypes.CronJobCreate;
import com.clawkeep.gateway.cron.CronTypes.CronJobPatch;
import com.clawkeep.gateway.cron.CronTypes.CronJobState;
import com.clawkeep.gateway.cron.CronTypes.CronPayload;
import com.clawkeep.gateway.cron.CronTypes.CronSchedule;
import com.clawkeep.gateway.cron.CronTypes.PayloadKind;
import com.clawkeep.gateway.cron.CronTypes.ScheduleKind;
import com.clawkeep.gateway.cron.CronTypes.SessionTarget;
import com.clawkeep.gateway.cron.CronTypes.WakeMode;

import java.time.Instant;
import java.util.UUID;

/**
 * Cron job input normalization: coerces create/patch input into well-formed
 * jobs and rejects unsupported combinations.
 */
public final class CronNormalize {

    private CronNormalize() {
    }

    /**
     * Normalize a schedule: trims the "at" value and rewrites it as a UTC
     * ISO-8601 instant when it parses.
     */
    public static CronSchedule coerceSchedule(CronSchedule schedule) {
        if (schedule == null)
            return null;
        CronSchedule next = CronSchedule.builder()
                .kind(schedule.getKind())
                .at(schedule.getAt())
                .everyMs(schedule.getEveryMs())
                .anchorMs(schedule.getAnchorMs())
                .build();
        if (next.getKind() == null) {
            if (next.getAt() != null) {
                next.setKind(ScheduleKind.AT);
            } else if (next.getEveryMs() != null) {
                next.setKind(ScheduleKind.EVERY);
            }
        }
        if (next.getAt() != null) {
            String at = next.getAt().trim();
            Long parsed = CronParse.parseAbsoluteTimeMs(at);
            next.setAt(parsed != null ? Instant.ofEpochMilli(parsed).toString() : at);
        }
        return next;
    }

    /**
     * Normalize delivery config (channel lowercased, blank fields dropped).
     */
    public static CronDelivery coerceDelivery(CronDelivery delivery) {
        if (delivery == null)
            return null;
        String channel = trimToNull(delivery.getChannel());
        return CronDelivery.builder()
                .mode(delivery.getMode())
                .channel(channel == null ? null : channel.toLowerCase())
                .to(trimToNull(delivery.getTo()))
                .bestEffort(delivery.getBestEffort())
                .build();
    }

    /**
     * "main" jobs carry a systemEvent, "isolated" jobs an agentTurn.
     */
    public static void assertSupportedPayload(SessionTarget target, CronPayload payload) {
        if (payload == null || payload.getKind() == null) {
            throw new IllegalArgumentException("payload.kind is required");
        }
        if (target == SessionTarget.MAIN && payload.getKind() != PayloadKind.SYSTEM_EVENT) {
            throw new IllegalArgumentException("main cron jobs require payload.kind=\"systemEvent\"");
        }
        if (target == SessionTarget.ISOLATED && payload.getKind() != PayloadKind.AGENT_TURN) {
            throw new IllegalArgumentException("isolated cron jobs require payload.kind=\"agentTurn\"");
        }
    }

    /**
     * Build a new job from create input, validating schedule and payload.
     *
     * @throws IllegalArgumentException on invalid input
     */
    public static CronJob createJob(CronJobCreate input, long nowMs) {
        if (input == null) {
            throw new IllegalArgumentException("cron job input is required");
        }
        CronSchedule schedule = coerceSchedule(input.getSchedule());
        CronSchedules.validate(schedule);

        CronPayload payload = input.getPayload();
        SessionTarget target = input.getSessionTarget();
        if (target == null) {
            target = payload != null && payload.getKind() == PayloadKind.AGENT_TURN
                    ? SessionTarget.ISOLATED
                    : SessionTarget.MAIN;
        }
        assertSupportedPayload(target, payload);

        String id = UUID.randomUUID().toString();
        String name = trimToNull(input.getName());
        Boolean deleteAfterRun = input.getDeleteAfterRun();
        if (deleteAfterRun == null && schedule.getKind() == ScheduleKind.AT) {
            deleteAfterRun = true;
        }

        CronJob job = CronJob.builder()
                .id(id)
                .agentId(trimToNull(input.getAgentId()))
                .name(name != null ? name : "cron-" + id.substring(0, 8))
                .description(trimToNull(input.getDescription()))
                .enabled(input.isEnabled())
                .deleteAfterRun(deleteAfterRun)
                .createdAtMs(nowMs)
                .updatedAtMs(nowMs)
                .schedule(schedule)
                .sessionTarget(target)
                .wakeMode(input.getWakeMode() != null ? input.getWakeMode() : WakeMode.NEXT_HEARTBEAT)
                .payload(payload)
                .delivery(coerceDelivery(input.getDelivery()))
                .state(new CronJobState())
                .build();
        if (job.isEnabled()) {
            job.getState().setNextRunAtMs(CronSchedules.computeNextRunAtMs(schedule, nowMs, null));
        }
        return job;
    }

    /**
     * Apply a patch in place. The next run time is recomputed when the
     * schedule or enabled flag changes.
     *
     * @throws IllegalArgumentException on invalid input; the job is left untouched
     */
    public static void applyPatch(CronJob job, CronJobPatch patch, long nowMs) {
        if (patch == null) {
            throw new IllegalArgumentException("cron job patch is required");
        }
        CronSchedule schedule = patch.getSchedule() != null ? coerceSchedule(patch.getSchedule()) : job.getSchedule();
        if (patch.getSchedule() != null) {
            CronSchedules.validate(schedule);
        }
        SessionTarget target = patch.getSessionTarget() != null ? patch.getSessionTarget() : job.getSessionTarget();
        CronPayload payload = patch.getPayload() != null ? patch.getPayload() : job.getPayload();
        assertSupportedPayload(target, payload);

        boolean rescheduled = patch.getSchedule() != null
                || (patch.getEnabled() != null && patch.getEnabled() != job.isEnabled());

        if (patch.getAgentId() != null)
            job.setAgentId(trimToNull(patch.getAgentId()));
        if (patch.getName() != null && !patch.getName().isBlank())
            job.setName(patch.getName().trim());
        if (patch.getDescription() != null)
            job.setDescription(trimToNull(patch.getDescription()));
        if (patch.getEnabled() != null)
            job.setEnabled(patch.getEnabled());
        if (patch.getDeleteAfterRun() != null)
            job.setDeleteAfterRun(patch.getDeleteAfterRun());
        if (patch.getWakeMode() != null)
            job.setWakeMode(patch.getWakeMode());
        if (patch.getDelivery() != null)
            job.setDelivery(coerceDelivery(patch.getDelivery()));
        job.setSchedule(schedule);
        job.setSessionTarget(target);
        job.setPayload(payload);
        job.setUpdatedAtMs(nowMs);

        if (rescheduled) {
            CronJobState state = job.getState();
            if (!job.isEnabled()) {
                state.setNextRunAtMs(null);
            } else {
                Long lastRun = patch.getSchedule() != null ? null : state.getLastRunAtMs();
                state.setNextRunAtMs(CronSchedules.computeNextRunAtMs(schedule, nowMs, lastRun));
            }
        }
    }

    private static String trimToNull(String value) {
        if (value == null)
            return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
