package com.clawkeep.gateway.cron;

import com.clawkeep.gateway.cron.CronTypes.CronSchedule;

/**
 * Next-run arithmetic for "at" and "every" schedules.
 */
public final class CronSchedules {

    private CronSchedules() {
    }

    /**
     * Compute the next fire time for a schedule relative to {@code nowMs}.
     * <p>
     * "every" schedules fire one interval after {@code nowMs}, or on the next
     * anchor-aligned slot strictly after it when an anchor is set. "at"
     * schedules fire at their absolute time, even if it lies in the past,
     * unless {@code lastRunAtMs} shows they already ran.
     *
     * @return epoch ms of the next run, or null if the schedule will not fire again
     */
    public static Long computeNextRunAtMs(CronSchedule schedule, long nowMs, Long lastRunAtMs) {
        if (schedule == null || schedule.getKind() == null)
            return null;
        switch (schedule.getKind()) {
            case EVERY: {
                long every = schedule.getEveryMs() == null ? 0 : schedule.getEveryMs();
                if (every <= 0)
                    return null;
                Long anchor = schedule.getAnchorMs();
                if (anchor == null)
                    return nowMs + every;
                if (anchor > nowMs)
                    return anchor;
                long elapsed = nowMs - anchor;
                return anchor + (elapsed / every + 1) * every;
            }
            case AT: {
                if (lastRunAtMs != null)
                    return null;
                return CronParse.parseAbsoluteTimeMs(schedule.getAt());
            }
            default:
                return null;
        }
    }

    /**
     * Validate a schedule, throwing {@link IllegalArgumentException} on bad input.
     */
    public static void validate(CronSchedule schedule) {
        if (schedule == null || schedule.getKind() == null) {
            throw new IllegalArgumentException("schedule.kind is required");
        }
        switch (schedule.getKind()) {
            case EVERY:
                if (schedule.getEveryMs() == null || schedule.getEveryMs() <= 0) {
                    throw new IllegalArgumentException("schedule.everyMs must be a positive number");
                }
                break;
            case AT:
                if (CronParse.parseAbsoluteTimeMs(schedule.getAt()) == null) {
                    throw new IllegalArgumentException("schedule.at is not a valid timestamp: " + schedule.getAt());
                }
                break;
            default:
                throw new IllegalArgumentException("unsupported schedule kind: " + schedule.getKind());
        }
    }
}
