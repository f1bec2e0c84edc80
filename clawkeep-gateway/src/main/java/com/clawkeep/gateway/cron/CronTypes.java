package com.clawkeep.gateway.cron;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Cron job type definitions: schedule variants, typed payloads, delivery
 * configuration, runtime state, create/patch DTOs and the store file.
 * Enum values serialize as their lower-camel wire keys.
 */
public final class CronTypes {

    private CronTypes() {
    }

    // =========================================================================
    // Schedule
    // =========================================================================

    public enum ScheduleKind {
        AT, EVERY;

        @JsonValue
        public String key() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static ScheduleKind fromKey(String key) {
            for (ScheduleKind kind : values()) {
                if (kind.key().equalsIgnoreCase(key)) {
                    return kind;
                }
            }
            throw new IllegalArgumentException("unsupported schedule kind: " + key);
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronSchedule {
        private ScheduleKind kind;
        /** ISO-8601 timestamp (or epoch ms string) for "at" schedules. */
        private String at;
        /** Interval in milliseconds for "every" schedules. */
        private Long everyMs;
        /** Optional alignment anchor in ms for "every" schedules. */
        private Long anchorMs;

        public static CronSchedule every(long everyMs) {
            return CronSchedule.builder().kind(ScheduleKind.EVERY).everyMs(everyMs).build();
        }

        public static CronSchedule at(String at) {
            return CronSchedule.builder().kind(ScheduleKind.AT).at(at).build();
        }
    }

    // =========================================================================
    // Session/wake modes
    // =========================================================================

    public enum SessionTarget {
        MAIN, ISOLATED;

        @JsonValue
        public String key() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static SessionTarget fromKey(String key) {
            return "isolated".equalsIgnoreCase(key) ? ISOLATED : MAIN;
        }
    }

    public enum WakeMode {
        NEXT_HEARTBEAT, NOW;

        @JsonValue
        public String key() {
            return name().toLowerCase().replace('_', '-');
        }

        @JsonCreator
        public static WakeMode fromKey(String key) {
            if ("now".equalsIgnoreCase(key))
                return NOW;
            return NEXT_HEARTBEAT;
        }
    }

    // =========================================================================
    // Payload
    // =========================================================================

    public enum PayloadKind {
        SYSTEM_EVENT, AGENT_TURN;

        @JsonValue
        public String key() {
            return this == SYSTEM_EVENT ? "systemEvent" : "agentTurn";
        }

        @JsonCreator
        public static PayloadKind fromKey(String key) {
            if ("agentTurn".equalsIgnoreCase(key))
                return AGENT_TURN;
            return SYSTEM_EVENT;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronPayload {
        private PayloadKind kind;
        /** Text for systemEvent payloads. */
        private String text;
        /** Message for agentTurn payloads. */
        private String message;
        private String model;
        private String thinking;
        private Integer timeoutSeconds;

        public static CronPayload systemEvent(String text) {
            return CronPayload.builder().kind(PayloadKind.SYSTEM_EVENT).text(text).build();
        }

        public static CronPayload agentTurn(String message) {
            return CronPayload.builder().kind(PayloadKind.AGENT_TURN).message(message).build();
        }
    }

    // =========================================================================
    // Delivery
    // =========================================================================

    public enum DeliveryMode {
        NONE, ANNOUNCE;

        @JsonValue
        public String key() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static DeliveryMode fromKey(String key) {
            if ("announce".equalsIgnoreCase(key) || "deliver".equalsIgnoreCase(key))
                return ANNOUNCE;
            return NONE;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronDelivery {
        private DeliveryMode mode;
        private String channel;
        private String to;
        private Boolean bestEffort;

        public static CronDelivery none() {
            return CronDelivery.builder().mode(DeliveryMode.NONE).build();
        }
    }

    // =========================================================================
    // Run status
    // =========================================================================

    public enum CronRunStatus {
        OK, ERROR, SKIPPED;

        @JsonValue
        public String key() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static CronRunStatus fromKey(String key) {
            return CronRunStatus.valueOf(key.trim().toUpperCase());
        }
    }

    // =========================================================================
    // Job state
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronJobState {
        private Long nextRunAtMs;
        /** Set while an execution is believed to be in flight. */
        private Long runningAtMs;
        private Long lastRunAtMs;
        private CronRunStatus lastStatus;
        private String lastError;
        private Long lastDurationMs;
    }

    // =========================================================================
    // Create/Patch DTOs
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronJobCreate {
        private String agentId;
        private String name;
        private String description;
        @Builder.Default
        private boolean enabled = true;
        private Boolean deleteAfterRun;
        private CronSchedule schedule;
        private SessionTarget sessionTarget;
        private WakeMode wakeMode;
        private CronPayload payload;
        private CronDelivery delivery;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronJobPatch {
        private String agentId;
        private String name;
        private String description;
        private Boolean enabled;
        private Boolean deleteAfterRun;
        private CronSchedule schedule;
        private SessionTarget sessionTarget;
        private WakeMode wakeMode;
        private CronPayload payload;
        private CronDelivery delivery;
    }

    // =========================================================================
    // Store format
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronStoreFile {
        public static final int CURRENT_VERSION = 1;

        @Builder.Default
        private int version = CURRENT_VERSION;
        @Builder.Default
        private List<CronJob> jobs = new ArrayList<>();
        /** Entries that could not be bound to a job; written back unchanged on save. */
        @JsonIgnore
        @Builder.Default
        private List<JsonNode> unparsedJobs = new ArrayList<>();

        public static CronStoreFile empty() {
            return CronStoreFile.builder().build();
        }
    }
}
