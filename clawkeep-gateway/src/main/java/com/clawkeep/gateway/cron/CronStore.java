package com.clawkeep.gateway.cron;

import com.clawkeep.gateway.cron.CronTypes.CronJobState;
import com.clawkeep.gateway.cron.CronTypes.CronStoreFile;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Cron store persistence utilities.
 * Handles loading, saving, and migrating cron store files.
 */
@Slf4j
public final class CronStore {

    private CronStore() {
    }

    static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.INDENT_OUTPUT, true)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    /**
     * Load the cron store from a file path.
     * A missing or blank file yields an empty store; a bare array of jobs is
     * accepted as the legacy layout. Entries that cannot be bound to a job are
     * kept aside in {@link CronStoreFile#getUnparsedJobs()}.
     *
     * @throws CronStoreException if the file exists but cannot be read or parsed
     */
    public static CronStoreFile load(Path path) {
        if (!Files.exists(path)) {
            log.debug("Cron store file not found: {}", path);
            return CronStoreFile.empty();
        }

        try {
            String content = Files.readString(path);
            if (content.isBlank()) {
                return CronStoreFile.empty();
            }

            JsonNode root = MAPPER.readTree(content);
            JsonNode jobsNode;
            int version = CronStoreFile.CURRENT_VERSION;
            if (root.isArray()) {
                jobsNode = root;
            } else if (root.isObject()) {
                jobsNode = root.path("jobs");
                version = root.path("version").asInt(CronStoreFile.CURRENT_VERSION);
            } else {
                throw new CronStoreException("Unrecognized cron store layout in " + path, null);
            }

            List<CronJob> jobs = new ArrayList<>();
            List<JsonNode> unparsed = new ArrayList<>();
            if (jobsNode.isArray()) {
                for (JsonNode entry : jobsNode) {
                    try {
                        CronJob job = MAPPER.treeToValue(entry, CronJob.class);
                        if (job == null || job.getId() == null || job.getId().isBlank()) {
                            log.warn("Skipping cron job entry without id in {}", path);
                            unparsed.add(entry);
                            continue;
                        }
                        if (job.getSchedule() == null || job.getSchedule().getKind() == null
                                || job.getPayload() == null) {
                            log.warn("Skipping cron job {} without schedule or payload in {}", job.getId(), path);
                            unparsed.add(entry);
                            continue;
                        }
                        jobs.add(migrate(job));
                    } catch (IOException | IllegalArgumentException e) {
                        log.warn("Skipping malformed cron job entry in {}: {}", path, e.getMessage());
                        unparsed.add(entry);
                    }
                }
            }
            return CronStoreFile.builder().version(version).jobs(jobs).unparsedJobs(unparsed).build();

        } catch (IOException e) {
            throw new CronStoreException("Failed to load cron store from " + path, e);
        }
    }

    /**
     * Save the cron store, replacing the file through a temp file and rename.
     * Entries that failed to bind on load are appended as they were read.
     *
     * @throws CronStoreException if the file cannot be written
     */
    public static void save(Path path, CronStoreFile store) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            ObjectNode root = MAPPER.createObjectNode();
            root.put("version", store.getVersion());
            ArrayNode jobs = root.putArray("jobs");
            for (CronJob job : store.getJobs()) {
                jobs.add(MAPPER.valueToTree(job));
            }
            if (store.getUnparsedJobs() != null) {
                jobs.addAll(store.getUnparsedJobs());
            }
            String json = MAPPER.writeValueAsString(root);
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            Files.writeString(tmp, json);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Saved cron store to {} ({} jobs)", path, store.getJobs().size());
        } catch (IOException e) {
            throw new CronStoreException("Failed to save cron store to " + path, e);
        }
    }

    /**
     * Fill in fields that older store files may lack.
     */
    static CronJob migrate(CronJob job) {
        if (job.getState() == null) {
            job.setState(new CronJobState());
        }
        if (job.getSessionTarget() == null) {
            job.setSessionTarget(job.getPayload() != null
                    && job.getPayload().getKind() == CronTypes.PayloadKind.AGENT_TURN
                            ? CronTypes.SessionTarget.ISOLATED
                            : CronTypes.SessionTarget.MAIN);
        }
        if (job.getWakeMode() == null) {
            job.setWakeMode(CronTypes.WakeMode.NEXT_HEARTBEAT);
        }
        return job;
    }

    /**
     * Get the file modification time in millis, or null if the file is absent.
     */
    public static Long getFileMtimeMs(Path path) {
        try {
            if (!Files.exists(path))
                return null;
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            log.debug("Cannot stat cron store {}: {}", path, e.getMessage());
            return null;
        }
    }
}
