package com.clawkeep.gateway.cron;

import com.clawkeep.common.infra.TimerHandle;
import com.clawkeep.common.infra.TimerScheduler;
import com.clawkeep.gateway.cron.CronState.CronEvent;
import com.clawkeep.gateway.cron.CronState.CronEventAction;
import com.clawkeep.gateway.cron.CronState.CronNotRan;
import com.clawkeep.gateway.cron.CronState.CronRanOk;
import com.clawkeep.gateway.cron.CronState.CronRemoveResult;
import com.clawkeep.gateway.cron.CronState.CronRunFailed;
import com.clawkeep.gateway.cron.CronState.CronRunMode;
import com.clawkeep.gateway.cron.CronState.CronRunResult;
import com.clawkeep.gateway.cron.CronState.CronServiceDeps;
import com.clawkeep.gateway.cron.CronState.CronSkipReason;
import com.clawkeep.gateway.cron.CronState.CronStatusSummary;
import com.clawkeep.gateway.cron.CronState.CronWakeMode;
import com.clawkeep.gateway.cron.CronState.HeartbeatRunResult;
import com.clawkeep.gateway.cron.CronState.IsolatedAgentRunResult;
import com.clawkeep.gateway.cron.CronTypes.CronJobCreate;
import com.clawkeep.gateway.cron.CronTypes.CronJobPatch;
import com.clawkeep.gateway.cron.CronTypes.CronJobState;
import com.clawkeep.gateway.cron.CronTypes.CronRunStatus;
import com.clawkeep.gateway.cron.CronTypes.DeliveryMode;
import com.clawkeep.gateway.cron.CronTypes.ScheduleKind;
import com.clawkeep.gateway.cron.CronTypes.SessionTarget;
import com.clawkeep.gateway.cron.CronTypes.WakeMode;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Manages cron jobs: CRUD, persistence, timer arming and execution.
 * <p>
 * Store and timer state are guarded by a single lock so that ticks, manual
 * edits and forced runs never interleave their reads and writes. Job execution
 * happens outside the lock, between a "mark running" and a "finish" step.
 * <p>
 * Two periodic checks keep the scheduler alive: a watchdog re-creates a lost
 * wake timer, and the anti-zombie pass re-initializes the timer when no tick
 * has been seen for a while and resets jobs whose running marker went stale.
 */
@Slf4j
public class CronService {

    static final int MAX_RUN_LOGS = 200;

    private final CronServiceDeps deps;
    private final TimerScheduler timers;
    private final Path storePath;
    private final CronServiceState state = new CronServiceState();
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<CronRunLog> runLogs = new ArrayDeque<>();
    private boolean started;

    public CronService(CronServiceDeps deps) {
        this.deps = Objects.requireNonNull(deps, "deps");
        this.timers = Objects.requireNonNull(deps.getTimers(), "deps.timers");
        if (deps.getStorePath() == null || deps.getStorePath().isBlank()) {
            throw new IllegalArgumentException("cron storePath is required");
        }
        this.storePath = Path.of(deps.getStorePath());
    }

    // --- Lifecycle ---

    /**
     * Load the store, recover stale jobs, arm the wake timer and start the
     * watchdog and anti-zombie checks. Idempotent.
     */
    public void start() {
        lock.lock();
        try {
            if (started)
                return;
            long now = timers.nowMs();
            state.setStartedAtMs(now);
            if (!deps.isCronEnabled()) {
                log.info("cron: disabled (storePath={})", storePath);
                return;
            }
            started = true;
            try {
                ensureLoaded();
                boolean changed = fillMissingNextRuns(now);
                if (recoverStaleJobs(now) > 0)
                    changed = true;
                if (changed)
                    persistQuietly("start");
            } catch (CronStoreException e) {
                log.error("cron: failed to load store {}: {}", storePath, e.getMessage());
            }
            armTimer();
            state.setWatchdogTimer(timers.scheduleAtFixedRate(this::watchdogCheck, deps.getWatchdogIntervalMs()));
            state.setAntiZombieTimer(
                    timers.scheduleAtFixedRate(this::antiZombieCheck, deps.getAntiZombieIntervalMs()));
            log.info("cron: started (jobs={}, nextWakeAtMs={}, storePath={})",
                    jobCount(), nextWakeAtMs(), storePath);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancel every timer. Safe to call repeatedly.
     */
    public void stop() {
        lock.lock();
        try {
            cancel(state.getTimer());
            cancel(state.getWatchdogTimer());
            cancel(state.getAntiZombieTimer());
            state.setTimer(null);
            state.setTimerTargetMs(null);
            state.setWatchdogTimer(null);
            state.setAntiZombieTimer(null);
            if (started) {
                log.info("cron: stopped");
            }
            started = false;
        } finally {
            lock.unlock();
        }
    }

    // --- CRUD ---

    /**
     * Validate, persist and schedule a new job.
     *
     * @throws IllegalArgumentException on invalid input
     * @throws CronStoreException       if the store cannot be written; the job
     *                                  stays scheduled in memory
     */
    public CronJob add(CronJobCreate input) {
        lock.lock();
        try {
            ensureLoaded();
            CronJob job = CronNormalize.createJob(input, timers.nowMs());
            state.getStore().getJobs().add(job);
            armTimer();
            try {
                persist();
            } catch (CronStoreException e) {
                log.error("cron: job added but not persisted (jobId={}): {}", job.getId(), e.getMessage());
                throw e;
            }
            log.info("cron: job added (jobId={}, name={}, nextRunAtMs={})",
                    job.getId(), job.getName(), job.getState().getNextRunAtMs());
            emit(CronEvent.builder()
                    .jobId(job.getId())
                    .action(CronEventAction.ADDED)
                    .nextRunAtMs(job.getState().getNextRunAtMs())
                    .build());
            return job;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Apply a patch to an existing job.
     *
     * @throws IllegalArgumentException for an unknown id or invalid patch
     * @throws CronStoreException       if the store cannot be written
     */
    public CronJob update(String id, CronJobPatch patch) {
        lock.lock();
        try {
            ensureLoaded();
            CronJob job = findJob(id);
            if (job == null) {
                throw new IllegalArgumentException("unknown cron job id: " + id);
            }
            CronNormalize.applyPatch(job, patch, timers.nowMs());
            armTimer();
            try {
                persist();
            } catch (CronStoreException e) {
                log.error("cron: job updated but not persisted (jobId={}): {}", id, e.getMessage());
                throw e;
            }
            emit(CronEvent.builder()
                    .jobId(job.getId())
                    .action(CronEventAction.UPDATED)
                    .nextRunAtMs(job.getState().getNextRunAtMs())
                    .build());
            return job;
        } finally {
            lock.unlock();
        }
    }

    public CronRemoveResult remove(String id) {
        lock.lock();
        try {
            ensureLoaded();
            CronJob job = findJob(id);
            if (job == null) {
                return new CronRemoveResult(true, false);
            }
            state.getStore().getJobs().remove(job);
            boolean persisted = persistQuietly("remove");
            armTimer();
            log.info("cron: job removed (jobId={})", id);
            emit(CronEvent.builder().jobId(id).action(CronEventAction.REMOVED).build());
            return new CronRemoveResult(persisted, true);
        } catch (CronStoreException e) {
            log.error("cron: remove failed (jobId={}): {}", id, e.getMessage());
            return new CronRemoveResult(false, false);
        } finally {
            lock.unlock();
        }
    }

    public Optional<CronJob> getJob(String id) {
        lock.lock();
        try {
            ensureLoaded();
            return Optional.ofNullable(findJob(id));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Jobs ordered by next run time, unscheduled ones last.
     */
    public List<CronJob> list(boolean includeDisabled) {
        lock.lock();
        try {
            ensureLoaded();
            armTimer();
            return state.getStore().getJobs().stream()
                    .filter(j -> includeDisabled || j.isEnabled())
                    .sorted(Comparator.comparing((CronJob j) -> j.getState().getNextRunAtMs(),
                            Comparator.nullsLast(Comparator.naturalOrder())))
                    .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    public CronStatusSummary status() {
        lock.lock();
        try {
            try {
                ensureLoaded();
            } catch (CronStoreException e) {
                log.warn("cron: status could not load store: {}", e.getMessage());
            }
            armTimer();
            return CronStatusSummary.builder()
                    .enabled(deps.isCronEnabled())
                    .storePath(storePath.toString())
                    .jobs(jobCount())
                    .nextWakeAtMs(deps.isCronEnabled() ? nextWakeAtMs() : null)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Post a system event to the main session and optionally wake the
     * heartbeat right away.
     *
     * @return false when the text is blank
     */
    public boolean wake(CronWakeMode mode, String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        if (deps.getEnqueueSystemEvent() != null) {
            deps.getEnqueueSystemEvent().accept(text.trim(), deps.getAgentId());
        }
        if (mode == CronWakeMode.NOW) {
            requestHeartbeat("wake");
        }
        return true;
    }

    /**
     * Most recent finished runs, newest first.
     *
     * @param jobId filter, or null for all jobs
     */
    public List<CronRunLog> getRunLogs(String jobId, int limit) {
        lock.lock();
        try {
            List<CronRunLog> result = new ArrayList<>();
            Iterator<CronRunLog> it = runLogs.descendingIterator();
            while (it.hasNext() && result.size() < limit) {
                CronRunLog entry = it.next();
                if (jobId == null || jobId.equals(entry.getJobId())) {
                    result.add(entry);
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    // --- Execution ---

    /**
     * Run a job now. {@link CronRunMode#DUE} runs it only if it is enabled and
     * due; {@link CronRunMode#FORCE} skips that check. A job already marked
     * running is never re-entered. Never throws.
     */
    public CronRunResult run(String id, CronRunMode mode) {
        CronJob job;
        long startedAt;
        lock.lock();
        try {
            ensureLoaded();
            job = findJob(id);
            if (job == null) {
                return new CronRunFailed(new IllegalArgumentException("unknown cron job id: " + id));
            }
            if (job.isRunning()) {
                return new CronNotRan(CronSkipReason.ALREADY_RUNNING);
            }
            startedAt = timers.nowMs();
            if (mode != CronRunMode.FORCE && !isDue(job, startedAt)) {
                return new CronNotRan(CronSkipReason.NOT_DUE);
            }
            markRunning(job, startedAt);
        } catch (RuntimeException e) {
            log.error("cron: run failed before execution (jobId={}): {}", id, e.getMessage());
            return new CronRunFailed(e);
        } finally {
            lock.unlock();
        }

        ExecutionOutcome outcome = execute(job);

        lock.lock();
        try {
            finishRun(job, outcome, startedAt);
            armTimer();
        } catch (RuntimeException e) {
            log.error("cron: failed to record run (jobId={}): {}", id, e.getMessage(), e);
            return new CronRunFailed(e);
        } finally {
            lock.unlock();
        }
        return new CronRanOk(outcome.status());
    }

    private void markRunning(CronJob job, long now) {
        job.getState().setRunningAtMs(now);
        try {
            persist();
        } catch (CronStoreException e) {
            job.getState().setRunningAtMs(null);
            throw e;
        }
        log.debug("cron: job started (jobId={})", job.getId());
        emit(CronEvent.builder()
                .jobId(job.getId())
                .action(CronEventAction.STARTED)
                .runAtMs(now)
                .build());
        if (job.getWakeMode() == WakeMode.NOW) {
            requestHeartbeat("cron:" + job.getId());
        }
    }

    private void finishRun(CronJob ran, ExecutionOutcome outcome, long startedAt) {
        long endedAt = timers.nowMs();
        long durationMs = Math.max(0, endedAt - startedAt);
        appendRunLog(ran, outcome, startedAt, endedAt);

        CronJob job = findJob(ran.getId());
        if (job == null) {
            log.info("cron: job removed while running (jobId={})", ran.getId());
            emit(finishedEvent(ran.getId(), outcome, startedAt, durationMs, null));
            return;
        }

        CronJobState st = job.getState();
        st.setRunningAtMs(null);
        st.setLastRunAtMs(startedAt);
        st.setLastStatus(outcome.status());
        st.setLastError(outcome.error());
        st.setLastDurationMs(durationMs);

        boolean deleted = false;
        if (job.getSchedule().getKind() == ScheduleKind.AT) {
            if (job.isDeleteAfterRunEnabled() && outcome.status() == CronRunStatus.OK) {
                state.getStore().getJobs().remove(job);
                deleted = true;
            } else {
                job.setEnabled(false);
                st.setNextRunAtMs(null);
            }
        } else if (job.isEnabled()) {
            st.setNextRunAtMs(CronSchedules.computeNextRunAtMs(job.getSchedule(), endedAt, startedAt));
        } else {
            st.setNextRunAtMs(null);
        }

        persistQuietly("finish");
        log.info("cron: job finished (jobId={}, status={}, durationMs={}, nextRunAtMs={})",
                job.getId(), outcome.status().key(), durationMs, st.getNextRunAtMs());
        emit(finishedEvent(job.getId(), outcome, startedAt, durationMs, st.getNextRunAtMs()));
        if (deleted) {
            emit(CronEvent.builder().jobId(job.getId()).action(CronEventAction.REMOVED).build());
        }
    }

    private ExecutionOutcome execute(CronJob job) {
        try {
            if (job.getSessionTarget() == SessionTarget.ISOLATED) {
                return executeIsolated(job);
            }
            return executeMain(job);
        } catch (Exception e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.warn("cron: job execution failed (jobId={}): {}", job.getId(), cause.toString());
            return ExecutionOutcome.error(cause.getMessage() != null ? cause.getMessage() : cause.toString());
        }
    }

    private ExecutionOutcome executeMain(CronJob job) {
        String text = job.getPayload().getText();
        if (text == null || text.isBlank()) {
            return ExecutionOutcome.skipped("main job requires non-empty systemEvent text");
        }
        if (deps.getEnqueueSystemEvent() == null) {
            return ExecutionOutcome.error("system event queue not configured");
        }
        deps.getEnqueueSystemEvent().accept(text.trim(), job.getAgentId());

        if (job.getWakeMode() == WakeMode.NOW && deps.getRunHeartbeatOnce() != null) {
            HeartbeatRunResult heartbeat = deps.getRunHeartbeatOnce().apply("cron:" + job.getId());
            if (heartbeat != null && heartbeat.isFailed()) {
                return ExecutionOutcome.error(heartbeat.reason());
            }
            if (heartbeat != null && !heartbeat.isRan()) {
                // Busy heartbeat; fall back to a deferred wake.
                requestHeartbeat("cron:" + job.getId());
            }
        }
        return ExecutionOutcome.ok();
    }

    private ExecutionOutcome executeIsolated(CronJob job) {
        if (deps.getRunIsolatedAgentJob() == null) {
            return ExecutionOutcome.error("isolated agent runner not configured");
        }
        String message = job.getPayload().getMessage();
        if (message == null || message.isBlank()) {
            return ExecutionOutcome.skipped("isolated job requires non-empty agentTurn message");
        }

        CompletableFuture<IsolatedAgentRunResult> future = deps.getRunIsolatedAgentJob().run(job, message.trim());
        Integer timeoutSeconds = job.getPayload().getTimeoutSeconds();
        if (timeoutSeconds != null && timeoutSeconds > 0) {
            future = future.orTimeout(timeoutSeconds, TimeUnit.SECONDS);
        }
        IsolatedAgentRunResult result = future.join();
        if (result == null) {
            return ExecutionOutcome.error("isolated agent run returned no result");
        }
        CronRunStatus status = result.getStatus() != null
                ? result.getStatus()
                : (result.getError() != null ? CronRunStatus.ERROR : CronRunStatus.OK);

        String summary = result.getSummary();
        DeliveryMode delivery = job.getDelivery() != null ? job.getDelivery().getMode() : DeliveryMode.ANNOUNCE;
        if (summary != null && !summary.isBlank() && delivery != DeliveryMode.NONE
                && deps.getEnqueueSystemEvent() != null) {
            String prefix = status == CronRunStatus.ERROR ? "Cron (error)" : "Cron";
            deps.getEnqueueSystemEvent().accept(prefix + ": " + summary.trim(), job.getAgentId());
            if (job.getWakeMode() == WakeMode.NOW) {
                requestHeartbeat("cron:" + job.getId() + ":summary");
            }
        }
        return new ExecutionOutcome(status, result.getError(), summary, result.getOutputText(),
                result.getSessionId(), result.getSessionKey());
    }

    // --- Timer ---

    /**
     * Arm the wake timer for the earliest next run. A no-op while the live
     * timer already targets that instant.
     */
    private void armTimer() {
        if (!started)
            return;
        if (!deps.isCronEnabled()) {
            if (!state.isWarnedDisabled()) {
                log.info("cron: scheduler disabled; jobs will not run automatically");
                state.setWarnedDisabled(true);
            }
            return;
        }
        Long next = nextWakeAtMs();
        TimerHandle current = state.getTimer();
        if (next == null) {
            cancel(current);
            state.setTimer(null);
            state.setTimerTargetMs(null);
            return;
        }
        if (current != null && current.isActive() && next.equals(state.getTimerTargetMs())) {
            return;
        }
        cancel(current);
        long delay = Math.max(0, Math.min(next - timers.nowMs(), deps.getMaxTimerDelayMs()));
        state.setTimer(timers.schedule(this::dispatchTick, delay));
        state.setTimerTargetMs(next);
        state.setTimerArmCount(state.getTimerArmCount() + 1);
        log.debug("cron: timer armed (nextAt={}, delayMs={})", next, delay);
    }

    private void dispatchTick() {
        Executor executor = deps.getTickExecutor();
        if (executor == null) {
            onTimerSafely();
            return;
        }
        try {
            executor.execute(this::onTimerSafely);
        } catch (RejectedExecutionException e) {
            log.warn("cron: tick executor rejected tick: {}", e.getMessage());
        }
    }

    private void onTimerSafely() {
        try {
            onTimer();
        } catch (Exception e) {
            log.error("cron: timer tick failed: {}", e.getMessage(), e);
        }
    }

    void onTimer() {
        List<String> dueIds;
        lock.lock();
        try {
            long now = timers.nowMs();
            state.setLastTimerTickAtMs(now);
            state.setTimer(null);
            state.setTimerTargetMs(null);
            if (state.isRunning()) {
                log.debug("cron: tick skipped, previous tick still running (since {})",
                        state.getRunningStartedAtMs());
                return;
            }
            ensureLoaded();
            dueIds = state.getStore().getJobs().stream()
                    .filter(j -> !j.isRunning() && isDue(j, now))
                    .map(CronJob::getId)
                    .collect(Collectors.toList());
            state.setRunning(true);
            state.setRunningStartedAtMs(now);
        } finally {
            lock.unlock();
        }

        try {
            for (String id : dueIds) {
                CronRunResult result = run(id, CronRunMode.DUE);
                if (result instanceof CronRunFailed failed) {
                    log.error("cron: due job failed to run (jobId={}): {}", id, failed.error().getMessage());
                }
            }
        } finally {
            lock.lock();
            try {
                state.setRunning(false);
                state.setRunningStartedAtMs(null);
                armTimer();
            } finally {
                lock.unlock();
            }
        }
    }

    void watchdogCheck() {
        lock.lock();
        try {
            if (!started || state.isRunning())
                return;
            TimerHandle current = state.getTimer();
            if (current != null && current.isActive())
                return;
            Long next = nextWakeAtMs();
            if (next == null)
                return;
            log.warn("cron: watchdog: timer lost, re-arming (nextWakeAtMs={})", next);
            state.setTimer(null);
            state.setTimerTargetMs(null);
            state.setWatchdogRearmCount(state.getWatchdogRearmCount() + 1);
            armTimer();
        } catch (Exception e) {
            log.error("cron: watchdog check failed: {}", e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    void antiZombieCheck() {
        lock.lock();
        try {
            if (!started)
                return;
            long now = timers.nowMs();
            try {
                ensureLoaded();
            } catch (CronStoreException e) {
                log.warn("cron: anti-zombie: store unavailable: {}", e.getMessage());
            }

            boolean reinit = false;
            long threshold = deps.getAntiZombieThresholdMs();
            Long lastTick = state.getLastTimerTickAtMs();
            long since = lastTick != null ? lastTick : state.getStartedAtMs();
            Long tickStartedAt = state.getRunningStartedAtMs();
            boolean tickInFlight = state.isRunning() && tickStartedAt != null
                    && now - tickStartedAt <= deps.getStaleRunningMs();
            if (tickInFlight) {
                log.debug("cron: anti-zombie: tick in flight since {}, not re-initializing", tickStartedAt);
            } else if (now - since > threshold && expectsTicks()) {
                log.warn("cron: anti-zombie: no tick in {}s, re-initializing scheduler "
                        + "(lastTimerTickAtMs={}, thresholdMs={})", threshold / 1000, lastTick, threshold);
                cancel(state.getTimer());
                state.setTimer(null);
                state.setTimerTargetMs(null);
                state.setRunning(false);
                state.setRunningStartedAtMs(null);
                state.setAntiZombieReinitCount(state.getAntiZombieReinitCount() + 1);
                reinit = true;
            }

            int recovered = recoverStaleJobs(now);
            if (recovered > 0) {
                persistQuietly("anti-zombie");
            }
            if (reinit || recovered > 0) {
                armTimer();
            }
        } catch (Exception e) {
            log.error("cron: anti-zombie check failed: {}", e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clear running markers older than the stale threshold and make those jobs
     * due again.
     *
     * @return number of jobs recovered
     */
    private int recoverStaleJobs(long now) {
        if (state.getStore() == null)
            return 0;
        int recovered = 0;
        for (CronJob job : state.getStore().getJobs()) {
            Long runningAt = job.getState().getRunningAtMs();
            if (runningAt == null || now - runningAt <= deps.getStaleRunningMs())
                continue;
            log.warn("cron: anti-zombie: recovering stale-running job (jobId={}, runningAtMs={}, ageMs={})",
                    job.getId(), runningAt, now - runningAt);
            job.getState().setRunningAtMs(null);
            if (job.isEnabled()) {
                job.getState().setNextRunAtMs(now);
            }
            recovered++;
        }
        return recovered;
    }

    private boolean fillMissingNextRuns(long now) {
        boolean changed = false;
        for (CronJob job : state.getStore().getJobs()) {
            CronJobState st = job.getState();
            if (!job.isEnabled() || st.getNextRunAtMs() != null || st.getRunningAtMs() != null)
                continue;
            Long next = CronSchedules.computeNextRunAtMs(job.getSchedule(), now, st.getLastRunAtMs());
            if (next != null) {
                st.setNextRunAtMs(next);
                changed = true;
            }
        }
        return changed;
    }

    // --- Store ---

    /**
     * Load the store on first use and reload it when the file changed on disk.
     * A failed reload keeps the in-memory jobs.
     */
    private void ensureLoaded() {
        Long mtime = CronStore.getFileMtimeMs(storePath);
        if (state.getStore() != null) {
            if (mtime == null || mtime.equals(state.getStoreFileMtimeMs()))
                return;
            try {
                state.setStore(CronStore.load(storePath));
                log.debug("cron: store changed on disk, reloaded ({} jobs)", jobCount());
            } catch (CronStoreException e) {
                log.warn("cron: failed to reload changed store, keeping in-memory jobs: {}", e.getMessage());
            }
            state.setStoreFileMtimeMs(mtime);
            return;
        }
        state.setStore(CronStore.load(storePath));
        state.setStoreFileMtimeMs(mtime);
    }

    private void persist() {
        CronStore.save(storePath, state.getStore());
        state.setStoreFileMtimeMs(CronStore.getFileMtimeMs(storePath));
    }

    private boolean persistQuietly(String context) {
        try {
            persist();
            return true;
        } catch (CronStoreException e) {
            log.error("cron: failed to persist store after {}: {}", context, e.getMessage());
            return false;
        }
    }

    // --- Helpers ---

    private CronJob findJob(String id) {
        if (id == null || state.getStore() == null)
            return null;
        for (CronJob job : state.getStore().getJobs()) {
            if (id.equals(job.getId()))
                return job;
        }
        return null;
    }

    private static boolean isDue(CronJob job, long now) {
        Long next = job.getState().getNextRunAtMs();
        return job.isEnabled() && next != null && next <= now;
    }

    /** Earliest next run among enabled jobs that are not in flight. */
    Long nextWakeAtMs() {
        if (state.getStore() == null)
            return null;
        return state.getStore().getJobs().stream()
                .filter(j -> j.isEnabled() && !j.isRunning())
                .map(j -> j.getState().getNextRunAtMs())
                .filter(Objects::nonNull)
                .min(Long::compare)
                .orElse(null);
    }

    private boolean expectsTicks() {
        if (state.getStore() == null)
            return false;
        return state.getStore().getJobs().stream()
                .anyMatch(j -> j.isEnabled() && j.getState().getNextRunAtMs() != null);
    }

    private int jobCount() {
        return state.getStore() == null ? 0 : state.getStore().getJobs().size();
    }

    private void appendRunLog(CronJob job, ExecutionOutcome outcome, long startedAt, long endedAt) {
        runLogs.addLast(CronRunLog.builder()
                .jobId(job.getId())
                .jobName(job.getName())
                .agentId(job.getAgentId())
                .startedAtMs(startedAt)
                .finishedAtMs(endedAt)
                .durationMs(Math.max(0, endedAt - startedAt))
                .status(outcome.status())
                .summary(outcome.summary())
                .error(outcome.error())
                .build());
        while (runLogs.size() > MAX_RUN_LOGS) {
            runLogs.removeFirst();
        }
    }

    private static CronEvent finishedEvent(String jobId, ExecutionOutcome outcome, long runAtMs, long durationMs,
            Long nextRunAtMs) {
        return CronEvent.builder()
                .jobId(jobId)
                .action(CronEventAction.FINISHED)
                .runAtMs(runAtMs)
                .durationMs(durationMs)
                .status(outcome.status())
                .error(outcome.error())
                .summary(outcome.summary())
                .sessionId(outcome.sessionId())
                .sessionKey(outcome.sessionKey())
                .nextRunAtMs(nextRunAtMs)
                .build();
    }

    private void emit(CronEvent event) {
        if (deps.getOnEvent() == null)
            return;
        try {
            deps.getOnEvent().accept(event);
        } catch (Exception e) {
            log.warn("cron: event listener failed (jobId={}, action={}): {}",
                    event.getJobId(), event.getAction(), e.getMessage());
        }
    }

    private void requestHeartbeat(String reason) {
        if (deps.getRequestHeartbeatNow() == null)
            return;
        try {
            deps.getRequestHeartbeatNow().accept(reason);
        } catch (Exception e) {
            log.warn("cron: heartbeat request failed ({}): {}", reason, e.getMessage());
        }
    }

    private static void cancel(TimerHandle handle) {
        if (handle != null)
            handle.cancel();
    }

    /** Exposed to tests in this package. */
    CronServiceState state() {
        return state;
    }

    private record ExecutionOutcome(CronRunStatus status, String error, String summary, String outputText,
            String sessionId, String sessionKey) {

        static ExecutionOutcome ok() {
            return new ExecutionOutcome(CronRunStatus.OK, null, null, null, null, null);
        }

        static ExecutionOutcome skipped(String reason) {
            return new ExecutionOutcome(CronRunStatus.SKIPPED, reason, null, null, null, null);
        }

        static ExecutionOutcome error(String error) {
            return new ExecutionOutcome(CronRunStatus.ERROR, error, null, null, null, null);
        }
    }
}
