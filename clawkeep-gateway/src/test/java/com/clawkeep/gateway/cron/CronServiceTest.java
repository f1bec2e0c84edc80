package com.clawkeep.gateway.cron;

import com.clawkeep.common.infra.ManualTimerScheduler;
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
import com.clawkeep.gateway.cron.CronState.IsolatedAgentJobRunner;
import com.clawkeep.gateway.cron.CronState.IsolatedAgentRunResult;
import com.clawkeep.gateway.cron.CronTypes.CronDelivery;
import com.clawkeep.gateway.cron.CronTypes.CronJobCreate;
import com.clawkeep.gateway.cron.CronTypes.CronJobPatch;
import com.clawkeep.gateway.cron.CronTypes.CronPayload;
import com.clawkeep.gateway.cron.CronTypes.CronRunStatus;
import com.clawkeep.gateway.cron.CronTypes.CronSchedule;
import com.clawkeep.gateway.cron.CronTypes.CronStoreFile;
import com.clawkeep.gateway.cron.CronTypes.WakeMode;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CronServiceTest {

    private static final long T0 = 1_700_000_000_000L;
    private static final long MINUTE = 60_000L;
    private static final long HOUR = 60 * MINUTE;

    @TempDir
    Path tempDir;

    private ManualTimerScheduler timers;
    private Path storePath;
    private final List<CronEvent> events = new CopyOnWriteArrayList<>();
    private final List<String> systemEvents = new CopyOnWriteArrayList<>();
    private final List<String> heartbeatRequests = new CopyOnWriteArrayList<>();
    private CronService service;

    @BeforeEach
    void setUp() {
        timers = new ManualTimerScheduler(T0);
        storePath = tempDir.resolve("cron/jobs.json");
    }

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.stop();
        }
    }

    private CronService newService(UnaryOperator<CronServiceDeps.CronServiceDepsBuilder> customize) {
        CronServiceDeps.CronServiceDepsBuilder builder = CronServiceDeps.builder()
                .storePath(storePath.toString())
                .cronEnabled(true)
                .timers(timers)
                .agentId("main")
                .enqueueSystemEvent((text, agentId) -> systemEvents.add(text))
                .requestHeartbeatNow(heartbeatRequests::add)
                .onEvent(events::add);
        service = new CronService(customize.apply(builder).build());
        return service;
    }

    private CronService newService() {
        return newService(b -> b);
    }

    private static CronJobCreate everyJob(String name, long everyMs) {
        return CronJobCreate.builder()
                .name(name)
                .schedule(CronSchedule.every(everyMs))
                .payload(CronPayload.systemEvent(name + " tick"))
                .build();
    }

    private static CronJobCreate isolatedJob(String name, long everyMs) {
        return CronJobCreate.builder()
                .name(name)
                .schedule(CronSchedule.every(everyMs))
                .payload(CronPayload.agentTurn("run " + name))
                .build();
    }

    private List<CronEventAction> actionsFor(String jobId) {
        return events.stream()
                .filter(e -> jobId.equals(e.getJobId()))
                .map(CronEvent::getAction)
                .collect(Collectors.toList());
    }

    private CronEvent lastFinished(String jobId) {
        CronEvent found = null;
        for (CronEvent e : events) {
            if (jobId.equals(e.getJobId()) && e.getAction() == CronEventAction.FINISHED) {
                found = e;
            }
        }
        assertNotNull(found, "no finished event for " + jobId);
        return found;
    }

    // =========================================================================
    // CRUD
    // =========================================================================

    @Nested
    class Crud {

        @Test
        void add_persistsJobAndSchedulesNextRun() {
            CronService cron = newService();
            CronJob job = cron.add(everyJob("ping", MINUTE));

            assertEquals(T0 + MINUTE, job.getState().getNextRunAtMs());
            CronStoreFile onDisk = CronStore.load(storePath);
            assertEquals(1, onDisk.getJobs().size());
            assertEquals(job.getId(), onDisk.getJobs().get(0).getId());
            assertEquals(List.of(CronEventAction.ADDED), actionsFor(job.getId()));
        }

        @Test
        void add_rejectsInvalidInput() {
            CronService cron = newService();
            assertThrows(IllegalArgumentException.class, () -> cron.add(everyJob("bad", 0)));
            assertThrows(IllegalArgumentException.class, () -> cron.add(CronJobCreate.builder()
                    .schedule(CronSchedule.every(MINUTE))
                    .sessionTarget(CronTypes.SessionTarget.MAIN)
                    .payload(CronPayload.agentTurn("nope"))
                    .build()));
            assertTrue(cron.list(true).isEmpty());
        }

        @Test
        void add_surfacesStoreFailure() throws Exception {
            Files.createDirectories(storePath);
            CronService cron = newService();

            assertThrows(CronStoreException.class, () -> cron.add(everyJob("ping", MINUTE)));
            assertEquals(new CronRemoveResult(false, false), cron.remove("anything"));
            assertInstanceOf(CronRunFailed.class, cron.run("anything", CronRunMode.FORCE));
        }

        @Test
        void update_disableAndReenable() {
            CronService cron = newService();
            cron.start();
            CronJob job = cron.add(everyJob("ping", MINUTE));

            cron.update(job.getId(), CronJobPatch.builder().enabled(false).build());
            assertNull(cron.getJob(job.getId()).orElseThrow().getState().getNextRunAtMs());
            assertNull(cron.status().getNextWakeAtMs());

            timers.advance(5_000);
            cron.update(job.getId(), CronJobPatch.builder().enabled(true).build());
            assertEquals(T0 + 5_000 + MINUTE, cron.status().getNextWakeAtMs());
            assertTrue(actionsFor(job.getId()).contains(CronEventAction.UPDATED));
        }

        @Test
        void update_unknownId_throws() {
            CronService cron = newService();
            assertThrows(IllegalArgumentException.class,
                    () -> cron.update("missing", CronJobPatch.builder().name("x").build()));
        }

        @Test
        void remove_reportsWhetherAJobWasRemoved() {
            CronService cron = newService();
            CronJob job = cron.add(everyJob("ping", MINUTE));

            assertEquals(new CronRemoveResult(true, true), cron.remove(job.getId()));
            assertEquals(new CronRemoveResult(true, false), cron.remove(job.getId()));
            assertTrue(CronStore.load(storePath).getJobs().isEmpty());
            assertEquals(List.of(CronEventAction.ADDED, CronEventAction.REMOVED), actionsFor(job.getId()));
        }

        @Test
        void list_sortsByNextRunAndFiltersDisabled() {
            CronService cron = newService();
            CronJob slow = cron.add(everyJob("slow", 10 * MINUTE));
            CronJob fast = cron.add(everyJob("fast", MINUTE));
            CronJob off = cron.add(everyJob("off", 2 * MINUTE));
            cron.update(off.getId(), CronJobPatch.builder().enabled(false).build());

            List<String> enabled = cron.list(false).stream().map(CronJob::getId).collect(Collectors.toList());
            assertEquals(List.of(fast.getId(), slow.getId()), enabled);
            List<String> all = cron.list(true).stream().map(CronJob::getId).collect(Collectors.toList());
            assertEquals(List.of(fast.getId(), slow.getId(), off.getId()), all);
        }

        @Test
        void status_reportsStoreAndNextWake() {
            CronService cron = newService();
            cron.add(everyJob("ping", MINUTE));

            CronStatusSummary status = cron.status();
            assertTrue(status.isEnabled());
            assertEquals(storePath.toString(), status.getStorePath());
            assertEquals(1, status.getJobs());
            assertEquals(T0 + MINUTE, status.getNextWakeAtMs());
        }

        @Test
        void store_reloadsWhenModifiedExternally() throws Exception {
            CronService cron = newService();
            cron.add(everyJob("ping", MINUTE));

            CronJob external = CronNormalize.createJob(everyJob("external", MINUTE), T0);
            CronStoreFile file = CronStore.load(storePath);
            file.getJobs().add(external);
            CronStore.save(storePath, file);
            Files.setLastModifiedTime(storePath,
                    FileTime.fromMillis(Files.getLastModifiedTime(storePath).toMillis() + 5_000));

            assertTrue(cron.getJob(external.getId()).isPresent());
            assertEquals(2, cron.list(true).size());
        }

        @Test
        void unreadableEntriesSurviveRewrites() throws Exception {
            Files.createDirectories(storePath.getParent());
            Files.writeString(storePath, """
                    {"version": 1, "jobs": [
                      {"id": "legacy", "schedule": {"kind": "cron", "expr": "0 7 * * *"},
                       "payload": {"kind": "systemEvent", "text": "morning"}}
                    ]}
                    """);

            CronService cron = newService();
            cron.start();
            CronJob added = cron.add(everyJob("ping", MINUTE));
            cron.update(added.getId(), CronJobPatch.builder().enabled(false).build());

            JsonNode jobs = CronStore.MAPPER.readTree(Files.readString(storePath)).path("jobs");
            List<String> ids = new ArrayList<>();
            jobs.forEach(j -> ids.add(j.path("id").asText()));
            assertEquals(List.of(added.getId(), "legacy"), ids);
            assertEquals("0 7 * * *", jobs.get(1).at("/schedule/expr").asText());
            assertEquals(1, cron.list(true).size());
        }

        @Test
        void jobsSurviveRestart() {
            CronService first = newService();
            CronJob job = first.add(everyJob("ping", MINUTE));
            first.stop();

            CronService second = newService();
            second.start();
            assertEquals(T0 + MINUTE, second.getJob(job.getId()).orElseThrow().getState().getNextRunAtMs());
        }
    }

    // =========================================================================
    // Manual runs
    // =========================================================================

    @Nested
    class ManualRuns {

        @Test
        void runDue_notDueYet() {
            CronService cron = newService();
            CronJob job = cron.add(everyJob("ping", MINUTE));

            CronRunResult result = cron.run(job.getId(), CronRunMode.DUE);

            assertEquals(new CronNotRan(CronSkipReason.NOT_DUE), result);
            assertTrue(result.ok());
            assertTrue(systemEvents.isEmpty());
        }

        @Test
        void runForce_executesAndAdvancesFromRunInstant() {
            CronService cron = newService();
            CronJob job = cron.add(everyJob("ping", MINUTE));
            timers.advance(5_000);

            CronRunResult result = cron.run(job.getId(), CronRunMode.FORCE);

            assertEquals(new CronRanOk(CronRunStatus.OK), result);
            assertTrue(result.ran());
            assertEquals(List.of("ping tick"), systemEvents);
            assertEquals(List.of(CronEventAction.ADDED, CronEventAction.STARTED, CronEventAction.FINISHED),
                    actionsFor(job.getId()));
            CronEvent finished = lastFinished(job.getId());
            assertEquals(CronRunStatus.OK, finished.getStatus());
            assertEquals(T0 + 5_000 + MINUTE, finished.getNextRunAtMs());

            CronJob stored = CronStore.load(storePath).getJobs().get(0);
            assertNull(stored.getState().getRunningAtMs());
            assertEquals(T0 + 5_000, stored.getState().getLastRunAtMs());
            assertEquals(CronRunStatus.OK, stored.getState().getLastStatus());
        }

        @Test
        void run_unknownId_failsWithoutThrowing() {
            CronService cron = newService();
            CronRunResult result = cron.run("missing", CronRunMode.FORCE);
            assertInstanceOf(CronRunFailed.class, result);
            assertFalse(result.ok());
        }

        @Test
        void run_neverReentersARunningJob() throws Exception {
            CountDownLatch runnerEntered = new CountDownLatch(1);
            CompletableFuture<IsolatedAgentRunResult> pending = new CompletableFuture<>();
            IsolatedAgentJobRunner runner = (job, message) -> {
                runnerEntered.countDown();
                return pending;
            };
            CronService cron = newService(b -> b.runIsolatedAgentJob(runner));
            CronJob job = cron.add(isolatedJob("digest", MINUTE));

            ExecutorService pool = Executors.newSingleThreadExecutor();
            try {
                Future<CronRunResult> first = pool.submit(() -> cron.run(job.getId(), CronRunMode.FORCE));
                assertTrue(runnerEntered.await(5, TimeUnit.SECONDS));

                assertEquals(new CronNotRan(CronSkipReason.ALREADY_RUNNING),
                        cron.run(job.getId(), CronRunMode.FORCE));
                assertNotNull(cron.getJob(job.getId()).orElseThrow().getState().getRunningAtMs());

                pending.complete(IsolatedAgentRunResult.ok("done"));
                assertEquals(new CronRanOk(CronRunStatus.OK), first.get(5, TimeUnit.SECONDS));
                assertNull(cron.getJob(job.getId()).orElseThrow().getState().getRunningAtMs());
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        void isolatedRun_postsSummaryToMainSession() {
            IsolatedAgentJobRunner runner = (job, message) -> CompletableFuture.completedFuture(
                    IsolatedAgentRunResult.builder()
                            .status(CronRunStatus.OK)
                            .summary("3 new emails")
                            .outputText("full text")
                            .sessionId("s-1")
                            .sessionKey("cron:digest")
                            .build());
            CronService cron = newService(b -> b.runIsolatedAgentJob(runner));
            CronJob job = cron.add(isolatedJob("digest", MINUTE));

            cron.run(job.getId(), CronRunMode.FORCE);

            assertEquals(List.of("Cron: 3 new emails"), systemEvents);
            CronEvent finished = lastFinished(job.getId());
            assertEquals("3 new emails", finished.getSummary());
            assertEquals("s-1", finished.getSessionId());
            assertEquals("cron:digest", finished.getSessionKey());
        }

        @Test
        void isolatedRun_withDeliveryNone_keepsSummaryOutOfMain() {
            IsolatedAgentJobRunner runner =
                    (job, message) -> CompletableFuture.completedFuture(IsolatedAgentRunResult.ok("quiet"));
            CronService cron = newService(b -> b.runIsolatedAgentJob(runner));
            CronJobCreate create = isolatedJob("digest", MINUTE);
            create.setDelivery(CronDelivery.none());
            CronJob job = cron.add(create);

            cron.run(job.getId(), CronRunMode.FORCE);

            assertTrue(systemEvents.isEmpty());
            assertEquals("quiet", lastFinished(job.getId()).getSummary());
        }

        @Test
        void runnerFailure_recordsErrorAndStillAdvances() {
            IsolatedAgentJobRunner runner =
                    (job, message) -> CompletableFuture.failedFuture(new IllegalStateException("model offline"));
            CronService cron = newService(b -> b.runIsolatedAgentJob(runner));
            CronJob job = cron.add(isolatedJob("digest", MINUTE));

            CronRunResult result = cron.run(job.getId(), CronRunMode.FORCE);

            assertEquals(new CronRanOk(CronRunStatus.ERROR), result);
            CronEvent finished = lastFinished(job.getId());
            assertEquals(CronRunStatus.ERROR, finished.getStatus());
            assertEquals("model offline", finished.getError());
            assertEquals(T0 + MINUTE, finished.getNextRunAtMs());
            CronJob stored = cron.getJob(job.getId()).orElseThrow();
            assertEquals("model offline", stored.getState().getLastError());
            assertNull(stored.getState().getRunningAtMs());
        }

        @Test
        void missingRunner_reportsError() {
            CronService cron = newService();
            CronJob job = cron.add(isolatedJob("digest", MINUTE));

            cron.run(job.getId(), CronRunMode.FORCE);

            assertEquals(CronRunStatus.ERROR, lastFinished(job.getId()).getStatus());
        }

        @Test
        void wakeModeNow_requestsHeartbeatAndRunsOnce() {
            List<String> heartbeatRuns = new CopyOnWriteArrayList<>();
            CronService cron = newService(b -> b.runHeartbeatOnce(reason -> {
                heartbeatRuns.add(reason);
                return HeartbeatRunResult.ran();
            }));
            CronJobCreate create = everyJob("ping", MINUTE);
            create.setWakeMode(WakeMode.NOW);
            CronJob job = cron.add(create);

            cron.run(job.getId(), CronRunMode.FORCE);

            assertEquals(List.of("cron:" + job.getId()), heartbeatRequests);
            assertEquals(List.of("cron:" + job.getId()), heartbeatRuns);
            assertEquals(List.of("ping tick"), systemEvents);
        }

        @Test
        void failedHeartbeat_marksRunAsError() {
            CronService cron = newService(
                    b -> b.runHeartbeatOnce(reason -> new HeartbeatRunResult("failed", "agent busy")));
            CronJobCreate create = everyJob("ping", MINUTE);
            create.setWakeMode(WakeMode.NOW);
            CronJob job = cron.add(create);

            cron.run(job.getId(), CronRunMode.FORCE);

            CronEvent finished = lastFinished(job.getId());
            assertEquals(CronRunStatus.ERROR, finished.getStatus());
            assertEquals("agent busy", finished.getError());
        }

        @Test
        void runLogs_newestFirstAndFiltered() {
            CronService cron = newService();
            CronJob a = cron.add(everyJob("a", MINUTE));
            CronJob b = cron.add(everyJob("b", MINUTE));

            cron.run(a.getId(), CronRunMode.FORCE);
            timers.advance(1_000);
            cron.run(b.getId(), CronRunMode.FORCE);
            timers.advance(1_000);
            cron.run(a.getId(), CronRunMode.FORCE);

            List<CronRunLog> all = cron.getRunLogs(null, 10);
            assertEquals(3, all.size());
            assertEquals(T0 + 2_000, all.get(0).getStartedAtMs());

            List<CronRunLog> onlyA = cron.getRunLogs(a.getId(), 1);
            assertEquals(1, onlyA.size());
            assertEquals(a.getId(), onlyA.get(0).getJobId());
            assertEquals(T0 + 2_000, onlyA.get(0).getStartedAtMs());
        }

        @Test
        void wake_enqueuesTextAndOptionallyRequestsHeartbeat() {
            CronService cron = newService();

            assertFalse(cron.wake(CronWakeMode.NOW, "  "));
            assertTrue(cron.wake(CronWakeMode.NEXT_HEARTBEAT, "check mail"));
            assertTrue(heartbeatRequests.isEmpty());
            assertTrue(cron.wake(CronWakeMode.NOW, "now please"));

            assertEquals(List.of("check mail", "now please"), systemEvents);
            assertEquals(List.of("wake"), heartbeatRequests);
        }
    }

    // =========================================================================
    // Timer-driven execution
    // =========================================================================

    @Nested
    class TimerDriven {

        @Test
        void dueJobFiresFromTimer() {
            CronService cron = newService();
            cron.start();
            CronJob job = cron.add(everyJob("ping", MINUTE));

            timers.advance(MINUTE - 1);
            assertTrue(systemEvents.isEmpty());

            timers.advance(1);
            assertEquals(List.of("ping tick"), systemEvents);
            assertEquals(T0 + 2 * MINUTE, cron.getJob(job.getId()).orElseThrow().getState().getNextRunAtMs());
            assertEquals(T0 + MINUTE, cron.state().getLastTimerTickAtMs());
        }

        @Test
        void failingJobDoesNotStopOthersInSameTick() {
            IsolatedAgentJobRunner runner =
                    (job, message) -> CompletableFuture.failedFuture(new IllegalStateException("boom"));
            CronService cron = newService(b -> b.runIsolatedAgentJob(runner));
            cron.start();
            CronJob failing = cron.add(isolatedJob("failing", MINUTE));
            CronJob healthy = cron.add(everyJob("healthy", MINUTE));

            timers.advance(MINUTE);

            assertEquals(CronRunStatus.ERROR, lastFinished(failing.getId()).getStatus());
            assertEquals(CronRunStatus.OK, lastFinished(healthy.getId()).getStatus());
            assertEquals(List.of("healthy tick"), systemEvents);
        }

        @Test
        void atJob_isDeletedAfterSuccessfulRun() {
            CronService cron = newService();
            cron.start();
            CronJob job = cron.add(CronJobCreate.builder()
                    .name("reminder")
                    .schedule(CronSchedule.at(Instant.ofEpochMilli(T0 + 10_000).toString()))
                    .payload(CronPayload.systemEvent("stand up"))
                    .build());

            timers.advance(10_000);

            assertEquals(List.of("stand up"), systemEvents);
            assertTrue(cron.getJob(job.getId()).isEmpty());
            assertEquals(CronEventAction.REMOVED, actionsFor(job.getId()).get(actionsFor(job.getId()).size() - 1));
            assertNull(cron.status().getNextWakeAtMs());
        }

        @Test
        void atJob_withoutDeleteAfterRun_isDisabled() {
            CronService cron = newService();
            cron.start();
            CronJob job = cron.add(CronJobCreate.builder()
                    .name("reminder")
                    .deleteAfterRun(false)
                    .schedule(CronSchedule.at(Instant.ofEpochMilli(T0 + 10_000).toString()))
                    .payload(CronPayload.systemEvent("stand up"))
                    .build());

            timers.advance(20_000);

            CronJob stored = cron.getJob(job.getId()).orElseThrow();
            assertFalse(stored.isEnabled());
            assertNull(stored.getState().getNextRunAtMs());
            assertEquals(1, systemEvents.size());
        }

        @Test
        void wakeModeNow_requestsHeartbeatWhenDue() {
            CronService cron = newService();
            cron.start();
            CronJobCreate create = everyJob("ping", MINUTE);
            create.setWakeMode(WakeMode.NOW);
            CronJob job = cron.add(create);

            timers.advance(MINUTE);

            assertEquals(List.of("cron:" + job.getId()), heartbeatRequests);
        }

        @Test
        void tickRunsOnTickExecutor() {
            List<Runnable> dispatched = new CopyOnWriteArrayList<>();
            CronService cron = newService(b -> b.tickExecutor(dispatched::add));
            cron.start();
            cron.add(everyJob("ping", MINUTE));

            timers.advance(MINUTE);

            assertEquals(1, dispatched.size());
            assertTrue(systemEvents.isEmpty());

            dispatched.get(0).run();

            assertEquals(List.of("ping tick"), systemEvents);
            assertEquals(T0 + 2 * MINUTE, cron.status().getNextWakeAtMs());
        }

        @Test
        void disabledScheduler_armsNothing() {
            CronService cron = newService(b -> b.cronEnabled(false));
            cron.start();
            CronJob job = cron.add(everyJob("ping", MINUTE));

            assertEquals(0, timers.pendingCount());
            timers.advance(10 * MINUTE);
            assertTrue(systemEvents.isEmpty());
            assertFalse(cron.status().isEnabled());

            // manual runs still work
            cron.run(job.getId(), CronRunMode.FORCE);
            assertEquals(List.of("ping tick"), systemEvents);
        }

        @Test
        void repeatedReads_doNotReArmAnUnchangedTimer() {
            CronService cron = newService();
            cron.start();
            cron.add(everyJob("ping", 10 * MINUTE));
            int armed = cron.state().getTimerArmCount();

            for (int i = 0; i < 20; i++) {
                cron.status();
                cron.list(true);
            }

            assertEquals(armed, cron.state().getTimerArmCount());
            assertTrue(cron.state().getTimer().isActive());
        }

        @Test
        void armedDelayIsClampedSoIdleTicksStayFresh() {
            CronService cron = newService();
            cron.start();
            cron.add(everyJob("ping", 10 * MINUTE));

            timers.advance(30_000);

            assertEquals(T0 + 30_000, cron.state().getLastTimerTickAtMs());
            assertTrue(systemEvents.isEmpty());
            assertTrue(cron.state().getTimer().isActive());
        }
    }

    // =========================================================================
    // Watchdog and anti-zombie
    // =========================================================================

    @Nested
    class SelfHealing {

        @Test
        void antiZombie_reinitializesWhenNoTickPastThreshold() {
            CronService cron = newService(b -> b.watchdogIntervalMs(24 * HOUR));
            cron.start();
            cron.add(everyJob("ping", 10 * MINUTE));
            cron.state().getTimer().cancel();
            cron.state().setLastTimerTickAtMs(timers.nowMs() - 61_000);

            cron.antiZombieCheck();

            assertEquals(1, cron.state().getAntiZombieReinitCount());
            assertTrue(cron.state().getTimer().isActive());
        }

        @Test
        void antiZombie_quietWhenTickIsRecent() {
            CronService cron = newService();
            cron.start();
            cron.add(everyJob("ping", 10 * MINUTE));
            cron.state().setLastTimerTickAtMs(timers.nowMs() - 5_000);

            cron.antiZombieCheck();

            assertEquals(0, cron.state().getAntiZombieReinitCount());
        }

        @Test
        void antiZombie_quietWithoutScheduledJobs() {
            CronService cron = newService();
            cron.start();

            timers.advance(10 * MINUTE);

            assertEquals(0, cron.state().getAntiZombieReinitCount());
        }

        @Test
        void antiZombie_recoversStaleRunningJob() {
            CronService cron = newService();
            cron.start();
            CronJob job = cron.add(everyJob("ping", 10 * MINUTE));
            cron.state().setLastTimerTickAtMs(timers.nowMs());
            long now = timers.nowMs();
            job.getState().setRunningAtMs(now - 3 * HOUR);

            cron.antiZombieCheck();

            CronJob recovered = cron.getJob(job.getId()).orElseThrow();
            assertNull(recovered.getState().getRunningAtMs());
            assertEquals(now, recovered.getState().getNextRunAtMs());
            assertNull(CronStore.load(storePath).getJobs().get(0).getState().getRunningAtMs());

            timers.advance(0);
            assertEquals(List.of("ping tick"), systemEvents);
        }

        @Test
        void antiZombie_leavesRecentlyStartedJobAlone() {
            CronService cron = newService();
            cron.start();
            CronJob job = cron.add(everyJob("ping", 10 * MINUTE));
            cron.state().setLastTimerTickAtMs(timers.nowMs());
            long startedAt = timers.nowMs() - 5 * MINUTE;
            job.getState().setRunningAtMs(startedAt);

            cron.antiZombieCheck();

            assertEquals(startedAt, cron.getJob(job.getId()).orElseThrow().getState().getRunningAtMs());
            assertEquals(new CronNotRan(CronSkipReason.ALREADY_RUNNING), cron.run(job.getId(), CronRunMode.FORCE));
        }

        @Test
        void start_recoversJobLeftRunningByCrashedProcess() {
            CronJob crashed = CronNormalize.createJob(everyJob("ping", 10 * MINUTE), T0 - 4 * HOUR);
            crashed.getState().setRunningAtMs(T0 - 3 * HOUR);
            crashed.getState().setNextRunAtMs(T0 + 5 * MINUTE);
            CronStore.save(storePath, CronStoreFile.builder().jobs(List.of(crashed)).build());

            CronService cron = newService();
            cron.start();

            CronJob loaded = cron.getJob(crashed.getId()).orElseThrow();
            assertNull(loaded.getState().getRunningAtMs());
            assertEquals(T0, loaded.getState().getNextRunAtMs());

            timers.advance(0);
            assertEquals(List.of("ping tick"), systemEvents);
            assertEquals(T0 + 10 * MINUTE, cron.getJob(crashed.getId()).orElseThrow().getState().getNextRunAtMs());
        }

        @Test
        void start_recoversCrashedJobWhoseDueTimeIsLongPast() {
            CronJob crashed = CronNormalize.createJob(everyJob("ping", 10 * MINUTE), T0 - 4 * HOUR);
            crashed.getState().setRunningAtMs(T0 - 3 * HOUR);
            crashed.getState().setNextRunAtMs(T0 - 3 * HOUR);
            CronStore.save(storePath, CronStoreFile.builder().jobs(List.of(crashed)).build());

            CronService cron = newService();
            cron.start();

            CronJob loaded = cron.getJob(crashed.getId()).orElseThrow();
            assertNull(loaded.getState().getRunningAtMs());
            assertEquals(T0, loaded.getState().getNextRunAtMs());
            assertEquals(T0, CronStore.load(storePath).getJobs().get(0).getState().getNextRunAtMs());

            timers.advance(0);
            assertEquals(List.of("ping tick"), systemEvents);
        }

        @Test
        void antiZombie_leavesLongRunningTickAlone() throws Exception {
            CountDownLatch runnerEntered = new CountDownLatch(1);
            CompletableFuture<IsolatedAgentRunResult> pending = new CompletableFuture<>();
            List<String> invocations = new CopyOnWriteArrayList<>();
            IsolatedAgentJobRunner runner = (job, message) -> {
                invocations.add(job.getId());
                runnerEntered.countDown();
                return pending;
            };
            CronService cron = newService(b -> b.runIsolatedAgentJob(runner));
            cron.start();
            CronJob job = cron.add(isolatedJob("digest", MINUTE));

            ExecutorService pool = Executors.newSingleThreadExecutor();
            try {
                timers.setNowMs(T0 + MINUTE);
                Future<?> tick = pool.submit(cron::onTimer);
                assertTrue(runnerEntered.await(5, TimeUnit.SECONDS));

                timers.setNowMs(T0 + 3 * MINUTE);
                cron.antiZombieCheck();
                cron.watchdogCheck();

                assertEquals(0, cron.state().getAntiZombieReinitCount());
                assertTrue(cron.state().isRunning());
                cron.onTimer();
                assertEquals(1, invocations.size());

                pending.complete(IsolatedAgentRunResult.ok("done"));
                tick.get(5, TimeUnit.SECONDS);
                assertFalse(cron.state().isRunning());
                assertNull(cron.getJob(job.getId()).orElseThrow().getState().getRunningAtMs());
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        void antiZombie_reinitializesTickHungPastStaleThreshold() throws Exception {
            CountDownLatch runnerEntered = new CountDownLatch(1);
            CompletableFuture<IsolatedAgentRunResult> pending = new CompletableFuture<>();
            IsolatedAgentJobRunner runner = (job, message) -> {
                runnerEntered.countDown();
                return pending;
            };
            CronService cron = newService(b -> b.runIsolatedAgentJob(runner).staleRunningMs(10 * MINUTE));
            cron.start();
            cron.add(isolatedJob("digest", HOUR));

            ExecutorService pool = Executors.newSingleThreadExecutor();
            try {
                timers.setNowMs(T0 + HOUR);
                Future<?> tick = pool.submit(cron::onTimer);
                assertTrue(runnerEntered.await(5, TimeUnit.SECONDS));

                timers.setNowMs(T0 + HOUR + 11 * MINUTE);
                cron.antiZombieCheck();

                assertEquals(1, cron.state().getAntiZombieReinitCount());
                assertFalse(cron.state().isRunning());

                pending.complete(IsolatedAgentRunResult.ok("late"));
                tick.get(5, TimeUnit.SECONDS);
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        void watchdog_rearmsLostTimer() {
            CronService cron = newService(b -> b.antiZombieThresholdMs(24 * HOUR));
            cron.start();
            cron.add(everyJob("ping", 10 * MINUTE));
            cron.state().getTimer().cancel();

            timers.advance(120_000);

            assertEquals(1, cron.state().getWatchdogRearmCount());
            assertTrue(cron.state().getTimer().isActive());
        }

        @Test
        void endToEnd_deadTimerIsRevivedAndJobRuns() {
            CronService cron = newService(b -> b.watchdogIntervalMs(24 * HOUR));
            cron.start();
            cron.add(everyJob("ping", 3 * MINUTE));
            cron.state().getTimer().cancel();

            timers.advance(3 * MINUTE);

            assertEquals(1, cron.state().getAntiZombieReinitCount());
            assertEquals(List.of("ping tick"), systemEvents);
        }

        @Test
        void stop_cancelsAllTimers() {
            CronService cron = newService();
            cron.start();
            cron.add(everyJob("ping", MINUTE));
            assertTrue(timers.pendingCount() >= 3);

            cron.stop();
            cron.stop();

            assertEquals(0, timers.pendingCount());
        }
    }
}
