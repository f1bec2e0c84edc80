package com.clawkeep.gateway;

import com.clawkeep.channel.recovery.ConnectionRecoveryTracker;
import com.clawkeep.common.config.ClawkeepConfig;
import com.clawkeep.common.config.ConfigPaths;
import com.clawkeep.common.config.ConfigService;
import com.clawkeep.common.infra.ExecutorTimerScheduler;
import com.clawkeep.common.infra.TimerScheduler;
import com.clawkeep.gateway.cron.CronService;
import com.clawkeep.gateway.cron.CronState.CronServiceDeps;
import com.clawkeep.gateway.session.ZombieSessionBuffer;
import com.clawkeep.node.NodeSubscriptionRouter;
import com.clawkeep.plugin.tools.SingletonToolLock;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Spring configuration for the resilience beans.
 * <p>
 * The host may contribute a {@link CronServiceDeps} bean carrying its
 * heartbeat and agent callbacks; store path, timers and tuning come from
 * config unless the host sets them.
 */
@Slf4j
@Configuration
public class ResilienceBeanConfig {

    @Value("${clawkeep.config.path:~/.clawkeep/config.json}")
    private String configPath;
    @Value("${clawkeep.state.dir:~/.clawkeep}")
    private String stateDir;

    @Bean
    public ConfigService configService() {
        return new ConfigService(ConfigPaths.resolveUserPath(configPath));
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean(destroyMethod = "close")
    public ExecutorTimerScheduler timerScheduler() {
        return new ExecutorTimerScheduler("clawkeep-timer", 2);
    }

    @Bean
    public NodeSubscriptionRouter nodeSubscriptionRouter(ObjectMapper objectMapper) {
        return new NodeSubscriptionRouter(objectMapper);
    }

    @Bean
    public ConnectionRecoveryTracker<Object> connectionRecoveryTracker(ConfigService configService) {
        long windowMs = configService.loadConfig().getRecovery().getWindowMs();
        return new ConnectionRecoveryTracker<>(windowMs, System::currentTimeMillis);
    }

    @Bean(destroyMethod = "clearZombieBuffer")
    public ZombieSessionBuffer<Object> zombieSessionBuffer(TimerScheduler timerScheduler,
            ConfigService configService) {
        ClawkeepConfig.ZombieConfig zombie = configService.loadConfig().getZombie();
        return new ZombieSessionBuffer<>(timerScheduler, zombie.getGraceMs(), zombie.getMaxQueuedPayloads());
    }

    @Bean
    public SingletonToolLock singletonToolLock(ConfigService configService) {
        SingletonToolLock lock = new SingletonToolLock(configService.resolveSingletonToolNames());
        log.info("Singleton tools: {}", lock.getSingletonNames());
        return lock;
    }

    /** Cron ticks block on job execution, so they get their own thread. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService cronTickExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "clawkeep-cron-tick");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public CronService cronService(ConfigService configService, TimerScheduler timerScheduler,
            ExecutorService cronTickExecutor, ObjectProvider<CronServiceDeps> hostDeps) {
        ClawkeepConfig.CronConfig cron = configService.loadConfig().getCron();
        CronServiceDeps host = hostDeps.getIfAvailable(() -> CronServiceDeps.builder().build());

        String storePath = host.getStorePath() != null
                ? host.getStorePath()
                : configService.resolveCronStorePath(resolveStateDir()).toString();

        CronServiceDeps deps = CronServiceDeps.builder()
                .storePath(storePath)
                .cronEnabled(cron.isEnabled() && host.isCronEnabled())
                .agentId(host.getAgentId())
                .timers(host.getTimers() != null ? host.getTimers() : timerScheduler)
                .enqueueSystemEvent(host.getEnqueueSystemEvent())
                .requestHeartbeatNow(host.getRequestHeartbeatNow())
                .runHeartbeatOnce(host.getRunHeartbeatOnce())
                .runIsolatedAgentJob(host.getRunIsolatedAgentJob())
                .onEvent(host.getOnEvent())
                .tickExecutor(host.getTickExecutor() != null ? host.getTickExecutor() : cronTickExecutor)
                .staleRunningMs(cron.getStaleRunningMs())
                .antiZombieIntervalMs(cron.getAntiZombieIntervalMs())
                .antiZombieThresholdMs(cron.getAntiZombieThresholdMs())
                .watchdogIntervalMs(cron.getWatchdogIntervalMs())
                .maxTimerDelayMs(cron.getMaxTimerDelayMs())
                .build();
        return new CronService(deps);
    }

    private Path resolveStateDir() {
        return ConfigPaths.resolveUserPath(stateDir);
    }
}
