package com.clawkeep.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the resilience configuration.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    /** Comma-separated tool names that must never run concurrently. */
    public static final String SINGLETON_TOOLS_ENV = "CLAWKEEP_SINGLETON_TOOLS";

    private final ObjectMapper objectMapper;
    private final Cache<String, ClawkeepConfig> cache;
    private final Path configPath;
    private final Map<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System.getenv());
    }

    public ConfigService(Path configPath, Duration cacheTtl, Map<String, String> env) {
        this.configPath = ConfigPaths.resolveUserPath(configPath.toString());
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public ClawkeepConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public ClawkeepConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * Resolve the cron store path: configured value with "~" expanded, or the
     * default location under the state directory.
     */
    public Path resolveCronStorePath(Path stateDir) {
        String configured = loadConfig().getCron().getStore();
        if (configured != null && !configured.isBlank()) {
            return ConfigPaths.resolveUserPath(configured.trim());
        }
        return ConfigPaths.defaultCronStorePath(stateDir);
    }

    /**
     * Union of the configured singleton tools and the names listed in
     * {@value #SINGLETON_TOOLS_ENV}. Names are returned as written; callers
     * normalize them.
     */
    public Set<String> resolveSingletonToolNames() {
        Set<String> names = new LinkedHashSet<>();
        var tools = loadConfig().getTools();
        if (tools.getSingleton() != null) {
            for (String name : tools.getSingleton()) {
                if (name != null && !name.isBlank()) {
                    names.add(name.trim());
                }
            }
        }
        String raw = env.get(SINGLETON_TOOLS_ENV);
        if (raw != null && !raw.isBlank()) {
            Arrays.stream(raw.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(names::add);
        }
        return names;
    }

    private ClawkeepConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new ClawkeepConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            ClawkeepConfig config = raw.isBlank()
                    ? new ClawkeepConfig()
                    : objectMapper.readValue(raw, ClawkeepConfig.class);
            log.info("Config loaded from: {}", configPath);
            return applyDefaults(config);
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new ClawkeepConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Apply default values to missing config sections.
     */
    ClawkeepConfig applyDefaults(ClawkeepConfig config) {
        if (config.getCron() == null) {
            config.setCron(new ClawkeepConfig.CronConfig());
        }
        if (config.getRecovery() == null) {
            config.setRecovery(new ClawkeepConfig.RecoveryConfig());
        }
        if (config.getZombie() == null) {
            config.setZombie(new ClawkeepConfig.ZombieConfig());
        }
        if (config.getTools() == null) {
            config.setTools(new ClawkeepConfig.ToolsConfig());
        }
        return config;
    }
}
