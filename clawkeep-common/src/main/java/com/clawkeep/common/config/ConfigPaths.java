package com.clawkeep.common.config;

import java.nio.file.Path;
import java.util.Map;

/**
 * State directory and default file locations.
 */
public final class ConfigPaths {

    private ConfigPaths() {
    }

    private static final String STATE_DIRNAME = ".clawkeep";
    private static final String CONFIG_FILENAME = "config.json";
    private static final String CRON_STORE_RELATIVE = "cron/jobs.json";

    /**
     * State directory for mutable data. Can be overridden via CLAWKEEP_STATE_DIR.
     * Default: ~/.clawkeep
     */
    public static Path resolveStateDir() {
        return resolveStateDir(System.getenv(), homeDir());
    }

    public static Path resolveStateDir(Map<String, String> env, String homedir) {
        String override = env.get("CLAWKEEP_STATE_DIR");
        if (override != null && !override.isBlank()) {
            return resolveUserPath(override.trim(), homedir);
        }
        return Path.of(homedir, STATE_DIRNAME);
    }

    public static Path defaultConfigPath() {
        return resolveStateDir().resolve(CONFIG_FILENAME);
    }

    public static Path defaultCronStorePath(Path stateDir) {
        return stateDir.resolve(CRON_STORE_RELATIVE);
    }

    /** Expand a leading "~" to the user home directory. */
    public static Path resolveUserPath(String raw) {
        return resolveUserPath(raw, homeDir());
    }

    static Path resolveUserPath(String raw, String homedir) {
        if (raw.equals("~")) {
            return Path.of(homedir);
        }
        if (raw.startsWith("~/") || raw.startsWith("~\\")) {
            return Path.of(homedir, raw.substring(2));
        }
        return Path.of(raw);
    }

    private static String homeDir() {
        return System.getProperty("user.home");
    }
}
