package com.clawkeep.common.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ConfigPathsTest {

    @Test
    void stateDir_defaultsToHome() {
        assertEquals(Path.of("/home/u", ".clawkeep"), ConfigPaths.resolveStateDir(Map.of(), "/home/u"));
    }

    @Test
    void stateDir_envOverrideExpandsTilde() {
        assertEquals(Path.of("/home/u", "state"),
                ConfigPaths.resolveStateDir(Map.of("CLAWKEEP_STATE_DIR", " ~/state "), "/home/u"));
    }

    @Test
    void resolveUserPath_absoluteUntouched() {
        assertEquals(Path.of("/var/lib/x"), ConfigPaths.resolveUserPath("/var/lib/x", "/home/u"));
        assertEquals(Path.of("/home/u"), ConfigPaths.resolveUserPath("~", "/home/u"));
    }
}
