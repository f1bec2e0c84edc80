package com.clawkeep.plugin.registry;

import com.clawkeep.plugin.tools.ToolHandler;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Tools registered by plugins, plus diagnostics produced while resolving them.
 */
@Slf4j
public class PluginToolRegistry {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolDefinition {
        private String name;
        private String description;
        private ToolHandler handler;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PluginToolRegistration {
        private String pluginId;
        private boolean optional;
        private List<ToolDefinition> tools;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PluginDiagnostic {
        private String pluginId;
        private String level; // "info", "warn", "error"
        private String message;
    }

    private final List<PluginToolRegistration> registrations = new CopyOnWriteArrayList<>();
    private final List<PluginDiagnostic> diagnostics = new CopyOnWriteArrayList<>();

    public void registerTool(PluginToolRegistration registration) {
        registrations.add(registration);
        log.debug("Registered {} tool(s) from plugin {}",
                registration.getTools() != null ? registration.getTools().size() : 0,
                registration.getPluginId());
    }

    public List<PluginToolRegistration> getTools() {
        return Collections.unmodifiableList(new ArrayList<>(registrations));
    }

    public void addDiagnostic(PluginDiagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public List<PluginDiagnostic> getDiagnostics() {
        return Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }
}
