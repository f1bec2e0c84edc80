package com.clawkeep.plugin.tools;

import com.clawkeep.plugin.registry.PluginToolRegistry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Resolves plugin-registered tools for the agent tool registry, wrapping
 * handlers of singleton tools in the {@link SingletonToolLock}.
 */
@Slf4j
public class PluginToolResolver {

    /**
     * A resolved plugin tool ready for agent consumption.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResolvedPluginTool {
        private String name;
        private String description;
        private String pluginId;
        private boolean optional;
        /** True when invocations are serialized by the singleton lock. */
        private boolean serialized;
        private ToolHandler handler;
    }

    /**
     * Resolve all plugin-registered tools from the registry.
     *
     * @param registry          plugin tool registry
     * @param existingToolNames tool names already registered (to detect conflicts)
     * @param toolAllowlist     optional allowlist for optional tools
     * @param singletonLock     lock for singleton tools; null disables wrapping
     * @return list of resolved plugin tools
     */
    public static List<ResolvedPluginTool> resolvePluginTools(
            PluginToolRegistry registry,
            Set<String> existingToolNames,
            List<String> toolAllowlist,
            SingletonToolLock singletonLock) {

        List<ResolvedPluginTool> tools = new ArrayList<>();
        Set<String> existing = existingToolNames != null
                ? new HashSet<>(existingToolNames)
                : new HashSet<>();
        Set<String> existingNormalized = new HashSet<>();
        existing.forEach(name -> existingNormalized.add(normalizeToolName(name)));
        Set<String> allowlist = normalizeAllowlist(toolAllowlist);

        for (var entry : registry.getTools()) {
            String pluginIdKey = normalizeToolName(entry.getPluginId());
            if (existingNormalized.contains(pluginIdKey)) {
                conflict(registry, entry.getPluginId(), String.format(
                        "plugin id conflicts with core tool name (%s)", entry.getPluginId()));
                continue;
            }
            if (entry.getTools() == null)
                continue;

            Set<String> pluginNames = new HashSet<>();
            for (var tool : entry.getTools()) {
                String toolName = tool.getName();
                if (entry.isOptional() && !isOptionalToolAllowed(toolName, entry.getPluginId(), allowlist)) {
                    continue;
                }
                if (pluginNames.contains(toolName) || existing.contains(toolName)) {
                    conflict(registry, entry.getPluginId(), String.format(
                            "plugin tool name conflict (%s): %s", entry.getPluginId(), toolName));
                    continue;
                }
                pluginNames.add(toolName);
                existing.add(toolName);

                boolean serialized = singletonLock != null
                        && tool.getHandler() != null
                        && singletonLock.isSingleton(toolName);
                ToolHandler handler = serialized
                        ? params -> singletonLock.withLock(toolName, () -> tool.getHandler().execute(params))
                        : tool.getHandler();

                tools.add(ResolvedPluginTool.builder()
                        .name(toolName)
                        .description(tool.getDescription())
                        .pluginId(entry.getPluginId())
                        .optional(entry.isOptional())
                        .serialized(serialized)
                        .handler(handler)
                        .build());
            }
        }

        log.debug("Resolved {} plugin tools", tools.size());
        return tools;
    }

    private static void conflict(PluginToolRegistry registry, String pluginId, String msg) {
        log.error(msg);
        registry.addDiagnostic(PluginToolRegistry.PluginDiagnostic.builder()
                .pluginId(pluginId)
                .level("error")
                .message(msg)
                .build());
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    static String normalizeToolName(String name) {
        if (name == null)
            return "";
        return name.trim().toLowerCase().replaceAll("[^a-z0-9]", "_");
    }

    static Set<String> normalizeAllowlist(List<String> list) {
        if (list == null || list.isEmpty())
            return Set.of();
        Set<String> normalized = new HashSet<>();
        for (String item : list) {
            if (item == null)
                continue;
            String trimmed = item.trim().toLowerCase();
            if (trimmed.equals("group:plugins")) {
                normalized.add(trimmed);
                continue;
            }
            String n = normalizeToolName(item);
            if (!n.isEmpty())
                normalized.add(n);
        }
        return normalized;
    }

    static boolean isOptionalToolAllowed(String toolName, String pluginId, Set<String> allowlist) {
        if (allowlist.isEmpty())
            return false;
        if (allowlist.contains(normalizeToolName(toolName)))
            return true;
        if (allowlist.contains(normalizeToolName(pluginId)))
            return true;
        return allowlist.contains("group:plugins");
    }
}
