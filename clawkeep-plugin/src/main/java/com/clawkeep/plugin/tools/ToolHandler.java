package com.clawkeep.plugin.tools;

import java.util.Map;

/**
 * Executes one tool call.
 */
@FunctionalInterface
public interface ToolHandler {

    String execute(Map<String, Object> params) throws Exception;
}
