package me.golemcore.support.domain.component;

import java.util.Map;

/**
 * Typed argument object of one tool. Each tool declares its own request type;
 * the registry checks it before execution.
 */
public interface ToolRequest {

    /**
     * Name of the tool this request is addressed to.
     */
    String toolName();

    /**
     * Argument view recorded in tool invocation summaries.
     */
    Map<String, Object> toArguments();
}
