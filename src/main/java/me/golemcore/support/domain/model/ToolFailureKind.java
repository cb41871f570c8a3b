package me.golemcore.support.domain.model;

/**
 * Machine-readable classification of tool failures.
 *
 * <p>
 * Agents branch on this instead of matching error text.
 */
public enum ToolFailureKind {

    /**
     * Arguments were missing or did not match the tool's request type.
     */
    INVALID_ARGUMENTS,

    /**
     * The looked-up entity does not exist (e.g. no customer for an email).
     */
    NOT_FOUND,

    /**
     * No tool is registered under the requested name, or it is disabled.
     */
    UNKNOWN_TOOL,

    /**
     * The tool threw, timed out, or its backing store failed.
     */
    EXECUTION_FAILED
}
