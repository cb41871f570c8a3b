package me.golemcore.support.domain.exception;

/**
 * Tool arguments are missing or malformed. Raised by argument parsing and
 * turned into an {@code INVALID_ARGUMENTS} tool result by the registry.
 */
public class ToolArgumentException extends SupportException {

    public ToolArgumentException(String message) {
        super(SupportErrorCode.INVALID_REQUEST, message);
    }
}
