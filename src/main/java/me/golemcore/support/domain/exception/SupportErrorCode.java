package me.golemcore.support.domain.exception;

/**
 * Stable error codes carried by {@link SupportException}. Codes are safe to
 * log and to expose as task failure reasons.
 */
public enum SupportErrorCode {
    STORAGE_UNAVAILABLE,
    MODEL_UNAVAILABLE,
    MALFORMED_MODEL_OUTPUT,
    CONVERSATION_BUSY,
    INVALID_REQUEST,
    TIMEOUT,
    INTERNAL
}
