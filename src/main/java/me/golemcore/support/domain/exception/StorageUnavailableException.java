package me.golemcore.support.domain.exception;

import java.util.Map;

/**
 * The durable store could not be read or written. Fatal for the current turn.
 */
public class StorageUnavailableException extends SupportException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(SupportErrorCode.STORAGE_UNAVAILABLE, message, cause);
    }

    public StorageUnavailableException(String message, Map<String, ?> context, Throwable cause) {
        super(SupportErrorCode.STORAGE_UNAVAILABLE, message, context, cause);
    }
}
