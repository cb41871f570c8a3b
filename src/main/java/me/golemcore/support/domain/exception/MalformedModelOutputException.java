package me.golemcore.support.domain.exception;

/**
 * Model output could not be parsed into the expected shape. Never retried.
 */
public class MalformedModelOutputException extends SupportException {

    public MalformedModelOutputException(String message) {
        super(SupportErrorCode.MALFORMED_MODEL_OUTPUT, message);
    }

    public MalformedModelOutputException(String message, Throwable cause) {
        super(SupportErrorCode.MALFORMED_MODEL_OUTPUT, message, cause);
    }
}
