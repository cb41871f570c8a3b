package me.golemcore.support.domain.exception;

import java.util.Map;

/**
 * A language-model call failed permanently or exhausted its retry budget.
 */
public class ModelUnavailableException extends SupportException {

    private final String reasonCode;

    public ModelUnavailableException(String message, String reasonCode, Throwable cause) {
        super(SupportErrorCode.MODEL_UNAVAILABLE, message, Map.of("reason", reasonCode), cause);
        this.reasonCode = reasonCode;
    }

    /**
     * Machine-readable classification from {@code LlmErrorClassifier}.
     */
    public String getReasonCode() {
        return reasonCode;
    }
}
