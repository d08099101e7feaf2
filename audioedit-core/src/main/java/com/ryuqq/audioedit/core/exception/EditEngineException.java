package com.ryuqq.audioedit.core.exception;

/**
 * Base type for errors surfaced by the edit engine to its callers.
 *
 * <p>Every subtype carries a stable error code so that boundary adapters
 * (intake channel, HTTP gateways) can map it without inspecting the message.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public abstract class EditEngineException extends RuntimeException {

    private final String errorCode;

    protected EditEngineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected EditEngineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
