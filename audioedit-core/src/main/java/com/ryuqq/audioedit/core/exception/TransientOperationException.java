package com.ryuqq.audioedit.core.exception;

/**
 * Thrown by an operation executor for a fault that may clear on retry
 * (temporary resource shortage, busy codec, I/O hiccup).
 *
 * <p>The pipeline retries these with backoff up to its retry budget. Any other
 * unchecked exception from an executor is treated as permanent.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public class TransientOperationException extends EditEngineException {

    public static final String ERROR_CODE = "TRANSIENT_FAULT";

    public TransientOperationException(String message) {
        super(ERROR_CODE, message);
    }

    public TransientOperationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
