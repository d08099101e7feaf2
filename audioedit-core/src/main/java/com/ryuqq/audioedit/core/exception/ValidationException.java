package com.ryuqq.audioedit.core.exception;

/**
 * Malformed, missing or out-of-range operation parameters.
 *
 * <p>Raised synchronously at submission; the request never enters {@code queued}.
 * The exception names the first offending operation (index and kind) and, where
 * applicable, the single parameter to fix.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public class ValidationException extends EditEngineException {

    public static final String ERROR_CODE = "VALIDATION_ERROR";

    private final int operationIndex;
    private final String operationKind;
    private final String parameter;

    public ValidationException(int operationIndex, String operationKind, String parameter, String message) {
        super(ERROR_CODE, message);
        this.operationIndex = operationIndex;
        this.operationKind = operationKind;
        this.parameter = parameter;
    }

    /**
     * Request-level problem not tied to a specific operation.
     */
    public static ValidationException forRequest(String message) {
        return new ValidationException(-1, null, null, message);
    }

    /**
     * Problem with one parameter of an operation whose position is not yet known.
     */
    public static ValidationException forParameter(String operationKind, String parameter, String message) {
        return new ValidationException(-1, operationKind, parameter, message);
    }

    /**
     * Returns a copy positioned at the given operation index.
     *
     * @param index zero-based index in the submitted chain
     * @return positioned exception
     */
    public ValidationException atIndex(int index) {
        String positioned = "operations[" + index + "] (" + operationKind + "): " + getMessage();
        ValidationException copy = new ValidationException(index, operationKind, parameter, positioned);
        copy.initCause(this);
        return copy;
    }

    public int getOperationIndex() {
        return operationIndex;
    }

    public String getOperationKind() {
        return operationKind;
    }

    public String getParameter() {
        return parameter;
    }
}
