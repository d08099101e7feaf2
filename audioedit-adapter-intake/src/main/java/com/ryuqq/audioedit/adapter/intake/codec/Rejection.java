package com.ryuqq.audioedit.adapter.intake.codec;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ryuqq.audioedit.core.exception.EditEngineException;
import com.ryuqq.audioedit.core.exception.ValidationException;

import java.time.Instant;

/**
 * Message published on {@code audio/rejections} when a submission is refused.
 *
 * @param requestId the caller-supplied id, when one could be read
 * @param clientId the caller-supplied client, when one could be read
 * @param errorCode taxonomy code ({@code VALIDATION_ERROR}, {@code ADMISSION_REJECTED}, ...)
 * @param message human-readable reason
 * @param operationIndex offending operation index, for validation failures
 * @param operationKind offending operation kind, for validation failures
 * @param parameter offending parameter, for validation failures
 * @param rejectedAt when the submission was refused
 * @author AudioEdit Team
 * @since 1.0.0
 */
public record Rejection(
    @JsonProperty("request_id") String requestId,
    @JsonProperty("client_id") String clientId,
    @JsonProperty("error_code") String errorCode,
    @JsonProperty("message") String message,
    @JsonProperty("operation_index") Integer operationIndex,
    @JsonProperty("operation_kind") String operationKind,
    @JsonProperty("parameter") String parameter,
    @JsonProperty("rejected_at") Instant rejectedAt
) {

    public Rejection {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        if (rejectedAt == null) {
            throw new IllegalArgumentException("rejectedAt cannot be null");
        }
    }

    public static Rejection of(String requestId, String clientId, EditEngineException cause, Instant rejectedAt) {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        if (cause instanceof ValidationException validation) {
            Integer index = validation.getOperationIndex() >= 0 ? validation.getOperationIndex() : null;
            return new Rejection(requestId, clientId, cause.getErrorCode(), cause.getMessage(),
                index, validation.getOperationKind(), validation.getParameter(), rejectedAt);
        }
        return new Rejection(requestId, clientId, cause.getErrorCode(), cause.getMessage(),
            null, null, null, rejectedAt);
    }

    public static Rejection internal(String requestId, String clientId, String message, Instant rejectedAt) {
        return new Rejection(requestId, clientId, "INTERNAL_ERROR", message, null, null, null, rejectedAt);
    }
}
