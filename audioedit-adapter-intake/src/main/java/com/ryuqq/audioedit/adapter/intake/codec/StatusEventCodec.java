package com.ryuqq.audioedit.adapter.intake.codec;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.audioedit.core.model.AudioRef;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.RequestError;
import com.ryuqq.audioedit.core.model.RequestId;
import com.ryuqq.audioedit.core.model.StatusEvent;
import com.ryuqq.audioedit.core.statemachine.RequestStatus;

import java.time.Instant;

/**
 * JSON codec for {@link StatusEvent} snapshots published on {@code audio/status/{id}}.
 *
 * <pre>
 * {"request_id":"REQ-000001","status":"processing","current_step":1,"total_steps":3,
 *  "current_operation":"normalize","updated_at":"2024-01-01T00:00:05Z"}
 * </pre>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class StatusEventCodec {

    private final ObjectMapper mapper;

    public StatusEventCodec() {
        this(JsonCodecs.jsonMapper());
    }

    public StatusEventCodec(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    public String encode(StatusEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        try {
            return mapper.writeValueAsString(StatusMessage.from(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("status event could not be serialized: " + event.requestId(), e);
        }
    }

    /**
     * Decodes a status message.
     *
     * @throws IllegalArgumentException if the message is malformed or names an unknown status
     */
    public StatusEvent decode(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("json cannot be null or blank");
        }
        try {
            return mapper.readValue(json, StatusMessage.class).toEvent();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed status message: " + e.getOriginalMessage(), e);
        }
    }

    record StatusMessage(
        @JsonProperty("request_id") String requestId,
        @JsonProperty("status") String status,
        @JsonProperty("current_step") int currentStep,
        @JsonProperty("total_steps") int totalSteps,
        @JsonProperty("current_operation") String currentOperation,
        @JsonProperty("result_ref") String resultRef,
        @JsonProperty("error") ErrorMessage error,
        @JsonProperty("updated_at") Instant updatedAt
    ) {

        static StatusMessage from(StatusEvent event) {
            return new StatusMessage(
                event.requestId().getValue(),
                event.status().wireName(),
                event.currentStep(),
                event.totalSteps(),
                event.currentOperation() == null ? null : event.currentOperation().wireName(),
                event.resultRef() == null ? null : event.resultRef().getValue(),
                event.error() == null ? null : ErrorMessage.from(event.error()),
                event.updatedAt()
            );
        }

        StatusEvent toEvent() {
            RequestStatus parsedStatus = RequestStatus.fromWireName(status)
                .orElseThrow(() -> new IllegalArgumentException("unknown status: " + status));
            return new StatusEvent(
                RequestId.of(requestId),
                parsedStatus,
                currentStep,
                totalSteps,
                currentOperation == null ? null : kind(currentOperation),
                resultRef == null ? null : AudioRef.of(resultRef),
                error == null ? null : error.toError(),
                updatedAt
            );
        }
    }

    record ErrorMessage(
        @JsonProperty("code") String code,
        @JsonProperty("message") String message,
        @JsonProperty("operation_index") Integer operationIndex,
        @JsonProperty("operation_kind") String operationKind
    ) {

        static ErrorMessage from(RequestError error) {
            return new ErrorMessage(
                error.code(),
                error.message(),
                error.hasOperation() ? error.operationIndex() : null,
                error.hasOperation() ? error.operationKind().wireName() : null
            );
        }

        RequestError toError() {
            if (operationIndex == null || operationKind == null) {
                return RequestError.of(code, message);
            }
            return RequestError.atOperation(code, message, operationIndex, kind(operationKind));
        }
    }

    private static OperationKind kind(String wireName) {
        return OperationKind.fromWireName(wireName)
            .orElseThrow(() -> new IllegalArgumentException("unknown operation: " + wireName));
    }
}
