package com.ryuqq.audioedit.adapter.intake.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON codec for {@link Rejection} messages.
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class RejectionCodec {

    private final ObjectMapper mapper;

    public RejectionCodec() {
        this(JsonCodecs.jsonMapper());
    }

    public RejectionCodec(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    public String encode(Rejection rejection) {
        if (rejection == null) {
            throw new IllegalArgumentException("rejection cannot be null");
        }
        try {
            return mapper.writeValueAsString(rejection);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("rejection could not be serialized", e);
        }
    }

    public Rejection decode(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("json cannot be null or blank");
        }
        try {
            return mapper.readValue(json, Rejection.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed rejection: " + e.getOriginalMessage(), e);
        }
    }
}
