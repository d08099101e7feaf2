package com.ryuqq.audioedit.adapter.intake.codec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson configuration for every intake wire format.
 *
 * <p>Field names are snake_case, instants are ISO-8601 strings, unknown fields are ignored
 * and null fields are omitted.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class JsonCodecs {

    private JsonCodecs() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static ObjectMapper jsonMapper() {
        return configure(new ObjectMapper());
    }

    public static ObjectMapper yamlMapper() {
        return configure(new ObjectMapper(new YAMLFactory()));
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
            .registerModule(new JavaTimeModule())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
