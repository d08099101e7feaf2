package com.ryuqq.audioedit.adapter.intake.flow;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One step of a {@link FlowDefinition}.
 *
 * @param name optional label, used only in log and error messages
 * @param type operation name, e.g. {@code fade_in}
 * @param parameters raw operation parameters
 * @author AudioEdit Team
 * @since 1.0.0
 */
public record FlowStep(
    @JsonProperty("name") String name,
    @JsonProperty("type") @JsonAlias("operation") String type,
    @JsonProperty("parameters") Map<String, Object> parameters
) {

    public FlowStep {
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * Label for messages: the step name, or its type when unnamed.
     */
    public String label() {
        return name != null && !name.isBlank() ? name : String.valueOf(type);
    }
}
