package com.ryuqq.audioedit.adapter.intake.flow;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ryuqq.audioedit.application.interpreter.EditPayload;
import com.ryuqq.audioedit.application.interpreter.RawOperation;

import java.util.List;

/**
 * A named, reusable edit chain stored as a JSON or YAML file.
 *
 * <pre>
 * workflow_name: podcast-cleanup
 * client_id: studio-1
 * priority: 2
 * audio_source: uploads/episode.wav
 * steps:
 *   - name: cut intro
 *     type: trim
 *     parameters: { start_ms: 0, end_ms: 60000 }
 *   - type: normalize
 * </pre>
 *
 * @param workflowName human-readable flow name
 * @param clientId submitting client (optional)
 * @param priority 1-5 or a label (optional)
 * @param audioSources input references; a single string is accepted
 * @param steps operations in submission order
 * @author AudioEdit Team
 * @since 1.0.0
 */
public record FlowDefinition(
    @JsonProperty("workflow_name") String workflowName,
    @JsonProperty("client_id") String clientId,
    @JsonProperty("priority") String priority,
    @JsonProperty("audio_source") @JsonAlias("audio_sources")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> audioSources,
    @JsonProperty("steps") List<FlowStep> steps
) {

    public FlowDefinition {
        audioSources = audioSources == null ? List.of() : List.copyOf(audioSources);
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /**
     * Converts the flow into an intake payload.
     *
     * <p>The payload still goes through the Instruction Interpreter; this method does not
     * validate parameters.</p>
     */
    public EditPayload toPayload() {
        EditPayload.Builder builder = EditPayload.builder()
            .clientId(clientId)
            .priority(priority)
            .sources(audioSources);
        for (FlowStep step : steps) {
            builder.operation(RawOperation.of(step.type(), step.parameters()));
        }
        return builder.build();
    }
}
