package com.ryuqq.audioedit.adapter.intake.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.audioedit.application.interpreter.EditPayload;
import com.ryuqq.audioedit.application.interpreter.RawOperation;
import com.ryuqq.audioedit.core.exception.ValidationException;

import java.util.Map;

/**
 * JSON codec for edit submissions arriving on the intake topic.
 *
 * <p><strong>Accepted shape:</strong></p>
 * <pre>
 * {
 *   "id": "REQ-000042",                     (optional, alias "request_id")
 *   "client_id": "studio-1",                (optional)
 *   "audio_source": "uploads/a.wav",        (string or array, alias "audio_sources")
 *   "operation": "trim",                    (single operation form)
 *   "parameters": {"start_ms": 0, "end_ms": 500},
 *   "operations": [{"operation": "normalize", "parameters": {...}}],   (chain form)
 *   "instruction": "make it louder",        (free text, optional)
 *   "guess": {"operation": "...", "parameters": {...}},               (optional)
 *   "priority": 2                           (1-5 or a label such as "high")
 * }
 * </pre>
 *
 * <p>The codec only checks structure. Operation kinds and parameters are validated by the
 * Instruction Interpreter after decoding.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class EditPayloadCodec {

    private static final TypeReference<Map<String, Object>> PARAMETERS = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public EditPayloadCodec() {
        this(JsonCodecs.jsonMapper());
    }

    public EditPayloadCodec(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    /**
     * Decodes one submission.
     *
     * @param json raw message body
     * @return the payload, not yet interpreted
     * @throws ValidationException if the body is not a well-formed submission
     */
    public EditPayload decode(String json) {
        if (json == null || json.isBlank()) {
            throw ValidationException.forRequest("payload is empty");
        }
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw ValidationException.forRequest("payload is not valid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw ValidationException.forRequest("payload must be a JSON object");
        }

        EditPayload.Builder builder = EditPayload.builder()
            .id(text(root, "id", "request_id"))
            .clientId(text(root, "client_id"))
            .instruction(text(root, "instruction"));

        readSources(root, builder);
        readPriority(root, builder);

        JsonNode operations = root.get("operations");
        if (operations != null && !operations.isNull()) {
            if (!operations.isArray()) {
                throw ValidationException.forRequest("'operations' must be an array");
            }
            for (int i = 0; i < operations.size(); i++) {
                builder.operation(readOperation(operations.get(i), "operations[" + i + "]"));
            }
        } else if (root.hasNonNull("operation")) {
            builder.operation(readOperation(root, "payload"));
        }

        JsonNode guess = root.get("guess");
        if (guess != null && !guess.isNull()) {
            builder.guess(readOperation(guess, "guess"));
        }
        return builder.build();
    }

    /**
     * Encodes a payload in the chain form accepted by {@link #decode(String)}.
     */
    public String encode(EditPayload payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        ObjectNode root = mapper.createObjectNode();
        putIfPresent(root, "id", payload.id());
        putIfPresent(root, "client_id", payload.clientId());
        ArrayNode sources = root.putArray("audio_source");
        payload.audioSources().forEach(sources::add);
        if (!payload.operations().isEmpty()) {
            ArrayNode operations = root.putArray("operations");
            for (RawOperation operation : payload.operations()) {
                operations.add(writeOperation(operation));
            }
        }
        putIfPresent(root, "instruction", payload.instruction());
        if (payload.guess() != null) {
            root.set("guess", writeOperation(payload.guess()));
        }
        putIfPresent(root, "priority", payload.priority());
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("payload could not be serialized", e);
        }
    }

    private void readSources(JsonNode root, EditPayload.Builder builder) {
        JsonNode sources = root.has("audio_source") ? root.get("audio_source") : root.get("audio_sources");
        if (sources == null || sources.isNull()) {
            return;
        }
        if (sources.isTextual()) {
            builder.source(sources.asText());
            return;
        }
        if (!sources.isArray()) {
            throw ValidationException.forRequest("'audio_source' must be a string or an array of strings");
        }
        for (JsonNode source : sources) {
            if (!source.isTextual()) {
                throw ValidationException.forRequest("'audio_source' entries must be strings");
            }
            builder.source(source.asText());
        }
    }

    private void readPriority(JsonNode root, EditPayload.Builder builder) {
        JsonNode priority = root.get("priority");
        if (priority == null || priority.isNull()) {
            return;
        }
        if (priority.isIntegralNumber()) {
            builder.priority(priority.asInt());
        } else if (priority.isTextual()) {
            builder.priority(priority.asText());
        } else {
            throw ValidationException.forRequest("'priority' must be an integer or a label");
        }
    }

    private RawOperation readOperation(JsonNode node, String where) {
        if (node == null || !node.isObject()) {
            throw ValidationException.forRequest(where + " must be an object");
        }
        String kind = text(node, "operation", "type");
        if (kind == null || kind.isBlank()) {
            throw ValidationException.forRequest(where + " is missing 'operation'");
        }
        JsonNode parameters = node.get("parameters");
        if (parameters == null || parameters.isNull()) {
            return RawOperation.of(kind);
        }
        if (!parameters.isObject()) {
            throw ValidationException.forRequest(where + " 'parameters' must be an object");
        }
        return RawOperation.of(kind, mapper.convertValue(parameters, PARAMETERS));
    }

    private ObjectNode writeOperation(RawOperation operation) {
        ObjectNode node = mapper.createObjectNode();
        node.put("operation", operation.kind());
        node.set("parameters", mapper.valueToTree(operation.parameters()));
        return node;
    }

    private static String text(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                if (!value.isValueNode()) {
                    throw ValidationException.forRequest("'" + name + "' must be a plain value");
                }
                return value.asText();
            }
        }
        return null;
    }

    private static void putIfPresent(ObjectNode node, String name, String value) {
        if (value != null) {
            node.put(name, value);
        }
    }
}
