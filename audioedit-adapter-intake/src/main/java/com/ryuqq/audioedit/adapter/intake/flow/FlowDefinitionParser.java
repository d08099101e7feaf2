package com.ryuqq.audioedit.adapter.intake.flow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.audioedit.adapter.intake.codec.JsonCodecs;
import com.ryuqq.audioedit.core.exception.ValidationException;
import com.ryuqq.audioedit.core.model.OperationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads {@link FlowDefinition} files.
 *
 * <p>The format follows the file extension: {@code .json} for JSON, {@code .yaml} or
 * {@code .yml} for YAML. Step types are checked against {@link OperationKind} here so a broken
 * flow file is reported with its step label before anything is submitted. Parameter checks are
 * left to the interpreter.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class FlowDefinitionParser {

    private static final Logger log = LoggerFactory.getLogger(FlowDefinitionParser.class);

    /**
     * Supported file formats.
     */
    public enum Format {
        JSON,
        YAML
    }

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public FlowDefinitionParser() {
        this(JsonCodecs.jsonMapper(), JsonCodecs.yamlMapper());
    }

    public FlowDefinitionParser(ObjectMapper jsonMapper, ObjectMapper yamlMapper) {
        if (jsonMapper == null) {
            throw new IllegalArgumentException("jsonMapper cannot be null");
        }
        if (yamlMapper == null) {
            throw new IllegalArgumentException("yamlMapper cannot be null");
        }
        this.jsonMapper = jsonMapper;
        this.yamlMapper = yamlMapper;
    }

    /**
     * Parses a flow file.
     *
     * @param file path ending in .json, .yaml or .yml
     * @return the validated definition
     * @throws IOException if the file cannot be read
     * @throws ValidationException if the extension is unknown or the content is invalid
     */
    public FlowDefinition parse(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("file cannot be null");
        }
        Format format = formatOf(file);
        String content = Files.readString(file, StandardCharsets.UTF_8);
        FlowDefinition definition = parse(content, format);
        log.debug("Loaded flow '{}' from {} ({} step(s))",
            definition.workflowName(), file, definition.steps().size());
        return definition;
    }

    /**
     * Parses flow content in the given format.
     *
     * @throws ValidationException if the content is malformed or names an unknown step type
     */
    public FlowDefinition parse(String content, Format format) {
        if (content == null || content.isBlank()) {
            throw ValidationException.forRequest("flow definition is empty");
        }
        if (format == null) {
            throw new IllegalArgumentException("format cannot be null");
        }
        ObjectMapper mapper = format == Format.YAML ? yamlMapper : jsonMapper;
        FlowDefinition definition;
        try {
            definition = mapper.readValue(content, FlowDefinition.class);
        } catch (JsonProcessingException e) {
            throw ValidationException.forRequest("flow definition is malformed: " + e.getOriginalMessage());
        }
        if (definition == null) {
            throw ValidationException.forRequest("flow definition is empty");
        }
        validate(definition);
        return definition;
    }

    private static void validate(FlowDefinition definition) {
        if (definition.workflowName() == null || definition.workflowName().isBlank()) {
            throw ValidationException.forRequest("flow definition requires 'workflow_name'");
        }
        if (definition.steps().isEmpty()) {
            throw ValidationException.forRequest(
                "flow '" + definition.workflowName() + "' has no steps");
        }
        for (int i = 0; i < definition.steps().size(); i++) {
            FlowStep step = definition.steps().get(i);
            if (step == null) {
                throw ValidationException.forRequest("flow step " + i + " is empty");
            }
            if (OperationKind.fromWireName(step.type()).isEmpty()) {
                throw new ValidationException(i, step.type(), null,
                    "flow step '" + step.label() + "' has unknown type '" + step.type() + "'");
            }
        }
    }

    private static Format formatOf(Path file) {
        Path fileName = file.getFileName();
        String name = fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".json")) {
            return Format.JSON;
        }
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return Format.YAML;
        }
        throw ValidationException.forRequest("unsupported flow file type: " + file);
    }
}
