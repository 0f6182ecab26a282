package com.deepansh.codeagent.tool;

import com.deepansh.codeagent.model.ToolCall;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Validates tool-call arguments against the tool's declared JSON Schema (draft 7).
 * Compiled schemas are cached per tool name; specs never change after startup.
 */
@Component
public class ToolSchemaValidator {

    private static final int RAW_PREVIEW_CHARS = 200;

    private final ObjectMapper objectMapper;
    private final JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
    private final Map<String, JsonSchema> compiled = new ConcurrentHashMap<>();

    public ToolSchemaValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return human-readable violations; empty when the arguments are valid
     */
    public List<String> validate(ToolSpec spec, ToolCall call) {
        if (call.hasMalformedArguments()) {
            String raw = call.getRawArguments();
            String preview = raw.length() > RAW_PREVIEW_CHARS ? raw.substring(0, RAW_PREVIEW_CHARS) + "..." : raw;
            return List.of("arguments are not a valid JSON object: " + preview);
        }

        JsonSchema schema = compiled.computeIfAbsent(spec.getName(),
                name -> factory.getSchema(objectMapper.valueToTree(spec.getParameterSchema())));
        JsonNode arguments = objectMapper.valueToTree(call.getArguments());

        Set<ValidationMessage> messages = schema.validate(arguments);
        return messages.stream()
                .map(ValidationMessage::getMessage)
                .sorted()
                .toList();
    }
}
