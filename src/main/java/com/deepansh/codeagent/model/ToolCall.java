package com.deepansh.codeagent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single tool invocation requested by the model. Immutable.
 *
 * Arguments are normalized to a keyed map regardless of how the provider
 * encoded them. When the provider sent something that does not parse as a
 * JSON object, {@code arguments} is empty and {@code rawArguments} keeps the
 * original text so schema validation can reject it with a useful message.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolCall {

    /** ID assigned by the provider; echoed back on the matching tool message */
    String id;

    String toolName;

    Map<String, Object> arguments;

    String rawArguments;

    private ToolCall(String id, String toolName, Map<String, Object> arguments, String rawArguments) {
        this.id = id;
        this.toolName = toolName;
        this.arguments = arguments == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        this.rawArguments = rawArguments;
    }

    @JsonIgnore
    public boolean hasMalformedArguments() {
        return rawArguments != null;
    }
}
