package com.deepansh.codeagent.llm.codec;

import com.deepansh.codeagent.exception.ProviderErrorKind;
import com.deepansh.codeagent.exception.ProviderException;
import com.deepansh.codeagent.model.Message;
import com.deepansh.codeagent.model.ToolCall;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Helpers shared by the codecs: text coercion, argument parsing and call id
 * generation.
 */
public abstract class AbstractWireCodec implements WireCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    protected final ObjectMapper objectMapper;
    protected final String provider;

    protected AbstractWireCodec(ObjectMapper objectMapper, String provider) {
        this.objectMapper = objectMapper;
        this.provider = provider;
    }

    /** Strings pass through; arrays of {@code {type:text,text}} parts are concatenated */
    protected static String coerceText(JsonNode content) {
        if (content == null || content.isNull() || content.isMissingNode()) {
            return "";
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            StringBuilder text = new StringBuilder();
            for (JsonNode part : content) {
                if ("text".equals(part.path("type").asText())) {
                    text.append(part.path("text").asText(""));
                }
            }
            return text.toString();
        }
        return content.toString();
    }

    protected static String textOrNull(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() ? null : node.asText();
    }

    protected static String newCallId() {
        return "call_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    protected static String idOrGenerated(JsonNode id) {
        String value = textOrNull(id);
        return value == null || value.isBlank() ? newCallId() : value;
    }

    /**
     * Builds a ToolCall from an argument string. Anything that is not a JSON
     * object is kept verbatim in {@code rawArguments}.
     */
    protected ToolCall callFromArgumentString(String id, String name, String raw) {
        if (raw == null || raw.isBlank()) {
            return ToolCall.builder().id(id).toolName(name).arguments(Map.of()).build();
        }
        JsonNode parsed;
        try {
            parsed = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return ToolCall.builder().id(id).toolName(name).rawArguments(raw).build();
        }
        if (parsed == null || !parsed.isObject()) {
            return ToolCall.builder().id(id).toolName(name).rawArguments(raw).build();
        }
        return ToolCall.builder().id(id).toolName(name).arguments(toMap(parsed)).build();
    }

    protected Map<String, Object> toMap(JsonNode objectNode) {
        return objectMapper.convertValue(objectNode, MAP_TYPE);
    }

    protected String argumentsAsJson(ToolCall call) {
        if (call.hasMalformedArguments()) {
            return call.getRawArguments();
        }
        try {
            return objectMapper.writeValueAsString(call.getArguments());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("tool arguments are not serializable", e);
        }
    }

    /** Tool name per call id, so decoded tool messages get their name back */
    protected static void rememberCalls(Map<String, String> namesById, List<ToolCall> calls) {
        if (calls != null) {
            calls.forEach(call -> namesById.put(call.getId(), call.getToolName()));
        }
    }

    protected static Map<String, String> newCallIndex() {
        return new HashMap<>();
    }

    /** Tool outputs carry no structured error flag on the OpenAI wire; failures are prefixed */
    protected static boolean looksLikeError(String output) {
        return output != null && output.startsWith("ERROR: ");
    }

    protected static Message.MessageBuilder toolMessage(String callId, String name, String output, boolean error) {
        return Message.builder()
                .role(Message.Role.tool)
                .toolCallId(callId)
                .name(name)
                .content(output)
                .error(error);
    }

    protected ProviderException invalid(String detail) {
        return new ProviderException(provider, ProviderErrorKind.INVALID_RESPONSE, detail);
    }
}
