package com.deepansh.codeagent.llm.codec;

import com.deepansh.codeagent.model.Message;
import com.deepansh.codeagent.model.ToolCall;
import com.deepansh.codeagent.tool.ToolSpec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat Completions wire shape.
 *
 * Tools go out as {@code {"type":"function","function":{name,description,parameters}}},
 * tool results as {@code role=tool} messages, and tool call arguments as a JSON string.
 * With {@code reasoningContent} enabled the codec also reads {@code reasoning_content}
 * from replies and echoes it on assistant history messages.
 */
@Slf4j
public class OpenAiWireCodec extends AbstractWireCodec {

    private final boolean reasoningContent;

    public OpenAiWireCodec(ObjectMapper objectMapper, String provider, boolean reasoningContent) {
        super(objectMapper, provider);
        this.reasoningContent = reasoningContent;
    }

    @Override
    public List<Map<String, Object>> encodeTools(List<ToolSpec> tools) {
        return tools.stream()
                .map(spec -> {
                    Map<String, Object> function = new LinkedHashMap<>();
                    function.put("name", spec.getName());
                    function.put("description", spec.getDescription() == null ? "" : spec.getDescription());
                    function.put("parameters", spec.getParameterSchema());
                    Map<String, Object> tool = new LinkedHashMap<>();
                    tool.put("type", "function");
                    tool.put("function", function);
                    return tool;
                })
                .toList();
    }

    @Override
    public List<Map<String, Object>> encodeMessages(List<Message> history) {
        return history.stream().map(this::encodeMessage).toList();
    }

    private Map<String, Object> encodeMessage(Message msg) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("role", msg.getRole().name());

        switch (msg.getRole()) {
            case tool -> {
                m.put("tool_call_id", msg.getToolCallId());
                m.put("content", msg.getContent() != null ? msg.getContent() : "");
            }
            case assistant -> {
                // An assistant turn with tool calls must carry them so results can be correlated
                m.put("content", msg.getContent() != null ? msg.getContent() : "");
                if (reasoningContent && msg.getReasoning() != null) {
                    m.put("reasoning_content", msg.getReasoning());
                }
                if (msg.hasToolCalls()) {
                    m.put("tool_calls", msg.getToolCalls().stream().map(this::encodeCall).toList());
                }
            }
            default -> m.put("content", msg.getContent() != null ? msg.getContent() : "");
        }
        return m;
    }

    private Map<String, Object> encodeCall(ToolCall call) {
        Map<String, Object> function = new LinkedHashMap<>();
        function.put("name", call.getToolName());
        function.put("arguments", argumentsAsJson(call));
        Map<String, Object> tc = new LinkedHashMap<>();
        tc.put("id", call.getId());
        tc.put("type", "function");
        tc.put("function", function);
        return tc;
    }

    @Override
    public List<Message> decodeMessages(JsonNode wireMessages) {
        if (wireMessages == null || !wireMessages.isArray()) {
            throw invalid("messages must be an array");
        }
        Map<String, String> namesById = newCallIndex();
        List<Message> messages = new ArrayList<>();
        for (JsonNode node : wireMessages) {
            String role = node.path("role").asText("");
            Message decoded = switch (role) {
                case "system" -> Message.system(coerceText(node.get("content")));
                case "user" -> Message.user(coerceText(node.get("content")));
                case "assistant" -> decodeAssistant(node);
                case "tool" -> {
                    String callId = textOrNull(node.get("tool_call_id"));
                    String output = coerceText(node.get("content"));
                    yield toolMessage(callId, namesById.get(callId), output, looksLikeError(output)).build();
                }
                default -> throw invalid("unknown message role '" + role + "'");
            };
            rememberCalls(namesById, decoded.getToolCalls());
            messages.add(decoded);
        }
        return messages;
    }

    @Override
    public Message decodeReply(JsonNode responseBody) {
        JsonNode choices = responseBody == null ? null : responseBody.get("choices");
        if (choices == null || !choices.isArray() || choices.isEmpty()) {
            throw invalid("response has no choices");
        }
        JsonNode choice = choices.get(0);
        JsonNode message = choice.get("message");
        if (message == null || !message.isObject()) {
            throw invalid("first choice has no message object");
        }

        JsonNode usage = responseBody.get("usage");
        if (usage != null) {
            log.debug("{} token usage: prompt={} completion={} finish_reason={}", provider,
                    usage.path("prompt_tokens").asInt(), usage.path("completion_tokens").asInt(),
                    choice.path("finish_reason").asText());
        }
        return decodeAssistant(message);
    }

    private Message decodeAssistant(JsonNode node) {
        List<ToolCall> calls = new ArrayList<>();
        JsonNode rawCalls = node.get("tool_calls");
        if (rawCalls != null && !rawCalls.isNull()) {
            if (!rawCalls.isArray()) {
                throw invalid("tool_calls must be an array");
            }
            for (JsonNode rawCall : rawCalls) {
                JsonNode function = rawCall.get("function");
                if (function == null || !function.isObject() || textOrNull(function.get("name")) == null) {
                    throw invalid("tool call without a function name");
                }
                calls.add(decodeCall(idOrGenerated(rawCall.get("id")), function));
            }
        }

        String reasoning = reasoningContent ? textOrNull(node.get("reasoning_content")) : null;
        return Message.builder()
                .role(Message.Role.assistant)
                .content(coerceText(node.get("content")))
                .reasoning(reasoning == null || reasoning.isEmpty() ? null : reasoning)
                .toolCalls(calls.isEmpty() ? null : List.copyOf(calls))
                .build();
    }

    private ToolCall decodeCall(String id, JsonNode function) {
        String name = function.get("name").asText();
        JsonNode arguments = function.get("arguments");
        if (arguments != null && arguments.isObject()) {
            return ToolCall.builder().id(id).toolName(name).arguments(toMap(arguments)).build();
        }
        return callFromArgumentString(id, name, textOrNull(arguments));
    }
}
