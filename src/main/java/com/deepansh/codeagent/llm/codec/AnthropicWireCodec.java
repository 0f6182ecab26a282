package com.deepansh.codeagent.llm.codec;

import com.deepansh.codeagent.model.Message;
import com.deepansh.codeagent.model.ReasoningBlock;
import com.deepansh.codeagent.model.ToolCall;
import com.deepansh.codeagent.tool.ToolSpec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Messages API wire shape.
 *
 * <ul>
 *   <li>system text is lifted out of the history into the top-level {@code system} field</li>
 *   <li>assistant tool calls become {@code tool_use} blocks with an object {@code input}</li>
 *   <li>consecutive tool messages merge into one user turn of {@code tool_result} blocks</li>
 *   <li>{@code thinking} and {@code redacted_thinking} blocks are kept in order and echoed back unchanged</li>
 * </ul>
 * Arguments that never parsed as an object travel as {@code {"_raw_arguments": "..."}}
 * and are restored on decode.
 */
@Slf4j
public class AnthropicWireCodec extends AbstractWireCodec {

    static final String RAW_ARGUMENTS_KEY = "_raw_arguments";

    public AnthropicWireCodec(ObjectMapper objectMapper, String provider) {
        super(objectMapper, provider);
    }

    @Override
    public List<Map<String, Object>> encodeTools(List<ToolSpec> tools) {
        return tools.stream()
                .map(spec -> {
                    Map<String, Object> tool = new LinkedHashMap<>();
                    tool.put("name", spec.getName());
                    tool.put("description", spec.getDescription() == null ? "" : spec.getDescription());
                    tool.put("input_schema", spec.getParameterSchema());
                    return tool;
                })
                .toList();
    }

    /** System messages joined by blank lines; empty when there are none */
    public String encodeSystem(List<Message> history) {
        return history.stream()
                .filter(m -> m.getRole() == Message.Role.system)
                .map(Message::getContent)
                .filter(text -> text != null && !text.isEmpty())
                .collect(Collectors.joining("\n\n"));
    }

    @Override
    public List<Map<String, Object>> encodeMessages(List<Message> history) {
        List<Map<String, Object>> out = new ArrayList<>();
        List<Map<String, Object>> pendingResults = new ArrayList<>();

        for (Message msg : history) {
            if (msg.getRole() == Message.Role.tool) {
                pendingResults.add(encodeToolResult(msg));
                continue;
            }
            flushResults(out, pendingResults);
            switch (msg.getRole()) {
                case user -> out.add(turn("user", List.of(textBlock(msg.getContent()))));
                case assistant -> out.add(turn("assistant", encodeAssistantBlocks(msg)));
                default -> {
                    // system text is sent top-level
                }
            }
        }
        flushResults(out, pendingResults);
        return out;
    }

    private void flushResults(List<Map<String, Object>> out, List<Map<String, Object>> pending) {
        if (!pending.isEmpty()) {
            out.add(turn("user", List.copyOf(pending)));
            pending.clear();
        }
    }

    private List<Map<String, Object>> encodeAssistantBlocks(Message msg) {
        List<Map<String, Object>> blocks = new ArrayList<>();
        if (msg.getReasoningBlocks() != null) {
            for (ReasoningBlock reasoning : msg.getReasoningBlocks()) {
                Map<String, Object> block = encodeReasoning(reasoning);
                if (block != null) {
                    blocks.add(block);
                }
            }
        }
        if (msg.getContent() != null && !msg.getContent().isEmpty()) {
            blocks.add(textBlock(msg.getContent()));
        }
        if (msg.hasToolCalls()) {
            for (ToolCall call : msg.getToolCalls()) {
                Map<String, Object> use = new LinkedHashMap<>();
                use.put("type", "tool_use");
                use.put("id", call.getId());
                use.put("name", call.getToolName());
                use.put("input", call.hasMalformedArguments()
                        ? Map.of(RAW_ARGUMENTS_KEY, call.getRawArguments())
                        : call.getArguments());
                blocks.add(use);
            }
        }
        if (blocks.isEmpty()) {
            blocks.add(textBlock(""));
        }
        return blocks;
    }

    // Unsigned thinking cannot be replayed, so it is left out
    private static Map<String, Object> encodeReasoning(ReasoningBlock reasoning) {
        Map<String, Object> block = new LinkedHashMap<>();
        if (reasoning.isRedacted()) {
            if (reasoning.data() == null) {
                return null;
            }
            block.put("type", ReasoningBlock.REDACTED);
            block.put("data", reasoning.data());
            return block;
        }
        if (reasoning.signature() == null) {
            return null;
        }
        block.put("type", ReasoningBlock.THINKING);
        block.put("thinking", reasoning.thinking() != null ? reasoning.thinking() : "");
        block.put("signature", reasoning.signature());
        return block;
    }

    private Map<String, Object> encodeToolResult(Message msg) {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("type", "tool_result");
        block.put("tool_use_id", msg.getToolCallId());
        block.put("content", msg.getContent() != null ? msg.getContent() : "");
        block.put("is_error", msg.isError());
        return block;
    }

    private static Map<String, Object> turn(String role, List<Map<String, Object>> content) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("role", role);
        m.put("content", content);
        return m;
    }

    private static Map<String, Object> textBlock(String text) {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("type", "text");
        block.put("text", text != null ? text : "");
        return block;
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
            JsonNode content = node.get("content");
            switch (role) {
                case "assistant" -> {
                    Message decoded = decodeAssistant(content);
                    rememberCalls(namesById, decoded.getToolCalls());
                    messages.add(decoded);
                }
                case "user" -> messages.addAll(decodeUserTurn(content, namesById));
                default -> throw invalid("unknown message role '" + role + "'");
            }
        }
        return messages;
    }

    private List<Message> decodeUserTurn(JsonNode content, Map<String, String> namesById) {
        if (content == null || !content.isArray()) {
            return List.of(Message.user(coerceText(content)));
        }
        List<Message> out = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        for (JsonNode block : content) {
            String type = block.path("type").asText();
            if ("tool_result".equals(type)) {
                String callId = textOrNull(block.get("tool_use_id"));
                out.add(toolMessage(callId, namesById.get(callId), coerceText(block.get("content")),
                        block.path("is_error").asBoolean(false)).build());
            } else if ("text".equals(type)) {
                text.append(block.path("text").asText(""));
            }
        }
        if (out.isEmpty() || text.length() > 0) {
            out.add(Message.user(text.toString()));
        }
        return out;
    }

    @Override
    public Message decodeReply(JsonNode responseBody) {
        if (responseBody == null || !responseBody.isObject()) {
            throw invalid("response body is not an object");
        }
        JsonNode content = responseBody.get("content");
        if (content == null || !content.isArray()) {
            throw invalid("response has no content array");
        }
        JsonNode usage = responseBody.get("usage");
        if (usage != null) {
            log.debug("{} token usage: input={} output={} stop_reason={}", provider,
                    usage.path("input_tokens").asInt(), usage.path("output_tokens").asInt(),
                    responseBody.path("stop_reason").asText());
        }
        return decodeAssistant(content);
    }

    private Message decodeAssistant(JsonNode content) {
        if (content == null || !content.isArray()) {
            return Message.assistant(coerceText(content));
        }
        StringBuilder text = new StringBuilder();
        StringBuilder reasoning = new StringBuilder();
        List<ReasoningBlock> reasoningBlocks = new ArrayList<>();
        List<ToolCall> calls = new ArrayList<>();

        for (JsonNode block : content) {
            switch (block.path("type").asText()) {
                case "text" -> text.append(block.path("text").asText(""));
                case ReasoningBlock.THINKING -> {
                    String thinking = block.path("thinking").asText("");
                    if (reasoning.length() > 0) {
                        reasoning.append('\n');
                    }
                    reasoning.append(thinking);
                    reasoningBlocks.add(ReasoningBlock.thinking(thinking, textOrNull(block.get("signature"))));
                }
                case ReasoningBlock.REDACTED -> reasoningBlocks.add(ReasoningBlock.redacted(textOrNull(block.get("data"))));
                case "tool_use" -> calls.add(decodeToolUse(block));
                default -> log.debug("Ignoring {} content block of type '{}'", provider, block.path("type").asText());
            }
        }

        return Message.builder()
                .role(Message.Role.assistant)
                .content(text.toString())
                .reasoning(reasoning.length() == 0 ? null : reasoning.toString())
                .reasoningBlocks(reasoningBlocks.isEmpty() ? null : List.copyOf(reasoningBlocks))
                .toolCalls(calls.isEmpty() ? null : List.copyOf(calls))
                .build();
    }

    private ToolCall decodeToolUse(JsonNode block) {
        String name = textOrNull(block.get("name"));
        if (name == null) {
            throw invalid("tool_use block without a name");
        }
        String id = idOrGenerated(block.get("id"));
        JsonNode input = block.get("input");

        if (input == null || input.isNull()) {
            return ToolCall.builder().id(id).toolName(name).arguments(Map.of()).build();
        }
        if (!input.isObject()) {
            return ToolCall.builder().id(id).toolName(name).rawArguments(input.toString()).build();
        }
        if (input.size() == 1 && input.has(RAW_ARGUMENTS_KEY)) {
            return ToolCall.builder().id(id).toolName(name).rawArguments(input.get(RAW_ARGUMENTS_KEY).asText()).build();
        }
        return ToolCall.builder().id(id).toolName(name).arguments(toMap(input)).build();
    }
}
