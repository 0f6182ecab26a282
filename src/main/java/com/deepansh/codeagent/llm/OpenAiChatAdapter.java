package com.deepansh.codeagent.llm;

import com.deepansh.codeagent.llm.codec.OpenAiWireCodec;
import com.deepansh.codeagent.model.Message;
import com.deepansh.codeagent.tool.ToolSpec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI Chat Completions. Uses {@code max_completion_tokens}; reasoning is not
 * exposed on this wire.
 */
public class OpenAiChatAdapter extends HttpModelAdapter {

    private final OpenAiWireCodec codec;

    public OpenAiChatAdapter(LlmProviderProperties props,
                             ObjectMapper objectMapper,
                             String providerName,
                             RestClient.Builder restClientBuilder) {
        this(props, objectMapper, providerName, restClientBuilder, false);
    }

    protected OpenAiChatAdapter(LlmProviderProperties props,
                                ObjectMapper objectMapper,
                                String providerName,
                                RestClient.Builder restClientBuilder,
                                boolean reasoningContent) {
        super(props, objectMapper, providerName, restClientBuilder);
        this.codec = new OpenAiWireCodec(objectMapper, providerName, reasoningContent);
    }

    public OpenAiWireCodec codec() {
        return codec;
    }

    @Override
    protected RestClient.Builder configure(RestClient.Builder builder) {
        return builder.defaultHeader("Authorization", "Bearer " + props.getApiKey());
    }

    @Override
    protected String path() {
        return "/chat/completions";
    }

    /** Name of the output token limit field */
    protected String tokenLimitField() {
        return "max_completion_tokens";
    }

    @Override
    protected Map<String, Object> buildRequestBody(List<Message> history, List<ToolSpec> tools) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", props.getModel());
        body.put("messages", codec.encodeMessages(history));
        if (props.getMaxTokens() > 0) {
            body.put(tokenLimitField(), props.getMaxTokens());
        }
        if (props.getTemperature() != null) {
            body.put("temperature", props.getTemperature());
        }
        if (!tools.isEmpty()) {
            body.put("tools", codec.encodeTools(tools));
            body.put("tool_choice", "auto");
        }
        return body;
    }

    @Override
    protected Message decodeReply(JsonNode body) {
        return codec.decodeReply(body);
    }
}
