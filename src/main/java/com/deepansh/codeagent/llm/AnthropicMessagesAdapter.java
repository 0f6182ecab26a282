package com.deepansh.codeagent.llm;

import com.deepansh.codeagent.llm.codec.AnthropicWireCodec;
import com.deepansh.codeagent.model.Message;
import com.deepansh.codeagent.tool.ToolSpec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API.
 *
 * With a thinking budget configured, extended thinking is enabled and
 * temperature is omitted (the API rejects it together with thinking).
 * {@code max_tokens} must exceed the budget, so it is widened when needed.
 */
@Slf4j
public class AnthropicMessagesAdapter extends HttpModelAdapter {

    private final AnthropicWireCodec codec;

    public AnthropicMessagesAdapter(LlmProviderProperties props,
                                    ObjectMapper objectMapper,
                                    String providerName,
                                    RestClient.Builder restClientBuilder) {
        super(props, objectMapper, providerName, restClientBuilder);
        this.codec = new AnthropicWireCodec(objectMapper, providerName);
    }

    public AnthropicWireCodec codec() {
        return codec;
    }

    @Override
    protected RestClient.Builder configure(RestClient.Builder builder) {
        return builder
                .defaultHeader("x-api-key", props.getApiKey())
                .defaultHeader("anthropic-version", props.getApiVersion());
    }

    @Override
    protected String path() {
        return "/messages";
    }

    @Override
    protected Map<String, Object> buildRequestBody(List<Message> history, List<ToolSpec> tools) {
        int budget = props.getThinkingBudgetTokens();
        int maxTokens = props.getMaxTokens() > 0 ? props.getMaxTokens() : 4096;
        if (budget > 0 && maxTokens <= budget) {
            log.debug("max_tokens {} does not exceed thinking budget {}; widening", maxTokens, budget);
            maxTokens = budget + maxTokens;
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", maxTokens);

        String system = codec.encodeSystem(history);
        if (!system.isBlank()) {
            body.put("system", system);
        }
        body.put("messages", codec.encodeMessages(history));
        if (!tools.isEmpty()) {
            body.put("tools", codec.encodeTools(tools));
        }

        if (budget > 0) {
            body.put("thinking", Map.of("type", "enabled", "budget_tokens", budget));
        } else if (props.getTemperature() != null) {
            body.put("temperature", props.getTemperature());
        }
        return body;
    }

    @Override
    protected Message decodeReply(JsonNode body) {
        return codec.decodeReply(body);
    }
}
