package com.deepansh.codeagent.llm;

import com.deepansh.codeagent.exception.ProviderErrorKind;
import com.deepansh.codeagent.exception.ProviderException;
import com.deepansh.codeagent.model.Message;
import com.deepansh.codeagent.tool.ToolSpec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Shared HTTP plumbing for the provider adapters: one JSON POST per call and a
 * single mapping from transport outcomes to {@link ProviderErrorKind}.
 *
 * | Outcome                          | Kind             |
 * |----------------------------------|------------------|
 * | 401, 403                         | AUTH             |
 * | 429                              | RATE_LIMIT       |
 * | 408, 5xx, 529                    | NETWORK          |
 * | connection / IO failure          | NETWORK          |
 * | other 4xx                        | INVALID_RESPONSE |
 * | unparseable or malformed body    | INVALID_RESPONSE |
 *
 * Retry is not done here; see the resilience decorator.
 */
@Slf4j
public abstract class HttpModelAdapter implements ModelProtocolAdapter {

    private static final int ERROR_BODY_PREVIEW = 500;

    protected final LlmProviderProperties props;
    protected final ObjectMapper objectMapper;
    protected final String providerName;
    private final RestClient restClient;

    protected HttpModelAdapter(LlmProviderProperties props,
                               ObjectMapper objectMapper,
                               String providerName,
                               RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.providerName = providerName;
        RestClient.Builder builder = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE);
        this.restClient = configure(builder).build();
    }

    /** Adds provider-specific auth and version headers */
    protected abstract RestClient.Builder configure(RestClient.Builder builder);

    protected abstract String path();

    protected abstract Map<String, Object> buildRequestBody(List<Message> history, List<ToolSpec> tools);

    protected abstract Message decodeReply(JsonNode body);

    @Override
    public String provider() {
        return providerName;
    }

    @Override
    public Message send(List<Message> history, List<ToolSpec> tools) {
        Map<String, Object> requestBody = buildRequestBody(history, tools);
        log.debug("Sending {} messages and {} tools to {} [model={}]",
                history.size(), tools.size(), providerName, props.getModel());

        String raw = post(requestBody);
        if (raw == null || raw.isBlank()) {
            throw new ProviderException(providerName, ProviderErrorKind.INVALID_RESPONSE, "empty response body");
        }
        log.debug("{} replied with {} chars", providerName, raw.length());

        JsonNode tree;
        try {
            tree = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ProviderException(providerName, ProviderErrorKind.INVALID_RESPONSE,
                    "response is not JSON: " + preview(raw), e);
        }
        return decodeReply(tree);
    }

    private String post(Map<String, Object> requestBody) {
        try {
            return restClient.post()
                    .uri(path())
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        int status = res.getStatusCode().value();
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        ProviderErrorKind kind = classify(status);
                        log.error("{} HTTP {} ({}): {}", providerName, status, kind, preview(body));
                        throw new ProviderException(providerName, kind, "HTTP " + status + ": " + preview(body));
                    })
                    .body(String.class);
        } catch (ResourceAccessException e) {
            log.error("{} network failure: {}", providerName, e.getMessage());
            throw new ProviderException(providerName, ProviderErrorKind.NETWORK, e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ProviderException(providerName, ProviderErrorKind.INVALID_RESPONSE, e.getMessage(), e);
        }
    }

    public static ProviderErrorKind classify(int status) {
        if (status == 401 || status == 403) {
            return ProviderErrorKind.AUTH;
        }
        if (status == 429) {
            return ProviderErrorKind.RATE_LIMIT;
        }
        if (status == 408 || status >= 500) {
            // 529 = overloaded
            return ProviderErrorKind.NETWORK;
        }
        return ProviderErrorKind.INVALID_RESPONSE;
    }

    private static String preview(String body) {
        return body.length() > ERROR_BODY_PREVIEW ? body.substring(0, ERROR_BODY_PREVIEW) + "..." : body;
    }
}
