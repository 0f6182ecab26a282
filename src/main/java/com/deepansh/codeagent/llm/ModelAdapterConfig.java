package com.deepansh.codeagent.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.util.Locale;

/**
 * Creates the provider adapter selected by {@code llm.provider}.
 * The choice is made once here; the loop never branches on provider.
 */
@Configuration
@Slf4j
public class ModelAdapterConfig {

    private final LlmProperties llmProperties;

    public ModelAdapterConfig(LlmProperties llmProperties) {
        this.llmProperties = llmProperties;
    }

    @PostConstruct
    public void logActiveProvider() {
        LlmProviderProperties active = llmProperties.getProviders().get(llmProperties.getProvider());
        log.info("================================================================");
        log.info("  Active LLM Provider : {}", llmProperties.getProvider().toUpperCase(Locale.ROOT));
        log.info("  Protocol            : {}", active == null ? "-" : protocolOf(llmProperties.getProvider(), active));
        log.info("  Model               : {}", active == null ? "-" : active.getModel());
        log.info("================================================================");
    }

    /**
     * The raw provider adapter. Wrapped by ResilientModelAdapter, which is the
     * bean the rest of the application receives.
     */
    @Bean("providerModelAdapter")
    public ModelProtocolAdapter providerModelAdapter(ObjectMapper objectMapper, RestClient.Builder builder) {
        String provider = llmProperties.getProvider();
        LlmProviderProperties props = llmProperties.active();
        logKey(provider, props.getApiKey());

        return switch (protocolOf(provider, props)) {
            case "openai" -> new OpenAiChatAdapter(props, objectMapper, provider, builder.clone());
            case "anthropic" -> new AnthropicMessagesAdapter(props, objectMapper, provider, builder.clone());
            case "openai-compatible" -> new OpenAiCompatibleChatAdapter(props, objectMapper, provider, builder.clone());
            default -> throw new IllegalStateException("Unsupported protocol '" + props.getProtocol()
                    + "' for provider " + provider + ". Use openai, openai-compatible or anthropic.");
        };
    }

    static String protocolOf(String provider, LlmProviderProperties props) {
        if (props.getProtocol() != null && !props.getProtocol().isBlank()) {
            return props.getProtocol().trim().toLowerCase(Locale.ROOT);
        }
        return switch (provider.toLowerCase(Locale.ROOT)) {
            case "openai" -> "openai";
            case "anthropic" -> "anthropic";
            default -> "openai-compatible";
        };
    }

    private void logKey(String provider, String key) {
        String envVar = provider.toUpperCase(Locale.ROOT).replace('-', '_') + "_API_KEY";
        if (key == null || key.isBlank()) {
            log.error("  {} API key not set! Set env var: {}={your-key}", provider, envVar);
        } else {
            log.info("  Key: {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
