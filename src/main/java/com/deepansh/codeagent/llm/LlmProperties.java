package com.deepansh.codeagent.llm;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bound from application.yml under the "llm" prefix.
 * {@code provider} selects one entry of {@code providers}.
 */
@Component
@ConfigurationProperties(prefix = "llm")
@Data
public class LlmProperties {

    private String provider = "openai";

    /** Response timeout for a single model call */
    private int timeoutSeconds = 120;

    private Map<String, LlmProviderProperties> providers = new LinkedHashMap<>();

    public LlmProviderProperties active() {
        LlmProviderProperties props = providers.get(provider);
        if (props == null) {
            throw new IllegalStateException("No configuration for llm provider '" + provider
                    + "'. Configured providers: " + providers.keySet());
        }
        return props;
    }
}
