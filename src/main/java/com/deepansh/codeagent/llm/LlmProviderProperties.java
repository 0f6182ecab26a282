package com.deepansh.codeagent.llm;

import lombok.Data;

/**
 * Holds config for a single model provider.
 * Populated from application.yml under llm.providers.&lt;key&gt;.
 */
@Data
public class LlmProviderProperties {

    /**
     * Wire protocol: openai, openai-compatible or anthropic.
     * When unset it is derived from the provider key.
     */
    private String protocol;

    private String apiKey;
    private String baseUrl;
    private String model;
    private int maxTokens = 4096;

    /** Null leaves the provider default; some reasoning models reject the field */
    private Double temperature;

    /** anthropic-version header */
    private String apiVersion = "2023-06-01";

    /** Extended thinking budget (anthropic); 0 disables thinking */
    private int thinkingBudgetTokens;
}
