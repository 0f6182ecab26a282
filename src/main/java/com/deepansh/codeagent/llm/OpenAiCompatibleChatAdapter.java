package com.deepansh.codeagent.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.client.RestClient;

/**
 * Chat Completions clones (Kimi, DeepSeek, Groq and other OpenAI-compatible
 * endpoints). Same wire shape with {@code max_tokens}; thinking models return
 * {@code reasoning_content}, which is read as reasoning and echoed back on
 * assistant history messages.
 */
public class OpenAiCompatibleChatAdapter extends OpenAiChatAdapter {

    public OpenAiCompatibleChatAdapter(LlmProviderProperties props,
                                       ObjectMapper objectMapper,
                                       String providerName,
                                       RestClient.Builder restClientBuilder) {
        super(props, objectMapper, providerName, restClientBuilder, true);
    }

    @Override
    protected String tokenLimitField() {
        return "max_tokens";
    }
}
