package com.deepansh.codeagent.llm;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ModelAdapterConfigTest {

    @Test
    void protocol_isDerivedFromProviderKeyUnlessSet() {
        LlmProviderProperties props = new LlmProviderProperties();

        assertThat(ModelAdapterConfig.protocolOf("openai", props)).isEqualTo("openai");
        assertThat(ModelAdapterConfig.protocolOf("Anthropic", props)).isEqualTo("anthropic");
        assertThat(ModelAdapterConfig.protocolOf("kimi", props)).isEqualTo("openai-compatible");

        props.setProtocol(" Anthropic ");
        assertThat(ModelAdapterConfig.protocolOf("proxy", props)).isEqualTo("anthropic");
    }
}
