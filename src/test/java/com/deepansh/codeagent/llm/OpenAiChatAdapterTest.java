package com.deepansh.codeagent.llm;

import com.deepansh.codeagent.exception.ProviderErrorKind;
import com.deepansh.codeagent.exception.ProviderException;
import com.deepansh.codeagent.model.Message;
import com.deepansh.codeagent.model.ToolCall;
import com.deepansh.codeagent.tool.ToolSpec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withRawStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenAiChatAdapterTest {

    private static final String URL = "https://llm.test/v1/chat/completions";

    private final ObjectMapper mapper = new ObjectMapper();
    private final ToolSpec readFile = ToolSpec.builder()
            .name("read_file")
            .description("Read a file")
            .parameterSchema(Map.of("type", "object"))
            .handler((args, ctx) -> "")
            .build();

    private LlmProviderProperties props;
    private RestClient.Builder builder;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        props = new LlmProviderProperties();
        props.setApiKey("sk-test");
        props.setBaseUrl("https://llm.test/v1");
        props.setModel("gpt-test");
        builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
    }

    @Test
    void send_encodesRequest_andDecodesToolCalls() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer sk-test"))
                .andExpect(jsonPath("$.model").value("gpt-test"))
                .andExpect(jsonPath("$.max_completion_tokens").value(4096))
                .andExpect(jsonPath("$.temperature").doesNotExist())
                .andExpect(jsonPath("$.tools[0].function.name").value("read_file"))
                .andExpect(jsonPath("$.tool_choice").value("auto"))
                .andExpect(jsonPath("$.messages[2].tool_calls[0].function.arguments").value("{\"path\":\"a.txt\"}"))
                .andExpect(jsonPath("$.messages[3].tool_call_id").value("call_1"))
                .andRespond(withSuccess("""
                        {"choices": [{"message": {"role": "assistant", "content": null,
                          "tool_calls": [{"id": "call_2", "type": "function",
                            "function": {"name": "read_file", "arguments": "{\\"path\\": \\"b.txt\\"}"}}]},
                          "finish_reason": "tool_calls"}],
                         "usage": {"prompt_tokens": 10, "completion_tokens": 5}}
                        """, MediaType.APPLICATION_JSON));

        OpenAiChatAdapter adapter = new OpenAiChatAdapter(props, mapper, "openai", builder);
        List<Message> history = List.of(
                Message.system("sys"),
                Message.user("read it"),
                Message.builder().role(Message.Role.assistant).content("")
                        .toolCalls(List.of(ToolCall.builder().id("call_1").toolName("read_file")
                                .arguments(Map.of("path", "a.txt")).build()))
                        .build(),
                Message.builder().role(Message.Role.tool).toolCallId("call_1").name("read_file").content("hello").build());

        Message reply = adapter.send(history, List.of(readFile));

        server.verify();
        assertThat(reply.getRole()).isEqualTo(Message.Role.assistant);
        assertThat(reply.getContent()).isEmpty();
        assertThat(reply.getToolCalls()).singleElement().satisfies(call -> {
            assertThat(call.getId()).isEqualTo("call_2");
            assertThat(call.getToolName()).isEqualTo("read_file");
            assertThat(call.getArguments()).containsEntry("path", "b.txt");
        });
    }

    @Test
    void malformedArguments_areKeptRaw_andMissingIdIsGenerated() {
        server.expect(requestTo(URL)).andRespond(withSuccess("""
                {"choices": [{"message": {"role": "assistant", "content": "",
                  "tool_calls": [{"type": "function", "function": {"name": "read_file", "arguments": "{broken"}}]}}]}
                """, MediaType.APPLICATION_JSON));

        Message reply = new OpenAiChatAdapter(props, mapper, "openai", builder).send(List.of(Message.user("x")), List.of());

        ToolCall call = reply.getToolCalls().get(0);
        assertThat(call.hasMalformedArguments()).isTrue();
        assertThat(call.getRawArguments()).isEqualTo("{broken");
        assertThat(call.getId()).matches("call_[0-9a-f]{12}");
    }

    @Test
    void httpStatuses_mapToErrorKinds() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED).body("{\"error\":\"bad key\"}"));
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
        server.expect(requestTo(URL)).andRespond(withRawStatus(529));
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.BAD_REQUEST));

        OpenAiChatAdapter adapter = new OpenAiChatAdapter(props, mapper, "openai", builder);
        List<Message> history = List.of(Message.user("x"));

        assertKind(adapter, history, ProviderErrorKind.AUTH);
        assertKind(adapter, history, ProviderErrorKind.RATE_LIMIT);
        assertKind(adapter, history, ProviderErrorKind.NETWORK);
        assertKind(adapter, history, ProviderErrorKind.INVALID_RESPONSE);
    }

    @Test
    void unparseableOrStructurallyWrongBody_isInvalidResponse() {
        server.expect(requestTo(URL)).andRespond(withSuccess("<html>oops</html>", MediaType.TEXT_HTML));
        server.expect(requestTo(URL)).andRespond(withSuccess("{\"choices\": []}", MediaType.APPLICATION_JSON));

        OpenAiChatAdapter adapter = new OpenAiChatAdapter(props, mapper, "openai", builder);

        assertKind(adapter, List.of(Message.user("x")), ProviderErrorKind.INVALID_RESPONSE);
        assertKind(adapter, List.of(Message.user("x")), ProviderErrorKind.INVALID_RESPONSE);
    }

    @Test
    void compatibleAdapter_sendsMaxTokensAndEchoesReasoning() {
        props.setTemperature(0.2);
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.max_tokens").value(4096))
                .andExpect(jsonPath("$.max_completion_tokens").doesNotExist())
                .andExpect(jsonPath("$.temperature").value(0.2))
                .andExpect(jsonPath("$.tools").doesNotExist())
                .andExpect(jsonPath("$.messages[1].reasoning_content").value("earlier thought"))
                .andRespond(withSuccess("""
                        {"choices": [{"message": {"role": "assistant", "content": "answer",
                          "reasoning_content": "thinking hard"}}]}
                        """, MediaType.APPLICATION_JSON));

        OpenAiCompatibleChatAdapter adapter = new OpenAiCompatibleChatAdapter(props, mapper, "kimi", builder);
        Message reply = adapter.send(List.of(
                Message.user("q"),
                Message.builder().role(Message.Role.assistant).content("a").reasoning("earlier thought").build(),
                Message.user("q2")), List.of());

        assertThat(reply.getContent()).isEqualTo("answer");
        assertThat(reply.getReasoning()).isEqualTo("thinking hard");
        assertThat(adapter.provider()).isEqualTo("kimi");
    }

    @Test
    void classify_coversStatusTable() {
        assertThat(HttpModelAdapter.classify(403)).isEqualTo(ProviderErrorKind.AUTH);
        assertThat(HttpModelAdapter.classify(408)).isEqualTo(ProviderErrorKind.NETWORK);
        assertThat(HttpModelAdapter.classify(503)).isEqualTo(ProviderErrorKind.NETWORK);
        assertThat(HttpModelAdapter.classify(404)).isEqualTo(ProviderErrorKind.INVALID_RESPONSE);
    }

    private static void assertKind(OpenAiChatAdapter adapter, List<Message> history, ProviderErrorKind kind) {
        assertThatThrownBy(() -> adapter.send(history, List.of()))
                .isInstanceOfSatisfying(ProviderException.class, e -> assertThat(e.getKind()).isEqualTo(kind));
    }
}
