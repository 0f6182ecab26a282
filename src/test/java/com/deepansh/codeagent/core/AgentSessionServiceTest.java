package com.deepansh.codeagent.core;

import com.deepansh.codeagent.config.AgentProperties;
import com.deepansh.codeagent.exception.SessionConflictException;
import com.deepansh.codeagent.model.AgentRequest;
import com.deepansh.codeagent.model.AgentResponse;
import com.deepansh.codeagent.model.ApprovalPolicy;
import com.deepansh.codeagent.model.Message;
import com.deepansh.codeagent.prompt.AgentsMdLoader;
import com.deepansh.codeagent.prompt.SystemPromptBuilder;
import com.deepansh.codeagent.tool.SandboxGate;
import com.deepansh.codeagent.tool.ToolRegistry;
import com.deepansh.codeagent.tool.ToolSchemaValidator;
import com.deepansh.codeagent.tool.ToolSpec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.deepansh.codeagent.core.ScriptedModelAdapter.call;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentSessionServiceTest {

    @TempDir
    Path workspace;

    private final SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("session-test-");
    private AgentProperties props;
    private SandboxGate gate;

    @BeforeEach
    void setUp() {
        props = new AgentProperties();
        props.setWorkspaceRoot(workspace.toString());
        props.setSystemPrompt("You are a test agent.");

        ToolSpec write = ToolSpec.builder()
                .name("write_file")
                .parameterSchema(Map.of("type", "object"))
                .mutating(true)
                .handler((args, ctx) -> "written")
                .build();
        ObjectMapper mapper = new ObjectMapper();
        gate = new SandboxGate(new ToolRegistry(List.of(write)), new ToolSchemaValidator(mapper), executor, mapper);
    }

    private AgentSessionService service(ScriptedModelAdapter model) {
        SystemPromptBuilder prompts = new SystemPromptBuilder(props, new AgentsMdLoader());
        return new AgentSessionService(model, gate, prompts, executor, props);
    }

    private static AgentRequest request(String input) {
        AgentRequest request = new AgentRequest();
        request.setInput(input);
        return request;
    }

    @Test
    void newSession_seedsSystemPromptAndReturnsAnswer() {
        ScriptedModelAdapter model = new ScriptedModelAdapter().reply(Message.assistant("hello"));

        AgentResponse response = service(model).run(request("hi"));

        List<Message> firstRequest = model.requests().get(0);
        assertThat(firstRequest.get(0).getRole()).isEqualTo(Message.Role.system);
        assertThat(firstRequest.get(0).getContent()).startsWith("You are a test agent.");
        assertThat(firstRequest.get(1).getContent()).isEqualTo("hi");
        assertThat(response.getFinalAnswer()).isEqualTo("hello");
        assertThat(response.getTerminationReason()).isEqualTo(TerminationReason.DONE);
        assertThat(response.getSessionId()).isNotBlank();
        assertThat(response.getMessages()).hasSize(3);
    }

    @Test
    void priorMessages_areContinuedWithoutNewSystemPrompt() {
        ScriptedModelAdapter model = new ScriptedModelAdapter().reply(Message.assistant("again"));
        AgentRequest request = request("next");
        request.setPriorMessages(List.of(Message.system("old system"), Message.user("first"), Message.assistant("reply")));

        service(model).run(request);

        assertThat(model.requests().get(0)).extracting(Message::getContent)
                .containsExactly("old system", "first", "reply", "next");
    }

    @Test
    void preApprovedTools_actAsConfirmation() {
        ScriptedModelAdapter model = new ScriptedModelAdapter()
                .toolCalls(call("w1", "write_file", Map.of()))
                .toolCalls(call("w2", "write_file", Map.of()))
                .reply(Message.assistant("done"));
        AgentRequest request = request("write twice");
        request.setApprovalPolicy(ApprovalPolicy.ALWAYS);
        request.setApprovedTools(Set.of("write_file"));

        AgentResponse response = service(model).run(request);

        assertThat(response.getMessages())
                .filteredOn(m -> m.getRole() == Message.Role.tool)
                .extracting(Message::getContent)
                .containsExactly("written", "written");
    }

    @Test
    void maxStepsOverride_isApplied() {
        ScriptedModelAdapter model = new ScriptedModelAdapter()
                .toolCalls(call("w1", "write_file", Map.of()));
        AgentRequest request = request("go");
        request.setMaxSteps(1);
        request.setApprovalPolicy(ApprovalPolicy.NEVER);

        AgentResponse response = service(model).run(request);

        assertThat(response.getTerminationReason()).isEqualTo(TerminationReason.MAX_STEPS_EXCEEDED);
        assertThat(response.getStepsUsed()).isEqualTo(1);
    }

    @Test
    void runningSession_canBeCancelledById_andIdIsReleased() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        ScriptedModelAdapter model = new ScriptedModelAdapter().reply(() -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Message.assistant("late");
        });
        AgentSessionService service = service(model);
        AgentRequest request = request("long task");
        request.setSessionId("s-42");

        CompletableFuture<AgentResponse> pending = CompletableFuture.supplyAsync(() -> service.run(request));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> service.run(request)).isInstanceOf(SessionConflictException.class);
        assertThat(service.cancel("s-42")).isTrue();

        AgentResponse response = pending.get(5, TimeUnit.SECONDS);
        assertThat(response.getTerminationReason()).isEqualTo(TerminationReason.CANCELLED);
        assertThat(service.runningSessions()).isEmpty();
        assertThat(service.cancel("s-42")).isFalse();
    }
}
