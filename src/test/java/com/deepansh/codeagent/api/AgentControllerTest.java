package com.deepansh.codeagent.api;

import com.deepansh.codeagent.core.AgentSessionService;
import com.deepansh.codeagent.core.TerminationReason;
import com.deepansh.codeagent.exception.GlobalExceptionHandler;
import com.deepansh.codeagent.exception.SessionConflictException;
import com.deepansh.codeagent.model.AgentRequest;
import com.deepansh.codeagent.model.AgentResponse;
import com.deepansh.codeagent.model.ApprovalPolicy;
import com.deepansh.codeagent.model.SandboxMode;
import com.deepansh.codeagent.subagent.SubagentCatalog;
import com.deepansh.codeagent.subagent.SubagentProfile;
import com.deepansh.codeagent.tool.SandboxGate;
import com.deepansh.codeagent.tool.ToolRegistry;
import com.deepansh.codeagent.tool.ToolSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AgentControllerTest {

    private AgentSessionService sessionService;
    private SubagentCatalog catalog;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        sessionService = mock(AgentSessionService.class);
        catalog = mock(SubagentCatalog.class);
        SandboxGate gate = mock(SandboxGate.class);
        when(gate.registry()).thenReturn(new ToolRegistry(List.of(
                ToolSpec.builder().name("read_file").description("Read").parameterSchema(Map.of("type", "object"))
                        .handler((args, ctx) -> "").build(),
                ToolSpec.builder().name("write_file").description("Write").parameterSchema(Map.of("type", "object"))
                        .mutating(true).handler((args, ctx) -> "").build())));
        mockMvc = MockMvcBuilders.standaloneSetup(new AgentController(sessionService, gate, catalog))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void run_bindsOverridesAndReturnsResponse() throws Exception {
        when(sessionService.run(any())).thenReturn(AgentResponse.builder()
                .sessionId("s1")
                .finalAnswer("done")
                .terminationReason(TerminationReason.DONE)
                .stepsUsed(2)
                .build());

        mockMvc.perform(post("/api/v1/agent/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"input": "fix the build", "sandboxMode": "read-only",
                                 "approvalPolicy": "never", "maxSteps": 3, "approvedTools": ["write_file"]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.finalAnswer").value("done"))
                .andExpect(jsonPath("$.terminationReason").value("DONE"))
                .andExpect(jsonPath("$.stepsUsed").value(2));

        ArgumentCaptor<AgentRequest> captor = ArgumentCaptor.forClass(AgentRequest.class);
        verify(sessionService).run(captor.capture());
        assertThat(captor.getValue().getSandboxMode()).isEqualTo(SandboxMode.READ_ONLY);
        assertThat(captor.getValue().getApprovalPolicy()).isEqualTo(ApprovalPolicy.NEVER);
        assertThat(captor.getValue().getMaxSteps()).isEqualTo(3);
        assertThat(captor.getValue().getApprovedTools()).containsExactly("write_file");
    }

    @Test
    void run_blankInput_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/agent/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("input: input must not be blank"));
        verifyNoInteractions(sessionService);
    }

    @Test
    void run_unknownSandboxMode_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/agent/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\": \"x\", \"sandboxMode\": \"root\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void run_sessionAlreadyRunning_isConflict() throws Exception {
        when(sessionService.run(any())).thenThrow(new SessionConflictException("s1"));

        mockMvc.perform(post("/api/v1/agent/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\": \"x\", \"sessionId\": \"s1\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("session 's1' is already running"));
    }

    @Test
    void cancel_knownAndUnknownSessions() throws Exception {
        when(sessionService.cancel("s1")).thenReturn(true);

        mockMvc.perform(post("/api/v1/agent/sessions/s1/cancel"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.cancelled").value(true));
        mockMvc.perform(post("/api/v1/agent/sessions/other/cancel"))
                .andExpect(status().isNotFound());
    }

    @Test
    void listsToolsAndSubagents() throws Exception {
        when(catalog.profiles()).thenReturn(List.of(
                new SubagentProfile("reviewer", "Review code", "", List.of("read_file"), 8, null)));

        mockMvc.perform(get("/api/v1/agent/tools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("read_file"))
                .andExpect(jsonPath("$[1].mutating").value(true));
        mockMvc.perform(get("/api/v1/agent/subagents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("reviewer"))
                .andExpect(jsonPath("$[0].tools[0]").value("read_file"));
        mockMvc.perform(get("/api/v1/agent/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }
}
