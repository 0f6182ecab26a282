package com.deepansh.codeagent.core;

import com.deepansh.codeagent.config.AgentProperties;
import com.deepansh.codeagent.exception.SessionConflictException;
import com.deepansh.codeagent.llm.ModelProtocolAdapter;
import com.deepansh.codeagent.model.AgentRequest;
import com.deepansh.codeagent.model.AgentResponse;
import com.deepansh.codeagent.model.ApprovalPolicy;
import com.deepansh.codeagent.model.Message;
import com.deepansh.codeagent.model.SandboxMode;
import com.deepansh.codeagent.observability.RunContext;
import com.deepansh.codeagent.prompt.SystemPromptBuilder;
import com.deepansh.codeagent.tool.ApprovalCallback;
import com.deepansh.codeagent.tool.SandboxGate;
import com.deepansh.codeagent.tool.ToolContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for a top-level run.
 *
 * Per-run flow:
 * 1. Resolve session id and register its cancellation signal
 * 2. Build the tool context from configured defaults and request overrides
 * 3. Seed the transcript: system prompt + user input, or prior messages + input
 * 4. Run the loop to termination
 * 5. Log the run summary and unregister the session
 */
@Service
@Slf4j
public class AgentSessionService {

    private final ModelProtocolAdapter modelAdapter;
    private final SandboxGate gate;
    private final SystemPromptBuilder promptBuilder;
    private final AsyncTaskExecutor executor;
    private final AgentProperties agentProperties;

    private final Map<String, CancellationSignal> running = new ConcurrentHashMap<>();

    public AgentSessionService(ModelProtocolAdapter modelAdapter,
                               SandboxGate gate,
                               SystemPromptBuilder promptBuilder,
                               @Qualifier("toolTaskExecutor") AsyncTaskExecutor executor,
                               AgentProperties agentProperties) {
        this.modelAdapter = modelAdapter;
        this.gate = gate;
        this.promptBuilder = promptBuilder;
        this.executor = executor;
        this.agentProperties = agentProperties;
    }

    public AgentResponse run(AgentRequest request) {
        String sessionId = request.getSessionId() != null && !request.getSessionId().isBlank()
                ? request.getSessionId()
                : UUID.randomUUID().toString();

        CancellationSignal cancellation = new CancellationSignal();
        if (running.putIfAbsent(sessionId, cancellation) != null) {
            throw new SessionConflictException(sessionId);
        }

        try {
            ToolContext context = buildContext(sessionId, request, cancellation);
            int maxSteps = request.getMaxSteps() != null ? request.getMaxSteps() : agentProperties.getMaxSteps();
            AgentState state = new AgentState(initialMessages(request, context.getWorkspaceRoot()),
                    maxSteps, context.getPlan());

            log.info("Agent run started [session={}, sandbox={}, approval={}, maxSteps={}]",
                    sessionId, context.getSandboxMode(), context.getApprovalPolicy(), maxSteps);

            RunContext run = new RunContext(sessionId);
            new AgentLoop(modelAdapter, gate, executor, agentProperties.getMaxParallelTools())
                    .run(state, context, run);
            run.logSummary(String.valueOf(state.getTerminationReason()), state.getStepCount());

            return toResponse(sessionId, state);
        } finally {
            running.remove(sessionId, cancellation);
        }
    }

    /**
     * Cancels a running session.
     * @return false if no session with that id is running
     */
    public boolean cancel(String sessionId) {
        CancellationSignal signal = running.get(sessionId);
        if (signal == null) {
            return false;
        }
        log.info("Cancelling session [{}]", sessionId);
        signal.cancel();
        return true;
    }

    public Set<String> runningSessions() {
        return Set.copyOf(running.keySet());
    }

    private ToolContext buildContext(String sessionId, AgentRequest request, CancellationSignal cancellation) {
        SandboxMode sandbox = request.getSandboxMode() != null
                ? request.getSandboxMode() : agentProperties.getSandboxMode();
        ApprovalPolicy approval = request.getApprovalPolicy() != null
                ? request.getApprovalPolicy() : agentProperties.getApprovalPolicy();
        Set<String> preApproved = request.getApprovedTools() == null
                ? Set.of() : Set.copyOf(request.getApprovedTools());
        ApprovalCallback callback = (toolName, preview) -> {
            boolean approved = preApproved.contains(toolName);
            log.info("Approval for [{}] [session={}]: {}", toolName, sessionId, approved ? "pre-approved" : "not approved");
            return approved;
        };

        return ToolContext.builder()
                .sessionId(sessionId)
                .workspaceRoot(Path.of(agentProperties.getWorkspaceRoot()))
                .sandboxMode(sandbox)
                .approvalPolicy(approval)
                .approvalCallback(callback)
                .defaultTimeout(Duration.ofSeconds(agentProperties.getToolTimeoutSeconds()))
                .cancellation(cancellation)
                .plan(new PlanState())
                .build();
    }

    private List<Message> initialMessages(AgentRequest request, Path workspaceRoot) {
        List<Message> messages = new ArrayList<>();
        if (request.getPriorMessages() == null || request.getPriorMessages().isEmpty()) {
            messages.add(Message.system(promptBuilder.build(workspaceRoot)));
        } else {
            messages.addAll(request.getPriorMessages());
        }
        messages.add(Message.user(request.getInput()));
        return messages;
    }

    private static AgentResponse toResponse(String sessionId, AgentState state) {
        Message last = state.lastAssistantMessage();
        return AgentResponse.builder()
                .sessionId(sessionId)
                .finalAnswer(last != null ? last.getContent() : null)
                .reasoning(last != null ? last.getReasoning() : null)
                .terminationReason(state.getTerminationReason())
                .stepsUsed(state.getStepCount())
                .messages(state.snapshot())
                .plan(state.getPlan().snapshot())
                .error(state.getError())
                .build();
    }
}
