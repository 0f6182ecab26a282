package com.deepansh.codeagent.subagent;

import com.deepansh.codeagent.config.AgentProperties;
import com.deepansh.codeagent.core.AgentLoop;
import com.deepansh.codeagent.core.AgentState;
import com.deepansh.codeagent.exception.ToolExecutionException;
import com.deepansh.codeagent.llm.ModelProtocolAdapter;
import com.deepansh.codeagent.model.Message;
import com.deepansh.codeagent.model.SandboxMode;
import com.deepansh.codeagent.observability.RunContext;
import com.deepansh.codeagent.prompt.SystemPromptBuilder;
import com.deepansh.codeagent.tool.ToolContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs a task under a subagent profile with its own loop and transcript.
 *
 * The subagent shares the parent's workspace, confirm capability and
 * cancellation signal, but gets a fresh plan, its own approvals and the
 * profile's tool view. Its sandbox is read-only unless the profile overrides
 * it, and an override is capped at the parent's mode.
 *
 * Step exhaustion comes back as text. Provider errors and cancellation are
 * thrown as {@link ToolExecutionException}, which the sandbox gate turns into
 * an error result for the parent; nothing else propagates.
 */
@Service
@Slf4j
public class SubagentDelegator {

    private final SubagentCatalog catalog;
    private final ModelProtocolAdapter modelAdapter;
    private final SystemPromptBuilder promptBuilder;
    private final AsyncTaskExecutor executor;
    private final AgentProperties agentProperties;

    public SubagentDelegator(SubagentCatalog catalog,
                             ModelProtocolAdapter modelAdapter,
                             SystemPromptBuilder promptBuilder,
                             @Qualifier("toolTaskExecutor") AsyncTaskExecutor executor,
                             AgentProperties agentProperties) {
        this.catalog = catalog;
        this.modelAdapter = modelAdapter;
        this.promptBuilder = promptBuilder;
        this.executor = executor;
        this.agentProperties = agentProperties;
    }

    public String delegate(String profileName, String task, ToolContext parent) {
        SubagentCatalog.BoundProfile bound = catalog.find(profileName)
                .orElseThrow(() -> new ToolExecutionException(
                        "unknown subagent profile '" + profileName + "'. Available profiles: " + catalog.names()));
        if (task == null || task.isBlank()) {
            throw new ToolExecutionException("task cannot be empty");
        }
        if (parent.getDelegationDepth() > 0) {
            throw new ToolExecutionException("a subagent cannot delegate further");
        }

        SubagentProfile profile = bound.profile();
        SandboxMode mode = profile.sandboxMode() == null
                ? SandboxMode.READ_ONLY
                : profile.sandboxMode().capTo(parent.getSandboxMode());
        ToolContext child = parent.forSubagent(mode);

        String systemPrompt = promptBuilder.buildForSubagent(child.getWorkspaceRoot(), profile.name(), profile.instructions());
        AgentState state = new AgentState(
                List.of(Message.system(systemPrompt), Message.user(task)),
                profile.maxSteps(),
                child.getPlan());

        log.info("Delegating to subagent [{}] with sandbox {} [session={}]", profile.name(), mode, parent.getSessionId());
        RunContext run = new RunContext(parent.getSessionId() + "/" + profile.name());
        AgentLoop loop = new AgentLoop(modelAdapter, bound.gate(), executor, agentProperties.getMaxParallelTools());
        loop.run(state, child, run);
        run.logSummary(String.valueOf(state.getTerminationReason()), state.getStepCount());

        return switch (state.getTerminationReason()) {
            case DONE -> {
                Message answer = state.lastAssistantMessage();
                String content = answer == null ? null : answer.getContent();
                yield content == null || content.isBlank() ? "(subagent returned no answer)" : content;
            }
            case MAX_STEPS_EXCEEDED -> "subagent '" + profile.name() + "' reached its step limit ("
                    + profile.maxSteps() + ") before finishing. Last progress:\n" + lastProgress(state);
            case ERROR -> throw new ToolExecutionException(
                    "subagent '" + profile.name() + "' failed: " + state.getError());
            case CANCELLED -> throw new ToolExecutionException("subagent '" + profile.name() + "' was cancelled");
        };
    }

    // Last non-empty assistant text before the synthesized closing message
    private static String lastProgress(AgentState state) {
        List<Message> messages = state.getMessages();
        for (int i = messages.size() - 2; i >= 0; i--) {
            Message m = messages.get(i);
            if (m.getRole() == Message.Role.assistant && m.getContent() != null && !m.getContent().isBlank()) {
                return m.getContent();
            }
        }
        return "(none)";
    }
}
