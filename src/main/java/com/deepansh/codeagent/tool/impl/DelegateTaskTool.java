package com.deepansh.codeagent.tool.impl;

import com.deepansh.codeagent.config.AgentProperties;
import com.deepansh.codeagent.subagent.SubagentDelegator;
import com.deepansh.codeagent.tool.AgentTool;
import com.deepansh.codeagent.tool.ToolArguments;
import com.deepansh.codeagent.tool.ToolContext;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Hands a self-contained sub-task to a subagent profile and returns its answer.
 *
 * The delegator is injected lazily: it depends on the subagent catalog, which
 * binds its tool views from the registry this tool is registered in.
 */
@Component
public class DelegateTaskTool implements AgentTool {

    public static final String NAME = "delegate_task";

    private final SubagentDelegator delegator;
    private final AgentProperties agentProperties;

    public DelegateTaskTool(@Lazy SubagentDelegator delegator, AgentProperties agentProperties) {
        this.delegator = delegator;
        this.agentProperties = agentProperties;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return """
                Delegate a focused, self-contained sub-task to a subagent and get its final answer back.
                Profiles: 'general' (focused execution), 'reviewer' (find bugs and risks),
                'researcher' (inspect the codebase and summarize). Subagents are read-only by default
                and cannot delegate further. Give the subagent everything it needs in 'task'.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "profile", Map.of(
                                "type", "string",
                                "description", "Subagent profile name. Defaults to 'general'."
                        ),
                        "task", Map.of(
                                "type", "string",
                                "minLength", 1,
                                "description", "The complete sub-task description, including relevant paths and context."
                        )
                ),
                "required", List.of("task"),
                "additionalProperties", false
        );
    }

    @Override
    public Duration getTimeout() {
        return Duration.ofSeconds(agentProperties.getSubagentTimeoutSeconds());
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) {
        String profile = ToolArguments.string(arguments, "profile", "general");
        String task = ToolArguments.requiredString(arguments, "task");
        return delegator.delegate(profile, task, context);
    }
}
