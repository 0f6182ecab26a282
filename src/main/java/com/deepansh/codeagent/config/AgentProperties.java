package com.deepansh.codeagent.config;

import com.deepansh.codeagent.model.ApprovalPolicy;
import com.deepansh.codeagent.model.SandboxMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Session defaults, the subagent catalog and external tool definitions.
 * Bound from application.yml under the "agent" prefix.
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private int maxSteps = 20;
    private String workspaceRoot = ".";
    private SandboxMode sandboxMode = SandboxMode.WORKSPACE_WRITE;
    private ApprovalPolicy approvalPolicy = ApprovalPolicy.ON_REQUEST;
    private int toolTimeoutSeconds = 120;

    /** Upper bound on tool calls of one turn running at the same time */
    private int maxParallelTools = 4;

    private String systemPrompt = """
            You are a coding agent working inside a local workspace.
            Use the available tools to inspect and change files and to run commands.
            Prefer the dedicated file tools over shell commands for listing, reading and searching.
            Keep a plan with update_plan for tasks with three or more steps.
            When the task is done, reply with a concise summary and no tool calls.
            """;

    private int subagentTimeoutSeconds = 600;

    /** Empty means the built-in general / reviewer / researcher profiles */
    private List<Subagent> subagents = new ArrayList<>();

    private List<ExternalTool> externalTools = new ArrayList<>();

    @Data
    public static class Subagent {
        private String name;
        private String description = "";
        private String instructions = "";
        private List<String> tools = new ArrayList<>();
        private int maxSteps = 8;
        /** Optional; capped at the parent session's mode */
        private SandboxMode sandboxMode;
    }

    @Data
    public static class ExternalTool {
        private String name;
        private String description = "";
        /** argv of the process; not run through a shell */
        private List<String> command = new ArrayList<>();
        /** JSON Schema of the arguments */
        private Map<String, Object> parameters = new LinkedHashMap<>(Map.of("type", "object"));
        private boolean mutating;
        private Integer timeoutSeconds;
        private List<String> pathArguments = new ArrayList<>();
    }
}
