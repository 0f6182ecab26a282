package com.deepansh.codeagent.prompt;

import com.deepansh.codeagent.config.AgentProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

/**
 * Assembles the session system prompt: configured base prompt, working
 * environment (UTC time, workspace root) and the AGENTS.md chain.
 */
@Component
public class SystemPromptBuilder {

    private final AgentProperties agentProperties;
    private final AgentsMdLoader agentsMdLoader;
    private final Clock clock;

    @Autowired
    public SystemPromptBuilder(AgentProperties agentProperties, AgentsMdLoader agentsMdLoader) {
        this(agentProperties, agentsMdLoader, Clock.systemUTC());
    }

    SystemPromptBuilder(AgentProperties agentProperties, AgentsMdLoader agentsMdLoader, Clock clock) {
        this.agentProperties = agentProperties;
        this.agentsMdLoader = agentsMdLoader;
        this.clock = clock;
    }

    public String build(Path workspaceRoot) {
        String now = DateTimeFormatter.ISO_INSTANT.format(Instant.now(clock));
        return agentProperties.getSystemPrompt().strip() + "\n\n"
                + "# Working Environment\n"
                + "- Current UTC time: " + now + "\n"
                + "- Workspace root: " + workspaceRoot + "\n\n"
                + "# AGENTS.md Instructions\n"
                + "AGENTS.md instructions take precedence over the defaults above when they conflict.\n\n"
                + agentsMdLoader.render(workspaceRoot) + "\n";
    }

    /** Base prompt plus the profile section a delegated subagent runs with */
    public String buildForSubagent(Path workspaceRoot, String profileName, String instructions) {
        return build(workspaceRoot) + "\n# Subagent profile: " + profileName + "\n" + instructions.strip() + "\n";
    }
}
