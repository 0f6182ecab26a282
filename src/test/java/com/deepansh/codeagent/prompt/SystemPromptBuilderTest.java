package com.deepansh.codeagent.prompt;

import com.deepansh.codeagent.config.AgentProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class SystemPromptBuilderTest {

    @TempDir
    Path tempDir;

    private final AgentsMdLoader loader = new AgentsMdLoader();

    @Test
    void agentsMdChain_isOrderedOutermostFirst() throws Exception {
        Path workspace = Files.createDirectories(tempDir.resolve("repo/module"));
        Files.writeString(tempDir.resolve("AGENTS.md"), "outer rules");
        Files.writeString(workspace.resolve("AGENTS.md"), "inner rules");

        assertThat(loader.find(workspace))
                .endsWith(tempDir.resolve("AGENTS.md").toAbsolutePath(), workspace.resolve("AGENTS.md").toAbsolutePath());

        String rendered = loader.render(workspace);
        assertThat(rendered.indexOf("outer rules")).isLessThan(rendered.indexOf("inner rules"));
    }

    @Test
    void build_includesBasePromptTimeWorkspaceAndInstructions() throws Exception {
        Files.writeString(tempDir.resolve("agents.md"), "Use tabs.");
        AgentProperties props = new AgentProperties();
        props.setSystemPrompt("Base prompt.\n");
        Clock clock = Clock.fixed(Instant.parse("2026-01-02T03:04:05Z"), ZoneOffset.UTC);

        String prompt = new SystemPromptBuilder(props, loader, clock).build(tempDir);

        assertThat(prompt).startsWith("Base prompt.\n\n# Working Environment")
                .contains("Current UTC time: 2026-01-02T03:04:05Z")
                .contains("Workspace root: " + tempDir)
                .contains("# AGENTS.md Instructions")
                .contains("Use tabs.");
    }

    @Test
    void subagentPrompt_appendsProfileSection() {
        AgentProperties props = new AgentProperties();

        String prompt = new SystemPromptBuilder(props, loader).buildForSubagent(tempDir, "reviewer", "  Find bugs.  ");

        assertThat(prompt).endsWith("# Subagent profile: reviewer\nFind bugs.\n");
    }
}
