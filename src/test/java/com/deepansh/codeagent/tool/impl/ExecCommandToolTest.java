package com.deepansh.codeagent.tool.impl;

import com.deepansh.codeagent.exception.ToolExecutionException;
import com.deepansh.codeagent.tool.ToolContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ExecCommandToolTest {

    @TempDir
    Path tempDir;

    private final ExecCommandTool tool = new ExecCommandTool();
    private ToolContext context;

    @BeforeEach
    void setUp() {
        context = ToolContext.builder().sessionId("t").workspaceRoot(tempDir).build();
    }

    @Test
    void runsInWorkspace_andReportsExitCode() throws Exception {
        Files.writeString(tempDir.resolve("marker.txt"), "x");

        String result = tool.execute(Map.of("command", "ls; echo oops >&2; exit 3"), context);

        assertThat(result).startsWith("exit_code=3\n").contains("marker.txt").contains("oops");
    }

    @Test
    void invalidUtf8Output_isReplacedAndExitCodeStillReported() throws Exception {
        String result = tool.execute(Map.of("command", "touch done.txt; printf 'caf\\351'; exit 3"), context);

        assertThat(result).isEqualTo("exit_code=3\ncaf\uFFFD");
        assertThat(tempDir.resolve("done.txt")).exists();
    }

    @Test
    void timeout_killsProcessAndFails() {
        assertThatThrownBy(() -> tool.execute(Map.of("command", "sleep 30", "timeout_sec", 1), context))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageContaining("timed out after 1s");
    }

    @Test
    void destructiveCommands_needFreshConfirmation() {
        assertThat(tool.requiresConfirmation(Map.of("command", "rm -rf build"))).isTrue();
        assertThat(tool.requiresConfirmation(Map.of("command", "git reset --hard HEAD~1"))).isTrue();
        assertThat(tool.requiresConfirmation(Map.of("command", "git push origin main --force"))).isTrue();
        assertThat(tool.requiresConfirmation(Map.of("command", "ls -la"))).isFalse();
        assertThat(tool.requiresConfirmation(Map.of("command", "git status"))).isFalse();
    }

    @Test
    void timeoutFor_widensToRequestedTimeout() {
        assertThat(tool.timeoutFor(Map.of("timeout_sec", 600), Duration.ofSeconds(120)))
                .isEqualTo(Duration.ofSeconds(605));
    }
}
