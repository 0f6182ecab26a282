package com.deepansh.codeagent.tool.impl;

import com.deepansh.codeagent.exception.ToolExecutionException;
import com.deepansh.codeagent.tool.AgentTool;
import com.deepansh.codeagent.tool.ToolArguments;
import com.deepansh.codeagent.tool.ToolContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Runs a shell command through {@code sh -c} in the workspace (or {@code workdir}).
 *
 * stdout and stderr are merged. The result is {@code exit_code=N} followed by
 * the trimmed output, truncated at 6000 characters. A non-zero exit is reported,
 * not treated as a tool failure. The process tree is killed on timeout and on
 * cancellation.
 *
 * Commands matching {@link #DESTRUCTIVE} need confirmation on every call under
 * the on-request policy, even after the tool was approved once.
 */
@Component
@Slf4j
public class ExecCommandTool implements AgentTool {

    static final int DEFAULT_TIMEOUT_SEC = 120;
    static final int MAX_TIMEOUT_SEC = 1800;
    static final int MAX_OUTPUT_CHARS = 6000;

    private static final Duration GRACE = Duration.ofSeconds(5);

    static final Pattern DESTRUCTIVE = Pattern.compile(
            "\\brm\\s+-[a-zA-Z]*[rf]"
                    + "|\\bgit\\s+(reset\\s+--hard|clean\\s+-[a-zA-Z]*f|push\\s+.*(--force|-f\\b))"
                    + "|\\bmkfs\\b|\\bdd\\s+if="
                    + "|\\b(shutdown|reboot|halt)\\b"
                    + "|\\bch(mod|own)\\s+-R\\b"
                    + "|>\\s*/dev/(sd|nvme|disk)");

    @Override
    public String getName() {
        return "exec_command";
    }

    @Override
    public String getDescription() {
        return """
                Execute a shell command and return its exit code and output (stdout + stderr).
                MUTATING operation. Use this for running tests, git operations, build commands,
                installing packages, or other system commands.
                Do NOT use this for file listing (use list_files), reading files (use read_file),
                or searching file contents (use grep_files).
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "command", Map.of(
                                "type", "string",
                                "minLength", 1,
                                "description", "The shell command to execute. Runs via sh -c."
                        ),
                        "timeout_sec", Map.of(
                                "type", "integer",
                                "minimum", 1,
                                "maximum", MAX_TIMEOUT_SEC,
                                "description", "Timeout in seconds. Defaults to 120. Range: 1-1800."
                        ),
                        "workdir", Map.of(
                                "type", "string",
                                "description", "Working directory. Defaults to the workspace root."
                        )
                ),
                "required", List.of("command"),
                "additionalProperties", false
        );
    }

    @Override
    public boolean isMutating() {
        return true;
    }

    @Override
    public Set<String> getPathArguments() {
        return Set.of("workdir");
    }

    @Override
    public boolean requiresConfirmation(Map<String, Object> arguments) {
        Object command = arguments.get("command");
        return command != null && DESTRUCTIVE.matcher(command.toString()).find();
    }

    @Override
    public Duration timeoutFor(Map<String, Object> arguments, Duration declared) {
        return Duration.ofSeconds(timeoutSeconds(arguments)).plus(GRACE);
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) throws IOException, InterruptedException {
        String command = ToolArguments.requiredString(arguments, "command");
        int timeoutSec = timeoutSeconds(arguments);
        String workdir = ToolArguments.string(arguments, "workdir", null);
        Path directory = workdir == null || workdir.isBlank()
                ? context.getWorkspaceRoot()
                : context.resolvePath(workdir);
        if (!Files.isDirectory(directory)) {
            throw new ToolExecutionException("workdir is not a directory: " + workdir);
        }

        Path capture = Files.createTempFile("exec-command-", ".out");
        try {
            log.info("exec_command in {}: {}", directory, command);
            Process process = new ProcessBuilder("sh", "-c", command)
                    .directory(directory.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(capture.toFile())
                    .start();

            boolean finished;
            try {
                finished = process.waitFor(timeoutSec, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                kill(process);
                throw e;
            }
            if (!finished) {
                kill(process);
                throw new ToolExecutionException("command timed out after " + timeoutSec + "s: " + command);
            }

            // Output is not guaranteed to be UTF-8; the String constructor replaces bad bytes
            String output = new String(Files.readAllBytes(capture), StandardCharsets.UTF_8).strip();
            if (output.length() > MAX_OUTPUT_CHARS) {
                output = output.substring(0, MAX_OUTPUT_CHARS) + "\n... (truncated)";
            }
            log.debug("exec_command exited with {}", process.exitValue());
            return "exit_code=" + process.exitValue() + "\n" + output;
        } finally {
            Files.deleteIfExists(capture);
        }
    }

    private static int timeoutSeconds(Map<String, Object> arguments) {
        return ToolArguments.clampedInteger(arguments, "timeout_sec", DEFAULT_TIMEOUT_SEC, 1, MAX_TIMEOUT_SEC);
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }
}
