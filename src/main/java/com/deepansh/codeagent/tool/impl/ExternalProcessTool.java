package com.deepansh.codeagent.tool.impl;

import com.deepansh.codeagent.exception.ToolExecutionException;
import com.deepansh.codeagent.tool.ToolContext;
import com.deepansh.codeagent.tool.ToolHandler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Handler that runs a configured executable per call.
 *
 * Protocol: the canonical arguments are written to stdin as one JSON object.
 * stdout must hold one JSON value. An object with an {@code output} field is
 * unwrapped, and {@code "is_error": true} makes it an error result. Any other
 * JSON value is returned as its text. A non-zero exit or output that is not JSON
 * is a failure. The process runs in the workspace root and is killed when the
 * call is cancelled or times out.
 */
@Slf4j
public class ExternalProcessTool implements ToolHandler {

    private static final int STDERR_PREVIEW = 1000;

    private final String name;
    private final List<String> command;
    private final ObjectMapper objectMapper;

    public ExternalProcessTool(String name, List<String> command, ObjectMapper objectMapper) {
        this.name = name;
        this.command = List.copyOf(command);
        this.objectMapper = objectMapper;
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) throws IOException, InterruptedException {
        Path stdout = Files.createTempFile("external-tool-", ".out");
        Path stderr = Files.createTempFile("external-tool-", ".err");
        try {
            log.info("External tool [{}] running {}", name, command);
            Process process = new ProcessBuilder(command)
                    .directory(context.getWorkspaceRoot().toFile())
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile())
                    .start();

            writeArguments(process, arguments);

            int exitCode;
            try {
                exitCode = process.waitFor();
            } catch (InterruptedException e) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                throw e;
            }

            if (exitCode != 0) {
                String err = new String(Files.readAllBytes(stderr), StandardCharsets.UTF_8).strip();
                if (err.length() > STDERR_PREVIEW) {
                    err = err.substring(0, STDERR_PREVIEW) + "...";
                }
                throw new ToolExecutionException("external tool '" + name + "' exited with code " + exitCode
                        + (err.isEmpty() ? "" : ": " + err));
            }
            return interpret(new String(Files.readAllBytes(stdout), StandardCharsets.UTF_8));
        } finally {
            Files.deleteIfExists(stdout);
            Files.deleteIfExists(stderr);
        }
    }

    private void writeArguments(Process process, Map<String, Object> arguments) throws IOException {
        byte[] payload = objectMapper.writeValueAsBytes(arguments);
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(payload);
        } catch (IOException e) {
            // the process may exit without reading its input; its exit code decides the outcome
            log.debug("External tool [{}] closed stdin early: {}", name, e.getMessage());
        }
    }

    String interpret(String rawOutput) {
        String trimmed = rawOutput.strip();
        if (trimmed.isEmpty()) {
            throw new ToolExecutionException("external tool '" + name + "' produced no output");
        }
        JsonNode payload;
        try {
            payload = objectMapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            throw new ToolExecutionException("external tool '" + name + "' produced malformed output: "
                    + (trimmed.length() > 200 ? trimmed.substring(0, 200) + "..." : trimmed));
        }

        if (payload.isObject() && payload.has("output")) {
            JsonNode output = payload.get("output");
            String text = output.isTextual() ? output.asText() : output.toString();
            if (payload.path("is_error").asBoolean(false)) {
                throw new ToolExecutionException(text);
            }
            return text;
        }
        return payload.isTextual() ? payload.asText() : payload.toString();
    }
}
