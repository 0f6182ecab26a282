package com.deepansh.codeagent.tool;

import com.deepansh.codeagent.core.CancellationSignal;
import com.deepansh.codeagent.exception.ToolExecutionException;
import com.deepansh.codeagent.model.ApprovalPolicy;
import com.deepansh.codeagent.model.SandboxMode;
import com.deepansh.codeagent.model.ToolCall;
import com.deepansh.codeagent.model.ToolErrorKind;
import com.deepansh.codeagent.model.ToolResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The single checkpoint every tool call passes through.
 *
 * Stages run in a fixed order and the first one that objects short-circuits:
 * <ol>
 *   <li>lookup: unknown names are reported back, never ignored</li>
 *   <li>schema: arguments must satisfy the declared JSON Schema</li>
 *   <li>sandbox: read-only refuses mutating tools, workspace-write confines their paths</li>
 *   <li>approval: mutating tools may need a human confirmation</li>
 *   <li>execution: the handler runs under a timeout and the session's cancellation</li>
 * </ol>
 * Every failure comes back as an error {@link ToolResult} so the model can self-correct.
 * This method never throws.
 */
@Component
@Slf4j
public class SandboxGate {

    private static final int PREVIEW_CHARS = 600;

    @FunctionalInterface
    interface Stage {
        Optional<ToolResult> check(ToolCall call, ToolSpec spec, ToolContext context);
    }

    private final ToolRegistry registry;
    private final ToolSchemaValidator validator;
    private final AsyncTaskExecutor executor;
    private final ObjectMapper objectMapper;
    private final List<Stage> stages;

    @Autowired
    public SandboxGate(ToolRegistry registry,
                       ToolSchemaValidator validator,
                       @Qualifier("toolTaskExecutor") AsyncTaskExecutor executor,
                       ObjectMapper objectMapper) {
        this.registry = registry;
        this.validator = validator;
        this.executor = executor;
        this.objectMapper = objectMapper;
        this.stages = List.of(this::checkSchema, this::checkSandbox, this::checkApproval);
    }

    /** Same checks and executor, bound to a different registry view */
    public SandboxGate withRegistry(ToolRegistry view) {
        return new SandboxGate(view, validator, executor, objectMapper);
    }

    public ToolRegistry registry() {
        return registry;
    }

    public ToolResult execute(ToolCall call, ToolContext context) {
        Optional<ToolSpec> found = registry.find(call.getToolName());
        if (found.isEmpty()) {
            log.warn("Unknown tool requested: [{}]", call.getToolName());
            return ToolResult.failure(call, ToolErrorKind.UNKNOWN_TOOL, String.format(
                    "Unknown tool '%s'. Available tools: %s", call.getToolName(), registry.names().stream().sorted().toList()));
        }
        ToolSpec spec = found.get();

        try {
            for (Stage stage : stages) {
                Optional<ToolResult> rejection = stage.check(call, spec, context);
                if (rejection.isPresent()) {
                    return rejection.get();
                }
            }
            return run(call, spec, context);
        } catch (RuntimeException e) {
            log.error("Gate failed while handling [{}]", spec.getName(), e);
            return ToolResult.failure(call, ToolErrorKind.HANDLER_FAILURE,
                    "tool execution failed: " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private Optional<ToolResult> checkSchema(ToolCall call, ToolSpec spec, ToolContext context) {
        List<String> violations = validator.validate(spec, call);
        if (violations.isEmpty()) {
            return Optional.empty();
        }
        log.info("Rejected [{}] arguments: {}", spec.getName(), violations);
        return Optional.of(ToolResult.failure(call, ToolErrorKind.SCHEMA_INVALID,
                "invalid arguments for '" + spec.getName() + "': " + String.join("; ", violations)));
    }

    private Optional<ToolResult> checkSandbox(ToolCall call, ToolSpec spec, ToolContext context) {
        if (!spec.isMutating()) {
            return Optional.empty();
        }
        SandboxMode mode = context.getSandboxMode();
        if (mode == SandboxMode.READ_ONLY) {
            log.warn("Sandbox refused mutating tool [{}] in read-only mode", spec.getName());
            return Optional.of(ToolResult.failure(call, ToolErrorKind.SANDBOX_DENIED,
                    "blocked by sandbox policy: '" + spec.getName() + "' modifies the workspace and the sandbox is "
                            + "read-only; it requires workspace-write or danger-full-access"));
        }
        if (mode == SandboxMode.WORKSPACE_WRITE) {
            for (String argument : spec.getPathArguments()) {
                Object raw = call.getArguments().get(argument);
                if (!(raw instanceof String rawPath) || rawPath.isBlank()) {
                    continue;
                }
                Path resolved;
                try {
                    resolved = WorkspacePaths.resolve(context.getWorkspaceRoot(), rawPath);
                } catch (InvalidPathException e) {
                    log.warn("Sandbox refused [{}]: {} is not a valid path: {}", spec.getName(), argument, e.getMessage());
                    return Optional.of(ToolResult.failure(call, ToolErrorKind.SANDBOX_DENIED,
                            "blocked by sandbox policy: " + argument + " is not a valid path (" + e.getReason() + ")"));
                }
                if (!WorkspacePaths.isWithin(context.getWorkspaceRoot(), resolved)) {
                    log.warn("Sandbox refused [{}]: {}='{}' escapes {}", spec.getName(), argument, rawPath,
                            context.getWorkspaceRoot());
                    return Optional.of(ToolResult.failure(call, ToolErrorKind.SANDBOX_DENIED,
                            "blocked by sandbox policy: " + argument + " '" + rawPath + "' resolves outside the "
                                    + "workspace root; writing there requires danger-full-access"));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<ToolResult> checkApproval(ToolCall call, ToolSpec spec, ToolContext context) {
        ApprovalPolicy policy = context.getApprovalPolicy();
        if (!spec.isMutating() || policy == ApprovalPolicy.NEVER) {
            return Optional.empty();
        }

        // One prompt at a time per session, even when calls run in parallel
        synchronized (context.getApprovalLock()) {
            boolean needsConfirmation = policy == ApprovalPolicy.ALWAYS
                    || !context.getApprovedTools().contains(spec.getName())
                    || spec.getHandler().requiresConfirmation(call.getArguments());
            if (!needsConfirmation) {
                return Optional.empty();
            }

            boolean approved;
            try {
                approved = context.getApprovalCallback().approve(spec.getName(), preview(call));
            } catch (RuntimeException e) {
                log.warn("Approval callback failed for [{}]: {}", spec.getName(), e.getMessage());
                approved = false;
            }

            if (!approved) {
                log.info("Mutating call [{}] denied by user", spec.getName());
                return Optional.of(ToolResult.failure(call, ToolErrorKind.APPROVAL_DENIED,
                        "denied by user: '" + spec.getName() + "' was not approved"));
            }
            if (policy == ApprovalPolicy.ON_REQUEST) {
                context.getApprovedTools().add(spec.getName());
            }
            return Optional.empty();
        }
    }

    private ToolResult run(ToolCall call, ToolSpec spec, ToolContext context) {
        CancellationSignal cancellation = context.getCancellation();
        if (cancellation.isCancelled()) {
            return ToolResult.failure(call, ToolErrorKind.CANCELLED, "session cancelled before '" + spec.getName() + "' ran");
        }

        Duration declared = spec.getTimeout() != null ? spec.getTimeout() : context.getDefaultTimeout();
        Duration timeout = spec.getHandler().timeoutFor(call.getArguments(), declared);

        log.info("Executing tool: [{}] with args: {}", spec.getName(), call.getArguments());
        Future<String> future;
        try {
            future = executor.submit(() -> spec.getHandler().execute(call.getArguments(), context));
        } catch (RejectedExecutionException e) {
            log.error("No worker available for tool [{}]", spec.getName());
            return ToolResult.failure(call, ToolErrorKind.HANDLER_FAILURE, "no worker available to run '" + spec.getName() + "'");
        }

        try (CancellationSignal.Subscription ignored = cancellation.onCancel(() -> future.cancel(true))) {
            String output = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Tool [{}] returned: {}", spec.getName(), output);
            return ToolResult.success(call, output);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Tool [{}] timed out after {}s", spec.getName(), timeout.toSeconds());
            return ToolResult.failure(call, ToolErrorKind.TIMEOUT,
                    "'" + spec.getName() + "' timed out after " + timeout.toSeconds() + "s");
        } catch (CancellationException e) {
            return ToolResult.failure(call, ToolErrorKind.CANCELLED, "'" + spec.getName() + "' was cancelled");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ToolResult.failure(call, ToolErrorKind.CANCELLED, "'" + spec.getName() + "' was interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ToolExecutionException) {
                log.info("Tool [{}] reported failure: {}", spec.getName(), cause.getMessage());
                return ToolResult.failure(call, ToolErrorKind.HANDLER_FAILURE, cause.getMessage());
            }
            log.error("Unexpected error in tool [{}]", spec.getName(), cause);
            return ToolResult.failure(call, ToolErrorKind.HANDLER_FAILURE,
                    "tool execution failed: " + cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }
    }

    private String preview(ToolCall call) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(call.getArguments());
            return json.length() > PREVIEW_CHARS ? json.substring(0, PREVIEW_CHARS) : json;
        } catch (JsonProcessingException e) {
            return String.valueOf(call.getArguments());
        }
    }
}
