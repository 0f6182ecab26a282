package com.deepansh.codeagent.tool;

import com.deepansh.codeagent.core.CancellationSignal;
import com.deepansh.codeagent.core.PlanState;
import com.deepansh.codeagent.exception.SandboxViolationException;
import com.deepansh.codeagent.exception.ToolExecutionException;
import com.deepansh.codeagent.model.ApprovalPolicy;
import com.deepansh.codeagent.model.SandboxMode;
import lombok.Builder;
import lombok.Getter;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session-scoped context handed to the sandbox gate and to every handler.
 *
 * Workspace root, sandbox mode and approval policy are fixed at construction
 * and only ever read. The plan is the only state a tool may change, and it
 * serializes its own writes.
 */
@Getter
public class ToolContext {

    private final String sessionId;
    private final Path workspaceRoot;
    private final SandboxMode sandboxMode;
    private final ApprovalPolicy approvalPolicy;
    private final ApprovalCallback approvalCallback;
    private final Duration defaultTimeout;
    private final CancellationSignal cancellation;
    private final PlanState plan;

    /** 0 for a top-level session, 1 inside a subagent */
    private final int delegationDepth;

    // Tool names confirmed once under on-request; owned by the gate
    private final Set<String> approvedTools = ConcurrentHashMap.newKeySet();
    private final Object approvalLock = new Object();

    @Builder
    private ToolContext(String sessionId,
                        Path workspaceRoot,
                        SandboxMode sandboxMode,
                        ApprovalPolicy approvalPolicy,
                        ApprovalCallback approvalCallback,
                        Duration defaultTimeout,
                        CancellationSignal cancellation,
                        PlanState plan,
                        int delegationDepth) {
        this.sessionId = sessionId;
        this.workspaceRoot = WorkspacePaths.realRoot(workspaceRoot != null ? workspaceRoot : Path.of("."));
        this.sandboxMode = sandboxMode != null ? sandboxMode : SandboxMode.WORKSPACE_WRITE;
        this.approvalPolicy = approvalPolicy != null ? approvalPolicy : ApprovalPolicy.ON_REQUEST;
        this.approvalCallback = approvalCallback != null ? approvalCallback : ApprovalCallback.DENY_ALL;
        this.defaultTimeout = defaultTimeout != null ? defaultTimeout : Duration.ofSeconds(120);
        this.cancellation = cancellation != null ? cancellation : new CancellationSignal();
        this.plan = plan != null ? plan : new PlanState();
        this.delegationDepth = delegationDepth;
    }

    /**
     * Resolves a path argument. Outside danger-full-access, anything that
     * lands outside the workspace root is rejected, reads included.
     */
    public Path resolvePath(String raw) {
        Path resolved;
        try {
            resolved = WorkspacePaths.resolve(workspaceRoot, raw);
        } catch (InvalidPathException e) {
            throw new ToolExecutionException("not a valid path: " + e.getReason(), e);
        }
        if (sandboxMode != SandboxMode.DANGER_FULL_ACCESS && !WorkspacePaths.isWithin(workspaceRoot, resolved)) {
            throw new SandboxViolationException("path escapes workspace: " + raw);
        }
        return resolved;
    }

    /** Workspace-relative rendering for tool output; absolute when outside the root */
    public String display(Path path) {
        return WorkspacePaths.isWithin(workspaceRoot, path)
                ? workspaceRoot.relativize(path).toString()
                : path.toString();
    }

    /**
     * Context for a delegated subagent: same workspace, confirm capability and
     * cancellation, its own plan and approvals, and the given sandbox mode.
     */
    public ToolContext forSubagent(SandboxMode mode) {
        return ToolContext.builder()
                .sessionId(sessionId)
                .workspaceRoot(workspaceRoot)
                .sandboxMode(mode)
                .approvalPolicy(approvalPolicy)
                .approvalCallback(approvalCallback)
                .defaultTimeout(defaultTimeout)
                .cancellation(cancellation)
                .plan(new PlanState())
                .delegationDepth(delegationDepth + 1)
                .build();
    }
}
