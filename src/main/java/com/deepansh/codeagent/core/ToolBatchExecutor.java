package com.deepansh.codeagent.core;

import com.deepansh.codeagent.model.ToolCall;
import com.deepansh.codeagent.model.ToolErrorKind;
import com.deepansh.codeagent.model.ToolResult;
import com.deepansh.codeagent.observability.RunContext;
import com.deepansh.codeagent.tool.SandboxGate;
import com.deepansh.codeagent.tool.ToolContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Runs the tool calls of one assistant turn through the sandbox gate.
 *
 * Calls may run concurrently, at most {@code maxParallel} at a time. Each call
 * owns one pre-assigned slot, so results come back in emission order no matter
 * which call finishes first, and every call gets exactly one result.
 */
@Slf4j
class ToolBatchExecutor {

    private final SandboxGate gate;
    private final AsyncTaskExecutor executor;
    private final int maxParallel;

    ToolBatchExecutor(SandboxGate gate, AsyncTaskExecutor executor, int maxParallel) {
        this.gate = gate;
        this.executor = executor;
        this.maxParallel = Math.max(1, maxParallel);
    }

    List<ToolResult> executeAll(List<ToolCall> calls, ToolContext context, RunContext run) {
        ToolResult[] slots = new ToolResult[calls.size()];

        if (calls.size() == 1 || maxParallel == 1) {
            for (int i = 0; i < calls.size(); i++) {
                slots[i] = timed(calls.get(i), context, run);
            }
            return Arrays.asList(slots);
        }

        Semaphore permits = new Semaphore(maxParallel);
        List<Future<?>> futures = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            final int slot = i;
            ToolCall call = calls.get(i);
            try {
                permits.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                futures.add(executor.submit(() -> {
                    try {
                        slots[slot] = timed(call, context, run);
                    } finally {
                        permits.release();
                    }
                }));
            } catch (RejectedExecutionException e) {
                permits.release();
                log.warn("Worker pool saturated, running [{}] inline", call.getToolName());
                slots[slot] = timed(call, context, run);
            }
        }

        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ExecutionException e) {
                // gate.execute never throws; an error here means the worker itself died
                log.error("Tool worker failed", e.getCause());
            }
        }

        for (int i = 0; i < slots.length; i++) {
            if (slots[i] == null) {
                slots[i] = ToolResult.failure(calls.get(i), ToolErrorKind.CANCELLED,
                        "'" + calls.get(i).getToolName() + "' did not run: session was interrupted");
            }
        }
        return Arrays.asList(slots);
    }

    private ToolResult timed(ToolCall call, ToolContext context, RunContext run) {
        long start = System.currentTimeMillis();
        ToolResult result;
        try {
            result = gate.execute(call, context);
        } catch (RuntimeException e) {
            log.error("Tool [{}] escaped the gate", call.getToolName(), e);
            result = ToolResult.failure(call, ToolErrorKind.HANDLER_FAILURE,
                    "tool execution failed: " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        long latency = System.currentTimeMillis() - start;
        run.recordToolCall(call.getToolName(), latency, result.errorKind());
        log.info("Tool [{}] finished in {}ms{} [session={}]", call.getToolName(), latency,
                result.error() ? " with " + result.errorKind() : "", context.getSessionId());
        return result;
    }
}
