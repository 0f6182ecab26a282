package com.deepansh.codeagent.core;

import com.deepansh.codeagent.exception.AgentException;
import com.deepansh.codeagent.exception.ProviderException;
import com.deepansh.codeagent.llm.ModelProtocolAdapter;
import com.deepansh.codeagent.model.Message;
import com.deepansh.codeagent.model.ToolCall;
import com.deepansh.codeagent.model.ToolResult;
import com.deepansh.codeagent.observability.RunContext;
import com.deepansh.codeagent.tool.SandboxGate;
import com.deepansh.codeagent.tool.ToolContext;
import com.deepansh.codeagent.tool.ToolSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Step state machine: model → tools → model ... until an answer or a limit.
 *
 * Per-step flow:
 * 1. AWAITING_MODEL: send the transcript; the call runs on a worker so
 *    cancellation can abort it
 * 2. reply without tool calls → TERMINATED(DONE)
 * 3. AWAITING_TOOL_RESULTS: every call goes through the sandbox gate; one tool
 *    message per call, appended in emission order
 * 4. step count +1; at the limit → TERMINATED(MAX_STEPS_EXCEEDED) with a
 *    closing assistant message and no further model call
 *
 * Provider failures that escape the retry layer end the loop with ERROR and the
 * partial transcript intact. Model calls within a session are strictly sequential.
 */
@Slf4j
public class AgentLoop {

    private final ModelProtocolAdapter modelAdapter;
    private final SandboxGate gate;
    private final AsyncTaskExecutor executor;
    private final ToolBatchExecutor batchExecutor;

    public AgentLoop(ModelProtocolAdapter modelAdapter,
                     SandboxGate gate,
                     AsyncTaskExecutor executor,
                     int maxParallelTools) {
        this.modelAdapter = modelAdapter;
        this.gate = gate;
        this.executor = executor;
        this.batchExecutor = new ToolBatchExecutor(gate, executor, maxParallelTools);
    }

    public AgentState run(AgentState state, ToolContext context, RunContext run) {
        List<ToolSpec> tools = gate.registry().specs();
        CancellationSignal cancellation = context.getCancellation();

        while (!state.isTerminated()) {
            if (cancellation.isCancelled()) {
                cancel(state, context);
                break;
            }

            log.info("Step {}/{}: awaiting model [session={}, depth={}]", state.getStepCount() + 1,
                    state.getMaxSteps(), context.getSessionId(), context.getDelegationDepth());

            Message reply;
            try {
                reply = callModel(state.snapshot(), tools, cancellation, run);
            } catch (CancellationException e) {
                cancel(state, context);
                break;
            } catch (ProviderException e) {
                log.error("Model call failed [session={}, kind={}]: {}", context.getSessionId(), e.getKind(), e.getMessage());
                state.terminate(TerminationReason.ERROR, e.getMessage());
                break;
            } catch (AgentException e) {
                log.error("Model call failed [session={}]", context.getSessionId(), e);
                state.terminate(TerminationReason.ERROR, e.getMessage());
                break;
            }

            state.append(reply);
            if (!reply.hasToolCalls()) {
                state.terminate(TerminationReason.DONE, null);
                break;
            }

            state.enter(LoopPhase.AWAITING_TOOL_RESULTS);
            log.info("Model requested {} tool call(s): {} [session={}]", reply.getToolCalls().size(),
                    reply.getToolCalls().stream().map(ToolCall::getToolName).toList(), context.getSessionId());

            List<ToolResult> results = batchExecutor.executeAll(reply.getToolCalls(), context, run);
            results.forEach(result -> state.append(Message.toolResult(result)));
            state.incrementSteps();

            if (cancellation.isCancelled()) {
                cancel(state, context);
                break;
            }
            if (state.getStepCount() >= state.getMaxSteps()) {
                log.warn("Max steps ({}) reached [session={}]", state.getMaxSteps(), context.getSessionId());
                state.append(Message.assistant(String.format(
                        "Stopped after %d step(s) without a final answer: the step limit was reached. "
                                + "The work so far is in the conversation above.", state.getStepCount())));
                state.terminate(TerminationReason.MAX_STEPS_EXCEEDED, null);
                break;
            }
            state.enter(LoopPhase.AWAITING_MODEL);
        }
        return state;
    }

    private Message callModel(List<Message> snapshot, List<ToolSpec> tools,
                              CancellationSignal cancellation, RunContext run) {
        run.recordModelCall();
        Future<Message> future = submit(snapshot, tools);

        try (CancellationSignal.Subscription ignored = cancellation.onCancel(() -> future.cancel(true))) {
            Message reply = future.get();
            if (reply == null || reply.getRole() != Message.Role.assistant) {
                throw new AgentException(modelAdapter.provider() + " returned no assistant message");
            }
            return reply;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("interrupted while waiting for the model");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AgentException agentException) {
                throw agentException;
            }
            throw new AgentException("model call failed: " + cause, cause);
        }
    }

    private Future<Message> submit(List<Message> snapshot, List<ToolSpec> tools) {
        try {
            return executor.submit(() -> modelAdapter.send(snapshot, tools));
        } catch (RejectedExecutionException e) {
            throw new AgentException("no worker available for the model call", e);
        }
    }

    private void cancel(AgentState state, ToolContext context) {
        log.warn("Run cancelled after {} step(s) [session={}]", state.getStepCount(), context.getSessionId());
        state.terminate(TerminationReason.CANCELLED, null);
    }
}
