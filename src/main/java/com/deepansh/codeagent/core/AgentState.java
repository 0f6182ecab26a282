package com.deepansh.codeagent.core;

import com.deepansh.codeagent.model.Message;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * All mutable state of a single loop: transcript, step accounting, plan and
 * phase. Owned by one {@link AgentLoop}; only the loop thread mutates it.
 */
@Getter
public class AgentState {

    private final List<Message> messages;
    private final int maxSteps;
    private final PlanState plan;

    private int stepCount;
    private LoopPhase phase = LoopPhase.AWAITING_MODEL;
    private TerminationReason terminationReason;

    /** Failure detail when terminated with ERROR */
    private String error;

    public AgentState(List<Message> initialMessages, int maxSteps, PlanState plan) {
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be at least 1, got " + maxSteps);
        }
        this.messages = new ArrayList<>(initialMessages);
        this.maxSteps = maxSteps;
        this.plan = plan != null ? plan : new PlanState();
    }

    /** Immutable copy, safe to hand to another thread */
    public List<Message> snapshot() {
        return List.copyOf(messages);
    }

    public boolean isTerminated() {
        return phase == LoopPhase.TERMINATED;
    }

    /** Last assistant message, or null if the model never replied */
    public Message lastAssistantMessage() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).getRole() == Message.Role.assistant) {
                return messages.get(i);
            }
        }
        return null;
    }

    void append(Message message) {
        messages.add(message);
    }

    void incrementSteps() {
        stepCount++;
    }

    void enter(LoopPhase next) {
        if (phase == LoopPhase.TERMINATED) {
            throw new IllegalStateException("loop already terminated with " + terminationReason);
        }
        phase = next;
    }

    void terminate(TerminationReason reason, String error) {
        this.phase = LoopPhase.TERMINATED;
        this.terminationReason = reason;
        this.error = error;
    }
}
