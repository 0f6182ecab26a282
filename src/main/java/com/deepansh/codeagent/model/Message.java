package com.deepansh.codeagent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Canonical conversation entry, independent of any provider wire format.
 * Adapters translate to and from this shape; the loop only ever sees this.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    public enum Role {
        system, user, assistant, tool
    }

    private Role role;

    /** May be empty on assistant messages that only carry tool calls */
    private String content;

    /**
     * Thinking text from reasoning-capable models. Assistant only.
     * Never part of {@link #content} and never counted toward the final answer.
     */
    private String reasoning;

    /**
     * The provider's thinking blocks in emission order, each with its own signature.
     * Echoed back verbatim where the protocol requires it; {@link #reasoning} is their readable text.
     */
    private List<ReasoningBlock> reasoningBlocks;

    /** Present when role = assistant and the model requested tools, in emission order */
    private List<ToolCall> toolCalls;

    /** Present when role = tool: links back to the assistant's tool call id */
    private String toolCallId;

    /** Present when role = tool: the name of the tool that produced this result */
    private String name;

    /** Present when role = tool: whether the result reports a failure */
    private boolean error;

    public static Message system(String content) {
        return Message.builder().role(Role.system).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(Role.user).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(Role.assistant).content(content).build();
    }

    public static Message toolResult(ToolResult result) {
        return Message.builder()
                .role(Role.tool)
                .toolCallId(result.toolCallId())
                .name(result.toolName())
                .content(result.output())
                .error(result.error())
                .build();
    }

    @JsonIgnore
    public boolean hasToolCalls() {
        return role == Role.assistant && toolCalls != null && !toolCalls.isEmpty();
    }
}
