package com.deepansh.codeagent.tool;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Immutable registry entry: what the model sees plus the handler that runs.
 * Decouples the provider serialization formats from tool implementations.
 */
@Value
@Builder
public class ToolSpec {

    @NonNull String name;

    String description;

    @NonNull Map<String, Object> parameterSchema;

    boolean mutating;

    @NonNull ToolHandler handler;

    /** Null means the session default */
    Duration timeout;

    @Builder.Default
    Set<String> pathArguments = Set.of();

    public static ToolSpec from(AgentTool tool) {
        return ToolSpec.builder()
                .name(tool.getName())
                .description(tool.getDescription().strip())
                .parameterSchema(tool.getInputSchema())
                .mutating(tool.isMutating())
                .handler(tool)
                .timeout(tool.getTimeout())
                .pathArguments(tool.getPathArguments())
                .build();
    }
}
