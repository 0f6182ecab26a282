package com.deepansh.codeagent.subagent;

import com.deepansh.codeagent.model.SandboxMode;

import java.util.List;

/**
 * Immutable catalog entry describing a delegated role.
 *
 * @param sandboxMode optional override; null means read-only. Never more
 *                    permissive than the delegating session.
 */
public record SubagentProfile(
        String name,
        String description,
        String instructions,
        List<String> allowedToolNames,
        int maxSteps,
        SandboxMode sandboxMode
) {

    public SubagentProfile {
        allowedToolNames = allowedToolNames == null ? List.of() : List.copyOf(allowedToolNames);
    }

    static final List<String> READ_TOOLS = List.of("list_files", "read_file", "grep_files");

    static List<SubagentProfile> defaults() {
        return List.of(
                new SubagentProfile("general",
                        "General-purpose delegate for focused task execution.",
                        "You are a delegated helper agent. Focus only on the assigned sub-task, keep answers concise, "
                                + "and report concrete results.",
                        READ_TOOLS, 8, null),
                new SubagentProfile("reviewer",
                        "Review code changes and identify bugs and risks.",
                        "You are a code reviewer subagent. Prioritize correctness, regressions, and missing tests. "
                                + "Provide findings first, then a short summary.",
                        READ_TOOLS, 8, null),
                new SubagentProfile("researcher",
                        "Inspect codebase context and summarize findings.",
                        "You are a research subagent. Gather high-signal facts from files and tools, state assumptions "
                                + "clearly, and return a structured summary.",
                        READ_TOOLS, 8, null)
        );
    }
}
