package com.deepansh.codeagent.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Permission tier for mutating tools. Declared from least to most permissive.
 */
public enum SandboxMode {

    READ_ONLY("read-only"),
    WORKSPACE_WRITE("workspace-write"),
    DANGER_FULL_ACCESS("danger-full-access");

    private final String value;

    SandboxMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** The less permissive of the two modes */
    public SandboxMode capTo(SandboxMode ceiling) {
        return this.ordinal() <= ceiling.ordinal() ? this : ceiling;
    }

    @JsonCreator
    public static SandboxMode fromValue(String value) {
        return Arrays.stream(values())
                .filter(m -> m.value.equalsIgnoreCase(value) || m.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown sandbox mode: " + value));
    }

    @Override
    public String toString() {
        return value;
    }
}
