package com.deepansh.codeagent.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * When a human confirmation is required before a mutating tool runs.
 */
public enum ApprovalPolicy {

    /** Confirm the first use of each tool per session, plus calls the handler flags as destructive */
    ON_REQUEST("on-request"),

    /** Confirm every mutating call */
    ALWAYS("always"),

    NEVER("never");

    private final String value;

    ApprovalPolicy(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ApprovalPolicy fromValue(String value) {
        return Arrays.stream(values())
                .filter(p -> p.value.equalsIgnoreCase(value) || p.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown approval policy: " + value));
    }

    @Override
    public String toString() {
        return value;
    }
}
