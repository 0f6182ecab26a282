package com.deepansh.codeagent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One provider thinking block, kept verbatim so it can be echoed back.
 *
 * A {@code thinking} block carries its text and the signature issued over it.
 * A {@code redacted_thinking} block carries only the opaque {@code data}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReasoningBlock(String type, String thinking, String signature, String data) {

    public static final String THINKING = "thinking";
    public static final String REDACTED = "redacted_thinking";

    public static ReasoningBlock thinking(String text, String signature) {
        return new ReasoningBlock(THINKING, text, signature, null);
    }

    public static ReasoningBlock redacted(String data) {
        return new ReasoningBlock(REDACTED, null, null, data);
    }

    @JsonIgnore
    public boolean isRedacted() {
        return REDACTED.equals(type);
    }
}
