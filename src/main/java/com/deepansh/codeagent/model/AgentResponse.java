package com.deepansh.codeagent.model;

import com.deepansh.codeagent.core.TerminationReason;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentResponse {

    /** Content of the last assistant message; null if the model never answered */
    private String finalAnswer;

    /** Reasoning attached to that message, kept apart from the answer */
    private String reasoning;

    private TerminationReason terminationReason;
    private int stepsUsed;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private List<PlanItem> plan = new ArrayList<>();

    /** Set when terminationReason is ERROR */
    private String error;

    private String sessionId;
}
