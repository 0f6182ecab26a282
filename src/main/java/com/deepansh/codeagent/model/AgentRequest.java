package com.deepansh.codeagent.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Data
public class AgentRequest {

    @NotBlank(message = "input must not be blank")
    private String input;

    /**
     * Optional. Identifies the run for cancellation; generated when absent.
     */
    private String sessionId;

    /**
     * Optional transcript to continue from. When present, the input is appended
     * as the next user message and no new system prompt is added.
     */
    private List<Message> priorMessages = new ArrayList<>();

    /**
     * Tool names the caller approves up front. Mutating calls to any other tool
     * are denied when confirmation is required.
     */
    private Set<String> approvedTools = new HashSet<>();

    // Overrides of the configured session defaults
    private SandboxMode sandboxMode;
    private ApprovalPolicy approvalPolicy;

    @Min(value = 1, message = "maxSteps must be at least 1")
    private Integer maxSteps;
}
