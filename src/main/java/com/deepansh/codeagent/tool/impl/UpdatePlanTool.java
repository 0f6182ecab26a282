package com.deepansh.codeagent.tool.impl;

import com.deepansh.codeagent.exception.ToolExecutionException;
import com.deepansh.codeagent.model.PlanItem;
import com.deepansh.codeagent.tool.AgentTool;
import com.deepansh.codeagent.tool.ToolContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Replaces the session plan wholesale. Not mutating: the plan lives in
 * session memory, not in the workspace.
 */
@Component
@Slf4j
public class UpdatePlanTool implements AgentTool {

    @Override
    public String getName() {
        return "update_plan";
    }

    @Override
    public String getDescription() {
        return """
                Create or update a lightweight task plan for the current session.
                Use this for tasks that involve 3 or more steps to help track progress.
                Each call replaces the entire plan: always include all steps with their current statuses.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "plan", Map.of(
                                "type", "array",
                                "description", "The complete list of plan steps. Each call replaces the entire plan.",
                                "items", Map.of(
                                        "type", "object",
                                        "properties", Map.of(
                                                "step", Map.of(
                                                        "type", "string",
                                                        "description", "A concise description of this task step."
                                                ),
                                                "status", Map.of(
                                                        "type", "string",
                                                        "enum", List.of("pending", "in_progress", "completed"),
                                                        "description", "Current status of this step."
                                                )
                                        ),
                                        "required", List.of("step", "status"),
                                        "additionalProperties", false
                                )
                        )
                ),
                "required", List.of("plan"),
                "additionalProperties", false
        );
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) {
        if (!(arguments.get("plan") instanceof List<?> rawItems)) {
            throw new ToolExecutionException("plan must be a list of {step, status}");
        }

        List<PlanItem> items = new ArrayList<>();
        for (Object raw : rawItems) {
            if (!(raw instanceof Map<?, ?> item)) {
                throw new ToolExecutionException("each plan item must be an object");
            }
            String step = String.valueOf(item.get("step") == null ? "" : item.get("step")).strip();
            if (step.isEmpty()) {
                throw new ToolExecutionException("plan step cannot be empty");
            }
            PlanItem.Status status;
            try {
                status = PlanItem.Status.fromValue(String.valueOf(item.get("status")).strip());
            } catch (IllegalArgumentException e) {
                throw new ToolExecutionException(e.getMessage());
            }
            items.add(new PlanItem(step, status));
        }

        context.getPlan().replace(items);
        log.info("Plan updated for session [{}]: {} steps", context.getSessionId(), items.size());
        return "{\"ok\": true, \"plan_size\": " + items.size() + "}";
    }
}
