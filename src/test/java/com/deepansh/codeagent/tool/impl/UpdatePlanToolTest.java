package com.deepansh.codeagent.tool.impl;

import com.deepansh.codeagent.exception.ToolExecutionException;
import com.deepansh.codeagent.model.PlanItem;
import com.deepansh.codeagent.tool.ToolContext;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UpdatePlanToolTest {

    private final UpdatePlanTool tool = new UpdatePlanTool();
    private final ToolContext context = ToolContext.builder().sessionId("t").build();

    @Test
    void replacesWholePlan() {
        tool.execute(Map.of("plan", List.of(Map.of("step", "old", "status", "pending"))), context);

        String result = tool.execute(Map.of("plan", List.of(
                Map.of("step", "read code", "status", "completed"),
                Map.of("step", "fix bug", "status", "in_progress"))), context);

        assertThat(result).isEqualTo("{\"ok\": true, \"plan_size\": 2}");
        assertThat(context.getPlan().snapshot()).containsExactly(
                new PlanItem("read code", PlanItem.Status.COMPLETED),
                new PlanItem("fix bug", PlanItem.Status.IN_PROGRESS));
    }

    @Test
    void rejectsEmptyStepAndUnknownStatus() {
        assertThatThrownBy(() -> tool.execute(Map.of("plan", List.of(Map.of("step", " ", "status", "pending"))), context))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageContaining("empty");
        assertThatThrownBy(() -> tool.execute(Map.of("plan", List.of(Map.of("step", "x", "status", "done"))), context))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageContaining("pending | in_progress | completed");
        assertThat(context.getPlan().isEmpty()).isTrue();
    }
}
