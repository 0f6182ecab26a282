package com.deepansh.codeagent.api;

import com.deepansh.codeagent.core.AgentSessionService;
import com.deepansh.codeagent.model.AgentRequest;
import com.deepansh.codeagent.model.AgentResponse;
import com.deepansh.codeagent.subagent.SubagentCatalog;
import com.deepansh.codeagent.tool.SandboxGate;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Agent endpoints.
 *
 * POST /api/v1/agent/run                    run a session to termination
 * POST /api/v1/agent/sessions/{id}/cancel   cancel a running session
 * GET  /api/v1/agent/tools                  registered tools
 * GET  /api/v1/agent/subagents              subagent profiles
 * GET  /api/v1/agent/health
 */
@RestController
@RequestMapping("/api/v1/agent")
@RequiredArgsConstructor
@Slf4j
public class AgentController {

    private final AgentSessionService sessionService;
    private final SandboxGate gate;
    private final SubagentCatalog subagentCatalog;

    @PostMapping("/run")
    public ResponseEntity<AgentResponse> run(@Valid @RequestBody AgentRequest request) {
        log.info("Agent run request [sessionId={}]", request.getSessionId());
        return ResponseEntity.ok(sessionService.run(request));
    }

    @PostMapping("/sessions/{sessionId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String sessionId) {
        if (!sessionService.cancel(sessionId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.accepted().body(Map.of("sessionId", sessionId, "cancelled", true));
    }

    @GetMapping("/tools")
    public ResponseEntity<List<Map<String, Object>>> tools() {
        List<Map<String, Object>> tools = gate.registry().specs().stream()
                .map(spec -> Map.<String, Object>of(
                        "name", spec.getName(),
                        "description", spec.getDescription() == null ? "" : spec.getDescription(),
                        "mutating", spec.isMutating()))
                .toList();
        return ResponseEntity.ok(tools);
    }

    @GetMapping("/subagents")
    public ResponseEntity<List<Map<String, Object>>> subagents() {
        List<Map<String, Object>> profiles = subagentCatalog.profiles().stream()
                .map(p -> Map.<String, Object>of(
                        "name", p.name(),
                        "description", p.description() == null ? "" : p.description(),
                        "tools", p.allowedToolNames(),
                        "maxSteps", p.maxSteps()))
                .toList();
        return ResponseEntity.ok(profiles);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}
