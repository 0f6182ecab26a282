package com.deepansh.codeagent.subagent;

import com.deepansh.codeagent.config.AgentProperties;
import com.deepansh.codeagent.exception.ToolConfigurationException;
import com.deepansh.codeagent.model.SandboxMode;
import com.deepansh.codeagent.tool.SandboxGate;
import com.deepansh.codeagent.tool.ToolRegistry;
import com.deepansh.codeagent.tool.impl.DelegateTaskTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Subagent profiles with their tool views bound up front.
 *
 * Binding runs once, here, so a profile naming an unknown tool, a mutating tool
 * without a write-capable sandbox override, or {@code delegate_task} fails
 * application startup instead of a later delegation.
 */
@Component
@Slf4j
public class SubagentCatalog {

    public record BoundProfile(SubagentProfile profile, SandboxGate gate) {
    }

    private final Map<String, BoundProfile> profiles = new TreeMap<>();

    @Autowired
    public SubagentCatalog(AgentProperties agentProperties, SandboxGate gate) {
        this(fromProperties(agentProperties.getSubagents()), gate);
    }

    public SubagentCatalog(Collection<SubagentProfile> definitions, SandboxGate gate) {
        Collection<SubagentProfile> source = definitions.isEmpty() ? SubagentProfile.defaults() : definitions;
        for (SubagentProfile profile : source) {
            bind(profile, gate);
        }
        log.info("Subagent profiles: {}", profiles.keySet());
    }

    private void bind(SubagentProfile profile, SandboxGate gate) {
        String name = profile.name();
        if (name == null || name.isBlank()) {
            throw new ToolConfigurationException("subagent profile without a name");
        }
        if (profiles.containsKey(name)) {
            throw new ToolConfigurationException("duplicate subagent profile: " + name);
        }
        if (profile.maxSteps() < 1) {
            throw new ToolConfigurationException("subagent '" + name + "' must allow at least one step");
        }
        if (profile.allowedToolNames().contains(DelegateTaskTool.NAME)) {
            throw new ToolConfigurationException("subagent '" + name + "' cannot use " + DelegateTaskTool.NAME
                    + ": delegation is limited to one level");
        }

        boolean allowMutating = profile.sandboxMode() != null && profile.sandboxMode() != SandboxMode.READ_ONLY;
        ToolRegistry view;
        try {
            view = gate.registry().restrictTo(profile.allowedToolNames(), allowMutating);
        } catch (ToolConfigurationException e) {
            throw new ToolConfigurationException("subagent '" + name + "': " + e.getMessage());
        }
        profiles.put(name, new BoundProfile(profile, gate.withRegistry(view)));
        log.debug("Bound subagent [{}] to tools {}", name, view.names());
    }

    public Optional<BoundProfile> find(String name) {
        return Optional.ofNullable(profiles.get(name));
    }

    /** Profiles sorted by name */
    public List<SubagentProfile> profiles() {
        return profiles.values().stream().map(BoundProfile::profile).toList();
    }

    public List<String> names() {
        return List.copyOf(profiles.keySet());
    }

    private static List<SubagentProfile> fromProperties(List<AgentProperties.Subagent> configured) {
        List<SubagentProfile> result = new ArrayList<>();
        for (AgentProperties.Subagent s : configured) {
            result.add(new SubagentProfile(s.getName(), s.getDescription(), s.getInstructions(),
                    s.getTools(), s.getMaxSteps(), s.getSandboxMode()));
        }
        return result;
    }
}
