package com.deepansh.codeagent.tool;

import com.deepansh.codeagent.exception.ToolConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Name → tool spec lookup.
 *
 * Spring injects every {@link AgentTool} bean plus every {@link ToolSpecLoader};
 * the core never needs to know concrete tool implementations. Entries are
 * registered once at startup and never change afterwards. A duplicate name
 * is a configuration error, not a silent override.
 *
 * Subsets for subagents are built with {@link #restrictTo}, which validates
 * the requested names at binding time.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolSpec> tools = new TreeMap<>();

    @Autowired
    public ToolRegistry(List<AgentTool> toolBeans, List<ToolSpecLoader> loaders) {
        toolBeans.forEach(tool -> register(ToolSpec.from(tool)));
        loaders.forEach(loader -> loader.load().forEach(this::register));
        tools.values().forEach(spec ->
                log.info("Registered tool: [{}]{}", spec.getName(), spec.isMutating() ? " (mutating)" : ""));
        log.info("Total tools registered: {}", tools.size());
    }

    public ToolRegistry(Collection<ToolSpec> specs) {
        specs.forEach(this::register);
    }

    private void register(ToolSpec spec) {
        if (tools.containsKey(spec.getName())) {
            throw new ToolConfigurationException("duplicate tool name: " + spec.getName());
        }
        tools.put(spec.getName(), spec);
    }

    public Optional<ToolSpec> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
    }

    /** All specs sorted by name */
    public List<ToolSpec> specs() {
        return List.copyOf(tools.values());
    }

    public Set<String> names() {
        return Set.copyOf(tools.keySet());
    }

    public int size() {
        return tools.size();
    }

    /**
     * Builds a view holding only the named tools.
     *
     * @param allowMutating when false, naming a mutating tool is rejected
     * @throws ToolConfigurationException for unknown names or disallowed mutating tools
     */
    public ToolRegistry restrictTo(Collection<String> allowedNames, boolean allowMutating) {
        List<ToolSpec> selected = new ArrayList<>();
        for (String name : allowedNames) {
            ToolSpec spec = tools.get(name);
            if (spec == null) {
                throw new ToolConfigurationException("unknown tool '" + name + "'. Available tools: " + tools.keySet());
            }
            if (spec.isMutating() && !allowMutating) {
                throw new ToolConfigurationException(
                        "tool '" + name + "' is mutating and cannot be bound to a read-only view");
            }
            selected.add(spec);
        }
        return new ToolRegistry(selected);
    }
}
