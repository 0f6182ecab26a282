package com.deepansh.codeagent.tool.impl;

import com.deepansh.codeagent.config.AgentProperties;
import com.deepansh.codeagent.exception.ToolConfigurationException;
import com.deepansh.codeagent.tool.ToolSpec;
import com.deepansh.codeagent.tool.ToolSpecLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Registers one {@link ExternalProcessTool} per {@code agent.external-tools} entry.
 */
@Component
@Slf4j
public class ExternalToolLoader implements ToolSpecLoader {

    private final AgentProperties agentProperties;
    private final ObjectMapper objectMapper;

    public ExternalToolLoader(AgentProperties agentProperties, ObjectMapper objectMapper) {
        this.agentProperties = agentProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ToolSpec> load() {
        List<ToolSpec> specs = new ArrayList<>();
        for (AgentProperties.ExternalTool def : agentProperties.getExternalTools()) {
            if (def.getName() == null || def.getName().isBlank()) {
                throw new ToolConfigurationException("external tool without a name");
            }
            if (def.getCommand() == null || def.getCommand().isEmpty()) {
                throw new ToolConfigurationException("external tool '" + def.getName() + "' has no command");
            }
            specs.add(ToolSpec.builder()
                    .name(def.getName())
                    .description(def.getDescription())
                    .parameterSchema(def.getParameters())
                    .mutating(def.isMutating())
                    .timeout(def.getTimeoutSeconds() == null ? null : Duration.ofSeconds(def.getTimeoutSeconds()))
                    .pathArguments(Set.copyOf(def.getPathArguments()))
                    .handler(new ExternalProcessTool(def.getName(), def.getCommand(), objectMapper))
                    .build());
            log.info("Loaded external tool [{}] → {}", def.getName(), def.getCommand());
        }
        return specs;
    }
}
