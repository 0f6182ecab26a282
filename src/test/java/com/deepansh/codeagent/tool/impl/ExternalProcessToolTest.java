package com.deepansh.codeagent.tool.impl;

import com.deepansh.codeagent.config.AgentProperties;
import com.deepansh.codeagent.exception.ToolConfigurationException;
import com.deepansh.codeagent.exception.ToolExecutionException;
import com.deepansh.codeagent.tool.ToolContext;
import com.deepansh.codeagent.tool.ToolSpec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExternalProcessToolTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();

    private ExternalProcessTool tool(String script) {
        return new ExternalProcessTool("ext", List.of("sh", "-c", script), mapper);
    }

    @Test
    void interpret_unwrapsOutputEnvelope() {
        ExternalProcessTool tool = tool("true");

        assertThat(tool.interpret("{\"output\": \"done\", \"is_error\": false}")).isEqualTo("done");
        assertThat(tool.interpret("{\"count\": 2}")).isEqualTo("{\"count\":2}");
        assertThat(tool.interpret("\"plain\"")).isEqualTo("plain");
    }

    @Test
    void interpret_errorEnvelopeAndMalformedOutput_fail() {
        ExternalProcessTool tool = tool("true");

        assertThatThrownBy(() -> tool.interpret("{\"output\": \"bad input\", \"is_error\": true}"))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessage("bad input");
        assertThatThrownBy(() -> tool.interpret("not json"))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageContaining("malformed output");
        assertThatThrownBy(() -> tool.interpret("  "))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageContaining("no output");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void execute_passesArgumentsOnStdin() throws Exception {
        ToolContext context = ToolContext.builder().workspaceRoot(tempDir).build();
        ExternalProcessTool echo = tool("cat");

        String result = echo.execute(Map.of("query", "abc"), context);

        assertThat(result).isEqualTo("{\"query\":\"abc\"}");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void execute_nonZeroExit_fails() {
        ToolContext context = ToolContext.builder().workspaceRoot(tempDir).build();

        assertThatThrownBy(() -> tool("echo broken >&2; exit 2").execute(Map.of(), context))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageContaining("exited with code 2")
                .hasMessageContaining("broken");
    }

    @Test
    void loader_buildsSpecsFromProperties() {
        AgentProperties props = new AgentProperties();
        AgentProperties.ExternalTool def = new AgentProperties.ExternalTool();
        def.setName("lint");
        def.setDescription("Run the linter");
        def.setCommand(List.of("./lint.sh"));
        def.setMutating(true);
        def.setTimeoutSeconds(30);
        def.setPathArguments(List.of("target"));
        props.setExternalTools(List.of(def));

        List<ToolSpec> specs = new ExternalToolLoader(props, mapper).load();

        assertThat(specs).singleElement().satisfies(spec -> {
            assertThat(spec.getName()).isEqualTo("lint");
            assertThat(spec.isMutating()).isTrue();
            assertThat(spec.getTimeout()).isEqualTo(Duration.ofSeconds(30));
            assertThat(spec.getPathArguments()).containsExactly("target");
            assertThat(spec.getParameterSchema()).containsEntry("type", "object");
        });
    }

    @Test
    void loader_rejectsToolWithoutCommand() {
        AgentProperties props = new AgentProperties();
        AgentProperties.ExternalTool def = new AgentProperties.ExternalTool();
        def.setName("broken");
        props.setExternalTools(List.of(def));

        assertThatThrownBy(() -> new ExternalToolLoader(props, mapper).load())
                .isInstanceOf(ToolConfigurationException.class)
                .hasMessageContaining("no command");
    }
}
