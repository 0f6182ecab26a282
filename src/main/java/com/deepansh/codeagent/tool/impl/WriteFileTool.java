package com.deepansh.codeagent.tool.impl;

import com.deepansh.codeagent.tool.AgentTool;
import com.deepansh.codeagent.tool.ToolArguments;
import com.deepansh.codeagent.tool.ToolContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
@Slf4j
public class WriteFileTool implements AgentTool {

    @Override
    public String getName() {
        return "write_file";
    }

    @Override
    public String getDescription() {
        return """
                Write content to a file. MUTATING operation: creates a new file or overwrites/appends to an existing one.
                Parent directories are created automatically if they do not exist.
                Prefer replace_in_file for targeted edits to existing files.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "path", Map.of(
                                "type", "string",
                                "description", "Relative or absolute path to the file to write."
                        ),
                        "content", Map.of(
                                "type", "string",
                                "description", "The full text content to write to the file."
                        ),
                        "mode", Map.of(
                                "type", "string",
                                "enum", List.of("overwrite", "append"),
                                "description", "'overwrite' (default) replaces the entire file. 'append' adds content to the end."
                        )
                ),
                "required", List.of("path", "content"),
                "additionalProperties", false
        );
    }

    @Override
    public boolean isMutating() {
        return true;
    }

    @Override
    public Set<String> getPathArguments() {
        return Set.of("path");
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) throws IOException {
        String content = ToolArguments.string(arguments, "content", "");
        String mode = ToolArguments.string(arguments, "mode", "overwrite");
        Path path = context.resolvePath(ToolArguments.requiredString(arguments, "path"));

        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        if ("append".equals(mode)) {
            Files.writeString(path, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } else {
            Files.writeString(path, content, StandardCharsets.UTF_8);
        }

        int bytes = content.getBytes(StandardCharsets.UTF_8).length;
        log.info("Wrote {} bytes to {} ({})", bytes, path, mode);
        return "wrote " + bytes + " bytes to " + context.display(path) + " (" + mode + ")";
    }
}
