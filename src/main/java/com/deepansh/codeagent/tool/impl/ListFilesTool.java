package com.deepansh.codeagent.tool.impl;

import com.deepansh.codeagent.exception.ToolExecutionException;
import com.deepansh.codeagent.tool.AgentTool;
import com.deepansh.codeagent.tool.ToolArguments;
import com.deepansh.codeagent.tool.ToolContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Lists workspace entries, one per line. Directories carry a trailing slash.
 */
@Component
@Slf4j
public class ListFilesTool implements AgentTool {

    static final int DEFAULT_MAX_ENTRIES = 200;
    static final int MAX_ENTRIES_LIMIT = 2000;

    @Override
    public String getName() {
        return "list_files";
    }

    @Override
    public String getDescription() {
        return """
                List files and directories under a given path.
                Returns one entry per line; directories have a trailing slash.
                Prefer this tool over exec_command with ls or find for directory exploration.
                By default lists recursively up to 200 entries.
                Use recursive=false for a shallow listing of large directories.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "path", Map.of(
                                "type", "string",
                                "description", "Relative or absolute path to list. Defaults to the workspace root ('.')."
                        ),
                        "recursive", Map.of(
                                "type", "boolean",
                                "description", "If true (default), list all files recursively. Set to false for a shallow listing."
                        ),
                        "max_entries", Map.of(
                                "type", "integer",
                                "minimum", 1,
                                "maximum", MAX_ENTRIES_LIMIT,
                                "description", "Maximum number of entries to return. Defaults to 200. Range: 1-2000."
                        )
                ),
                "required", List.of(),
                "additionalProperties", false
        );
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) throws IOException {
        String rawPath = ToolArguments.string(arguments, "path", ".");
        boolean recursive = ToolArguments.bool(arguments, "recursive", true);
        int maxEntries = ToolArguments.clampedInteger(arguments, "max_entries", DEFAULT_MAX_ENTRIES, 1, MAX_ENTRIES_LIMIT);

        Path root = context.resolvePath(rawPath);
        if (!Files.exists(root)) {
            throw new ToolExecutionException("path does not exist: " + rawPath);
        }
        if (Files.isRegularFile(root)) {
            return context.display(root);
        }

        List<String> entries = new ArrayList<>();
        try (Stream<Path> stream = recursive ? Files.walk(root) : Files.list(root)) {
            List<Path> sorted = stream.filter(p -> !p.equals(root)).sorted().toList();
            for (Path item : sorted) {
                String rel = context.display(item);
                entries.add(Files.isDirectory(item) ? rel + "/" : rel);
                if (entries.size() >= maxEntries) {
                    entries.add("... truncated at " + maxEntries + " entries");
                    break;
                }
            }
        }
        log.debug("Listed {} entries under {}", entries.size(), root);
        return entries.isEmpty() ? "(empty directory)" : String.join("\n", entries);
    }
}
