package com.deepansh.codeagent.tool.impl;

import com.deepansh.codeagent.exception.ToolExecutionException;
import com.deepansh.codeagent.tool.AgentTool;
import com.deepansh.codeagent.tool.ToolArguments;
import com.deepansh.codeagent.tool.ToolContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Exact-text replacement, left to right, up to {@code count} occurrences.
 * The file is left untouched when the text does not occur.
 */
@Component
@Slf4j
public class ReplaceInFileTool implements AgentTool {

    @Override
    public String getName() {
        return "replace_in_file";
    }

    @Override
    public String getDescription() {
        return """
                Replace exact text in an existing file. PREFERRED tool for editing existing files.
                Always use read_file first to see the current content, then specify the exact old text to replace.
                MUTATING operation. The old string must match exactly (including whitespace and indentation).
                If no match is found, no changes are made.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "path", Map.of(
                                "type", "string",
                                "description", "Relative or absolute path to the file to edit."
                        ),
                        "old", Map.of(
                                "type", "string",
                                "minLength", 1,
                                "description", "The exact text to find. Must match the file content exactly, including whitespace."
                        ),
                        "new", Map.of(
                                "type", "string",
                                "description", "The replacement text. Can be empty to delete the matched text."
                        ),
                        "count", Map.of(
                                "type", "integer",
                                "minimum", 1,
                                "description", "Maximum number of occurrences to replace. Defaults to 1."
                        )
                ),
                "required", List.of("path", "old", "new"),
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
        String old = ToolArguments.requiredString(arguments, "old");
        String replacement = ToolArguments.requiredString(arguments, "new");
        int count = Math.max(1, ToolArguments.integer(arguments, "count", 1));
        Path path = context.resolvePath(ToolArguments.requiredString(arguments, "path"));

        if (!Files.isRegularFile(path)) {
            throw new ToolExecutionException("file not found: " + context.display(path));
        }

        String content = Files.readString(path, StandardCharsets.UTF_8);
        StringBuilder out = new StringBuilder(content.length());
        int from = 0;
        int replaced = 0;
        while (replaced < count) {
            int at = content.indexOf(old, from);
            if (at < 0) {
                break;
            }
            out.append(content, from, at).append(replacement);
            from = at + old.length();
            replaced++;
        }
        if (replaced == 0) {
            return "no replacements made";
        }
        out.append(content, from, content.length());

        Files.writeString(path, out.toString(), StandardCharsets.UTF_8);
        log.info("Replaced {} occurrence(s) in {}", replaced, path);
        return "applied " + replaced + " replacement(s) in " + context.display(path);
    }
}
