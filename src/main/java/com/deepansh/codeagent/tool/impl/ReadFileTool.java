package com.deepansh.codeagent.tool.impl;

import com.deepansh.codeagent.exception.ToolExecutionException;
import com.deepansh.codeagent.tool.AgentTool;
import com.deepansh.codeagent.tool.ToolArguments;
import com.deepansh.codeagent.tool.ToolContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;

/**
 * Line-numbered file reads. Each line renders as a six-wide right-aligned
 * number, a tab, then the text. Invalid UTF-8 is replaced, not rejected.
 */
@Component
@Slf4j
public class ReadFileTool implements AgentTool {

    static final int DEFAULT_NUM_LINES = 200;
    static final int MAX_NUM_LINES = 2000;

    @Override
    public String getName() {
        return "read_file";
    }

    @Override
    public String getDescription() {
        return """
                Read the contents of a file with line numbers.
                Output format is line-numbered (6-digit padded line number followed by a tab and the line content).
                Prefer this tool over exec_command with cat, head, or tail.
                Reads up to 200 lines by default starting from line 1.
                Use start_line and num_lines to read specific sections of large files.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "path", Map.of(
                                "type", "string",
                                "description", "Relative or absolute path to the file to read."
                        ),
                        "start_line", Map.of(
                                "type", "integer",
                                "minimum", 1,
                                "description", "1-based line number to start reading from. Defaults to 1."
                        ),
                        "num_lines", Map.of(
                                "type", "integer",
                                "minimum", 1,
                                "maximum", MAX_NUM_LINES,
                                "description", "Number of lines to read. Defaults to 200. Maximum: 2000."
                        )
                ),
                "required", List.of("path"),
                "additionalProperties", false
        );
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) throws IOException {
        String rawPath = ToolArguments.requiredString(arguments, "path");
        int startLine = Math.max(1, ToolArguments.integer(arguments, "start_line", 1));
        int numLines = ToolArguments.clampedInteger(arguments, "num_lines", DEFAULT_NUM_LINES, 1, MAX_NUM_LINES);

        Path path = context.resolvePath(rawPath);
        if (!Files.isRegularFile(path)) {
            throw new ToolExecutionException("file not found: " + rawPath);
        }

        List<String> lines = decodeLenient(Files.readAllBytes(path)).lines().toList();
        int from = startLine - 1;
        if (from >= lines.size()) {
            return "(no content)";
        }
        int to = Math.min(lines.size(), from + numLines);

        StringBuilder out = new StringBuilder();
        for (int i = from; i < to; i++) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(String.format("%6d\t%s", i + 1, lines.get(i)));
        }
        log.debug("Read lines {}-{} of {}", from + 1, to, path);
        return out.toString();
    }

    private static String decodeLenient(byte[] bytes) throws IOException {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }
}
