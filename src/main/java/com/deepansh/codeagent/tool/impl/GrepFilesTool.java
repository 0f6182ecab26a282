package com.deepansh.codeagent.tool.impl;

import com.deepansh.codeagent.exception.ToolExecutionException;
import com.deepansh.codeagent.tool.AgentTool;
import com.deepansh.codeagent.tool.ToolArguments;
import com.deepansh.codeagent.tool.ToolContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

/**
 * Regex search across workspace files. Output lines are {@code file:line:text}.
 *
 * A glob without a slash matches file names ({@code *.java}); one with a slash
 * matches paths relative to the search root.
 * Files that are not valid UTF-8 are skipped.
 */
@Component
@Slf4j
public class GrepFilesTool implements AgentTool {

    static final int DEFAULT_MAX_RESULTS = 200;
    static final int MAX_RESULTS_LIMIT = 2000;

    @Override
    public String getName() {
        return "grep_files";
    }

    @Override
    public String getDescription() {
        return """
                Search for a regex pattern across files.
                Prefer this tool over exec_command with grep or rg.
                Output format is file:line_number:matching_line.
                Use the glob parameter to restrict to specific file types (e.g., '*.java', '*.{ts,tsx}').
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "pattern", Map.of(
                                "type", "string",
                                "description", "Regex pattern to search for in file contents."
                        ),
                        "path", Map.of(
                                "type", "string",
                                "description", "Directory or file to search in. Defaults to the workspace root ('.')."
                        ),
                        "glob", Map.of(
                                "type", "string",
                                "description", "Glob pattern to filter which files are searched (e.g., '*.py', 'src/**/*.rs')."
                        ),
                        "max_results", Map.of(
                                "type", "integer",
                                "minimum", 1,
                                "maximum", MAX_RESULTS_LIMIT,
                                "description", "Maximum number of matching lines to return. Defaults to 200. Range: 1-2000."
                        )
                ),
                "required", List.of("pattern"),
                "additionalProperties", false
        );
    }

    @Override
    public String execute(Map<String, Object> arguments, ToolContext context) throws IOException {
        Pattern pattern = compile(ToolArguments.requiredString(arguments, "pattern"));
        Path root = context.resolvePath(ToolArguments.string(arguments, "path", "."));
        String glob = ToolArguments.string(arguments, "glob", null);
        int maxResults = ToolArguments.clampedInteger(arguments, "max_results", DEFAULT_MAX_RESULTS, 1, MAX_RESULTS_LIMIT);

        if (!Files.exists(root)) {
            throw new ToolExecutionException("path does not exist: " + context.display(root));
        }
        PathMatcher matcher = glob == null || glob.isBlank()
                ? null
                : FileSystems.getDefault().getPathMatcher("glob:" + glob);
        boolean matchWholePath = glob != null && glob.contains("/");

        List<String> matches = new ArrayList<>();
        try (Stream<Path> stream = Files.walk(root)) {
            List<Path> files = stream.filter(Files::isRegularFile).sorted().toList();
            for (Path file : files) {
                if (matcher != null) {
                    Path candidate = matchWholePath ? root.relativize(file) : file.getFileName();
                    if (!matcher.matches(candidate)) {
                        continue;
                    }
                }
                if (scan(file, pattern, context, matches, maxResults)) {
                    break;
                }
            }
        }
        log.debug("grep '{}' under {} → {} matches", pattern.pattern(), root, matches.size());
        return matches.isEmpty() ? "(no matches)" : String.join("\n", matches);
    }

    /** @return true once the result cap is reached */
    private boolean scan(Path file, Pattern pattern, ToolContext context, List<String> matches, int maxResults) {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(Files.readAllBytes(file))).toString();
        } catch (CharacterCodingException e) {
            return false;
        } catch (IOException e) {
            log.debug("Skipping unreadable file {}: {}", file, e.getMessage());
            return false;
        }

        String display = context.display(file);
        List<String> lines = text.lines().toList();
        for (int i = 0; i < lines.size(); i++) {
            Matcher m = pattern.matcher(lines.get(i));
            if (m.find()) {
                matches.add(display + ":" + (i + 1) + ":" + lines.get(i));
                if (matches.size() >= maxResults) {
                    return true;
                }
            }
        }
        return false;
    }

    private static Pattern compile(String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ToolExecutionException("invalid regex pattern: " + e.getDescription());
        }
    }
}
