package com.deepansh.codeagent.prompt;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Finds project instruction files ({@code AGENTS.md} or {@code agents.md}) from the
 * workspace root up to the filesystem root. Outermost files come first so that
 * instructions closer to the workspace read last and win.
 */
@Component
@Slf4j
public class AgentsMdLoader {

    static final List<String> FILE_NAMES = List.of("AGENTS.md", "agents.md");

    public List<Path> find(Path workspaceRoot) {
        List<Path> found = new ArrayList<>();
        Path current = workspaceRoot.toAbsolutePath().normalize();
        while (current != null) {
            for (String name : FILE_NAMES) {
                Path candidate = current.resolve(name);
                if (Files.isRegularFile(candidate) && !containsSameFile(found, candidate)) {
                    found.add(candidate);
                }
            }
            current = current.getParent();
        }
        Collections.reverse(found);
        return found;
    }

    /** One {@code ## <path>} section per file; "(none)" when there are no files */
    public String render(Path workspaceRoot) {
        List<String> blocks = new ArrayList<>();
        for (Path file : find(workspaceRoot)) {
            try {
                String content = Files.readString(file, StandardCharsets.UTF_8).strip();
                blocks.add("## " + file + "\n" + content);
            } catch (IOException e) {
                log.warn("Could not read {}: {}", file, e.getMessage());
            }
        }
        return blocks.isEmpty() ? "(none)" : String.join("\n\n", blocks);
    }

    // On case-insensitive filesystems AGENTS.md and agents.md are the same file
    private static boolean containsSameFile(List<Path> found, Path candidate) {
        for (Path existing : found) {
            try {
                if (existing.getParent().equals(candidate.getParent()) && Files.isSameFile(existing, candidate)) {
                    return true;
                }
            } catch (IOException e) {
                log.debug("Could not compare {} and {}: {}", existing, candidate, e.getMessage());
            }
        }
        return false;
    }
}
