package com.deepansh.codeagent.tool.impl;

import com.deepansh.codeagent.exception.SandboxViolationException;
import com.deepansh.codeagent.exception.ToolExecutionException;
import com.deepansh.codeagent.model.SandboxMode;
import com.deepansh.codeagent.tool.ToolContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileToolsTest {

    @TempDir
    Path tempDir;

    private ToolContext context;

    @BeforeEach
    void setUp() throws Exception {
        context = ToolContext.builder().sessionId("t").workspaceRoot(tempDir).build();
        Files.createDirectories(tempDir.resolve("src/main"));
        Files.writeString(tempDir.resolve("src/main/App.java"), "class App {\n  void run() {}\n}\n");
        Files.writeString(tempDir.resolve("README.md"), "# Title\nrun the app\n");
    }

    @Test
    void listFiles_recursive_marksDirectories() throws Exception {
        String result = new ListFilesTool().execute(Map.of(), context);

        assertThat(result.lines()).containsExactly("README.md", "src/", "src/main/", "src/main/App.java");
    }

    @Test
    void listFiles_nonRecursive_andTruncation() throws Exception {
        ListFilesTool tool = new ListFilesTool();

        assertThat(tool.execute(Map.of("recursive", false), context).lines()).containsExactly("README.md", "src/");
        assertThat(tool.execute(Map.of("max_entries", 1), context)).contains("... truncated at 1 entries");
    }

    @Test
    void listFiles_missingPath_fails() {
        assertThatThrownBy(() -> new ListFilesTool().execute(Map.of("path", "nope"), context))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageContaining("path does not exist");
    }

    @Test
    void readFile_numbersLines_andHonoursWindow() throws Exception {
        String result = new ReadFileTool().execute(
                Map.of("path", "src/main/App.java", "start_line", 2, "num_lines", 1), context);

        assertThat(result).isEqualTo("     2\t  void run() {}");
    }

    @Test
    void readFile_pastEnd_andMissingFile() throws Exception {
        ReadFileTool tool = new ReadFileTool();

        assertThat(tool.execute(Map.of("path", "README.md", "start_line", 50), context)).isEqualTo("(no content)");
        assertThatThrownBy(() -> tool.execute(Map.of("path", "missing.txt"), context))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageContaining("file not found");
    }

    @Test
    void readFile_outsideWorkspace_isRejected() {
        assertThatThrownBy(() -> new ReadFileTool().execute(Map.of("path", "../../etc/passwd"), context))
                .isInstanceOf(SandboxViolationException.class);
    }

    @Test
    void grepFiles_reportsPathLineAndText() throws Exception {
        String result = new GrepFilesTool().execute(Map.of("pattern", "run"), context);

        assertThat(result.lines()).containsExactly("README.md:2:run the app", "src/main/App.java:2:  void run() {}");
    }

    @Test
    void grepFiles_glob_andSkipsBinary() throws Exception {
        Files.write(tempDir.resolve("blob.bin"), new byte[]{(byte) 0xC3, (byte) 0x28, 'r', 'u', 'n'});
        GrepFilesTool tool = new GrepFilesTool();

        assertThat(tool.execute(Map.of("pattern", "run", "glob", "*.java"), context))
                .isEqualTo("src/main/App.java:2:  void run() {}");
        assertThat(tool.execute(Map.of("pattern", "run"), context)).doesNotContain("blob.bin");
        assertThat(tool.execute(Map.of("pattern", "zzz"), context)).isEqualTo("(no matches)");
    }

    @Test
    void grepFiles_invalidRegex_fails() {
        assertThatThrownBy(() -> new GrepFilesTool().execute(Map.of("pattern", "(unclosed"), context))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageContaining("invalid regex pattern");
    }

    @Test
    void writeFile_createsParents_andAppends() throws Exception {
        WriteFileTool tool = new WriteFileTool();

        String first = tool.execute(Map.of("path", "out/notes.txt", "content", "line1\n"), context);
        tool.execute(Map.of("path", "out/notes.txt", "content", "line2\n", "mode", "append"), context);

        assertThat(first).isEqualTo("wrote 6 bytes to out/notes.txt (overwrite)");
        assertThat(Files.readString(tempDir.resolve("out/notes.txt"), StandardCharsets.UTF_8))
                .isEqualTo("line1\nline2\n");
    }

    @Test
    void writeFile_outsideRootAllowedOnlyWithDangerFullAccess(@TempDir Path elsewhere) throws Exception {
        String target = elsewhere.resolve("x.txt").toString();
        WriteFileTool tool = new WriteFileTool();

        assertThatThrownBy(() -> tool.execute(Map.of("path", target, "content", "x"), context))
                .isInstanceOf(SandboxViolationException.class);

        ToolContext danger = ToolContext.builder().workspaceRoot(tempDir).sandboxMode(SandboxMode.DANGER_FULL_ACCESS).build();
        tool.execute(Map.of("path", target, "content", "x"), danger);
        assertThat(Files.readString(elsewhere.resolve("x.txt"))).isEqualTo("x");
    }

    @Test
    void replaceInFile_replacesUpToCount() throws Exception {
        Files.writeString(tempDir.resolve("a.txt"), "foo foo foo");
        ReplaceInFileTool tool = new ReplaceInFileTool();

        assertThat(tool.execute(Map.of("path", "a.txt", "old", "foo", "new", "bar"), context))
                .isEqualTo("applied 1 replacement(s) in a.txt");
        assertThat(tool.execute(Map.of("path", "a.txt", "old", "foo", "new", "", "count", 5), context))
                .isEqualTo("applied 2 replacement(s) in a.txt");
        assertThat(Files.readString(tempDir.resolve("a.txt"))).isEqualTo("bar  ");
        assertThat(tool.execute(Map.of("path", "a.txt", "old", "zzz", "new", "y"), context))
                .isEqualTo("no replacements made");
    }
}
