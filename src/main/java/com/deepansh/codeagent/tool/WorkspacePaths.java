package com.deepansh.codeagent.tool;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Path resolution shared by the sandbox gate and the file tools.
 *
 * A raw argument is resolved against the workspace root, {@code ..} segments
 * are normalized away, and symlinks are followed through the longest prefix
 * that exists on disk. The result can then be compared against the (real)
 * workspace root, so neither traversal nor a symlink pointing outside can
 * smuggle a path past the check.
 */
public final class WorkspacePaths {

    private WorkspacePaths() {
    }

    public static Path realRoot(Path workspaceRoot) {
        try {
            Path absolute = workspaceRoot.toAbsolutePath().normalize();
            Files.createDirectories(absolute);
            return absolute.toRealPath();
        } catch (IOException e) {
            throw new UncheckedIOException("cannot resolve workspace root " + workspaceRoot, e);
        }
    }

    public static Path resolve(Path realRoot, String raw) {
        String expanded = raw.equals("~") || raw.startsWith("~/")
                ? System.getProperty("user.home") + raw.substring(1)
                : raw;
        Path candidate = Paths.get(expanded);
        Path absolute = candidate.isAbsolute() ? candidate : realRoot.resolve(candidate);
        return followExistingPrefix(absolute.normalize());
    }

    public static boolean isWithin(Path realRoot, Path resolved) {
        return resolved.startsWith(realRoot);
    }

    private static Path followExistingPrefix(Path path) {
        Path existing = path;
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            return path;
        }
        try {
            Path real = existing.toRealPath();
            return real.resolve(existing.relativize(path)).normalize();
        } catch (IOException e) {
            return path;
        }
    }
}
