package org.dxworks.codelint;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Decides which files under the input path are linted.
 */
public class SourceFileDetector {

    private static final Set<String> EXCLUDED_DIRECTORIES = Set.of("node_modules", ".git", "dist", "build");

    private final List<PathMatcher> excludes = new ArrayList<>();

    public SourceFileDetector(List<String> excludeGlobs) {
        for (String glob : excludeGlobs) {
            excludes.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
        }
    }

    public static boolean isTypeScript(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase();
        return fileName.endsWith(".ts") || fileName.endsWith(".mts") || fileName.endsWith(".cts");
    }

    /**
     * @param root the directory being walked; exclusions are matched against the path relative to it
     */
    public boolean accepts(Path root, Path filePath) {
        if (!isTypeScript(filePath)) return false;
        Path relative = root.equals(filePath) ? filePath.getFileName() : root.relativize(filePath);
        for (Path segment : relative) {
            if (EXCLUDED_DIRECTORIES.contains(segment.toString())) return false;
        }
        for (PathMatcher matcher : excludes) {
            if (matcher.matches(relative)) return false;
        }
        return true;
    }
}
