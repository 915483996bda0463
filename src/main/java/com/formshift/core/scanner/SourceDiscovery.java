package com.formshift.core.scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Walks a source tree and returns the form files to convert, sorted by path.
 * <p>
 * Build output and IDE directories (e.g. {@code bin}, {@code obj}, {@code .vs}) are always
 * skipped, as is anything matching one of the caller's exclude globs (matched against the
 * path relative to the source root, using {@code /} separators).
 */
@Service
public class SourceDiscovery {

    private static final Logger log = LoggerFactory.getLogger(SourceDiscovery.class);

    /** Directories to skip during the walk. */
    private static final Set<String> IGNORE_DIRS = Set.of(
            "bin", "obj", ".git", ".vs", ".idea", ".vscode", "node_modules", "target", "build", "packages"
    );

    /**
     * @param sourceRoot      directory to walk
     * @param filePattern     glob for file names, e.g. {@code *.Designer.cs}
     * @param excludePatterns globs for relative paths to skip
     * @throws NoSuchFileException if {@code sourceRoot} is not a directory
     */
    public List<Path> discover(Path sourceRoot, String filePattern, List<String> excludePatterns) throws IOException {
        if (!Files.isDirectory(sourceRoot)) {
            throw new NoSuchFileException(sourceRoot.toString(), null, "source directory not found");
        }
        PathMatcher nameMatcher = FileSystems.getDefault().getPathMatcher("glob:" + filePattern);
        List<PathMatcher> excludes = new ArrayList<>();
        for (String pattern : excludePatterns == null ? List.<String>of() : excludePatterns) {
            excludes.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
        }

        List<Path> found;
        try (Stream<Path> stream = Files.walk(sourceRoot)) {
            found = stream.filter(Files::isRegularFile)
                    .filter(p -> !inIgnoredDirectory(sourceRoot, p))
                    .filter(p -> nameMatcher.matches(p.getFileName()))
                    .filter(p -> !isExcluded(sourceRoot, p, excludes))
                    .map(p -> p.toAbsolutePath().normalize())
                    .sorted()
                    .toList();
        }
        log.info("Discovered {} form file(s) under {}", found.size(), sourceRoot);
        return found;
    }

    private static boolean inIgnoredDirectory(Path root, Path path) {
        Path relative = root.relativize(path);
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            if (IGNORE_DIRS.contains(relative.getName(i).toString())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isExcluded(Path root, Path path, List<PathMatcher> excludes) {
        if (excludes.isEmpty()) {
            return false;
        }
        Path relative = Path.of(root.relativize(path).toString().replace('\\', '/'));
        for (PathMatcher m : excludes) {
            if (m.matches(relative) || m.matches(path.getFileName())) {
                return true;
            }
        }
        return false;
    }
}
