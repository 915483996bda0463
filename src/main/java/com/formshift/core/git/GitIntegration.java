package com.formshift.core.git;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Records conversion output in the git repository that contains it.
 * <p>
 * Shells out to the {@code git} CLI via {@link ProcessBuilder}; no git library is used.
 */
@Service
public class GitIntegration {

    private static final Logger log = LoggerFactory.getLogger(GitIntegration.class);

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    /** Exit code and merged stdout/stderr of one git invocation. */
    record GitResult(int exitCode, String output) {
        boolean ok() {
            return exitCode == 0;
        }
    }

    private final String gitExecutable;

    public GitIntegration() {
        this("git");
    }

    GitIntegration(String gitExecutable) {
        this.gitExecutable = gitExecutable;
    }

    /** Nearest ancestor of {@code start} (inclusive) holding a {@code .git} entry. */
    public Optional<Path> findRepositoryRoot(Path start) {
        Path current = start.toAbsolutePath().normalize();
        while (current != null) {
            if (Files.exists(current.resolve(".git"))) {
                return Optional.of(current);
            }
            current = current.getParent();
        }
        return Optional.empty();
    }

    public boolean isRepository(Path path) {
        return findRepositoryRoot(path).isPresent();
    }

    /**
     * Expands {@code {timestamp}} ({@code yyyyMMdd-HHmmss}) and {@code {date}}
     * ({@code yyyyMMdd}) in a branch name pattern.
     */
    public static String branchName(String pattern, LocalDateTime now) {
        return pattern
                .replace("{timestamp}", TIMESTAMP.format(now))
                .replace("{date}", DATE.format(now));
    }

    /**
     * Creates and checks out a new branch named after {@code pattern}.
     *
     * @return the branch name
     * @throws GitException if {@code path} is not inside a repository or git refuses
     */
    public String createBranch(Path path, String pattern) {
        Path root = requireRepository(path);
        String branch = branchName(pattern, LocalDateTime.now());
        GitResult result = runGit(root, "checkout", "-b", branch);
        if (!result.ok()) {
            throw new GitException("Failed to create branch '%s' (exit code %d): %s"
                    .formatted(branch, result.exitCode(), result.output()));
        }
        log.info("Created branch '{}' in {}", branch, root);
        return branch;
    }

    /**
     * Stages {@code paths} and commits them. Paths outside the repository are ignored.
     *
     * @return {@code false} when nothing was staged, so no commit was made
     * @throws GitException if {@code repositoryPath} is not inside a repository or git refuses
     */
    public boolean stageAndCommit(Path repositoryPath, Collection<Path> paths, String message) {
        Path root = requireRepository(repositoryPath);
        List<String> add = new ArrayList<>(List.of("add", "--"));
        for (Path p : paths) {
            Path absolute = p.toAbsolutePath().normalize();
            if (absolute.startsWith(root)) {
                add.add(root.relativize(absolute).toString());
            } else {
                log.debug("Not staging {}: outside {}", absolute, root);
            }
        }
        if (add.size() == 2) {
            return false;
        }
        GitResult added = runGit(root, add.toArray(String[]::new));
        if (!added.ok()) {
            throw new GitException("git add failed (exit code %d): %s".formatted(added.exitCode(), added.output()));
        }
        if (runGit(root, "diff", "--cached", "--quiet").ok()) {
            log.info("Nothing to commit in {}", root);
            return false;
        }
        GitResult commit = runGit(root, "commit", "-m", message);
        if (!commit.ok()) {
            throw new GitException("git commit failed (exit code %d): %s".formatted(commit.exitCode(), commit.output()));
        }
        log.info("Committed {} path(s) in {}", add.size() - 2, root);
        return true;
    }

    private Path requireRepository(Path path) {
        return findRepositoryRoot(path)
                .orElseThrow(() -> new GitException("Not a git repository: " + path));
    }

    GitResult runGit(Path workDir, String... args) {
        List<String> command = new ArrayList<>();
        command.add(gitExecutable);
        command.addAll(List.of(args));
        log.debug("Running: {}", String.join(" ", command));
        try {
            Process process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .start();
            String output;
            try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.lines().collect(Collectors.joining("\n"));
            }
            return new GitResult(process.waitFor(), output);
        } catch (IOException e) {
            throw new GitException("Git command failed: " + String.join(" ", command), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitException("Interrupted running: " + String.join(" ", command), e);
        }
    }
}
