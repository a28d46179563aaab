package com.autonomous.ralph.worker;

import com.autonomous.ralph.model.GitOutcome;
import com.autonomous.ralph.model.ProjectConfig;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Stages, commits and pushes the changes Claude Code left in a project checkout.
 */
@Slf4j
@Service
@Profile("worker")
public class GitService {

    static final String COMMIT_TRAILER = "\n\nCo-Authored-By: Ralph Worker <ralph@localhost>";

    private static final long GIT_TIMEOUT_SECONDS = 60;

    /**
     * Each step runs only if the previous one succeeded; the first failure is reported in
     * {@link GitOutcome#getError()} and stops the sequence.
     */
    public GitOutcome commitAndPush(File projectDir, String message, ProjectConfig.GitSettings git) {
        GitOutcome outcome = new GitOutcome();

        log.info("Staging changes...");
        CommandResult add = runGitCommand(projectDir, "git", "add", "-A");
        if (!add.succeeded()) {
            outcome.setError("git add failed: " + add.getOutput().trim());
            return outcome;
        }
        outcome.setStaged(true);

        CommandResult status = runGitCommand(projectDir, "git", "status", "--porcelain");
        if (!status.succeeded()) {
            outcome.setError("git status failed: " + status.getOutput().trim());
            return outcome;
        }
        if (status.getOutput().isBlank()) {
            log.warn("No changes to commit");
            return outcome;
        }

        log.info("Committing changes...");
        CommandResult commit = runGitCommand(projectDir, "git", "commit", "-m", message + COMMIT_TRAILER);
        if (!commit.succeeded()) {
            outcome.setError("git commit failed: " + commit.getOutput().trim());
            return outcome;
        }
        outcome.setCommitted(true);

        if (git.isAutoPush()) {
            log.info("Pushing to {}/{}...", git.getRemote(), git.getBranch());
            CommandResult push = runGitCommand(projectDir, "git", "push", git.getRemote(), git.getBranch());
            if (!push.succeeded()) {
                outcome.setError("git push failed: " + push.getOutput().trim());
                log.error("Git push failed: {}", push.getOutput().trim());
                return outcome;
            }
            outcome.setPushed(true);
            log.info("Changes pushed to {}/{}", git.getRemote(), git.getBranch());
        }
        return outcome;
    }

    /**
     * Current branch name, or {@code null} outside a repository.
     */
    public String currentBranch(File projectDir) {
        CommandResult result = runGitCommand(projectDir, "git", "branch", "--show-current");
        return result.succeeded() ? result.getOutput().trim() : null;
    }

    public boolean isClean(File projectDir) {
        CommandResult result = runGitCommand(projectDir, "git", "status", "--porcelain");
        return result.succeeded() && result.getOutput().isBlank();
    }

    CommandResult runGitCommand(File repoDir, String... command) {
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.directory(repoDir);
            pb.redirectErrorStream(true);

            Process process = pb.start();
            String output = readProcessOutput(process);
            boolean finished = process.waitFor(GIT_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                return new CommandResult(-1, "timed out after " + GIT_TIMEOUT_SECONDS + "s");
            }
            return new CommandResult(process.exitValue(), output);
        } catch (IOException e) {
            return new CommandResult(-1, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new CommandResult(-1, "interrupted");
        }
    }

    private String readProcessOutput(Process process) throws IOException {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append("\n");
            }
        }
        return output.toString();
    }

    @Getter
    @AllArgsConstructor
    static class CommandResult {
        private final int exitCode;
        private final String output;

        boolean succeeded() {
            return exitCode == 0;
        }
    }
}
