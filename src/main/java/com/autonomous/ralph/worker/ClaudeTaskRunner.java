package com.autonomous.ralph.worker;

import com.autonomous.ralph.model.GitOutcome;
import com.autonomous.ralph.model.ProjectConfig;
import com.autonomous.ralph.protocol.*;
import com.autonomous.ralph.service.ProjectConfigService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one Claude Code task at a time in a local project checkout.
 *
 * <p>Progress streams to the hub as the CLI prints it. A successful run is committed
 * (and pushed when the project allows it), then the project's post-deploy command runs.
 * The run always ends with exactly one {@code complete} or {@code error} event.
 */
@Slf4j
@Service
@Profile("worker")
public class ClaudeTaskRunner {

    private static final long POST_DEPLOY_TIMEOUT_SECONDS = 30;
    private static final int COMMIT_SUBJECT_LENGTH = 50;

    @Value("${ralph.worker.claude-path:claude}")
    private String claudePath;

    private Duration taskTimeout = Duration.ofMinutes(30);

    private final ProjectConfigService projectConfigs;
    private final GitService gitService;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final AtomicReference<ActiveRun> active = new AtomicReference<>();
    private final ExecutorService runner = Executors.newSingleThreadExecutor(daemon("claude-runner"));
    private final ExecutorService streams = Executors.newCachedThreadPool(daemon("claude-stream"));

    public ClaudeTaskRunner(ProjectConfigService projectConfigs, GitService gitService, Clock clock, ObjectMapper mapper) {
        this.projectConfigs = projectConfigs;
        this.gitService = gitService;
        this.clock = clock;
        this.mapper = mapper;
    }

    public void setClaudePath(String claudePath) {
        this.claudePath = claudePath;
    }

    @Value("${ralph.worker.task-timeout-minutes:30}")
    public void setTaskTimeoutMinutes(long minutes) {
        this.taskTimeout = Duration.ofMinutes(minutes);
    }

    void setTaskTimeout(Duration taskTimeout) {
        this.taskTimeout = taskTimeout;
    }

    public Long activeTaskId() {
        ActiveRun run = active.get();
        return run != null ? run.taskId : null;
    }

    /**
     * Starts the task in the background. Answers {@code busy} and returns {@code false}
     * when another task is still running.
     */
    public boolean submit(TaskAssignment assignment, WorkerEventSink sink) {
        long taskId = assignment.getTaskId() != null ? assignment.getTaskId() : -1;
        ActiveRun run = new ActiveRun(taskId);
        if (!active.compareAndSet(null, run)) {
            log.warn("Already executing task {}, rejecting task {}", activeTaskId(), taskId);
            sink.emit(MessageTypes.WORKER_BUSY, new TaskRef(taskId));
            return false;
        }
        log.info("Received task {} for {}", taskId, assignment.getProject());
        runner.execute(() -> {
            try {
                execute(run, assignment, sink);
            } catch (RuntimeException e) {
                log.error("Task {} crashed", taskId, e);
                sink.emit(MessageTypes.WORKER_ERROR, new ErrorEvent(taskId, assignment.getProject(), e.getMessage()));
            } finally {
                active.compareAndSet(run, null);
            }
        });
        return true;
    }

    /**
     * Terminates the subprocess of {@code taskId} if it is the one running.
     */
    public boolean cancel(long taskId) {
        ActiveRun run = active.get();
        if (run == null || run.taskId != taskId) {
            return false;
        }
        log.warn("Cancelling task {}", taskId);
        run.cancelled = true;
        Process process = run.process;
        if (process != null) {
            process.destroy();
        }
        return true;
    }

    @PreDestroy
    public void shutdown() {
        ActiveRun run = active.get();
        if (run != null && run.process != null) {
            run.process.destroyForcibly();
        }
        runner.shutdownNow();
        streams.shutdownNow();
    }

    private void execute(ActiveRun run, TaskAssignment assignment, WorkerEventSink sink) {
        long taskId = run.taskId;
        String project = assignment.getProject();

        ProjectConfig config = projectConfigs.getProject(project).orElse(null);
        if (config == null) {
            fail(sink, taskId, project, "Unknown project: " + project);
            return;
        }
        if (config.getPath() == null || !new File(config.getPath()).isDirectory()) {
            fail(sink, taskId, project, "Project path not found: " + config.getPath());
            return;
        }
        File projectDir = new File(config.getPath());
        if (isBlank(assignment.getPrompt()) && isBlank(assignment.getInstruction())) {
            fail(sink, taskId, project, "Task has no instruction");
            return;
        }

        if (config.getGit() != null && config.getGit().isAutoPush() && !gitService.isClean(projectDir)) {
            log.warn("Working directory of {} has uncommitted changes", project);
        }

        String prompt = buildPrompt(assignment, config);
        log.info("Executing: {}", abbreviate(prompt, 100));
        log.info("Project: {} | Path: {}", project, projectDir);

        File prdFile = writePrd(projectDir, config, taskId, project, prompt);

        Instant startedAt = clock.instant();
        sink.emit(MessageTypes.WORKER_START, StartEvent.builder()
            .taskId(taskId)
            .project(project)
            .task(prompt)
            .startTime(startedAt.toEpochMilli())
            .build());

        EventStreamInterpreter interpreter = new EventStreamInterpreter(taskId, project, sink, clock, mapper);

        Process process;
        try {
            process = startClaude(projectDir, prompt);
        } catch (IOException e) {
            log.error("Spawn error: {}", e.getMessage());
            fail(sink, taskId, project, "Failed to spawn Claude Code: " + e.getMessage());
            return;
        }
        run.process = process;
        if (run.cancelled) {
            process.destroy();
        }

        var stdout = streams.submit(() -> pumpStdout(process, interpreter));
        var stderr = streams.submit(() -> pumpStderr(process, taskId, sink));

        boolean timedOut = false;
        int exitCode;
        try {
            if (!process.waitFor(taskTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Task {} timed out after {} minutes, killing process", taskId, taskTimeout.toMinutes());
                timedOut = true;
                process.destroyForcibly();
            }
            exitCode = process.waitFor();
            stdout.get(10, TimeUnit.SECONDS);
            stderr.get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            fail(sink, taskId, project, "Worker interrupted while running task");
            return;
        } catch (Exception e) {
            log.warn("Output of task {} not fully drained: {}", taskId, e.getMessage());
            exitCode = process.exitValue();
        }

        long duration = Duration.between(startedAt, clock.instant()).getSeconds();
        boolean success = exitCode == 0 && !timedOut && !run.cancelled;
        log.info("Claude Code finished - Exit: {}, Duration: {}s", exitCode, duration);

        TaskRunState state = interpreter.state();
        markPrdFinished(prdFile, success, duration, state.getTurns(), exitCode);

        GitOutcome git = null;
        if (success && config.getGit() != null) {
            git = gitService.commitAndPush(projectDir, commitMessage(assignment), config.getGit());
        }
        if (success && config.getPostDeploy() != null && !config.getPostDeploy().isBlank()) {
            runPostDeploy(projectDir, config.getPostDeploy());
        }

        sink.emit(MessageTypes.WORKER_COMPLETE, CompleteEvent.builder()
            .taskId(taskId)
            .project(project)
            .success(success)
            .duration(duration)
            .turns(state.getTurns())
            .cost(state.getCost())
            .tokensIn(state.getTokensIn())
            .tokensOut(state.getTokensOut())
            .filesRead(state.getFilesRead())
            .filesWritten(state.getFilesWritten())
            .filesEdited(state.getFilesEdited())
            .git(git)
            .build());
        log.info("Task {} {}", taskId, success ? "completed" : "failed");
    }

    private Process startClaude(File projectDir, String prompt) throws IOException {
        List<String> command = new ArrayList<>();
        command.add(claudePath);
        command.add("--dangerously-skip-permissions");
        command.add("-p");
        command.add(prompt);
        command.add("--output-format");
        command.add("stream-json");
        command.add("--verbose");

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(projectDir);
        pb.environment().put("NO_COLOR", "1");
        pb.environment().put("FORCE_COLOR", "0");

        log.info("Spawning Claude Code CLI...");
        Process process = pb.start();
        process.getOutputStream().close();
        return process;
    }

    private Void pumpStdout(Process process, EventStreamInterpreter interpreter) throws IOException {
        StreamLineDecoder decoder = new StreamLineDecoder();
        try (Reader reader = new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8)) {
            char[] buffer = new char[8192];
            int read;
            while ((read = reader.read(buffer)) != -1) {
                for (String line : decoder.feed(new String(buffer, 0, read))) {
                    interpreter.accept(line);
                }
            }
        }
        for (String line : decoder.flush()) {
            interpreter.accept(line);
        }
        return null;
    }

    private Void pumpStderr(Process process, long taskId, WorkerEventSink sink) throws IOException {
        try (Reader reader = new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8)) {
            char[] buffer = new char[4096];
            int read;
            while ((read = reader.read(buffer)) != -1) {
                String chunk = new String(buffer, 0, read);
                log.warn("[stderr] {}", abbreviate(chunk.trim(), 200));
                sink.emit(MessageTypes.WORKER_LOG, new LogEvent(taskId, "stderr", chunk));
            }
        }
        return null;
    }

    private String buildPrompt(TaskAssignment assignment, ProjectConfig config) {
        String base = !isBlank(assignment.getPrompt()) ? assignment.getPrompt() : assignment.getInstruction();
        // The hub already appended hints when it knows the project's structure
        if (assignment.getStructure() == null && config.getStructure() != null) {
            return base + config.getStructure().toPromptHints();
        }
        return base;
    }

    private File writePrd(File projectDir, ProjectConfig config, long taskId, String project, String prompt) {
        File ralphDir = new File(projectDir, config.getRalphDir() != null ? config.getRalphDir() : "scripts/ralph");
        File prdFile = new File(ralphDir, "prd.json");
        try {
            if (!ralphDir.isDirectory() && !ralphDir.mkdirs()) {
                throw new IOException("cannot create " + ralphDir);
            }
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("taskId", taskId);
            meta.put("project", project);
            meta.put("startedAt", clock.instant().toString());

            Map<String, Object> prd = new LinkedHashMap<>();
            prd.put("meta", meta);
            prd.put("projectStructure", config.getStructure());
            prd.put("task", Map.of("title", prompt, "description", prompt));
            prd.put("completed", false);
            mapper.writerWithDefaultPrettyPrinter().writeValue(prdFile, prd);
        } catch (IOException e) {
            log.warn("Could not write {}: {}", prdFile, e.getMessage());
        }
        return prdFile;
    }

    private void markPrdFinished(File prdFile, boolean completed, long duration, int turns, int exitCode) {
        if (!prdFile.isFile()) return;
        try {
            ObjectNode prd = (ObjectNode) mapper.readTree(prdFile);
            prd.put("completed", completed);
            ObjectNode result = prd.putObject("result");
            result.put("duration", duration);
            result.put("turns", turns);
            result.put("code", exitCode);
            mapper.writerWithDefaultPrettyPrinter().writeValue(prdFile, prd);
        } catch (IOException | ClassCastException e) {
            log.warn("Could not update {}: {}", prdFile, e.getMessage());
        }
    }

    private void runPostDeploy(File projectDir, String command) {
        log.info("Running post-deploy: {}", command);
        boolean windows = System.getProperty("os.name", "").toLowerCase().startsWith("windows");
        ProcessBuilder pb = windows
            ? new ProcessBuilder("cmd", "/c", command)
            : new ProcessBuilder("sh", "-c", command);
        pb.directory(projectDir);
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        try {
            Process process = pb.start();
            if (!process.waitFor(POST_DEPLOY_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                log.error("Post-deploy timed out after {}s", POST_DEPLOY_TIMEOUT_SECONDS);
            } else if (process.exitValue() != 0) {
                log.error("Post-deploy failed with exit code {}", process.exitValue());
            } else {
                log.info("Post-deploy completed");
            }
        } catch (IOException e) {
            log.error("Post-deploy failed: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String commitMessage(TaskAssignment assignment) {
        String subject = !isBlank(assignment.getInstruction()) ? assignment.getInstruction() : assignment.getPrompt();
        return "Ralph: " + abbreviate(subject, COMMIT_SUBJECT_LENGTH);
    }

    private void fail(WorkerEventSink sink, long taskId, String project, String error) {
        log.error("Task {} failed: {}", taskId, error);
        sink.emit(MessageTypes.WORKER_ERROR, new ErrorEvent(taskId, project, error));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String abbreviate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            Thread thread = new Thread(r, name);
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class ActiveRun {
        private final long taskId;
        private volatile Process process;
        private volatile boolean cancelled;

        private ActiveRun(long taskId) {
            this.taskId = taskId;
        }
    }
}
