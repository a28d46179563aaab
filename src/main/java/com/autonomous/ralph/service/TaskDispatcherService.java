package com.autonomous.ralph.service;

import com.autonomous.ralph.model.*;
import com.autonomous.ralph.protocol.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Owns the task lifecycle: {@code pending -> dispatching -> running -> completed | failed | cancelled}.
 *
 * <p>Every transition is driven by an explicit request or a relayed worker event and runs
 * under this service's monitor, so a worker's slot and its task's status always change
 * together. Events for unknown or already-terminal tasks are dropped rather than relayed.
 */
@Slf4j
@Service
@Profile("!worker")
public class TaskDispatcherService {

    static final String NO_WORKERS_MESSAGE =
        "No Ralph workers connected. Start a Ralph worker on the workstation where the code lives.";
    static final String BUSY_MESSAGE = "Worker is busy with another task. Try again shortly.";

    public static final String REASON_CANCELLED = "Task cancelled by user";
    public static final String REASON_CLEARED = "timeout-or-cleared";
    public static final String REASON_WORKER_LOST = "worker-lost";
    public static final String REASON_WORKER_BUSY = "worker-busy";

    private static final int BRANCH_LABEL_LENGTH = 40;

    private final WorkerRegistry registry;
    private final TaskStore store;
    private final RelayBroadcaster relay;
    private final ProjectConfigService projectConfigs;
    private final Clock clock;

    public TaskDispatcherService(WorkerRegistry registry, TaskStore store, RelayBroadcaster relay,
                                 ProjectConfigService projectConfigs, Clock clock) {
        this.registry = registry;
        this.store = store;
        this.relay = relay;
        this.projectConfigs = projectConfigs;
        this.clock = clock;
    }

    public TriggerResult trigger(String project, String instruction, String requestedBy) {
        return trigger(project, instruction, null, requestedBy);
    }

    public synchronized TriggerResult trigger(String project, String instruction, String prd, String requestedBy) {
        if (isBlank(project) || isBlank(instruction)) {
            return TriggerResult.rejected(DispatchError.INVALID_REQUEST, "Both project and task are required");
        }
        if (registry.isEmpty()) {
            return TriggerResult.rejected(DispatchError.NO_WORKERS_CONNECTED, NO_WORKERS_MESSAGE);
        }
        if (!projectConfigs.isConfigured(project) && !registry.anySupports(project)) {
            Set<String> valid = new TreeSet<>(projectConfigs.getProjectNames());
            valid.addAll(registry.advertisedProjects());
            return TriggerResult.rejected(DispatchError.UNKNOWN_PROJECT,
                String.format("Unknown project: %s. Valid: %s", project, String.join(", ", valid)));
        }

        Optional<WorkerInfo> candidate = registry.findIdleWorkerFor(project);
        if (candidate.isEmpty()) {
            if (registry.anySupports(project)) {
                return TriggerResult.rejected(DispatchError.WORKER_BUSY, BUSY_MESSAGE);
            }
            return TriggerResult.rejected(DispatchError.NO_CAPABLE_IDLE_WORKER,
                String.format("No worker supports %s. Workers support: %s",
                    project, String.join(", ", registry.advertisedProjects())));
        }

        WorkerInfo worker = candidate.get();
        Optional<ProjectConfig.Structure> structure = projectConfigs.getProject(project).map(ProjectConfig::getStructure);
        String prompt = instruction + structure.map(ProjectConfig.Structure::toPromptHints).orElse("");
        String branchLabel = branchLabel(instruction);

        Task task = store.create(project, instruction, prompt, requestedBy, branchLabel);
        task.setPrdContent(isBlank(prd) ? instruction : prd);
        log.info("Task {} created for {} by {}: {}", task.getId(), project, requestedBy, abbreviate(instruction, 50));

        if (!registry.markBusy(worker.getConnectionId(), task.getId())) {
            fail(task, "Worker slot was taken before dispatch");
            return TriggerResult.rejected(DispatchError.WORKER_BUSY, BUSY_MESSAGE);
        }

        task.setStatus(TaskStatus.DISPATCHING);
        task.setWorkerConnectionId(worker.getConnectionId());
        task.setWorkerHostname(worker.getHostname());
        store.save(task);

        TaskAssignment assignment = TaskAssignment.builder()
            .taskId(task.getId())
            .project(project)
            .instruction(instruction)
            .prompt(prompt)
            .structure(structure.orElse(null))
            .build();
        try {
            worker.getChannel().send(MessageTypes.TASK, assignment);
        } catch (IOException e) {
            log.error("Failed to dispatch task {} to {}: {}", task.getId(), worker, e.getMessage());
            String error = "Failed to dispatch to worker: " + e.getMessage();
            fail(task, error);
            relay.broadcast(RelayEvent.forTask(RelayEventType.ERROR, task.getId(),
                new ErrorEvent(task.getId(), project, error)));
            return new TriggerResult(false, task.getId(), branchLabel, error, DispatchError.DISPATCH_FAILED);
        }

        log.info("Task {} dispatched to worker {}", task.getId(), worker.getHostname());
        relay.broadcast(RelayEvent.forTask(RelayEventType.DISPATCHED, task.getId(),
            DispatchedEvent.builder()
                .taskId(task.getId())
                .project(project)
                .task(instruction)
                .branchLabel(branchLabel)
                .workerId(worker.getConnectionId())
                .workerHostname(worker.getHostname())
                .build()));

        return TriggerResult.dispatched(task.getId(), branchLabel);
    }

    public synchronized void onWorkerStart(String connectionId, StartEvent event) {
        liveTask(connectionId, event.getTaskId(), MessageTypes.WORKER_START).ifPresent(task -> {
            if (task.getStatus() == TaskStatus.PENDING || task.getStatus() == TaskStatus.DISPATCHING) {
                task.setStatus(TaskStatus.RUNNING);
                task.setStartedAt(clock.instant());
            }
            store.save(task);
            log.info("Worker {} started task {} for {}", task.getWorkerHostname(), task.getId(), task.getProject());

            event.setProject(task.getProject());
            event.setWorkerId(connectionId);
            event.setWorkerHostname(task.getWorkerHostname());
            relay.broadcast(RelayEvent.forTask(RelayEventType.START, task.getId(), event));
        });
    }

    public synchronized void onWorkerInit(String connectionId, InitEvent event) {
        liveTask(connectionId, event.getTaskId(), MessageTypes.WORKER_INIT).ifPresent(task -> {
            task.setSessionId(event.getSessionId());
            task.setModel(event.getModel());
            store.save(task);
            relay.broadcast(RelayEvent.forTask(RelayEventType.INIT, task.getId(), event));
        });
    }

    public synchronized void onWorkerTool(String connectionId, ToolEvent event) {
        liveTask(connectionId, event.getTaskId(), MessageTypes.WORKER_TOOL).ifPresent(task -> {
            task.setLastTool(event.getTool());
            task.setLastFile(event.getFile());
            touch(task);
            log.debug("Task {} tool: {}{}", task.getId(), event.getTool(),
                event.getFile() != null ? " -> " + event.getFile() : "");
            relay.broadcast(RelayEvent.forTask(RelayEventType.TOOL, task.getId(), event));
        });
    }

    public synchronized void onWorkerThought(String connectionId, ThoughtEvent event) {
        liveTask(connectionId, event.getTaskId(), MessageTypes.WORKER_THOUGHT).ifPresent(task -> {
            touch(task);
            relay.broadcast(RelayEvent.forTask(RelayEventType.THOUGHT, task.getId(), event));
        });
    }

    public synchronized void onWorkerProgress(String connectionId, ProgressEvent event) {
        liveTask(connectionId, event.getTaskId(), MessageTypes.WORKER_PROGRESS).ifPresent(task -> {
            task.setTurns(event.getTurns());
            task.setTokensIn(event.getTokensIn());
            task.setTokensOut(event.getTokensOut());
            store.save(task);
            relay.broadcast(RelayEvent.forTask(RelayEventType.PROGRESS, task.getId(), event));
        });
    }

    public synchronized void onWorkerFile(String connectionId, FileEvent event) {
        liveTask(connectionId, event.getTaskId(), MessageTypes.WORKER_FILE).ifPresent(task -> {
            touch(task);
            relay.broadcast(RelayEvent.forTask(RelayEventType.FILE, task.getId(), event));
        });
    }

    public synchronized void onWorkerLog(String connectionId, LogEvent event) {
        liveTask(connectionId, event.getTaskId(), MessageTypes.WORKER_LOG).ifPresent(task -> {
            touch(task);
            relay.broadcast(RelayEvent.forTask(RelayEventType.LOG, task.getId(), event));
        });
    }

    /**
     * Records the final result. Returns {@code false} when the task was already terminal,
     * in which case nothing is changed or relayed.
     */
    public synchronized boolean onWorkerComplete(String connectionId, CompleteEvent event) {
        Optional<Task> live = liveTask(connectionId, event.getTaskId(), MessageTypes.WORKER_COMPLETE);
        if (live.isEmpty()) {
            return false;
        }
        Task task = live.get();
        task.setStatus(event.isSuccess() ? TaskStatus.COMPLETED : TaskStatus.FAILED);
        task.setCompletedAt(clock.instant());
        task.setTurns(event.getTurns());
        task.setTokensIn(Math.max(task.getTokensIn(), event.getTokensIn()));
        task.setTokensOut(Math.max(task.getTokensOut(), event.getTokensOut()));
        task.setResult(TaskResult.builder()
            .duration(event.getDuration())
            .turns(event.getTurns())
            .cost(event.getCost())
            .tokensIn(event.getTokensIn())
            .tokensOut(event.getTokensOut())
            .filesRead(copyOf(event.getFilesRead()))
            .filesWritten(copyOf(event.getFilesWritten()))
            .filesEdited(copyOf(event.getFilesEdited()))
            .git(event.getGit())
            .build());
        if (!event.isSuccess()) {
            task.setFailureReason("Claude Code exited with failure");
        }
        registry.markIdle(task.getWorkerConnectionId(), task.getId());
        store.save(task);

        log.info("Task {} {}: {}s, {} turns, ${}", task.getId(), task.getStatus().wireName(),
            event.getDuration(), event.getTurns(), String.format("%.4f", event.getCost()));
        if (event.getGit() != null) {
            log.info("Task {} git: staged={}, committed={}, pushed={}", task.getId(),
                event.getGit().isStaged(), event.getGit().isCommitted(), event.getGit().isPushed());
        }

        event.setProject(task.getProject());
        relay.broadcast(RelayEvent.forTask(RelayEventType.COMPLETE, task.getId(), event));
        return true;
    }

    public synchronized boolean onWorkerError(String connectionId, ErrorEvent event) {
        Optional<Task> live = liveTask(connectionId, event.getTaskId(), MessageTypes.WORKER_ERROR);
        if (live.isEmpty()) {
            return false;
        }
        Task task = live.get();
        log.error("Worker error for task {}: {}", task.getId(), event.getError());
        fail(task, event.getError());
        event.setProject(task.getProject());
        relay.broadcast(RelayEvent.forTask(RelayEventType.ERROR, task.getId(), event));
        return true;
    }

    /**
     * The worker refused the assignment because it was already running something.
     */
    public synchronized void onWorkerBusy(String connectionId, TaskRef ref) {
        liveTask(connectionId, ref.getTaskId(), MessageTypes.WORKER_BUSY).ifPresent(task -> {
            log.warn("Worker {} busy, cannot accept task {}", task.getWorkerHostname(), task.getId());
            fail(task, REASON_WORKER_BUSY);
            relay.broadcast(RelayEvent.forTask(RelayEventType.BUSY, task.getId(), ref));
        });
    }

    /**
     * Best effort: the task is marked cancelled whether or not the worker stops the process.
     */
    public synchronized boolean cancel(long taskId) {
        Optional<Task> found = store.find(taskId);
        if (found.isEmpty() || found.get().isTerminal()) {
            return false;
        }
        Task task = found.get();
        log.info("Cancelling task {}", taskId);
        signalTerminate(task);

        task.setStatus(TaskStatus.CANCELLED);
        task.setFailureReason(REASON_CANCELLED);
        task.setCompletedAt(clock.instant());
        if (task.getWorkerConnectionId() != null) {
            registry.markIdle(task.getWorkerConnectionId(), taskId);
        }
        store.save(task);

        relay.broadcast(RelayEvent.forTask(RelayEventType.CANCELLED, taskId, new TaskRef(taskId)));
        return true;
    }

    /**
     * Fails every {@code running} task not updated for {@code thresholdMinutes}. This is the
     * manual recovery path for tasks whose worker vanished.
     */
    public synchronized int clearStuck(long thresholdMinutes) {
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(thresholdMinutes));
        List<Long> cleared = new ArrayList<>();
        for (Task task : store.findByStatus(TaskStatus.RUNNING)) {
            if (task.getUpdatedAt() == null || task.getUpdatedAt().isAfter(cutoff)) {
                continue;
            }
            signalTerminate(task);
            registry.releaseTask(task.getId());
            task.setStatus(TaskStatus.FAILED);
            task.setFailureReason(REASON_CLEARED);
            task.setCompletedAt(clock.instant());
            store.save(task);
            cleared.add(task.getId());
        }
        log.info("Cleared {} stuck tasks", cleared.size());

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("count", cleared.size());
        summary.put("taskIds", cleared);
        relay.broadcast(RelayEvent.of(RelayEventType.CLEARED, summary));
        return cleared.size();
    }

    /**
     * Fails the non-terminal tasks assigned to a worker the hub has given up on.
     */
    public synchronized int onWorkerLost(String connectionId) {
        int failed = 0;
        for (Task task : store.findActive()) {
            if (connectionId.equals(task.getWorkerConnectionId())) {
                failLost(task);
                failed++;
            }
        }
        return failed;
    }

    /**
     * Fails non-terminal tasks whose worker is no longer registered and that have not been
     * updated within {@code grace}.
     */
    public synchronized int failOrphans(Duration grace) {
        Instant cutoff = clock.instant().minus(grace);
        int failed = 0;
        for (Task task : store.findActive()) {
            String owner = task.getWorkerConnectionId();
            if (owner == null || registry.contains(owner)) {
                continue;
            }
            if (task.getUpdatedAt() != null && task.getUpdatedAt().isAfter(cutoff)) {
                continue;
            }
            failLost(task);
            failed++;
        }
        return failed;
    }

    public synchronized HubStatus status() {
        Instant now = clock.instant();
        List<HubStatus.ActiveTask> active = store.findActive().stream()
            .map(t -> new HubStatus.ActiveTask(t.getId(), t.getProject(), t.getStatus().wireName(),
                Duration.between(t.getCreatedAt(), now).getSeconds()))
            .toList();
        List<HubStatus.WorkerSummary> workers = registry.snapshot().stream()
            .map(w -> new HubStatus.WorkerSummary(w.getConnectionId(), w.getHostname(), w.getProjects(),
                w.getActiveTaskId(), w.getConnectedAt(), w.getLastSeen()))
            .toList();
        return HubStatus.builder()
            .working(!active.isEmpty())
            .activeTasks(active)
            .activeCount(active.size())
            .workers(workers)
            .workersOnline(workers.size())
            .recentTasks(store.findRecent(null, 5))
            .build();
    }

    public synchronized List<Task> tasks(String project, int limit) {
        return store.findRecent(project, limit);
    }

    public synchronized Optional<Task> task(long taskId) {
        return store.find(taskId).map(t -> t.toBuilder().build());
    }

    static String branchLabel(String instruction) {
        String slug = instruction.toLowerCase().replaceAll("\\s+", "-");
        return "ralph/" + slug.substring(0, Math.min(BRANCH_LABEL_LENGTH, slug.length()));
    }

    private Optional<Task> liveTask(String connectionId, Long taskId, String eventType) {
        registry.touch(connectionId);
        if (taskId == null) {
            log.warn("Dropping {} without taskId from {}", eventType, connectionId);
            return Optional.empty();
        }
        Optional<Task> found = store.find(taskId);
        if (found.isEmpty()) {
            log.warn("Dropping {} for unknown task {}", eventType, taskId);
            return Optional.empty();
        }
        Task task = found.get();
        if (task.isTerminal()) {
            log.debug("Dropping {} for task {} already {}", eventType, taskId, task.getStatus().wireName());
            return Optional.empty();
        }
        if (task.getWorkerConnectionId() != null && !task.getWorkerConnectionId().equals(connectionId)) {
            log.warn("Dropping {} for task {} from {}, task belongs to {}",
                eventType, taskId, connectionId, task.getWorkerConnectionId());
            return Optional.empty();
        }
        return found;
    }

    private void fail(Task task, String reason) {
        task.setStatus(TaskStatus.FAILED);
        task.setFailureReason(reason);
        task.setCompletedAt(clock.instant());
        if (task.getWorkerConnectionId() != null) {
            registry.markIdle(task.getWorkerConnectionId(), task.getId());
        }
        store.save(task);
    }

    private void failLost(Task task) {
        log.warn("Task {} lost its worker {}", task.getId(), task.getWorkerHostname());
        fail(task, REASON_WORKER_LOST);
        relay.broadcast(RelayEvent.forTask(RelayEventType.ERROR, task.getId(),
            new ErrorEvent(task.getId(), task.getProject(), REASON_WORKER_LOST)));
    }

    private void signalTerminate(Task task) {
        if (task.getWorkerConnectionId() == null) return;
        registry.get(task.getWorkerConnectionId())
            .filter(worker -> worker.getChannel().isOpen())
            .ifPresent(worker -> {
                try {
                    worker.getChannel().send(MessageTypes.CANCEL, new TaskRef(task.getId()));
                } catch (IOException e) {
                    log.warn("Could not send cancel for task {} to {}: {}", task.getId(), worker, e.getMessage());
                }
            });
    }

    private void touch(Task task) {
        task.setUpdatedAt(clock.instant());
    }

    private static List<String> copyOf(List<String> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String abbreviate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
