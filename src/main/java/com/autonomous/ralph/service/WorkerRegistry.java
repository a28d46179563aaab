package com.autonomous.ralph.service;

import com.autonomous.ralph.model.WorkerInfo;
import com.autonomous.ralph.protocol.WorkerChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Connected workers keyed by connection id, in registration order.
 *
 * <p>Removing a worker does not tell the dispatcher anything; a task the worker
 * was running stays in its last state until the liveness sweep or
 * {@link TaskDispatcherService#clearStuck(long)} picks it up.
 */
@Slf4j
@Service
@Profile("!worker")
public class WorkerRegistry {

    private final Clock clock;
    private final Map<String, WorkerInfo> workers = new LinkedHashMap<>();

    public WorkerRegistry(Clock clock) {
        this.clock = clock;
    }

    public synchronized WorkerInfo register(WorkerChannel channel, String hostname,
                                            List<String> projects, List<String> capabilities) {
        WorkerInfo worker = new WorkerInfo(channel, hostname, projects, capabilities, clock.instant());
        WorkerInfo previous = workers.put(worker.getConnectionId(), worker);
        if (previous != null) {
            // Re-registration on the same connection keeps the original position but not the slot
            log.warn("Worker {} re-registered on the same connection", hostname);
        }
        log.info("Worker registered: {} (projects: {})", hostname, String.join(", ", worker.getProjects()));
        return worker;
    }

    /**
     * First worker in registration order that supports {@code project} and has a free slot.
     */
    public synchronized Optional<WorkerInfo> findIdleWorkerFor(String project) {
        for (WorkerInfo worker : workers.values()) {
            if (worker.supports(project) && worker.isIdle()) {
                return Optional.of(worker);
            }
        }
        return Optional.empty();
    }

    public synchronized boolean anySupports(String project) {
        return workers.values().stream().anyMatch(w -> w.supports(project));
    }

    public synchronized List<String> advertisedProjects() {
        return workers.values().stream()
            .flatMap(w -> w.getProjects().stream())
            .distinct()
            .toList();
    }

    public synchronized boolean markBusy(String connectionId, long taskId) {
        WorkerInfo worker = workers.get(connectionId);
        return worker != null && worker.tryAcquire(taskId);
    }

    /**
     * Frees the slot only while it still holds {@code taskId}.
     */
    public synchronized boolean markIdle(String connectionId, long taskId) {
        WorkerInfo worker = workers.get(connectionId);
        return worker != null && worker.release(taskId);
    }

    public synchronized void markIdle(String connectionId) {
        WorkerInfo worker = workers.get(connectionId);
        if (worker != null) {
            worker.forceRelease();
        }
    }

    /**
     * Frees any worker whose slot still points at {@code taskId}.
     */
    public synchronized int releaseTask(long taskId) {
        int released = 0;
        for (WorkerInfo worker : workers.values()) {
            if (worker.release(taskId)) {
                released++;
            }
        }
        return released;
    }

    public synchronized Optional<WorkerInfo> remove(String connectionId) {
        WorkerInfo removed = workers.remove(connectionId);
        if (removed != null) {
            log.info("Worker removed: {}{}", removed.getHostname(),
                removed.getActiveTaskId() != null ? " (had active task " + removed.getActiveTaskId() + ")" : "");
        }
        return Optional.ofNullable(removed);
    }

    public synchronized Optional<WorkerInfo> get(String connectionId) {
        return Optional.ofNullable(workers.get(connectionId));
    }

    public synchronized boolean contains(String connectionId) {
        return workers.containsKey(connectionId);
    }

    public synchronized Optional<WorkerInfo> firstWorker() {
        return workers.values().stream().findFirst();
    }

    public synchronized void touch(String connectionId) {
        WorkerInfo worker = workers.get(connectionId);
        if (worker != null) {
            worker.touch(clock.instant());
        }
    }

    public synchronized boolean isEmpty() {
        return workers.isEmpty();
    }

    public synchronized int size() {
        return workers.size();
    }

    public synchronized List<WorkerInfo> snapshot() {
        return new ArrayList<>(workers.values());
    }
}
