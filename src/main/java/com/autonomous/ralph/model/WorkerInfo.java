package com.autonomous.ralph.model;

import com.autonomous.ralph.protocol.WorkerChannel;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A connected worker and its single task slot.
 *
 * <p>The slot holds the id of the task the worker is executing. It can only be
 * acquired while empty and only be released by the holder, so a worker never
 * carries two tasks at once.
 */
@Getter
public class WorkerInfo {

    private final String connectionId;
    private final String hostname;
    private final List<String> projects;
    private final List<String> capabilities;
    private final Instant connectedAt;

    @JsonIgnore
    private final WorkerChannel channel;

    private volatile Instant lastSeen;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicReference<Long> activeTask = new AtomicReference<>();

    public WorkerInfo(WorkerChannel channel, String hostname, List<String> projects,
                      List<String> capabilities, Instant connectedAt) {
        this.channel = channel;
        this.connectionId = channel.getConnectionId();
        this.hostname = hostname;
        this.projects = projects != null ? List.copyOf(projects) : List.of();
        this.capabilities = capabilities != null ? List.copyOf(capabilities) : List.of();
        this.connectedAt = connectedAt;
        this.lastSeen = connectedAt;
    }

    public Long getActiveTaskId() {
        return activeTask.get();
    }

    @JsonIgnore
    public boolean isIdle() {
        return activeTask.get() == null;
    }

    public boolean supports(String project) {
        return projects.contains(project);
    }

    public boolean tryAcquire(long taskId) {
        return activeTask.compareAndSet(null, taskId);
    }

    /**
     * Frees the slot only if it still holds {@code taskId}.
     */
    public boolean release(long taskId) {
        Long current = activeTask.get();
        return current != null && current == taskId && activeTask.compareAndSet(current, null);
    }

    public Optional<Long> forceRelease() {
        return Optional.ofNullable(activeTask.getAndSet(null));
    }

    public void touch(Instant now) {
        this.lastSeen = now;
    }

    @Override
    public String toString() {
        return hostname + "[" + connectionId + "]";
    }
}
