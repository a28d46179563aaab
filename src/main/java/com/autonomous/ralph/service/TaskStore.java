package com.autonomous.ralph.service;

import com.autonomous.ralph.model.Task;
import com.autonomous.ralph.model.TaskStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.*;
import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Task table backed by an append-only journal ({@code tasks.jsonl}).
 *
 * <p>Each save appends a full snapshot of the task. Snapshots are serialized on the
 * caller's thread and written by a single background thread, so journal order
 * matches save order and callers never wait on disk.
 */
@Slf4j
@Service
@Profile("!worker")
public class TaskStore {

    @Value("${ralph.data.path:data}")
    private String dataPath;

    private final Clock clock;
    private final ObjectMapper mapper;
    private final Map<Long, Task> tasks = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final ExecutorService journalWriter = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "task-journal");
        thread.setDaemon(true);
        return thread;
    });

    public TaskStore(Clock clock) {
        this.clock = clock;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public void setDataPath(String path) {
        this.dataPath = path;
    }

    @PostConstruct
    public void init() {
        loadJournal();
    }

    @PreDestroy
    public void shutdown() {
        journalWriter.shutdown();
        try {
            if (!journalWriter.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Task journal writer did not drain in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Creates and journals a task in {@code pending}.
     */
    public Task create(String project, String instruction, String prompt, String requestedBy, String branchLabel) {
        var now = clock.instant();
        Task task = Task.builder()
            .id(sequence.incrementAndGet())
            .project(project)
            .instruction(instruction)
            .prompt(prompt)
            .requestedBy(requestedBy)
            .branchLabel(branchLabel)
            .status(TaskStatus.PENDING)
            .createdAt(now)
            .updatedAt(now)
            .build();
        tasks.put(task.getId(), task);
        persist(task);
        return task;
    }

    /**
     * Stamps {@code updatedAt} and journals the task's current state.
     */
    public void save(Task task) {
        task.setUpdatedAt(clock.instant());
        tasks.put(task.getId(), task);
        persist(task);
    }

    public Optional<Task> find(long id) {
        return Optional.ofNullable(tasks.get(id));
    }

    public List<Task> findByStatus(TaskStatus status) {
        return tasks.values().stream()
            .filter(t -> t.getStatus() == status)
            .sorted(Comparator.comparingLong(Task::getId))
            .toList();
    }

    public List<Task> findActive() {
        return tasks.values().stream()
            .filter(t -> !t.isTerminal())
            .sorted(Comparator.comparingLong(Task::getId))
            .toList();
    }

    /**
     * Most recent first, optionally restricted to one project.
     */
    public List<Task> findRecent(String project, int limit) {
        return tasks.values().stream()
            .filter(t -> project == null || project.equals(t.getProject()))
            .sorted(Comparator.comparingLong(Task::getId).reversed())
            .limit(Math.max(0, limit))
            .map(t -> t.toBuilder().build())
            .toList();
    }

    public int size() {
        return tasks.size();
    }

    /**
     * Blocks until every journal write queued so far has reached disk.
     */
    public void flush() {
        try {
            journalWriter.submit(() -> { }).get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.warn("Task journal flush failed: {}", e.getMessage());
        }
    }

    private void persist(Task task) {
        String json;
        try {
            json = mapper.writeValueAsString(task);
        } catch (IOException e) {
            log.error("Failed to serialize task {}: {}", task.getId(), e.getMessage());
            return;
        }
        journalWriter.execute(() -> appendLine(json));
    }

    private void appendLine(String json) {
        try {
            Path journal = Paths.get(dataPath, "tasks.jsonl");
            Files.createDirectories(journal.getParent());
            Files.writeString(journal, json + "\n",
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("Failed to persist task snapshot: {}", e.getMessage());
        }
    }

    private void loadJournal() {
        Path journal = Paths.get(dataPath, "tasks.jsonl");
        if (!Files.exists(journal)) return;

        int[] skipped = {0};
        try (Stream<String> lines = Files.lines(journal)) {
            lines.filter(line -> !line.isBlank()).forEach(line -> {
                try {
                    Task task = mapper.readValue(line, Task.class);
                    tasks.put(task.getId(), task);
                    sequence.accumulateAndGet(task.getId(), Math::max);
                } catch (Exception e) {
                    skipped[0]++;
                }
            });
        } catch (IOException e) {
            log.error("Failed to load task journal: {}", e.getMessage());
            return;
        }
        log.info("Restored {} tasks from journal ({} malformed lines skipped)", tasks.size(), skipped[0]);
    }
}
