package com.autonomous.ralph.worker;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Counters accumulated while one Claude Code run streams its events.
 */
@Getter
@Setter
public class TaskRunState {

    private final Instant startedAt;
    private String sessionId;
    private String model;
    private int turns;
    private long tokensIn;
    private long tokensOut;
    private double cost;

    @Getter(lombok.AccessLevel.NONE)
    private final Set<String> filesRead = new LinkedHashSet<>();
    @Getter(lombok.AccessLevel.NONE)
    private final Set<String> filesWritten = new LinkedHashSet<>();
    @Getter(lombok.AccessLevel.NONE)
    private final Set<String> filesEdited = new LinkedHashSet<>();

    public TaskRunState(Instant startedAt) {
        this.startedAt = startedAt;
    }

    void recordToolFile(String tool, String file) {
        switch (tool) {
            case "Read" -> filesRead.add(file);
            case "Write" -> filesWritten.add(file);
            case "Edit" -> filesEdited.add(file);
            default -> { }
        }
    }

    void addTokens(long in, long out) {
        tokensIn += in;
        tokensOut += out;
    }

    void incrementTurns() {
        turns++;
    }

    public List<String> getFilesRead() {
        return new ArrayList<>(filesRead);
    }

    public List<String> getFilesWritten() {
        return new ArrayList<>(filesWritten);
    }

    public List<String> getFilesEdited() {
        return new ArrayList<>(filesEdited);
    }
}
