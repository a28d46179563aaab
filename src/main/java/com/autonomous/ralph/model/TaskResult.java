package com.autonomous.ralph.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Summary reported by the worker when a task finishes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskResult {
    private long duration;   // seconds
    private int turns;
    private double cost;
    private long tokensIn;
    private long tokensOut;
    @Builder.Default
    private List<String> filesRead = new ArrayList<>();
    @Builder.Default
    private List<String> filesWritten = new ArrayList<>();
    @Builder.Default
    private List<String> filesEdited = new ArrayList<>();
    private GitOutcome git;
}
