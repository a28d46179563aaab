package com.autonomous.ralph.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Task {
    private long id;
    private String project;
    private String instruction;
    private String prompt;
    // Optional PRD text supplied with the request, otherwise the instruction
    private String prdContent;
    private String requestedBy;
    private String branchLabel;
    private TaskStatus status;

    // Assigned once at dispatch, never reassigned
    private String workerConnectionId;
    private String workerHostname;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant startedAt;
    private Instant completedAt;

    // Running state relayed from the worker
    private String sessionId;
    private String model;
    private int turns;
    private long tokensIn;
    private long tokensOut;
    private String lastTool;
    private String lastFile;

    private TaskResult result;
    private String failureReason;

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
