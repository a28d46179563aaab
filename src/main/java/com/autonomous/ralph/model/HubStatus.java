package com.autonomous.ralph.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HubStatus {
    private boolean working;
    private List<ActiveTask> activeTasks;
    private int activeCount;
    private List<WorkerSummary> workers;
    private int workersOnline;
    private List<Task> recentTasks;

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class ActiveTask {
        private long taskId;
        private String project;
        private String status;
        private long runningFor;  // seconds
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class WorkerSummary {
        private String workerId;
        private String hostname;
        private List<String> projects;
        private Long activeTask;
        private Instant connectedAt;
        private Instant lastSeen;
    }
}
