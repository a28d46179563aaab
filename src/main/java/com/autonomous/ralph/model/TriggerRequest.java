package com.autonomous.ralph.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /api/ralph/trigger}. Dashboards send the instruction as {@code task}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TriggerRequest {
    private String project;
    private String task;
    private String instruction;
    private String prd;
    private String requestedBy;

    @JsonIgnore
    public String getInstructionText() {
        return task != null && !task.isBlank() ? task : instruction;
    }
}
