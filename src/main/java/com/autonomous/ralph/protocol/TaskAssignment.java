package com.autonomous.ralph.protocol;

import com.autonomous.ralph.model.ProjectConfig;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskAssignment {
    private Long taskId;
    private String project;
    private String instruction;
    // instruction plus project structure hints
    private String prompt;
    private ProjectConfig.Structure structure;
}
