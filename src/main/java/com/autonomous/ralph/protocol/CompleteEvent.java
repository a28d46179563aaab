package com.autonomous.ralph.protocol;

import com.autonomous.ralph.model.GitOutcome;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompleteEvent {
    private Long taskId;
    private String project;
    private boolean success;
    private long duration;
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
