package com.autonomous.ralph.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TriggerResult {
    private boolean success;
    private Long taskId;
    private String branchLabel;
    private String error;
    private DispatchError code;

    public static TriggerResult dispatched(long taskId, String branchLabel) {
        return new TriggerResult(true, taskId, branchLabel, null, null);
    }

    public static TriggerResult rejected(DispatchError code, String error) {
        return new TriggerResult(false, null, null, error, code);
    }
}
