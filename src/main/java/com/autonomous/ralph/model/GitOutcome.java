package com.autonomous.ralph.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GitOutcome {
    private boolean staged;
    private boolean committed;
    private boolean pushed;
    private String error;
}
