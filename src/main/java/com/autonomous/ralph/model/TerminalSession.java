package com.autonomous.ralph.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TerminalSession {
    private String sessionId;
    private String workerConnectionId;
    private String workerHostname;
    private String cwd;
    private String title;
    private String preset;
    private String autoCommand;
    private boolean ready;
    private Instant createdAt;
}
