package com.autonomous.ralph.controller;

import com.autonomous.ralph.model.TerminalOptions;
import com.autonomous.ralph.model.TerminalSession;
import com.autonomous.ralph.service.TerminalMultiplexerService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/terminal")
@Profile("!worker")
public class TerminalController {

    @Autowired
    private TerminalMultiplexerService terminals;

    @GetMapping("/sessions")
    public List<TerminalSession> sessions() {
        return terminals.sessions();
    }

    @PostMapping("/sessions")
    public ResponseEntity<?> create(@RequestBody(required = false) TerminalOptions options) {
        String sessionId = terminals.createSession(options);
        return ResponseEntity.ok(Map.of("sessionId", sessionId));
    }

    @GetMapping("/worker-status")
    public ResponseEntity<?> workerStatus() {
        return ResponseEntity.ok(Map.of("connected", terminals.hasWorker()));
    }
}
