package com.autonomous.ralph.service;

import com.autonomous.ralph.model.RelayEvent;
import com.autonomous.ralph.model.RelayEventType;
import com.autonomous.ralph.model.TerminalOptions;
import com.autonomous.ralph.model.TerminalSession;
import com.autonomous.ralph.model.WorkerInfo;
import com.autonomous.ralph.protocol.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes interactive shell sessions through worker connections.
 *
 * <p>A session is bound at creation to the first registered worker and never moves.
 * Input, resize and close go to that worker untouched; output and lifecycle
 * notifications coming back are broadcast to every observer.
 */
@Slf4j
@Service
@Profile("!worker")
public class TerminalMultiplexerService {

    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

    @Value("${ralph.terminal.auto-command-delay-ms:2000}")
    private long autoCommandDelayMs;

    private final WorkerRegistry registry;
    private final RelayBroadcaster relay;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final Map<String, TerminalSession> sessions = new ConcurrentHashMap<>();

    public TerminalMultiplexerService(WorkerRegistry registry, RelayBroadcaster relay,
                                      TaskScheduler scheduler,
                                      Clock clock) {
        this.registry = registry;
        this.relay = relay;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public void setAutoCommandDelayMs(long autoCommandDelayMs) {
        this.autoCommandDelayMs = autoCommandDelayMs;
    }

    /**
     * Asks the first connected worker to open a shell. Returns the new session id right
     * away; the shell is usable once the worker reports it created.
     *
     * @throws NoWorkerConnectedException when no worker is registered
     */
    public String createSession(TerminalOptions options) {
        TerminalOptions opts = options != null ? options : new TerminalOptions();
        WorkerInfo worker = registry.firstWorker().orElseThrow(NoWorkerConnectedException::new);

        TerminalSession session = TerminalSession.builder()
            .workerConnectionId(worker.getConnectionId())
            .workerHostname(worker.getHostname())
            .cwd(opts.getCwd())
            .title(opts.getTitle())
            .preset(opts.getPreset())
            .autoCommand(opts.getAutoCommand())
            .createdAt(clock.instant())
            .build();
        String sessionId = reserveId(session);

        log.info("Creating terminal session {} on {}{}{}", sessionId, worker.getHostname(),
            opts.getPreset() != null ? " (" + opts.getPreset() + ")" : "",
            opts.getAutoCommand() != null ? " [auto: " + opts.getAutoCommand() + "]" : "");

        TerminalSpec spec = new TerminalSpec(sessionId, opts.getCwd(), opts.getTitle(),
            opts.getPreset(), opts.getAutoCommand());
        try {
            worker.getChannel().send(MessageTypes.TERMINAL_CREATE, spec);
        } catch (IOException e) {
            sessions.remove(sessionId);
            log.warn("Failed to send terminal create for {}: {}", sessionId, e.getMessage());
            relay.broadcast(RelayEvent.forSession(RelayEventType.TERMINAL_ERROR, sessionId,
                new TerminalError(sessionId, e.getMessage())));
        }
        return sessionId;
    }

    public void input(TerminalData input) {
        route(input.getSessionId(), MessageTypes.TERMINAL_INPUT, input);
    }

    public void resize(TerminalResize resize) {
        route(resize.getSessionId(), MessageTypes.TERMINAL_RESIZE, resize);
    }

    /**
     * Forwards a close request. The session stays listed until the worker reports it closed.
     */
    public void close(String sessionId) {
        log.info("Closing terminal session {}", sessionId);
        route(sessionId, MessageTypes.TERMINAL_CLOSE, new TerminalRef(sessionId));
    }

    public void onCreated(String connectionId, TerminalSpec created) {
        TerminalSession session = ownedSession(connectionId, created.getSessionId());
        if (session == null) return;
        session.setReady(true);
        log.info("Terminal session created: {}{}", created.getSessionId(),
            created.getTitle() != null ? " (" + created.getTitle() + ")" : "");
        relay.broadcast(RelayEvent.forSession(RelayEventType.TERMINAL_CREATED, created.getSessionId(),
            new TerminalSpec(session.getSessionId(), session.getCwd(), session.getTitle(),
                session.getPreset(), session.getAutoCommand())));

        if (session.getAutoCommand() != null && !session.getAutoCommand().isBlank()) {
            scheduleAutoCommand(session);
        }
    }

    public void onOutput(String connectionId, TerminalData output) {
        if (ownedSession(connectionId, output.getSessionId()) == null) return;
        relay.broadcast(RelayEvent.forSession(RelayEventType.TERMINAL_OUTPUT, output.getSessionId(), output));
    }

    public void onClosed(String connectionId, TerminalClosed closed) {
        if (ownedSession(connectionId, closed.getSessionId()) == null) return;
        sessions.remove(closed.getSessionId());
        log.info("Terminal session {} closed (exit {})", closed.getSessionId(), closed.getExitCode());
        relay.broadcast(RelayEvent.forSession(RelayEventType.TERMINAL_CLOSED, closed.getSessionId(), closed));
    }

    public void onError(String connectionId, TerminalError error) {
        if (error.getSessionId() != null && ownedSession(connectionId, error.getSessionId()) != null) {
            sessions.remove(error.getSessionId());
        }
        log.warn("Terminal error for session {}: {}", error.getSessionId(), error.getError());
        relay.broadcast(RelayEvent.forSession(RelayEventType.TERMINAL_ERROR, error.getSessionId(), error));
    }

    /**
     * Drops every session hosted by a worker that went away.
     */
    public void onWorkerDisconnected(String connectionId) {
        List<String> dropped = new ArrayList<>();
        sessions.values().removeIf(session -> {
            if (connectionId.equals(session.getWorkerConnectionId())) {
                dropped.add(session.getSessionId());
                return true;
            }
            return false;
        });
        for (String sessionId : dropped) {
            relay.broadcast(RelayEvent.forSession(RelayEventType.TERMINAL_CLOSED, sessionId,
                new TerminalClosed(sessionId, null)));
        }
        if (!dropped.isEmpty()) {
            log.info("Dropped {} terminal sessions of disconnected worker {}", dropped.size(), connectionId);
        }
    }

    public boolean hasWorker() {
        return !registry.isEmpty();
    }

    public List<TerminalSession> sessions() {
        return sessions.values().stream()
            .sorted(Comparator.comparing(TerminalSession::getCreatedAt))
            .toList();
    }

    public Optional<TerminalSession> session(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    private String reserveId(TerminalSession session) {
        while (true) {
            String candidate = "term-" + clock.millis() + "-" + randomSuffix();
            session.setSessionId(candidate);
            if (sessions.putIfAbsent(candidate, session) == null) {
                return candidate;
            }
        }
    }

    private String randomSuffix() {
        StringBuilder suffix = new StringBuilder(6);
        for (int i = 0; i < 6; i++) {
            suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return suffix.toString();
    }

    // Lets the remote shell print its prompt first
    private void scheduleAutoCommand(TerminalSession session) {
        String sessionId = session.getSessionId();
        String command = session.getAutoCommand();
        scheduler.schedule(() -> {
            if (!sessions.containsKey(sessionId)) {
                log.debug("Session {} gone before auto-command ran", sessionId);
                return;
            }
            log.info("Running auto-command in {}: {}", sessionId, command);
            input(new TerminalData(sessionId, command + "\r"));
        }, clock.instant().plusMillis(autoCommandDelayMs));
    }

    private TerminalSession ownedSession(String connectionId, String sessionId) {
        registry.touch(connectionId);
        if (sessionId == null) {
            log.debug("Dropping terminal frame without sessionId from {}", connectionId);
            return null;
        }
        TerminalSession session = sessions.get(sessionId);
        if (session == null) {
            log.debug("Dropping terminal frame for unknown session {}", sessionId);
            return null;
        }
        if (!session.getWorkerConnectionId().equals(connectionId)) {
            log.warn("Session {} frame from {}, owned by {}", sessionId, connectionId, session.getWorkerConnectionId());
            return null;
        }
        return session;
    }

    private void route(String sessionId, String type, Object payload) {
        TerminalSession session = sessionId != null ? sessions.get(sessionId) : null;
        if (session == null) {
            log.debug("Dropping {} for unknown session {}", type, sessionId);
            return;
        }
        Optional<WorkerInfo> worker = registry.get(session.getWorkerConnectionId());
        if (worker.isEmpty()) {
            log.debug("Dropping {} for session {}, worker gone", type, sessionId);
            return;
        }
        try {
            worker.get().getChannel().send(type, payload);
        } catch (IOException e) {
            log.warn("Failed to route {} for session {}: {}", type, sessionId, e.getMessage());
        }
    }
}
