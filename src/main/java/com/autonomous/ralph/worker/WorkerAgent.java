package com.autonomous.ralph.worker;

import com.autonomous.ralph.protocol.*;
import com.autonomous.ralph.service.ProjectConfigService;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import jakarta.websocket.ContainerProvider;
import jakarta.websocket.WebSocketContainer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Profile;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Worker side of the hub connection.
 *
 * <p>Registers on every (re)connect, runs assigned tasks through {@link ClaudeTaskRunner},
 * hosts terminal sessions through {@link TerminalHost}, and retries the connection
 * forever with exponential backoff.
 */
@Slf4j
@Component
@Profile("worker")
public class WorkerAgent extends TextWebSocketHandler implements WorkerEventSink {

    static final List<String> CAPABILITIES = List.of("execute", "git-push", "terminal");

    private static final Duration INITIAL_BACKOFF = Duration.ofSeconds(2);
    private static final Duration MAX_BACKOFF = Duration.ofSeconds(30);
    private static final int MAX_MESSAGE_BYTES = 1024 * 1024;
    private static final int SEND_TIME_LIMIT_MS = 10_000;

    @Value("${ralph.worker.hub-url:ws://localhost:3002/ws/worker}")
    private String hubUrl;

    @Value("${ralph.worker.name:}")
    private String workerName;

    private final ProjectConfigService projectConfigs;
    private final ClaudeTaskRunner taskRunner;
    private final TerminalHost terminalHost;
    private final TaskScheduler scheduler;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final WebSocketClient client;

    private volatile WebSocketSession session;
    private volatile boolean stopping;
    private int reconnectAttempts;

    public WorkerAgent(ProjectConfigService projectConfigs, ClaudeTaskRunner taskRunner, TerminalHost terminalHost,
                       TaskScheduler scheduler, ObjectMapper mapper, Clock clock) {
        this.projectConfigs = projectConfigs;
        this.taskRunner = taskRunner;
        this.terminalHost = terminalHost;
        this.scheduler = scheduler;
        this.mapper = mapper;
        this.clock = clock;
        WebSocketContainer container = ContainerProvider.getWebSocketContainer();
        container.setDefaultMaxTextMessageBufferSize(MAX_MESSAGE_BYTES);
        this.client = new StandardWebSocketClient(container);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        log.info("Worker {} serving projects: {}", hostname(), String.join(", ", projectConfigs.getProjectNames()));
        connect();
    }

    @PreDestroy
    public void stop() {
        stopping = true;
        WebSocketSession current = session;
        if (current != null && current.isOpen()) {
            try {
                current.close(CloseStatus.GOING_AWAY);
            } catch (IOException e) {
                log.debug("Close on shutdown failed: {}", e.getMessage());
            }
        }
    }

    void connect() {
        if (stopping) return;
        log.info("Connecting to hub at {}", hubUrl);
        client.execute(this, hubUrl).whenComplete((connected, error) -> {
            if (error != null) {
                onConnectFailed(error);
            }
        });
    }

    private synchronized void onConnectFailed(Throwable error) {
        reconnectAttempts++;
        if (reconnectAttempts == 1 || reconnectAttempts % 10 == 0) {
            log.error("Connection failed (attempt {}): {}", reconnectAttempts, rootMessage(error));
        }
        scheduleReconnect();
    }

    private synchronized void scheduleReconnect() {
        if (stopping) return;
        Duration delay = backoff(reconnectAttempts);
        log.debug("Reconnecting in {}s", delay.getSeconds());
        scheduler.schedule(this::connect, clock.instant().plus(delay));
    }

    static Duration backoff(int attempts) {
        int exponent = Math.max(0, Math.min(attempts - 1, 5));
        Duration delay = INITIAL_BACKOFF.multipliedBy(1L << exponent);
        return delay.compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : delay;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession raw) {
        synchronized (this) {
            reconnectAttempts = 0;
        }
        session = new ConcurrentWebSocketSessionDecorator(raw, SEND_TIME_LIMIT_MS, MAX_MESSAGE_BYTES);
        log.info("Connected to hub as {} ({})", hostname(), raw.getId());
        emit(MessageTypes.WORKER_REGISTER, new RegisterMessage(hostname(), projectConfigs.getProjectNames(), CAPABILITIES));
        log.info("Waiting for tasks...");
    }

    @Override
    protected void handleTextMessage(WebSocketSession raw, TextMessage message) {
        Envelope envelope;
        try {
            envelope = Envelope.parse(mapper, message.getPayload());
        } catch (IOException e) {
            log.warn("Invalid frame from hub: {}", e.getMessage());
            return;
        }
        if (envelope.getType() == null) {
            log.debug("Ignoring untyped frame from hub");
            return;
        }
        try {
            route(envelope);
        } catch (IOException e) {
            log.warn("Malformed {} from hub: {}", envelope.getType(), e.getMessage());
        }
    }

    void route(Envelope envelope) throws IOException {
        switch (envelope.getType()) {
            case MessageTypes.TASK -> taskRunner.submit(envelope.dataAs(mapper, TaskAssignment.class), this);
            case MessageTypes.CANCEL -> {
                TaskRef ref = envelope.dataAs(mapper, TaskRef.class);
                if (ref.getTaskId() != null) {
                    taskRunner.cancel(ref.getTaskId());
                }
            }
            case MessageTypes.PING -> emit(MessageTypes.PONG, new PongMessage(taskRunner.activeTaskId()));
            case MessageTypes.TERMINAL_CREATE -> terminalHost.create(envelope.dataAs(mapper, TerminalSpec.class), this);
            case MessageTypes.TERMINAL_INPUT -> terminalHost.input(envelope.dataAs(mapper, TerminalData.class));
            case MessageTypes.TERMINAL_RESIZE -> terminalHost.resize(envelope.dataAs(mapper, TerminalResize.class));
            case MessageTypes.TERMINAL_CLOSE -> terminalHost.close(envelope.dataAs(mapper, TerminalRef.class).getSessionId());
            default -> log.debug("Ignoring unknown frame type {} from hub", envelope.getType());
        }
    }

    @Override
    public void emit(String type, Object payload) {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            log.debug("Not connected, dropping {}", type);
            return;
        }
        try {
            current.sendMessage(new TextMessage(Envelope.write(mapper, type, payload)));
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to send {} to hub: {}", type, e.getMessage());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession raw, Throwable exception) {
        log.warn("Transport error: {}", exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession raw, CloseStatus status) {
        session = null;
        log.warn("Disconnected from hub: {}", status);
        terminalHost.closeAll();
        if (!stopping) {
            log.info("Will automatically reconnect...");
            synchronized (this) {
                reconnectAttempts = 1;
                scheduleReconnect();
            }
        }
    }

    boolean isConnected() {
        WebSocketSession current = session;
        return current != null && current.isOpen();
    }

    String hostname() {
        if (workerName != null && !workerName.isBlank()) {
            return workerName;
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "ralph-worker";
        }
    }

    private static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
