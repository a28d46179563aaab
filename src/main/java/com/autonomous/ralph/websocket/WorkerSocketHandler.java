package com.autonomous.ralph.websocket;

import com.autonomous.ralph.model.RelayEvent;
import com.autonomous.ralph.model.RelayEventType;
import com.autonomous.ralph.model.WorkerInfo;
import com.autonomous.ralph.protocol.*;
import com.autonomous.ralph.service.RelayBroadcaster;
import com.autonomous.ralph.service.TaskDispatcherService;
import com.autonomous.ralph.service.TerminalMultiplexerService;
import com.autonomous.ralph.service.WorkerRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hub end of the worker connections ({@code /ws/worker}).
 *
 * <p>Frames are handled on the connection's own thread in arrival order, and every
 * task event goes through the dispatcher's monitor, so a worker's events reach
 * observers in the order the worker sent them.
 */
@Slf4j
@Component
@Profile("!worker")
public class WorkerSocketHandler extends TextWebSocketHandler {

    private static final int SEND_BUFFER_BYTES = 1024 * 1024;

    private final WorkerRegistry registry;
    private final TaskDispatcherService dispatcher;
    private final TerminalMultiplexerService terminals;
    private final RelayBroadcaster relay;
    private final ObjectMapper mapper;
    private final Map<String, WebSocketWorkerChannel> channels = new ConcurrentHashMap<>();

    public WorkerSocketHandler(WorkerRegistry registry, TaskDispatcherService dispatcher,
                               TerminalMultiplexerService terminals, RelayBroadcaster relay,
                               ObjectMapper mapper) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.terminals = terminals;
        this.relay = relay;
        this.mapper = mapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        channels.put(session.getId(), new WebSocketWorkerChannel(session, mapper, SEND_BUFFER_BYTES));
        log.info("Worker connection opened: {} from {}", session.getId(), session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Envelope envelope;
        try {
            envelope = Envelope.parse(mapper, message.getPayload());
        } catch (IOException e) {
            log.warn("Invalid frame from worker {}: {}", session.getId(), e.getMessage());
            return;
        }
        if (envelope.getType() == null) {
            log.debug("Ignoring untyped frame from worker {}", session.getId());
            return;
        }
        try {
            route(session.getId(), envelope);
        } catch (IOException e) {
            log.warn("Malformed {} from worker {}: {}", envelope.getType(), session.getId(), e.getMessage());
        }
    }

    void route(String connectionId, Envelope envelope) throws IOException {
        switch (envelope.getType()) {
            case MessageTypes.WORKER_REGISTER -> register(connectionId, envelope.dataAs(mapper, RegisterMessage.class));
            case MessageTypes.WORKER_START -> dispatcher.onWorkerStart(connectionId, envelope.dataAs(mapper, StartEvent.class));
            case MessageTypes.WORKER_INIT -> dispatcher.onWorkerInit(connectionId, envelope.dataAs(mapper, InitEvent.class));
            case MessageTypes.WORKER_TOOL -> dispatcher.onWorkerTool(connectionId, envelope.dataAs(mapper, ToolEvent.class));
            case MessageTypes.WORKER_THOUGHT -> dispatcher.onWorkerThought(connectionId, envelope.dataAs(mapper, ThoughtEvent.class));
            case MessageTypes.WORKER_PROGRESS -> dispatcher.onWorkerProgress(connectionId, envelope.dataAs(mapper, ProgressEvent.class));
            case MessageTypes.WORKER_FILE -> dispatcher.onWorkerFile(connectionId, envelope.dataAs(mapper, FileEvent.class));
            case MessageTypes.WORKER_LOG -> dispatcher.onWorkerLog(connectionId, envelope.dataAs(mapper, LogEvent.class));
            case MessageTypes.WORKER_COMPLETE -> dispatcher.onWorkerComplete(connectionId, envelope.dataAs(mapper, CompleteEvent.class));
            case MessageTypes.WORKER_ERROR -> dispatcher.onWorkerError(connectionId, envelope.dataAs(mapper, ErrorEvent.class));
            case MessageTypes.WORKER_BUSY -> dispatcher.onWorkerBusy(connectionId, envelope.dataAs(mapper, TaskRef.class));
            case MessageTypes.PONG -> registry.touch(connectionId);
            case MessageTypes.TERMINAL_CREATED -> terminals.onCreated(connectionId, envelope.dataAs(mapper, TerminalSpec.class));
            case MessageTypes.TERMINAL_OUTPUT -> terminals.onOutput(connectionId, envelope.dataAs(mapper, TerminalData.class));
            case MessageTypes.TERMINAL_CLOSED -> terminals.onClosed(connectionId, envelope.dataAs(mapper, TerminalClosed.class));
            case MessageTypes.TERMINAL_ERROR -> terminals.onError(connectionId, envelope.dataAs(mapper, TerminalError.class));
            default -> {
                registry.touch(connectionId);
                log.debug("Ignoring unknown frame type {} from worker {}", envelope.getType(), connectionId);
            }
        }
    }

    private void register(String connectionId, RegisterMessage message) {
        WebSocketWorkerChannel channel = channels.get(connectionId);
        if (channel == null) {
            log.warn("Register on unknown connection {}", connectionId);
            return;
        }
        String hostname = message.getHostname() != null ? message.getHostname() : "unknown";
        WorkerInfo worker = registry.register(channel, hostname, message.getProjects(), message.getCapabilities());

        Map<String, Object> online = new LinkedHashMap<>();
        online.put("workerId", worker.getConnectionId());
        online.put("hostname", worker.getHostname());
        online.put("projects", worker.getProjects());
        online.put("capabilities", worker.getCapabilities());
        relay.broadcast(RelayEvent.of(RelayEventType.WORKER_ONLINE, online));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on worker connection {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String connectionId = session.getId();
        channels.remove(connectionId);
        registry.remove(connectionId).ifPresent(worker -> {
            log.info("Worker disconnected: {} ({})", worker.getHostname(), status);
            terminals.onWorkerDisconnected(connectionId);

            Map<String, Object> offline = new LinkedHashMap<>();
            offline.put("workerId", connectionId);
            offline.put("hostname", worker.getHostname());
            offline.put("reason", "disconnected");
            relay.broadcast(RelayEvent.of(RelayEventType.WORKER_OFFLINE, offline));
        });
    }
}
