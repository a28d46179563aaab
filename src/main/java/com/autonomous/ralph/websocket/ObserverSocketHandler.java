package com.autonomous.ralph.websocket;

import com.autonomous.ralph.model.TerminalOptions;
import com.autonomous.ralph.protocol.*;
import com.autonomous.ralph.service.NoWorkerConnectedException;
import com.autonomous.ralph.service.RelayBroadcaster;
import com.autonomous.ralph.service.TerminalMultiplexerService;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dashboard connections ({@code /ws/observer}). Every connection receives the full relay
 * stream and may drive terminal sessions.
 */
@Slf4j
@Component
@Profile("!worker")
public class ObserverSocketHandler extends TextWebSocketHandler {

    @Value("${ralph.observer.send-buffer-bytes:524288}")
    private int sendBufferBytes = 512 * 1024;

    private final RelayBroadcaster relay;
    private final TerminalMultiplexerService terminals;
    private final ObjectMapper mapper;
    private final Map<String, WebSocketRelayObserver> observers = new ConcurrentHashMap<>();

    public ObserverSocketHandler(RelayBroadcaster relay, TerminalMultiplexerService terminals, ObjectMapper mapper) {
        this.relay = relay;
        this.terminals = terminals;
        this.mapper = mapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketRelayObserver observer = new WebSocketRelayObserver(session, mapper, sendBufferBytes);
        observers.put(session.getId(), observer);
        relay.register(observer);
        log.info("Observer connected: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Envelope envelope;
        try {
            envelope = Envelope.parse(mapper, message.getPayload());
        } catch (IOException e) {
            log.warn("Invalid frame from observer {}: {}", session.getId(), e.getMessage());
            return;
        }
        if (envelope.getType() == null) {
            log.debug("Ignoring untyped frame from observer {}", session.getId());
            return;
        }
        WebSocketRelayObserver observer = observers.get(session.getId());
        try {
            switch (envelope.getType()) {
                case MessageTypes.TERMINAL_CHECK_WORKER ->
                    reply(observer, MessageTypes.TERMINAL_WORKER_STATUS, Map.of("connected", terminals.hasWorker()));
                case MessageTypes.TERMINAL_CREATE_SESSION -> createSession(observer, envelope.dataAs(mapper, TerminalOptions.class));
                case MessageTypes.TERMINAL_INPUT -> terminals.input(envelope.dataAs(mapper, TerminalData.class));
                case MessageTypes.TERMINAL_RESIZE -> terminals.resize(envelope.dataAs(mapper, TerminalResize.class));
                case MessageTypes.TERMINAL_CLOSE_SESSION -> terminals.close(envelope.dataAs(mapper, TerminalRef.class).getSessionId());
                default -> log.debug("Ignoring unknown frame type {} from observer {}", envelope.getType(), session.getId());
            }
        } catch (IOException e) {
            log.warn("Failed to handle {} from observer {}: {}", envelope.getType(), session.getId(), e.getMessage());
        }
    }

    private void createSession(WebSocketRelayObserver observer, TerminalOptions options) throws IOException {
        try {
            terminals.createSession(options);
        } catch (NoWorkerConnectedException e) {
            reply(observer, MessageTypes.TERMINAL_ERROR, new TerminalError(null, e.getMessage()));
        }
    }

    private void reply(WebSocketRelayObserver observer, String type, Object data) throws IOException {
        if (observer != null) {
            observer.send(type, data);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error on observer {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        observers.remove(session.getId());
        relay.unregister(session.getId());
        log.info("Observer disconnected: {}", session.getId());
    }
}
