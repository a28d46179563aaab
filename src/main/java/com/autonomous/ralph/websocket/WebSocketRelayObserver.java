package com.autonomous.ralph.websocket;

import com.autonomous.ralph.model.RelayEvent;
import com.autonomous.ralph.protocol.Envelope;
import com.autonomous.ralph.service.RelayObserver;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * Relay observer backed by a browser WebSocket. A client whose send buffer overflows
 * is disconnected by the decorator and then dropped by the broadcaster.
 */
class WebSocketRelayObserver implements RelayObserver {

    private static final int SEND_TIME_LIMIT_MS = 5_000;

    private final WebSocketSession session;
    private final ObjectMapper mapper;

    WebSocketRelayObserver(WebSocketSession session, ObjectMapper mapper, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, bufferSizeLimit);
        this.mapper = mapper;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void deliver(RelayEvent event) throws IOException {
        send(event.getType().getWireName(), event.getData());
    }

    void send(String type, Object data) throws IOException {
        session.sendMessage(new TextMessage(Envelope.write(mapper, type, data)));
    }
}
