package com.autonomous.ralph.websocket;

import com.autonomous.ralph.protocol.Envelope;
import com.autonomous.ralph.protocol.WorkerChannel;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/**
 * {@link WorkerChannel} over a hub-side WebSocket session. Sends from different threads
 * are queued by the decorator, so frames never interleave.
 */
@Slf4j
class WebSocketWorkerChannel implements WorkerChannel {

    private static final int SEND_TIME_LIMIT_MS = 10_000;

    private final WebSocketSession session;
    private final ObjectMapper mapper;

    WebSocketWorkerChannel(WebSocketSession session, ObjectMapper mapper, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, bufferSizeLimit);
        this.mapper = mapper;
    }

    @Override
    public String getConnectionId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String type, Object payload) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("Worker connection " + session.getId() + " is closed");
        }
        try {
            session.sendMessage(new TextMessage(Envelope.write(mapper, type, payload)));
        } catch (SessionLimitExceededException e) {
            throw new IOException("Worker connection " + session.getId() + " is not keeping up", e);
        }
    }

    @Override
    public void close() {
        try {
            session.close(CloseStatus.GOING_AWAY);
        } catch (IOException e) {
            log.debug("Closing worker connection {} failed: {}", session.getId(), e.getMessage());
        }
    }
}
