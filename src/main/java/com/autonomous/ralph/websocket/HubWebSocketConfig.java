package com.autonomous.ralph.websocket;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
@Profile("!worker")
public class HubWebSocketConfig implements WebSocketConfigurer {

    static final String WORKER_PATH = "/ws/worker";
    static final String OBSERVER_PATH = "/ws/observer";

    private static final int MAX_MESSAGE_BYTES = 1024 * 1024;

    @Value("${ralph.websocket.allowed-origins:*}")
    private String[] allowedOrigins;

    private final WorkerSocketHandler workerHandler;
    private final ObserverSocketHandler observerHandler;

    public HubWebSocketConfig(WorkerSocketHandler workerHandler, ObserverSocketHandler observerHandler) {
        this.workerHandler = workerHandler;
        this.observerHandler = observerHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(workerHandler, WORKER_PATH).setAllowedOriginPatterns(allowedOrigins);
        registry.addHandler(observerHandler, OBSERVER_PATH).setAllowedOriginPatterns(allowedOrigins);
    }

    // Completion events and terminal output easily exceed the container's 8 KB default
    @Bean
    public ServletServerContainerFactoryBean webSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(MAX_MESSAGE_BYTES);
        container.setMaxBinaryMessageBufferSize(MAX_MESSAGE_BYTES);
        return container;
    }
}
