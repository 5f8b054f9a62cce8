package me.golemcore.monitor.adapter.inbound.web.config;

import lombok.RequiredArgsConstructor;
import me.golemcore.monitor.adapter.inbound.web.WebSocketUsageStateHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.server.support.WebSocketHandlerAdapter;

import java.util.Map;

/**
 * WebFlux WebSocket configuration for the usage state stream.
 */
@Configuration
@RequiredArgsConstructor
public class WebSocketConfig {

    private final WebSocketUsageStateHandler webSocketUsageStateHandler;

    @Bean
    public HandlerMapping webSocketHandlerMapping() {
        SimpleUrlHandlerMapping mapping = new SimpleUrlHandlerMapping();
        mapping.setUrlMap(Map.of("/ws/usage", webSocketUsageStateHandler));
        mapping.setOrder(-1);
        return mapping;
    }

    @Bean
    public WebSocketHandlerAdapter webSocketHandlerAdapter() {
        return new WebSocketHandlerAdapter();
    }
}
