package com.molcollab.config;

import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.server.WebSocketService;
import org.springframework.web.reactive.socket.server.support.HandshakeWebSocketService;
import org.springframework.web.reactive.socket.server.support.WebSocketHandlerAdapter;
import org.springframework.web.reactive.socket.server.upgrade.ReactorNettyRequestUpgradeStrategy;

import com.molcollab.handler.CollaborationWebSocketHandler;

import reactor.netty.http.server.WebsocketServerSpec;

/**
 * WebFlux WebSocket configuration on Netty.
 */
@Configuration
public class WebFluxWebSocketConfig {

    private final CollaborationWebSocketHandler collaborationHandler;
    private final CollaborationProperties properties;

    public WebFluxWebSocketConfig(CollaborationWebSocketHandler collaborationHandler,
                                  CollaborationProperties properties) {
        this.collaborationHandler = collaborationHandler;
        this.properties = properties;
    }

    @Bean
    public HandlerMapping webSocketHandlerMapping() {
        SimpleUrlHandlerMapping handlerMapping = new SimpleUrlHandlerMapping();
        handlerMapping.setOrder(Ordered.HIGHEST_PRECEDENCE);
        handlerMapping.setUrlMap(Map.of(properties.getWebsocket().getPath(), collaborationHandler));
        return handlerMapping;
    }

    @Bean
    public WebSocketHandlerAdapter handlerAdapter() {
        return new WebSocketHandlerAdapter(webSocketService());
    }

    /**
     * Netty upgrade strategy bounded by the configured frame size. State updates and
     * snapshots are JSON, so frames stay small compared to the default limit.
     */
    @Bean
    public WebSocketService webSocketService() {
        int maxFrameBytes = properties.getWebsocket().getMaxFrameBytes();
        ReactorNettyRequestUpgradeStrategy strategy = new ReactorNettyRequestUpgradeStrategy(
                () -> WebsocketServerSpec.builder().maxFramePayloadLength(maxFrameBytes));
        return new HandshakeWebSocketService(strategy);
    }
}
