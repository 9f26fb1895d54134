package com.example.pipeline.server.config;

import com.example.pipeline.server.websocket.PublishWebSocketHandler;
import com.example.pipeline.server.websocket.SubscribeWebSocketHandler;
import com.example.pipeline.shared.config.AppProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.server.WebSocketService;
import org.springframework.web.reactive.socket.server.support.HandshakeWebSocketService;
import org.springframework.web.reactive.socket.server.upgrade.ReactorNettyRequestUpgradeStrategy;
import reactor.netty.http.server.WebsocketServerSpec;

import java.util.Map;

@Configuration
@RequiredArgsConstructor
public class WebSocketConfig implements WebFluxConfigurer {

    public static final String PUBLISH_PATH = "/ws/publish";
    public static final String SUBSCRIBE_PATH = "/ws/subscribe";

    private final AppProperties appProperties;

    @Bean
    public HandlerMapping webSocketHandlerMapping(PublishWebSocketHandler publishHandler,
                                                  SubscribeWebSocketHandler subscribeHandler) {
        Map<String, WebSocketHandler> handlers = Map.of(
                PUBLISH_PATH, publishHandler,
                SUBSCRIBE_PATH, subscribeHandler);
        // ahead of the annotated controllers
        return new SimpleUrlHandlerMapping(handlers, -1);
    }

    /**
     * Raises Reactor Netty's frame limit to the configured maximum message size.
     */
    @Override
    public WebSocketService getWebSocketService() {
        int maxFrameBytes = appProperties.getWebsocket().getMaxMessageBytes();
        ReactorNettyRequestUpgradeStrategy upgradeStrategy = new ReactorNettyRequestUpgradeStrategy(
                () -> WebsocketServerSpec.builder().maxFramePayloadLength(maxFrameBytes));
        return new HandshakeWebSocketService(upgradeStrategy);
    }
}
