package com.example.pipeline.server.websocket;

import com.example.pipeline.server.service.EventIngestionService;
import com.example.pipeline.shared.config.ApiKeyAuthFilter;
import com.example.pipeline.shared.config.AppProperties;
import com.example.pipeline.shared.dto.PublishEventRequest;
import com.example.pipeline.shared.exception.InvalidEventException;
import com.example.pipeline.shared.util.Constants;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * High-rate publishing over a socket: every text frame is one publish request and gets
 * exactly one status reply, in order. A bad frame never ends the session.
 */
@Component
@Slf4j
public class PublishWebSocketHandler extends GuardedWebSocketHandler {

    private final EventIngestionService ingestionService;

    public PublishWebSocketHandler(ApiKeyAuthFilter apiKeyAuthFilter,
                                   WebSocketConnectionLimiter connectionLimiter,
                                   ObjectMapper objectMapper,
                                   AppProperties appProperties,
                                   EventIngestionService ingestionService) {
        super(apiKeyAuthFilter, connectionLimiter, objectMapper, appProperties.getWebsocket().getMaxMessageBytes());
        this.ingestionService = ingestionService;
    }

    @Override
    protected Mono<Void> handleAdmitted(WebSocketSession session, String clientIp) {
        return session.send(session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(frame -> handleFrame(frame, session.getId()))
                .map(reply -> session.textMessage(toJson(reply))));
    }

    Mono<Map<String, Object>> handleFrame(String frame, String sessionId) {
        if (isTooLarge(frame)) {
            return Mono.just(errorReply("Message too large"));
        }

        PublishEventRequest request;
        try {
            JsonNode tree = objectMapper.readTree(frame);
            if (tree == null || !tree.isObject()) {
                return Mono.just(errorReply("Invalid JSON"));
            }
            request = objectMapper.treeToValue(tree, PublishEventRequest.class);
        } catch (JsonProcessingException e) {
            return Mono.just(errorReply("Invalid JSON"));
        }
        if (request.getCorrelationId() == null) {
            request.setCorrelationId(sessionId);
        }

        return ingestionService.publish(request)
                .map(result -> {
                    Map<String, Object> reply = statusReply(Constants.SocketMessages.STATUS_OK);
                    reply.put("event_id", result.getEvent().getId());
                    return reply;
                })
                .onErrorResume(InvalidEventException.class, e -> Mono.just(errorReply(e.getMessage())))
                .onErrorResume(e -> !(e instanceof InvalidEventException), e -> {
                    log.error("WebSocket publish error on session {}", sessionId, e);
                    return Mono.just(errorReply("Internal error"));
                });
    }
}
