package com.example.pipeline.server.websocket;

import com.example.pipeline.shared.config.ApiKeyAuthFilter;
import com.example.pipeline.shared.util.Constants;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Common admission for the socket endpoints: API key first (close code 4001), then the
 * per-address connection limit (close code 4002). The connection slot is released when the
 * session ends, however it ends.
 */
@Slf4j
public abstract class GuardedWebSocketHandler implements WebSocketHandler {

    protected final ApiKeyAuthFilter apiKeyAuthFilter;
    protected final WebSocketConnectionLimiter connectionLimiter;
    protected final ObjectMapper objectMapper;
    protected final int maxMessageBytes;

    protected GuardedWebSocketHandler(ApiKeyAuthFilter apiKeyAuthFilter,
                                      WebSocketConnectionLimiter connectionLimiter,
                                      ObjectMapper objectMapper,
                                      int maxMessageBytes) {
        this.apiKeyAuthFilter = apiKeyAuthFilter;
        this.connectionLimiter = connectionLimiter;
        this.objectMapper = objectMapper;
        this.maxMessageBytes = maxMessageBytes;
    }

    @Override
    public final Mono<Void> handle(WebSocketSession session) {
        HandshakeInfo handshake = session.getHandshakeInfo();
        if (!apiKeyAuthFilter.isValidKey(presentedApiKey(handshake))) {
            log.warn("Rejected WebSocket {} with invalid or missing API key", handshake.getUri().getPath());
            return session.close(new CloseStatus(Constants.CloseCodes.UNAUTHORIZED, "Unauthorized"));
        }

        String clientIp = clientIp(handshake);
        if (!connectionLimiter.tryAcquire(clientIp)) {
            return session.close(new CloseStatus(Constants.CloseCodes.TOO_MANY_CONNECTIONS, "Too many connections"));
        }

        log.debug("WebSocket {} opened from {} (session {})", handshake.getUri().getPath(), clientIp, session.getId());
        return handleAdmitted(session, clientIp)
                .doFinally(signal -> {
                    connectionLimiter.release(clientIp);
                    log.debug("WebSocket session {} from {} ended ({})", session.getId(), clientIp, signal);
                });
    }

    protected abstract Mono<Void> handleAdmitted(WebSocketSession session, String clientIp);

    protected boolean isTooLarge(String frame) {
        return frame.length() > maxMessageBytes
                || frame.getBytes(StandardCharsets.UTF_8).length > maxMessageBytes;
    }

    protected String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Reply is not serializable", e);
        }
    }

    protected static Map<String, Object> statusReply(String status) {
        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("status", status);
        return reply;
    }

    protected static Map<String, Object> errorReply(String message) {
        Map<String, Object> reply = statusReply(Constants.SocketMessages.STATUS_ERROR);
        reply.put("message", message);
        return reply;
    }

    protected static Map<String, Object> typeMessage(String type) {
        return Map.of("type", type);
    }

    static String presentedApiKey(HandshakeInfo handshake) {
        String fromQuery = UriComponentsBuilder.fromUri(handshake.getUri()).build()
                .getQueryParams().getFirst(Constants.API_KEY_QUERY_PARAM);
        if (fromQuery != null && !fromQuery.isEmpty()) {
            return fromQuery;
        }
        return handshake.getHeaders().getFirst(Constants.API_KEY_HEADER);
    }

    static String clientIp(HandshakeInfo handshake) {
        InetSocketAddress remote = handshake.getRemoteAddress();
        if (remote == null) {
            return "unknown";
        }
        return remote.getAddress() != null ? remote.getAddress().getHostAddress() : remote.getHostString();
    }
}
