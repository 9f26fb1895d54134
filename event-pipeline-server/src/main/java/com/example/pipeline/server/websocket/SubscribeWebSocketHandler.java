package com.example.pipeline.server.websocket;

import com.example.pipeline.server.router.EventRouter;
import com.example.pipeline.shared.config.ApiKeyAuthFilter;
import com.example.pipeline.shared.config.AppProperties;
import com.example.pipeline.shared.dto.SubscriptionRequest;
import com.example.pipeline.shared.model.EventFilter;
import com.example.pipeline.shared.util.Constants.SocketMessages;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Live event stream for one subscriber.
 * <p>
 * The first frame must carry the filter configuration and arrive within the configured
 * timeout; a malformed first frame, or a full router, ends the session after an error reply.
 * The session also ends when the router drops the subscriber for a failed delivery.
 * After that the client may send {@code ping} and {@code update_filters}. The server sends a
 * {@code keepalive} when the client has been silent for a whole keepalive interval.
 * Whatever ends the session, the subscription is removed.
 */
@Component
@Slf4j
public class SubscribeWebSocketHandler extends GuardedWebSocketHandler {

    private final EventRouter eventRouter;
    private final Duration subscribeConfigTimeout;
    private final Duration keepaliveInterval;
    private final int outboundBufferSize;

    public SubscribeWebSocketHandler(ApiKeyAuthFilter apiKeyAuthFilter,
                                     WebSocketConnectionLimiter connectionLimiter,
                                     ObjectMapper objectMapper,
                                     AppProperties appProperties,
                                     EventRouter eventRouter) {
        super(apiKeyAuthFilter, connectionLimiter, objectMapper, appProperties.getWebsocket().getMaxMessageBytes());
        this.eventRouter = eventRouter;
        this.subscribeConfigTimeout = appProperties.getWebsocket().getSubscribeConfigTimeout();
        this.keepaliveInterval = appProperties.getWebsocket().getKeepaliveInterval();
        this.outboundBufferSize = appProperties.getWebsocket().getOutboundBufferSize();
    }

    @Override
    protected Mono<Void> handleAdmitted(WebSocketSession session, String clientIp) {
        WebSocketSubscriberConnection connection = new WebSocketSubscriberConnection(
                eventRouter.newSubscriberId(), clientIp, objectMapper, outboundBufferSize);
        SubscriberSession subscriber = new SubscriberSession(connection);

        Mono<Void> outbound = session.send(connection.frames().map(session::textMessage));

        Mono<Void> inbound = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .timeout(Mono.delay(subscribeConfigTimeout), frame -> Mono.never())
                .doOnNext(subscriber::onFrame)
                .onErrorResume(TimeoutException.class, e -> {
                    log.info("Subscriber {} timed out waiting for config", connection.getSubscriberId());
                    return Mono.empty();
                })
                .then();

        Mono<Void> keepalive = Flux.interval(keepaliveInterval)
                .doOnNext(tick -> subscriber.onKeepaliveTick())
                .then();

        return Mono.firstWithSignal(inbound, outbound, keepalive)
                .doOnError(e -> log.error("Subscriber error for {}", connection.getSubscriberId(), e))
                .doFinally(signal -> subscriber.end());
    }

    /**
     * Per-connection protocol state. Frames arrive one at a time from the session.
     */
    final class SubscriberSession {

        private final WebSocketSubscriberConnection connection;
        private final AtomicBoolean heardFromClient = new AtomicBoolean();
        private volatile boolean subscribed;

        SubscriberSession(WebSocketSubscriberConnection connection) {
            this.connection = connection;
        }

        void onFrame(String frame) {
            heardFromClient.set(true);
            if (subscribed) {
                onControlFrame(frame);
            } else {
                onConfigFrame(frame);
            }
        }

        private void onConfigFrame(String frame) {
            if (isTooLarge(frame)) {
                rejectAndClose("Message too large");
                return;
            }
            SubscriptionRequest request;
            try {
                request = objectMapper.readValue(frame, SubscriptionRequest.class);
            } catch (JsonProcessingException e) {
                rejectAndClose("Invalid JSON");
                return;
            }
            if (request == null) {
                rejectAndClose("Invalid JSON");
                return;
            }

            EventFilter filter = request.toFilter();
            if (!eventRouter.subscribe(connection.getSubscriberId(), connection, filter)) {
                rejectAndClose(eventRouter.isSubscribed(connection.getSubscriberId())
                        ? "Subscriber id already in use"
                        : "Server at subscriber capacity");
                return;
            }
            subscribed = true;

            Map<String, Object> reply = statusReply(SocketMessages.STATUS_SUBSCRIBED);
            reply.put("subscriber_id", connection.getSubscriberId());
            reply.put("filters", filter);
            connection.sendControl(reply);
        }

        private void onControlFrame(String frame) {
            if (isTooLarge(frame)) {
                connection.sendControl(errorReply("Message too large"));
                return;
            }
            JsonNode message;
            try {
                message = objectMapper.readTree(frame);
            } catch (JsonProcessingException e) {
                log.debug("Ignoring malformed frame from subscriber {}", connection.getSubscriberId());
                return;
            }
            if (message == null || !message.isObject()) {
                return;
            }

            String type = message.path("type").asText("");
            if (SocketMessages.TYPE_PING.equals(type)) {
                connection.sendControl(typeMessage(SocketMessages.TYPE_PONG));
            } else if (SocketMessages.TYPE_UPDATE_FILTERS.equals(type)) {
                updateFilters(message.path("filters"));
            }
        }

        private void updateFilters(JsonNode filtersNode) {
            EventFilter filter;
            try {
                filter = filtersNode.isObject()
                        ? objectMapper.treeToValue(filtersNode, SubscriptionRequest.class).toFilter()
                        : EventFilter.matchAll();
            } catch (JsonProcessingException e) {
                connection.sendControl(errorReply("Invalid filters"));
                return;
            }
            if (!eventRouter.updateFilter(connection.getSubscriberId(), filter)) {
                // dropped by the router after a failed delivery
                log.info("Subscriber {} is no longer registered, closing", connection.getSubscriberId());
                rejectAndClose("Subscription no longer active");
                return;
            }

            Map<String, Object> reply = statusReply(SocketMessages.STATUS_FILTERS_UPDATED);
            reply.put("filters", filter);
            connection.sendControl(reply);
        }

        void onKeepaliveTick() {
            if (subscribed && !heardFromClient.getAndSet(false)) {
                connection.sendControl(typeMessage(SocketMessages.TYPE_KEEPALIVE));
            }
        }

        private void rejectAndClose(String message) {
            connection.sendControl(errorReply(message));
            connection.close();
        }

        void end() {
            if (subscribed) {
                eventRouter.unsubscribe(connection.getSubscriberId());
            }
            connection.close();
        }
    }
}
