package com.example.pipeline.server.websocket;

import com.example.pipeline.server.router.DeliveryResult;
import com.example.pipeline.server.router.SubscriberConnection;
import com.example.pipeline.shared.model.Event;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.concurrent.ArrayBlockingQueue;

/**
 * Subscriber handle backed by a bounded outbound sink that the WebSocket session drains.
 * <p>
 * Routed events and control replies share the sink, so emission is serialized here. A frame
 * the sink cannot take (socket gone, or the client reading too slowly to keep the buffer
 * below its bound) is reported as a failed delivery, and the stream is completed so the
 * session ends along with the subscription the router drops.
 */
@Slf4j
public class WebSocketSubscriberConnection implements SubscriberConnection {

    private final String subscriberId;
    private final String remoteAddress;
    private final ObjectMapper objectMapper;
    private final Sinks.Many<String> sink;

    public WebSocketSubscriberConnection(String subscriberId, String remoteAddress,
                                         ObjectMapper objectMapper, int bufferSize) {
        this.subscriberId = subscriberId;
        this.remoteAddress = remoteAddress;
        this.objectMapper = objectMapper;
        this.sink = Sinks.many().unicast().onBackpressureBuffer(new ArrayBlockingQueue<>(bufferSize));
    }

    public Flux<String> frames() {
        return sink.asFlux();
    }

    @Override
    public DeliveryResult send(Event event) {
        DeliveryResult result;
        try {
            result = emit(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.error("Could not serialize event {} for {}: {}", event.getId(), subscriberId, e.getMessage());
            result = DeliveryResult.FAILED;
        }
        if (result.isFailure()) {
            close();
        }
        return result;
    }

    /**
     * Queues a control frame (status reply, pong, keepalive) behind any pending events.
     */
    public DeliveryResult sendControl(Object message) {
        try {
            return emit(objectMapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Control frame is not serializable", e);
        }
    }

    /**
     * Completes the outbound stream once pending frames are flushed.
     */
    public synchronized void close() {
        sink.tryEmitComplete();
    }

    private synchronized DeliveryResult emit(String frame) {
        Sinks.EmitResult result = sink.tryEmitNext(frame);
        if (result.isFailure()) {
            log.warn("Failed to emit frame to subscriber {} ({}). Result: {}", subscriberId, remoteAddress, result);
            return DeliveryResult.FAILED;
        }
        return DeliveryResult.DELIVERED;
    }

    public String getSubscriberId() {
        return subscriberId;
    }

    @Override
    public String describe() {
        return "websocket " + remoteAddress;
    }
}
