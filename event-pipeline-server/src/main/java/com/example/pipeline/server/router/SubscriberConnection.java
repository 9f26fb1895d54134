package com.example.pipeline.server.router;

import com.example.pipeline.shared.model.Event;

/**
 * Transport handle of one live subscriber.
 * <p>
 * The router only ever calls {@link #send(Event)} from its single dispatch thread,
 * so implementations never see concurrent sends from the router. A {@link DeliveryResult#FAILED}
 * result (or an exception) is taken as a dead connection and the subscription is dropped.
 * The router never closes the underlying transport.
 */
public interface SubscriberConnection {

    DeliveryResult send(Event event);

    /**
     * Short human readable description for log lines, e.g. the remote address.
     */
    default String describe() {
        return getClass().getSimpleName();
    }
}
