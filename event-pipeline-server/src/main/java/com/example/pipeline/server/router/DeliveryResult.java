package com.example.pipeline.server.router;

/**
 * Outcome of handing one event to a subscriber connection.
 */
public enum DeliveryResult {
    DELIVERED,
    FAILED;

    public boolean isFailure() {
        return this == FAILED;
    }
}
