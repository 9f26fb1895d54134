package com.example.pipeline.shared.exception;

/**
 * Raised when a published event fails validation at the ingestion boundary.
 * The message is safe to return to the publisher.
 */
public class InvalidEventException extends RuntimeException {

    public InvalidEventException(String message) {
        super(message);
    }
}
