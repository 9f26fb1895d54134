package com.example.pipeline.shared.dto;

/**
 * Request carrying a caller supplied correlation id, picked up by the monitoring aspect.
 */
public interface CorrelatedRequest {
    String getCorrelationId();
}
