package com.example.pipeline.server.service;

import com.example.pipeline.shared.model.Event;
import lombok.Value;

/**
 * A stored event and whether the router accepted it for live delivery.
 */
@Value
public class PublishResult {
    Event event;
    boolean routed;
}
