package com.example.pipeline.server.router;

import com.example.pipeline.shared.model.EventFilter;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

@Value
public class Subscription {
    @NonNull
    String subscriberId;
    @NonNull
    SubscriberConnection connection;
    @With
    @NonNull
    EventFilter filter;
}
