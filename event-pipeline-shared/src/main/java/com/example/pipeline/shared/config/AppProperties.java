package com.example.pipeline.shared.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Validated
public class AppProperties {

    private String version = "2.0.0";
    private String serviceName = "event-pipeline";

    private final Router router = new Router();
    private final WebSocket websocket = new WebSocket();
    private final Payload payload = new Payload();
    private final Security security = new Security();
    private final Cors cors = new Cors();

    @Data
    public static class Router {
        @Positive
        private int maxQueueSize = 10000;
        @Positive
        private int maxSubscribers = 5000;
        @NotNull
        private Duration shutdownTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class WebSocket {
        @Positive
        private int maxMessageBytes = 1024 * 1024;
        @Positive
        private int maxConnectionsPerIp = 20;
        @NotNull
        private Duration subscribeConfigTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration keepaliveInterval = Duration.ofSeconds(30);
        @Positive
        private int outboundBufferSize = 256;
    }

    @Data
    public static class Payload {
        @Min(0)
        private int maxKeys = 50;
        @Positive
        private int maxBytes = 64 * 1024;
    }

    @Data
    public static class Security {
        private boolean requireAuth = false;
        private String apiKey = "";
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}
