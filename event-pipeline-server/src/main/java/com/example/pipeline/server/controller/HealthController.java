package com.example.pipeline.server.controller;

import com.example.pipeline.server.router.EventRouter;
import com.example.pipeline.server.service.EventQueryService;
import com.example.pipeline.shared.config.AppProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final AppProperties appProperties;
    private final EventQueryService queryService;
    private final EventRouter eventRouter;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("service", appProperties.getServiceName());
        body.put("version", appProperties.getVersion());
        return ResponseEntity.ok(body);
    }

    /**
     * Ready when the event store answers. The router figures are included either way.
     */
    @GetMapping("/readiness")
    public Mono<ResponseEntity<Map<String, Object>>> readiness() {
        return queryService.isStoreAvailable().map(storeUp -> {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", storeUp ? "ready" : "not_ready");
            body.put("database", storeUp ? "ok" : "unavailable");
            body.put("router", eventRouter.getStats());
            return ResponseEntity.status(storeUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
        });
    }
}
