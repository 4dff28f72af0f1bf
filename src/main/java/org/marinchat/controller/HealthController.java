package org.marinchat.controller;

import org.marinchat.service.ws.BroadcastHub;
import org.marinchat.service.ws.ConnectionRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final ConnectionRegistry registry;
    private final BroadcastHub hub;
    private final Clock clock;

    public HealthController(ConnectionRegistry registry, BroadcastHub hub, Clock clock) {
        this.registry = registry;
        this.hub = hub;
        this.clock = clock;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("timestamp", clock.instant().toString());
        body.put("connections", registry.size());
        body.put("droppedEvents", hub.droppedCount());
        return body;
    }
}
