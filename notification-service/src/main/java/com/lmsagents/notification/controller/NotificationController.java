package com.lmsagents.notification.controller;

import com.lmsagents.common.model.AlertRecord;
import com.lmsagents.common.persistence.PersistenceGateway;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/notify")
public class NotificationController {

    private static final int MAX_LIMIT = 500;

    private final PersistenceGateway gateway;

    public NotificationController(PersistenceGateway gateway) {
        this.gateway = gateway;
    }

    /** Newest alerts first, both monitoring summaries and routed notices. */
    @GetMapping("/alerts")
    public Flux<AlertRecord> alerts(@RequestParam(defaultValue = "50") int limit) {
        return gateway.findRecentAlerts(Math.max(1, Math.min(limit, MAX_LIMIT)));
    }

    /** Marks every unread alert as read. Safe to repeat. */
    @PostMapping("/alerts/read")
    public Mono<ResponseEntity<Map<String, Long>>> markAllRead() {
        return gateway.markAllAlertsRead()
            .map(updated -> ResponseEntity.ok(Map.of("updated", updated)));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
