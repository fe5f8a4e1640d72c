package com.lmsagents.adaptation.controller;

import com.lmsagents.common.model.RecommendationRecord;
import com.lmsagents.common.persistence.PersistenceGateway;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

@RestController
@RequestMapping("/api/v1/adaptation")
public class AdaptationController {

    private static final int MAX_LIMIT = 500;

    private final PersistenceGateway gateway;

    public AdaptationController(PersistenceGateway gateway) {
        this.gateway = gateway;
    }

    /** Newest recommendations first, per-topic and whole-program alike. */
    @GetMapping("/recommendations")
    public Flux<RecommendationRecord> recommendations(@RequestParam(defaultValue = "50") int limit) {
        return gateway.findRecentRecommendations(Math.max(1, Math.min(limit, MAX_LIMIT)));
    }
}
