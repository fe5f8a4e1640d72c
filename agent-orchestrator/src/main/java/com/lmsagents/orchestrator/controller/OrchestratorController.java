package com.lmsagents.orchestrator.controller;

import com.lmsagents.common.model.DecisionLogEntry;
import com.lmsagents.orchestrator.router.OrchestratorRouter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/orchestrator")
public class OrchestratorController {

    private static final int MAX_LIMIT = 500;

    private final OrchestratorRouter router;

    public OrchestratorController(OrchestratorRouter router) {
        this.router = router;
    }

    @GetMapping("/decisions")
    public Flux<DecisionLogEntry> decisions(@RequestParam(defaultValue = "50") int limit) {
        return router.recentDecisions(Math.max(1, Math.min(limit, MAX_LIMIT)));
    }

    /** 202 when queued, 404 for an unknown student, 503 when the adaptation mailbox is unreachable. */
    @PostMapping("/students/{studentId}/analysis")
    public Mono<ResponseEntity<Void>> requestAnalysis(@PathVariable long studentId) {
        return router.requestErrorAnalysis(studentId)
            .map(sent -> sent
                ? ResponseEntity.accepted().<Void>build()
                : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).<Void>build())
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
