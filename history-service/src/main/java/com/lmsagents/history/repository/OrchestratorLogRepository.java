package com.lmsagents.history.repository;

import com.lmsagents.history.model.OrchestratorLog;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface OrchestratorLogRepository extends ReactiveCrudRepository<OrchestratorLog, Long> {

    @Query("""
        SELECT * FROM orchestrator_logs
        ORDER BY created_at DESC, id DESC
        LIMIT :limit
        """)
    Flux<OrchestratorLog> findRecent(int limit);
}
