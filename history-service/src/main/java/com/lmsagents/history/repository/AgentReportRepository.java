package com.lmsagents.history.repository;

import com.lmsagents.history.model.AgentReport;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface AgentReportRepository extends ReactiveCrudRepository<AgentReport, Long> {

    /** Most recent report of one agent type for one student; drives the monitoring dedup window. */
    @Query("""
        SELECT * FROM agent_reports
        WHERE agent_type = :agentType
          AND student_id = :studentId
        ORDER BY created_at DESC, id DESC
        LIMIT 1
        """)
    Mono<AgentReport> findLatest(String agentType, Long studentId);

    @Query("""
        SELECT * FROM agent_reports
        ORDER BY created_at DESC, id DESC
        LIMIT :limit
        """)
    Flux<AgentReport> findRecent(int limit);

    @Modifying
    @Query("UPDATE agent_reports SET is_read = TRUE WHERE is_read = FALSE")
    Mono<Integer> markAllRead();
}
