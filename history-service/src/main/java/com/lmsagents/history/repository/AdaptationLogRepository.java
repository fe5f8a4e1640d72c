package com.lmsagents.history.repository;

import com.lmsagents.history.model.AdaptationLog;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface AdaptationLogRepository extends ReactiveCrudRepository<AdaptationLog, Long> {

    @Query("""
        SELECT * FROM adaptation_logs
        WHERE student_id = :studentId
          AND topic_id = :topicId
        ORDER BY created_at DESC, id DESC
        LIMIT 1
        """)
    Mono<AdaptationLog> findLatestForTopic(Long studentId, Long topicId);

    /** Latest whole-program recommendation (no topic). */
    @Query("""
        SELECT * FROM adaptation_logs
        WHERE student_id = :studentId
          AND topic_id IS NULL
        ORDER BY created_at DESC, id DESC
        LIMIT 1
        """)
    Mono<AdaptationLog> findLatestGeneral(Long studentId);

    @Query("""
        SELECT * FROM adaptation_logs
        ORDER BY created_at DESC, id DESC
        LIMIT :limit
        """)
    Flux<AdaptationLog> findRecent(int limit);
}
