package com.lmsagents.common.persistence;

import com.lmsagents.common.model.AgentRole;
import com.lmsagents.common.model.AlertRecord;
import com.lmsagents.common.model.AnswerRecord;
import com.lmsagents.common.model.DecisionLogEntry;
import com.lmsagents.common.model.RecommendationRecord;
import com.lmsagents.common.model.Student;
import com.lmsagents.common.model.Topic;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * The only shared mutable resource between workers.
 *
 * <p>Writes are append-only, apart from the idempotent {@link #markAllAlertsRead()}.
 * A single append is atomic; a "find latest, then append" sequence is not, so dedup
 * windows built on it may let a duplicate through under a race.
 *
 * <p>All methods are non-blocking; implementations must not call {@code .block()}.
 */
public interface PersistenceGateway extends AutoCloseable {

    /** Students only; staff accounts are excluded. */
    Flux<Student> findStudents();

    Mono<Student> findStudent(long studentId);

    Mono<Topic> findTopic(long topicId);

    Flux<AnswerRecord> findAnswers(long studentId);

    /** Most recent alert written by {@code source} for the student, or empty. */
    Mono<AlertRecord> findLatestAlert(AgentRole source, long studentId);

    /**
     * Most recent recommendation for the (student, topic) pair, or empty.
     * A {@code null} topic looks up whole-program recommendations.
     */
    Mono<RecommendationRecord> findLatestRecommendation(long studentId, Long topicId);

    Mono<AlertRecord> appendAlert(AlertRecord alert);

    Mono<RecommendationRecord> appendRecommendation(RecommendationRecord recommendation);

    Mono<DecisionLogEntry> appendDecision(DecisionLogEntry entry);

    /** Newest first. */
    Flux<AlertRecord> findRecentAlerts(int limit);

    /** Newest first. */
    Flux<RecommendationRecord> findRecentRecommendations(int limit);

    /** Newest first. */
    Flux<DecisionLogEntry> findRecentDecisions(int limit);

    /** @return number of alerts that changed from unread to read */
    Mono<Long> markAllAlertsRead();

    @Override
    void close();
}
