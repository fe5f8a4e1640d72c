package com.lmsagents.history.service;

import com.lmsagents.common.model.AgentRole;
import com.lmsagents.common.model.AlertRecord;
import com.lmsagents.common.model.AnswerRecord;
import com.lmsagents.common.model.DecisionLogEntry;
import com.lmsagents.common.model.GeneratedBy;
import com.lmsagents.common.model.RecommendationRecord;
import com.lmsagents.common.model.Severity;
import com.lmsagents.common.model.Student;
import com.lmsagents.common.model.Topic;
import com.lmsagents.common.persistence.PersistenceGateway;
import com.lmsagents.history.model.AdaptationLog;
import com.lmsagents.history.model.AgentReport;
import com.lmsagents.history.model.CourseTopic;
import com.lmsagents.history.model.OrchestratorLog;
import com.lmsagents.history.model.StudentAnswer;
import com.lmsagents.history.model.UserAccount;
import com.lmsagents.history.repository.AdaptationLogRepository;
import com.lmsagents.history.repository.AgentReportRepository;
import com.lmsagents.history.repository.CourseTopicRepository;
import com.lmsagents.history.repository.OrchestratorLogRepository;
import com.lmsagents.history.repository.StudentAnswerRepository;
import com.lmsagents.history.repository.UserAccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * {@link PersistenceGateway} over Spring Data R2DBC.
 *
 * <p>Timestamps are stored as UTC {@link LocalDateTime}. Every append is a single-row
 * insert, which is the only atomicity the workers rely on. The connection pool belongs to
 * the Spring context, so {@link #close()} only logs.
 */
@Service
public class R2dbcPersistenceGateway implements PersistenceGateway {

    private static final Logger log = LoggerFactory.getLogger(R2dbcPersistenceGateway.class);

    private final UserAccountRepository userRepository;
    private final CourseTopicRepository topicRepository;
    private final StudentAnswerRepository answerRepository;
    private final AgentReportRepository reportRepository;
    private final AdaptationLogRepository adaptationRepository;
    private final OrchestratorLogRepository orchestratorLogRepository;

    public R2dbcPersistenceGateway(UserAccountRepository userRepository,
                                   CourseTopicRepository topicRepository,
                                   StudentAnswerRepository answerRepository,
                                   AgentReportRepository reportRepository,
                                   AdaptationLogRepository adaptationRepository,
                                   OrchestratorLogRepository orchestratorLogRepository) {
        this.userRepository            = userRepository;
        this.topicRepository           = topicRepository;
        this.answerRepository          = answerRepository;
        this.reportRepository          = reportRepository;
        this.adaptationRepository      = adaptationRepository;
        this.orchestratorLogRepository = orchestratorLogRepository;
    }

    // ── reads ────────────────────────────────────────────────────────────────

    @Override
    public Flux<Student> findStudents() {
        return userRepository.findByRoleOrderById(UserAccount.ROLE_STUDENT).map(R2dbcPersistenceGateway::toStudent);
    }

    @Override
    public Mono<Student> findStudent(long studentId) {
        return userRepository.findByIdAndRole(studentId, UserAccount.ROLE_STUDENT).map(R2dbcPersistenceGateway::toStudent);
    }

    @Override
    public Mono<Topic> findTopic(long topicId) {
        return topicRepository.findById(topicId).map(R2dbcPersistenceGateway::toTopic);
    }

    @Override
    public Flux<AnswerRecord> findAnswers(long studentId) {
        return answerRepository.findByStudentIdOrderById(studentId).map(R2dbcPersistenceGateway::toAnswer);
    }

    @Override
    public Mono<AlertRecord> findLatestAlert(AgentRole source, long studentId) {
        return reportRepository.findLatest(source.wireName(), studentId).map(R2dbcPersistenceGateway::toAlert);
    }

    @Override
    public Mono<RecommendationRecord> findLatestRecommendation(long studentId, Long topicId) {
        Mono<AdaptationLog> latest = topicId == null
            ? adaptationRepository.findLatestGeneral(studentId)
            : adaptationRepository.findLatestForTopic(studentId, topicId);
        return latest.map(R2dbcPersistenceGateway::toRecommendation);
    }

    @Override
    public Flux<AlertRecord> findRecentAlerts(int limit) {
        return reportRepository.findRecent(limit).map(R2dbcPersistenceGateway::toAlert);
    }

    @Override
    public Flux<RecommendationRecord> findRecentRecommendations(int limit) {
        return adaptationRepository.findRecent(limit).map(R2dbcPersistenceGateway::toRecommendation);
    }

    @Override
    public Flux<DecisionLogEntry> findRecentDecisions(int limit) {
        return orchestratorLogRepository.findRecent(limit).map(R2dbcPersistenceGateway::toDecision);
    }

    // ── writes ───────────────────────────────────────────────────────────────

    @Override
    public Mono<AlertRecord> appendAlert(AlertRecord alert) {
        AgentReport entity = new AgentReport();
        entity.setAgentType(alert.source().wireName());
        entity.setStudentId(alert.studentId());
        entity.setMessage(alert.text());
        entity.setSeverity(alert.severity().wireName());
        entity.setRead(alert.read());
        entity.setCreatedAt(toUtc(alert.createdAt()));
        return reportRepository.save(entity)
            .map(R2dbcPersistenceGateway::toAlert)
            .doOnError(e -> log.error("[PersistenceGateway] Failed to save alert. studentId={} source={}",
                                      alert.studentId(), alert.source().wireName(), e));
    }

    @Override
    public Mono<RecommendationRecord> appendRecommendation(RecommendationRecord recommendation) {
        AdaptationLog entity = new AdaptationLog();
        entity.setStudentId(recommendation.studentId());
        entity.setTopicId(recommendation.topicId());
        entity.setRecommendation(recommendation.text());
        entity.setAiGenerated(recommendation.generatedBy() == GeneratedBy.EXTERNAL);
        entity.setCreatedAt(toUtc(recommendation.createdAt()));
        return adaptationRepository.save(entity)
            .map(R2dbcPersistenceGateway::toRecommendation)
            .doOnError(e -> log.error("[PersistenceGateway] Failed to save recommendation. studentId={} topicId={}",
                                      recommendation.studentId(), recommendation.topicId(), e));
    }

    @Override
    public Mono<DecisionLogEntry> appendDecision(DecisionLogEntry entry) {
        OrchestratorLog entity = new OrchestratorLog();
        entity.setEventType(entry.eventType());
        entity.setSourceAgent(entry.sourceAgent());
        entity.setTargetAgent(entry.targetAgent());
        entity.setStudentId(entry.studentId());
        entity.setPayload(entry.payload());
        entity.setDecision(entry.decision());
        entity.setCreatedAt(toUtc(entry.createdAt()));
        return orchestratorLogRepository.save(entity)
            .map(R2dbcPersistenceGateway::toDecision)
            .doOnError(e -> log.error("[PersistenceGateway] Failed to save decision log entry. eventType={}",
                                      entry.eventType(), e));
    }

    @Override
    public Mono<Long> markAllAlertsRead() {
        return reportRepository.markAllRead()
            .map(Integer::longValue)
            .doOnSuccess(updated -> log.info("[PersistenceGateway] Alerts marked read. updated={}", updated));
    }

    @Override
    public void close() {
        log.info("[PersistenceGateway] Closed; connection pool is released with the application context.");
    }

    // ── mapping ──────────────────────────────────────────────────────────────

    static Student toStudent(UserAccount e) {
        return new Student(e.getId(), e.getUsername(), e.getFullName());
    }

    static Topic toTopic(CourseTopic e) {
        return new Topic(e.getId(), e.getTitle(), e.getDescription(),
                         e.getDifficulty() != null ? e.getDifficulty() : 1);
    }

    static AnswerRecord toAnswer(StudentAnswer e) {
        return new AnswerRecord(e.getId(), e.getStudentId(), e.getTopicId(),
                                Boolean.TRUE.equals(e.getCorrect()), toInstant(e.getAnsweredAt()));
    }

    static AlertRecord toAlert(AgentReport e) {
        return new AlertRecord(e.getId(), AgentRole.fromWireName(e.getAgentType()), e.getStudentId(),
                               e.getMessage(), Severity.fromWireName(e.getSeverity()),
                               Boolean.TRUE.equals(e.getRead()), toInstant(e.getCreatedAt()));
    }

    static RecommendationRecord toRecommendation(AdaptationLog e) {
        return new RecommendationRecord(e.getId(), e.getStudentId(), e.getTopicId(), e.getRecommendation(),
                                        Boolean.TRUE.equals(e.getAiGenerated()) ? GeneratedBy.EXTERNAL : GeneratedBy.RULE,
                                        toInstant(e.getCreatedAt()));
    }

    static DecisionLogEntry toDecision(OrchestratorLog e) {
        return new DecisionLogEntry(e.getId(), e.getEventType(), e.getSourceAgent(), e.getTargetAgent(),
                                    e.getStudentId(), e.getPayload(), e.getDecision(), toInstant(e.getCreatedAt()));
    }

    private static LocalDateTime toUtc(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant toInstant(LocalDateTime utc) {
        return utc == null ? null : utc.toInstant(ZoneOffset.UTC);
    }
}
