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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Heap-backed {@link PersistenceGateway}. Used by tests and by local runs that need no
 * database. Every append is atomic; the read flag update is synchronised on the alert list.
 */
public class InMemoryPersistenceGateway implements PersistenceGateway {

    private final AtomicLong sequence = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final Map<Long, Student> students = new ConcurrentHashMap<>();
    private final Map<Long, Topic> topics = new ConcurrentHashMap<>();
    private final List<AnswerRecord> answers = new CopyOnWriteArrayList<>();
    private final List<AlertRecord> alerts = new ArrayList<>();
    private final List<RecommendationRecord> recommendations = new CopyOnWriteArrayList<>();
    private final List<DecisionLogEntry> decisions = new CopyOnWriteArrayList<>();

    // ── seeding ─────────────────────────────────────────────────────────────

    public Student addStudent(String username, String fullName) {
        Student student = new Student(sequence.incrementAndGet(), username, fullName);
        students.put(student.id(), student);
        return student;
    }

    public Topic addTopic(String title) {
        Topic topic = new Topic(sequence.incrementAndGet(), title, "", 1);
        topics.put(topic.id(), topic);
        return topic;
    }

    public AnswerRecord addAnswer(long studentId, long topicId, boolean correct, Instant answeredAt) {
        AnswerRecord answer = new AnswerRecord(sequence.incrementAndGet(), studentId, topicId, correct, answeredAt);
        answers.add(answer);
        return answer;
    }

    /** Adds {@code total} answers of which the first {@code correct} are right. */
    public void addAnswers(long studentId, long topicId, int total, int correct, Instant answeredAt) {
        for (int i = 0; i < total; i++) {
            addAnswer(studentId, topicId, i < correct, answeredAt);
        }
    }

    // ── snapshots for inspection ────────────────────────────────────────────

    public List<AlertRecord> alerts() {
        synchronized (alerts) {
            return List.copyOf(alerts);
        }
    }

    public List<RecommendationRecord> recommendations() {
        return List.copyOf(recommendations);
    }

    public List<DecisionLogEntry> decisions() {
        return List.copyOf(decisions);
    }

    public boolean isClosed() {
        return closed.get();
    }

    // ── PersistenceGateway ──────────────────────────────────────────────────

    @Override
    public Flux<Student> findStudents() {
        return guardedFlux(() -> students.values().stream()
            .sorted(Comparator.comparingLong(Student::id))
            .toList());
    }

    @Override
    public Mono<Student> findStudent(long studentId) {
        return guardedMono(() -> students.get(studentId));
    }

    @Override
    public Mono<Topic> findTopic(long topicId) {
        return guardedMono(() -> topics.get(topicId));
    }

    @Override
    public Flux<AnswerRecord> findAnswers(long studentId) {
        return guardedFlux(() -> answers.stream()
            .filter(a -> a.studentId() == studentId)
            .toList());
    }

    @Override
    public Mono<AlertRecord> findLatestAlert(AgentRole source, long studentId) {
        return guardedMono(() -> alerts().stream()
            .filter(a -> a.source() == source && a.studentId() == studentId)
            .max(Comparator.comparing(AlertRecord::createdAt).thenComparing(AlertRecord::id))
            .orElse(null));
    }

    @Override
    public Mono<RecommendationRecord> findLatestRecommendation(long studentId, Long topicId) {
        return guardedMono(() -> recommendations.stream()
            .filter(r -> r.studentId() == studentId && Objects.equals(r.topicId(), topicId))
            .max(Comparator.comparing(RecommendationRecord::createdAt).thenComparing(RecommendationRecord::id))
            .orElse(null));
    }

    @Override
    public Mono<AlertRecord> appendAlert(AlertRecord alert) {
        return guardedMono(() -> {
            AlertRecord saved = alert.withId(sequence.incrementAndGet());
            synchronized (alerts) {
                alerts.add(saved);
            }
            return saved;
        });
    }

    @Override
    public Mono<RecommendationRecord> appendRecommendation(RecommendationRecord recommendation) {
        return guardedMono(() -> {
            RecommendationRecord saved = recommendation.withId(sequence.incrementAndGet());
            recommendations.add(saved);
            return saved;
        });
    }

    @Override
    public Mono<DecisionLogEntry> appendDecision(DecisionLogEntry entry) {
        return guardedMono(() -> {
            DecisionLogEntry saved = entry.withId(sequence.incrementAndGet());
            decisions.add(saved);
            return saved;
        });
    }

    @Override
    public Flux<AlertRecord> findRecentAlerts(int limit) {
        return guardedFlux(() -> alerts().stream()
            .sorted(Comparator.comparing(AlertRecord::createdAt).thenComparing(AlertRecord::id).reversed())
            .limit(limit)
            .toList());
    }

    @Override
    public Flux<RecommendationRecord> findRecentRecommendations(int limit) {
        return guardedFlux(() -> recommendations.stream()
            .sorted(Comparator.comparing(RecommendationRecord::createdAt)
                .thenComparing(RecommendationRecord::id).reversed())
            .limit(limit)
            .toList());
    }

    @Override
    public Flux<DecisionLogEntry> findRecentDecisions(int limit) {
        return guardedFlux(() -> decisions.stream()
            .sorted(Comparator.comparing(DecisionLogEntry::createdAt)
                .thenComparing(DecisionLogEntry::id).reversed())
            .limit(limit)
            .toList());
    }

    @Override
    public Mono<Long> markAllAlertsRead() {
        return guardedMono(() -> {
            long changed = 0;
            synchronized (alerts) {
                for (int i = 0; i < alerts.size(); i++) {
                    AlertRecord alert = alerts.get(i);
                    if (!alert.read()) {
                        alerts.set(i, alert.markedRead());
                        changed++;
                    }
                }
            }
            return changed;
        });
    }

    @Override
    public void close() {
        closed.set(true);
    }

    private <T> Mono<T> guardedMono(Supplier<T> supplier) {
        return Mono.defer(() -> closed.get()
            ? Mono.error(new IllegalStateException("Persistence gateway is closed"))
            : Mono.justOrEmpty(supplier.get()));
    }

    private <T> Flux<T> guardedFlux(Supplier<List<T>> supplier) {
        return Flux.defer(() -> closed.get()
            ? Flux.error(new IllegalStateException("Persistence gateway is closed"))
            : Flux.fromIterable(supplier.get()));
    }
}
