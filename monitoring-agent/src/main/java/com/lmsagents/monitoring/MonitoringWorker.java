package com.lmsagents.monitoring;

import com.lmsagents.common.config.AgentAddresses;
import com.lmsagents.common.config.AgentSettings;
import com.lmsagents.common.exception.MailboxDeliveryException;
import com.lmsagents.common.mailbox.AgentMessenger;
import com.lmsagents.common.mailbox.MailboxTransport;
import com.lmsagents.common.message.MessageCodec;
import com.lmsagents.common.message.StudentRiskEvent;
import com.lmsagents.common.model.AgentRole;
import com.lmsagents.common.model.AlertRecord;
import com.lmsagents.common.model.Student;
import com.lmsagents.common.model.StudentPerformanceSnapshot;
import com.lmsagents.common.persistence.PersistenceGateway;
import com.lmsagents.common.scoring.DedupWindow;
import com.lmsagents.common.scoring.PerformanceCalculator;
import com.lmsagents.common.trace.TraceContextUtil;
import com.lmsagents.common.worker.Agent;
import com.lmsagents.common.worker.PeriodicSweep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;

/**
 * Periodically scans every student's answers and reports at-risk students to the router.
 *
 * <p>Per cycle, for each student with at least one answer:
 * <pre>
 *   snapshot → score &lt; threshold? → monitoring report inside dedup window? → persist summary → emit student_risk
 * </pre>
 *
 * <p>Students are processed one after another and independently: a failure while
 * scanning one student is logged and the scan moves on to the next.
 * The persisted summary doubles as the dedup marker for the next cycles.
 */
@Component
public class MonitoringWorker implements Agent {

    private static final Logger log = LoggerFactory.getLogger(MonitoringWorker.class);
    private static final String AGENT_NAME = "MonitoringAgent";

    private final PersistenceGateway gateway;
    private final AgentMessenger messenger;
    private final AgentAddresses addresses;
    private final AgentSettings settings;
    private final Clock clock;
    private final PeriodicSweep sweep;

    public MonitoringWorker(MailboxTransport transport,
                            MessageCodec codec,
                            PersistenceGateway gateway,
                            AgentAddresses addresses,
                            AgentSettings settings,
                            Clock clock) {
        transport.register(addresses.monitoring());
        this.messenger = new AgentMessenger(addresses.monitoring(), transport, codec, clock);
        this.gateway   = gateway;
        this.addresses = addresses;
        this.settings  = settings;
        this.clock     = clock;
        this.sweep     = new PeriodicSweep(AGENT_NAME, settings.monitoringPeriod(), this::runCycle);
    }

    @Override
    public String agentName() {
        return AGENT_NAME;
    }

    @Override
    public void start() {
        sweep.start();
    }

    @Override
    public void stop() {
        sweep.stop();
    }

    @Override
    public boolean isRunning() {
        return sweep.isRunning();
    }

    /**
     * One monitoring scan over all students.
     *
     * @return number of {@code student_risk} events handed to the transport
     */
    public Mono<Integer> runCycle() {
        Instant now = clock.instant();
        log.info("[{}] Running monitoring cycle.", AGENT_NAME);
        return gateway.findStudents()
            .concatMap(student -> scanStudent(student, now)
                .onErrorResume(e -> {
                    log.error("[{}] Scan failed for studentId={}; continuing with next student",
                              AGENT_NAME, student.id(), e);
                    return Mono.just(false);
                }))
            .filter(Boolean::booleanValue)
            .count()
            .map(Long::intValue)
            .doOnSuccess(emitted -> log.info("[{}] Monitoring cycle complete. riskEvents={}", AGENT_NAME, emitted));
    }

    private Mono<Boolean> scanStudent(Student student, Instant now) {
        return gateway.findAnswers(student.id())
            .collectList()
            .map(answers -> PerformanceCalculator.snapshot(student.id(), answers, now))
            .flatMap(snapshot -> {
                if (!snapshot.hasAnswers() || snapshot.score() >= settings.riskThreshold()) {
                    return Mono.just(false);
                }
                return gateway.findLatestAlert(AgentRole.MONITORING, student.id())
                    .map(last -> DedupWindow.suppresses(last.createdAt(), now, DedupWindow.MONITORING))
                    .defaultIfEmpty(false)
                    .flatMap(suppressed -> {
                        if (suppressed) {
                            log.debug("[{}] Recent report exists; skipping studentId={}", AGENT_NAME, student.id());
                            return Mono.just(false);
                        }
                        return report(student, snapshot, now);
                    });
            });
    }

    private Mono<Boolean> report(Student student, StudentPerformanceSnapshot snapshot, Instant now) {
        String traceId = TraceContextUtil.newTraceId();
        AlertRecord summary = AlertRecord.unread(AgentRole.MONITORING, student.id(),
            summaryText(student, snapshot), snapshot.severity(), now);

        Mono<Void> persisted = gateway.appendAlert(summary)
            .then()
            .onErrorResume(e -> {
                log.error("[{}] Failed to persist performance summary. studentId={} traceId={}",
                          AGENT_NAME, student.id(), traceId, e);
                return Mono.empty();
            });

        return persisted.then(Mono.fromSupplier(() -> emitRiskEvent(student, snapshot, traceId)));
    }

    private boolean emitRiskEvent(Student student, StudentPerformanceSnapshot snapshot, String traceId) {
        StudentRiskEvent event = new StudentRiskEvent(student.id(), student.displayName(),
            snapshot.score(), snapshot.recentScore(), snapshot.severity());
        try {
            messenger.send(addresses.router(), event, traceId);
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[{}] Risk event sent. studentId={} score={} severity={} traceId={}",
                         AGENT_NAME, student.id(), snapshot.score(), snapshot.severity().wireName(), traceId));
            return true;
        } catch (MailboxDeliveryException e) {
            log.error("[{}] Risk event not delivered. studentId={} traceId={} reason={}",
                      AGENT_NAME, student.id(), traceId, e.getMessage());
            return false;
        }
    }

    static String summaryText(Student student, StudentPerformanceSnapshot snapshot) {
        String text = String.format(Locale.ROOT, "Student \"%s\" has an overall score of %.1f%% (%d/%d).",
            student.displayName(), snapshot.score(), snapshot.correctAnswers(), snapshot.totalAnswers());
        if (snapshot.recentScore() != null) {
            text += String.format(Locale.ROOT, " Last 24h: %.1f%%.", snapshot.recentScore());
        }
        return text;
    }
}
