package com.lmsagents.orchestrator.router;

import com.lmsagents.common.config.AgentAddresses;
import com.lmsagents.common.config.AgentSettings;
import com.lmsagents.common.exception.MailboxDeliveryException;
import com.lmsagents.common.exception.MalformedMessageException;
import com.lmsagents.common.mailbox.AgentMessenger;
import com.lmsagents.common.mailbox.Envelope;
import com.lmsagents.common.mailbox.MailboxTransport;
import com.lmsagents.common.message.AdaptationAnalysisEvent;
import com.lmsagents.common.message.AgentMessage;
import com.lmsagents.common.message.AnalyzeErrorsCommand;
import com.lmsagents.common.message.CreateAlertCommand;
import com.lmsagents.common.message.GenerateRecommendationsCommand;
import com.lmsagents.common.message.MessageCodec;
import com.lmsagents.common.message.MessageType;
import com.lmsagents.common.message.RecommendationsReadyEvent;
import com.lmsagents.common.message.StudentRiskEvent;
import com.lmsagents.common.model.AgentRole;
import com.lmsagents.common.model.DecisionLogEntry;
import com.lmsagents.common.persistence.PersistenceGateway;
import com.lmsagents.common.trace.TraceContextUtil;
import com.lmsagents.common.worker.Agent;
import com.lmsagents.common.worker.ReceiveLoop;
import com.lmsagents.orchestrator.logger.DecisionLogWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Locale;

/**
 * Central router. Every inter-worker message passes through here; workers never
 * address each other.
 *
 * <p>Per inbound message:
 * <pre>
 *   decode ─[malformed]→ WARN, drop (no audit row)
 *          └→ inbound audit row → route by type → decision audit row → dispatch
 * </pre>
 *
 * <p>Routing is flat and stateless: one level of fan-out, no retries, nothing carried
 * between events. A {@code student_risk} always yields one command to adaptation and one
 * to notification; both sends are attempted even when the first fails.
 */
@Component
public class OrchestratorRouter implements Agent {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorRouter.class);
    private static final String AGENT_NAME = "OrchestratorAgent";

    static final String RISK_TARGETS = AgentRole.ADAPTATION.wireName() + "," + AgentRole.NOTIFICATION.wireName();

    private final MessageCodec codec;
    private final PersistenceGateway gateway;
    private final DecisionLogWriter decisionLog;
    private final AgentMessenger messenger;
    private final AgentAddresses addresses;
    private final ReceiveLoop receiveLoop;

    public OrchestratorRouter(MailboxTransport transport,
                              MessageCodec codec,
                              PersistenceGateway gateway,
                              DecisionLogWriter decisionLog,
                              AgentAddresses addresses,
                              AgentSettings settings,
                              Clock clock) {
        this.codec       = codec;
        this.gateway     = gateway;
        this.decisionLog = decisionLog;
        this.messenger   = new AgentMessenger(addresses.router(), transport, codec, clock);
        this.addresses   = addresses;
        this.receiveLoop = new ReceiveLoop(AGENT_NAME, transport.register(addresses.router()),
                                           settings.receiveTimeout(), this::handle);
    }

    @Override
    public String agentName() {
        return AGENT_NAME;
    }

    @Override
    public void start() {
        receiveLoop.start();
    }

    @Override
    public void stop() {
        receiveLoop.stop();
    }

    @Override
    public boolean isRunning() {
        return receiveLoop.isRunning();
    }

    // ── inbound ──────────────────────────────────────────────────────────────

    public Mono<Void> handle(Envelope envelope) {
        AgentMessage message;
        try {
            message = codec.decode(envelope.body());
        } catch (MalformedMessageException e) {
            log.warn("[{}] Dropping malformed message. from={} traceId={} reason={}",
                     AGENT_NAME, envelope.sender(), envelope.traceId(), e.getMessage());
            return Mono.empty();
        }
        TraceContextUtil.withMdc(envelope.traceId(), () ->
            log.info("[{}] Event received. type={} from={} studentId={} traceId={}",
                     AGENT_NAME, message.eventName(), envelope.sender(), message.studentId(), envelope.traceId()));

        return decisionLog.recordInbound(message, envelope)
            .then(Mono.defer(() -> route(message, envelope.traceId())));
    }

    private Mono<Void> route(AgentMessage message, String traceId) {
        return switch (message.type()) {
            case STUDENT_RISK -> onStudentRisk((StudentRiskEvent) message, traceId);
            case RECOMMENDATIONS_READY -> onRecommendationsReady((RecommendationsReadyEvent) message, traceId);
            case ADAPTATION_ANALYSIS -> onAdaptationAnalysis((AdaptationAnalysisEvent) message, traceId);
            case GENERATE_RECOMMENDATIONS, CREATE_ALERT, ANALYZE_ERRORS -> {
                log.warn("[{}] Command addressed to the router; ignoring. type={} traceId={}",
                         AGENT_NAME, message.eventName(), traceId);
                yield Mono.empty();
            }
            case UNKNOWN -> {
                log.info("[{}] Unknown event type={}; no action. traceId={}", AGENT_NAME, message.eventName(), traceId);
                yield Mono.empty();
            }
        };
    }

    private Mono<Void> onStudentRisk(StudentRiskEvent event, String traceId) {
        String decision = String.format(Locale.ROOT,
            "Score=%.1f%%, dispatching to adaptation and notification", event.score());
        return decisionLog.recordDecision(MessageType.STUDENT_RISK.wireName(), RISK_TARGETS,
                                          event.studentId(), decision, traceId)
            .then(Mono.fromRunnable(() -> {
                dispatch(addresses.adaptation(),
                    new GenerateRecommendationsCommand(event.studentId(), event.studentName(), event.score()), traceId);
                dispatch(addresses.notification(),
                    new CreateAlertCommand(event.studentId(), event.studentName(), event.score(), event.severity()),
                    traceId);
            }));
    }

    private Mono<Void> onRecommendationsReady(RecommendationsReadyEvent event, String traceId) {
        String decision = String.format(Locale.ROOT, "Generated %d recommendations (AI=%s)",
            event.recommendationsCount(), event.aiUsed() ? "yes" : "no");
        return decisionLog.recordDecision(MessageType.RECOMMENDATIONS_READY.wireName(),
                                          AgentRole.ADAPTATION.wireName(), event.studentId(), decision, traceId);
    }

    private Mono<Void> onAdaptationAnalysis(AdaptationAnalysisEvent event, String traceId) {
        return decisionLog.recordDecision(MessageType.ADAPTATION_ANALYSIS.wireName(),
                                          AgentRole.ADAPTATION.wireName(), event.studentId(),
                                          "Suggested difficulty=" + event.suggestedDifficulty(), traceId);
    }

    // ── operator-triggered ───────────────────────────────────────────────────

    /**
     * Asks the adaptation worker for an error-pattern analysis of one student.
     *
     * @return {@code true} if the command was handed to the transport, {@code false} if delivery
     *         failed, empty if no such student exists
     */
    public Mono<Boolean> requestErrorAnalysis(long studentId) {
        return gateway.findStudent(studentId)
            .flatMap(student -> {
                String traceId = TraceContextUtil.newTraceId();
                return decisionLog.recordDecision(MessageType.ANALYZE_ERRORS.wireName(),
                                                  AgentRole.ADAPTATION.wireName(), studentId,
                                                  "Requested error-pattern analysis", traceId)
                    .then(Mono.fromSupplier(() -> dispatch(addresses.adaptation(),
                        new AnalyzeErrorsCommand(studentId, student.displayName()), traceId)));
            });
    }

    public Flux<DecisionLogEntry> recentDecisions(int limit) {
        return gateway.findRecentDecisions(limit);
    }

    // ── outbound ─────────────────────────────────────────────────────────────

    private boolean dispatch(String destination, AgentMessage command, String traceId) {
        try {
            messenger.send(destination, command, traceId);
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[{}] Dispatched. type={} to={} studentId={} traceId={}",
                         AGENT_NAME, command.eventName(), destination, command.studentId(), traceId));
            return true;
        } catch (MailboxDeliveryException e) {
            log.error("[{}] Dispatch failed. type={} to={} traceId={} reason={}",
                      AGENT_NAME, command.eventName(), destination, traceId, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.warn("[{}] Dispatch aborted before delivery. type={} to={} traceId={}",
                     AGENT_NAME, command.eventName(), destination, traceId, e);
            return false;
        }
    }
}
