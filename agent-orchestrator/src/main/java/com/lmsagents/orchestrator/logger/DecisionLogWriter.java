package com.lmsagents.orchestrator.logger;

import com.lmsagents.common.mailbox.Envelope;
import com.lmsagents.common.message.AgentMessage;
import com.lmsagents.common.model.DecisionLogEntry;
import com.lmsagents.common.persistence.PersistenceGateway;
import com.lmsagents.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Appends the router's audit trail.
 *
 * <p>Two kinds of rows, both written before the router acts on them:
 * <ol>
 *   <li>inbound: one per decoded message, with the raw body as payload</li>
 *   <li>decision: one per routing decision, source {@code orchestrator}</li>
 * </ol>
 *
 * <p>A failed append is logged and swallowed so routing always proceeds.
 */
@Component
public class DecisionLogWriter {

    private static final Logger log = LoggerFactory.getLogger(DecisionLogWriter.class);

    private final PersistenceGateway gateway;
    private final Clock clock;

    public DecisionLogWriter(PersistenceGateway gateway, Clock clock) {
        this.gateway = gateway;
        this.clock   = clock;
    }

    public Mono<Void> recordInbound(AgentMessage message, Envelope envelope) {
        DecisionLogEntry entry = DecisionLogEntry.inbound(message.eventName(), envelope.sender(),
            message.studentId(), envelope.body(), clock.instant());
        return append(entry, envelope.traceId());
    }

    public Mono<Void> recordDecision(String eventType, String targetAgent, Long studentId,
                                     String decision, String traceId) {
        DecisionLogEntry entry = DecisionLogEntry.decision(eventType, targetAgent, studentId, decision, clock.instant());
        return append(entry, traceId);
    }

    private Mono<Void> append(DecisionLogEntry entry, String traceId) {
        return gateway.appendDecision(entry)
            .doOnNext(saved -> TraceContextUtil.withMdc(traceId, () ->
                log.debug("[DecisionLog] Appended. id={} eventType={} decision={} traceId={}",
                          saved.id(), saved.eventType(), saved.decision(), traceId)))
            .then()
            .onErrorResume(e -> {
                log.error("[DecisionLog] Failed to append entry. eventType={} studentId={} traceId={}",
                          entry.eventType(), entry.studentId(), traceId, e);
                return Mono.empty();
            });
    }
}
