package com.lmsagents.notification;

import com.lmsagents.common.config.AgentAddresses;
import com.lmsagents.common.config.AgentSettings;
import com.lmsagents.common.exception.MalformedMessageException;
import com.lmsagents.common.mailbox.Envelope;
import com.lmsagents.common.mailbox.MailboxTransport;
import com.lmsagents.common.message.AgentMessage;
import com.lmsagents.common.message.CreateAlertCommand;
import com.lmsagents.common.message.MessageCodec;
import com.lmsagents.common.message.MessageType;
import com.lmsagents.common.model.AgentRole;
import com.lmsagents.common.model.AlertRecord;
import com.lmsagents.common.persistence.PersistenceGateway;
import com.lmsagents.common.trace.TraceContextUtil;
import com.lmsagents.common.worker.Agent;
import com.lmsagents.common.worker.ReceiveLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Locale;

/**
 * Turns every {@code create_alert} command into one unread instructor-facing alert.
 * No dedup: the router only sends one command per routed risk event.
 */
@Component
public class NotificationWorker implements Agent {

    private static final Logger log = LoggerFactory.getLogger(NotificationWorker.class);
    private static final String AGENT_NAME = "NotificationAgent";

    private final PersistenceGateway gateway;
    private final MessageCodec codec;
    private final Clock clock;
    private final ReceiveLoop receiveLoop;

    public NotificationWorker(MailboxTransport transport,
                              MessageCodec codec,
                              PersistenceGateway gateway,
                              AgentAddresses addresses,
                              AgentSettings settings,
                              Clock clock) {
        this.gateway     = gateway;
        this.codec       = codec;
        this.clock       = clock;
        this.receiveLoop = new ReceiveLoop(AGENT_NAME, transport.register(addresses.notification()),
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

    public Mono<Void> handle(Envelope envelope) {
        AgentMessage message;
        try {
            message = codec.decode(envelope.body());
        } catch (MalformedMessageException e) {
            log.warn("[{}] Dropping malformed message. from={} traceId={} reason={}",
                     AGENT_NAME, envelope.sender(), envelope.traceId(), e.getMessage());
            return Mono.empty();
        }
        if (message.type() != MessageType.CREATE_ALERT) {
            log.info("[{}] Ignoring message type={} from={}", AGENT_NAME, message.eventName(), envelope.sender());
            return Mono.empty();
        }
        return createAlert((CreateAlertCommand) message, envelope.traceId()).then();
    }

    /** Persists one unread alert; a persistence failure is logged and completes empty. */
    public Mono<AlertRecord> createAlert(CreateAlertCommand command, String traceId) {
        AlertRecord alert = AlertRecord.unread(AgentRole.NOTIFICATION, command.studentId(),
            alertText(command), command.severity(), clock.instant());

        return gateway.appendAlert(alert)
            .doOnNext(saved -> TraceContextUtil.withMdc(traceId, () ->
                log.info("[{}] Alert created. alertId={} studentId={} severity={} traceId={}",
                         AGENT_NAME, saved.id(), saved.studentId(), saved.severity().wireName(), traceId)))
            .onErrorResume(e -> {
                log.error("[{}] Failed to persist alert. studentId={} traceId={}",
                          AGENT_NAME, command.studentId(), traceId, e);
                return Mono.empty();
            });
    }

    static String alertText(CreateAlertCommand command) {
        String name = command.studentName().isBlank() ? "#" + command.studentId() : command.studentName();
        return String.format(Locale.ROOT, "Notice: student \"%s\" is at risk (score: %.1f%%, severity: %s).",
            name, command.score(), command.severity().wireName());
    }
}
