package com.lmsagents.orchestrator.router;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lmsagents.common.config.AgentAddresses;
import com.lmsagents.common.config.AgentSettings;
import com.lmsagents.common.mailbox.Envelope;
import com.lmsagents.common.mailbox.InMemoryMailboxTransport;
import com.lmsagents.common.mailbox.Mailbox;
import com.lmsagents.common.message.AdaptationAnalysisEvent;
import com.lmsagents.common.message.AgentMessage;
import com.lmsagents.common.message.AnalyzeErrorsCommand;
import com.lmsagents.common.message.CreateAlertCommand;
import com.lmsagents.common.message.GenerateRecommendationsCommand;
import com.lmsagents.common.message.MessageCodec;
import com.lmsagents.common.message.RecommendationsReadyEvent;
import com.lmsagents.common.message.StudentRiskEvent;
import com.lmsagents.common.model.DecisionLogEntry;
import com.lmsagents.common.model.Severity;
import com.lmsagents.common.model.Student;
import com.lmsagents.common.persistence.InMemoryPersistenceGateway;
import com.lmsagents.orchestrator.logger.DecisionLogWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorRouterTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");
    private static final AgentAddresses ADDRESSES = AgentAddresses.forServer("localhost");

    private final MessageCodec codec = new MessageCodec(new ObjectMapper());
    private final Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
    private InMemoryMailboxTransport transport;
    private InMemoryPersistenceGateway gateway;

    @BeforeEach
    void setUp() {
        transport = new InMemoryMailboxTransport();
        gateway = new InMemoryPersistenceGateway();
    }

    private OrchestratorRouter router() {
        return routerWith(codec);
    }

    private OrchestratorRouter routerWith(MessageCodec routerCodec) {
        return new OrchestratorRouter(transport, routerCodec, gateway, new DecisionLogWriter(gateway, clock),
            ADDRESSES, AgentSettings.defaults(), clock);
    }

    private Envelope fromMonitoring(AgentMessage message) {
        return raw(ADDRESSES.monitoring(), codec.encode(message));
    }

    private Envelope raw(String sender, String body) {
        return new Envelope(sender, ADDRESSES.router(), body, "trace-r", T0);
    }

    private static List<AgentMessage> drain(Mailbox mailbox, MessageCodec codec) throws InterruptedException {
        List<AgentMessage> received = new ArrayList<>();
        Optional<Envelope> next;
        while ((next = mailbox.receive(Duration.ofMillis(10))).isPresent()) {
            received.add(codec.decode(next.get().body()));
        }
        return received;
    }

    @Nested
    @DisplayName("student_risk")
    class StudentRisk {

        @Test
        @DisplayName("fans out exactly one command to adaptation and one alert to notification")
        void fanOut() throws InterruptedException {
            Mailbox adaptation = transport.register(ADDRESSES.adaptation());
            Mailbox notification = transport.register(ADDRESSES.notification());

            router().handle(fromMonitoring(new StudentRiskEvent(7L, "Anna Smirnova", 20.0, null, Severity.DANGER)))
                .block();

            List<AgentMessage> toAdaptation = drain(adaptation, codec);
            List<AgentMessage> toNotification = drain(notification, codec);
            assertEquals(List.of(new GenerateRecommendationsCommand(7L, "Anna Smirnova", 20.0)), toAdaptation);
            assertEquals(List.of(new CreateAlertCommand(7L, "Anna Smirnova", 20.0, Severity.DANGER)), toNotification);
        }

        @Test
        @DisplayName("writes the inbound row and then the routing decision")
        void decisionLog() {
            transport.register(ADDRESSES.adaptation());
            transport.register(ADDRESSES.notification());

            router().handle(fromMonitoring(new StudentRiskEvent(7L, "Anna Smirnova", 20.0, null, Severity.DANGER)))
                .block();

            List<DecisionLogEntry> entries = gateway.decisions();
            assertEquals(2, entries.size());

            DecisionLogEntry inbound = entries.get(0);
            assertEquals("student_risk", inbound.eventType());
            assertEquals(ADDRESSES.monitoring(), inbound.sourceAgent());
            assertEquals(7L, inbound.studentId());
            assertNotNull(inbound.payload());
            assertFalse(inbound.isDecision());

            DecisionLogEntry decision = entries.get(1);
            assertEquals("orchestrator", decision.sourceAgent());
            assertEquals("adaptation,notification", decision.targetAgent());
            assertEquals("Score=20.0%, dispatching to adaptation and notification", decision.decision());
        }

        @Test
        @DisplayName("unreachable notification mailbox still leaves both log rows and the adaptation command")
        void downstreamFailure() throws InterruptedException {
            Mailbox adaptation = transport.register(ADDRESSES.adaptation());

            assertDoesNotThrow(() -> router()
                .handle(fromMonitoring(new StudentRiskEvent(7L, "Anna", 45.0, null, Severity.WARNING)))
                .block());

            assertEquals(2, gateway.decisions().size());
            assertEquals(1, drain(adaptation, codec).size());
        }

        @Test
        @DisplayName("encoding failure on the adaptation command still sends the alert")
        void encodingFailureIsolated() throws InterruptedException {
            MessageCodec failingOnRecommendations = new MessageCodec(new ObjectMapper()) {
                @Override
                public String encode(AgentMessage message) {
                    if (message instanceof GenerateRecommendationsCommand) {
                        throw new IllegalStateException("serializer broken");
                    }
                    return super.encode(message);
                }
            };
            Mailbox adaptation = transport.register(ADDRESSES.adaptation());
            Mailbox notification = transport.register(ADDRESSES.notification());

            assertDoesNotThrow(() -> routerWith(failingOnRecommendations)
                .handle(fromMonitoring(new StudentRiskEvent(7L, "Anna", 20.0, null, Severity.DANGER)))
                .block());

            assertTrue(drain(adaptation, codec).isEmpty());
            assertEquals(List.of(new CreateAlertCommand(7L, "Anna", 20.0, Severity.DANGER)),
                         drain(notification, codec));
            assertEquals(2, gateway.decisions().size());
        }

        @Test
        @DisplayName("decision log outage does not stop dispatch")
        void persistenceFailure() throws InterruptedException {
            gateway = new InMemoryPersistenceGateway() {
                @Override
                public Mono<DecisionLogEntry> appendDecision(DecisionLogEntry entry) {
                    return Mono.error(new IllegalStateException("database down"));
                }
            };
            Mailbox adaptation = transport.register(ADDRESSES.adaptation());
            Mailbox notification = transport.register(ADDRESSES.notification());

            router().handle(fromMonitoring(new StudentRiskEvent(7L, "Anna", 20.0, null, Severity.DANGER))).block();

            assertEquals(1, drain(adaptation, codec).size());
            assertEquals(1, drain(notification, codec).size());
        }
    }

    @Test
    @DisplayName("recommendations_ready is logged with count and AI flag")
    void recommendationsReady() {
        router().handle(raw(ADDRESSES.adaptation(), codec.encode(new RecommendationsReadyEvent(7L, 3, true))))
            .block();

        DecisionLogEntry decision = gateway.decisions().get(1);
        assertEquals("recommendations_ready", decision.eventType());
        assertEquals("adaptation", decision.targetAgent());
        assertEquals("Generated 3 recommendations (AI=yes)", decision.decision());
    }

    @Test
    @DisplayName("adaptation_analysis is logged with the suggested difficulty")
    void adaptationAnalysis() {
        router().handle(raw(ADDRESSES.adaptation(),
            codec.encode(new AdaptationAnalysisEvent(7L, 2, "Average score: 65.0%.", List.of())))).block();

        assertEquals("Suggested difficulty=2", gateway.decisions().get(1).decision());
    }

    @Test
    @DisplayName("unknown event type is logged inbound only and nothing is sent")
    void unknownType() throws InterruptedException {
        Mailbox adaptation = transport.register(ADDRESSES.adaptation());

        router().handle(raw(ADDRESSES.monitoring(), "{\"type\":\"quiz_finished\",\"student_id\":7}")).block();

        List<DecisionLogEntry> entries = gateway.decisions();
        assertEquals(1, entries.size());
        assertEquals("quiz_finished", entries.get(0).eventType());
        assertEquals(7L, entries.get(0).studentId());
        assertTrue(drain(adaptation, codec).isEmpty());
    }

    @Test
    @DisplayName("malformed body is dropped without any log row")
    void malformed() {
        router().handle(raw(ADDRESSES.monitoring(), "not json at all")).block();
        router().handle(raw(ADDRESSES.monitoring(), "{\"type\":\"student_risk\",\"student_id\":7}")).block();

        assertTrue(gateway.decisions().isEmpty());
    }

    @Nested
    @DisplayName("requestErrorAnalysis")
    class RequestErrorAnalysis {

        @Test
        @DisplayName("known student → analyze_errors command with the display name")
        void knownStudent() throws InterruptedException {
            Student ivan = gateway.addStudent("ivan", "Ivan Petrov");
            Mailbox adaptation = transport.register(ADDRESSES.adaptation());

            Boolean sent = router().requestErrorAnalysis(ivan.id()).block();

            assertEquals(Boolean.TRUE, sent);
            assertEquals(List.of(new AnalyzeErrorsCommand(ivan.id(), "Ivan Petrov")), drain(adaptation, codec));
            assertEquals("analyze_errors", gateway.decisions().get(0).eventType());
        }

        @Test
        @DisplayName("unknown student → empty, nothing sent")
        void unknownStudent() {
            transport.register(ADDRESSES.adaptation());

            assertNull(router().requestErrorAnalysis(999L).block());
            assertTrue(gateway.decisions().isEmpty());
        }

        @Test
        @DisplayName("unreachable adaptation mailbox → false")
        void unreachable() {
            Student ivan = gateway.addStudent("ivan", "Ivan Petrov");

            assertEquals(Boolean.FALSE, router().requestErrorAnalysis(ivan.id()).block());
        }
    }
}
