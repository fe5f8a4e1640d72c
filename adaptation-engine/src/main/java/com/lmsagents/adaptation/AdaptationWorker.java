package com.lmsagents.adaptation;

import com.lmsagents.adaptation.analysis.ErrorAnalysis;
import com.lmsagents.adaptation.analysis.ErrorPatternAnalyzer;
import com.lmsagents.adaptation.generator.GenerationResult;
import com.lmsagents.adaptation.generator.RecommendationGenerator;
import com.lmsagents.adaptation.generator.RecommendationRequest;
import com.lmsagents.adaptation.generator.TopicResult;
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
import com.lmsagents.common.message.GenerateRecommendationsCommand;
import com.lmsagents.common.message.MessageCodec;
import com.lmsagents.common.message.RecommendationsReadyEvent;
import com.lmsagents.common.model.AnswerRecord;
import com.lmsagents.common.model.GeneratedBy;
import com.lmsagents.common.model.RecommendationRecord;
import com.lmsagents.common.model.Student;
import com.lmsagents.common.model.Topic;
import com.lmsagents.common.model.TopicStats;
import com.lmsagents.common.persistence.PersistenceGateway;
import com.lmsagents.common.scoring.DedupWindow;
import com.lmsagents.common.scoring.FallbackRecommendations;
import com.lmsagents.common.scoring.PerformanceCalculator;
import com.lmsagents.common.trace.TraceContextUtil;
import com.lmsagents.common.worker.Agent;
import com.lmsagents.common.worker.PeriodicSweep;
import com.lmsagents.common.worker.ReceiveLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Produces remediation for at-risk students.
 *
 * <p>Three entry points:
 * <ul>
 *   <li>{@code generate_recommendations} from the router: one record per weak topic, or one
 *       whole-program record when no single topic is weak but the overall score is, followed
 *       by a {@code recommendations_ready} event.</li>
 *   <li>A periodic sweep over all students that tops up weak-topic records without any event.</li>
 *   <li>{@code analyze_errors} from the router: error-pattern analysis answered with an
 *       {@code adaptation_analysis} event.</li>
 * </ul>
 *
 * <p>Every (student, topic) key, including the whole-program key, is written at most once per
 * {@link DedupWindow#ADAPTATION}. Generator failures never surface: a
 * {@link GenerationResult.Failed} result is replaced by {@link FallbackRecommendations} text.
 */
@Component
public class AdaptationWorker implements Agent {

    private static final Logger log = LoggerFactory.getLogger(AdaptationWorker.class);
    private static final String AGENT_NAME = "AdaptationAgent";

    static final String GENERAL_PROGRAM = "general program";

    private final PersistenceGateway gateway;
    private final RecommendationGenerator generator;
    private final ErrorPatternAnalyzer analyzer;
    private final MessageCodec codec;
    private final AgentMessenger messenger;
    private final AgentAddresses addresses;
    private final AgentSettings settings;
    private final Clock clock;
    private final ReceiveLoop receiveLoop;
    private final PeriodicSweep sweep;

    public AdaptationWorker(MailboxTransport transport,
                            MessageCodec codec,
                            PersistenceGateway gateway,
                            RecommendationGenerator generator,
                            ErrorPatternAnalyzer analyzer,
                            AgentAddresses addresses,
                            AgentSettings settings,
                            Clock clock) {
        this.gateway     = gateway;
        this.generator   = generator;
        this.analyzer    = analyzer;
        this.codec       = codec;
        this.messenger   = new AgentMessenger(addresses.adaptation(), transport, codec, clock);
        this.addresses   = addresses;
        this.settings    = settings;
        this.clock       = clock;
        this.receiveLoop = new ReceiveLoop(AGENT_NAME, transport.register(addresses.adaptation()),
                                           settings.receiveTimeout(), this::handle);
        this.sweep       = new PeriodicSweep(AGENT_NAME + "-sweep", settings.adaptationPeriod(), this::runSweep);
    }

    @Override
    public String agentName() {
        return AGENT_NAME;
    }

    @Override
    public void start() {
        receiveLoop.start();
        sweep.start();
    }

    @Override
    public void stop() {
        sweep.stop();
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
        return switch (message.type()) {
            case GENERATE_RECOMMENDATIONS ->
                generateRecommendations((GenerateRecommendationsCommand) message, envelope.traceId()).then();
            case ANALYZE_ERRORS ->
                analyzeErrors((AnalyzeErrorsCommand) message, envelope.traceId()).then();
            default -> {
                log.info("[{}] Ignoring message type={} from={}", AGENT_NAME, message.eventName(), envelope.sender());
                yield Mono.empty();
            }
        };
    }

    /**
     * Handles one {@code generate_recommendations} command and reports the outcome to the router.
     */
    public Mono<RecommendationOutcome> generateRecommendations(GenerateRecommendationsCommand command, String traceId) {
        Instant now = clock.instant();
        long studentId = command.studentId();
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[{}] Generating recommendations. studentId={} score={} traceId={}",
                     AGENT_NAME, studentId, command.score(), traceId));

        return gateway.findAnswers(studentId)
            .collectList()
            .flatMap(answers -> {
                List<TopicStats> weakTopics = PerformanceCalculator.byTopic(answers).values().stream()
                    .filter(stats -> stats.isBelow(settings.riskThreshold()))
                    .toList();
                if (!weakTopics.isEmpty()) {
                    return Flux.fromIterable(weakTopics)
                        .concatMap(stats -> recommendForTopic(studentId, command.studentName(), stats, now))
                        .collectList()
                        .map(RecommendationOutcome::of);
                }
                if (command.score() < settings.riskThreshold()) {
                    return recommendForProgram(studentId, command.studentName(), command.score(), answers, now)
                        .map(generatedBy -> RecommendationOutcome.of(List.of(generatedBy)))
                        .defaultIfEmpty(RecommendationOutcome.NONE);
                }
                return Mono.just(RecommendationOutcome.NONE);
            })
            .onErrorResume(e -> {
                log.error("[{}] Recommendation pass failed. studentId={} traceId={}", AGENT_NAME, studentId, traceId, e);
                return Mono.just(RecommendationOutcome.NONE);
            })
            .doOnNext(outcome -> reportReady(studentId, outcome, traceId));
    }

    /**
     * Handles one {@code analyze_errors} command: analyses the student's per-topic results and
     * sends the analysis to the router.
     */
    public Mono<ErrorAnalysis> analyzeErrors(AnalyzeErrorsCommand command, String traceId) {
        long studentId = command.studentId();
        return gateway.findAnswers(studentId)
            .collectList()
            .flatMapMany(answers -> Flux.fromIterable(PerformanceCalculator.byTopic(answers).values()))
            .concatMap(stats -> gateway.findTopic(stats.topicId())
                .map(Topic::title)
                .defaultIfEmpty("Topic " + stats.topicId())
                .map(title -> new TopicResult(title, stats.total(), stats.correct(), stats.roundedPercentage())))
            .collectList()
            .flatMap(results -> analyzer.analyze(command.studentName(), results))
            .doOnNext(analysis -> reportAnalysis(studentId, analysis, traceId))
            .onErrorResume(e -> {
                log.error("[{}] Error analysis failed. studentId={} traceId={}", AGENT_NAME, studentId, traceId, e);
                return Mono.empty();
            });
    }

    // ── periodic sweep ───────────────────────────────────────────────────────

    /**
     * One sweep over all students.
     *
     * @return number of recommendation records written
     */
    public Mono<Integer> runSweep() {
        Instant now = clock.instant();
        log.info("[{}] Running adaptation sweep.", AGENT_NAME);
        return gateway.findStudents()
            .concatMap(student -> sweepStudent(student, now)
                .onErrorResume(e -> {
                    log.error("[{}] Sweep failed for studentId={}; continuing with next student",
                              AGENT_NAME, student.id(), e);
                    return Mono.just(0);
                }))
            .reduce(0, Integer::sum)
            .doOnSuccess(written -> log.info("[{}] Adaptation sweep complete. recommendations={}", AGENT_NAME, written));
    }

    private Mono<Integer> sweepStudent(Student student, Instant now) {
        return gateway.findAnswers(student.id())
            .collectList()
            .flatMapMany(answers -> Flux.fromIterable(PerformanceCalculator.byTopic(answers).values()))
            .filter(stats -> stats.isBelow(settings.riskThreshold()))
            .concatMap(stats -> recommendForTopic(student.id(), student.displayName(), stats, now))
            .count()
            .map(Long::intValue);
    }

    // ── record generation ────────────────────────────────────────────────────

    private Mono<GeneratedBy> recommendForTopic(long studentId, String studentName, TopicStats stats, Instant now) {
        return outsideWindow(studentId, stats.topicId(), now)
            .flatMap(ignored -> gateway.findTopic(stats.topicId()))
            .flatMap(topic -> generateAndStore(studentId, topic.id(),
                new RecommendationRequest(studentName, topic.title(), stats.roundedPercentage(),
                                          stats.total(), stats.correct()),
                now))
            .onErrorResume(e -> {
                log.error("[{}] Recommendation failed. studentId={} topicId={}", AGENT_NAME, studentId, stats.topicId(), e);
                return Mono.empty();
            });
    }

    private Mono<GeneratedBy> recommendForProgram(long studentId, String studentName, double score,
                                                  List<AnswerRecord> answers, Instant now) {
        int correct = (int) answers.stream().filter(AnswerRecord::correct).count();
        RecommendationRequest request =
            new RecommendationRequest(studentName, GENERAL_PROGRAM, score, answers.size(), correct);
        return outsideWindow(studentId, null, now)
            .flatMap(ignored -> generateAndStore(studentId, null, request, now))
            .onErrorResume(e -> {
                log.error("[{}] Whole-program recommendation failed. studentId={}", AGENT_NAME, studentId, e);
                return Mono.empty();
            });
    }

    /** Emits once when the key has no record inside the dedup window, otherwise completes empty. */
    private Mono<Boolean> outsideWindow(long studentId, Long topicId, Instant now) {
        return gateway.findLatestRecommendation(studentId, topicId)
            .map(last -> DedupWindow.suppresses(last.createdAt(), now, DedupWindow.ADAPTATION))
            .defaultIfEmpty(false)
            .filter(suppressed -> {
                if (suppressed) {
                    log.debug("[{}] Recent recommendation exists; skipping studentId={} topicId={}",
                              AGENT_NAME, studentId, topicId);
                }
                return !suppressed;
            });
    }

    private Mono<GeneratedBy> generateAndStore(long studentId, Long topicId, RecommendationRequest request, Instant now) {
        return generator.generateRecommendation(request)
            .onErrorResume(e -> Mono.just(GenerationResult.failed(String.valueOf(e.getMessage()))))
            .defaultIfEmpty(GenerationResult.failed("generator returned nothing"))
            .map(result -> toRecord(studentId, topicId, request, result, now))
            .flatMap(gateway::appendRecommendation)
            .map(RecommendationRecord::generatedBy);
    }

    private RecommendationRecord toRecord(long studentId, Long topicId, RecommendationRequest request,
                                          GenerationResult result, Instant now) {
        if (result instanceof GenerationResult.Generated generated) {
            return RecommendationRecord.of(studentId, topicId, generated.text(), GeneratedBy.EXTERNAL, now);
        }
        log.info("[{}] Using rule recommendation. studentId={} topic={} reason={}",
                 AGENT_NAME, studentId, request.topicTitle(), ((GenerationResult.Failed) result).reason());
        return RecommendationRecord.of(studentId, topicId,
            FallbackRecommendations.text(request.topicTitle(), request.scorePct()), GeneratedBy.RULE, now);
    }

    // ── outbound ─────────────────────────────────────────────────────────────

    private void reportReady(long studentId, RecommendationOutcome outcome, String traceId) {
        try {
            messenger.send(addresses.router(),
                new RecommendationsReadyEvent(studentId, outcome.count(), outcome.aiUsed()), traceId);
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[{}] Recommendations ready. studentId={} count={} aiUsed={} traceId={}",
                         AGENT_NAME, studentId, outcome.count(), outcome.aiUsed(), traceId));
        } catch (MailboxDeliveryException e) {
            log.error("[{}] recommendations_ready not delivered. studentId={} traceId={} reason={}",
                      AGENT_NAME, studentId, traceId, e.getMessage());
        }
    }

    private void reportAnalysis(long studentId, ErrorAnalysis analysis, String traceId) {
        try {
            messenger.send(addresses.router(),
                new AdaptationAnalysisEvent(studentId, analysis.suggestedDifficulty(),
                                            analysis.summary(), analysis.weakAreas()), traceId);
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[{}] Analysis sent. studentId={} difficulty={} source={} traceId={}",
                         AGENT_NAME, studentId, analysis.suggestedDifficulty(),
                         analysis.generatedBy().wireName(), traceId));
        } catch (MailboxDeliveryException e) {
            log.error("[{}] adaptation_analysis not delivered. studentId={} traceId={} reason={}",
                      AGENT_NAME, studentId, traceId, e.getMessage());
        }
    }
}
