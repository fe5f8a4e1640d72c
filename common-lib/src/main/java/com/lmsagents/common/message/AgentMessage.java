package com.lmsagents.common.message;

/**
 * Closed set of payloads exchanged between workers. Every variant is a flat record
 * whose JSON form carries a {@code type} discriminator (see {@link MessageCodec}).
 */
public sealed interface AgentMessage
    permits StudentRiskEvent, GenerateRecommendationsCommand, CreateAlertCommand,
            RecommendationsReadyEvent, AdaptationAnalysisEvent, AnalyzeErrorsCommand,
            UnknownMessage {

    MessageType type();

    /** Student the message concerns, or {@code null} when the payload does not name one. */
    Long studentId();

    /** Event type as it appears on the wire. */
    default String eventName() {
        return type().wireName();
    }
}
