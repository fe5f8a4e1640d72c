package com.lmsagents.common.message;

public enum MessageType {
    STUDENT_RISK("student_risk", StudentRiskEvent.class),
    GENERATE_RECOMMENDATIONS("generate_recommendations", GenerateRecommendationsCommand.class),
    CREATE_ALERT("create_alert", CreateAlertCommand.class),
    RECOMMENDATIONS_READY("recommendations_ready", RecommendationsReadyEvent.class),
    ADAPTATION_ANALYSIS("adaptation_analysis", AdaptationAnalysisEvent.class),
    ANALYZE_ERRORS("analyze_errors", AnalyzeErrorsCommand.class),
    UNKNOWN("unknown", UnknownMessage.class);

    private final String wireName;
    private final Class<? extends AgentMessage> payloadType;

    MessageType(String wireName, Class<? extends AgentMessage> payloadType) {
        this.wireName = wireName;
        this.payloadType = payloadType;
    }

    public String wireName() {
        return wireName;
    }

    public Class<? extends AgentMessage> payloadType() {
        return payloadType;
    }

    /** Resolves a wire name; anything unrecognised (including {@code null}) maps to {@link #UNKNOWN}. */
    public static MessageType fromWireName(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (MessageType t : values()) {
            if (t != UNKNOWN && t.wireName.equals(value)) {
                return t;
            }
        }
        return UNKNOWN;
    }
}
