package com.lmsagents.common.config;

import java.time.Duration;

/**
 * Tunables shared by all workers. Dedup windows are fixed and live in
 * {@link com.lmsagents.common.scoring.DedupWindow}.
 *
 * @param riskThreshold     percentage below which a student (or topic) is at risk
 * @param monitoringPeriod  spacing of monitoring scans
 * @param adaptationPeriod  spacing of adaptation sweeps
 * @param receiveTimeout    how long a mailbox loop blocks before re-checking for shutdown
 */
public record AgentSettings(
    double riskThreshold,
    Duration monitoringPeriod,
    Duration adaptationPeriod,
    Duration receiveTimeout
) {
    public static final double DEFAULT_RISK_THRESHOLD = 50.0;

    public static AgentSettings defaults() {
        return new AgentSettings(DEFAULT_RISK_THRESHOLD, Duration.ofSeconds(30),
                                 Duration.ofSeconds(60), Duration.ofSeconds(10));
    }

    public AgentSettings withReceiveTimeout(Duration timeout) {
        return new AgentSettings(riskThreshold, monitoringPeriod, adaptationPeriod, timeout);
    }
}
