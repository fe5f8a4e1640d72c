package com.lmsagents.orchestrator.config;

import com.lmsagents.common.config.AgentAddresses;
import com.lmsagents.common.config.AgentSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * {@code lms.agents.*}. Periods without a unit are seconds, so {@code MONITORING_PERIOD=30}
 * and {@code MONITORING_PERIOD=30s} mean the same thing.
 */
@ConfigurationProperties(prefix = "lms.agents")
public record AgentProperties(
    @DefaultValue("50") double riskThreshold,
    @DefaultValue("30") @DurationUnit(ChronoUnit.SECONDS) Duration monitoringPeriod,
    @DefaultValue("60") @DurationUnit(ChronoUnit.SECONDS) Duration adaptationPeriod,
    @DefaultValue("10") @DurationUnit(ChronoUnit.SECONDS) Duration receiveTimeout,
    @DefaultValue("localhost") String server
) {
    public AgentSettings toSettings() {
        return new AgentSettings(riskThreshold, monitoringPeriod, adaptationPeriod, receiveTimeout);
    }

    public AgentAddresses toAddresses() {
        return AgentAddresses.forServer(server);
    }
}
