package com.lmsagents.orchestrator.config;

import com.lmsagents.common.config.AgentAddresses;
import com.lmsagents.common.config.AgentSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withUserConfiguration(OrchestratorConfig.class);

    @Test
    @DisplayName("periods given as bare numbers are seconds")
    void bareNumbersAreSeconds() {
        runner.withPropertyValues(
                "lms.agents.monitoring-period=30",
                "lms.agents.adaptation-period=60",
                "lms.agents.receive-timeout=10")
            .run(context -> {
                AgentSettings settings = context.getBean(AgentSettings.class);
                assertEquals(Duration.ofSeconds(30), settings.monitoringPeriod());
                assertEquals(Duration.ofSeconds(60), settings.adaptationPeriod());
                assertEquals(Duration.ofSeconds(10), settings.receiveTimeout());
            });
    }

    @Test
    @DisplayName("explicit units are honoured")
    void explicitUnits() {
        runner.withPropertyValues(
                "lms.agents.monitoring-period=2m",
                "lms.agents.receive-timeout=500ms",
                "lms.agents.risk-threshold=40")
            .run(context -> {
                AgentSettings settings = context.getBean(AgentSettings.class);
                assertEquals(Duration.ofMinutes(2), settings.monitoringPeriod());
                assertEquals(Duration.ofMillis(500), settings.receiveTimeout());
                assertEquals(40.0, settings.riskThreshold());
            });
    }

    @Test
    @DisplayName("unset properties fall back to 50 / 30s / 60s / 10s on localhost")
    void defaults() {
        runner.run(context -> {
            assertEquals(AgentSettings.defaults(), context.getBean(AgentSettings.class));
            assertEquals("orchestrator@localhost", context.getBean(AgentAddresses.class).router());
        });
    }

    @Test
    @DisplayName("server name is applied to every mailbox address")
    void serverAddresses() {
        runner.withPropertyValues("lms.agents.server=lms.example.org")
            .run(context -> assertEquals(AgentAddresses.forServer("lms.example.org"),
                                         context.getBean(AgentAddresses.class)));
    }
}
