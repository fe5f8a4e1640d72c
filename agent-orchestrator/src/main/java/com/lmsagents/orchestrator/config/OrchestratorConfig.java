package com.lmsagents.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lmsagents.common.config.AgentAddresses;
import com.lmsagents.common.config.AgentSettings;
import com.lmsagents.common.mailbox.InMemoryMailboxTransport;
import com.lmsagents.common.mailbox.MailboxTransport;
import com.lmsagents.common.message.MessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(AgentProperties.class)
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Bean
    public AgentSettings agentSettings(AgentProperties properties) {
        AgentSettings settings = properties.toSettings();
        log.info("[Config] Agent settings. riskThreshold={} monitoringPeriod={} adaptationPeriod={} receiveTimeout={}",
                 settings.riskThreshold(), settings.monitoringPeriod(), settings.adaptationPeriod(),
                 settings.receiveTimeout());
        return settings;
    }

    @Bean
    public AgentAddresses agentAddresses(AgentProperties properties) {
        return properties.toAddresses();
    }

    @Bean
    public MailboxTransport mailboxTransport() {
        return new InMemoryMailboxTransport();
    }

    @Bean
    public MessageCodec messageCodec(ObjectMapper objectMapper) {
        return new MessageCodec(objectMapper);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
