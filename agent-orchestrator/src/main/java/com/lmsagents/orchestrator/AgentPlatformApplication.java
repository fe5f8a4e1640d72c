package com.lmsagents.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;

/**
 * Single deployable hosting the router and the three workers in one process,
 * connected through the in-process mailbox transport.
 */
@SpringBootApplication(scanBasePackages = "com.lmsagents")
@EnableR2dbcRepositories(basePackages = "com.lmsagents.history.repository")
public class AgentPlatformApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentPlatformApplication.class, args);
    }
}
