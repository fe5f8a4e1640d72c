package com.lmsagents.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Router audit row. Inbound rows carry {@code payload}; decision rows carry
 * {@code decision} and usually {@code targetAgent}.
 */
@Data
@NoArgsConstructor
@Table("orchestrator_logs")
public class OrchestratorLog {

    @Id
    private Long id;

    private String eventType;

    private String sourceAgent;

    private String targetAgent;

    private Long studentId;

    /** JSON body of the inbound message */
    private String payload;

    private String decision;

    private LocalDateTime createdAt;
}
