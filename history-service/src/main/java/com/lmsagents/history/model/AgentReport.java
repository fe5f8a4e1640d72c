package com.lmsagents.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Instructor-facing alert row.
 *
 * Column mapping:
 *   agentType → agent_type   ("monitoring" | "notification")
 *   read      → is_read
 */
@Data
@NoArgsConstructor
@Table("agent_reports")
public class AgentReport {

    @Id
    private Long id;

    private String agentType;

    private Long studentId;

    private String message;

    private String severity;

    @Column("is_read")
    private Boolean read;

    private LocalDateTime createdAt;
}
