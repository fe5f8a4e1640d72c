package com.lmsagents.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/** Persisted recommendation. {@code topicId} is null for whole-program advice. */
@Data
@NoArgsConstructor
@Table("adaptation_logs")
public class AdaptationLog {

    @Id
    private Long id;

    private Long studentId;

    private Long topicId;

    private String recommendation;

    private Boolean aiGenerated;

    private LocalDateTime createdAt;
}
