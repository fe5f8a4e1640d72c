package com.lmsagents.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One submitted quiz answer. {@code topicId} is denormalised from the question so the
 * workers can aggregate per topic without a join.
 */
@Data
@NoArgsConstructor
@Table("student_answers")
public class StudentAnswer {

    @Id
    private Long id;

    private Long studentId;

    private Long questionId;

    private Long topicId;

    @Column("is_correct")
    private Boolean correct;

    private LocalDateTime answeredAt;
}
