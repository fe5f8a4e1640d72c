package com.lmsagents.common.model;

import java.time.Instant;

public record AnswerRecord(
    long id,
    long studentId,
    long topicId,
    boolean correct,
    Instant answeredAt
) {}
