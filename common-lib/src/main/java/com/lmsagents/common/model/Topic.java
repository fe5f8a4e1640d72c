package com.lmsagents.common.model;

public record Topic(
    long id,
    String title,
    String description,
    int difficulty
) {}
