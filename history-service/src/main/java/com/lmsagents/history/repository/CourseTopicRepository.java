package com.lmsagents.history.repository;

import com.lmsagents.history.model.CourseTopic;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CourseTopicRepository extends ReactiveCrudRepository<CourseTopic, Long> {
}
