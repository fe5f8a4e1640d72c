package com.lmsagents.history.repository;

import com.lmsagents.history.model.StudentAnswer;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface StudentAnswerRepository extends ReactiveCrudRepository<StudentAnswer, Long> {

    Flux<StudentAnswer> findByStudentIdOrderById(Long studentId);
}
