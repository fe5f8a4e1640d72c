package com.lmsagents.history.repository;

import com.lmsagents.history.model.UserAccount;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface UserAccountRepository extends ReactiveCrudRepository<UserAccount, Long> {

    Flux<UserAccount> findByRoleOrderById(String role);

    Mono<UserAccount> findByIdAndRole(Long id, String role);
}
