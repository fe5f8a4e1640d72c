package com.lmsagents.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Platform account. Only rows with {@code role = 'student'} are scanned by the workers.
 */
@Data
@NoArgsConstructor
@Table("users")
public class UserAccount {

    public static final String ROLE_STUDENT = "student";

    @Id
    private Long id;

    private String username;

    private String fullName;

    private String role;

    private LocalDateTime createdAt;
}
