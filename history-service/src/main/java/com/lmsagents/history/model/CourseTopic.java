package com.lmsagents.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

@Data
@NoArgsConstructor
@Table("topics")
public class CourseTopic {

    @Id
    private Long id;

    private String title;

    private String description;

    /** 1 = easy, 2 = medium, 3 = hard */
    private Integer difficulty;
}
