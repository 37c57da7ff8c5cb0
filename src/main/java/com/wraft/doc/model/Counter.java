package com.wraft.doc.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-subject monotonic counter. Subjects look like {@code "ContentType:<id>"}.
 */
@Entity
@Table(name = "counters", uniqueConstraints = @UniqueConstraint(name = "uk_counter_subject", columnNames = "subject"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Counter {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "subject", nullable = false, length = 100)
    private String subject;

    @Column(name = "counter_value", nullable = false)
    private long count;

    public static String subjectFor(ContentType contentType) {
        return "ContentType:" + contentType.getId();
    }
}
