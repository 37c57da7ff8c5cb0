package com.wraft.doc.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Workflow state an instance moves through (Draft, Review, Published...).
 */
@Entity
@Table(name = "states", indexes = {
        @Index(name = "idx_state_uuid", columnList = "uuid", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class State {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "uuid", nullable = false, unique = true, length = 36, updatable = false)
    private String uuid;

    @Column(name = "state", nullable = false, length = 100)
    private String state;

    @Column(name = "order_index", nullable = false)
    private int orderIndex;
}
