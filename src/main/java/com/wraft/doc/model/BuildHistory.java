package com.wraft.doc.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * One build attempt of an instance. Append-only: rows are inserted once and
 * never updated.
 *
 * Table: build_histories
 */
@Entity
@Immutable
@Table(name = "build_histories", indexes = {
        @Index(name = "idx_build_history_content", columnList = "content_id"),
        @Index(name = "idx_build_history_exit_code", columnList = "exit_code")
})
@Getter
@Builder
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class BuildHistory {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_FAILED = "failed";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "content_id", nullable = false, updatable = false)
    private Instance content;

    @Column(name = "creator_id", nullable = false, length = 100, updatable = false)
    private String creatorId;

    @Column(name = "start_time", nullable = false, updatable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false, updatable = false)
    private Instant endTime;

    /**
     * end_time - start_time, in milliseconds.
     */
    @Column(name = "delay", nullable = false, updatable = false)
    private long delay;

    /**
     * Renderer exit status, exactly as the process reported it.
     */
    @Column(name = "exit_code", nullable = false, updatable = false)
    private int exitCode;

    @Column(name = "status", nullable = false, length = 20, updatable = false)
    private String status;

    @Column(name = "inserted_at", nullable = false, updatable = false)
    private LocalDateTime insertedAt;

    @PrePersist
    protected void onCreate() {
        if (insertedAt == null) {
            insertedAt = LocalDateTime.now();
        }
    }

    public boolean isSuccessful() {
        return exitCode == 0;
    }
}
