package com.wraft.doc.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A document authored from a content type.
 *
 * {@code instanceId} is the human readable sequence code (prefix plus zero padded
 * counter). It is assigned once at creation and names the build workspace.
 */
@Entity
@Table(name = "contents", indexes = {
        @Index(name = "idx_content_uuid", columnList = "uuid", unique = true),
        @Index(name = "idx_content_instance_id", columnList = "instance_id", unique = true)
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Instance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "uuid", nullable = false, unique = true, length = 36, updatable = false)
    private String uuid;

    @Column(name = "instance_id", nullable = false, unique = true, length = 64, updatable = false)
    private String instanceId;

    @Builder.Default
    @Lob
    @Convert(converter = SerializedFieldsConverter.class)
    @Column(name = "serialized")
    private Map<String, String> serialized = new LinkedHashMap<>();

    @Lob
    @Column(name = "raw_content")
    private String raw;

    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "content_type_id", nullable = false, updatable = false)
    private ContentType contentType;

    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "state_id")
    private State state;

    @Column(name = "creator_id", nullable = false, length = 100, updatable = false)
    private String creatorId;

    /**
     * Build log of this instance; removed together with it.
     */
    @Builder.Default
    @ToString.Exclude
    @OneToMany(mappedBy = "content", cascade = CascadeType.REMOVE, orphanRemoval = true, fetch = FetchType.LAZY)
    private List<BuildHistory> buildHistories = new ArrayList<>();

    @Column(name = "inserted_at", nullable = false, updatable = false)
    private LocalDateTime insertedAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        insertedAt = LocalDateTime.now();
        updatedAt = insertedAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
