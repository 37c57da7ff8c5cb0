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
import java.util.List;

/**
 * Schema for a class of documents: the fields it declares, the layout it is
 * rendered with, and the prefix of its sequence codes.
 */
@Entity
@Table(name = "content_types", indexes = {
        @Index(name = "idx_content_type_uuid", columnList = "uuid", unique = true)
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentType {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "uuid", nullable = false, unique = true, length = 36, updatable = false)
    private String uuid;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "description", length = 1000)
    private String description;

    @Column(name = "prefix", nullable = false, length = 20)
    private String prefix;

    @Column(name = "color", length = 20)
    private String color;

    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "layout_id")
    private Layout layout;

    /**
     * Declared fields, in declaration order.
     */
    @Builder.Default
    @ToString.Exclude
    @OneToMany(mappedBy = "contentType", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("id ASC")
    private List<ContentTypeField> fields = new ArrayList<>();

    @Column(name = "creator_id", nullable = false, length = 100)
    private String creatorId;

    @Column(name = "inserted_at", nullable = false, updatable = false)
    private LocalDateTime insertedAt;

    @PrePersist
    protected void onCreate() {
        insertedAt = LocalDateTime.now();
    }

    public void addField(ContentTypeField field) {
        field.setContentType(this);
        fields.add(field);
    }
}
