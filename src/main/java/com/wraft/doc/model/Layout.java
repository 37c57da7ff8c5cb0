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
 * Template bundle used to render instances.
 *
 * The {@code slug} names the bundle directory on disk; its files are copied into
 * every build workspace.
 */
@Entity
@Table(name = "layouts", indexes = {
        @Index(name = "idx_layout_uuid", columnList = "uuid", unique = true)
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Layout {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "uuid", nullable = false, unique = true, length = 36, updatable = false)
    private String uuid;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "slug", nullable = false, length = 100)
    private String slug;

    @Column(name = "description", length = 1000)
    private String description;

    /**
     * Assets in association order.
     */
    @Builder.Default
    @ToString.Exclude
    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(name = "layout_assets",
            joinColumns = @JoinColumn(name = "layout_id"),
            inverseJoinColumns = @JoinColumn(name = "asset_id"))
    @OrderColumn(name = "position")
    private List<Asset> assets = new ArrayList<>();

    @Column(name = "creator_id", nullable = false, length = 100)
    private String creatorId;

    @Column(name = "inserted_at", nullable = false, updatable = false)
    private LocalDateTime insertedAt;

    @PrePersist
    protected void onCreate() {
        insertedAt = LocalDateTime.now();
    }
}
