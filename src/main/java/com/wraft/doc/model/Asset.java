package com.wraft.doc.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Named file resource (a logo, a signature) referenced from layouts.
 */
@Entity
@Table(name = "assets", indexes = {
        @Index(name = "idx_asset_uuid", columnList = "uuid", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Asset {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "uuid", nullable = false, unique = true, length = 36, updatable = false)
    private String uuid;

    /**
     * Header key the asset URL is published under.
     */
    @Column(name = "name", nullable = false, length = 100)
    private String name;

    /**
     * Stored file name, relative to the asset's storage directory.
     */
    @Column(name = "file_name", length = 500)
    private String file;

    @Column(name = "creator_id", nullable = false, length = 100)
    private String creatorId;

    @Column(name = "inserted_at", nullable = false, updatable = false)
    private LocalDateTime insertedAt;

    @PrePersist
    protected void onCreate() {
        insertedAt = LocalDateTime.now();
    }
}
