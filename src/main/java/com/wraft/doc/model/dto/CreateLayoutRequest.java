package com.wraft.doc.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * {@code assetUuids} are associated in the given order; that order is kept in the document header.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateLayoutRequest {
    private String name;
    private String slug;
    private String description;
    private List<String> assetUuids;
    private String creatorId;
}
