package com.wraft.doc.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for declaring a content type with its fields.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateContentTypeRequest {
    private String name;
    private String description;
    private String prefix;
    private String color;
    private String layoutUuid;
    private List<FieldDefinition> fields;
    private String creatorId;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FieldDefinition {
        private String name;
        private String fieldType;
    }
}
