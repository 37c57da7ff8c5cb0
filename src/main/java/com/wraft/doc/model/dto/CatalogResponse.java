package com.wraft.doc.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Answer to the catalog setup endpoints: what was created and under which uuid.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CatalogResponse {
    private boolean success;
    private String kind;
    private String uuid;
    private String name;
    private String error;

    public static CatalogResponse created(String kind, String uuid, String name) {
        return CatalogResponse.builder()
                .success(true)
                .kind(kind)
                .uuid(uuid)
                .name(name)
                .build();
    }

    public static CatalogResponse error(String errorMessage) {
        return CatalogResponse.builder()
                .success(false)
                .error(errorMessage)
                .build();
    }
}
