package com.wraft.doc.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Build log of one instance, newest first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BuildHistoryListResponse {
    private boolean success;
    private String instanceUuid;
    private List<BuildHistoryResponse> builds;
    private String error;

    public static BuildHistoryListResponse error(String errorMessage) {
        return BuildHistoryListResponse.builder()
                .success(false)
                .error(errorMessage)
                .build();
    }
}
