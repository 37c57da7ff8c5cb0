package com.wraft.doc.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InstanceListResponse {
    private boolean success;
    private String contentTypeUuid;
    private List<InstanceResponse> contents;
    private String error;

    public static InstanceListResponse error(String errorMessage) {
        return InstanceListResponse.builder()
                .success(false)
                .error(errorMessage)
                .build();
    }
}
