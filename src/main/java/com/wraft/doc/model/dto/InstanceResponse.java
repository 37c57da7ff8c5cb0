package com.wraft.doc.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.wraft.doc.model.Instance;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Instance view. {@code build} is only present once a build has succeeded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InstanceResponse {
    private boolean success;
    private String uuid;
    private String instanceId;
    private String contentTypeUuid;
    private String state;
    private String raw;
    private Map<String, String> serialized;
    private String creatorId;
    @JsonProperty("build")
    private String documentUrl;
    private LocalDateTime insertedAt;
    private LocalDateTime updatedAt;
    private String error;

    /**
     * Must be called while the instance's associations can still be loaded.
     */
    public static InstanceResponse from(Instance instance, String buildUrl) {
        return InstanceResponse.builder()
                .success(true)
                .uuid(instance.getUuid())
                .instanceId(instance.getInstanceId())
                .contentTypeUuid(instance.getContentType().getUuid())
                .state(instance.getState() != null ? instance.getState().getState() : null)
                .raw(instance.getRaw())
                .serialized(new LinkedHashMap<>(instance.getSerialized()))
                .creatorId(instance.getCreatorId())
                .documentUrl(buildUrl)
                .insertedAt(instance.getInsertedAt())
                .updatedAt(instance.getUpdatedAt())
                .build();
    }

    public static InstanceResponse error(String errorMessage) {
        return InstanceResponse.builder()
                .success(false)
                .error(errorMessage)
                .build();
    }
}
