package com.wraft.doc.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for creating an instance of a content type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateInstanceRequest {
    private String creatorId;
    private String raw;
    private Map<String, String> serialized;
    private String stateUuid;
}
