package com.wraft.doc.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for building an instance into a PDF.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildRequest {
    private String userId;
}
