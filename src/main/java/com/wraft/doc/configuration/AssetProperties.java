package com.wraft.doc.configuration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

@Data
public class AssetProperties {

    /**
     * Public path under which stored asset files are served.
     */
    @NotBlank
    private String urlPrefix = "/uploads/assets";

    @NotBlank(message = "Asset signing secret is required")
    private String signingSecret;

    @NotNull
    private Duration urlTtl = Duration.ofHours(1);
}
