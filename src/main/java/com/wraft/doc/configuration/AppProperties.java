package com.wraft.doc.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    /**
     * Root of the upload tree. Instance workspaces live under {@code <uploadsDir>/contents}.
     */
    @NotBlank(message = "Uploads directory path is required")
    private String uploadsDir = "uploads";

    /**
     * Directory holding one template bundle per layout slug.
     */
    @NotBlank(message = "Slugs directory path is required")
    private String slugsDir = "lib/slugs";

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private RendererProperties renderer = new RendererProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private AssetProperties assets = new AssetProperties();

    public Path contentsRoot() {
        return Path.of(uploadsDir, "contents");
    }

    public Path slugPath(String slug) {
        return Path.of(slugsDir, slug);
    }
}
