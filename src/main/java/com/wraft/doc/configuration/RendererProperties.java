package com.wraft.doc.configuration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

@Data
public class RendererProperties {

    /**
     * Executable of the typesetting tool.
     */
    @NotBlank
    private String command = "pandoc";

    @NotBlank
    private String pdfEngine = "xelatex";

    /**
     * Upper bound for one renderer run. The process is killed when it is exceeded.
     */
    @NotNull
    private Duration timeout = Duration.ofMinutes(5);
}
