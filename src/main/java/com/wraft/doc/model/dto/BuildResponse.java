package com.wraft.doc.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.wraft.doc.build.BuildOutcome;
import com.wraft.doc.build.BuildWorkspace;
import com.wraft.doc.model.BuildHistory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Result of one build request. Renderer output is returned as-is so template
 * authors can see what went wrong.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BuildResponse {
    private boolean success;
    private String instanceId;
    private Integer exitCode;
    private String status;
    private String output;
    private Long delay;
    private Instant startTime;
    private Instant endTime;
    @JsonProperty("build")
    private String documentUrl;
    private String error;

    public static BuildResponse from(BuildOutcome outcome) {
        BuildHistory history = outcome.history();
        boolean succeeded = history.isSuccessful();
        return BuildResponse.builder()
                .success(succeeded)
                .instanceId(outcome.workspace().instanceCode())
                .exitCode(history.getExitCode())
                .status(history.getStatus())
                .output(outcome.render().getOutput())
                .delay(history.getDelay())
                .startTime(history.getStartTime())
                .endTime(history.getEndTime())
                .documentUrl(succeeded ? BuildWorkspace.documentUrl(outcome.workspace().instanceCode()) : null)
                .error(succeeded ? null : "Renderer exited with code " + history.getExitCode())
                .build();
    }

    public static BuildResponse error(String errorMessage) {
        return BuildResponse.builder()
                .success(false)
                .error(errorMessage)
                .build();
    }
}
