package com.wraft.doc.model.dto;

import com.wraft.doc.model.BuildHistory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildHistoryResponse {
    private Long id;
    private String creatorId;
    private Instant startTime;
    private Instant endTime;
    private long delay;
    private int exitCode;
    private String status;
    private LocalDateTime insertedAt;

    public static BuildHistoryResponse from(BuildHistory history) {
        return BuildHistoryResponse.builder()
                .id(history.getId())
                .creatorId(history.getCreatorId())
                .startTime(history.getStartTime())
                .endTime(history.getEndTime())
                .delay(history.getDelay())
                .exitCode(history.getExitCode())
                .status(history.getStatus())
                .insertedAt(history.getInsertedAt())
                .build();
    }
}
