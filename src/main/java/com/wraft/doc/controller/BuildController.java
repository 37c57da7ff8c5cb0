package com.wraft.doc.controller;

import com.wraft.doc.build.BuildOutcome;
import com.wraft.doc.exception.BuildWorkspaceException;
import com.wraft.doc.exception.DocumentNotFoundException;
import com.wraft.doc.model.dto.BuildHistoryListResponse;
import com.wraft.doc.model.dto.BuildRequest;
import com.wraft.doc.model.dto.BuildResponse;
import com.wraft.doc.service.BuildHistoryService;
import com.wraft.doc.service.DocumentBuildService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for building instances and reading their build log.
 *
 * A build that runs but whose renderer exits non-zero answers 422 with the
 * renderer output in the body.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/contents")
@RequiredArgsConstructor
public class BuildController {

    private final DocumentBuildService documentBuildService;
    private final BuildHistoryService buildHistoryService;

    @PostMapping("/{uuid}/build")
    public ResponseEntity<BuildResponse> build(
            @PathVariable String uuid,
            @RequestBody BuildRequest request) {
        try {
            if (request.getUserId() == null || request.getUserId().trim().isEmpty()) {
                log.warn("Build of {} rejected - missing userId", uuid);
                return ResponseEntity.badRequest()
                        .body(BuildResponse.error("userId is required."));
            }

            BuildOutcome outcome = documentBuildService.build(uuid, request.getUserId());
            BuildResponse response = BuildResponse.from(outcome);

            return response.isSuccess()
                    ? ResponseEntity.ok(response)
                    : ResponseEntity.unprocessableEntity().body(response);

        } catch (DocumentNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(BuildResponse.error(e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(BuildResponse.error(e.getMessage()));
        } catch (BuildWorkspaceException e) {
            log.error("Build workspace failure for {} at {}", uuid, e.getPath(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(BuildResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to build instance {}", uuid, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(BuildResponse.error(e.getMessage()));
        }
    }

    @GetMapping("/{uuid}/builds")
    public ResponseEntity<BuildHistoryListResponse> listBuilds(@PathVariable String uuid) {
        try {
            return ResponseEntity.ok(BuildHistoryListResponse.builder()
                    .success(true)
                    .instanceUuid(uuid)
                    .builds(buildHistoryService.listForInstance(uuid))
                    .build());

        } catch (DocumentNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(BuildHistoryListResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to list builds of {}", uuid, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(BuildHistoryListResponse.error(e.getMessage()));
        }
    }
}
