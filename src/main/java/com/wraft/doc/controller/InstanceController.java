package com.wraft.doc.controller;

import com.wraft.doc.exception.DocumentNotFoundException;
import com.wraft.doc.model.dto.CreateInstanceRequest;
import com.wraft.doc.model.dto.InstanceListResponse;
import com.wraft.doc.model.dto.InstanceResponse;
import com.wraft.doc.model.dto.UpdateInstanceRequest;
import com.wraft.doc.service.InstanceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for content instances.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class InstanceController {

    private final InstanceService instanceService;

    @PostMapping("/content-types/{contentTypeUuid}/contents")
    public ResponseEntity<InstanceResponse> createInstance(
            @PathVariable String contentTypeUuid,
            @RequestBody CreateInstanceRequest request) {
        try {
            if (request.getCreatorId() == null || request.getCreatorId().trim().isEmpty()) {
                log.warn("Instance creation rejected - missing creatorId");
                return ResponseEntity.badRequest()
                        .body(InstanceResponse.error("creatorId is required."));
            }

            InstanceResponse created = instanceService.createInstance(request.getCreatorId(), contentTypeUuid, request);
            return ResponseEntity.status(HttpStatus.CREATED).body(created);

        } catch (DocumentNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(InstanceResponse.error(e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(InstanceResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to create instance of content type {}", contentTypeUuid, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(InstanceResponse.error(e.getMessage()));
        }
    }

    @GetMapping("/content-types/{contentTypeUuid}/contents")
    public ResponseEntity<InstanceListResponse> listInstances(@PathVariable String contentTypeUuid) {
        try {
            List<InstanceResponse> contents = instanceService.listInstances(contentTypeUuid);
            return ResponseEntity.ok(InstanceListResponse.builder()
                    .success(true)
                    .contentTypeUuid(contentTypeUuid)
                    .contents(contents)
                    .build());

        } catch (DocumentNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(InstanceListResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to list instances of content type {}", contentTypeUuid, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(InstanceListResponse.error(e.getMessage()));
        }
    }

    @GetMapping("/contents/{uuid}")
    public ResponseEntity<InstanceResponse> showInstance(@PathVariable String uuid) {
        try {
            return ResponseEntity.ok(instanceService.showInstance(uuid));

        } catch (DocumentNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(InstanceResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to load instance {}", uuid, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(InstanceResponse.error(e.getMessage()));
        }
    }

    @PutMapping("/contents/{uuid}")
    public ResponseEntity<InstanceResponse> updateInstance(
            @PathVariable String uuid,
            @RequestBody UpdateInstanceRequest request) {
        try {
            return ResponseEntity.ok(instanceService.updateInstance(uuid, request));

        } catch (DocumentNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(InstanceResponse.error(e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(InstanceResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to update instance {}", uuid, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(InstanceResponse.error(e.getMessage()));
        }
    }

    @DeleteMapping("/contents/{uuid}")
    public ResponseEntity<InstanceResponse> deleteInstance(@PathVariable String uuid) {
        try {
            instanceService.deleteInstance(uuid);
            return ResponseEntity.noContent().build();

        } catch (DocumentNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(InstanceResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to delete instance {}", uuid, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(InstanceResponse.error(e.getMessage()));
        }
    }
}
