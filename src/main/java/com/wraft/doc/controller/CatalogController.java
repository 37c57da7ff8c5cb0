package com.wraft.doc.controller;

import com.wraft.doc.exception.DocumentNotFoundException;
import com.wraft.doc.model.Asset;
import com.wraft.doc.model.ContentType;
import com.wraft.doc.model.Layout;
import com.wraft.doc.model.State;
import com.wraft.doc.model.dto.CatalogResponse;
import com.wraft.doc.model.dto.CreateAssetRequest;
import com.wraft.doc.model.dto.CreateContentTypeRequest;
import com.wraft.doc.model.dto.CreateLayoutRequest;
import com.wraft.doc.model.dto.CreateStateRequest;
import com.wraft.doc.service.DocumentCatalogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.function.Supplier;

/**
 * Setup endpoints for the records instances are built from.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class CatalogController {

    private final DocumentCatalogService catalogService;

    @PostMapping("/assets")
    public ResponseEntity<CatalogResponse> createAsset(@RequestBody CreateAssetRequest request) {
        return create("asset", () -> {
            Asset asset = catalogService.createAsset(request);
            return CatalogResponse.created("asset", asset.getUuid(), asset.getName());
        });
    }

    @PostMapping("/layouts")
    public ResponseEntity<CatalogResponse> createLayout(@RequestBody CreateLayoutRequest request) {
        return create("layout", () -> {
            Layout layout = catalogService.createLayout(request);
            return CatalogResponse.created("layout", layout.getUuid(), layout.getName());
        });
    }

    @PostMapping("/content-types")
    public ResponseEntity<CatalogResponse> createContentType(@RequestBody CreateContentTypeRequest request) {
        return create("content type", () -> {
            ContentType contentType = catalogService.createContentType(request);
            return CatalogResponse.created("content_type", contentType.getUuid(), contentType.getName());
        });
    }

    @PostMapping("/states")
    public ResponseEntity<CatalogResponse> createState(@RequestBody CreateStateRequest request) {
        return create("state", () -> {
            State state = catalogService.createState(request);
            return CatalogResponse.created("state", state.getUuid(), state.getState());
        });
    }

    private ResponseEntity<CatalogResponse> create(String kind, Supplier<CatalogResponse> action) {
        try {
            return ResponseEntity.status(HttpStatus.CREATED).body(action.get());

        } catch (DocumentNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(CatalogResponse.error(e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(CatalogResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to create {}", kind, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(CatalogResponse.error(e.getMessage()));
        }
    }
}
