package com.wraft.doc.service.impl;

import com.wraft.doc.build.BuildOutcome;
import com.wraft.doc.exception.DocumentNotFoundException;
import com.wraft.doc.model.Asset;
import com.wraft.doc.model.ContentType;
import com.wraft.doc.model.Layout;
import com.wraft.doc.model.dto.CreateAssetRequest;
import com.wraft.doc.model.dto.CreateContentTypeRequest;
import com.wraft.doc.model.dto.CreateInstanceRequest;
import com.wraft.doc.model.dto.CreateLayoutRequest;
import com.wraft.doc.model.dto.InstanceResponse;
import com.wraft.doc.repository.BuildHistoryRepository;
import com.wraft.doc.repository.InstanceRepository;
import com.wraft.doc.service.DocumentBuildService;
import com.wraft.doc.service.DocumentCatalogService;
import com.wraft.doc.service.InstanceService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.nio.file.Files;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Builds against the test profile, whose renderer is {@code true}: it accepts
 * any arguments and exits 0 without writing a PDF.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Document build service")
class DocumentBuildServiceImplTest {

    @Autowired
    private DocumentBuildService documentBuildService;

    @Autowired
    private DocumentCatalogService catalogService;

    @Autowired
    private InstanceService instanceService;

    @Autowired
    private InstanceRepository instanceRepository;

    @Autowired
    private BuildHistoryRepository buildHistoryRepository;

    @Test
    @DisplayName("Should build an instance, write its source document and record the attempt")
    void build_shouldRenderAndRecordHistory() throws Exception {
        // Given
        InstanceResponse created = createInstance(layout("pletter"));

        // When
        BuildOutcome outcome = documentBuildService.build(created.getUuid(), "builder-1");
        outcome.historyRotation().join();

        // Then
        assertThat(outcome.render().getExitCode()).isZero();
        assertThat(outcome.history().getStatus()).isEqualTo("success");
        assertThat(outcome.history().getCreatorId()).isEqualTo("builder-1");
        assertThat(outcome.history().getDelay()).isGreaterThanOrEqualTo(0);
        assertThat(outcome.workspace().instanceCode()).isEqualTo(created.getInstanceId());

        String content = Files.readString(outcome.workspace().contentFile());
        assertThat(content).startsWith("---\ntitle: Offer\nlogo: uploads/assets/");
        assertThat(content).contains("\nqrcode: " + outcome.workspace().qrFile() + "\n");
        assertThat(content).endsWith("---\n\nDear candidate\n");
        assertThat(outcome.workspace().templateFile()).exists();
        assertThat(outcome.workspace().qrFile()).exists();

        Long instanceId = instanceRepository.findByUuid(created.getUuid()).orElseThrow().getId();
        assertThat(buildHistoryRepository.countByContentId(instanceId)).isEqualTo(1);
        assertThat(instanceService.showInstance(created.getUuid()).getDocumentUrl())
                .isEqualTo("uploads/contents/" + created.getInstanceId() + "/final.pdf");
    }

    @Test
    @DisplayName("Should record one history entry per build")
    void build_twice_shouldAppendHistory() {
        InstanceResponse created = createInstance(layout("pletter"));

        documentBuildService.build(created.getUuid(), "builder-1").historyRotation().join();
        documentBuildService.build(created.getUuid(), "builder-2").historyRotation().join();

        Long instanceId = instanceRepository.findByUuid(created.getUuid()).orElseThrow().getId();
        assertThat(buildHistoryRepository.countByContentId(instanceId)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should reject an unknown instance before touching the filesystem")
    void build_unknownInstance_shouldFail() {
        assertThrows(DocumentNotFoundException.class,
                () -> documentBuildService.build(UUID.randomUUID().toString(), "builder-1"));
    }

    @Test
    @DisplayName("Should reject a content type without a layout")
    void build_withoutLayout_shouldFail() {
        InstanceResponse created = createInstance(null);

        assertThrows(IllegalArgumentException.class, () -> documentBuildService.build(created.getUuid(), "builder-1"));
    }

    private Layout layout(String slug) {
        Asset logo = catalogService.createAsset(CreateAssetRequest.builder()
                .name("logo").file("logo.png").creatorId("user-1").build());
        return catalogService.createLayout(CreateLayoutRequest.builder()
                .name("Letter").slug(slug).assetUuids(List.of(logo.getUuid())).creatorId("user-1").build());
    }

    private InstanceResponse createInstance(Layout layout) {
        ContentType contentType = catalogService.createContentType(CreateContentTypeRequest.builder()
                .name("Offer letter")
                .prefix("B" + UUID.randomUUID().toString().substring(0, 6).toUpperCase() + "-")
                .layoutUuid(layout != null ? layout.getUuid() : null)
                .fields(List.of(new CreateContentTypeRequest.FieldDefinition("title", "String")))
                .creatorId("user-1")
                .build());
        return instanceService.createInstance("user-1", contentType.getUuid(), CreateInstanceRequest.builder()
                .creatorId("user-1")
                .raw("Dear candidate")
                .serialized(Map.of("title", "Offer"))
                .build());
    }
}
