package com.wraft.doc.service.impl;

import com.wraft.doc.model.BuildHistory;
import com.wraft.doc.model.ContentType;
import com.wraft.doc.model.Instance;
import com.wraft.doc.model.dto.BuildHistoryResponse;
import com.wraft.doc.model.dto.CreateContentTypeRequest;
import com.wraft.doc.model.dto.CreateInstanceRequest;
import com.wraft.doc.model.dto.InstanceResponse;
import com.wraft.doc.repository.InstanceRepository;
import com.wraft.doc.service.BuildHistoryParams;
import com.wraft.doc.service.BuildHistoryService;
import com.wraft.doc.service.DocumentCatalogService;
import com.wraft.doc.service.InstanceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Build history recording")
class BuildHistoryServiceImplTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired
    private BuildHistoryService buildHistoryService;

    @Autowired
    private InstanceService instanceService;

    @Autowired
    private DocumentCatalogService catalogService;

    @Autowired
    private InstanceRepository instanceRepository;

    private Instance instance;

    @BeforeEach
    void setUp() {
        String prefix = "H" + UUID.randomUUID().toString().substring(0, 6).toUpperCase() + "-";
        ContentType contentType = catalogService.createContentType(CreateContentTypeRequest.builder()
                .name("Report")
                .prefix(prefix)
                .creatorId("user-1")
                .build());
        InstanceResponse created = instanceService.createInstance("user-1", contentType.getUuid(),
                CreateInstanceRequest.builder().creatorId("user-1").raw("body").build());
        instance = instanceRepository.findByUuid(created.getUuid()).orElseThrow();
    }

    @Test
    @DisplayName("Should derive delay from start and end time")
    void addBuildHistory_shouldComputeDelay() {
        // When
        BuildHistory history = buildHistoryService.addBuildHistory("user-1", instance,
                new BuildHistoryParams(START, START.plusMillis(2_500), 0));

        // Then
        assertThat(history.getId()).isNotNull();
        assertThat(history.getDelay()).isEqualTo(2_500);
        assertThat(history.getStartTime()).isEqualTo(START);
        assertThat(history.getEndTime()).isEqualTo(START.plusMillis(2_500));
        assertThat(history.getCreatorId()).isEqualTo("user-1");
        assertThat(history.getStatus()).isEqualTo(BuildHistory.STATUS_SUCCESS);
    }

    @Test
    @DisplayName("Should mark exit code 0 as success and anything else as failed")
    void addBuildHistory_shouldDeriveStatus() {
        BuildHistory ok = buildHistoryService.addBuildHistory("user-1", instance, new BuildHistoryParams(START, START, 0));
        BuildHistory failed = buildHistoryService.addBuildHistory("user-1", instance, new BuildHistoryParams(START, START, 43));
        BuildHistory timedOut = buildHistoryService.addBuildHistory("user-1", instance, new BuildHistoryParams(START, START, 124));

        assertThat(ok.getStatus()).isEqualTo(BuildHistory.STATUS_SUCCESS);
        assertThat(failed.getStatus()).isEqualTo(BuildHistory.STATUS_FAILED);
        assertThat(failed.getExitCode()).isEqualTo(43);
        assertThat(timedOut.getStatus()).isEqualTo(BuildHistory.STATUS_FAILED);
    }

    @Test
    @DisplayName("Should find the most recent successful build")
    void latestSuccessful_shouldIgnoreFailures() {
        buildHistoryService.addBuildHistory("user-1", instance, new BuildHistoryParams(START, START.plusSeconds(1), 0));
        BuildHistory latestOk = buildHistoryService.addBuildHistory("user-1", instance,
                new BuildHistoryParams(START.plusSeconds(10), START.plusSeconds(12), 0));
        buildHistoryService.addBuildHistory("user-1", instance,
                new BuildHistoryParams(START.plusSeconds(20), START.plusSeconds(21), 1));

        assertThat(buildHistoryService.latestSuccessful(instance))
                .map(BuildHistory::getId)
                .contains(latestOk.getId());
    }

    @Test
    @DisplayName("Should list builds newest first")
    void listForInstance_shouldReturnNewestFirst() {
        BuildHistory first = buildHistoryService.addBuildHistory("user-1", instance, new BuildHistoryParams(START, START, 1));
        BuildHistory second = buildHistoryService.addBuildHistory("user-2", instance, new BuildHistoryParams(START, START, 0));

        List<BuildHistoryResponse> listed = buildHistoryService.listForInstance(instance.getUuid());

        assertThat(listed).extracting(BuildHistoryResponse::getId).containsExactly(second.getId(), first.getId());
        assertThat(listed.get(0).getCreatorId()).isEqualTo("user-2");
    }

    @Test
    @DisplayName("Should propagate a failed insert")
    void addBuildHistory_unknownInstance_shouldPropagateFailure() {
        // Given: an instance that was never stored
        Instance missing = Instance.builder().id(Long.MAX_VALUE).instanceId("GONE0001").build();

        // When / Then
        assertThrows(DataIntegrityViolationException.class,
                () -> buildHistoryService.addBuildHistory("user-1", missing, new BuildHistoryParams(START, START, 0)));
    }
}
