package com.wraft.doc.service.impl;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.wraft.doc.build.BuildOutcome;
import com.wraft.doc.build.BuildSource;
import com.wraft.doc.build.DocumentBuildPipeline;
import com.wraft.doc.exception.DocumentNotFoundException;
import com.wraft.doc.model.BuildHistory;
import com.wraft.doc.model.ContentType;
import com.wraft.doc.model.ContentTypeField;
import com.wraft.doc.model.Instance;
import com.wraft.doc.model.Layout;
import com.wraft.doc.repository.InstanceRepository;
import com.wraft.doc.service.BuildHistoryParams;
import com.wraft.doc.service.BuildHistoryService;
import com.wraft.doc.service.DocumentBuildService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Loads what a build needs, hands it to the pipeline and records the attempt.
 *
 * No transaction is held while the renderer runs.
 */
@Slf4j
@Service
public class DocumentBuildServiceImpl implements DocumentBuildService {

    private final InstanceRepository instanceRepository;
    private final BuildHistoryService buildHistoryService;
    private final DocumentBuildPipeline pipeline;
    private final TransactionTemplate readOnlyTransaction;
    private final Clock clock;

    public DocumentBuildServiceImpl(InstanceRepository instanceRepository,
                                    BuildHistoryService buildHistoryService,
                                    DocumentBuildPipeline pipeline,
                                    PlatformTransactionManager transactionManager,
                                    Clock clock) {
        this.instanceRepository = instanceRepository;
        this.buildHistoryService = buildHistoryService;
        this.pipeline = pipeline;
        this.readOnlyTransaction = new TransactionTemplate(transactionManager);
        this.readOnlyTransaction.setReadOnly(true);
        this.clock = clock;
    }

    private record Loaded(Instance instance, BuildSource source) {
    }

    @Override
    public BuildOutcome build(String instanceUuid, String creatorId) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(creatorId), "User is required to build a document");

        Loaded loaded = readOnlyTransaction.execute(status -> load(instanceUuid));
        BuildSource source = loaded.source();
        log.info("Building {} ({}) with layout '{}'", source.instanceCode(), instanceUuid, source.layoutSlug());

        Instant start = clock.instant();
        DocumentBuildPipeline.Run run = pipeline.run(source);
        Instant end = clock.instant();

        BuildHistory history = buildHistoryService.addBuildHistory(
                creatorId, loaded.instance(), new BuildHistoryParams(start, end, run.render().getExitCode()));

        if (!history.isSuccessful()) {
            log.warn("Build of {} failed with exit code {}", source.instanceCode(), history.getExitCode());
        }

        return new BuildOutcome(run.workspace(), run.render(), history, run.historyRotation());
    }

    private Loaded load(String instanceUuid) {
        Instance instance = instanceRepository.findByUuid(instanceUuid)
                .orElseThrow(() -> new DocumentNotFoundException("Instance", instanceUuid));

        ContentType contentType = instance.getContentType();
        Layout layout = contentType.getLayout();
        if (layout == null) {
            throw new IllegalArgumentException("Content type " + contentType.getName() + " has no layout to build with");
        }

        List<String> fieldNames = contentType.getFields().stream()
                .map(ContentTypeField::getName)
                .toList();
        List<BuildSource.AssetRef> assets = layout.getAssets().stream()
                .map(asset -> new BuildSource.AssetRef(asset.getUuid(), asset.getName(), asset.getFile()))
                .toList();

        BuildSource source = new BuildSource(
                instance.getUuid(),
                instance.getInstanceId(),
                new LinkedHashMap<>(instance.getSerialized()),
                instance.getRaw(),
                fieldNames,
                layout.getSlug(),
                assets);
        return new Loaded(instance, source);
    }
}
