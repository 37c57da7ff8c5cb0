package com.wraft.doc.service;

import com.wraft.doc.model.BuildHistory;
import com.wraft.doc.model.Instance;
import com.wraft.doc.model.dto.BuildHistoryResponse;

import java.util.List;
import java.util.Optional;

/**
 * Append-only build log.
 */
public interface BuildHistoryService {

    /**
     * Record one build attempt. Delay and status are derived from the params.
     * Persistence failures are not caught.
     */
    BuildHistory addBuildHistory(String creatorId, Instance instance, BuildHistoryParams params);

    /**
     * Most recent build of the instance that exited with code 0.
     */
    Optional<BuildHistory> latestSuccessful(Instance instance);

    /**
     * All builds of an instance, newest first.
     */
    List<BuildHistoryResponse> listForInstance(String instanceUuid);
}
