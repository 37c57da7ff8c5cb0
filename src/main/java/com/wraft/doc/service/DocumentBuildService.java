package com.wraft.doc.service;

import com.wraft.doc.build.BuildOutcome;

/**
 * Turns an instance into a PDF.
 */
public interface DocumentBuildService {

    /**
     * Build the instance and record the attempt in its build log.
     *
     * @param instanceUuid instance to build
     * @param creatorId    user the build history is attributed to
     * @return renderer result, the recorded history and the pending history rotation
     */
    BuildOutcome build(String instanceUuid, String creatorId);
}
