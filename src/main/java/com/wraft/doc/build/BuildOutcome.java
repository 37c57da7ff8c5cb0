package com.wraft.doc.build;

import com.wraft.doc.model.BuildHistory;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Result of building one instance.
 *
 * @param workspace       where the artifact was written
 * @param render          renderer exit code and output, unmodified
 * @param history         the build history row recorded for this attempt
 * @param historyRotation completes once the previous artifact has been kept (or there was none);
 *                        it may still be running when the build returns
 */
public record BuildOutcome(
        BuildWorkspace workspace,
        RenderResult render,
        BuildHistory history,
        CompletableFuture<Optional<Path>> historyRotation
) {
}
