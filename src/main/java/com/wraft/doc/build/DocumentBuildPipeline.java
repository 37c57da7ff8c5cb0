package com.wraft.doc.build;

import com.google.common.util.concurrent.Striped;
import com.wraft.doc.exception.BuildWorkspaceException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.Lock;

/**
 * File side of a build: workspace, template bundle, QR code, history rotation,
 * source document and renderer run.
 *
 * <p>Bundle copy and QR generation run side by side on the build executor and are
 * both joined before the header is written. History rotation is submitted to the
 * same executor and not joined; the next build of the same instance waits for it.
 *
 * <p>Builds of one instance are serialized from directory preparation until the
 * renderer exits.
 */
@Slf4j
@Component
public class DocumentBuildPipeline {

    private final WorkspacePreparer workspacePreparer;
    private final QrCodeGenerator qrCodeGenerator;
    private final VersionHistoryRotator historyRotator;
    private final HeaderAssembler headerAssembler;
    private final DocumentRenderer renderer;
    private final Executor buildExecutor;
    private final Striped<Lock> buildLocks;

    private final Map<String, CompletableFuture<Optional<Path>>> pendingRotations = new ConcurrentHashMap<>();

    public DocumentBuildPipeline(WorkspacePreparer workspacePreparer,
                                 QrCodeGenerator qrCodeGenerator,
                                 VersionHistoryRotator historyRotator,
                                 HeaderAssembler headerAssembler,
                                 DocumentRenderer renderer,
                                 @Qualifier("buildExecutor") Executor buildExecutor,
                                 @Qualifier("buildLocks") Striped<Lock> buildLocks) {
        this.workspacePreparer = workspacePreparer;
        this.qrCodeGenerator = qrCodeGenerator;
        this.historyRotator = historyRotator;
        this.headerAssembler = headerAssembler;
        this.renderer = renderer;
        this.buildExecutor = buildExecutor;
        this.buildLocks = buildLocks;
    }

    public record Run(BuildWorkspace workspace, RenderResult render, CompletableFuture<Optional<Path>> historyRotation) {
    }

    /**
     * @throws BuildWorkspaceException when a filesystem step fails; the renderer is not run
     */
    public Run run(BuildSource source) {
        String code = source.instanceCode();
        BuildWorkspace workspace = workspacePreparer.workspaceFor(code);

        Lock lock = buildLocks.get(code);
        lock.lock();
        try (MDC.MDCCloseable ignored = MDC.putCloseable("instance", code)) {
            awaitPreviousRotation(code);

            workspacePreparer.createDirectory(workspace);

            CompletableFuture<Void> bundle = CompletableFuture.runAsync(
                    () -> workspacePreparer.copyTemplateBundle(workspace, source.layoutSlug()), buildExecutor);
            CompletableFuture<Path> qrCode = CompletableFuture.supplyAsync(
                    () -> qrCodeGenerator.generate(source.instanceUuid(), workspace), buildExecutor);
            CompletableFuture<Optional<Path>> rotation = submitRotation(workspace);

            Path qrPath = joinPreparation(bundle, qrCode);

            String header = headerAssembler.assemble(
                    source.fieldNames(), source.serialized(), source.assets(), qrPath, workspace);
            writeSourceDocument(workspace, headerAssembler.document(header, source.raw()));

            RenderResult render = renderer.render(workspace);
            log.info("Rendered {} with exit code {} in {}ms", code, render.getExitCode(), render.getDurationMs());

            return new Run(workspace, render, rotation);
        } finally {
            lock.unlock();
        }
    }

    private CompletableFuture<Optional<Path>> submitRotation(BuildWorkspace workspace) {
        String code = workspace.instanceCode();
        CompletableFuture<Optional<Path>> rotation = CompletableFuture
                .supplyAsync(() -> historyRotator.rotate(workspace), buildExecutor)
                .handle((kept, ex) -> {
                    if (ex != null) {
                        log.error("History rotation failed for {}", code, unwrap(ex));
                        return Optional.<Path>empty();
                    }
                    return kept;
                });

        pendingRotations.put(code, rotation);
        rotation.whenComplete((kept, ex) -> pendingRotations.remove(code, rotation));
        return rotation;
    }

    private void awaitPreviousRotation(String code) {
        CompletableFuture<Optional<Path>> previous = pendingRotations.get(code);
        if (previous != null && !previous.isDone()) {
            log.debug("Waiting for previous history rotation of {}", code);
            previous.join();
        }
    }

    private Path joinPreparation(CompletableFuture<Void> bundle, CompletableFuture<Path> qrCode) {
        try {
            CompletableFuture.allOf(bundle, qrCode).join();
            return qrCode.join();
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Build preparation failed", cause);
        }
    }

    private void writeSourceDocument(BuildWorkspace workspace, String content) {
        try {
            Files.writeString(workspace.contentFile(), content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new BuildWorkspaceException("Source document could not be written", workspace.contentFile(), e);
        }
    }

    private static Throwable unwrap(Throwable ex) {
        return ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
    }
}
