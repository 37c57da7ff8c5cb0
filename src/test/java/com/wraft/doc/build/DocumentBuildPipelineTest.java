package com.wraft.doc.build;

import com.google.common.util.concurrent.Striped;
import com.wraft.doc.configuration.AppProperties;
import com.wraft.doc.exception.BuildWorkspaceException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Document build pipeline")
class DocumentBuildPipelineTest {

    @TempDir
    Path tempDir;

    private ExecutorService executor;
    private AppProperties appProperties;
    private AtomicInteger renderCalls;
    private int nextExitCode;

    @BeforeEach
    void setUp() throws IOException {
        executor = Executors.newFixedThreadPool(4);
        appProperties = new AppProperties();
        appProperties.setUploadsDir(tempDir.resolve("uploads").toString());
        appProperties.setSlugsDir(tempDir.resolve("slugs").toString());
        renderCalls = new AtomicInteger();
        nextExitCode = 0;

        Files.createDirectories(tempDir.resolve("slugs/pletter"));
        Files.writeString(tempDir.resolve("slugs/pletter/template.tex"), "$body$");
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdown();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("Should prepare the workspace, write the source document and render it")
    void run_shouldProduceSourceDocumentAndRender() throws IOException {
        // Given
        DocumentBuildPipeline pipeline = pipeline();

        // When
        DocumentBuildPipeline.Run run = pipeline.run(source("OFF0001", "Dear reader"));

        // Then
        BuildWorkspace workspace = run.workspace();
        assertThat(run.render().getExitCode()).isZero();
        assertThat(renderCalls).hasValue(1);
        assertThat(workspace.templateFile()).exists();
        assertThat(workspace.qrFile()).exists();

        String content = Files.readString(workspace.contentFile());
        assertThat(content).startsWith("---\ntitle: Offer\nlogo: uploads/assets/a1/logo.png\n");
        assertThat(content).contains("qrcode: " + workspace.qrFile() + "\n");
        assertThat(content).contains("path: " + workspace.root() + "\n");
        assertThat(content).endsWith("---\n\nDear reader\n");
    }

    @Test
    @DisplayName("Should pass the renderer exit code through unchanged")
    void run_failingRenderer_shouldReportExitCode() {
        nextExitCode = 43;

        DocumentBuildPipeline.Run run = pipeline().run(source("OFF0002", "body"));

        assertThat(run.render().getExitCode()).isEqualTo(43);
        assertThat(run.render().isSuccess()).isFalse();
    }

    @Test
    @DisplayName("Should keep the previous artifact in history")
    void run_withPreviousArtifact_shouldRotateIt() throws IOException {
        // Given
        DocumentBuildPipeline pipeline = pipeline();
        BuildWorkspace workspace = BuildWorkspace.of(appProperties.contentsRoot(), "OFF0003");
        Files.createDirectories(workspace.root());
        Files.writeString(workspace.finalFile(), "previous");

        // When
        DocumentBuildPipeline.Run run = pipeline.run(source("OFF0003", "next"));
        Optional<Path> kept = run.historyRotation().join();

        // Then
        assertThat(kept).contains(workspace.historyDir().resolve("final-v1.pdf"));
        assertThat(kept.get()).exists();
    }

    @Test
    @DisplayName("Should abort before rendering when the workspace cannot be created")
    void run_workspaceFailure_shouldNotRender() throws IOException {
        // Given: the contents root is a regular file
        Files.createDirectories(tempDir.resolve("uploads"));
        Files.writeString(tempDir.resolve("uploads/contents"), "blocked");

        // When / Then
        assertThrows(BuildWorkspaceException.class, () -> pipeline().run(source("OFF0004", "body")));
        assertThat(renderCalls).hasValue(0);
    }

    @Test
    @DisplayName("Should run concurrent builds of the same instance one after another")
    void run_sameInstanceConcurrently_shouldNotOverlap() throws Exception {
        // Given: the first render blocks until released
        List<String> events = new CopyOnWriteArrayList<>();
        CountDownLatch rendering = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        DocumentBuildPipeline pipeline = pipeline(recordingPreparer(events), new VersionHistoryRotator(), workspace -> {
            events.add("render-start");
            rendering.countDown();
            await(release);
            RenderResult result = fakeRender(workspace);
            events.add("render-end");
            return result;
        });
        ExecutorService callers = Executors.newFixedThreadPool(2);

        // When
        Future<DocumentBuildPipeline.Run> first = callers.submit(() -> pipeline.run(source("OFF0010", "first")));
        Future<DocumentBuildPipeline.Run> second = callers.submit(() -> pipeline.run(source("OFF0010", "second")));
        assertThat(rendering.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(200);
        List<String> whileRendering = List.copyOf(events);
        release.countDown();
        first.get(10, TimeUnit.SECONDS);
        second.get(10, TimeUnit.SECONDS);
        callers.shutdown();

        // Then
        assertThat(whileRendering).containsExactly("prepare", "render-start");
        assertThat(events).containsExactly(
                "prepare", "render-start", "render-end",
                "prepare", "render-start", "render-end");
        assertThat(renderCalls).hasValue(2);
    }

    @Test
    @DisplayName("Should finish the previous history rotation before preparing the next build")
    void run_slowRotation_shouldFinishBeforeNextBuildPrepares() throws Exception {
        // Given: rotations block until released
        List<String> events = new CopyOnWriteArrayList<>();
        CountDownLatch rotating = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        VersionHistoryRotator slowRotator = new VersionHistoryRotator() {
            @Override
            public Optional<Path> rotate(BuildWorkspace workspace) {
                events.add("rotate-start");
                rotating.countDown();
                await(release);
                Optional<Path> kept = super.rotate(workspace);
                events.add("rotate-end");
                return kept;
            }
        };
        DocumentBuildPipeline pipeline = pipeline(recordingPreparer(events), slowRotator, this::fakeRender);

        // When: the first build returns while its rotation is still running
        DocumentBuildPipeline.Run first = pipeline.run(source("OFF0011", "first"));
        assertThat(rotating.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(first.historyRotation()).isNotDone();

        ExecutorService callers = Executors.newSingleThreadExecutor();
        Future<DocumentBuildPipeline.Run> second = callers.submit(() -> pipeline.run(source("OFF0011", "second")));
        Thread.sleep(200);
        List<String> whileRotating = List.copyOf(events);
        release.countDown();
        second.get(10, TimeUnit.SECONDS);
        callers.shutdown();

        // Then
        assertThat(whileRotating).containsExactly("prepare", "rotate-start");
        assertThat(events).filteredOn("prepare"::equals).hasSize(2);
        assertThat(events.indexOf("rotate-end")).isLessThan(events.lastIndexOf("prepare"));
        assertThat(renderCalls).hasValue(2);
    }

    private DocumentBuildPipeline pipeline() {
        return pipeline(new WorkspacePreparer(appProperties), new VersionHistoryRotator(), this::fakeRender);
    }

    private DocumentBuildPipeline pipeline(WorkspacePreparer preparer, VersionHistoryRotator rotator, DocumentRenderer renderer) {
        return new DocumentBuildPipeline(
                preparer,
                new QrCodeGenerator(),
                rotator,
                new HeaderAssembler(asset -> "/uploads/assets/" + asset.uuid() + "/" + asset.file()),
                renderer,
                executor,
                Striped.lock(4));
    }

    private WorkspacePreparer recordingPreparer(List<String> events) {
        return new WorkspacePreparer(appProperties) {
            @Override
            public void createDirectory(BuildWorkspace workspace) {
                events.add("prepare");
                super.createDirectory(workspace);
            }
        };
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Latch was not released in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private RenderResult fakeRender(BuildWorkspace workspace) {
        renderCalls.incrementAndGet();
        try {
            Files.writeString(workspace.finalFile(), Files.readString(workspace.contentFile()));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return RenderResult.builder().exitCode(nextExitCode).output("").durationMs(1).build();
    }

    private static BuildSource source(String code, String raw) {
        return new BuildSource(
                "uuid-" + code,
                code,
                Map.of("title", "Offer"),
                raw,
                List.of("title", "date"),
                "pletter",
                List.of(new BuildSource.AssetRef("a1", "logo", "logo.png")));
    }
}
