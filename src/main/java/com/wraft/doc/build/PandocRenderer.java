package com.wraft.doc.build;

import com.wraft.doc.configuration.AppProperties;
import com.wraft.doc.configuration.RendererProperties;
import com.wraft.doc.model.CallContext;
import com.wraft.doc.model.ServiceType;
import com.wraft.doc.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the typesetting tool as a child process.
 *
 * Output (stdout and stderr merged) goes to {@code render.log} in the workspace.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PandocRenderer implements DocumentRenderer {

    private static final int LOG_PREVIEW_CHARS = 2000;

    private final AppProperties appProperties;

    @Override
    public RenderResult render(BuildWorkspace workspace) {
        RendererProperties props = appProperties.getRenderer();
        List<String> command = buildCommand(props, workspace);

        CallContext call = ExternalCallLogger.startCall(ServiceType.RENDERER, "render " + workspace.instanceCode(), log);
        call.logRequest(String.join(" ", command));

        long startTime = System.currentTimeMillis();
        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.redirectErrorStream(true);
            builder.redirectOutput(workspace.renderLog().toFile());
            process = builder.start();
        } catch (IOException e) {
            call.logError("Renderer could not be started", e);
            return RenderResult.builder()
                    .exitCode(RenderResult.EXIT_NOT_STARTED)
                    .output("Renderer could not be started: " + e.getMessage())
                    .durationMs(System.currentTimeMillis() - startTime)
                    .build();
        }

        try {
            boolean finished = process.waitFor(props.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            int exitCode;
            if (finished) {
                exitCode = process.exitValue();
            } else {
                log.error("Renderer exceeded {} for {}, killing it", props.getTimeout(), workspace.instanceCode());
                process.destroyForcibly().waitFor();
                exitCode = RenderResult.EXIT_TIMED_OUT;
            }

            long durationMs = System.currentTimeMillis() - startTime;
            String output = readOutput(workspace);
            log.debug("[RENDER] {}", ExternalCallLogger.truncate(output, LOG_PREVIEW_CHARS));

            if (exitCode == 0) {
                call.logResponse("exit code 0");
            } else {
                call.logError("Renderer exited with code " + exitCode, null);
            }

            return RenderResult.builder()
                    .exitCode(exitCode)
                    .output(output)
                    .durationMs(durationMs)
                    .build();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            call.logError("Interrupted while waiting for renderer", e);

            return RenderResult.builder()
                    .exitCode(RenderResult.EXIT_TIMED_OUT)
                    .output("Interrupted while waiting for renderer")
                    .durationMs(System.currentTimeMillis() - startTime)
                    .build();
        }
    }

    List<String> buildCommand(RendererProperties props, BuildWorkspace workspace) {
        List<String> command = new ArrayList<>();
        command.add(props.getCommand());
        command.add(workspace.contentFile().toString());
        command.add("--template=" + workspace.templateFile());
        command.add("--pdf-engine=" + props.getPdfEngine());
        command.add("-o");
        command.add(workspace.finalFile().toString());
        return command;
    }

    private String readOutput(BuildWorkspace workspace) {
        try {
            return Files.readString(workspace.renderLog(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Renderer output not readable at {}: {}", workspace.renderLog(), e.getMessage());
            return "";
        }
    }
}
