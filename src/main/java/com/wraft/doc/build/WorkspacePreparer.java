package com.wraft.doc.build;

import com.wraft.doc.configuration.AppProperties;
import com.wraft.doc.exception.BuildWorkspaceException;
import com.wraft.doc.model.CallContext;
import com.wraft.doc.model.ServiceType;
import com.wraft.doc.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileSystemException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Creates the instance workspace and copies the layout's template bundle into it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkspacePreparer {

    private final AppProperties appProperties;

    public BuildWorkspace workspaceFor(String instanceCode) {
        return BuildWorkspace.of(appProperties.contentsRoot(), instanceCode);
    }

    /**
     * Creates the workspace directory (and parents) if missing.
     */
    public void createDirectory(BuildWorkspace workspace) {
        try {
            Files.createDirectories(workspace.root());
        } catch (IOException e) {
            throw new BuildWorkspaceException("Build directory could not be created", offendingPath(e, workspace.root()), e);
        }
    }

    /**
     * Copies every file of the slug bundle into the workspace, replacing older copies.
     */
    public void copyTemplateBundle(BuildWorkspace workspace, String slug) {
        Path bundle = appProperties.slugPath(slug);
        if (!Files.isDirectory(bundle)) {
            // The renderer reports the missing template through its exit code
            log.warn("Template bundle for slug '{}' not found at {}", slug, bundle);
            return;
        }

        CallContext call = ExternalCallLogger.startCall(ServiceType.FILESYSTEM, "copy bundle " + slug, log);
        call.logRequest(bundle + " -> " + workspace.root());
        try {
            Files.walkFileTree(bundle, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                    Files.createDirectories(workspace.root().resolve(bundle.relativize(dir).toString()));
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Path target = workspace.root().resolve(bundle.relativize(file).toString());
                    Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            call.logError("Template bundle could not be copied", e);
            throw new BuildWorkspaceException("Template bundle could not be copied", offendingPath(e, bundle), e);
        }
        call.logResponse(null);
    }

    private static Path offendingPath(IOException e, Path fallback) {
        if (e instanceof FileSystemException fse && fse.getFile() != null) {
            return Path.of(fse.getFile());
        }
        return fallback;
    }
}
