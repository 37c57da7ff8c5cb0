package com.wraft.doc.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * A filesystem step of a build failed. The renderer is never invoked after this.
 */
@Getter
public class BuildWorkspaceException extends RuntimeException {

    private final Path path;

    public BuildWorkspaceException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }
}
