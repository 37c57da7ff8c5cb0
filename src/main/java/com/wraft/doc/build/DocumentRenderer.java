package com.wraft.doc.build;

public interface DocumentRenderer {
    /**
     * Typesets {@code content.md} of the workspace into {@code final.pdf}.
     *
     * Never throws for renderer failures; they are reported through the exit code.
     *
     * @param workspace directory holding content.md and the template bundle
     * @return exit code and captured output of the renderer
     */
    RenderResult render(BuildWorkspace workspace);
}
