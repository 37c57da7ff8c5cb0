package com.wraft.doc.build;

import java.nio.file.Path;

/**
 * Working directory of one instance's builds, {@code <uploads>/contents/<instance code>/}.
 *
 * Every stage receives this value instead of deriving paths from the instance code itself.
 */
public record BuildWorkspace(String instanceCode, Path root) {

    public static final String CONTENT_FILE = "content.md";
    public static final String TEMPLATE_FILE = "template.tex";
    public static final String FINAL_FILE = "final.pdf";
    public static final String QR_FILE = "qr.png";
    public static final String HISTORY_DIR = "history";
    public static final String RENDER_LOG = "render.log";

    public static BuildWorkspace of(Path contentsRoot, String instanceCode) {
        return new BuildWorkspace(instanceCode, contentsRoot.resolve(instanceCode));
    }

    public Path contentFile() {
        return root.resolve(CONTENT_FILE);
    }

    public Path templateFile() {
        return root.resolve(TEMPLATE_FILE);
    }

    public Path finalFile() {
        return root.resolve(FINAL_FILE);
    }

    public Path qrFile() {
        return root.resolve(QR_FILE);
    }

    public Path historyDir() {
        return root.resolve(HISTORY_DIR);
    }

    public Path renderLog() {
        return root.resolve(RENDER_LOG);
    }

    /**
     * Public location of the latest artifact, independent of where uploads live on disk.
     */
    public static String documentUrl(String instanceCode) {
        return "uploads/contents/" + instanceCode + "/" + FINAL_FILE;
    }
}
