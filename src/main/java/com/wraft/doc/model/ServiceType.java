package com.wraft.doc.model;

/**
 * External collaborators of a build, for uniform call logging.
 *
 * @see com.wraft.doc.util.ExternalCallLogger
 */
public enum ServiceType {
    RENDERER("📄", "Renderer"),
    QRCODE("🔳", "QR"),
    FILESYSTEM("📁", "Filesystem");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
