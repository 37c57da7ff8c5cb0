package com.wraft.doc.build;

import java.util.List;
import java.util.Map;

/**
 * Everything a build reads from the database, copied out of the persistence
 * context before any file is touched.
 *
 * @param instanceUuid  encoded into the QR code
 * @param instanceCode  sequence code, names the workspace
 * @param serialized    field values of the instance
 * @param raw           body text appended after the header
 * @param fieldNames    declared fields of the content type, in declaration order
 * @param layoutSlug    template bundle to copy in
 * @param assets        layout assets, in association order
 */
public record BuildSource(
        String instanceUuid,
        String instanceCode,
        Map<String, String> serialized,
        String raw,
        List<String> fieldNames,
        String layoutSlug,
        List<AssetRef> assets
) {

    public record AssetRef(String uuid, String name, String file) {
    }
}
