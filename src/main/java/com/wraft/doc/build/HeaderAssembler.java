package com.wraft.doc.build;

import com.wraft.doc.exception.AssetUrlResolutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Builds the metadata block the renderer template reads:
 *
 * <pre>
 * ---
 * title: Offer letter
 * logo: uploads/assets/…/logo.png?expires=…&amp;signature=…
 * qrcode: uploads/contents/OFF0001/qr.png
 * path: uploads/contents/OFF0001
 * ---
 * </pre>
 *
 * Key order is fields (declaration order), assets (layout order), qrcode, path.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HeaderAssembler {

    static final String SENTINEL = "---";

    private final AssetUrlResolver assetUrlResolver;

    public String assemble(List<String> fieldNames,
                           Map<String, String> serialized,
                           List<BuildSource.AssetRef> assets,
                           Path qrCode,
                           BuildWorkspace workspace) {
        StringBuilder header = new StringBuilder(SENTINEL).append('\n');

        for (String field : fieldNames) {
            if (serialized.containsKey(field)) {
                appendLine(header, field, serialized.get(field));
            }
        }

        for (BuildSource.AssetRef asset : assets) {
            try {
                appendLine(header, asset.name(), relativize(assetUrlResolver.resolve(asset)));
            } catch (AssetUrlResolutionException e) {
                log.warn("Skipping asset '{}' in header of {}: {}", asset.name(), workspace.instanceCode(), e.getMessage());
            }
        }

        appendLine(header, "qrcode", qrCode.toString());
        appendLine(header, "path", workspace.root().toString());
        return header.append(SENTINEL).append('\n').toString();
    }

    /**
     * Source document handed to the renderer: header, blank line, body.
     */
    public String document(String header, String raw) {
        return header + "\n" + (raw == null ? "" : raw) + "\n";
    }

    /**
     * Local asset URLs start with '/'; templates load them relative to the application root.
     */
    static String relativize(String url) {
        return url.startsWith("/") ? url.substring(1) : url;
    }

    private static void appendLine(StringBuilder header, String key, String value) {
        header.append(key).append(": ").append(value == null ? "" : value).append('\n');
    }
}
