package com.wraft.doc.build;

import com.wraft.doc.exception.AssetUrlResolutionException;

/**
 * Turns a stored asset file into a URL the renderer can load.
 */
public interface AssetUrlResolver {

    /**
     * @throws AssetUrlResolutionException when the asset has no usable stored file
     */
    String resolve(BuildSource.AssetRef asset);
}
