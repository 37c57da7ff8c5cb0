package com.wraft.doc.exception;

public class AssetUrlResolutionException extends RuntimeException {

    public AssetUrlResolutionException(String message) {
        super(message);
    }
}
