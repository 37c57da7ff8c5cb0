package com.wraft.doc.exception;

public class DocumentNotFoundException extends RuntimeException {

    public DocumentNotFoundException(String kind, String uuid) {
        super(kind + " not found: " + uuid);
    }
}
