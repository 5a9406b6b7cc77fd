package com.jdocs.tools;

public class DocumentNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DocumentNotFoundException(String docId) {
        super("Doc with id %s not found".formatted(docId));
    }
}
