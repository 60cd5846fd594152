package com.document.intelligence.exception;

import com.document.intelligence.model.DocumentState;
import lombok.Getter;

/**
 * A stage could not finish its work for a document. The lifecycle records
 * the stage and message and moves the document to FAILED.
 */
@Getter
public class DocumentProcessingException extends RuntimeException {

    private final DocumentState stage;

    public DocumentProcessingException(DocumentState stage, String message) {
        super(message);
        this.stage = stage;
    }

    public DocumentProcessingException(DocumentState stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }
}
