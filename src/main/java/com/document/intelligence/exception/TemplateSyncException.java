package com.document.intelligence.exception;

/**
 * The business system could not be reached, or answered with an error, while
 * pulling templates or pushing a variant proposal.
 */
public class TemplateSyncException extends RuntimeException {

    public TemplateSyncException(String message) {
        super(message);
    }

    public TemplateSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
