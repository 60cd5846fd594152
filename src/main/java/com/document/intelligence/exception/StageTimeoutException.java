package com.document.intelligence.exception;

import com.document.intelligence.model.DocumentState;

import java.time.Duration;

public class StageTimeoutException extends DocumentProcessingException {

    public StageTimeoutException(DocumentState stage, Duration timeout) {
        super(stage, stage + " did not finish within " + timeout.toMillis() + "ms");
    }
}
