package com.document.intelligence.service;

import com.document.intelligence.config.PipelineProperties;
import com.document.intelligence.exception.DocumentProcessingException;
import com.document.intelligence.exception.StageTimeoutException;
import com.document.intelligence.model.DocumentState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one stage of one document with that stage's time limit. An overrun
 * stage is interrupted and reported as a {@link StageTimeoutException}.
 */
@Component
@Slf4j
public class StageRunner {

    private final ExecutorService stageExecutor;
    private final PipelineProperties.StageTimeouts timeouts;

    public StageRunner(@Qualifier("stageExecutor") ExecutorService stageExecutor, PipelineProperties properties) {
        this.stageExecutor = stageExecutor;
        this.timeouts = properties.getLifecycle().getStageTimeouts();
    }

    public <T> T run(DocumentState stage, Callable<T> work) {
        Duration timeout = timeoutFor(stage);
        Future<T> future = stageExecutor.submit(work);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} overran its {}ms limit", stage, timeout.toMillis());
            throw new StageTimeoutException(stage, timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new DocumentProcessingException(stage, String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new DocumentProcessingException(stage, "interrupted while waiting for " + stage, e);
        }
    }

    Duration timeoutFor(DocumentState stage) {
        return switch (stage) {
            case PREPROCESSING -> timeouts.getPreprocessing();
            case MATCHING      -> timeouts.getMatching();
            case EXTRACTING    -> timeouts.getExtracting();
            default            -> throw new IllegalArgumentException("No stage work for " + stage);
        };
    }
}
