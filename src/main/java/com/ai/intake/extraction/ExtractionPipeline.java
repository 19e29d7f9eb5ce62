package com.ai.intake.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs layers in order and stops at the first success. Exceptions and timeouts become layer failures.
 */
public class ExtractionPipeline<T> {

    private static final Logger log = LoggerFactory.getLogger(ExtractionPipeline.class);

    private final String field;
    private final List<ExtractionLayer<T>> layers;
    private final AsyncTaskExecutor executor;
    private final Duration defaultTimeout;
    private final String failureReason;

    public ExtractionPipeline(String field, List<ExtractionLayer<T>> layers, AsyncTaskExecutor executor,
                              Duration defaultTimeout) {
        this.field = field;
        this.layers = List.copyOf(layers);
        this.executor = executor;
        this.defaultTimeout = defaultTimeout;
        this.failureReason = "no_" + field + "_found";
    }

    public ExtractionResult<T> run(String transcript) {
        if (transcript == null || transcript.isBlank()) {
            return ExtractionResult.failed("empty_input");
        }
        for (ExtractionLayer<T> layer : layers) {
            long started = System.nanoTime();
            ExtractionResult<T> result = layer.isExternal() ? runBounded(layer, transcript) : runInline(layer, transcript);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            if (result.isSuccess()) {
                log.info("[{}] layer {} succeeded in {}ms", field, layer.name(), elapsedMs);
                return result;
            }
            log.debug("[{}] layer {} failed in {}ms: {}", field, layer.name(), elapsedMs, result.getReason());
        }
        return ExtractionResult.failed(failureReason);
    }

    private ExtractionResult<T> runInline(ExtractionLayer<T> layer, String transcript) {
        try {
            return nullSafe(layer.extract(transcript));
        } catch (RuntimeException e) {
            log.warn("[{}] layer {} threw: {}", field, layer.name(), e.toString());
            return ExtractionResult.failed("layer_error");
        }
    }

    private ExtractionResult<T> runBounded(ExtractionLayer<T> layer, String transcript) {
        Duration budget = layer.timeout().orElse(defaultTimeout);
        Future<ExtractionResult<T>> future;
        try {
            future = executor.submit(() -> layer.extract(transcript));
        } catch (RejectedExecutionException e) {
            log.warn("[{}] layer {} rejected by executor: {}", field, layer.name(), e.getMessage());
            return ExtractionResult.failed("layer_rejected");
        }
        try {
            return nullSafe(future.get(budget.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[{}] layer {} timed out after {}ms", field, layer.name(), budget.toMillis());
            return ExtractionResult.failed("layer_timeout");
        } catch (ExecutionException e) {
            log.warn("[{}] layer {} threw: {}", field, layer.name(), String.valueOf(e.getCause()));
            return ExtractionResult.failed("layer_error");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ExtractionResult.failed("layer_interrupted");
        }
    }

    private ExtractionResult<T> nullSafe(ExtractionResult<T> result) {
        return result != null ? result : ExtractionResult.failed("layer_error");
    }
}
