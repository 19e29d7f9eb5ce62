package com.ai.intake.extraction;

import java.util.Objects;

/**
 * Outcome of one extraction attempt: a value with the layer that produced it, or a failure reason.
 */
public final class ExtractionResult<T> {

    private final T value;
    private final String layer;
    private final String reason;

    private ExtractionResult(T value, String layer, String reason) {
        this.value = value;
        this.layer = layer;
        this.reason = reason;
    }

    public static <T> ExtractionResult<T> success(T value, String layer) {
        Objects.requireNonNull(value, "value");
        return new ExtractionResult<>(value, layer, null);
    }

    public static <T> ExtractionResult<T> failed(String reason) {
        return new ExtractionResult<>(null, null, reason);
    }

    public boolean isSuccess() {
        return value != null;
    }

    public T getValue() {
        return value;
    }

    public String getLayer() {
        return layer;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "Success(" + value + ", " + layer + ")"
                : "Failed(" + reason + ")";
    }
}
