package com.costsentinel.core.detection;

import com.costsentinel.core.model.DetectionMethod;

import java.util.Objects;

/**
 * Raised when a detection method cannot produce a result for a series.
 *
 * @since 1.0.0
 */
public class DetectionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final DetectionMethod method;

    public DetectionException(DetectionMethod method, String message) {
        super(message);
        this.method = Objects.requireNonNull(method, "method must not be null");
    }

    public DetectionException(DetectionMethod method, String message, Throwable cause) {
        super(message, cause);
        this.method = Objects.requireNonNull(method, "method must not be null");
    }

    public DetectionMethod getMethod() {
        return method;
    }
}
