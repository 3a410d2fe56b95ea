package com.costsentinel.core.detection;

import com.costsentinel.core.model.DetectionMethod;
import com.costsentinel.core.model.MethodResult;
import com.costsentinel.core.series.NormalizedSeries;

/**
 * Contract for all cost anomaly detectors.
 * <p>
 * Implementations are <strong>stateless</strong>: a detector is a pure
 * function of the series and the threshold, so one instance may serve any
 * number of concurrent calls.
 * </p>
 * <p>
 * A detector that cannot complete throws {@link DetectionException}; callers
 * recover through the fallback policy rather than seeing the failure.
 * </p>
 */
public interface CostAnomalyDetector {

    /**
     * @return the method this detector implements
     */
    DetectionMethod getMethod();

    /**
     * @return the smallest series this detector accepts
     */
    int getMinimumPoints();

    /**
     * Whether the detector can run on the series at all.
     *
     * @param series normalized series
     * @return {@code true} if {@link #detect} may be called
     */
    default boolean isApplicable(NormalizedSeries series) {
        return series.size() >= getMinimumPoints();
    }

    /**
     * Flag the anomalous points of a series.
     *
     * @param series    normalized series; must satisfy {@link #isApplicable}
     * @param threshold sensitivity, higher is less sensitive
     * @return a {@link MethodResult.Outcome#PRIMARY} result
     * @throws DetectionException if the method cannot produce a result
     */
    MethodResult detect(NormalizedSeries series, double threshold);
}
