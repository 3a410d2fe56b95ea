package com.costsentinel.core.ensemble;

import com.costsentinel.core.detection.CostAnomalyDetector;
import com.costsentinel.core.detection.DetectionException;
import com.costsentinel.core.detection.DetectorRegistry;
import com.costsentinel.core.model.DetectionMethod;
import com.costsentinel.core.model.MethodResult;
import com.costsentinel.core.series.NormalizedSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Runs one method slot under the fallback policy.
 *
 * <h3>Policy</h3>
 * <ol>
 * <li>The requested detector, if registered and applicable to the series.</li>
 * <li>Otherwise, or if it throws, z-score in its place
 * ({@link MethodResult.Outcome#FALLBACK}).</li>
 * <li>If z-score cannot run either, a {@link MethodResult.Outcome#FAILED}
 * result with the reason.</li>
 * </ol>
 *
 * <p>
 * Never throws for a detector failure. Stateless and safe to call from
 * several threads.
 * </p>
 *
 * @since 1.0.0
 */
public class MethodRunner {

    private static final Logger LOG = LoggerFactory.getLogger(MethodRunner.class);

    private final DetectorRegistry registry;

    public MethodRunner(DetectorRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "DetectorRegistry must not be null");
    }

    /**
     * @param method    requested method; must not be {@code null} or
     *                  {@link DetectionMethod#ENSEMBLE}
     * @param series    normalized series
     * @param threshold sensitivity threshold
     * @return the slot's result, never {@code null}
     */
    public MethodResult run(DetectionMethod method, NormalizedSeries series, double threshold) {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(series, "series must not be null");
        if (method == DetectionMethod.ENSEMBLE) {
            throw new IllegalArgumentException("ENSEMBLE is aggregated, not run as a single slot");
        }

        Optional<CostAnomalyDetector> detector = registry.find(method);
        String failure;
        if (detector.isEmpty()) {
            failure = "No detector registered for " + method.getWireName();
        } else if (!detector.get().isApplicable(series)) {
            failure = method.getWireName() + " needs at least " + detector.get().getMinimumPoints()
                    + (method == DetectionMethod.DECOMPOSITION ? " dated" : "")
                    + " point(s), got " + series.size();
        } else {
            try {
                return detector.get().detect(series, threshold);
            } catch (DetectionException e) {
                failure = method.getWireName() + " failed: " + e.getMessage();
            } catch (RuntimeException e) {
                LOG.warn("Unexpected error in {} detector", method.getWireName(), e);
                failure = method.getWireName() + " failed unexpectedly: " + e;
            }
        }

        if (method == DetectionMethod.ZSCORE) {
            LOG.warn("Z-score detection unavailable: {}", failure);
            return MethodResult.failed(method, failure);
        }

        LOG.warn("{}; falling back to z-score", failure);
        MethodResult substitute = run(DetectionMethod.ZSCORE, series, threshold);
        if (substitute.isFailed()) {
            String reason = failure + "; z-score fallback failed: " + substitute.getMessage().orElse("unknown");
            return MethodResult.failed(method, reason);
        }
        return MethodResult.fallback(method, substitute, failure);
    }
}
