package com.costsentinel.core.detection;

import com.costsentinel.core.config.DetectionConfig;
import com.costsentinel.core.model.DetectionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Strategy table mapping each concrete {@link DetectionMethod} to its
 * detector.
 *
 * <p>
 * This is the single point of extension when adding a detection method:
 * add the enum constant and register the detector in {@link #standard}.
 * {@link DetectionMethod#ENSEMBLE} is not a detector and never registered.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorRegistry.class);

    private final Map<DetectionMethod, CostAnomalyDetector> detectors;

    private DetectorRegistry(Map<DetectionMethod, CostAnomalyDetector> detectors) {
        this.detectors = Collections.unmodifiableMap(new EnumMap<>(detectors));
    }

    /**
     * Registry with the four built-in detectors.
     *
     * @param config detection configuration; must not be {@code null}
     * @return the registry
     */
    public static DetectorRegistry standard(DetectionConfig config) {
        Objects.requireNonNull(config, "DetectionConfig must not be null");
        Map<DetectionMethod, CostAnomalyDetector> table = new EnumMap<>(DetectionMethod.class);
        register(table, new ZScoreDetector(config));
        register(table, new IsolationForestDetector(config));
        register(table, new DensityClusterDetector(config));
        register(table, new SeasonalDecompositionDetector(config));
        LOG.debug("Registered {} detector(s): {}", table.size(), table.keySet());
        return new DetectorRegistry(table);
    }

    /**
     * Registry with caller-supplied detectors. A z-score detector is
     * required because every fallback ends there.
     *
     * @throws IllegalArgumentException if no z-score detector is supplied or
     *                                  a method is registered twice
     */
    public static DetectorRegistry of(CostAnomalyDetector... detectors) {
        Objects.requireNonNull(detectors, "detectors must not be null");
        Map<DetectionMethod, CostAnomalyDetector> table = new EnumMap<>(DetectionMethod.class);
        for (CostAnomalyDetector detector : detectors) {
            register(table, Objects.requireNonNull(detector, "detector must not be null"));
        }
        if (!table.containsKey(DetectionMethod.ZSCORE)) {
            throw new IllegalArgumentException("A z-score detector is required as the fallback");
        }
        return new DetectorRegistry(table);
    }

    private static void register(Map<DetectionMethod, CostAnomalyDetector> table, CostAnomalyDetector detector) {
        DetectionMethod method = Objects.requireNonNull(detector.getMethod(), "Detector method must not be null");
        if (method == DetectionMethod.ENSEMBLE) {
            throw new IllegalArgumentException("ENSEMBLE is a combination policy, not a detector");
        }
        if (table.putIfAbsent(method, detector) != null) {
            throw new IllegalArgumentException("Duplicate detector for method: " + method.getWireName());
        }
    }

    public Optional<CostAnomalyDetector> find(DetectionMethod method) {
        return Optional.ofNullable(detectors.get(method));
    }

    /**
     * @throws IllegalArgumentException if no detector is registered
     */
    public CostAnomalyDetector get(DetectionMethod method) {
        CostAnomalyDetector detector = detectors.get(method);
        if (detector == null) {
            throw new IllegalArgumentException("No detector registered for method: " + method);
        }
        return detector;
    }

    public CostAnomalyDetector zscore() {
        return get(DetectionMethod.ZSCORE);
    }

    public Set<DetectionMethod> methods() {
        return detectors.keySet();
    }
}
