/**
 * Detection methods.
 *
 * <p>
 * Each {@link com.costsentinel.core.detection.CostAnomalyDetector} flags the
 * anomalous points of a normalized series on its own terms: z-score,
 * isolation forest, density clustering and seasonal decomposition. The
 * {@link com.costsentinel.core.detection.DetectorRegistry} maps method names
 * to detectors. Detectors are stateless and report internal failures as
 * {@link com.costsentinel.core.detection.DetectionException}.
 * </p>
 *
 * @since 1.0.0
 */
package com.costsentinel.core.detection;
