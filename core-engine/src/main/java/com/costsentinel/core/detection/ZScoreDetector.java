package com.costsentinel.core.detection;

import com.costsentinel.core.config.DetectionConfig;
import com.costsentinel.core.model.AnomalyCandidate;
import com.costsentinel.core.model.DetectionMethod;
import com.costsentinel.core.model.MethodResult;
import com.costsentinel.core.series.NormalizedSeries;
import com.costsentinel.core.series.SeriesStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Z-score outlier detector.
 *
 * <p>
 * A point is anomalous when its cost lies more than {@code threshold} sample
 * standard deviations from the series mean. The expected cost is the median
 * of the points that were <em>not</em> flagged, so one spike does not drag
 * its own baseline up.
 * </p>
 *
 * <h3>Edge Cases</h3>
 * <ul>
 * <li>Zero variance: nothing can be an outlier, the result is empty.</li>
 * </ul>
 *
 * <p>
 * This detector is also the substitute every other method falls back to.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreDetector implements CostAnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreDetector.class);

    private final int minimumPoints;

    public ZScoreDetector(DetectionConfig config) {
        Objects.requireNonNull(config, "DetectionConfig must not be null");
        this.minimumPoints = config.getMinDataPoints();
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.ZSCORE;
    }

    @Override
    public int getMinimumPoints() {
        return minimumPoints;
    }

    @Override
    public MethodResult detect(NormalizedSeries series, double threshold) {
        double[] costs = series.costs();
        double mean = SeriesStatistics.mean(costs);
        double std = SeriesStatistics.sampleStd(costs);

        if (std == 0.0 || Double.isNaN(std)) {
            LOG.debug("Zero cost variance over {} point(s); no z-score outliers", costs.length);
            return MethodResult.primary(getMethod(), List.of());
        }

        double[] scores = new double[costs.length];
        List<Integer> flagged = new ArrayList<>();
        List<Double> normal = new ArrayList<>();
        for (int i = 0; i < costs.length; i++) {
            scores[i] = Math.abs((costs[i] - mean) / std);
            if (scores[i] > threshold) {
                flagged.add(i);
            } else {
                normal.add(costs[i]);
            }
        }

        double baseline = normal.isEmpty()
                ? SeriesStatistics.median(costs)
                : SeriesStatistics.median(normal.stream().mapToDouble(Double::doubleValue).toArray());

        List<AnomalyCandidate> candidates = new ArrayList<>(flagged.size());
        for (int i : flagged) {
            candidates.add(AnomalyCandidate.of(series.get(i), baseline, scores[i], getMethod()));
        }

        LOG.debug("Z-score flagged {} of {} point(s) (mean={}, std={}, threshold={})",
                candidates.size(), costs.length, mean, std, threshold);
        return MethodResult.primary(getMethod(), candidates);
    }
}
