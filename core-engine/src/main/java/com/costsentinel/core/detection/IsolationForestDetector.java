package com.costsentinel.core.detection;

import com.costsentinel.core.config.DetectionConfig;
import com.costsentinel.core.detection.isolation.IsolationForest;
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
 * Isolation forest detector over standardized {@code [cost, dayOffset]}.
 *
 * <p>
 * The threshold maps to an expected outlier share,
 * {@code contamination = clamp(1 / threshold, 0.01, 0.5)}. Points scoring
 * above the {@code (1 - contamination)} score percentile are anomalies; their
 * reported score is the margin above that cut-off. The baseline is the median
 * cost of the remaining points.
 * </p>
 *
 * <p>
 * The forest is re-grown on every call with a fixed seed, so repeated calls
 * on the same series agree exactly.
 * </p>
 *
 * @since 1.0.0
 */
public class IsolationForestDetector implements CostAnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(IsolationForestDetector.class);

    static final double MIN_CONTAMINATION = 0.01;
    static final double MAX_CONTAMINATION = 0.5;

    private final int minimumPoints;
    private final int treeCount;
    private final int sampleSize;
    private final long seed;

    public IsolationForestDetector(DetectionConfig config) {
        Objects.requireNonNull(config, "DetectionConfig must not be null");
        this.minimumPoints = config.getMinDistancePoints();
        this.treeCount = config.getIsolationTrees();
        this.sampleSize = config.getIsolationSampleSize();
        this.seed = config.getIsolationSeed();
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.ISOLATION;
    }

    @Override
    public int getMinimumPoints() {
        return minimumPoints;
    }

    static double contamination(double threshold) {
        return Math.min(MAX_CONTAMINATION, Math.max(MIN_CONTAMINATION, 1.0 / threshold));
    }

    @Override
    public MethodResult detect(NormalizedSeries series, double threshold) {
        double[] costs = series.costs();
        double[][] rows = featureRows(costs, series.dayOffsets());

        double[] scores;
        try {
            scores = IsolationForest.train(rows, treeCount, sampleSize, seed).scoreAll(rows);
        } catch (IllegalArgumentException e) {
            throw new DetectionException(getMethod(), "Isolation forest training failed: " + e.getMessage(), e);
        }

        double contamination = contamination(threshold);
        double cutoff = SeriesStatistics.percentile(scores, 100.0 * (1.0 - contamination));

        List<Integer> outliers = new ArrayList<>();
        List<Double> inliers = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            if (scores[i] > cutoff) {
                outliers.add(i);
            } else {
                inliers.add(costs[i]);
            }
        }
        double baseline = inliers.isEmpty()
                ? SeriesStatistics.median(costs)
                : SeriesStatistics.median(inliers.stream().mapToDouble(Double::doubleValue).toArray());

        List<AnomalyCandidate> candidates = new ArrayList<>(outliers.size());
        for (int i : outliers) {
            candidates.add(AnomalyCandidate.of(series.get(i), baseline, scores[i] - cutoff, getMethod()));
        }

        LOG.debug("Isolation forest flagged {} of {} point(s) (contamination={}, cutoff={})",
                candidates.size(), costs.length, contamination, cutoff);
        return MethodResult.primary(getMethod(), candidates);
    }

    private static double[][] featureRows(double[] costs, double[] dayOffsets) {
        double[] cost = SeriesStatistics.standardize(costs);
        double[] day = SeriesStatistics.standardize(dayOffsets);
        double[][] rows = new double[costs.length][];
        for (int i = 0; i < costs.length; i++) {
            rows[i] = new double[] { cost[i], day[i] };
        }
        return rows;
    }
}
