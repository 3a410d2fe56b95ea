package com.costsentinel.core.detection;

import com.costsentinel.core.config.DetectionConfig;
import com.costsentinel.core.model.AnomalyCandidate;
import com.costsentinel.core.model.DetectionMethod;
import com.costsentinel.core.model.MethodResult;
import com.costsentinel.core.series.NormalizedSeries;
import com.costsentinel.core.series.SeriesStatistics;
import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Density-based (DBSCAN) detector over standardized {@code [cost, dayOffset]}.
 *
 * <p>
 * Points that belong to no dense cluster are anomalies with a fixed score of
 * {@value #NOISE_SCORE}. The neighbourhood radius is
 * {@code radiusFactor × threshold}; the minimum neighbour count grows with the
 * series as configured by {@link DetectionConfig#densityMinNeighbors(int)}.
 * The baseline is the median cost of the clustered points.
 * </p>
 *
 * @since 1.0.0
 */
public class DensityClusterDetector implements CostAnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DensityClusterDetector.class);

    static final double NOISE_SCORE = 1.0;

    private final DetectionConfig config;

    public DensityClusterDetector(DetectionConfig config) {
        this.config = Objects.requireNonNull(config, "DetectionConfig must not be null");
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.DENSITY;
    }

    @Override
    public int getMinimumPoints() {
        return config.getMinDistancePoints();
    }

    @Override
    public MethodResult detect(NormalizedSeries series, double threshold) {
        double[] costs = series.costs();
        double[] cost = SeriesStatistics.standardize(costs);
        double[] day = SeriesStatistics.standardize(series.dayOffsets());

        List<IndexedPoint> points = new ArrayList<>(costs.length);
        for (int i = 0; i < costs.length; i++) {
            points.add(new IndexedPoint(i, cost[i], day[i]));
        }

        double eps = config.getDensityRadiusFactor() * threshold;
        int minNeighbors = config.densityMinNeighbors(costs.length);
        List<Cluster<IndexedPoint>> clusters;
        try {
            clusters = new DBSCANClusterer<IndexedPoint>(eps, minNeighbors).cluster(points);
        } catch (RuntimeException e) {
            throw new DetectionException(getMethod(), "DBSCAN clustering failed: " + e.getMessage(), e);
        }

        boolean[] clustered = new boolean[costs.length];
        for (Cluster<IndexedPoint> cluster : clusters) {
            for (IndexedPoint point : cluster.getPoints()) {
                clustered[point.index] = true;
            }
        }

        List<Double> members = new ArrayList<>();
        List<Integer> noise = new ArrayList<>();
        for (int i = 0; i < costs.length; i++) {
            if (clustered[i]) {
                members.add(costs[i]);
            } else {
                noise.add(i);
            }
        }
        if (members.isEmpty()) {
            throw new DetectionException(getMethod(),
                    "No dense cluster at eps=" + eps + ", minNeighbors=" + minNeighbors);
        }
        double baseline = SeriesStatistics.median(members.stream().mapToDouble(Double::doubleValue).toArray());

        List<AnomalyCandidate> candidates = new ArrayList<>(noise.size());
        for (int i : noise) {
            candidates.add(AnomalyCandidate.of(series.get(i), baseline, NOISE_SCORE, getMethod()));
        }

        LOG.debug("DBSCAN found {} cluster(s) and {} noise point(s) (eps={}, minNeighbors={})",
                clusters.size(), candidates.size(), eps, minNeighbors);
        return MethodResult.primary(getMethod(), candidates);
    }

    /**
     * Clusterable with identity equality, so equal feature vectors are still
     * distinct points to the clusterer.
     */
    private static final class IndexedPoint implements Clusterable {

        private final int index;
        private final double[] point;

        IndexedPoint(int index, double cost, double day) {
            this.index = index;
            this.point = new double[] { cost, day };
        }

        @Override
        public double[] getPoint() {
            return point;
        }
    }
}
