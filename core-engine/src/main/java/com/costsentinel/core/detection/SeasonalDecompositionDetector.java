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
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Seasonal decomposition detector.
 *
 * <h3>Period Selection</h3>
 * <p>
 * Candidate periods are weekly (7) and monthly (30), each considered only
 * when the series covers two full cycles. The candidate with the higher
 * autocorrelation wins; if that autocorrelation does not exceed the configured
 * seasonality cut-off the series is not seasonal and the detector fails, which
 * hands the slot to z-score.
 * </p>
 *
 * <h3>Flagging</h3>
 * <p>
 * A point is anomalous when {@code |residual| > threshold × std(residual)}.
 * Its score is {@code |residual| / std(residual)} and its baseline is the trend
 * at that date.
 * </p>
 *
 * @since 1.0.0
 */
public class SeasonalDecompositionDetector implements CostAnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalDecompositionDetector.class);

    static final int WEEKLY = 7;
    static final int MONTHLY = 30;

    private final int minimumPoints;
    private final double seasonalityThreshold;

    public SeasonalDecompositionDetector(DetectionConfig config) {
        Objects.requireNonNull(config, "DetectionConfig must not be null");
        this.minimumPoints = config.getMinDecompositionPoints();
        this.seasonalityThreshold = config.getSeasonalityThreshold();
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.DECOMPOSITION;
    }

    @Override
    public int getMinimumPoints() {
        return minimumPoints;
    }

    @Override
    public boolean isApplicable(NormalizedSeries series) {
        return series.hasDateAxis() && series.size() >= minimumPoints;
    }

    @Override
    public MethodResult detect(NormalizedSeries series, double threshold) {
        double[] costs = series.costs();
        int period = selectPeriod(costs);

        SeasonalDecomposition decomposition;
        try {
            decomposition = SeasonalDecomposition.decompose(costs, period);
        } catch (IllegalArgumentException e) {
            throw new DetectionException(getMethod(), "Decomposition failed: " + e.getMessage(), e);
        }

        double[] residual = decomposition.getResidual();
        double[] trend = decomposition.getTrend();
        double[] defined = Arrays.stream(residual).filter(r -> !Double.isNaN(r)).toArray();
        if (defined.length == 0) {
            throw new DetectionException(getMethod(), "No residuals for period " + period);
        }
        double std = SeriesStatistics.populationStd(defined);
        if (std == 0.0) {
            LOG.debug("Residuals are constant for period {}; no anomalies", period);
            return MethodResult.primary(getMethod(), List.of());
        }

        double fallbackBaseline = SeriesStatistics.median(costs);
        List<AnomalyCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < costs.length; i++) {
            if (Double.isNaN(residual[i])) {
                continue;
            }
            double score = Math.abs(residual[i]) / std;
            if (score > threshold) {
                double baseline = Double.isNaN(trend[i]) ? fallbackBaseline : trend[i];
                candidates.add(AnomalyCandidate.of(series.get(i), baseline, score, getMethod()));
            }
        }

        LOG.debug("Seasonal decomposition (period={}) flagged {} of {} point(s)",
                period, candidates.size(), costs.length);
        return MethodResult.primary(getMethod(), candidates);
    }

    private int selectPeriod(double[] costs) {
        int best = -1;
        double bestCorrelation = Double.NEGATIVE_INFINITY;
        for (int lag : new int[] { WEEKLY, MONTHLY }) {
            if (costs.length < 2 * lag) {
                continue;
            }
            double correlation = SeasonalDecomposition.autocorrelation(costs, lag);
            LOG.debug("Autocorrelation at lag {}: {}", lag, correlation);
            if (correlation > bestCorrelation) {
                best = lag;
                bestCorrelation = correlation;
            }
        }
        if (best < 0) {
            throw new DetectionException(getMethod(), "Series too short for a weekly cycle: " + costs.length);
        }
        if (!(bestCorrelation > seasonalityThreshold)) {
            throw new DetectionException(getMethod(), String.format(Locale.ROOT,
                    "No significant seasonality (best lag %d, autocorrelation %.3f <= %.2f)",
                    best, bestCorrelation, seasonalityThreshold));
        }
        return best;
    }
}
