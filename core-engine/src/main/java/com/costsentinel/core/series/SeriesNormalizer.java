package com.costsentinel.core.series;

import com.costsentinel.core.config.DetectionConfig;
import com.costsentinel.core.model.CostObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns raw cost observations into a {@link NormalizedSeries}.
 *
 * <h3>Rules</h3>
 * <ul>
 * <li>Missing costs are replaced by the median of the batch's present costs
 * ({@code 0} when no cost is present).</li>
 * <li>Observations are sorted by date, stable on input order. Undated
 * observations go last.</li>
 * <li>A batch smaller than the required point count yields
 * {@link Optional#empty()}; this is the insufficient-data signal.</li>
 * </ul>
 *
 * <p>
 * The normalizer holds no state beyond its configuration and is safe to share.
 * </p>
 *
 * @since 1.0.0
 */
public class SeriesNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesNormalizer.class);

    private static final Comparator<CostObservation> BY_DATE_UNDATED_LAST =
            Comparator.comparing(CostObservation::getDate, Comparator.nullsLast(Comparator.<LocalDate>naturalOrder()));

    private final DetectionConfig config;

    public SeriesNormalizer(DetectionConfig config) {
        this.config = Objects.requireNonNull(config, "DetectionConfig must not be null");
    }

    /**
     * Normalize with the minimum point count for the requested analysis depth.
     *
     * @param observations     raw observations; must not be {@code null}
     * @param contextRequested whether root-cause or context analysis follows
     * @return the series, or empty when there are too few points
     */
    public Optional<NormalizedSeries> normalize(Collection<CostObservation> observations, boolean contextRequested) {
        return normalize(observations, config.requiredDataPoints(contextRequested));
    }

    /**
     * @param observations   raw observations; must not be {@code null}
     * @param requiredPoints minimum number of observations
     * @return the series, or empty when there are fewer than
     *         {@code requiredPoints} observations
     */
    public Optional<NormalizedSeries> normalize(Collection<CostObservation> observations, int requiredPoints) {
        Objects.requireNonNull(observations, "observations must not be null");
        if (observations.size() < requiredPoints) {
            LOG.debug("Insufficient data: {} point(s), {} required", observations.size(), requiredPoints);
            return Optional.empty();
        }

        List<CostObservation> sorted = new ArrayList<>(observations.size());
        for (CostObservation observation : observations) {
            sorted.add(Objects.requireNonNull(observation, "observations must not contain null"));
        }
        // List.sort is a stable merge sort
        sorted.sort(BY_DATE_UNDATED_LAST);

        BigDecimal fill = imputedCost(sorted);
        List<CostObservation> filled = new ArrayList<>(sorted.size());
        int imputed = 0;
        for (CostObservation observation : sorted) {
            if (observation.hasCost()) {
                filled.add(observation);
            } else {
                filled.add(observation.withCost(fill));
                imputed++;
            }
        }
        if (imputed > 0) {
            LOG.debug("Imputed {} missing cost(s) with {}", imputed, fill);
        }
        return Optional.of(new NormalizedSeries(filled));
    }

    private static BigDecimal imputedCost(List<CostObservation> observations) {
        double[] present = observations.stream()
                .filter(CostObservation::hasCost)
                .mapToDouble(CostObservation::costValue)
                .toArray();
        if (present.length == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(SeriesStatistics.median(present));
    }
}
