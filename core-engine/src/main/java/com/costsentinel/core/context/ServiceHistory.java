package com.costsentinel.core.context;

import com.costsentinel.core.model.CostObservation;
import com.costsentinel.core.series.EntityKey;
import com.costsentinel.core.series.NormalizedSeries;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Daily cost totals per {@code (provider, service)}.
 *
 * <p>
 * Several observations for the same entity and date (one per resource, say)
 * are summed. Undated observations carry no history and are skipped.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceHistory {

    private final Map<EntityKey, NavigableMap<LocalDate, Double>> totals;

    private ServiceHistory(Map<EntityKey, NavigableMap<LocalDate, Double>> totals) {
        this.totals = totals;
    }

    public static ServiceHistory of(NormalizedSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        Map<EntityKey, NavigableMap<LocalDate, Double>> totals = new LinkedHashMap<>();
        for (CostObservation observation : series.getObservations()) {
            if (observation.getDate() == null) {
                continue;
            }
            EntityKey key = new EntityKey(observation.getProvider(), observation.getService());
            totals.computeIfAbsent(key, k -> new TreeMap<>())
                    .merge(observation.getDate(), observation.costValue(), Double::sum);
        }
        totals.replaceAll((key, daily) -> Collections.unmodifiableNavigableMap(daily));
        return new ServiceHistory(Collections.unmodifiableMap(totals));
    }

    /**
     * @return the entity's daily totals by date, empty if unknown
     */
    public NavigableMap<LocalDate, Double> dailyTotals(String provider, String service) {
        NavigableMap<LocalDate, Double> daily = totals.get(new EntityKey(provider, service));
        return daily != null ? daily : Collections.emptyNavigableMap();
    }

    public Set<EntityKey> entities() {
        return totals.keySet();
    }

    public NavigableMap<LocalDate, Double> dailyTotals(EntityKey key) {
        return dailyTotals(key.getProvider(), key.getService());
    }
}
