package com.costsentinel.core.context;

import com.costsentinel.core.model.RelatedService;
import com.costsentinel.core.series.EntityKey;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NavigableMap;

/**
 * Finds other services whose cost moved on the anomaly date.
 *
 * <p>
 * A service is related when its total that day differs by at least
 * {@value #MIN_CHANGE_PCT}% from its own average before that day. Moves
 * above {@value #STRONG_CHANGE_PCT}% are strong. The anomalous service is
 * skipped under every provider.
 * </p>
 *
 * @since 1.0.0
 */
public class RelatedServiceFinder {

    static final double MIN_CHANGE_PCT = 20.0;
    static final double STRONG_CHANGE_PCT = 50.0;

    public List<RelatedService> find(LocalDate date, EntityKey anomalous, ServiceHistory history) {
        List<RelatedService> related = new ArrayList<>();
        if (date == null) {
            return related;
        }
        for (EntityKey key : history.entities()) {
            if (key.getService().equals(anomalous.getService())) {
                continue;
            }
            NavigableMap<LocalDate, Double> daily = history.dailyTotals(key);
            Double cost = daily.get(date);
            NavigableMap<LocalDate, Double> before = daily.headMap(date, false);
            if (cost == null || before.isEmpty()) {
                continue;
            }
            double avgPrev = PatternClassifier.average(before.values());
            double pct = avgPrev > 0.0 ? (cost - avgPrev) / avgPrev * 100.0 : 0.0;
            if (Math.abs(pct) < MIN_CHANGE_PCT) {
                continue;
            }
            related.add(new RelatedService(key.getService(), key.getProvider(), cost, pct, avgPrev,
                    Math.abs(pct) > STRONG_CHANGE_PCT
                            ? RelatedService.Correlation.STRONG
                            : RelatedService.Correlation.MODERATE));
        }
        related.sort(Comparator.comparingDouble((RelatedService r) -> Math.abs(r.getPctChange())).reversed());
        return related;
    }
}
