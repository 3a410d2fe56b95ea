package com.costsentinel.core.context;

import com.costsentinel.core.config.CloudTaxonomy;
import com.costsentinel.core.model.AnomalyRecord;
import com.costsentinel.core.model.CauseConfidence;
import com.costsentinel.core.model.RootCause;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.NavigableMap;
import java.util.Objects;

/**
 * Names the most likely root cause of a cost spike.
 *
 * <p>
 * Potential causes are the first {@value #POTENTIAL_CAUSES} typical causes
 * for the service. The primary cause grades the day-over-day change, and is
 * replaced when the cost stays more than 30% above its earlier level
 * afterwards.
 * </p>
 *
 * @since 1.0.0
 */
public class RootCauseAnalyzer {

    static final int POTENTIAL_CAUSES = 2;
    static final String DEFAULT_CAUSE = "Cost spike detected";
    static final String SUSTAINED_CAUSE = "Beginning of a sustained cost increase";
    static final String PERMANENT_CHANGE = "Possible permanent infrastructure change";

    private final CloudTaxonomy taxonomy;

    public RootCauseAnalyzer(CloudTaxonomy taxonomy) {
        this.taxonomy = Objects.requireNonNull(taxonomy, "CloudTaxonomy must not be null");
    }

    public RootCause analyze(AnomalyRecord record, ServiceHistory history) {
        List<String> potential = new ArrayList<>(taxonomy.causePatternsFor(record.getService()));
        if (potential.size() > POTENTIAL_CAUSES) {
            potential = new ArrayList<>(potential.subList(0, POTENTIAL_CAUSES));
        }

        LocalDate date = record.getDate();
        NavigableMap<LocalDate, Double> daily = history.dailyTotals(record.getProvider(), record.getService());
        if (date == null || daily.size() < 2 || !daily.containsKey(date)) {
            return new RootCause(DEFAULT_CAUSE, potential, CauseConfidence.MEDIUM);
        }

        String primary = DEFAULT_CAUSE;
        CauseConfidence confidence = CauseConfidence.MEDIUM;
        if (daily.lowerKey(date) != null) {
            double pct = PatternClassifier.dayOverDayChange(date, daily);
            if (pct > 80.0) {
                primary = String.format(Locale.ROOT, "Extreme cost spike (+%.1f%%)", pct);
                confidence = CauseConfidence.HIGH;
            } else if (pct > 30.0) {
                primary = String.format(Locale.ROOT, "Significant cost increase (+%.1f%%)", pct);
            }
        }

        Collection<Double> after = daily.tailMap(date, false).values();
        if (!after.isEmpty()) {
            Collection<Double> before = daily.headMap(date, false).values();
            double prevAvg = before.isEmpty() ? daily.get(date) : PatternClassifier.average(before);
            if (PatternClassifier.average(after) > prevAvg * 1.3) {
                primary = SUSTAINED_CAUSE;
                potential.add(PERMANENT_CHANGE);
            }
        }
        return new RootCause(primary, potential, confidence);
    }
}
