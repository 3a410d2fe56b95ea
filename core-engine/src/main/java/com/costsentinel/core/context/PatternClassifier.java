package com.costsentinel.core.context;

import com.costsentinel.core.model.PatternType;

import java.time.LocalDate;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;

/**
 * Classifies the shape of a cost movement from the entity's daily history.
 *
 * <table>
 * <caption>Rules, evaluated independently</caption>
 * <tr><th>Pattern</th><th>Condition</th></tr>
 * <tr><td>sudden_increase</td><td>day-over-day change &gt; 50%</td></tr>
 * <tr><td>step_increase</td><td>change &gt; 20% and post-average &ge; 110% of
 * pre-average</td></tr>
 * <tr><td>temporary_spike</td><td>change &gt; 40% and post-average within 20%
 * of pre-average</td></tr>
 * <tr><td>cyclical_spike</td><td>day-of-week or day-of-month average &gt;
 * 110% of the overall average</td></tr>
 * </table>
 *
 * <p>
 * Fewer than {@value #MIN_HISTORY} history points, or a date missing from the
 * history, classify as nothing.
 * </p>
 *
 * @since 1.0.0
 */
public class PatternClassifier {

    static final int MIN_HISTORY = 3;

    private static final List<PatternType> PRIORITY = List.of(
            PatternType.STEP_INCREASE,
            PatternType.TEMPORARY_SPIKE,
            PatternType.SUDDEN_INCREASE,
            PatternType.CYCLICAL_SPIKE);

    /**
     * @param date    anomaly date
     * @param history the entity's daily totals
     * @return every matching pattern, possibly none
     */
    public Set<PatternType> classify(LocalDate date, NavigableMap<LocalDate, Double> history) {
        Set<PatternType> types = EnumSet.noneOf(PatternType.class);
        if (date == null || history.size() < MIN_HISTORY || !history.containsKey(date)) {
            return types;
        }

        double pct = dayOverDayChange(date, history);
        Collection<Double> before = history.headMap(date, false).values();
        Collection<Double> after = history.tailMap(date, false).values();

        if (pct > 50.0) {
            types.add(PatternType.SUDDEN_INCREASE);
        }
        if (pct > 20.0 && !before.isEmpty() && !after.isEmpty()
                && average(after) >= average(before) * 1.1) {
            types.add(PatternType.STEP_INCREASE);
        }
        if (pct > 40.0 && !before.isEmpty() && !after.isEmpty()) {
            double pre = average(before);
            if (pre > 0.0 && Math.abs(average(after) - pre) / pre < 0.2) {
                types.add(PatternType.TEMPORARY_SPIKE);
            }
        }
        if (isCyclical(date, history)) {
            types.add(PatternType.CYCLICAL_SPIKE);
        }
        return types;
    }

    /**
     * @return the most specific of the classified patterns, or
     *         {@link PatternType#UNKNOWN}
     */
    public static PatternType primary(Set<PatternType> types) {
        return PRIORITY.stream().filter(types::contains).findFirst().orElse(PatternType.UNKNOWN);
    }

    /**
     * Percentage change against the previous dated total; {@code 0} when there
     * is no previous total or it is zero.
     */
    static double dayOverDayChange(LocalDate date, NavigableMap<LocalDate, Double> history) {
        Map.Entry<LocalDate, Double> previous = history.lowerEntry(date);
        Double current = history.get(date);
        if (previous == null || current == null || previous.getValue() == 0.0) {
            return 0.0;
        }
        return (current - previous.getValue()) / previous.getValue() * 100.0;
    }

    private static boolean isCyclical(LocalDate date, NavigableMap<LocalDate, Double> history) {
        double overall = average(history.values());
        if (overall <= 0.0) {
            return false;
        }
        double weekdaySum = 0.0;
        int weekdayCount = 0;
        double monthDaySum = 0.0;
        int monthDayCount = 0;
        for (Map.Entry<LocalDate, Double> entry : history.entrySet()) {
            if (entry.getKey().getDayOfWeek() == date.getDayOfWeek()) {
                weekdaySum += entry.getValue();
                weekdayCount++;
            }
            if (entry.getKey().getDayOfMonth() == date.getDayOfMonth()) {
                monthDaySum += entry.getValue();
                monthDayCount++;
            }
        }
        return weekdaySum / weekdayCount / overall > 1.1 || monthDaySum / monthDayCount / overall > 1.1;
    }

    static double average(Collection<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(Double.NaN);
    }
}
