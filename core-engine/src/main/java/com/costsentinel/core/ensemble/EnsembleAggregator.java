package com.costsentinel.core.ensemble;

import com.costsentinel.core.config.DetectionConfig;
import com.costsentinel.core.detection.DetectorRegistry;
import com.costsentinel.core.model.AnomalyCandidate;
import com.costsentinel.core.model.AnomalyRecord;
import com.costsentinel.core.model.DetectionMethod;
import com.costsentinel.core.model.MethodResult;
import com.costsentinel.core.series.EntityKey;
import com.costsentinel.core.series.NormalizedSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Runs method slots and reconciles their candidates into confirmed records.
 *
 * <h3>Slots</h3>
 * <p>
 * A single-method request runs one slot. An ensemble request always runs
 * z-score and adds every other registered method the series is large enough
 * for (isolation and density from 10 points, decomposition from 14 dated
 * points by default).
 * </p>
 *
 * <h3>Consensus</h3>
 * <p>
 * Candidates are grouped by {@code (date, provider, service)}; the same
 * service under two providers yields two records. A group is confirmed when
 * at least {@code ceil(total / 2)} distinct slots flagged it. The
 * highest-scoring member represents the group; score and baseline are the
 * member averages, and {@code confidence = agreement / total}.
 * </p>
 *
 * <h3>Ordering</h3>
 * <p>
 * Confidence descending, then absolute percentage increase descending, then
 * date, service and provider ascending.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * When constructed with an {@link Executor}, slots run concurrently. Results
 * are merged in slot order, so the output never depends on completion order.
 * </p>
 *
 * @since 1.0.0
 */
public class EnsembleAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(EnsembleAggregator.class);

    static final Comparator<AnomalyRecord> RANKING = Comparator
            .comparingDouble(AnomalyRecord::getConfidence).reversed()
            .thenComparing(Comparator.comparingDouble(
                    (AnomalyRecord r) -> Math.abs(r.getPercentageIncrease())).reversed())
            .thenComparing(AnomalyRecord::getDate, Comparator.nullsLast(Comparator.<LocalDate>naturalOrder()))
            .thenComparing(AnomalyRecord::getService)
            .thenComparing(AnomalyRecord::getProvider);

    private final DetectorRegistry registry;
    private final MethodRunner runner;
    private final DetectionConfig config;
    private final Executor executor;

    /**
     * Sequential aggregator.
     */
    public EnsembleAggregator(DetectorRegistry registry, DetectionConfig config) {
        this(registry, config, null);
    }

    /**
     * @param registry detectors
     * @param config   detection configuration
     * @param executor runs ensemble slots concurrently; {@code null} runs
     *                 them on the calling thread
     */
    public EnsembleAggregator(DetectorRegistry registry, DetectionConfig config, Executor executor) {
        this.registry = Objects.requireNonNull(registry, "DetectorRegistry must not be null");
        this.config = Objects.requireNonNull(config, "DetectionConfig must not be null");
        this.runner = new MethodRunner(registry);
        this.executor = executor;
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Detect and reconcile, honouring entity partitioning when configured.
     *
     * @param method    requested method, possibly {@link DetectionMethod#ENSEMBLE}
     * @param series    normalized series
     * @param threshold sensitivity threshold
     * @return the outcome, never {@code null}
     */
    public AggregationOutcome aggregate(DetectionMethod method, NormalizedSeries series, double threshold) {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(series, "series must not be null");

        if (!config.isPartitionByEntity()) {
            return aggregateSeries(method, series, threshold);
        }

        Map<EntityKey, NormalizedSeries> parts = series.groupByEntity();
        List<AnomalyRecord> records = new ArrayList<>();
        List<MethodResult> slotResults = new ArrayList<>();
        List<String> notes = new ArrayList<>();
        for (Map.Entry<EntityKey, NormalizedSeries> part : parts.entrySet()) {
            AggregationOutcome outcome = aggregateSeries(method, part.getValue(), threshold);
            records.addAll(outcome.getRecords());
            slotResults.addAll(outcome.getSlotResults());
            outcome.getNote().ifPresent(note -> notes.add(part.getKey() + ": " + note));
        }
        records.sort(RANKING);
        LOG.debug("Partitioned detection over {} entit(ies) confirmed {} record(s)", parts.size(), records.size());
        return new AggregationOutcome(records, slotResults, notes.isEmpty() ? null : String.join("; ", notes));
    }

    /**
     * The slots an ensemble request runs for this series, z-score first.
     */
    public List<DetectionMethod> ensembleSlots(NormalizedSeries series) {
        List<DetectionMethod> slots = new ArrayList<>();
        slots.add(DetectionMethod.ZSCORE);
        for (DetectionMethod method : List.of(DetectionMethod.ISOLATION, DetectionMethod.DENSITY,
                DetectionMethod.DECOMPOSITION)) {
            registry.find(method)
                    .filter(detector -> detector.isApplicable(series))
                    .ifPresent(detector -> slots.add(method));
        }
        return slots;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private AggregationOutcome aggregateSeries(DetectionMethod method, NormalizedSeries series, double threshold) {
        List<DetectionMethod> slots = method == DetectionMethod.ENSEMBLE ? ensembleSlots(series) : List.of(method);
        List<MethodResult> results = runSlots(slots, series, threshold);

        if (results.stream().allMatch(MethodResult::isFailed)) {
            String attempted = slots.stream().map(DetectionMethod::getWireName).collect(Collectors.joining(", "));
            return new AggregationOutcome(List.of(), results,
                    "No detection method produced a result (attempted: " + attempted + ")");
        }

        List<AnomalyRecord> records = reconcile(results, method);
        LOG.debug("{} over {} slot(s) confirmed {} record(s)", method.getWireName(), slots.size(), records.size());
        return new AggregationOutcome(records, results, fallbackNote(results));
    }

    private List<MethodResult> runSlots(List<DetectionMethod> slots, NormalizedSeries series, double threshold) {
        if (executor == null || slots.size() == 1) {
            return slots.stream().map(slot -> runner.run(slot, series, threshold)).toList();
        }
        List<CompletableFuture<MethodResult>> futures = slots.stream()
                .map(slot -> CompletableFuture.supplyAsync(() -> runner.run(slot, series, threshold), executor))
                .toList();
        List<MethodResult> results = new ArrayList<>(slots.size());
        for (int i = 0; i < slots.size(); i++) {
            try {
                results.add(futures.get(i).join());
            } catch (CompletionException e) {
                LOG.warn("Slot {} did not complete", slots.get(i).getWireName(), e.getCause());
                results.add(MethodResult.failed(slots.get(i), "Slot did not complete: " + e.getCause()));
            }
        }
        return results;
    }

    /**
     * Group candidates by {@code (date, provider, service)} and keep the groups a
     * majority of slots agree on.
     *
     * @param results      one result per slot, in slot order
     * @param recordMethod method reported on the records
     * @return confirmed records in ranking order
     */
    static List<AnomalyRecord> reconcile(List<MethodResult> results, DetectionMethod recordMethod) {
        int total = results.size();
        int required = (total + 1) / 2;

        Map<GroupKey, List<AnomalyCandidate>> groups = new LinkedHashMap<>();
        for (MethodResult result : results) {
            for (AnomalyCandidate candidate : result.getAnomalies()) {
                GroupKey key = new GroupKey(candidate.getDate(), candidate.getProvider(), candidate.getService());
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(candidate);
            }
        }

        List<AnomalyRecord> records = new ArrayList<>();
        for (List<AnomalyCandidate> members : groups.values()) {
            Set<DetectionMethod> agreeing = new LinkedHashSet<>();
            members.forEach(member -> agreeing.add(member.getMethod()));
            if (agreeing.size() < required) {
                continue;
            }
            records.add(merge(members, agreeing, total, recordMethod));
        }
        records.sort(RANKING);
        return records;
    }

    private static AnomalyRecord merge(List<AnomalyCandidate> members, Set<DetectionMethod> agreeing,
                                      int total, DetectionMethod recordMethod) {
        AnomalyCandidate representative = members.get(0);
        double scoreSum = 0.0;
        double baselineSum = 0.0;
        for (AnomalyCandidate member : members) {
            if (member.getScore() > representative.getScore()) {
                representative = member;
            }
            scoreSum += member.getScore();
            baselineSum += member.getBaselineCost();
        }
        return AnomalyRecord.builder()
                .date(representative.getDate())
                .service(representative.getService())
                .provider(representative.getProvider())
                .cost(representative.getCost())
                .baselineCost(baselineSum / members.size())
                .anomalyScore(scoreSum / members.size())
                .detectionMethod(recordMethod)
                .detectionMethods(List.copyOf(agreeing))
                .methodsAgreement(agreeing.size())
                .methodsTotal(total)
                .build();
    }

    private static String fallbackNote(List<MethodResult> results) {
        List<String> notes = new ArrayList<>();
        for (MethodResult result : results) {
            if (result.getOutcome() == MethodResult.Outcome.FALLBACK) {
                notes.add(result.getMethod().getWireName() + " replaced by z-score ("
                        + result.getMessage().orElse("no reason given") + ")");
            } else if (result.isFailed()) {
                notes.add(result.getMethod().getWireName() + " failed ("
                        + result.getMessage().orElse("no reason given") + ")");
            }
        }
        return notes.isEmpty() ? null : String.join("; ", notes);
    }

    private static final class GroupKey {

        private final LocalDate date;
        private final String provider;
        private final String service;

        GroupKey(LocalDate date, String provider, String service) {
            this.date = date;
            this.provider = provider;
            this.service = service;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof GroupKey that))
                return false;
            return Objects.equals(date, that.date)
                    && Objects.equals(provider, that.provider)
                    && Objects.equals(service, that.service);
        }

        @Override
        public int hashCode() {
            return Objects.hash(date, provider, service);
        }
    }
}
