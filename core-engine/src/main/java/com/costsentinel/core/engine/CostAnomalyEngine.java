package com.costsentinel.core.engine;

import com.costsentinel.core.config.CloudTaxonomy;
import com.costsentinel.core.config.DetectionConfig;
import com.costsentinel.core.config.TaxonomyLoader;
import com.costsentinel.core.context.CloudContextAnalyzer;
import com.costsentinel.core.context.RootCauseAnalyzer;
import com.costsentinel.core.context.ServiceHistory;
import com.costsentinel.core.detection.DetectorRegistry;
import com.costsentinel.core.ensemble.AggregationOutcome;
import com.costsentinel.core.ensemble.EnsembleAggregator;
import com.costsentinel.core.model.AnomalyRecord;
import com.costsentinel.core.model.CostObservation;
import com.costsentinel.core.model.DetectionMethod;
import com.costsentinel.core.model.DetectionRequest;
import com.costsentinel.core.model.DetectionResult;
import com.costsentinel.core.series.NormalizedSeries;
import com.costsentinel.core.series.SeriesNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Entry point: detects cost anomalies in a batch and explains them.
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li>Resolve the method (unknown names run z-score) and the threshold.</li>
 * <li>Normalize the observations; too few points end the run with a note.</li>
 * <li>Run the method or the ensemble under the fallback policy.</li>
 * <li>Attach root causes and, when requested, cloud context.</li>
 * <li>Assemble the result envelope.</li>
 * </ol>
 *
 * <h3>Error Handling</h3>
 * <p>
 * {@link #detect(DetectionRequest)} never throws. Recovered failures are
 * reported in the result's note; anything unexpected becomes an error result
 * and is logged at ERROR.
 * </p>
 *
 * <p>
 * The engine keeps no state between calls and may be shared across threads.
 * </p>
 *
 * @since 1.0.0
 */
public class CostAnomalyEngine {

    private static final Logger LOG = LoggerFactory.getLogger(CostAnomalyEngine.class);

    private final DetectionConfig config;
    private final SeriesNormalizer normalizer;
    private final EnsembleAggregator aggregator;
    private final RootCauseAnalyzer rootCauseAnalyzer;
    private final CloudContextAnalyzer contextAnalyzer;
    private final ResultAssembler assembler;

    /**
     * Engine configured from the environment with the resolved taxonomy.
     *
     * @throws IllegalArgumentException if an environment value is malformed
     * @throws IllegalStateException    if the taxonomy is invalid
     */
    public CostAnomalyEngine() {
        this(DetectionConfig.fromEnvironment());
    }

    public CostAnomalyEngine(DetectionConfig config) {
        this(config, TaxonomyLoader.load(config));
    }

    public CostAnomalyEngine(DetectionConfig config, CloudTaxonomy taxonomy) {
        this(config, taxonomy, Clock.systemUTC(), null);
    }

    /**
     * @param config   detection configuration
     * @param taxonomy cloud billing taxonomy
     * @param clock    stamps each result
     * @param executor runs ensemble slots concurrently; {@code null} for the
     *                 calling thread
     */
    public CostAnomalyEngine(DetectionConfig config, CloudTaxonomy taxonomy, Clock clock, Executor executor) {
        this.config = Objects.requireNonNull(config, "DetectionConfig must not be null");
        Objects.requireNonNull(taxonomy, "CloudTaxonomy must not be null");
        this.normalizer = new SeriesNormalizer(config);
        this.aggregator = new EnsembleAggregator(DetectorRegistry.standard(config), config, executor);
        this.rootCauseAnalyzer = new RootCauseAnalyzer(taxonomy);
        this.contextAnalyzer = new CloudContextAnalyzer(taxonomy);
        this.assembler = new ResultAssembler(clock);
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Convenience overload without side data.
     *
     * @param observations     cost observations
     * @param method           method name, {@code null} for the ensemble
     * @param threshold        sensitivity, {@code null} for the default
     * @param analyzeRootCause whether to explain the anomalies
     * @return the result, never {@code null}
     */
    public DetectionResult detect(List<CostObservation> observations, String method,
                                  Double threshold, boolean analyzeRootCause) {
        DetectionRequest.Builder builder = DetectionRequest.builder()
                .observations(observations)
                .threshold(threshold)
                .analyzeRootCause(analyzeRootCause);
        if (method != null) {
            builder.methodName(method);
        }
        return detect(builder.build());
    }

    /**
     * @param request detection request; must not be {@code null}
     * @return the result, never {@code null}
     */
    public DetectionResult detect(DetectionRequest request) {
        Objects.requireNonNull(request, "DetectionRequest must not be null");
        DetectionMethod method = resolveMethod(request);
        double threshold = request.getThreshold().orElse(config.getDefaultThreshold());
        int dataPoints = request.getObservations().size();

        try {
            if (!(threshold > 0.0) || Double.isInfinite(threshold)) {
                return assembler.failure(method, threshold, dataPoints, List.of(),
                        "Threshold must be a positive number, got: " + threshold);
            }
            return run(request, method, threshold, dataPoints);
        } catch (RuntimeException e) {
            LOG.error("Anomaly detection failed ({} over {} point(s))", method.getWireName(), dataPoints, e);
            return assembler.failure(method, threshold, dataPoints, List.of(),
                    "Anomaly detection failed: " + e.getMessage());
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private DetectionResult run(DetectionRequest request, DetectionMethod method, double threshold, int dataPoints) {
        Optional<NormalizedSeries> normalized = normalizer.normalize(request.getObservations(),
                request.isAnalyzeRootCause());
        if (normalized.isEmpty()) {
            int required = config.requiredDataPoints(request.isAnalyzeRootCause());
            LOG.info("Skipping detection: {} point(s), {} required", dataPoints, required);
            return assembler.insufficientData(method, threshold, dataPoints, required);
        }
        NormalizedSeries series = normalized.get();

        AggregationOutcome outcome = aggregator.aggregate(method, series, threshold);
        if (method != DetectionMethod.ENSEMBLE && outcome.isAllFailed()) {
            String error = outcome.getSlotResults().stream()
                    .map(result -> result.getMessage().orElse(result.getMethod().getWireName() + " failed"))
                    .distinct()
                    .reduce((a, b) -> a + "; " + b)
                    .orElse("Detection failed");
            LOG.error("Detection with {} failed: {}", method.getWireName(), error);
            return assembler.failure(method, threshold, dataPoints, outcome.getMethodsRun(), error);
        }

        List<AnomalyRecord> records = outcome.getRecords();
        boolean contextApplied = false;
        if (request.isAnalyzeRootCause() && !records.isEmpty()) {
            records = explain(records, series, request);
            contextApplied = request.isAnalyzeCloudContext();
        }

        LOG.info("Detected {} anomal(ies) in {} point(s) with {} (threshold={}, methods={})",
                records.size(), dataPoints, method.getWireName(), threshold, outcome.getMethodsRun());
        return assembler.success(method, threshold, dataPoints, outcome, records, contextApplied);
    }

    private List<AnomalyRecord> explain(List<AnomalyRecord> records, NormalizedSeries series,
                                        DetectionRequest request) {
        ServiceHistory history = ServiceHistory.of(series);
        List<AnomalyRecord> explained = new ArrayList<>(records.size());
        for (AnomalyRecord record : records) {
            AnomalyRecord current = record;
            try {
                current = current.withRootCause(rootCauseAnalyzer.analyze(current, history));
            } catch (RuntimeException e) {
                LOG.warn("Root cause analysis failed for {} {} on {}",
                        record.getProvider(), record.getService(), record.getDate(), e);
            }
            if (request.isAnalyzeCloudContext()) {
                current = current.withCloudContext(contextAnalyzer.analyze(current, history,
                        request.getUtilization(), request.getCustomEvents()));
            }
            explained.add(current);
        }
        return explained;
    }

    private static DetectionMethod resolveMethod(DetectionRequest request) {
        Optional<DetectionMethod> method = request.getMethod();
        if (method.isEmpty()) {
            LOG.warn("Unknown detection method '{}'; using {}", request.getMethodName(),
                    DetectionMethod.ZSCORE.getWireName());
            return DetectionMethod.ZSCORE;
        }
        return method.get();
    }
}
