package com.costsentinel.core.context;

import com.costsentinel.core.config.CloudTaxonomy;
import com.costsentinel.core.model.AnomalyRecord;
import com.costsentinel.core.model.CloudContext;
import com.costsentinel.core.model.CustomEvent;
import com.costsentinel.core.model.PatternType;
import com.costsentinel.core.model.ProbableCause;
import com.costsentinel.core.model.RelatedService;
import com.costsentinel.core.model.UtilizationObservation;
import com.costsentinel.core.series.EntityKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the {@link CloudContext} of a confirmed anomaly.
 *
 * <h3>Steps</h3>
 * <ol>
 * <li>Classify the cost movement ({@link PatternClassifier}).</li>
 * <li>Match provider billing events ({@link TaxonomyMatcher}).</li>
 * <li>Correlate utilization, when supplied ({@link UtilizationCorrelator}).</li>
 * <li>Match caller events, when supplied ({@link CustomEventMatcher}); these
 * rank ahead of every other cause.</li>
 * <li>Find co-moving services ({@link RelatedServiceFinder}).</li>
 * <li>Suggest mitigations ({@link MitigationAdvisor}).</li>
 * </ol>
 *
 * <p>
 * A failure while explaining one record yields an empty context for that
 * record only and is logged at WARN.
 * </p>
 *
 * @since 1.0.0
 */
public class CloudContextAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(CloudContextAnalyzer.class);

    private static final Comparator<ProbableCause> BY_CONFIDENCE =
            Comparator.comparingInt((ProbableCause cause) -> cause.getConfidence().rank()).reversed();

    private final PatternClassifier classifier;
    private final TaxonomyMatcher taxonomyMatcher;
    private final UtilizationCorrelator utilizationCorrelator;
    private final CustomEventMatcher customEventMatcher;
    private final RelatedServiceFinder relatedServiceFinder;
    private final MitigationAdvisor mitigationAdvisor;

    public CloudContextAnalyzer(CloudTaxonomy taxonomy) {
        Objects.requireNonNull(taxonomy, "CloudTaxonomy must not be null");
        this.classifier = new PatternClassifier();
        this.taxonomyMatcher = new TaxonomyMatcher(taxonomy);
        this.utilizationCorrelator = new UtilizationCorrelator(taxonomy.getResourcePatterns());
        this.customEventMatcher = new CustomEventMatcher();
        this.relatedServiceFinder = new RelatedServiceFinder();
        this.mitigationAdvisor = new MitigationAdvisor(taxonomy);
    }

    /**
     * @param record      confirmed anomaly
     * @param history     daily totals of the whole batch
     * @param utilization utilization rows, possibly empty
     * @param events      caller events, possibly empty
     * @return the context, {@link CloudContext#empty()} on failure
     */
    public CloudContext analyze(AnomalyRecord record, ServiceHistory history,
                                List<UtilizationObservation> utilization, List<CustomEvent> events) {
        try {
            return explain(record, history, utilization, events);
        } catch (RuntimeException e) {
            LOG.warn("Cloud context analysis failed for {} {} on {}; continuing without context",
                    record.getProvider(), record.getService(), record.getDate(), e);
            return CloudContext.empty();
        }
    }

    private CloudContext explain(AnomalyRecord record, ServiceHistory history,
                                 List<UtilizationObservation> utilization, List<CustomEvent> events) {
        String service = record.getService();
        Set<PatternType> patterns = classifier.classify(record.getDate(),
                history.dailyTotals(record.getProvider(), service));
        PatternType patternType = PatternClassifier.primary(patterns);

        List<ProbableCause> causes = new ArrayList<>(customEventMatcher.match(record.getDate(), service, events));
        causes.addAll(taxonomyMatcher.match(record.getProvider(), service, patterns));

        List<String> affected = List.of();
        if (utilization != null && !utilization.isEmpty()) {
            UtilizationCorrelator.Correlation correlation =
                    utilizationCorrelator.correlate(record.getDate(), service, utilization);
            causes.addAll(correlation.getCauses());
            affected = correlation.getAffectedResources();
        }
        // stable, so custom events stay first among very-high causes
        causes.sort(BY_CONFIDENCE);

        List<RelatedService> related = relatedServiceFinder.find(record.getDate(),
                new EntityKey(record.getProvider(), service), history);
        List<String> mitigations = mitigationAdvisor.advise(service, patternType, causes);

        LOG.debug("Context for {}/{} on {}: patterns={}, causes={}, related={}",
                record.getProvider(), service, record.getDate(), patterns, causes.size(), related.size());
        return new CloudContext(causes, patternType, affected, related, mitigations);
    }
}
