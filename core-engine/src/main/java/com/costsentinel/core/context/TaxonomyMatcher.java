package com.costsentinel.core.context;

import com.costsentinel.core.config.CloudTaxonomy;
import com.costsentinel.core.config.EventPattern;
import com.costsentinel.core.model.CauseConfidence;
import com.costsentinel.core.model.PatternType;
import com.costsentinel.core.model.ProbableCause;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Matches a classified anomaly against the provider's known billing events.
 *
 * <p>
 * An event applies when it lists the service (confidence {@code high}) or
 * applies to {@code All} services (confidence {@code medium}), and its
 * pattern is among the classified patterns.
 * </p>
 *
 * @since 1.0.0
 */
public class TaxonomyMatcher {

    private final CloudTaxonomy taxonomy;

    public TaxonomyMatcher(CloudTaxonomy taxonomy) {
        this.taxonomy = Objects.requireNonNull(taxonomy, "CloudTaxonomy must not be null");
    }

    /**
     * @param provider anomaly provider
     * @param service  anomaly service
     * @param patterns classified patterns
     * @return matching events as causes, in taxonomy order
     */
    public List<ProbableCause> match(String provider, String service, Set<PatternType> patterns) {
        List<ProbableCause> causes = new ArrayList<>();
        if (patterns.isEmpty()) {
            return causes;
        }
        for (EventPattern event : taxonomy.eventsFor(provider)) {
            if (!event.appliesTo(service) || !patterns.contains(event.patternType())) {
                continue;
            }
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("provider", event.getProvider());
            info.put("timeline", event.getTimeline());
            if (event.getPeriod() != null) {
                info.put("period", event.getPeriod());
            }
            causes.add(new ProbableCause(
                    event.getName(),
                    event.lists(service) ? CauseConfidence.HIGH : CauseConfidence.MEDIUM,
                    "Detected " + event.getPattern() + " pattern typical of " + event.getName(),
                    ProbableCause.Source.CLOUD_EVENT,
                    info));
        }
        return causes;
    }
}
