package com.costsentinel.core.context;

import com.costsentinel.core.config.CauseSuggestion;
import com.costsentinel.core.config.CloudTaxonomy;
import com.costsentinel.core.model.PatternType;
import com.costsentinel.core.model.ProbableCause;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Suggests actions for an explained anomaly.
 *
 * <ol>
 * <li>General advice for the service's category (compute, storage,
 * database), plus the category's advice for the classified pattern.</li>
 * <li>For each cause, most confident first, the advice of the first
 * cause-keyword entry that matches its name.</li>
 * </ol>
 * Duplicates are dropped; the first occurrence keeps its place.
 *
 * @since 1.0.0
 */
public class MitigationAdvisor {

    private final CloudTaxonomy taxonomy;

    public MitigationAdvisor(CloudTaxonomy taxonomy) {
        this.taxonomy = Objects.requireNonNull(taxonomy, "CloudTaxonomy must not be null");
    }

    /**
     * @param service service of the anomaly
     * @param pattern primary classified pattern
     * @param causes  causes already ordered by confidence
     * @return distinct suggestions in first-seen order
     */
    public List<String> advise(String service, PatternType pattern, List<ProbableCause> causes) {
        Set<String> suggestions = new LinkedHashSet<>();
        taxonomy.categoryOf(service).ifPresent(category -> {
            suggestions.addAll(category.getSuggestions());
            suggestions.addAll(category.suggestionsFor(pattern.getValue()));
        });
        for (ProbableCause cause : causes) {
            taxonomy.getCauseSuggestions().stream()
                    .filter(entry -> entry.matches(cause.getCause()))
                    .findFirst()
                    .map(CauseSuggestion::getSuggestions)
                    .ifPresent(suggestions::addAll);
        }
        return new ArrayList<>(suggestions);
    }
}
