package com.costsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Cloud-specific explanation bundle attached to a confirmed anomaly:
 * probable causes ordered by confidence, the recognised cost-change pattern,
 * affected resources, co-moving services and mitigation suggestions.
 *
 * @since 1.0.0
 */
public final class CloudContext {

    private static final CloudContext EMPTY = new CloudContext(
            List.of(), PatternType.UNKNOWN, List.of(), List.of(), List.of());

    private final List<ProbableCause> probableCauses;
    private final PatternType patternType;
    private final List<String> affectedResources;
    private final List<RelatedService> relatedServices;
    private final List<String> mitigationSuggestions;

    public CloudContext(List<ProbableCause> probableCauses, PatternType patternType,
                        List<String> affectedResources, List<RelatedService> relatedServices,
                        List<String> mitigationSuggestions) {
        this.probableCauses = List.copyOf(probableCauses);
        this.patternType = Objects.requireNonNull(patternType, "patternType must not be null");
        this.affectedResources = List.copyOf(affectedResources);
        this.relatedServices = List.copyOf(relatedServices);
        this.mitigationSuggestions = List.copyOf(mitigationSuggestions);
    }

    /**
     * @return the context reported when analysis could not be completed
     */
    public static CloudContext empty() {
        return EMPTY;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return probableCauses.isEmpty() && affectedResources.isEmpty()
                && relatedServices.isEmpty() && mitigationSuggestions.isEmpty()
                && patternType == PatternType.UNKNOWN;
    }

    @JsonProperty("probable_causes")
    public List<ProbableCause> getProbableCauses() {
        return probableCauses;
    }

    @JsonProperty("pattern_type")
    public PatternType getPatternType() {
        return patternType;
    }

    @JsonProperty("affected_resources")
    public List<String> getAffectedResources() {
        return affectedResources;
    }

    @JsonProperty("related_services")
    public List<RelatedService> getRelatedServices() {
        return relatedServices;
    }

    @JsonProperty("mitigation_suggestions")
    public List<String> getMitigationSuggestions() {
        return mitigationSuggestions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CloudContext that))
            return false;
        return Objects.equals(probableCauses, that.probableCauses)
                && patternType == that.patternType
                && Objects.equals(affectedResources, that.affectedResources)
                && Objects.equals(relatedServices, that.relatedServices)
                && Objects.equals(mitigationSuggestions, that.mitigationSuggestions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(probableCauses, patternType, affectedResources, relatedServices,
                mitigationSuggestions);
    }

    @Override
    public String toString() {
        return "CloudContext{" +
                "causes=" + probableCauses.size() +
                ", patternType=" + patternType +
                ", affectedResources=" + affectedResources +
                ", relatedServices=" + relatedServices.size() +
                ", suggestions=" + mitigationSuggestions.size() +
                '}';
    }
}
