package com.costsentinel.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Top-level POJO for the cloud billing taxonomy YAML.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * events:
 *   - provider: AWS
 *     name: reserved_instance_expiration
 *     pattern: step_increase
 *     services: [EC2, RDS, ElastiCache]
 *     timeline: persistent
 * resourcePatterns:
 *   - name: storage_increase
 *     metrics: [storage_gb, storage_operations]
 *     thresholdMultiplier: 2.0
 * serviceCategories:
 *   - name: compute
 *     services: [EC2, VM, Compute Engine]
 *     suggestions: [...]
 *     patternSuggestions:
 *       step_increase: [...]
 * causeSuggestions:
 *   - keywords: [instance_count]
 *     suggestions: [...]
 * causePatterns:
 *   EC2: [...]
 * defaultCauses: [Unknown cause]
 * </pre>
 *
 * <p>
 * The tables are read-only once loaded: every getter returns an
 * unmodifiable view and the loader freezes the setters after
 * {@link #validate()} succeeds.
 * </p>
 *
 * @since 1.0.0
 */
public class CloudTaxonomy extends LoadedTable {

    private List<EventPattern> events = new ArrayList<>();
    private List<ResourcePattern> resourcePatterns = new ArrayList<>();
    private List<ServiceCategory> serviceCategories = new ArrayList<>();
    private List<CauseSuggestion> causeSuggestions = new ArrayList<>();
    private Map<String, List<String>> causePatterns = new LinkedHashMap<>();
    private List<String> defaultCauses = new ArrayList<>(List.of("Unknown cause"));

    // ---------------------------------------------------------------
    // Lookups
    // ---------------------------------------------------------------

    /**
     * @param provider provider name, e.g. {@code AWS}
     * @return the provider's events in declaration order
     */
    public List<EventPattern> eventsFor(String provider) {
        return events.stream()
                .filter(event -> Objects.equals(event.getProvider(), provider))
                .toList();
    }

    /**
     * @param service service name
     * @return the first category listing the service
     */
    public Optional<ServiceCategory> categoryOf(String service) {
        return serviceCategories.stream()
                .filter(category -> category.contains(service))
                .findFirst();
    }

    /**
     * @param service service name
     * @return typical causes for the service, or the default causes
     */
    public List<String> causePatternsFor(String service) {
        List<String> causes = causePatterns.get(service);
        return causes != null ? Collections.unmodifiableList(causes) : getDefaultCauses();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every table. Collects all errors and throws a single
     * exception if any entry is invalid.
     *
     * @throws IllegalStateException if one or more entries are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        for (int i = 0; i < events.size(); i++) {
            Objects.requireNonNull(events.get(i), "Event at index " + i + " is null").validate(errors);
        }
        for (int i = 0; i < resourcePatterns.size(); i++) {
            Objects.requireNonNull(resourcePatterns.get(i), "Resource pattern at index " + i + " is null")
                    .validate(errors);
        }
        for (int i = 0; i < serviceCategories.size(); i++) {
            Objects.requireNonNull(serviceCategories.get(i), "Service category at index " + i + " is null")
                    .validate(errors);
        }
        for (int i = 0; i < causeSuggestions.size(); i++) {
            Objects.requireNonNull(causeSuggestions.get(i), "Cause suggestion at index " + i + " is null")
                    .validate(errors);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Cloud taxonomy validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * Make this taxonomy and every table in it read-only.
     */
    @Override
    void freeze() {
        events.forEach(EventPattern::freeze);
        resourcePatterns.forEach(ResourcePattern::freeze);
        serviceCategories.forEach(ServiceCategory::freeze);
        causeSuggestions.forEach(CauseSuggestion::freeze);
        Map<String, List<String>> copied = new LinkedHashMap<>();
        causePatterns.forEach((service, causes) ->
                copied.put(service, causes != null ? List.copyOf(causes) : List.of()));
        causePatterns = copied;
        super.freeze();
    }

    // ---------------------------------------------------------------
    // Getters / Setters (setters used by SnakeYAML)
    // ---------------------------------------------------------------

    public List<EventPattern> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public void setEvents(List<EventPattern> events) {
        checkMutable();
        this.events = events != null ? new ArrayList<>(events) : new ArrayList<>();
    }

    public List<ResourcePattern> getResourcePatterns() {
        return Collections.unmodifiableList(resourcePatterns);
    }

    public void setResourcePatterns(List<ResourcePattern> resourcePatterns) {
        checkMutable();
        this.resourcePatterns = resourcePatterns != null ? new ArrayList<>(resourcePatterns) : new ArrayList<>();
    }

    public List<ServiceCategory> getServiceCategories() {
        return Collections.unmodifiableList(serviceCategories);
    }

    public void setServiceCategories(List<ServiceCategory> serviceCategories) {
        checkMutable();
        this.serviceCategories = serviceCategories != null ? new ArrayList<>(serviceCategories) : new ArrayList<>();
    }

    public List<CauseSuggestion> getCauseSuggestions() {
        return Collections.unmodifiableList(causeSuggestions);
    }

    public void setCauseSuggestions(List<CauseSuggestion> causeSuggestions) {
        checkMutable();
        this.causeSuggestions = causeSuggestions != null ? new ArrayList<>(causeSuggestions) : new ArrayList<>();
    }

    public Map<String, List<String>> getCausePatterns() {
        return Collections.unmodifiableMap(causePatterns);
    }

    public void setCausePatterns(Map<String, List<String>> causePatterns) {
        checkMutable();
        this.causePatterns = causePatterns != null ? new LinkedHashMap<>(causePatterns) : new LinkedHashMap<>();
    }

    public List<String> getDefaultCauses() {
        return Collections.unmodifiableList(defaultCauses);
    }

    public void setDefaultCauses(List<String> defaultCauses) {
        checkMutable();
        this.defaultCauses = defaultCauses != null && !defaultCauses.isEmpty()
                ? new ArrayList<>(defaultCauses)
                : new ArrayList<>(List.of("Unknown cause"));
    }

    @Override
    public String toString() {
        return "CloudTaxonomy{" +
                "events=" + events.size() +
                ", resourcePatterns=" + resourcePatterns.size() +
                ", serviceCategories=" + serviceCategories.size() +
                ", causeSuggestions=" + causeSuggestions.size() +
                ", causePatterns=" + causePatterns.keySet() +
                '}';
    }
}
