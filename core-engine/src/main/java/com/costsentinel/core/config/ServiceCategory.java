package com.costsentinel.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A family of equivalent services across providers (compute, storage,
 * database) with the mitigation advice that applies to all of them.
 *
 * <p>
 * {@code patternSuggestions} adds advice only when the anomaly was classified
 * with the given pattern, keyed by the pattern's taxonomy spelling.
 * </p>
 *
 * @since 1.0.0
 */
public class ServiceCategory extends LoadedTable {

    private String name;
    private List<String> services = new ArrayList<>();
    private List<String> suggestions = new ArrayList<>();
    private Map<String, List<String>> patternSuggestions = new LinkedHashMap<>();

    void validate(List<String> errors) {
        if (name == null || name.isBlank()) {
            errors.add("Service category requires 'name'");
        }
        if (services.isEmpty()) {
            errors.add("Service category '" + name + "' requires at least one service");
        }
    }

    public boolean contains(String service) {
        return services.contains(service);
    }

    /**
     * @param pattern taxonomy spelling of the classified pattern
     * @return extra suggestions for that pattern, possibly empty
     */
    public List<String> suggestionsFor(String pattern) {
        List<String> extra = patternSuggestions.get(pattern);
        return extra != null ? Collections.unmodifiableList(extra) : List.of();
    }

    @Override
    void freeze() {
        Map<String, List<String>> copied = new LinkedHashMap<>();
        patternSuggestions.forEach((pattern, extra) ->
                copied.put(pattern, extra != null ? List.copyOf(extra) : List.of()));
        patternSuggestions = copied;
        super.freeze();
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        checkMutable();
        this.name = name;
    }

    public List<String> getServices() {
        return Collections.unmodifiableList(services);
    }

    public void setServices(List<String> services) {
        checkMutable();
        this.services = services != null ? new ArrayList<>(services) : new ArrayList<>();
    }

    public List<String> getSuggestions() {
        return Collections.unmodifiableList(suggestions);
    }

    public void setSuggestions(List<String> suggestions) {
        checkMutable();
        this.suggestions = suggestions != null ? new ArrayList<>(suggestions) : new ArrayList<>();
    }

    public Map<String, List<String>> getPatternSuggestions() {
        return Collections.unmodifiableMap(patternSuggestions);
    }

    public void setPatternSuggestions(Map<String, List<String>> patternSuggestions) {
        checkMutable();
        this.patternSuggestions = patternSuggestions != null
                ? new LinkedHashMap<>(patternSuggestions)
                : new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "ServiceCategory{name='" + name + "', services=" + services + '}';
    }
}
