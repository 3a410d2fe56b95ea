package com.costsentinel.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mitigation advice triggered when a probable cause's name contains one of
 * the keywords, e.g. {@code data_transfer} in {@code data_transfer_spike}.
 *
 * @since 1.0.0
 */
public class CauseSuggestion extends LoadedTable {

    private List<String> keywords = new ArrayList<>();
    private List<String> suggestions = new ArrayList<>();

    void validate(List<String> errors) {
        if (keywords.isEmpty()) {
            errors.add("Cause suggestion requires at least one keyword");
        }
        if (suggestions.isEmpty()) {
            errors.add("Cause suggestion " + keywords + " requires at least one suggestion");
        }
    }

    /**
     * @param causeName name of a probable cause
     * @return {@code true} if any keyword occurs in the name
     */
    public boolean matches(String causeName) {
        if (causeName == null) {
            return false;
        }
        return keywords.stream().anyMatch(causeName::contains);
    }

    public List<String> getKeywords() {
        return Collections.unmodifiableList(keywords);
    }

    public void setKeywords(List<String> keywords) {
        checkMutable();
        this.keywords = keywords != null ? new ArrayList<>(keywords) : new ArrayList<>();
    }

    public List<String> getSuggestions() {
        return Collections.unmodifiableList(suggestions);
    }

    public void setSuggestions(List<String> suggestions) {
        checkMutable();
        this.suggestions = suggestions != null ? new ArrayList<>(suggestions) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "CauseSuggestion{keywords=" + keywords + '}';
    }
}
