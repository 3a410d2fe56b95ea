package com.costsentinel.core.config;

import com.costsentinel.core.model.EventTimeline;
import com.costsentinel.core.model.PatternType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A provider billing event known to produce a characteristic cost pattern,
 * e.g. an AWS reserved-instance expiration producing a step increase on EC2.
 *
 * <p>
 * The special service name {@value #ALL_SERVICES} makes the event apply to
 * every service of its provider.
 * </p>
 *
 * @since 1.0.0
 */
public class EventPattern extends LoadedTable {

    /** Service wildcard. */
    public static final String ALL_SERVICES = "All";

    private String provider;
    private String name;
    private String pattern;
    private List<String> services = new ArrayList<>();
    private String timeline;
    private String period;

    /**
     * @param service the anomaly's service
     * @return {@code true} if the service is listed explicitly
     */
    public boolean lists(String service) {
        return services.contains(service);
    }

    /**
     * @param service the anomaly's service
     * @return {@code true} if the event covers the service, explicitly or via
     *         the wildcard
     */
    public boolean appliesTo(String service) {
        return lists(service) || services.contains(ALL_SERVICES);
    }

    public PatternType patternType() {
        return PatternType.fromValue(pattern);
    }

    public EventTimeline timelineType() {
        return EventTimeline.fromValue(timeline);
    }

    /**
     * Collect validation errors for this event.
     *
     * @param errors sink for error messages
     */
    void validate(List<String> errors) {
        if (provider == null || provider.isBlank()) {
            errors.add("Event '" + name + "' requires 'provider'");
        }
        if (name == null || name.isBlank()) {
            errors.add("Event for provider '" + provider + "' requires 'name'");
        }
        if (services.isEmpty()) {
            errors.add("Event '" + name + "' requires at least one service");
        }
        try {
            if (patternType() == PatternType.UNKNOWN) {
                errors.add("Event '" + name + "' must declare a concrete pattern");
            }
        } catch (IllegalArgumentException e) {
            errors.add("Event '" + name + "': " + e.getMessage());
        }
        try {
            timelineType();
        } catch (IllegalArgumentException e) {
            errors.add("Event '" + name + "': " + e.getMessage());
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        checkMutable();
        this.provider = provider;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        checkMutable();
        this.name = name;
    }

    public String getPattern() {
        return pattern;
    }

    public void setPattern(String pattern) {
        checkMutable();
        this.pattern = pattern;
    }

    public List<String> getServices() {
        return Collections.unmodifiableList(services);
    }

    public void setServices(List<String> services) {
        checkMutable();
        this.services = services != null ? new ArrayList<>(services) : new ArrayList<>();
    }

    public String getTimeline() {
        return timeline;
    }

    public void setTimeline(String timeline) {
        checkMutable();
        this.timeline = timeline;
    }

    public String getPeriod() {
        return period;
    }

    public void setPeriod(String period) {
        checkMutable();
        this.period = period;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EventPattern that))
            return false;
        return Objects.equals(provider, that.provider) && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(provider, name);
    }

    @Override
    public String toString() {
        return "EventPattern{" +
                "provider='" + provider + '\'' +
                ", name='" + name + '\'' +
                ", pattern='" + pattern + '\'' +
                ", services=" + services +
                ", timeline='" + timeline + '\'' +
                '}';
    }
}
