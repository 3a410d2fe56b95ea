package com.costsentinel.core.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A caller-declared event (a migration, a launch, a load test) that may
 * explain a cost anomaly.
 *
 * <p>
 * An empty {@code services} list means the event applies to every service.
 * Extra attributes supplied with the event are kept and echoed back on the
 * resulting probable cause.
 * </p>
 *
 * @since 1.0.0
 */
public final class CustomEvent {

    private final String name;
    private final LocalDate date;
    private final List<String> services;
    private final String description;
    private final Map<String, Object> attributes;

    private CustomEvent(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name must not be null");
        this.date = Objects.requireNonNull(builder.date, "date must not be null for event '" + name + "'");
        this.services = builder.services != null ? List.copyOf(builder.services) : List.of();
        this.description = builder.description;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private LocalDate date;
        private List<String> services;
        private String description;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder date(LocalDate date) {
            this.date = date;
            return this;
        }

        public Builder services(List<String> services) {
            this.services = services;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder attribute(String key, Object value) {
            this.attributes.put(key, value);
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            if (attributes != null) {
                this.attributes.putAll(attributes);
            }
            return this;
        }

        /**
         * @return a new event
         * @throws NullPointerException if {@code name} or {@code date} is missing
         */
        public CustomEvent build() {
            return new CustomEvent(this);
        }
    }

    public String getName() {
        return name;
    }

    public LocalDate getDate() {
        return date;
    }

    public List<String> getServices() {
        return services;
    }

    /**
     * @return the description, or a generated one when none was supplied
     */
    public String getDescription() {
        return description != null ? description : "Custom event: " + name;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    /**
     * @param service service name to test
     * @return {@code true} if the event declares no services or lists this one
     */
    public boolean appliesTo(String service) {
        return services.isEmpty() || services.contains(service);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CustomEvent that))
            return false;
        return Objects.equals(name, that.name)
                && Objects.equals(date, that.date)
                && Objects.equals(services, that.services)
                && Objects.equals(description, that.description)
                && Objects.equals(attributes, that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, date, services, description, attributes);
    }

    @Override
    public String toString() {
        return "CustomEvent{name='" + name + "', date=" + date + ", services=" + services + '}';
    }
}
