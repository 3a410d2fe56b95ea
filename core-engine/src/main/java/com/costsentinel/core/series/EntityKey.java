package com.costsentinel.core.series;

import java.util.Objects;

/**
 * Identity of one billed entity: a service under a provider.
 *
 * @since 1.0.0
 */
public final class EntityKey {

    private final String provider;
    private final String service;

    public EntityKey(String provider, String service) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.service = Objects.requireNonNull(service, "service must not be null");
    }

    public String getProvider() {
        return provider;
    }

    public String getService() {
        return service;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EntityKey that))
            return false;
        return provider.equals(that.provider) && service.equals(that.service);
    }

    @Override
    public int hashCode() {
        return Objects.hash(provider, service);
    }

    @Override
    public String toString() {
        return provider + "/" + service;
    }
}
