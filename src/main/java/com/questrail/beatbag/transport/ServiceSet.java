package com.questrail.beatbag.transport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * ServiceSet
 * -----------------------------------------------------------------------------
 * Immutable result of service discovery: each advertised service identifier
 * mapped to the characteristic identifiers it groups.
 *
 * <p>Iteration order is advertisement order, which is also the order in which
 * services are probed when the expected service is absent.</p>
 */
public final class ServiceSet
{
    private static final ServiceSet EMPTY = new ServiceSet(Map.of());

    private final Map<UUID, Set<UUID>> services;

    private ServiceSet(Map<UUID, Set<UUID>> services)
    {
        Map<UUID, Set<UUID>> copy = new LinkedHashMap<>();
        services.forEach((service, characteristics) ->
                copy.put(service, Collections.unmodifiableSet(new LinkedHashSet<>(characteristics))));
        this.services = Collections.unmodifiableMap(copy);
    }

    public static ServiceSet empty()
    {
        return EMPTY;
    }

    /**
     * Returns advertised service identifiers in advertisement order.
     */
    public List<UUID> serviceIds()
    {
        return List.copyOf(services.keySet());
    }

    public boolean containsService(UUID service)
    {
        return services.containsKey(service);
    }

    /**
     * Returns the characteristics of {@code service}, or an empty set if the
     * service was not advertised.
     */
    public Set<UUID> characteristicsOf(UUID service)
    {
        return services.getOrDefault(service, Set.of());
    }

    public boolean hasCharacteristic(UUID service, UUID characteristic)
    {
        return characteristicsOf(service).contains(characteristic);
    }

    public boolean isEmpty()
    {
        return services.isEmpty();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof ServiceSet other)) return false;
        return services.equals(other.services);
    }

    @Override
    public int hashCode()
    {
        return services.hashCode();
    }

    @Override
    public String toString()
    {
        return "ServiceSet" + services;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private final Map<UUID, Set<UUID>> services = new LinkedHashMap<>();

        public Builder addService(UUID service, UUID... characteristics)
        {
            Objects.requireNonNull(service, "service");
            Set<UUID> set = services.computeIfAbsent(service, s -> new LinkedHashSet<>());
            for (UUID c : characteristics) {
                set.add(Objects.requireNonNull(c, "characteristic"));
            }
            return this;
        }

        public ServiceSet build()
        {
            return new ServiceSet(services);
        }
    }
}
