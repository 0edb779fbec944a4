package net.tollgate.core.description;

import net.tollgate.core.model.ServiceDescription;
import net.tollgate.core.spi.ServiceDescriptionRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public final class InMemoryServiceDescriptionRepository implements ServiceDescriptionRepository {
    private final Map<String, ServiceDescription> descriptions = new ConcurrentHashMap<>();

    @Override public Optional<ServiceDescription> findByServiceId(String serviceId) {
        return Optional.ofNullable(descriptions.get(serviceId));
    }

    @Override public List<ServiceDescription> findAll() {
        return descriptions.values().stream()
                .sorted(Comparator.comparing(ServiceDescription::serviceId))
                .collect(Collectors.toList());
    }

    @Override public void save(ServiceDescription description) {
        descriptions.put(description.serviceId(), description);
    }
}
