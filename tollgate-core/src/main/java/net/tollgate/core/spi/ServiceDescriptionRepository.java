package net.tollgate.core.spi;

import net.tollgate.core.model.ServiceDescription;

import java.util.List;
import java.util.Optional;

public interface ServiceDescriptionRepository {
    Optional<ServiceDescription> findByServiceId(String serviceId) throws Exception;
    List<ServiceDescription> findAll() throws Exception;

    /** 멱등 upsert: serviceId 기반 */
    void save(ServiceDescription description) throws Exception;
}
