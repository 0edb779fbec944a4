package net.tollgate.bootstrap.catalog;

import net.tollgate.bootstrap.props.TollgateProperties;
import net.tollgate.core.config.RouterSettings;
import net.tollgate.core.description.ServiceDescriptionCache;
import net.tollgate.core.model.DistributionScheme;
import net.tollgate.core.model.ServiceDescription;
import net.tollgate.core.spi.ServiceDescriptionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** 설정의 서비스 설명을 저장소에 올린다 (멱등) */
public class ServiceCatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(ServiceCatalogRegistrar.class);

    private final ServiceDescriptionRepository repository;
    private final ServiceDescriptionCache cache;
    private final RouterSettings settings;

    public ServiceCatalogRegistrar(ServiceDescriptionRepository repository,
                                   ServiceDescriptionCache cache,
                                   RouterSettings settings) {
        this.repository = repository;
        this.cache = cache;
        this.settings = settings;
    }

    public int register(TollgateProperties.Catalog catalog) throws Exception {
        int n = 0;
        for (var def : catalog.getServices()) {
            ServiceDescription d = toDescription(def);
            repository.save(d);
            cache.invalidate(d.serviceId());
            n++;
            log.info("Catalog registered: service='{}' interstitialSecs={} maxQueueLength={} concurrencyLevel={} scheme={}",
                    d.serviceId(), d.interstitialSecs(), d.maxQueueLength(), d.concurrencyLevel(), d.distributionScheme().code());
        }
        return n;
    }

    ServiceDescription toDescription(TollgateProperties.ServiceDef def) {
        if (def.getServiceId() == null || def.getServiceId().isBlank()) {
            throw new IllegalArgumentException("service.serviceId is required");
        }
        return new ServiceDescription(
                def.getServiceId(),
                def.getInterstitialSecs() != null ? def.getInterstitialSecs() : settings.defaultInterstitialSecs(),
                def.getMaxQueueLength() != null ? def.getMaxQueueLength() : settings.defaultMaxQueueLength(),
                def.getConcurrencyLevel() != null ? def.getConcurrencyLevel() : settings.defaultConcurrencyLevel(),
                DistributionScheme.from(def.getDistributionScheme()));
    }
}
