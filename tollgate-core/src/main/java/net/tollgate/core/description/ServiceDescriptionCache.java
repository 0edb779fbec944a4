package net.tollgate.core.description;

import net.tollgate.core.config.RouterSettings;
import net.tollgate.core.model.DistributionScheme;
import net.tollgate.core.model.ServiceDescription;
import net.tollgate.core.spi.Clock;
import net.tollgate.core.spi.ServiceDescriptionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 저장소 앞의 읽기 위주 캐시 (LRU + TTL). 저장소 오류 시 이전 값 또는 기본값을 쓴다.
 */
public final class ServiceDescriptionCache implements ServiceDescriptionLookup {
    private static final Logger log = LoggerFactory.getLogger(ServiceDescriptionCache.class);

    private final ServiceDescriptionRepository repository;
    private final RouterSettings settings;
    private final Clock clock;
    private final Duration ttl;
    private final Map<String, Cached> cache;

    public ServiceDescriptionCache(ServiceDescriptionRepository repository, RouterSettings settings,
                                   Clock clock, Duration ttl, int maxEntries) {
        this.repository = repository;
        this.settings = settings;
        this.clock = clock;
        this.ttl = ttl;
        this.cache = new LruMap<>(maxEntries);
    }

    @Override
    public ServiceDescription describe(String serviceId) {
        Instant now = clock.now();
        Cached cached;
        synchronized (cache) { cached = cache.get(serviceId); }
        if (cached != null && cached.loadedAt.plus(ttl).isAfter(now)) return cached.description;

        ServiceDescription loaded;
        try {
            Optional<ServiceDescription> found = repository.findByServiceId(serviceId);
            loaded = found.orElseGet(() -> defaults(serviceId));
        } catch (Exception e) {
            log.warn("unable to load service description for {}, using {}", serviceId,
                    cached != null ? "stale copy" : "defaults", e);
            return cached != null ? cached.description : defaults(serviceId);
        }
        synchronized (cache) { cache.put(serviceId, new Cached(loaded, now)); }
        return loaded;
    }

    public void invalidate(String serviceId) { synchronized (cache) { cache.remove(serviceId); } }
    public void invalidateAll() { synchronized (cache) { cache.clear(); } }

    public ServiceDescription defaults(String serviceId) {
        return new ServiceDescription(serviceId,
                settings.defaultInterstitialSecs(),
                settings.defaultMaxQueueLength(),
                settings.defaultConcurrencyLevel(),
                DistributionScheme.BALANCED);
    }

    private record Cached(ServiceDescription description, Instant loadedAt) {}

    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K, V> eldest) { return size() > max; }
    }
}
