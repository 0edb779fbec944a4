package net.tollgate.bootstrap.autoconfigure;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import net.tollgate.bootstrap.catalog.ServiceCatalogRegistrar;
import net.tollgate.bootstrap.props.TollgateProperties;
import net.tollgate.core.config.RouterSettings;
import net.tollgate.core.description.InMemoryServiceDescriptionRepository;
import net.tollgate.core.description.ServiceDescriptionCache;
import net.tollgate.core.dispatch.InstanceRpcDispatcher;
import net.tollgate.core.interstitial.InterstitialFilter;
import net.tollgate.core.interstitial.InterstitialGate;
import net.tollgate.core.maintenance.MaintenanceService;
import net.tollgate.core.model.SchedulerSnapshot;
import net.tollgate.core.scheduler.SchedulerSyncer;
import net.tollgate.core.service.RouterControlService;
import net.tollgate.core.service.TollgateRouter;
import net.tollgate.core.spi.Clock;
import net.tollgate.core.spi.ClusterState;
import net.tollgate.core.spi.MetricsSink;
import net.tollgate.core.spi.RouterTransport;
import net.tollgate.core.spi.SchedulerClient;
import net.tollgate.core.spi.ServiceDescriptionRepository;
import net.tollgate.core.workstealing.WorkStealingCoordinator;
import net.tollgate.integration.spring.TollgateSpringConfig;
import net.tollgate.integration.spring.sched.TollgateSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@AutoConfiguration
@EnableConfigurationProperties(TollgateProperties.class)
@Import(TollgateSpringConfig.class) // integration-spring: clock/metrics wiring
public class TollgateAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(TollgateAutoConfiguration.class);

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry tollgateMeterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean(ServiceDescriptionRepository.class)
    public ServiceDescriptionRepository serviceDescriptionRepository() {
        return new InMemoryServiceDescriptionRepository();
    }

    @Bean
    @ConditionalOnMissingBean(SchedulerClient.class)
    public SchedulerClient schedulerClient(Clock clock) {
        // 오케스트레이터 드라이버는 앱이 제공한다. 없으면 빈 상태만 보고
        log.warn("no SchedulerClient bean configured, the router will not see any service instances");
        return () -> new SchedulerSnapshot(Set.of(), Map.of(), clock.now());
    }

    // --- 코어 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public RouterSettings routerSettings(TollgateProperties props) {
        var b = RouterSettings.builder()
                .blacklistBackoffBaseTime(Duration.ofMillis(props.getBlacklist().getBackoffBaseTimeMs()))
                .maxBlacklistTime(Duration.ofMillis(props.getBlacklist().getMaxBlacklistTimeMs()))
                .blacklistInUseAllowed(props.getBlacklist().isAllowInUse())
                .offerHelpInterval(Duration.ofMillis(props.getWorkStealing().getOfferHelpIntervalMs()))
                .reserveTimeout(Duration.ofMillis(props.getWorkStealing().getReserveTimeoutMs()))
                .schedulerSyncerInterval(Duration.ofSeconds(props.getScheduler().getSyncerIntervalSecs()))
                .mailboxCapacity(props.getResponder().getMailboxCapacity())
                .queryTimeout(Duration.ofMillis(props.getResponder().getQueryTimeoutMs()))
                .blacklistTimeout(Duration.ofMillis(props.getResponder().getBlacklistTimeoutMs()))
                .defaultInterstitialSecs(props.getDefaults().getInterstitialSecs())
                .defaultMaxQueueLength(props.getDefaults().getMaxQueueLength())
                .defaultConcurrencyLevel(props.getDefaults().getConcurrencyLevel());
        if (props.getRouterId() != null && !props.getRouterId().isBlank()) b.routerId(props.getRouterId());
        return b.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public TollgateRouter tollgateRouter(RouterSettings settings,
                                         SchedulerClient schedulerClient,
                                         ServiceDescriptionRepository descriptions,
                                         Clock clock,
                                         MetricsSink metrics,
                                         ObjectProvider<ClusterState> cluster,
                                         ObjectProvider<RouterTransport> transport) {
        var b = TollgateRouter.builder(schedulerClient)
                .settings(settings)
                .descriptionRepository(descriptions)
                .clock(clock)
                .metrics(metrics);
        ClusterState c = cluster.getIfAvailable();
        RouterTransport t = transport.getIfAvailable();
        if (c != null && t != null) b.cluster(c, t);
        return b.build();
    }

    // 구성요소는 라우터가 소유하므로 개별 close는 끈다
    @Bean(destroyMethod = "")
    public ServiceDescriptionCache serviceDescriptionCache(TollgateRouter router) { return router.descriptions(); }

    @Bean(destroyMethod = "")
    public InstanceRpcDispatcher instanceRpcDispatcher(TollgateRouter router) { return router.dispatcher(); }

    @Bean(destroyMethod = "")
    public InterstitialGate interstitialGate(TollgateRouter router) { return router.interstitialGate(); }

    @Bean(destroyMethod = "")
    public InterstitialFilter interstitialFilter(TollgateRouter router) { return router.interstitialFilter(); }

    @Bean(destroyMethod = "")
    public WorkStealingCoordinator workStealingCoordinator(TollgateRouter router) { return router.workStealing(); }

    @Bean(destroyMethod = "")
    public SchedulerSyncer schedulerSyncer(TollgateRouter router) { return router.syncer(); }

    @Bean(destroyMethod = "")
    public MaintenanceService maintenanceService(TollgateRouter router) { return router.maintenance(); }

    @Bean(destroyMethod = "")
    public RouterControlService routerControlService(TollgateRouter router) { return router.control(); }

    // --- 스케줄러 등록 (프로퍼티로 주기 제어) ---

    @Bean
    @ConditionalOnProperty(prefix = "tollgate.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public TollgateSchedulers tollgateSchedulers(SchedulerSyncer syncer,
                                                 WorkStealingCoordinator workStealing,
                                                 MaintenanceService maintenance) {
        // 주기는 @Scheduled가 tollgate.* 키에서 직접 읽는다
        return new TollgateSchedulers(syncer, workStealing, maintenance);
    }

    @Bean
    public ServiceCatalogRegistrar serviceCatalogRegistrar(ServiceDescriptionRepository repository,
                                                           ServiceDescriptionCache cache,
                                                           RouterSettings settings) {
        return new ServiceCatalogRegistrar(repository, cache, settings);
    }

    @Bean
    @ConditionalOnProperty(prefix = "tollgate.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner tollgateCatalogRunner(ServiceCatalogRegistrar registrar,
                                                   TollgateProperties props) {
        log.info("catalog: {}", props.getCatalog().getServices().stream()
                .map(TollgateProperties.ServiceDef::toString).collect(Collectors.joining(", ")));
        return args -> registrar.register(props.getCatalog());
    }
}
