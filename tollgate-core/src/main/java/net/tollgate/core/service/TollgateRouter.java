package net.tollgate.core.service;

import net.tollgate.core.config.RouterSettings;
import net.tollgate.core.description.InMemoryServiceDescriptionRepository;
import net.tollgate.core.description.ServiceDescriptionCache;
import net.tollgate.core.dispatch.InstanceRpcDispatcher;
import net.tollgate.core.interstitial.InterstitialFilter;
import net.tollgate.core.interstitial.InterstitialGate;
import net.tollgate.core.maintenance.MaintenanceService;
import net.tollgate.core.model.OfferResponse;
import net.tollgate.core.responder.PendingRequest;
import net.tollgate.core.responder.PendingRequestOrder;
import net.tollgate.core.responder.RendezvousInstanceOwnership;
import net.tollgate.core.responder.ResponderFactory;
import net.tollgate.core.scheduler.SchedulerSyncer;
import net.tollgate.core.spi.Clock;
import net.tollgate.core.spi.ClusterState;
import net.tollgate.core.spi.MetricsSink;
import net.tollgate.core.spi.RouterTransport;
import net.tollgate.core.spi.SchedulerClient;
import net.tollgate.core.spi.ServiceDescriptionRepository;
import net.tollgate.core.workstealing.InProcessCluster;
import net.tollgate.core.workstealing.WorkStealingCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Comparator;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 라우터 하나의 조립체. 실행기와 모든 액터/코디네이터를 소유한다.
 * 주기 호출(syncOnce, offerHelpOnce, runOnce)은 바깥(@Scheduled 등)에서 한다.
 */
public final class TollgateRouter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TollgateRouter.class);

    private final RouterSettings settings;
    private final ExecutorService actorPool;
    private final ScheduledExecutorService timer;
    private final ServiceDescriptionCache descriptions;
    private final InstanceRpcDispatcher dispatcher;
    private final InterstitialGate interstitialGate;
    private final InterstitialFilter interstitialFilter;
    private final WorkStealingCoordinator workStealing;
    private final SchedulerSyncer syncer;
    private final MaintenanceService maintenance;
    private final RouterControlService control;
    private final InProcessCluster inProcessCluster;

    private TollgateRouter(Builder b) {
        this.settings = b.settings;
        this.actorPool = Executors.newFixedThreadPool(b.actorThreads, threads("tollgate-actor"));
        this.timer = Executors.newSingleThreadScheduledExecutor(threads("tollgate-timer"));
        this.descriptions = new ServiceDescriptionCache(b.descriptionRepository, settings, b.clock,
                b.descriptionTtl, b.descriptionCacheSize);

        ResponderFactory factory = new ResponderFactory(settings, descriptions, b.clock, b.metrics,
                new RendezvousInstanceOwnership(settings.routerId(), b.cluster), b.pendingOrder, actorPool);
        this.dispatcher = new InstanceRpcDispatcher(factory);
        this.interstitialGate = new InterstitialGate(descriptions, b.clock, b.metrics, timer, actorPool,
                settings.mailboxCapacity(), settings.queryTimeout());
        this.interstitialFilter = new InterstitialFilter(interstitialGate, descriptions, b.metrics);
        this.workStealing = new WorkStealingCoordinator(settings, dispatcher, descriptions, b.cluster, b.transport, b.metrics);

        this.syncer = new SchedulerSyncer(b.schedulerClient, b.clock);
        syncer.addListener(dispatcher);
        syncer.addListener(interstitialGate);

        this.maintenance = new MaintenanceService(dispatcher, descriptions, b.clock);
        this.control = new RouterControlService(settings, dispatcher, workStealing, interstitialGate, b.schedulerClient, b.clock);

        this.inProcessCluster = b.inProcessCluster;
        if (inProcessCluster != null) inProcessCluster.join(settings.routerId(), dispatcher, workStealing);
        log.info("tollgate router {} started: {}", settings.routerId(), settings);
    }

    public static Builder builder(SchedulerClient schedulerClient) {
        return new Builder(schedulerClient);
    }

    public RouterSettings settings() { return settings; }
    public String routerId() { return settings.routerId(); }
    public ServiceDescriptionCache descriptions() { return descriptions; }
    public InstanceRpcDispatcher dispatcher() { return dispatcher; }
    public InterstitialGate interstitialGate() { return interstitialGate; }
    public InterstitialFilter interstitialFilter() { return interstitialFilter; }
    public WorkStealingCoordinator workStealing() { return workStealing; }
    public SchedulerSyncer syncer() { return syncer; }
    public MaintenanceService maintenance() { return maintenance; }
    public RouterControlService control() { return control; }

    /** 종료 신호는 남은 데이터 메시지보다 먼저 처리된다 */
    @Override
    public void close() {
        if (inProcessCluster != null) inProcessCluster.leave(settings.routerId());
        dispatcher.close();
        interstitialGate.close();
        timer.shutdownNow();
        actorPool.shutdown();
        try {
            if (!actorPool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("actor pool of router {} did not stop in time", settings.routerId());
                actorPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            actorPool.shutdownNow();
        }
        log.info("tollgate router {} stopped", settings.routerId());
    }

    private static ThreadFactory threads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public static final class Builder {
        private final SchedulerClient schedulerClient;
        private RouterSettings settings = RouterSettings.defaults();
        private ServiceDescriptionRepository descriptionRepository = new InMemoryServiceDescriptionRepository();
        private Clock clock = Clock.system();
        private MetricsSink metrics = MetricsSink.noop();
        private ClusterState cluster;
        private RouterTransport transport;
        private InProcessCluster inProcessCluster;
        private Comparator<PendingRequest> pendingOrder = PendingRequestOrder.priorityThenArrival();
        private Duration descriptionTtl = Duration.ofSeconds(30);
        private int descriptionCacheSize = 1000;
        private int actorThreads = Math.max(2, Runtime.getRuntime().availableProcessors());

        private Builder(SchedulerClient schedulerClient) {
            this.schedulerClient = Objects.requireNonNull(schedulerClient, "schedulerClient");
        }

        public Builder settings(RouterSettings settings) { this.settings = Objects.requireNonNull(settings); return this; }
        public Builder descriptionRepository(ServiceDescriptionRepository repo) { this.descriptionRepository = Objects.requireNonNull(repo); return this; }
        public Builder clock(Clock clock) { this.clock = Objects.requireNonNull(clock); return this; }
        public Builder metrics(MetricsSink metrics) { this.metrics = Objects.requireNonNull(metrics); return this; }
        public Builder pendingOrder(Comparator<PendingRequest> order) { this.pendingOrder = Objects.requireNonNull(order); return this; }
        public Builder descriptionTtl(Duration ttl) { this.descriptionTtl = Objects.requireNonNull(ttl); return this; }
        public Builder descriptionCacheSize(int size) { this.descriptionCacheSize = size; return this; }
        public Builder actorThreads(int threads) { this.actorThreads = threads; return this; }

        public Builder cluster(ClusterState cluster, RouterTransport transport) {
            this.cluster = Objects.requireNonNull(cluster);
            this.transport = Objects.requireNonNull(transport);
            return this;
        }

        /** 같은 JVM의 라우터끼리 묶을 때 */
        public Builder inProcessCluster(InProcessCluster cluster) {
            this.inProcessCluster = Objects.requireNonNull(cluster);
            return cluster(cluster, cluster);
        }

        public TollgateRouter build() {
            if (cluster == null) {
                cluster = ClusterState.standalone(settings.routerId());
                transport = (routerId, offer) -> CompletableFuture.completedFuture(OfferResponse.DECLINED);
            }
            return new TollgateRouter(this);
        }
    }
}
