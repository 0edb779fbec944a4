package net.tollgate.core.interstitial;

import net.tollgate.core.description.ServiceDescriptionLookup;
import net.tollgate.core.metrics.MetricNames;
import net.tollgate.core.model.InterstitialResolution;
import net.tollgate.core.model.SchedulerSnapshot;
import net.tollgate.core.scheduler.SchedulerStateListener;
import net.tollgate.core.spi.Clock;
import net.tollgate.core.spi.MetricsSink;
import net.tollgate.core.support.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 서비스별 interstitial promise 관리.
 * <ul>
 *   <li>promise 생성은 putIfAbsent 한 번. 이긴 쪽만 타임아웃을 건다.</li>
 *   <li>maintainer(메일박스)가 스케줄러 스냅샷을 받아 promise를 만들고/풀고/치운다.</li>
 *   <li>해결되지 않은 promise는 절대 지우지 않는다.</li>
 * </ul>
 */
public final class InterstitialGate implements SchedulerStateListener, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(InterstitialGate.class);
    static final String NOT_REALIZED = "not-realized";

    private final ServiceDescriptionLookup descriptions;
    private final Clock clock;
    private final MetricsSink metrics;
    private final ScheduledExecutorService timer;
    private final Duration queryTimeout;
    private final ConcurrentHashMap<String, InterstitialPromise> promises = new ConcurrentHashMap<>();
    private final Mailbox<GateMessage> maintainer;
    private volatile boolean initialized;

    // maintainer 전용
    private Set<String> availableServiceIds = new HashSet<>();

    private interface GateMessage {
        default void reject() { }
    }

    private record SchedulerUpdate(SchedulerSnapshot snapshot) implements GateMessage {}

    private record Query(String serviceId, CompletableFuture<Object> reply) implements GateMessage {
        @Override public void reject() { reply.completeExceptionally(new RejectedExecutionException("interstitial maintainer stopped")); }
    }

    public InterstitialGate(ServiceDescriptionLookup descriptions,
                            Clock clock,
                            MetricsSink metrics,
                            ScheduledExecutorService timer,
                            Executor executor,
                            int mailboxCapacity,
                            Duration queryTimeout) {
        this.descriptions = descriptions;
        this.clock = clock;
        this.metrics = metrics;
        this.timer = timer;
        this.queryTimeout = queryTimeout;
        this.maintainer = new Mailbox<>("interstitial-maintainer", mailboxCapacity, executor,
                this::handle, GateMessage::reject, () -> log.warn("stopping interstitial-maintainer"));
    }

    // ------------------------------------------------------------------ promises

    /**
     * 서비스의 promise를 돌려준다. 없으면 만든다.
     * 경합 시 putIfAbsent에서 이긴 promise만 살아남고 그 생성자만 타임아웃을 건다.
     */
    public InterstitialPromise ensure(String serviceId, int interstitialSecs) {
        InterstitialPromise existing = promises.get(serviceId);
        if (existing != null) return existing;

        InterstitialPromise candidate = new InterstitialPromise(serviceId, clock.now());
        InterstitialPromise winner = promises.putIfAbsent(serviceId, candidate);
        if (winner != null) return winner;

        log.info("created interstitial promise for {}", serviceId);
        metrics.incrementCounter(MetricNames.routerCounter("interstitial", "promise", "total"));
        installTimeout(candidate, interstitialSecs);
        return candidate;
    }

    private void installTimeout(InterstitialPromise promise, int interstitialSecs) {
        if (interstitialSecs <= 0) {
            log.error("{} has opted out of interstitial, not installing timeout", promise.serviceId());
            return;
        }
        try {
            timer.schedule(() -> resolve(promise, InterstitialResolution.INTERSTITIAL_TIMEOUT), interstitialSecs, TimeUnit.SECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("timer rejected interstitial timeout for {}, resolving now", promise.serviceId());
            resolve(promise, InterstitialResolution.INTERSTITIAL_TIMEOUT);
        }
    }

    boolean resolve(InterstitialPromise promise, InterstitialResolution resolution) {
        if (!promise.resolve(resolution)) return false;
        log.info("interstitial for {} resolved to {}", promise.serviceId(), resolution.code());
        metrics.incrementCounter(MetricNames.routerCounter("interstitial", "promise", "resolved"));
        metrics.incrementCounter(MetricNames.routerCounter("interstitial", "resolution", resolution.code()));
        return true;
    }

    public Optional<InterstitialPromise> promise(String serviceId) {
        return Optional.ofNullable(promises.get(serviceId));
    }

    /** 첫 스케줄러 스냅샷을 처리했는지 */
    public boolean initialized() {
        return initialized;
    }

    // ------------------------------------------------------------------ maintainer

    @Override
    public void onSchedulerSnapshot(SchedulerSnapshot snapshot) {
        if (!maintainer.tell(new SchedulerUpdate(snapshot))) {
            log.warn("interstitial-maintainer did not accept scheduler snapshot of {}", snapshot.syncedAt());
        }
    }

    public CompletableFuture<InterstitialServiceState> queryState(String serviceId) {
        return query(serviceId).thenApply(InterstitialServiceState.class::cast);
    }

    public CompletableFuture<InterstitialGateState> queryAllState() {
        return query(null).thenApply(InterstitialGateState.class::cast);
    }

    private CompletableFuture<Object> query(String serviceId) {
        CompletableFuture<Object> reply = new CompletableFuture<>();
        if (!maintainer.tell(new Query(serviceId, reply))) {
            reply.completeExceptionally(new RejectedExecutionException("interstitial maintainer is not accepting queries"));
        }
        return reply.orTimeout(queryTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void handle(GateMessage message) {
        if (message instanceof SchedulerUpdate u) {
            availableServiceIds = process(u.snapshot());
            if (!initialized) {
                log.info("interstitial state has been initialized with services from the scheduler");
                initialized = true;
            }
        } else if (message instanceof Query q) {
            q.reply().complete(q.serviceId() != null ? serviceState(q.serviceId()) : gateState());
        }
        metrics.resetCounter(MetricNames.routerCounter("interstitial", "available-services"), availableServiceIds.size());
    }

    private Set<String> process(SchedulerSnapshot snapshot) {
        Set<String> available = snapshot.availableServiceIds();

        Set<String> toRemove = new HashSet<>(availableServiceIds);
        toRemove.removeAll(available);
        Set<String> removed = new HashSet<>();
        for (String serviceId : toRemove) {
            InterstitialPromise p = promises.get(serviceId);
            if (p == null || (p.resolved() && promises.remove(serviceId, p))) removed.add(serviceId);
        }

        for (String serviceId : available) {
            int secs = descriptions.describe(serviceId).interstitialSecs();
            if (secs > 0) ensure(serviceId, secs);
        }

        Set<String> healthy = new HashSet<>();
        for (String serviceId : available) {
            if (!snapshot.instancesOf(serviceId).healthy().isEmpty()) {
                healthy.add(serviceId);
                InterstitialPromise p = promises.get(serviceId);
                if (p != null) resolve(p, InterstitialResolution.HEALTHY_INSTANCE_FOUND);
            }
        }

        Set<String> next = new HashSet<>(availableServiceIds);
        next.removeAll(removed);
        next.addAll(available);
        next.addAll(healthy);
        return next;
    }

    private InterstitialServiceState serviceState(String serviceId) {
        InterstitialPromise p = promises.get(serviceId);
        return new InterstitialServiceState(serviceId, availableServiceIds.contains(serviceId), p == null ? null : p.describe());
    }

    private InterstitialGateState gateState() {
        Map<String, String> byService = new TreeMap<>();
        promises.forEach((id, p) -> byService.put(id, p.describe()));
        return new InterstitialGateState(initialized, byService, availableServiceIds);
    }

    @Override
    public void close() {
        maintainer.requestExit();
    }
}
