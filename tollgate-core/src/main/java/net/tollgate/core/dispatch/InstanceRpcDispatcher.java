package net.tollgate.core.dispatch;

import net.tollgate.core.model.BlacklistResult;
import net.tollgate.core.model.InstanceSelection;
import net.tollgate.core.model.OfferResponse;
import net.tollgate.core.model.ReleaseOutcome;
import net.tollgate.core.model.RequestContext;
import net.tollgate.core.model.ResponderState;
import net.tollgate.core.model.SchedulerSnapshot;
import net.tollgate.core.model.WorkStealingOffer;
import net.tollgate.core.responder.Responder;
import net.tollgate.core.responder.ResponderFactory;
import net.tollgate.core.responder.ResponderMessage;
import net.tollgate.core.scheduler.SchedulerStateListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * service-id → Responder 라우팅.
 * <ul>
 *   <li>Responder는 처음 필요할 때 putIfAbsent로 만들어지고, 경합에서 이긴 것만 쓰인다.</li>
 *   <li>종료된 Responder에 도착한 메시지는 새 Responder로 다시 보낸다.</li>
 *   <li>조회/정리용 메시지는 살아있는 Responder에만 보낸다.</li>
 * </ul>
 */
public final class InstanceRpcDispatcher implements SchedulerStateListener, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(InstanceRpcDispatcher.class);
    private static final int MAX_REDELIVERY = 8;

    private final ResponderFactory factory;
    private final ConcurrentHashMap<String, Responder> responders = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public InstanceRpcDispatcher(ResponderFactory factory) {
        this.factory = factory;
    }

    // ------------------------------------------------------------------ scheduler fan-out

    @Override
    public void onSchedulerSnapshot(SchedulerSnapshot snapshot) {
        if (closed) return;
        for (String serviceId : snapshot.availableServiceIds()) {
            send(serviceId, new ResponderMessage.ApplySchedulerUpdate(snapshot.instancesOf(serviceId), snapshot.syncedAt()));
        }
        for (Responder r : responders.values()) {
            if (!snapshot.availableServiceIds().contains(r.serviceId())) {
                tellExisting(r.serviceId(), new ResponderMessage.ServiceRemoved());
            }
        }
    }

    // ------------------------------------------------------------------ routing

    /** 지금 빈 슬롯이 없으면 바로 NoInstanceAvailable */
    public CompletableFuture<InstanceSelection> selectInstanceForRequest(String serviceId, RequestContext request) {
        CompletableFuture<InstanceSelection> reply = new CompletableFuture<>();
        send(serviceId, new ResponderMessage.SelectInstance(request, false, reply));
        return reply.orTimeout(factory.settings().queryTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * 빈 슬롯이 생길 때까지 대기열에서 기다린다.
     * timeout이 지나면 future가 TimeoutException으로 끝나고 대기열 항목은 버려진다.
     */
    public CompletableFuture<InstanceSelection> reserveInstance(String serviceId, RequestContext request, Duration timeout) {
        CompletableFuture<InstanceSelection> reply = new CompletableFuture<>();
        send(serviceId, new ResponderMessage.SelectInstance(request, true, reply));
        return reply.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void releaseInstance(String serviceId, String instanceId, ReleaseOutcome outcome) {
        send(serviceId, new ResponderMessage.ReleaseInstance(instanceId, outcome));
    }

    public CompletableFuture<BlacklistResult> blacklistInstance(String serviceId, String instanceId, Duration period, String reason) {
        CompletableFuture<BlacklistResult> reply = new CompletableFuture<>();
        send(serviceId, new ResponderMessage.BlacklistInstance(instanceId, period, reason, reply));
        return reply.orTimeout(factory.settings().blacklistTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    /** 다른 라우터가 보낸 제안. 결과는 offer.response()로도 전달된다. */
    public CompletableFuture<OfferResponse> offerInstance(WorkStealingOffer offer) {
        send(offer.serviceId(), new ResponderMessage.OfferInstance(offer));
        return offer.response();
    }

    /** 제안할 유휴 인스턴스 예약. Responder가 없으면 빈 값. */
    public CompletableFuture<Optional<WorkStealingOffer>> reserveIdleForOffer(String serviceId, String targetRouterId) {
        CompletableFuture<Optional<WorkStealingOffer>> reply = new CompletableFuture<>();
        if (!tellExisting(serviceId, new ResponderMessage.ReserveIdleForOffer(targetRouterId, reply))) {
            reply.complete(Optional.empty());
        }
        return reply.completeOnTimeout(Optional.empty(), factory.settings().queryTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    // ------------------------------------------------------------------ queries

    public CompletableFuture<Optional<ResponderState>> queryState(String serviceId) {
        CompletableFuture<ResponderState> reply = new CompletableFuture<>();
        if (!tellExisting(serviceId, new ResponderMessage.QueryState(reply))) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return reply.orTimeout(factory.settings().queryTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(Optional::of);
    }

    /** 모든 Responder에 병렬로 묻고 합친다. 답하지 못한 서비스는 빠진다. */
    public CompletableFuture<Map<String, ResponderState>> queryAllStates() {
        Map<String, CompletableFuture<Optional<ResponderState>>> queries = new HashMap<>();
        for (String serviceId : responders.keySet()) {
            queries.put(serviceId, queryState(serviceId).exceptionally(e -> {
                log.warn("state query for {} failed: {}", serviceId, e.toString());
                return Optional.empty();
            }));
        }
        return CompletableFuture.allOf(queries.values().toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    Map<String, ResponderState> merged = new TreeMap<>();
                    queries.forEach((serviceId, f) -> f.join().ifPresent(s -> merged.put(serviceId, s)));
                    return merged;
                });
    }

    /** gossip용: 대기 요청이 있는 서비스만 */
    public Map<String, Integer> pendingRequestCounts() {
        return responders.values().stream()
                .filter(r -> !r.terminated() && r.pendingRequestCount() > 0)
                .collect(Collectors.toMap(Responder::serviceId, Responder::pendingRequestCount, (a, b) -> a, TreeMap::new));
    }

    public Set<String> serviceIds() {
        return new TreeSet<>(responders.keySet());
    }

    public int responderCount() {
        return responders.size();
    }

    // ------------------------------------------------------------------ maintenance

    /** @return sweep을 받은 Responder 수 */
    public int sweepAll() {
        int n = 0;
        for (String serviceId : List.copyOf(responders.keySet())) {
            if (tellExisting(serviceId, new ResponderMessage.Sweep())) n++;
        }
        return n;
    }

    /** onExit 훅이 놓친 종료된 Responder를 맵에서 치운다 */
    public int reapTerminated() {
        int reaped = 0;
        for (Map.Entry<String, Responder> e : responders.entrySet()) {
            if (e.getValue().terminated() && responders.remove(e.getKey(), e.getValue())) {
                reaped++;
            }
        }
        return reaped;
    }

    @Override
    public void close() {
        closed = true;
        for (Responder r : responders.values()) r.stop();
        log.info("dispatcher closed, stopped {} responder(s)", responders.size());
    }

    // ------------------------------------------------------------------ internals

    Responder responderFor(String serviceId) {
        while (true) {
            Responder existing = responders.get(serviceId);
            if (existing != null && !existing.terminated()) return existing;

            Responder created = factory.create(serviceId, this::terminated, m -> redeliver(serviceId, m));
            boolean won = existing == null
                    ? responders.putIfAbsent(serviceId, created) == null
                    : responders.replace(serviceId, existing, created);
            if (won) {
                log.info("responder created for service {}", serviceId);
                return created;
            }
            // 경합에서 졌다: 아직 메시지를 받은 적 없으므로 버려도 된다
            created.stop();
        }
    }

    private void send(String serviceId, ResponderMessage message) {
        if (closed) {
            message.reject(new RejectedExecutionException("router is closed"));
            return;
        }
        for (int attempt = 0; attempt < MAX_REDELIVERY; attempt++) {
            Responder r = responderFor(serviceId);
            if (r.tell(message)) return;
            if (!r.terminated()) {
                message.reject(new RejectedExecutionException("mailbox of responder " + serviceId + " is full"));
                return;
            }
        }
        log.warn("giving up on {} for service {} after {} attempts", message.getClass().getSimpleName(), serviceId, MAX_REDELIVERY);
        message.reject(new RejectedExecutionException("responder " + serviceId + " keeps terminating"));
    }

    private boolean tellExisting(String serviceId, ResponderMessage message) {
        Responder r = responders.get(serviceId);
        return r != null && !r.terminated() && r.tell(message);
    }

    private void redeliver(String serviceId, ResponderMessage message) {
        if (message instanceof ResponderMessage.ServiceRemoved || message instanceof ResponderMessage.Sweep) return;
        if (closed) {
            message.reject(new RejectedExecutionException("router is closed"));
            return;
        }
        log.debug("redelivering {} for service {} to a fresh responder", message.getClass().getSimpleName(), serviceId);
        send(serviceId, message);
    }

    private void terminated(Responder responder) {
        if (responders.remove(responder.serviceId(), responder)) {
            log.info("responder for service {} terminated", responder.serviceId());
        }
    }
}
