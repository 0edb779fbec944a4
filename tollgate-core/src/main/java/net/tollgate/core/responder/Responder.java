package net.tollgate.core.responder;

import net.tollgate.core.config.RouterSettings;
import net.tollgate.core.description.ServiceDescriptionLookup;
import net.tollgate.core.metrics.MetricNames;
import net.tollgate.core.model.BlacklistEntry;
import net.tollgate.core.model.BlacklistResult;
import net.tollgate.core.model.InstanceSelection;
import net.tollgate.core.model.OfferResponse;
import net.tollgate.core.model.ReleaseOutcome;
import net.tollgate.core.model.ResponderState;
import net.tollgate.core.model.ResponderStatus;
import net.tollgate.core.model.ServiceDescription;
import net.tollgate.core.model.ServiceInstance;
import net.tollgate.core.model.ServiceInstances;
import net.tollgate.core.model.WorkStealingOffer;
import net.tollgate.core.responder.ResponderMessage.ApplySchedulerUpdate;
import net.tollgate.core.responder.ResponderMessage.BlacklistInstance;
import net.tollgate.core.responder.ResponderMessage.OfferInstance;
import net.tollgate.core.responder.ResponderMessage.OfferResolved;
import net.tollgate.core.responder.ResponderMessage.OfferReturned;
import net.tollgate.core.responder.ResponderMessage.QueryState;
import net.tollgate.core.responder.ResponderMessage.ReleaseInstance;
import net.tollgate.core.responder.ResponderMessage.ReserveIdleForOffer;
import net.tollgate.core.responder.ResponderMessage.SelectInstance;
import net.tollgate.core.responder.ResponderMessage.ServiceRemoved;
import net.tollgate.core.responder.ResponderMessage.Sweep;
import net.tollgate.core.spi.Clock;
import net.tollgate.core.spi.MetricsSink;
import net.tollgate.core.support.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 서비스 하나의 인스턴스/슬롯 상태를 단독 소유하는 액터.
 * 모든 상태 변경은 메일박스 스레드 안에서만 일어나고 외부에는 메시지로만 노출된다.
 *
 * <p>슬롯 상태:
 * <ul>
 *   <li>available: 지금 고를 수 있는 인스턴스 (빈 슬롯 있음, 블랙리스트 아님, 제안 중 아님)</li>
 *   <li>inUse: 인스턴스별 처리 중 요청 수</li>
 *   <li>offered: 다른 라우터에 빌려준 인스턴스 (available과 겹치지 않음)</li>
 *   <li>borrowed: 다른 라우터에서 빌려온 인스턴스 (1회용)</li>
 * </ul>
 */
public final class Responder {
    private static final Logger log = LoggerFactory.getLogger(Responder.class);

    private final String serviceId;
    private final RouterSettings settings;
    private final ServiceDescriptionLookup descriptions;
    private final Clock clock;
    private final MetricsSink metrics;
    private final InstanceOwnership ownership;
    private final BlacklistTracker blacklist;
    private final PendingRequestQueue pending;
    private final Mailbox<ResponderMessage> mailbox;
    private final Consumer<Responder> onTerminated;

    // ---- 아래 필드는 메일박스 스레드 전용 ----
    private final Map<String, ServiceInstance> healthy = new HashMap<>();
    private final Map<String, ServiceInstance> owned = new LinkedHashMap<>();
    private final Set<String> unhealthy = new HashSet<>();
    private final Set<String> available = new LinkedHashSet<>();
    private final Map<String, Integer> inUse = new HashMap<>();
    private final Map<String, Long> lastUsed = new HashMap<>();
    private final Map<String, OutgoingOffer> offered = new HashMap<>();
    private final Map<String, WorkStealingOffer> borrowed = new HashMap<>();
    private final Set<String> borrowedInUse = new HashSet<>();
    private long useSequence;
    private Instant lastSchedulerUpdate;
    private ResponderStatus status = ResponderStatus.ACTIVE;

    // 다른 스레드가 읽는 공개값 (gossip용)
    private volatile int publishedPending;
    private volatile ResponderStatus publishedStatus = ResponderStatus.ACTIVE;

    Responder(String serviceId,
              RouterSettings settings,
              ServiceDescriptionLookup descriptions,
              Clock clock,
              MetricsSink metrics,
              InstanceOwnership ownership,
              BlacklistPolicy blacklistPolicy,
              Comparator<PendingRequest> pendingOrder,
              Executor executor,
              Consumer<Responder> onTerminated,
              Consumer<ResponderMessage> onUndelivered) {
        this.serviceId = serviceId;
        this.settings = settings;
        this.descriptions = descriptions;
        this.clock = clock;
        this.metrics = metrics;
        this.ownership = ownership;
        this.blacklist = new BlacklistTracker(blacklistPolicy);
        this.pending = new PendingRequestQueue(pendingOrder);
        this.onTerminated = onTerminated;
        this.mailbox = new Mailbox<>("responder-" + serviceId, settings.mailboxCapacity(), executor,
                this::handle, onUndelivered, this::exited);
    }

    public String serviceId() { return serviceId; }

    /** @return 메일박스에 들어갔으면 true (닫혔거나 가득 차면 false) */
    public boolean tell(ResponderMessage message) {
        return mailbox.tell(message);
    }

    /** 라우터 종료 시 */
    public void stop() {
        mailbox.requestExit();
    }

    public boolean terminated() {
        return mailbox.closed() || mailbox.exitRequested();
    }

    public ResponderStatus status() { return terminated() ? ResponderStatus.TERMINATED : publishedStatus; }

    public int pendingRequestCount() { return publishedPending; }

    // ------------------------------------------------------------------ dispatch

    void handle(ResponderMessage message) {
        Instant now = clock.now();
        expireBlacklist(now);

        if (message instanceof ApplySchedulerUpdate m) {
            applySchedulerUpdate(m, now);
        } else if (message instanceof SelectInstance m) {
            selectInstance(m, now);
        } else if (message instanceof ReleaseInstance m) {
            releaseInstance(m.instanceId(), m.outcome(), now);
        } else if (message instanceof BlacklistInstance m) {
            blacklistInstance(m, now);
        } else if (message instanceof OfferInstance m) {
            offerInstance(m.offer(), now);
        } else if (message instanceof ReserveIdleForOffer m) {
            reserveIdleForOffer(m, now);
        } else if (message instanceof OfferResolved m) {
            offerResolved(m.offer(), m.response(), now);
        } else if (message instanceof OfferReturned m) {
            offerReturned(m.offer(), m.outcome(), now);
        } else if (message instanceof QueryState m) {
            m.reply().complete(snapshot());
        } else if (message instanceof ServiceRemoved) {
            serviceRemoved();
        } else if (message instanceof Sweep) {
            sweep(now);
        } else {
            log.warn("responder {} dropping unknown message {}", serviceId, message);
        }

        dispatchPending(now);
        // 종료 요청 뒤에는 후임 Responder가 같은 지표를 쓸 수 있다
        publish(now);
        maybeTerminate();
    }

    // ------------------------------------------------------------------ scheduler updates

    private void applySchedulerUpdate(ApplySchedulerUpdate m, Instant now) {
        ServiceInstances update = m.instances();
        if (!wellFormed(update)) {
            log.warn("responder {} ignoring malformed scheduler update {}", serviceId, update);
            return;
        }
        if (status == ResponderStatus.DRAINING) {
            log.info("responder {} is active again", serviceId);
        }
        status = ResponderStatus.ACTIVE;

        for (ServiceInstance killed : update.killed()) {
            purge(killed.id());
        }

        Set<String> killedIds = new HashSet<>();
        update.killed().forEach(i -> killedIds.add(i.id()));

        healthy.clear();
        unhealthy.clear();
        Map<String, ServiceInstance> nextOwned = new LinkedHashMap<>();
        for (ServiceInstance i : update.healthy()) {
            if (killedIds.contains(i.id())) continue;
            healthy.put(i.id(), i);
            if (ownership.ownedLocally(i)) nextOwned.put(i.id(), i);
        }
        for (ServiceInstance i : update.unhealthy()) {
            if (!killedIds.contains(i.id())) unhealthy.add(i.id());
        }

        for (String id : Set.copyOf(owned.keySet())) {
            if (!nextOwned.containsKey(id)) {
                owned.remove(id);
                available.remove(id);
                if (!inUse.containsKey(id)) lastUsed.remove(id);
            }
        }
        for (var e : nextOwned.entrySet()) {
            if (owned.put(e.getKey(), e.getValue()) == null) {
                log.debug("responder {} now owns instance {}", serviceId, e.getKey());
            }
            refreshAvailability(e.getKey(), now);
        }

        Set<String> known = new HashSet<>(healthy.keySet());
        known.addAll(unhealthy);
        known.addAll(borrowed.keySet());
        int dropped = blacklist.retainOnly(known);
        if (dropped > 0) log.info("responder {} dropped {} blacklist entries of vanished instances", serviceId, dropped);

        lastSchedulerUpdate = m.syncedAt() != null ? m.syncedAt() : now;
    }

    private boolean wellFormed(ServiceInstances update) {
        if (update == null) return false;
        for (List<ServiceInstance> list : List.of(update.healthy(), update.unhealthy(), update.killed())) {
            for (ServiceInstance i : list) {
                if (i == null || !i.wellFormed() || !serviceId.equals(i.serviceId())) return false;
            }
        }
        return true;
    }

    /** killed 인스턴스는 모든 집합에서 제거 */
    private void purge(String instanceId) {
        boolean known = healthy.remove(instanceId) != null | owned.remove(instanceId) != null;
        available.remove(instanceId);
        inUse.remove(instanceId);
        lastUsed.remove(instanceId);
        blacklist.remove(instanceId);
        unhealthy.remove(instanceId);
        offered.remove(instanceId);
        WorkStealingOffer b = borrowed.remove(instanceId);
        borrowedInUse.remove(instanceId);
        if (b != null) b.returned().complete(ReleaseOutcome.INSTANCE_ERROR);
        if (known || b != null) log.info("responder {} purged killed instance {}", serviceId, instanceId);
    }

    private void serviceRemoved() {
        if (status != ResponderStatus.ACTIVE) return;
        status = ResponderStatus.DRAINING;
        log.info("responder {} draining: service no longer reported by the scheduler", serviceId);
        PendingRequest p;
        while ((p = pending.pollLive()) != null) {
            p.reply().complete(new InstanceSelection.NoInstanceAvailable(serviceId));
        }
    }

    // ------------------------------------------------------------------ routing

    private void selectInstance(SelectInstance m, Instant now) {
        String picked = pending.pruneAndCount() == 0 ? pickInstance(now) : null;
        if (picked != null) {
            assign(picked, m.reply(), now);
            return;
        }
        if (!m.queueIfUnavailable() || status != ResponderStatus.ACTIVE) {
            m.reply().complete(new InstanceSelection.NoInstanceAvailable(serviceId));
            return;
        }
        int maxQueueLength = description().maxQueueLength();
        if (pending.size() >= maxQueueLength) {
            log.info("responder {} rejecting request {}: {} waiting, max-queue-length {}",
                    serviceId, m.request().requestId(), pending.size(), maxQueueLength);
            metrics.incrementCounter(MetricNames.serviceCounter(serviceId, "request-counts", "queue-full"));
            m.reply().complete(new InstanceSelection.QueueFull(serviceId, maxQueueLength));
            return;
        }
        pending.add(new PendingRequest(m.request(), pending.nextArrival(), now, m.reply()));
    }

    /** 빈 슬롯이 있는 인스턴스 중 가장 오래 전에 쓰인 것 (한 번도 안 쓰인 것이 최우선) */
    private String pickInstance(Instant now) {
        int concurrency = description().concurrencyLevel();
        String best = null;
        long bestUsed = Long.MAX_VALUE;
        for (String id : available) {
            if (blacklist.isBlacklisted(id, now)) continue;
            if (inUse.getOrDefault(id, 0) >= concurrency) continue;
            if (borrowedInUse.contains(id)) continue;
            long used = lastUsed.getOrDefault(id, -1L);
            if (used < bestUsed) {
                best = id;
                bestUsed = used;
            }
        }
        return best;
    }

    private void assign(String instanceId, CompletableFuture<InstanceSelection> reply, Instant now) {
        boolean isBorrowed = borrowed.containsKey(instanceId);
        ServiceInstance instance = isBorrowed ? borrowed.get(instanceId).instance() : owned.get(instanceId);
        inUse.merge(instanceId, 1, Integer::sum);
        lastUsed.put(instanceId, useSequence++);
        if (isBorrowed) borrowedInUse.add(instanceId);
        refreshAvailability(instanceId, now);

        if (!reply.complete(new InstanceSelection.Selected(instance, isBorrowed))) {
            // 호출자가 이미 포기함: 슬롯을 되돌린다
            unassign(instanceId, now);
            if (isBorrowed) borrowedInUse.remove(instanceId);
            refreshAvailability(instanceId, now);
            return;
        }
        metrics.markMeter(MetricNames.serviceMeter(serviceId, "instance-assigned"));
    }

    private void unassign(String instanceId, Instant now) {
        Integer count = inUse.get(instanceId);
        if (count == null) return;
        if (count <= 1) inUse.remove(instanceId); else inUse.put(instanceId, count - 1);
    }

    private void dispatchPending(Instant now) {
        while (pending.pruneAndCount() > 0) {
            String picked = pickInstance(now);
            if (picked == null) return;
            PendingRequest p = pending.pollLive();
            if (p == null) return;
            assign(picked, p.reply(), now);
        }
    }

    private void releaseInstance(String instanceId, ReleaseOutcome outcome, Instant now) {
        if (!inUse.containsKey(instanceId)) {
            log.debug("responder {} ignoring release of unknown or purged instance {}", serviceId, instanceId);
            return;
        }
        unassign(instanceId, now);

        WorkStealingOffer b = borrowed.get(instanceId);
        if (b != null && borrowedInUse.remove(instanceId)) {
            // 빌려온 인스턴스는 1회용: 주인에게 돌려준다
            borrowed.remove(instanceId);
            available.remove(instanceId);
            if (!inUse.containsKey(instanceId)) lastUsed.remove(instanceId);
            b.returned().complete(outcome);
            log.info("responder {} returned borrowed instance {} to router {} ({})",
                    serviceId, instanceId, b.routerId(), outcome);
            return;
        }

        if (outcome.blacklists() && (healthy.containsKey(instanceId) || owned.containsKey(instanceId))) {
            BlacklistEntry e = blacklist.blacklist(instanceId, null, outcome.name().toLowerCase(), now);
            available.remove(instanceId);
            log.info("responder {} blacklisted instance {} after {} until {} (failures={})",
                    serviceId, instanceId, outcome, e.expiresAt(), e.consecutiveFailures());
        }
        refreshAvailability(instanceId, now);
    }

    // ------------------------------------------------------------------ blacklist

    private void blacklistInstance(BlacklistInstance m, Instant now) {
        String id = m.instanceId();
        boolean known = healthy.containsKey(id) || owned.containsKey(id) || unhealthy.contains(id)
                || borrowed.containsKey(id) || inUse.containsKey(id) || offered.containsKey(id);
        if (!known) {
            m.reply().complete(BlacklistResult.NO_SUCH_INSTANCE);
            return;
        }
        if (inUse.getOrDefault(id, 0) > 0 && !settings.blacklistInUseAllowed()) {
            m.reply().complete(BlacklistResult.IN_USE);
            return;
        }
        BlacklistEntry e = blacklist.blacklist(id, m.period(), m.reason(), now);
        available.remove(id);
        metrics.incrementCounter(MetricNames.serviceCounter(serviceId, "blacklist", m.reason() == null ? "unknown" : m.reason()));
        log.info("responder {} blacklisted instance {} for reason {} until {} (failures={})",
                serviceId, id, m.reason(), e.expiresAt(), e.consecutiveFailures());
        m.reply().complete(BlacklistResult.BLACKLISTED);
    }

    private void expireBlacklist(Instant now) {
        for (String id : blacklist.expire(now)) {
            log.debug("responder {} blacklist expired for {}", serviceId, id);
            refreshAvailability(id, now);
        }
    }

    // ------------------------------------------------------------------ work stealing: receiving side

    private void offerInstance(WorkStealingOffer offer, Instant now) {
        String id = offer.instance() == null ? null : offer.instance().id();
        String declineReason = null;
        if (!offer.complete() || !serviceId.equals(offer.serviceId()) || !serviceId.equals(offer.instance().serviceId())) {
            declineReason = "malformed offer";
        } else if (status != ResponderStatus.ACTIVE) {
            declineReason = "service is " + status.code();
        } else if (!offer.expiresAt().isAfter(now)) {
            declineReason = "offer already expired";
        } else if (pending.pruneAndCount() == 0) {
            declineReason = "no waiting requests";
        } else if (owned.containsKey(id) || borrowed.containsKey(id) || inUse.containsKey(id)
                || offered.containsKey(id) || blacklist.isBlacklisted(id, now)) {
            declineReason = "instance already tracked";
        }
        if (declineReason != null) {
            log.debug("responder {} declining offer {} of {} from {}: {}", serviceId, offer.cid(), id, offer.routerId(), declineReason);
            offer.response().complete(OfferResponse.DECLINED);
            return;
        }
        // 주는 쪽의 TIMEOUT과 경합하면 먼저 완료된 쪽이 이긴다
        if (!offer.response().complete(OfferResponse.ACCEPTED)) {
            log.info("responder {} offer {} of {} resolved as {} before acceptance",
                    serviceId, offer.cid(), id, offer.response().getNow(null));
            return;
        }
        borrowed.put(id, offer);
        refreshAvailability(id, now);
        metrics.incrementCounter(MetricNames.serviceCounter(serviceId, "work-stealing", "received", "accepted"));
        log.info("responder {} accepted offer {} of instance {} from router {}", serviceId, offer.cid(), id, offer.routerId());
    }

    // ------------------------------------------------------------------ work stealing: offering side

    private void reserveIdleForOffer(ReserveIdleForOffer m, Instant now) {
        if (status != ResponderStatus.ACTIVE || !description().workStealingEnabled() || pending.pruneAndCount() > 0) {
            m.reply().complete(Optional.empty());
            return;
        }
        String idle = null;
        long oldest = Long.MAX_VALUE;
        for (String id : available) {
            if (!owned.containsKey(id) || inUse.containsKey(id) || blacklist.isBlacklisted(id, now)) continue;
            long used = lastUsed.getOrDefault(id, -1L);
            if (idle == null || used < oldest) {
                idle = id;
                oldest = used;
            }
        }
        if (idle == null) {
            m.reply().complete(Optional.empty());
            return;
        }

        WorkStealingOffer offer = WorkStealingOffer.create(
                UUID.randomUUID().toString(),
                "offer-" + serviceId + "-" + useSequence,
                settings.routerId(),
                owned.get(idle),
                now.plus(settings.reserveTimeout()));
        offered.put(idle, new OutgoingOffer(offer));
        available.remove(idle);

        offer.response().completeOnTimeout(OfferResponse.TIMEOUT, settings.reserveTimeout().toMillis(), TimeUnit.MILLISECONDS);
        offer.response().whenComplete((r, error) ->
                deliverToSelf(new OfferResolved(offer, error == null ? r : OfferResponse.DECLINED)));
        offer.returned().whenComplete((outcome, error) ->
                deliverToSelf(new OfferReturned(offer, error == null ? outcome : ReleaseOutcome.INSTANCE_ERROR)));

        if (!m.reply().complete(Optional.of(offer))) {
            offer.response().complete(OfferResponse.DECLINED);
        }
        log.info("responder {} reserved instance {} for offer {} to router {}", serviceId, idle, offer.cid(), m.targetRouterId());
    }

    private void deliverToSelf(ResponderMessage message) {
        if (!mailbox.tell(message)) {
            log.warn("responder {} could not deliver {} to itself", serviceId, message.getClass().getSimpleName());
        }
    }

    private void offerResolved(WorkStealingOffer offer, OfferResponse response, Instant now) {
        String id = offer.instance().id();
        OutgoingOffer entry = offered.get(id);
        if (entry == null || entry.offer != offer) return;
        metrics.incrementCounter(MetricNames.serviceCounter(serviceId, "work-stealing", "sent", response.code()));
        if (response == OfferResponse.ACCEPTED) {
            entry.accepted = true;
            return;
        }
        offered.remove(id);
        refreshAvailability(id, now);
        log.debug("responder {} offer {} of {} was {}, instance available again", serviceId, offer.cid(), id, response.code());
    }

    private void offerReturned(WorkStealingOffer offer, ReleaseOutcome outcome, Instant now) {
        String id = offer.instance().id();
        OutgoingOffer entry = offered.get(id);
        if (entry == null || entry.offer != offer) return;
        offered.remove(id);
        if (outcome.blacklists() && healthy.containsKey(id)) {
            blacklist.blacklist(id, null, outcome.name().toLowerCase(), now);
        }
        refreshAvailability(id, now);
        log.info("responder {} instance {} came back from router {} ({})", serviceId, id, offer.routerId(), outcome);
    }

    // ------------------------------------------------------------------ maintenance

    private void sweep(Instant now) {
        for (var it = borrowed.entrySet().iterator(); it.hasNext(); ) {
            var e = it.next();
            if (borrowedInUse.contains(e.getKey()) || e.getValue().expiresAt().isAfter(now)) continue;
            it.remove();
            available.remove(e.getKey());
            lastUsed.remove(e.getKey());
            e.getValue().returned().complete(ReleaseOutcome.UNUSED);
            log.info("responder {} reservation of borrowed instance {} expired unused", serviceId, e.getKey());
        }
        for (var it = offered.entrySet().iterator(); it.hasNext(); ) {
            var e = it.next();
            OutgoingOffer o = e.getValue();
            if (o.accepted || o.offer.expiresAt().isAfter(now)) continue;
            o.offer.response().complete(OfferResponse.TIMEOUT);
            if (o.offer.response().getNow(OfferResponse.TIMEOUT) == OfferResponse.ACCEPTED) {
                o.accepted = true;
                continue;
            }
            it.remove();
            refreshAvailability(e.getKey(), now);
        }
    }

    private void maybeTerminate() {
        if (status != ResponderStatus.DRAINING) return;
        if (!inUse.isEmpty() || pending.pruneAndCount() > 0 || !offered.isEmpty()) return;
        status = ResponderStatus.TERMINATED;
        for (WorkStealingOffer b : borrowed.values()) b.returned().complete(ReleaseOutcome.UNUSED);
        borrowed.clear();
        log.info("responder {} terminating", serviceId);
        mailbox.requestExit();
    }

    private void exited() {
        publishedStatus = ResponderStatus.TERMINATED;
        publishedPending = 0;
        for (PendingRequest p : pending.drainAll()) {
            p.reply().complete(new InstanceSelection.NoInstanceAvailable(serviceId));
        }
        for (WorkStealingOffer b : borrowed.values()) b.returned().complete(ReleaseOutcome.UNUSED);
        borrowed.clear();
        onTerminated.accept(this);
    }

    // ------------------------------------------------------------------ helpers

    private void refreshAvailability(String id, Instant now) {
        boolean selectable = (owned.containsKey(id) || (borrowed.containsKey(id) && !borrowedInUse.contains(id)))
                && !offered.containsKey(id)
                && !blacklist.isBlacklisted(id, now)
                && inUse.getOrDefault(id, 0) < description().concurrencyLevel();
        if (selectable) available.add(id); else available.remove(id);
    }

    private ServiceDescription description() {
        return descriptions.describe(serviceId);
    }

    private ResponderState snapshot() {
        return new ResponderState(serviceId, status,
                healthy.keySet(), available, inUse, offered.keySet(), borrowed.keySet(),
                blacklist.snapshot(), pending.pruneAndCount(), lastSchedulerUpdate);
    }

    private void publish(Instant now) {
        publishedPending = pending.size();
        publishedStatus = status;
        int concurrency = description().concurrencyLevel();
        long freeSlots = 0;
        for (String id : available) freeSlots += Math.max(0, concurrency - inUse.getOrDefault(id, 0));
        long busySlots = 0;
        for (int c : inUse.values()) busySlots += c;
        metrics.resetCounter(MetricNames.serviceCounter(serviceId, "slots-available"), freeSlots);
        metrics.resetCounter(MetricNames.serviceCounter(serviceId, "slots-in-use"), busySlots);
        metrics.resetCounter(MetricNames.serviceCounter(serviceId, "slots-offered"), offered.size());
        metrics.resetCounter(MetricNames.serviceCounter(serviceId, "instance-counts", "healthy"), healthy.size());
        metrics.resetCounter(MetricNames.serviceCounter(serviceId, "instance-counts", "my-instances"), owned.size());
        metrics.resetCounter(MetricNames.serviceCounter(serviceId, "instance-counts", "blacklisted"), blacklist.activeCount(now));
        metrics.resetCounter(MetricNames.serviceCounter(serviceId, "request-counts", "waiting"), publishedPending);
    }

    private static final class OutgoingOffer {
        final WorkStealingOffer offer;
        boolean accepted;

        OutgoingOffer(WorkStealingOffer offer) { this.offer = offer; }
    }
}
