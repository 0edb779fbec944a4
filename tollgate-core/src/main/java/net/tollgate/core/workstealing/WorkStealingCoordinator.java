package net.tollgate.core.workstealing;

import net.tollgate.core.config.RouterSettings;
import net.tollgate.core.description.ServiceDescriptionLookup;
import net.tollgate.core.dispatch.InstanceRpcDispatcher;
import net.tollgate.core.metrics.MetricNames;
import net.tollgate.core.model.OfferResponse;
import net.tollgate.core.model.WorkStealingOffer;
import net.tollgate.core.spi.ClusterState;
import net.tollgate.core.spi.MetricsSink;
import net.tollgate.core.spi.RouterTransport;
import net.tollgate.core.support.InvalidRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 라우터 간 work stealing.
 * 주는 쪽: 유휴 인스턴스를 예약해 대기 요청이 있는 라우터에 제안한다.
 * 받는 쪽: 들어온 제안을 검증해 로컬 Responder에 넘긴다.
 */
public final class WorkStealingCoordinator {
    private static final Logger log = LoggerFactory.getLogger(WorkStealingCoordinator.class);

    private final RouterSettings settings;
    private final InstanceRpcDispatcher dispatcher;
    private final ServiceDescriptionLookup descriptions;
    private final ClusterState cluster;
    private final RouterTransport transport;
    private final MetricsSink metrics;

    private final Map<String, WorkStealingOffer> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong sent = new AtomicLong();
    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong declined = new AtomicLong();
    private final AtomicLong timedOut = new AtomicLong();
    private final AtomicLong received = new AtomicLong();

    public WorkStealingCoordinator(RouterSettings settings,
                                   InstanceRpcDispatcher dispatcher,
                                   ServiceDescriptionLookup descriptions,
                                   ClusterState cluster,
                                   RouterTransport transport,
                                   MetricsSink metrics) {
        this.settings = settings;
        this.dispatcher = dispatcher;
        this.descriptions = descriptions;
        this.cluster = cluster;
        this.transport = transport;
        this.metrics = metrics;
    }

    /**
     * 한 번 돌면서 도움이 필요한 라우터마다 인스턴스 하나씩 예약을 시도한다.
     * @return 예약을 요청한 (서비스, 라우터) 쌍의 수
     */
    public int offerHelpOnce() {
        int asked = 0;
        for (String serviceId : dispatcher.serviceIds()) {
            if (!descriptions.describe(serviceId).workStealingEnabled()) continue;
            List<String> needy;
            try {
                needy = cluster.routersWithPendingRequests(serviceId);
            } catch (RuntimeException e) {
                log.warn("unable to read cluster state for service {}", serviceId, e);
                continue;
            }
            for (String peer : needy) {
                if (peer.equals(settings.routerId())) continue;
                asked++;
                dispatcher.reserveIdleForOffer(serviceId, peer)
                        .thenAccept(reserved -> reserved.ifPresent(offer -> sendOffer(peer, offer)));
            }
        }
        return asked;
    }

    private void sendOffer(String peer, WorkStealingOffer offer) {
        inFlight.put(offer.cid(), offer);
        sent.incrementAndGet();
        metrics.incrementCounter(MetricNames.routerCounter("work-stealing", "offers", "sent"));
        log.info("offering instance {} of service {} to router {} (cid={})",
                offer.instance().id(), offer.serviceId(), peer, offer.cid());

        offer.response().whenComplete((response, error) -> resolved(offer, error == null ? response : OfferResponse.DECLINED));
        offer.returned().whenComplete((outcome, error) -> inFlight.remove(offer.cid()));

        CompletableFuture<OfferResponse> reply;
        try {
            reply = transport.sendOffer(peer, offer);
        } catch (RuntimeException e) {
            log.warn("sending offer {} to router {} failed", offer.cid(), peer, e);
            offer.response().complete(OfferResponse.DECLINED);
            return;
        }
        reply.whenComplete((response, error) -> {
            if (error != null) {
                log.warn("offer {} to router {} failed: {}", offer.cid(), peer, error.toString());
                offer.response().complete(OfferResponse.DECLINED);
            } else {
                offer.response().complete(response);
            }
        });
    }

    private void resolved(WorkStealingOffer offer, OfferResponse response) {
        switch (response) {
            case ACCEPTED -> accepted.incrementAndGet();
            case DECLINED -> declined.incrementAndGet();
            case TIMEOUT -> timedOut.incrementAndGet();
        }
        if (response != OfferResponse.ACCEPTED) inFlight.remove(offer.cid());
        metrics.incrementCounter(MetricNames.routerCounter("work-stealing", "offers", response.code()));
        log.info("offer {} of instance {} resolved: {}", offer.cid(), offer.instance().id(), response.code());
    }

    /**
     * 다른 라우터가 보낸 제안을 받는다.
     * @throws InvalidRequestException 필수 필드 누락
     */
    public CompletableFuture<OfferResponse> receiveOffer(WorkStealingOffer offer) {
        validate(offer);
        received.incrementAndGet();
        metrics.incrementCounter(MetricNames.routerCounter("work-stealing", "offers", "received"));
        return dispatcher.offerInstance(offer);
    }

    static void validate(WorkStealingOffer offer) {
        if (offer == null) throw new InvalidRequestException("offer is required");
        List<String> missing = new ArrayList<>();
        if (blank(offer.cid())) missing.add("cid");
        if (offer.instance() == null) missing.add("instance");
        if (blank(offer.requestId())) missing.add("request-id");
        if (blank(offer.routerId())) missing.add("router-id");
        if (blank(offer.serviceId())) missing.add("service-id");
        if (offer.expiresAt() == null) missing.add("expires-at");
        if (offer.response() == null || offer.returned() == null) missing.add("reply channel");
        if (!missing.isEmpty()) {
            throw new InvalidRequestException("work-stealing offer is missing " + String.join(", ", missing));
        }
        if (!offer.serviceId().equals(offer.instance().serviceId())) {
            throw new InvalidRequestException("offered instance " + offer.instance().id()
                    + " does not belong to service " + offer.serviceId());
        }
    }

    private static boolean blank(String s) {
        return s == null || s.isBlank();
    }

    public WorkStealingState queryState() {
        List<String> cids = new ArrayList<>(inFlight.keySet());
        cids.sort(null);
        return new WorkStealingState(settings.routerId(), cids,
                sent.get(), accepted.get(), declined.get(), timedOut.get(), received.get());
    }

    /** 해당 서비스의 진행 중 제안 cid */
    public List<String> offersInFlight(String serviceId) {
        List<String> cids = new ArrayList<>();
        for (WorkStealingOffer o : inFlight.values()) {
            if (o.serviceId().equals(serviceId)) cids.add(o.cid());
        }
        cids.sort(null);
        return cids;
    }
}
