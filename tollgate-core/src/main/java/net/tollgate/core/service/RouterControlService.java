package net.tollgate.core.service;

import net.tollgate.core.config.RouterSettings;
import net.tollgate.core.dispatch.InstanceRpcDispatcher;
import net.tollgate.core.interstitial.InterstitialGate;
import net.tollgate.core.interstitial.InterstitialGateState;
import net.tollgate.core.interstitial.InterstitialPromise;
import net.tollgate.core.interstitial.InterstitialServiceState;
import net.tollgate.core.model.BlacklistResult;
import net.tollgate.core.model.InstanceSelection;
import net.tollgate.core.model.OfferResponse;
import net.tollgate.core.model.RequestContext;
import net.tollgate.core.model.ResponderState;
import net.tollgate.core.model.ServiceInstance;
import net.tollgate.core.model.WorkStealingOffer;
import net.tollgate.core.spi.Clock;
import net.tollgate.core.spi.SchedulerClient;
import net.tollgate.core.support.InvalidRequestException;
import net.tollgate.core.workstealing.WorkStealingCoordinator;
import net.tollgate.core.workstealing.WorkStealingState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

/**
 * 관리용 요청 처리 (블랙리스트, work-stealing 수신, 상태 조회).
 * 요청 본문은 JSON을 풀어놓은 Map 형태로 받는다.
 */
public final class RouterControlService {
    private static final Logger log = LoggerFactory.getLogger(RouterControlService.class);

    static final String KILLED = "killed";

    private final RouterSettings settings;
    private final InstanceRpcDispatcher dispatcher;
    private final WorkStealingCoordinator workStealing;
    private final InterstitialGate gate;
    private final SchedulerClient scheduler;
    private final Clock clock;

    public RouterControlService(RouterSettings settings,
                                InstanceRpcDispatcher dispatcher,
                                WorkStealingCoordinator workStealing,
                                InterstitialGate gate,
                                SchedulerClient scheduler,
                                Clock clock) {
        this.settings = settings;
        this.dispatcher = dispatcher;
        this.workStealing = workStealing;
        this.gate = gate;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    // ------------------------------------------------------------------ blacklist

    /**
     * {"instance": {"id", "service-id", ...}, "period-in-ms": n, "reason": "..."}
     * 200 성공, 400 입력 오류, 423 사용 중, 503 그 외/타임아웃
     */
    public CompletableFuture<ControlResponse> blacklistInstance(Map<String, ?> request) {
        Map<String, ?> instance;
        String instanceId;
        String serviceId;
        String reason;
        long periodMs;
        try {
            instance = mapField(request, "instance");
            instanceId = stringField(instance, "id");
            serviceId = stringField(instance, "service-id");
            reason = stringField(request, "reason");
            Object period = request == null ? null : request.get("period-in-ms");
            if (!(period instanceof Integer || period instanceof Long) || ((Number) period).longValue() <= 0) {
                throw new InvalidRequestException("period-in-ms must be a positive integer");
            }
            periodMs = ((Number) period).longValue();
            if (instanceId == null || serviceId == null || reason == null) {
                throw new InvalidRequestException("missing field");
            }
        } catch (InvalidRequestException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("input-data", request);
            return CompletableFuture.completedFuture(ControlResponse.error(ControlResponse.BAD_REQUEST,
                    "Must provide the service-id, the instance id, the reason, and a positive period", details));
        }

        return dispatcher.blacklistInstance(serviceId, instanceId, Duration.ofMillis(periodMs), reason)
                .handle((result, error) -> {
                    String code = error != null ? failureCode(error) : result.code();
                    if (result == BlacklistResult.BLACKLISTED) {
                        log.info("blacklist {} of {} response: {}", instanceId, serviceId, code);
                        if (KILLED.equals(reason)) notifyKilled(instance, instanceId, serviceId);
                        Map<String, Object> body = new LinkedHashMap<>();
                        body.put("instance-id", instanceId);
                        body.put("blacklist-period", periodMs);
                        return ControlResponse.ok(body);
                    }
                    log.warn("blacklist {} of {} response: {}", instanceId, serviceId, code);
                    int status = result == BlacklistResult.IN_USE ? ControlResponse.LOCKED : ControlResponse.UNAVAILABLE;
                    return ControlResponse.error(status, "Unable to blacklist instance.",
                            Map.of("instance-id", instanceId, "reason", code));
                });
    }

    private void notifyKilled(Map<String, ?> instance, String instanceId, String serviceId) {
        ServiceInstance killed = new ServiceInstance(instanceId, serviceId,
                optionalString(instance, "host"), optionalInt(instance, "port"), optionalString(instance, "log-directory"));
        try {
            scheduler.instanceKilled(killed);
        } catch (Exception e) {
            log.warn("scheduler was not notified about killed instance {}", instanceId, e);
        }
    }

    /** 이 라우터에서 블랙리스트에 있는 인스턴스 id */
    public CompletableFuture<ControlResponse> blacklistedInstances(String serviceId) {
        if (serviceId == null || serviceId.isBlank()) {
            return CompletableFuture.completedFuture(badRequest("Missing service-id!"));
        }
        return dispatcher.queryState(serviceId).handle((state, error) -> {
            if (error != null) return unavailable("Unable to query blacklisted instances.", error);
            List<String> ids = new ArrayList<>(state.map(s -> s.blacklisted().keySet()).orElse(Set.of()));
            ids.sort(null);
            return ControlResponse.ok(Map.of("blacklisted-instances", ids));
        });
    }

    // ------------------------------------------------------------------ work stealing

    /**
     * 다른 라우터가 보낸 제안.
     * {"cid", "instance": {...}, "request-id", "router-id", "service-id"}
     */
    public CompletableFuture<ControlResponse> workStealingOffer(Map<String, ?> request) {
        WorkStealingOffer offer;
        try {
            offer = toOffer(request);
        } catch (InvalidRequestException e) {
            return CompletableFuture.completedFuture(badRequest(e.getMessage()));
        }
        log.info("received work-stealing offer {} of {} from {}", offer.instance().id(), offer.serviceId(), offer.routerId());
        CompletableFuture<OfferResponse> response;
        try {
            response = workStealing.receiveOffer(offer);
        } catch (InvalidRequestException e) {
            return CompletableFuture.completedFuture(badRequest(e.getMessage()));
        }
        return response.handle((status, error) -> {
            if (error != null) return unavailable("Unable to process work-stealing offer.", error);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("cid", offer.cid());
            body.put("request-id", offer.requestId());
            body.put("router-id", offer.routerId());
            body.put("service-id", offer.serviceId());
            body.put("response-status", status.code());
            return ControlResponse.ok(body);
        });
    }

    private WorkStealingOffer toOffer(Map<String, ?> request) {
        String cid = stringField(request, "cid");
        Map<String, ?> instance = request == null ? null
                : request.get("instance") instanceof Map<?, ?> ? mapField(request, "instance") : null;
        String requestId = stringField(request, "request-id");
        String routerId = stringField(request, "router-id");
        String serviceId = stringField(request, "service-id");
        if (cid == null || instance == null || requestId == null || routerId == null || serviceId == null) {
            throw new InvalidRequestException("Missing one of cid, instance, request-id, router-id or service-id!");
        }
        String instanceId = stringField(instance, "id");
        if (instanceId == null) throw new InvalidRequestException("offered instance has no id");
        String instanceServiceId = Optional.ofNullable(stringField(instance, "service-id")).orElse(serviceId);
        ServiceInstance si = new ServiceInstance(instanceId, instanceServiceId,
                optionalString(instance, "host"), optionalInt(instance, "port"), optionalString(instance, "log-directory"));
        Instant expiresAt = clock.now().plus(settings.reserveTimeout());
        return new WorkStealingOffer(cid, requestId, routerId, serviceId, si, expiresAt,
                new CompletableFuture<>(), new CompletableFuture<>());
    }

    // ------------------------------------------------------------------ queries

    /** responder + work-stealing + interstitial 상태를 합쳐서 */
    public CompletableFuture<ControlResponse> serviceState(String serviceId) {
        if (serviceId == null || serviceId.isBlank()) {
            return CompletableFuture.completedFuture(badRequest("Missing service-id!"));
        }
        CompletableFuture<Object> responder = dispatcher.queryState(serviceId)
                .<Object>thenApply(s -> s.map(RouterControlService::describe).orElse(Map.of()))
                .exceptionally(RouterControlService::timeoutBody);
        CompletableFuture<Object> interstitial = gate.queryState(serviceId)
                .<Object>thenApply(RouterControlService::describe)
                .exceptionally(RouterControlService::timeoutBody);

        Map<String, Object> workStealingState = describe(workStealing.queryState());
        workStealingState.put("service-offers-in-flight", workStealing.offersInFlight(serviceId));

        return responder.thenCombine(interstitial, (r, i) -> {
            Map<String, Object> state = new TreeMap<>();
            state.put("responder-state", r);
            state.put("work-stealing-state", workStealingState);
            state.put("interstitial-state", i);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("router-id", settings.routerId());
            body.put("state", state);
            return ControlResponse.ok(body);
        });
    }

    public ControlResponse ensureInterstitialGate(String serviceId, int interstitialSecs) {
        if (serviceId == null || serviceId.isBlank()) return badRequest("Missing service-id!");
        if (interstitialSecs < 0) return badRequest("interstitial-secs must be >= 0");
        InterstitialPromise promise = gate.ensure(serviceId, interstitialSecs);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service-id", serviceId);
        body.put("interstitial", promise.describe());
        body.put("created-at", promise.createdAt().toString());
        return ControlResponse.ok(body);
    }

    public CompletableFuture<ControlResponse> queryAllInterstitialState() {
        return gate.queryAllState().handle((state, error) -> {
            if (error != null) return unavailable("Unable to query interstitial state.", error);
            return ControlResponse.ok(describe(state));
        });
    }

    public CompletableFuture<ControlResponse> selectInstanceForRequest(String serviceId) {
        if (serviceId == null || serviceId.isBlank()) {
            return CompletableFuture.completedFuture(badRequest("Missing service-id!"));
        }
        RequestContext request = RequestContext.of(UUID.randomUUID().toString());
        return dispatcher.selectInstanceForRequest(serviceId, request).handle((selection, error) -> {
            if (error != null) return unavailable("Unable to select an instance.", error);
            if (selection instanceof InstanceSelection.Selected s) {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("instance-id", s.instance().id());
                body.put("host", s.instance().host());
                body.put("port", s.instance().port());
                body.put("borrowed", s.borrowed());
                return ControlResponse.ok(body);
            }
            if (selection instanceof InstanceSelection.QueueFull q) {
                return ControlResponse.error(ControlResponse.UNAVAILABLE, q.message(), Map.of("service-id", serviceId));
            }
            return ControlResponse.error(ControlResponse.UNAVAILABLE, "no-instance-available", Map.of("service-id", serviceId));
        });
    }

    // ------------------------------------------------------------------ helpers

    static Map<String, Object> describe(ResponderState s) {
        Map<String, Object> m = new TreeMap<>();
        m.put("status", s.status().code());
        m.put("healthy-instances", sorted(s.healthyInstanceIds()));
        m.put("available-instances", sorted(s.availableInstanceIds()));
        m.put("in-use", new TreeMap<>(s.inUse()));
        m.put("offered-instances", sorted(s.offeredInstanceIds()));
        m.put("borrowed-instances", sorted(s.borrowedInstanceIds()));
        Map<String, Object> blacklisted = new TreeMap<>();
        s.blacklisted().forEach((id, e) -> blacklisted.put(id, Map.of(
                "expires-at", e.expiresAt().toString(),
                "consecutive-failures", e.consecutiveFailures(),
                "reason", e.reason() == null ? "" : e.reason())));
        m.put("blacklisted", blacklisted);
        m.put("pending-requests", s.pendingRequests());
        m.put("last-scheduler-update", s.lastSchedulerUpdate() == null ? null : s.lastSchedulerUpdate().toString());
        return m;
    }

    static Map<String, Object> describe(WorkStealingState s) {
        Map<String, Object> m = new TreeMap<>();
        m.put("router-id", s.routerId());
        m.put("offers-in-flight", s.offersInFlight());
        m.put("sent", s.offersSent());
        m.put("accepted", s.offersAccepted());
        m.put("declined", s.offersDeclined());
        m.put("timeout", s.offersTimedOut());
        m.put("received", s.offersReceived());
        return m;
    }

    static Map<String, Object> describe(InterstitialServiceState s) {
        Map<String, Object> m = new TreeMap<>();
        m.put("available", s.available());
        m.put("interstitial", s.interstitial());
        return m;
    }

    static Map<String, Object> describe(InterstitialGateState s) {
        Map<String, Object> m = new TreeMap<>();
        m.put("initialized", s.initialized());
        m.put("service-id->interstitial-promise", new TreeMap<>(s.promises()));
        m.put("available-service-ids", sorted(s.availableServiceIds()));
        return m;
    }

    private static List<String> sorted(Collection<String> ids) {
        List<String> list = new ArrayList<>(ids);
        list.sort(null);
        return list;
    }

    private static Object timeoutBody(Throwable error) {
        return Map.of("message", unwrap(error) instanceof TimeoutException ? "Request timeout" : String.valueOf(unwrap(error).getMessage()));
    }

    private static String failureCode(Throwable error) {
        return unwrap(error) instanceof TimeoutException ? "timeout" : "unavailable";
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private static ControlResponse badRequest(String message) {
        return ControlResponse.error(ControlResponse.BAD_REQUEST, message, Map.of());
    }

    private static ControlResponse unavailable(String message, Throwable error) {
        log.warn("{} {}", message, unwrap(error).toString());
        return ControlResponse.error(ControlResponse.UNAVAILABLE, message, Map.of("reason", failureCode(error)));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> mapField(Map<String, ?> m, String key) {
        Object v = m == null ? null : m.get(key);
        if (!(v instanceof Map)) throw new InvalidRequestException(key + " is required");
        return (Map<String, ?>) v;
    }

    private static String stringField(Map<String, ?> m, String key) {
        Object v = m == null ? null : m.get(key);
        if (v == null) return null;
        String s = v.toString();
        return s.isBlank() ? null : s;
    }

    private static String optionalString(Map<String, ?> m, String key) {
        return stringField(m, key);
    }

    private static int optionalInt(Map<String, ?> m, String key) {
        Object v = m == null ? null : m.get(key);
        return v instanceof Number n ? n.intValue() : 0;
    }
}
