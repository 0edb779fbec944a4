package net.tollgate.core.workstealing;

import net.tollgate.core.dispatch.InstanceRpcDispatcher;
import net.tollgate.core.model.OfferResponse;
import net.tollgate.core.model.WorkStealingOffer;
import net.tollgate.core.spi.ClusterState;
import net.tollgate.core.spi.RouterTransport;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * 한 JVM 안의 라우터들을 묶는 클러스터 상태 + 전송.
 * 대기 요청 수는 각 dispatcher에서 직접 읽는다.
 */
public final class InProcessCluster implements ClusterState, RouterTransport {

    private record Member(InstanceRpcDispatcher dispatcher, WorkStealingCoordinator coordinator) {}

    private final Map<String, Member> members = new ConcurrentSkipListMap<>();

    public void join(String routerId, InstanceRpcDispatcher dispatcher, WorkStealingCoordinator coordinator) {
        members.put(routerId, new Member(dispatcher, coordinator));
    }

    public void leave(String routerId) {
        members.remove(routerId);
    }

    @Override public List<String> routerIds() {
        return new ArrayList<>(members.keySet());
    }

    @Override public List<String> routersWithPendingRequests(String serviceId) {
        List<Map.Entry<String, Integer>> waiting = new ArrayList<>();
        for (var e : members.entrySet()) {
            int n = e.getValue().dispatcher().pendingRequestCounts().getOrDefault(serviceId, 0);
            if (n > 0) waiting.add(Map.entry(e.getKey(), n));
        }
        waiting.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()));
        List<String> routers = new ArrayList<>();
        for (var e : waiting) routers.add(e.getKey());
        return routers;
    }

    @Override public CompletableFuture<OfferResponse> sendOffer(String routerId, WorkStealingOffer offer) {
        Member m = members.get(routerId);
        if (m == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("unknown router " + routerId));
        }
        try {
            return m.coordinator().receiveOffer(offer);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
