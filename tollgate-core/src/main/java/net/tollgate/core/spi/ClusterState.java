package net.tollgate.core.spi;

import java.util.List;

/** 분산 라우터 상태 조회 (gossip 등으로 채워짐) */
public interface ClusterState {
    List<String> routerIds();

    /** 해당 서비스에 대기 요청이 있는 라우터들, 대기 수가 많은 순 */
    List<String> routersWithPendingRequests(String serviceId);

    static ClusterState standalone(String routerId) {
        return new ClusterState() {
            @Override public List<String> routerIds() { return List.of(routerId); }
            @Override public List<String> routersWithPendingRequests(String serviceId) { return List.of(); }
        };
    }
}
