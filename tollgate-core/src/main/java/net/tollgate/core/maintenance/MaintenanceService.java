package net.tollgate.core.maintenance;

import net.tollgate.core.description.ServiceDescriptionCache;
import net.tollgate.core.dispatch.InstanceRpcDispatcher;
import net.tollgate.core.spi.Clock;

import java.time.Instant;
import java.util.Map;

public final class MaintenanceService {
    private final InstanceRpcDispatcher dispatcher;
    private final ServiceDescriptionCache descriptions;
    private final Clock clock;

    public MaintenanceService(InstanceRpcDispatcher dispatcher,
                              ServiceDescriptionCache descriptions,
                              Clock clock) {
        this.dispatcher = dispatcher;
        this.descriptions = descriptions;
        this.clock = clock;
    }

    /**
     * 주기 점검 메인 루틴.
     * - 모든 Responder에 sweep (블랙리스트/예약 만료, DRAINING 종료 판단)
     * - 종료된 Responder 회수
     * - 대기 요청 집계
     */
    public MaintenanceReport runOnce(boolean refreshDescriptions) {
        Instant now = clock.now();
        MaintenanceReport r = new MaintenanceReport();

        // 1) sweep
        r.sweptResponders = dispatcher.sweepAll();

        // 2) onExit에서 빠진 종료 Responder 정리
        r.reapedResponders = dispatcher.reapTerminated();

        // 3) 서비스 설명 캐시 비우기 (옵션)
        if (refreshDescriptions && descriptions != null) {
            descriptions.invalidateAll();
            r.descriptionsRefreshed = true;
        }

        Map<String, Integer> pending = dispatcher.pendingRequestCounts();
        r.waitingRequests = pending.values().stream().mapToInt(Integer::intValue).sum();
        r.activeResponders = dispatcher.responderCount();
        r.timestamp = now;
        return r;
    }

    /** 간단 리포트 DTO */
    public static final class MaintenanceReport {
        public Instant timestamp;
        public int sweptResponders;
        public int reapedResponders;
        public int activeResponders;
        public int waitingRequests;
        public boolean descriptionsRefreshed;

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", sweptResponders=" + sweptResponders +
                    ", reapedResponders=" + reapedResponders +
                    ", activeResponders=" + activeResponders +
                    ", waitingRequests=" + waitingRequests +
                    ", descriptionsRefreshed=" + descriptionsRefreshed +
                    '}';
        }
    }
}
