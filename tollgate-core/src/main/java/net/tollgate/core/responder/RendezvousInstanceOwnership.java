package net.tollgate.core.responder;

import net.tollgate.core.model.ServiceInstance;
import net.tollgate.core.spi.ClusterState;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.CRC32;

/**
 * rendezvous(HRW) 해싱으로 인스턴스마다 라우터 하나를 고른다.
 * 멤버십이 바뀌어도 다른 라우터의 인스턴스는 대부분 그대로 남는다.
 */
public final class RendezvousInstanceOwnership implements InstanceOwnership {
    private final String routerId;
    private final ClusterState cluster;

    public RendezvousInstanceOwnership(String routerId, ClusterState cluster) {
        this.routerId = routerId;
        this.cluster = cluster;
    }

    @Override public boolean ownedLocally(ServiceInstance instance) {
        List<String> routers = cluster.routerIds();
        if (routers.isEmpty()) return true;
        String winner = null;
        long best = Long.MIN_VALUE;
        for (String r : routers) {
            long w = weight(r, instance.id());
            if (winner == null || w > best || (w == best && r.compareTo(winner) < 0)) {
                winner = r;
                best = w;
            }
        }
        return routerId.equals(winner);
    }

    static long weight(String routerId, String instanceId) {
        CRC32 crc = new CRC32();
        crc.update((routerId + '|' + instanceId).getBytes(StandardCharsets.UTF_8));
        return crc.getValue();
    }
}
