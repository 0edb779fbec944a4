package net.tollgate.core.responder;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

final class PendingRequestQueue {
    private final PriorityQueue<PendingRequest> queue;
    private long arrivals;

    PendingRequestQueue(Comparator<PendingRequest> order) {
        this.queue = new PriorityQueue<>(order);
    }

    long nextArrival() {
        return arrivals++;
    }

    void add(PendingRequest request) {
        queue.add(request);
    }

    /** 포기된 요청을 건너뛰고 다음 대기 요청을 꺼낸다 */
    PendingRequest pollLive() {
        PendingRequest p;
        while ((p = queue.poll()) != null) {
            if (!p.abandoned()) return p;
        }
        return null;
    }

    /** 포기된 요청을 치우고 남은 개수 */
    int pruneAndCount() {
        queue.removeIf(PendingRequest::abandoned);
        return queue.size();
    }

    int size() {
        return queue.size();
    }

    boolean isEmpty() {
        return pruneAndCount() == 0;
    }

    List<PendingRequest> drainAll() {
        List<PendingRequest> all = new ArrayList<>(queue);
        queue.clear();
        return all;
    }
}
