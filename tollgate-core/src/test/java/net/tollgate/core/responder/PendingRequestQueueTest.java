package net.tollgate.core.responder;

import net.tollgate.core.model.InstanceSelection;
import net.tollgate.core.model.RequestContext;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

@TestMethodOrder(MethodOrderer.MethodName.class)
class PendingRequestQueueTest {

    private static PendingRequest add(PendingRequestQueue q, String id, int priority) {
        PendingRequest p = new PendingRequest(new RequestContext(id, priority), q.nextArrival(),
                Instant.EPOCH, new CompletableFuture<InstanceSelection>());
        q.add(p);
        return p;
    }

    private static List<String> drainIds(PendingRequestQueue q) {
        List<String> ids = new ArrayList<>();
        PendingRequest p;
        while ((p = q.pollLive()) != null) ids.add(p.request().requestId());
        return ids;
    }

    // ========== t1: priority 우선, 같으면 FIFO ==========
    @Test
    void t1_priority_then_arrival() {
        PendingRequestQueue q = new PendingRequestQueue(PendingRequestOrder.priorityThenArrival());
        add(q, "low-1", 0);
        add(q, "high-1", 5);
        add(q, "low-2", 0);
        add(q, "high-2", 5);

        assertEquals(List.of("high-1", "high-2", "low-1", "low-2"), drainIds(q));
    }

    @Test
    void t2_arrival_order_ignores_priority() {
        PendingRequestQueue q = new PendingRequestQueue(PendingRequestOrder.arrival());
        add(q, "a", 0);
        add(q, "b", 9);
        add(q, "c", 3);
        assertEquals(List.of("a", "b", "c"), drainIds(q));
    }

    // ========== t3: 포기된 요청은 건너뛴다 ==========
    @Test
    void t3_abandoned_requests_are_skipped_and_pruned() {
        PendingRequestQueue q = new PendingRequestQueue(PendingRequestOrder.priorityThenArrival());
        PendingRequest gone = add(q, "gone", 1);
        add(q, "kept", 0);
        gone.reply().cancel(false);

        assertEquals(1, q.pruneAndCount());
        assertFalse(q.isEmpty());
        assertEquals(List.of("kept"), drainIds(q));
        assertTrue(q.isEmpty());
    }

    @Test
    void t4_drain_all_empties_the_queue() {
        PendingRequestQueue q = new PendingRequestQueue(PendingRequestOrder.arrival());
        add(q, "a", 0);
        add(q, "b", 0);
        assertEquals(2, q.drainAll().size());
        assertEquals(0, q.size());
    }
}
