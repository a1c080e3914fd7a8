package com.aska.ghostlink;

import org.junit.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PendingRequestQueueTest {

    private final AtomicLong now = new AtomicLong(1_000L);
    private final PendingRequestQueue queue = new PendingRequestQueue(3, 30_000L, now::get);

    private static RpcRequest call(int id) {
        return new RpcRequest(id, McpProtocolHandler.METHOD_TOOLS_CALL, null);
    }

    @Test
    public void rejectsBeyondCapacity() {
        assertTrue(queue.offer(call(1)));
        assertTrue(queue.offer(call(2)));
        assertTrue(queue.offer(call(3)));

        assertFalse(queue.offer(call(4)));
        assertEquals(3, queue.size());
    }

    @Test
    public void drainsInArrivalOrder() {
        queue.offer(call(1));
        queue.offer(call(2));
        queue.offer(call(3));

        List<RpcRequest> drained = queue.drain();

        assertEquals(3, drained.size());
        assertEquals(1, drained.get(0).id);
        assertEquals(3, drained.get(2).id);
        assertTrue(queue.isEmpty());
    }

    @Test
    public void expiredRequestsAreDroppedOnDrain() {
        queue.offer(call(1));
        now.addAndGet(20_000L);
        queue.offer(call(2));
        now.addAndGet(15_000L);

        List<RpcRequest> drained = queue.drain();

        assertEquals(1, drained.size());
        assertEquals(2, drained.get(0).id);
    }

    @Test
    public void expiredHeadFreesCapacity() {
        queue.offer(call(1));
        queue.offer(call(2));
        queue.offer(call(3));
        now.addAndGet(30_001L);

        assertTrue(queue.offer(call(4)));
        assertEquals(1, queue.size());
    }

    @Test
    public void clearReportsDroppedCount() {
        queue.offer(call(1));
        queue.offer(call(2));

        assertEquals(2, queue.clear());
        assertTrue(queue.drain().isEmpty());
    }
}
