package com.aska.ghostlink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * 握手完成前收到的工具调用
 *
 * 有容量上限；超过存活时间的请求在取出时直接丢弃，不再回复。
 * 只在连接线程上使用，不做同步。
 */
class PendingRequestQueue {

    private static final Logger log = LoggerFactory.getLogger(Config.LOG_TAG + ".Pending");

    static final class PendingRequest {
        final RpcRequest request;
        final long enqueuedAt;

        PendingRequest(RpcRequest request, long enqueuedAt) {
            this.request = request;
            this.enqueuedAt = enqueuedAt;
        }
    }

    private final Deque<PendingRequest> queue = new ArrayDeque<>();
    private final int capacity;
    private final long maxAgeMs;
    private final LongSupplier clock;

    PendingRequestQueue() {
        this(Config.MAX_PENDING_REQUESTS, Config.PENDING_REQUEST_TIMEOUT_MS, System::currentTimeMillis);
    }

    PendingRequestQueue(int capacity, long maxAgeMs, LongSupplier clock) {
        this.capacity = capacity;
        this.maxAgeMs = maxAgeMs;
        this.clock = clock;
    }

    /**
     * @return 已满时返回 false
     */
    boolean offer(RpcRequest request) {
        purgeExpired();
        if (queue.size() >= capacity) {
            return false;
        }
        queue.addLast(new PendingRequest(request, clock.getAsLong()));
        return true;
    }

    /**
     * 按到达顺序取出全部未过期请求并清空队列
     */
    List<RpcRequest> drain() {
        long now = clock.getAsLong();
        List<RpcRequest> ready = new ArrayList<>(queue.size());
        int expired = 0;
        PendingRequest pending;
        while ((pending = queue.pollFirst()) != null) {
            if (isExpired(pending, now)) {
                expired++;
            } else {
                ready.add(pending.request);
            }
        }
        if (expired > 0) {
            log.info("Dropped {} expired pending request(s)", expired);
        }
        return ready;
    }

    int size() {
        return queue.size();
    }

    boolean isEmpty() {
        return queue.isEmpty();
    }

    int clear() {
        int dropped = queue.size();
        queue.clear();
        return dropped;
    }

    private void purgeExpired() {
        long now = clock.getAsLong();
        while (!queue.isEmpty() && isExpired(queue.peekFirst(), now)) {
            queue.pollFirst();
        }
    }

    private boolean isExpired(PendingRequest pending, long now) {
        return now - pending.enqueuedAt > maxAgeMs;
    }
}
