package com.aska.ghostlink;

/**
 * 重连退避：从初始延迟开始每次翻倍，不超过上限；连接成功后复位
 */
public class ReconnectBackoff {

    private final long initialDelayMs;
    private final long maxDelayMs;
    private long nextDelayMs;

    public ReconnectBackoff() {
        this(Config.INITIAL_RETRY_DELAY_MS, Config.MAX_RETRY_DELAY_MS);
    }

    public ReconnectBackoff(long initialDelayMs, long maxDelayMs) {
        if (initialDelayMs <= 0 || maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException("invalid backoff bounds: " + initialDelayMs + ", " + maxDelayMs);
        }
        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.nextDelayMs = initialDelayMs;
    }

    /**
     * 取本次失败应等待的时间，并把下一次翻倍
     */
    public synchronized long nextDelay() {
        long delay = nextDelayMs;
        nextDelayMs = Math.min(nextDelayMs * 2, maxDelayMs);
        return delay;
    }

    public synchronized long peek() {
        return nextDelayMs;
    }

    public synchronized void reset() {
        nextDelayMs = initialDelayMs;
    }
}
