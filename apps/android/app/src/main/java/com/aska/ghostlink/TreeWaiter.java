package com.aska.ghostlink;

import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * 等待界面条件
 *
 * 在调用线程上按固定间隔轮询树快照，直到控件出现（或消失）或超时。
 * 间隔和最长等待时间由调用方传入，缺省取配置。线程被中断时立即结束。
 */
public class TreeWaiter {

    private static final Logger log = LoggerFactory.getLogger(Config.LOG_TAG + ".Wait");

    private final CommandExecutor executor;
    private final ConfigStore config;

    public TreeWaiter(CommandExecutor executor, ConfigStore config) {
        this.executor = executor;
        this.config = config;
    }

    void registerAll(ActionDispatcher dispatcher) {
        dispatcher.register("wait", this::handle, "element.wait");
    }

    /**
     * 轮询结果
     */
    public static final class Outcome {
        public final boolean satisfied;
        public final RawNode node;
        public final int attempts;
        public final long elapsedMs;

        Outcome(boolean satisfied, RawNode node, int attempts, long elapsedMs) {
            this.satisfied = satisfied;
            this.node = node;
            this.attempts = attempts;
            this.elapsedMs = elapsedMs;
        }
    }

    /**
     * @param gone true 等待控件消失，false 等待控件出现
     * @throws InterruptedException 等待被中断
     */
    public Outcome await(ElementFinder.Locator locator, boolean gone, long intervalMs, long timeoutMs)
            throws InterruptedException {
        long interval = Math.max(1L, intervalMs);
        long start = System.nanoTime();
        long deadline = start + TimeUnit.MILLISECONDS.toNanos(Math.max(0L, timeoutMs));
        int attempts = 0;

        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("wait cancelled");
            }
            attempts++;
            RawNode root = executor.snapshot();
            RawNode node = root != null ? ElementFinder.find(root, locator) : null;
            boolean satisfied = gone ? node == null : node != null;
            long now = System.nanoTime();
            if (satisfied) {
                return new Outcome(true, node, attempts, TimeUnit.NANOSECONDS.toMillis(now - start));
            }
            if (now >= deadline) {
                return new Outcome(false, null, attempts, TimeUnit.NANOSECONDS.toMillis(now - start));
            }
            long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - now);
            Thread.sleep(Math.max(1L, Math.min(interval, remaining)));
        }
    }

    /**
     * 参数：定位条件、state（visible / gone）、interval、timeout（毫秒）
     */
    ApiResponse handle(JSONObject params) {
        ElementFinder.Locator locator = ElementFinder.Locator.from(params);
        if (locator.isEmpty()) {
            return ApiResponse.error(ErrorCode.MISSING_PARAMETER, ElementActions.NO_CRITERIA);
        }
        String state = Params.getString(params, "state", "visible").toLowerCase(Locale.ROOT);
        if (!state.equals("visible") && !state.equals("gone")) {
            throw new IllegalArgumentException("state must be visible or gone");
        }
        long interval = Params.getLong(params, "interval",
            config.getLong(Config.KEY_WAIT_INTERVAL, Config.DEFAULT_WAIT_INTERVAL_MS));
        long timeout = Params.getLong(params, "timeout",
            config.getLong(Config.KEY_WAIT_TIMEOUT, Config.DEFAULT_WAIT_TIMEOUT_MS));
        boolean gone = state.equals("gone");

        Outcome outcome;
        try {
            outcome = await(locator, gone, interval, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Wait for {} cancelled", locator);
            return ApiResponse.error(ErrorCode.TIMEOUT, "Wait cancelled");
        }

        if (!outcome.satisfied) {
            log.info("Wait for {} ({}) timed out after {}ms", locator, state, outcome.elapsedMs);
            return ApiResponse.error(ErrorCode.TIMEOUT,
                "Condition not met within " + timeout + "ms: element " + (gone ? "still present" : "not found"));
        }

        JSONObject result = new JSONObject();
        result.put("state", state);
        result.put("elapsed_ms", outcome.elapsedMs);
        result.put("attempts", outcome.attempts);
        if (outcome.node != null) {
            result.put("element", JsonUtils.toJsonObject(ElementInfo.of(outcome.node)));
        }
        return ApiResponse.success(result);
    }
}
