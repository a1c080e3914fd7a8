package com.aska.ghostlink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 指令执行器
 *
 * 职责：
 * 1. 把点击、滑动、长按等动作转换为手势派发
 * 2. 焦点输入框的文本写入、清空，按键发送
 * 3. 启动应用、系统全局动作、截图
 * 4. 串行化对设备的访问：同一时刻只有一个手势或树操作在进行
 */
public class CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(Config.LOG_TAG + ".Executor");

    // 与 AccessibilityService.GLOBAL_ACTION_* 取值一致
    public static final int GLOBAL_ACTION_BACK = 1;
    public static final int GLOBAL_ACTION_HOME = 2;
    public static final int GLOBAL_ACTION_RECENTS = 3;
    public static final int GLOBAL_ACTION_NOTIFICATIONS = 4;
    public static final int GLOBAL_ACTION_QUICK_SETTINGS = 5;

    private final DeviceAutomation device;
    private final ReentrantLock deviceLock = new ReentrantLock(true);

    public CommandExecutor(DeviceAutomation device) {
        if (device == null) throw new IllegalArgumentException("device must not be null");
        this.device = device;
    }

    /**
     * 持有设备锁执行一次设备调用
     */
    private <T> T withDevice(Supplier<T> call) {
        deviceLock.lock();
        try {
            return call.get();
        } finally {
            deviceLock.unlock();
        }
    }

    // ========== 读取 ==========

    /**
     * 采集 UI 树快照，没有活动窗口时返回 null
     */
    public RawNode snapshot() {
        return withDevice(device::snapshotTree);
    }

    public Bounds screenBounds() {
        return withDevice(device::getScreenBounds);
    }

    public PhoneState phoneState() {
        return withDevice(device::getPhoneState);
    }

    public List<AppPackage> installedPackages() {
        List<AppPackage> packages = withDevice(device::getInstalledPackages);
        return packages != null ? packages : Collections.<AppPackage>emptyList();
    }

    // ========== 手势 ==========

    /**
     * 在指定坐标点击（绝对坐标）
     */
    public boolean tap(int x, int y) {
        if (Config.DEBUG_MODE) {
            log.debug("Tap at ({}, {})", x, y);
        }
        return withDevice(() -> device.performGesture(GesturePath.point(x, y), Config.TAP_DURATION_MS));
    }

    /**
     * 双击：两次点击间隔 100ms，期间不释放设备锁
     */
    public boolean doubleTap(int x, int y) {
        deviceLock.lock();
        try {
            boolean first = device.performGesture(GesturePath.point(x, y), Config.TAP_DURATION_MS);
            if (!first) {
                log.warn("Double tap: first tap rejected at ({}, {})", x, y);
                return false;
            }
            Thread.sleep(Config.DOUBLE_TAP_INTERVAL_MS);
            return device.performGesture(GesturePath.point(x, y), Config.TAP_DURATION_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            deviceLock.unlock();
        }
    }

    public boolean longPress(int x, int y, long durationMs) {
        long duration = durationMs > 0 ? durationMs : Config.DEFAULT_LONG_PRESS_MS;
        if (Config.DEBUG_MODE) {
            log.debug("Long press at ({}, {}) for {}ms", x, y, duration);
        }
        return withDevice(() -> device.performGesture(GesturePath.point(x, y), duration));
    }

    /**
     * 滑动，时长限制在 [10, 5000] 毫秒
     */
    public boolean swipe(int startX, int startY, int endX, int endY, int durationMs) {
        int duration = clampSwipeDuration(durationMs);
        if (Config.DEBUG_MODE) {
            log.debug("Swipe ({}, {}) -> ({}, {}) duration={}ms", startX, startY, endX, endY, duration);
        }
        return withDevice(() -> device.performGesture(
            GesturePath.line(startX, startY, endX, endY), duration));
    }

    static int clampSwipeDuration(int durationMs) {
        return Math.max(Config.MIN_SWIPE_DURATION_MS, Math.min(durationMs, Config.MAX_SWIPE_DURATION_MS));
    }

    public boolean globalAction(int actionId) {
        boolean result = withDevice(() -> device.performGlobalAction(actionId));
        log.debug("Global action {} performed: {}", actionId, result);
        return result;
    }

    // ========== 输入 ==========

    /**
     * 解码 Base64 文本写入焦点输入框
     *
     * @param clear true 替换原有内容，false 追加
     * @return 没有焦点输入框或写入失败时返回 false
     * @throws IllegalArgumentException Base64 不合法
     */
    public boolean inputBase64(String base64Text, boolean clear) {
        String text = new String(Base64.getDecoder().decode(base64Text.trim()), StandardCharsets.UTF_8);
        return inputText(text, clear);
    }

    public boolean inputText(String text, boolean clear) {
        return withDevice(() -> {
            RawNode focused = device.getFocusedEditableNode();
            if (focused == null) {
                log.warn("Input failed: no focused editable node");
                return false;
            }
            String value = clear ? text : focused.text + text;
            log.info("Input text (length {}), clear={}", text.length(), clear);
            return device.setNodeText(focused, value);
        });
    }

    /**
     * 清空焦点输入框
     */
    public boolean clearFocused() {
        return withDevice(() -> {
            RawNode focused = device.getFocusedEditableNode();
            if (focused == null) {
                log.warn("Clear failed: no focused editable node");
                return false;
            }
            return device.setNodeText(focused, "");
        });
    }

    /**
     * 直接设置指定节点的文本
     */
    public boolean setText(RawNode node, String text) {
        return withDevice(() -> device.setNodeText(node, text));
    }

    public boolean sendKey(int keyCode) {
        return withDevice(() -> device.sendKeyEvent(keyCode));
    }

    // ========== 应用 ==========

    /**
     * 启动指定 APP
     *
     * @param activity 可选，为空或 "null" 时使用默认启动 Activity
     */
    public boolean launchApp(String packageName, String activity) {
        if (packageName == null || packageName.isEmpty()) {
            return false;
        }
        String actualPackage = "Settings".equalsIgnoreCase(packageName) ? "com.android.settings" : packageName;
        String actualActivity = (activity == null || activity.isEmpty() || "null".equals(activity)) ? null : activity;
        // ".MainActivity" 相对于包名
        if (actualActivity != null && actualActivity.startsWith(".")) {
            actualActivity = actualPackage + actualActivity;
        }
        final String component = actualActivity;

        boolean result = withDevice(() -> device.launchApp(actualPackage, component));
        if (result) {
            log.info("Launched app: {}", actualPackage);
        } else {
            log.error("Failed to launch app: {}", actualPackage);
        }
        return result;
    }

    // ========== 截图 ==========

    /**
     * 截图并等待结果
     *
     * 底层采集是异步的，这里在调用线程上等待，不持有设备锁。
     *
     * @throws TimeoutException 超时
     * @throws ExecutionException 采集失败
     */
    public byte[] screenshot(boolean hideOverlay, long timeoutMs)
            throws TimeoutException, ExecutionException, InterruptedException {
        Future<byte[]> future = withDevice(() -> device.captureScreenshotAsync(hideOverlay));
        if (future == null) {
            throw new ExecutionException("Screenshot not available", null);
        }
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        }
    }
}
