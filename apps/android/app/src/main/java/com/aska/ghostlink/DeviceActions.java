package com.aska.ghostlink;

import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * 坐标手势、键盘输入、应用启动、截图和配置透传
 */
class DeviceActions {

    private static final Logger log = LoggerFactory.getLogger(Config.LOG_TAG + ".Actions");

    private final CommandExecutor executor;
    private final ConfigStore config;

    DeviceActions(CommandExecutor executor, ConfigStore config) {
        this.executor = executor;
        this.config = config;
    }

    void registerAll(ActionDispatcher dispatcher) {
        dispatcher.register("tap", this::tap);
        dispatcher.register("double_tap", this::doubleTap);
        dispatcher.register("long_press", this::longPress);
        dispatcher.register("swipe", this::swipe);
        dispatcher.register("global", this::global);
        dispatcher.register("app", this::launchApp, "launch_app");
        dispatcher.register("input", this::input, "keyboard/input", "text.input");
        dispatcher.register("clear", this::clear, "keyboard/clear", "input.clear");
        dispatcher.register("key", this::key, "keyboard/key", "key.send");
        dispatcher.register("overlay_offset", this::overlayOffset);
        dispatcher.register("overlay_visible", this::overlayVisible);
        dispatcher.register("socket_port", this::socketPort);
        dispatcher.register("screenshot", this::screenshot);
    }

    // ========== 手势 ==========

    ApiResponse tap(JSONObject params) {
        int x = Params.getInt(params, "x");
        int y = Params.getInt(params, "y");
        if (executor.tap(x, y)) {
            return ApiResponse.success("Tap performed at (" + x + ", " + y + ")");
        }
        return ApiResponse.failed("Failed to perform tap at (" + x + ", " + y + ")");
    }

    ApiResponse doubleTap(JSONObject params) {
        int x = Params.getInt(params, "x");
        int y = Params.getInt(params, "y");
        if (executor.doubleTap(x, y)) {
            return ApiResponse.success("Double tap performed at (" + x + ", " + y + ")");
        }
        return ApiResponse.failed("Failed to perform double tap at (" + x + ", " + y + ")");
    }

    ApiResponse longPress(JSONObject params) {
        int x = Params.getInt(params, "x");
        int y = Params.getInt(params, "y");
        long duration = Params.getLong(params, "duration", Config.DEFAULT_LONG_PRESS_MS);
        if (executor.longPress(x, y, duration)) {
            return ApiResponse.success("Long press performed at (" + x + ", " + y + ")");
        }
        return ApiResponse.failed("Failed to perform long press at (" + x + ", " + y + ")");
    }

    ApiResponse swipe(JSONObject params) {
        int startX = Params.getInt(params, "startX");
        int startY = Params.getInt(params, "startY");
        int endX = Params.getInt(params, "endX");
        int endY = Params.getInt(params, "endY");
        int duration = Params.getInt(params, "duration", Config.DEFAULT_SWIPE_DURATION_MS);
        if (executor.swipe(startX, startY, endX, endY, duration)) {
            return ApiResponse.success("Swipe performed");
        }
        return ApiResponse.failed("Failed to perform swipe");
    }

    /**
     * action 可以是数值 ID，也可以是 back/home/recents/notifications/quick_settings
     */
    ApiResponse global(JSONObject params) {
        int actionId = resolveGlobalAction(Params.getString(params, "action", "0"));
        if (executor.globalAction(actionId)) {
            return ApiResponse.success("Global action " + actionId + " performed");
        }
        return ApiResponse.failed("Failed to perform global action " + actionId);
    }

    static int resolveGlobalAction(String value) {
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "back":
                return CommandExecutor.GLOBAL_ACTION_BACK;
            case "home":
                return CommandExecutor.GLOBAL_ACTION_HOME;
            case "recents":
                return CommandExecutor.GLOBAL_ACTION_RECENTS;
            case "notifications":
                return CommandExecutor.GLOBAL_ACTION_NOTIFICATIONS;
            case "quick_settings":
                return CommandExecutor.GLOBAL_ACTION_QUICK_SETTINGS;
            default:
                return Integer.parseInt(value.trim());
        }
    }

    // ========== 应用 ==========

    ApiResponse launchApp(JSONObject params) throws MissingParameterException {
        String packageName = Params.requireString(params, "package");
        String activity = Params.getString(params, "activity");
        if (executor.launchApp(packageName, activity)) {
            return ApiResponse.success("Launched " + packageName);
        }
        return ApiResponse.failed("Failed to launch app: " + packageName);
    }

    // ========== 键盘 ==========

    /**
     * HTTP 形式传 base64_text，工具调用形式传明文 text
     */
    ApiResponse input(JSONObject params) throws MissingParameterException {
        boolean clear = Params.getBoolean(params, "clear", true);
        String base64 = Params.getString(params, "base64_text");

        boolean result;
        if (base64 != null && !base64.isEmpty()) {
            result = executor.inputBase64(base64, clear);
        } else {
            String text = Params.getString(params, "text");
            if (text == null) {
                throw new MissingParameterException("base64_text");
            }
            result = executor.inputText(text, clear);
        }

        if (result) {
            return ApiResponse.success("Text input performed");
        }
        return ApiResponse.failed("No focused editable field or text input failed");
    }

    ApiResponse clear(JSONObject params) {
        if (executor.clearFocused()) {
            return ApiResponse.success("Text cleared");
        }
        return ApiResponse.failed("No focused editable field or clear failed");
    }

    ApiResponse key(JSONObject params) {
        int keyCode = Params.getInt(params, "key_code");
        if (executor.sendKey(keyCode)) {
            return ApiResponse.success("Key event sent: " + keyCode);
        }
        return ApiResponse.failed("Failed to send key event: " + keyCode);
    }

    // ========== 配置 ==========

    ApiResponse overlayOffset(JSONObject params) {
        int offset = Params.getInt(params, "offset");
        config.setInt(Config.KEY_OVERLAY_OFFSET, offset);
        log.info("Overlay offset updated to {}", offset);
        return ApiResponse.success("Overlay offset updated to " + offset);
    }

    ApiResponse overlayVisible(JSONObject params) {
        boolean visible = Params.getBoolean(params, "visible", true);
        config.setBoolean(Config.KEY_OVERLAY_VISIBLE, visible);
        return ApiResponse.success("Overlay visibility set to " + visible);
    }

    ApiResponse socketPort(JSONObject params) {
        int port = Params.getInt(params, "port");
        if (port < 1 || port > 65535) {
            return ApiResponse.failed("Invalid port: " + port);
        }
        config.setInt(Config.KEY_SOCKET_SERVER_PORT, port);
        log.info("Socket server port updated to {}", port);
        return ApiResponse.success("Socket server port updated to " + port);
    }

    // ========== 截图 ==========

    ApiResponse screenshot(JSONObject params)
            throws TimeoutException, ExecutionException, InterruptedException {
        boolean hideOverlay = Params.getBoolean(params, "hideOverlay", true);
        long timeout = config.getLong(Config.KEY_SCREENSHOT_TIMEOUT, Config.DEFAULT_SCREENSHOT_TIMEOUT_MS);
        byte[] png = executor.screenshot(hideOverlay, timeout);
        return new ApiResponse.Binary(png, "image/png");
    }
}
