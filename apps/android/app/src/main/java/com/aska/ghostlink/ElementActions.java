package com.aska.ghostlink;

import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * 基于控件的操作
 *
 * 先在快照上定位控件，再把控件中心或边界换算成坐标交给基础手势。
 * 操作成功后等待界面稳定，附带一份精简后的屏幕状态 screen_state。
 */
class ElementActions {

    private static final Logger log = LoggerFactory.getLogger(Config.LOG_TAG + ".Element");

    static final String NO_CRITERIA = "At least one search parameter is required";
    static final String NOT_FOUND = "Element not found";

    private final CommandExecutor executor;
    private final TreeCompactor compactor;
    private final ConfigStore config;

    ElementActions(CommandExecutor executor, TreeCompactor compactor, ConfigStore config) {
        this.executor = executor;
        this.compactor = compactor;
        this.config = config;
    }

    void registerAll(ActionDispatcher dispatcher) {
        dispatcher.register("element.find", this::find);
        dispatcher.register("element.click", this::click);
        dispatcher.register("element.long_press", this::longPress);
        dispatcher.register("element.double_tap", this::doubleTap);
        dispatcher.register("element.scroll", this::scroll);
        dispatcher.register("element.set_text", this::setText);
        dispatcher.register("element.drag", this::drag);
        dispatcher.register("element.toggle_checkbox", this::toggleCheckbox);
    }

    /**
     * 定位结果：命中的节点，或者可以直接返回的错误
     */
    private static final class Lookup {
        final RawNode node;
        final ApiResponse error;

        Lookup(RawNode node, ApiResponse error) {
            this.node = node;
            this.error = error;
        }
    }

    private Lookup locate(JSONObject params) {
        ElementFinder.Locator locator = ElementFinder.Locator.from(params);
        if (locator.isEmpty()) {
            return new Lookup(null, ApiResponse.error(ErrorCode.MISSING_PARAMETER, NO_CRITERIA));
        }
        RawNode root = executor.snapshot();
        if (root == null) {
            return new Lookup(null, ApiResponse.failed(StateQueries.NO_ACTIVE_WINDOW));
        }
        RawNode node = ElementFinder.find(root, locator);
        if (node == null) {
            return new Lookup(null, ApiResponse.failed(NOT_FOUND));
        }
        return new Lookup(node, null);
    }

    // ========== 查找 ==========

    ApiResponse find(JSONObject params) {
        Lookup lookup = locate(params);
        if (lookup.error != null) return lookup.error;

        JSONObject result = new JSONObject();
        result.put("element", JsonUtils.toJsonObject(ElementInfo.of(lookup.node)));
        return ApiResponse.success(result);
    }

    // ========== 点击类 ==========

    ApiResponse click(JSONObject params) throws InterruptedException {
        Lookup lookup = locate(params);
        if (lookup.error != null) return lookup.error;

        Bounds b = lookup.node.bounds;
        if (!executor.tap(b.centerX(), b.centerY())) {
            return ApiResponse.failed("Failed to click element");
        }
        return completed("Element clicked at (" + b.centerX() + ", " + b.centerY() + ")");
    }

    ApiResponse longPress(JSONObject params) throws InterruptedException {
        Lookup lookup = locate(params);
        if (lookup.error != null) return lookup.error;

        Bounds b = lookup.node.bounds;
        long duration = Params.getLong(params, "duration", Config.DEFAULT_LONG_PRESS_MS);
        if (!executor.longPress(b.centerX(), b.centerY(), duration)) {
            return ApiResponse.failed("Failed to long press element");
        }
        return completed("Element long pressed at (" + b.centerX() + ", " + b.centerY() + ")");
    }

    ApiResponse doubleTap(JSONObject params) throws InterruptedException {
        Lookup lookup = locate(params);
        if (lookup.error != null) return lookup.error;

        Bounds b = lookup.node.bounds;
        if (!executor.doubleTap(b.centerX(), b.centerY())) {
            return ApiResponse.failed("Failed to double tap element");
        }
        return completed("Element double tapped at (" + b.centerX() + ", " + b.centerY() + ")");
    }

    // ========== 滚动 ==========

    /**
     * direction: forward（向下/向右，默认）或 backward
     *
     * 在控件边界内滑动：纵向控件沿 Y 轴，横向控件沿 X 轴，起止点取 3/4 与 1/4 处。
     */
    ApiResponse scroll(JSONObject params) throws InterruptedException {
        String direction = Params.getString(params, "direction", "forward").toLowerCase(Locale.ROOT);
        if (!direction.equals("forward") && !direction.equals("backward")) {
            throw new IllegalArgumentException("direction must be forward or backward");
        }

        Lookup lookup = locate(params);
        if (lookup.error != null) return lookup.error;
        if (!lookup.node.scrollable) {
            return ApiResponse.failed("Element is not scrollable");
        }

        Bounds b = lookup.node.bounds;
        boolean forward = direction.equals("forward");
        int startX = b.centerX();
        int startY = b.centerY();
        int endX = startX;
        int endY = startY;
        if (b.height() >= b.width()) {
            int near = b.top + b.height() / 4;
            int far = b.top + b.height() * 3 / 4;
            startY = forward ? far : near;
            endY = forward ? near : far;
        } else {
            int near = b.left + b.width() / 4;
            int far = b.left + b.width() * 3 / 4;
            startX = forward ? far : near;
            endX = forward ? near : far;
        }

        if (!executor.swipe(startX, startY, endX, endY, Config.DEFAULT_SWIPE_DURATION_MS)) {
            return ApiResponse.failed("Failed to scroll element");
        }
        return completed("Element scrolled " + direction + " successfully");
    }

    // ========== 文本 ==========

    /**
     * 要写入的内容放在 input_text 中，text 参数用于定位
     */
    ApiResponse setText(JSONObject params) throws MissingParameterException, InterruptedException {
        String value = Params.getString(params, "input_text");
        if (value == null) {
            throw new MissingParameterException("input_text");
        }

        Lookup lookup = locate(params);
        if (lookup.error != null) return lookup.error;
        if (!lookup.node.editable) {
            return ApiResponse.failed("Element is not editable");
        }

        if (!executor.setText(lookup.node, value)) {
            return ApiResponse.failed("Failed to set text");
        }
        return completed("Text set successfully");
    }

    // ========== 拖动 ==========

    ApiResponse drag(JSONObject params) throws InterruptedException {
        Lookup lookup = locate(params);
        if (lookup.error != null) return lookup.error;

        int startX = lookup.node.bounds.centerX();
        int startY = lookup.node.bounds.centerY();
        int targetX = Params.getInt(params, "target_x");
        int targetY = Params.getInt(params, "target_y");

        if (!executor.swipe(startX, startY, targetX, targetY, Config.DRAG_DURATION_MS)) {
            return ApiResponse.failed("Failed to drag element");
        }
        return completed("Element dragged successfully from (" + startX + "," + startY
            + ") to (" + targetX + "," + targetY + ")");
    }

    // ========== 复选框 ==========

    ApiResponse toggleCheckbox(JSONObject params) throws InterruptedException {
        ElementFinder.Locator locator = ElementFinder.Locator.from(params);
        Lookup lookup = locate(params);
        if (lookup.error != null) return lookup.error;
        if (!lookup.node.checkable) {
            return ApiResponse.failed("Element is not checkable");
        }

        boolean before = lookup.node.checked;
        Bounds b = lookup.node.bounds;
        if (!executor.tap(b.centerX(), b.centerY())) {
            return ApiResponse.failed("Failed to toggle checkbox");
        }
        settle();

        // 重新采集，读取切换后的状态
        RawNode root = executor.snapshot();
        RawNode after = root != null ? ElementFinder.find(root, locator) : null;
        boolean checked = after != null ? after.checked : !before;

        JSONObject result = new JSONObject();
        result.put("message", "Checkbox toggled");
        result.put("previous_checked", before);
        result.put("checked", checked);
        putScreenState(result, root);
        return ApiResponse.success(result);
    }

    // ========== 结果 ==========

    private ApiResponse completed(String message) throws InterruptedException {
        settle();
        JSONObject result = new JSONObject();
        result.put("message", message);
        putScreenState(result, executor.snapshot());
        return ApiResponse.success(result);
    }

    private void putScreenState(JSONObject result, RawNode root) {
        if (root == null) {
            log.warn("No tree available for screen_state");
            return;
        }
        result.put("screen_state", compactor.render(root, executor.screenBounds(), executor.phoneState()));
    }

    private void settle() throws InterruptedException {
        long delay = config.getLong(Config.KEY_ELEMENT_SETTLE_DELAY, Config.DEFAULT_ELEMENT_SETTLE_MS);
        if (delay > 0) {
            Thread.sleep(delay);
        }
    }
}
