package com.aska.ghostlink;

import java.util.List;

/**
 * GhostLink 设备状态数据模型
 * 由 DeviceAutomation 提供，经 Gson 序列化后返回给远程调用方
 */

// ============ 屏幕信息 ============

/**
 * 屏幕信息（device_context 的一部分）
 */
class ScreenInfo {
    public int width;
    public int height;
    public String orientation; // "portrait" or "landscape"

    public ScreenInfo() {}

    public ScreenInfo(int width, int height) {
        this.width = width;
        this.height = height;
        this.orientation = height >= width ? "portrait" : "landscape";
    }

    public static ScreenInfo of(Bounds screen) {
        return new ScreenInfo(screen.width(), screen.height());
    }
}

/**
 * 设备上下文
 */
class DeviceContext {
    public ScreenInfo screen;
    public String device_name;
    public int overlay_offset;

    public DeviceContext() {}

    public DeviceContext(ScreenInfo screen, String device_name, int overlay_offset) {
        this.screen = screen;
        this.device_name = device_name;
        this.overlay_offset = overlay_offset;
    }
}

// ============ 手机状态 ============

/**
 * 当前焦点元素
 */
class FocusedElement {
    public String text;
    public String resourceId;
    public String className;

    public FocusedElement() {}

    public FocusedElement(String text, String resourceId, String className) {
        this.text = text;
        this.resourceId = resourceId;
        this.className = className;
    }
}

/**
 * 手机状态
 */
class PhoneState {
    public String currentApp;
    public String packageName;
    public String activityName;
    public boolean keyboardVisible;
    public boolean isEditable;
    public FocusedElement focusedElement;

    public PhoneState() {}

    public PhoneState(String currentApp, String packageName, String activityName,
                      boolean keyboardVisible, boolean isEditable, FocusedElement focusedElement) {
        this.currentApp = currentApp;
        this.packageName = packageName;
        this.activityName = activityName;
        this.keyboardVisible = keyboardVisible;
        this.isEditable = isEditable;
        this.focusedElement = focusedElement;
    }
}

// ============ 应用列表 ============

/**
 * 可启动应用
 */
class AppPackage {
    public String packageName;
    public String label;
    public String versionName;
    public long versionCode;
    public boolean isSystemApp;

    public AppPackage() {}

    public AppPackage(String packageName, String label, String versionName,
                      long versionCode, boolean isSystemApp) {
        this.packageName = packageName;
        this.label = label;
        this.versionName = versionName;
        this.versionCode = versionCode;
        this.isSystemApp = isSystemApp;
    }
}

// ============ 控件查找结果 ============

/**
 * element.find 返回的控件信息
 */
class ElementInfo {
    public String text;
    public String content_description;
    public String resource_id;
    public String class_name;
    public List<Integer> bounds;  // [left, top, right, bottom]
    public List<Integer> center;  // [x, y]
    public boolean clickable;
    public boolean editable;
    public boolean scrollable;
    public boolean checkable;
    public boolean checked;

    public ElementInfo() {}

    public static ElementInfo of(RawNode node) {
        ElementInfo info = new ElementInfo();
        info.text = node.text;
        info.content_description = node.contentDescription;
        info.resource_id = node.resourceId;
        info.class_name = node.className;
        info.bounds = List.of(node.bounds.left, node.bounds.top, node.bounds.right, node.bounds.bottom);
        info.center = List.of(node.bounds.centerX(), node.bounds.centerY());
        info.clickable = node.clickable;
        info.editable = node.editable;
        info.scrollable = node.scrollable;
        info.checkable = node.checkable;
        info.checked = node.checked;
        return info;
    }
}
