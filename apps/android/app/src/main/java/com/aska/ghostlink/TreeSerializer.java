package com.aska.ghostlink;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * RawNode 与完整属性 JSON 之间的转换
 *
 * toJson 支持可见性过滤：节点可见比例低于 1% 且没有保留下来的子节点时被丢弃，
 * 有可见子节点的父节点保留，以维持层级上下文。
 */
public final class TreeSerializer {

    private TreeSerializer() {}

    /**
     * @param node 节点
     * @param screenBounds 屏幕区域，为 null 时不过滤
     * @return 节点 JSON，被过滤掉时返回 null
     */
    public static JSONObject toJson(RawNode node, Bounds screenBounds) {
        boolean passes = screenBounds == null || TreeCompactor.isVisible(node, screenBounds);

        // 先处理子节点，再决定当前节点
        JSONArray children = new JSONArray();
        for (RawNode child : node.children) {
            JSONObject childJson = toJson(child, screenBounds);
            if (childJson != null) {
                children.put(childJson);
            }
        }

        if (!passes && children.length() == 0) {
            return null;
        }

        JSONObject json = new JSONObject();
        json.put("resourceId", node.resourceId);
        json.put("className", node.className);
        json.put("packageName", node.packageName);
        json.put("text", node.text);
        json.put("contentDescription", node.contentDescription);

        JSONObject bounds = new JSONObject();
        bounds.put("left", node.bounds.left);
        bounds.put("top", node.bounds.top);
        bounds.put("right", node.bounds.right);
        bounds.put("bottom", node.bounds.bottom);
        json.put("boundsInScreen", bounds);

        json.put("isClickable", node.clickable);
        json.put("isLongClickable", node.longClickable);
        json.put("isFocusable", node.focusable);
        json.put("isFocused", node.focused);
        json.put("isSelected", node.selected);
        json.put("isCheckable", node.checkable);
        json.put("isChecked", node.checked);
        json.put("isEnabled", node.enabled);
        json.put("isEditable", node.editable);
        json.put("isScrollable", node.scrollable);
        json.put("childCount", node.children.size());
        json.put("children", children);
        return json;
    }

    /**
     * 从 JSON 还原节点
     *
     * 兼容精简格式：bounds 可以是 "l,t,r,b" 字符串，布尔属性可以不带 is 前缀，
     * contentDescription 也可以写作 contentDesc。
     *
     * @throws org.json.JSONException 结构不合法
     * @throws IllegalArgumentException bounds 字符串不合法
     */
    public static RawNode fromJson(JSONObject json) {
        RawNode.Builder builder = RawNode.builder()
            .resourceId(json.optString("resourceId", ""))
            .className(json.optString("className", ""))
            .packageName(json.optString("packageName", ""))
            .text(json.optString("text", ""))
            .contentDescription(json.optString("contentDescription", json.optString("contentDesc", "")))
            .bounds(parseBounds(json))
            .clickable(flag(json, "Clickable"))
            .longClickable(flag(json, "LongClickable"))
            .focusable(flag(json, "Focusable"))
            .focused(flag(json, "Focused"))
            .selected(flag(json, "Selected"))
            .checkable(flag(json, "Checkable"))
            .checked(flag(json, "Checked"))
            .editable(flag(json, "Editable"))
            .scrollable(flag(json, "Scrollable"));

        if (json.has("isEnabled") || json.has("enabled")) {
            builder.enabled(flag(json, "Enabled"));
        }

        JSONArray children = json.optJSONArray("children");
        if (children != null) {
            for (int i = 0; i < children.length(); i++) {
                builder.addChild(fromJson(children.getJSONObject(i)));
            }
        }
        return builder.build();
    }

    private static boolean flag(JSONObject json, String name) {
        String lower = Character.toLowerCase(name.charAt(0)) + name.substring(1);
        return json.optBoolean("is" + name, json.optBoolean(lower, false));
    }

    private static Bounds parseBounds(JSONObject json) {
        JSONObject rect = json.optJSONObject("boundsInScreen");
        if (rect != null) {
            return new Bounds(rect.optInt("left"), rect.optInt("top"),
                rect.optInt("right"), rect.optInt("bottom"));
        }
        String text = json.optString("bounds", "");
        if (text.isEmpty()) {
            return new Bounds(0, 0, 0, 0);
        }
        String[] parts = text.split(",");
        if (parts.length != 4) {
            throw new IllegalArgumentException("Invalid bounds: " + text);
        }
        try {
            return new Bounds(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()),
                Integer.parseInt(parts[2].trim()), Integer.parseInt(parts[3].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid bounds: " + text, e);
        }
    }
}
