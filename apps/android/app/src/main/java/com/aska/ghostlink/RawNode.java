package com.aska.ghostlink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次查询得到的 UI 节点快照
 *
 * 每次查询重新构建，构建后不可变，可在线程间自由共享；
 * 精简或序列化完成后整体丢弃，不需要逐个节点回收。
 */
public final class RawNode {

    public final String text;
    public final String contentDescription;
    public final String resourceId;
    public final String className;
    public final String packageName;
    public final Bounds bounds;

    public final boolean clickable;
    public final boolean longClickable;
    public final boolean editable;
    public final boolean focused;
    public final boolean selected;
    public final boolean checkable;
    public final boolean checked;
    public final boolean scrollable;
    public final boolean focusable;
    public final boolean enabled;

    public final List<RawNode> children;

    private RawNode(Builder b) {
        this.text = nonNull(b.text);
        this.contentDescription = nonNull(b.contentDescription);
        this.resourceId = nonNull(b.resourceId);
        this.className = nonNull(b.className);
        this.packageName = nonNull(b.packageName);
        this.bounds = b.bounds != null ? b.bounds : new Bounds(0, 0, 0, 0);
        this.clickable = b.clickable;
        this.longClickable = b.longClickable;
        this.editable = b.editable;
        this.focused = b.focused;
        this.selected = b.selected;
        this.checkable = b.checkable;
        this.checked = b.checked;
        this.scrollable = b.scrollable;
        this.focusable = b.focusable;
        this.enabled = b.enabled;
        this.children = Collections.unmodifiableList(new ArrayList<>(b.children));
    }

    private static String nonNull(String s) {
        return s != null ? s : "";
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 去掉包名前缀的类名，如 android.widget.Button → Button
     */
    public String shortClassName() {
        int dot = className.lastIndexOf('.');
        return dot >= 0 ? className.substring(dot + 1) : className;
    }

    /**
     * 以当前节点为根的子树节点总数
     */
    public int subtreeSize() {
        int count = 1;
        for (RawNode child : children) {
            count += child.subtreeSize();
        }
        return count;
    }

    @Override
    public String toString() {
        return "RawNode{" + shortClassName()
            + (text.isEmpty() ? "" : " text=" + text)
            + (resourceId.isEmpty() ? "" : " id=" + resourceId)
            + " " + bounds + "}";
    }

    public static final class Builder {
        private String text;
        private String contentDescription;
        private String resourceId;
        private String className;
        private String packageName;
        private Bounds bounds;
        private boolean clickable;
        private boolean longClickable;
        private boolean editable;
        private boolean focused;
        private boolean selected;
        private boolean checkable;
        private boolean checked;
        private boolean scrollable;
        private boolean focusable;
        private boolean enabled = true;
        private final List<RawNode> children = new ArrayList<>();

        private Builder() {}

        public Builder text(String text) { this.text = text; return this; }
        public Builder contentDescription(String desc) { this.contentDescription = desc; return this; }
        public Builder resourceId(String resourceId) { this.resourceId = resourceId; return this; }
        public Builder className(String className) { this.className = className; return this; }
        public Builder packageName(String packageName) { this.packageName = packageName; return this; }
        public Builder bounds(Bounds bounds) { this.bounds = bounds; return this; }
        public Builder bounds(int left, int top, int right, int bottom) {
            this.bounds = new Bounds(left, top, right, bottom);
            return this;
        }
        public Builder clickable(boolean v) { this.clickable = v; return this; }
        public Builder longClickable(boolean v) { this.longClickable = v; return this; }
        public Builder editable(boolean v) { this.editable = v; return this; }
        public Builder focused(boolean v) { this.focused = v; return this; }
        public Builder selected(boolean v) { this.selected = v; return this; }
        public Builder checkable(boolean v) { this.checkable = v; return this; }
        public Builder checked(boolean v) { this.checked = v; return this; }
        public Builder scrollable(boolean v) { this.scrollable = v; return this; }
        public Builder focusable(boolean v) { this.focusable = v; return this; }
        public Builder enabled(boolean v) { this.enabled = v; return this; }

        public Builder addChild(RawNode child) {
            if (child != null) children.add(child);
            return this;
        }

        public Builder addChildren(List<RawNode> nodes) {
            for (RawNode node : nodes) addChild(node);
            return this;
        }

        public RawNode build() {
            return new RawNode(this);
        }
    }
}
