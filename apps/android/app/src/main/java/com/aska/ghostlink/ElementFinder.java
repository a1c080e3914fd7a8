package com.aska.ghostlink;

import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * 控件查找
 *
 * 在一次树快照上按属性定位控件，优先级：resourceId > text > contentDescription > className。
 * 前一种条件没有命中时才尝试下一种。
 */
public final class ElementFinder {

    private static final Logger log = LoggerFactory.getLogger(Config.LOG_TAG + ".Finder");

    private ElementFinder() {}

    /**
     * 查找条件，字段为空表示不使用该条件
     */
    public static final class Locator {
        public final String resourceId;
        public final String text;
        public final String contentDescription;
        public final String className;
        public final boolean exactText;

        public Locator(String resourceId, String text, String contentDescription,
                       String className, boolean exactText) {
            this.resourceId = emptyToNull(resourceId);
            this.text = emptyToNull(text);
            this.contentDescription = emptyToNull(contentDescription);
            this.className = emptyToNull(className);
            this.exactText = exactText;
        }

        /**
         * 从工具参数读取：resource_id、text、content_description、class_name、exact
         */
        public static Locator from(JSONObject params) {
            return new Locator(
                Params.getString(params, "resource_id"),
                Params.getString(params, "text"),
                Params.getString(params, "content_description"),
                Params.getString(params, "class_name"),
                Params.getBoolean(params, "exact", false));
        }

        public static Locator byResourceId(String resourceId) {
            return new Locator(resourceId, null, null, null, false);
        }

        public static Locator byText(String text) {
            return new Locator(null, text, null, null, false);
        }

        public boolean isEmpty() {
            return resourceId == null && text == null && contentDescription == null && className == null;
        }

        private static String emptyToNull(String value) {
            return value == null || value.isEmpty() ? null : value;
        }

        @Override
        public String toString() {
            return "Locator{resourceId=" + resourceId + ", text=" + text
                + ", contentDescription=" + contentDescription + ", className=" + className + "}";
        }
    }

    /**
     * @return 第一个命中的节点（文档顺序），未找到返回 null
     */
    public static RawNode find(RawNode root, Locator locator) {
        if (root == null || locator == null || locator.isEmpty()) {
            return null;
        }

        if (locator.resourceId != null) {
            for (String candidate : resourceIdCandidates(locator.resourceId, root.packageName)) {
                RawNode found = findFirst(root, node -> node.resourceId.equals(candidate));
                if (found != null) {
                    log.info("Found element by resourceId: {} (original: {}), bounds: {}",
                        candidate, locator.resourceId, found.bounds);
                    return found;
                }
            }
        }

        if (locator.text != null) {
            RawNode found = findFirst(root, node -> locator.exactText
                ? node.text.equals(locator.text)
                : node.text.contains(locator.text));
            if (found != null) {
                log.info("Found element by text: {}, bounds: {}", locator.text, found.bounds);
                return found;
            }
        }

        if (locator.contentDescription != null) {
            RawNode found = findFirst(root, node -> node.contentDescription.equals(locator.contentDescription));
            if (found != null) {
                log.info("Found element by contentDescription: {}, bounds: {}",
                    locator.contentDescription, found.bounds);
                return found;
            }
        }

        if (locator.className != null) {
            RawNode found = findFirst(root, node -> node.className.equals(locator.className));
            if (found != null) {
                log.info("Found element by className: {}, bounds: {}", locator.className, found.bounds);
                return found;
            }
        }

        log.warn("Element not found with {}", locator);
        return null;
    }

    /**
     * 不带包名的 id 自动补全为 package:id/name
     */
    static List<String> resourceIdCandidates(String resourceId, String packageName) {
        List<String> ids = new ArrayList<>();
        ids.add(resourceId);
        if (!resourceId.contains(":") && packageName != null && !packageName.isEmpty()) {
            String name = resourceId.startsWith("id/") ? resourceId.substring(3) : resourceId;
            ids.add(packageName + ":id/" + name);
        }
        return ids;
    }

    static RawNode findFirst(RawNode node, Predicate<RawNode> predicate) {
        if (predicate.test(node)) {
            return node;
        }
        for (RawNode child : node.children) {
            RawNode found = findFirst(child, predicate);
            if (found != null) {
                return found;
            }
        }
        return null;
    }
}
