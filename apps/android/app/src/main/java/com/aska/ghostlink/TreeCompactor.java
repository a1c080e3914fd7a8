package com.aska.ghostlink;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * UI 树精简器
 *
 * 职责：
 * 1. 深度优先、先父后子遍历 RawNode 树
 * 2. 过滤纯布局容器和无意义节点（容器被跳过但子节点继续遍历）
 * 3. 可选的屏幕可见性过滤（保留有可见后代的父节点）
 * 4. 截断长文本，元素数达到上限后静默丢弃
 * 5. 生成给远程调用方阅读的文本形式
 *
 * 纯函数：不修改输入，不保留状态，同一棵树多次精简结果相同。
 */
public class TreeCompactor {

    private static final Logger log = LoggerFactory.getLogger(Config.LOG_TAG + ".Compactor");

    /**
     * 纯容器类名：text 等于这些值时不算有意义文本
     */
    static final Set<String> CONTAINER_NAMES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
        "FrameLayout", "View", "LinearLayout", "ViewPager", "RecyclerView", "ViewGroup"
    )));

    private static final String SYMBOL_CHARS = "|-_=~";

    private static final char ELLIPSIS = '…';

    private final int maxElements;
    private final int maxTextLength;

    public TreeCompactor() {
        this(Config.MAX_UI_ELEMENTS, Config.MAX_TEXT_LENGTH);
    }

    public TreeCompactor(int maxElements, int maxTextLength) {
        if (maxElements <= 0) throw new IllegalArgumentException("maxElements must be positive");
        this.maxElements = maxElements;
        this.maxTextLength = maxTextLength;
    }

    /**
     * 精简整棵树（不做可见性过滤）
     */
    public List<CompactElement> compact(RawNode root) {
        return compact(root, null);
    }

    /**
     * 精简整棵树
     *
     * @param root 根节点，可为 null
     * @param screenBounds 屏幕区域，为 null 时不做可见性过滤
     * @return 按文档顺序排列的元素，最多 maxElements 个
     */
    public List<CompactElement> compact(RawNode root, Bounds screenBounds) {
        List<CompactElement> elements = new ArrayList<>();
        if (root == null) return elements;

        if (screenBounds == null) {
            traverse(root, elements);
        } else {
            Map<RawNode, Boolean> retained = new IdentityHashMap<>();
            markRetained(root, screenBounds, retained);
            traverseFiltered(root, screenBounds, retained, elements);
        }

        if (Config.DEBUG_MODE) {
            log.debug("Compacted {} nodes into {} elements", root.subtreeSize(), elements.size());
        }
        return elements;
    }

    /**
     * 先序遍历，父节点先于子节点输出
     */
    private void traverse(RawNode node, List<CompactElement> elements) {
        if (elements.size() >= maxElements) return;

        if (shouldKeepNode(node)) {
            elements.add(toElement(node));
        }

        for (RawNode child : node.children) {
            if (elements.size() >= maxElements) return;
            traverse(child, elements);
        }
    }

    /**
     * 后序标记：节点可见，或者子树中有会被输出的节点，则保留
     *
     * @return 子树（含自身）中是否有会被输出的节点
     */
    private boolean markRetained(RawNode node, Bounds screen, Map<RawNode, Boolean> retained) {
        boolean childEmits = false;
        for (RawNode child : node.children) {
            if (markRetained(child, screen, retained)) {
                childEmits = true;
            }
        }
        boolean keep = isVisible(node, screen) || childEmits;
        retained.put(node, keep);
        return childEmits || (keep && shouldKeepNode(node));
    }

    private void traverseFiltered(RawNode node, Bounds screen,
                                  Map<RawNode, Boolean> retained, List<CompactElement> elements) {
        if (elements.size() >= maxElements) return;
        if (!Boolean.TRUE.equals(retained.get(node))) return;

        if (shouldKeepNode(node)) {
            if (isVisible(node, screen)) {
                elements.add(toElement(node));
            } else if (elements.size() + 1 < maxElements) {
                // 自身不可见，必须给至少一个后代留出位置
                elements.add(toElement(node));
            }
        }

        for (RawNode child : node.children) {
            if (elements.size() >= maxElements) return;
            traverseFiltered(child, screen, retained, elements);
        }
    }

    static boolean isVisible(RawNode node, Bounds screen) {
        return node.bounds.visibleFraction(screen) >= Config.VISIBILITY_THRESHOLD;
    }

    /**
     * 判断节点是否应该被保留
     *
     * 保留条件（满足其一）：
     * - 有意义的文本
     * - 有 contentDescription
     * - 有 resourceId
     * - 可点击、可聚焦、可勾选、可编辑
     */
    static boolean shouldKeepNode(RawNode node) {
        if (isMeaningfulText(node.text)) return true;
        if (!node.contentDescription.isEmpty()) return true;
        if (!node.resourceId.isEmpty()) return true;
        return node.clickable || node.focusable || node.checkable || node.editable;
    }

    static boolean isMeaningfulText(String text) {
        if (text == null || text.isEmpty()) return false;
        if (CONTAINER_NAMES.contains(text)) return false;

        // 过滤 1~2 个字符的纯分隔符
        if (text.length() <= 2) {
            boolean allSymbol = true;
            for (int i = 0; i < text.length(); i++) {
                if (SYMBOL_CHARS.indexOf(text.charAt(i)) < 0) {
                    allSymbol = false;
                    break;
                }
            }
            if (allSymbol) return false;
        }
        return true;
    }

    private CompactElement toElement(RawNode node) {
        String source = !node.text.isEmpty() ? node.text : node.contentDescription;
        return new CompactElement(
            truncate(source, maxTextLength),
            node.bounds.toCompactString(),
            node.resourceId,
            node.shortClassName(),
            flagString(node)
        );
    }

    static String flagString(RawNode node) {
        StringBuilder flags = new StringBuilder(6);
        if (node.clickable) flags.append('c');
        if (node.longClickable) flags.append('l');
        if (node.editable) flags.append('e');
        if (node.focused) flags.append('f');
        if (node.selected) flags.append('s');
        if (node.checked) flags.append('k');
        return flags.toString();
    }

    static String truncate(String text, int maxLength) {
        if (text == null) return "";
        if (text.length() <= maxLength) return text;
        int end = maxLength;
        // 不拆开代理对
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end) + ELLIPSIS;
    }

    // ========== 文本形式 ==========

    /**
     * 生成给远程调用方阅读的屏幕描述
     *
     * @param root 根节点，可为 null
     * @param screenBounds 屏幕区域，为 null 时不过滤
     * @param phoneState 手机状态，可为 null
     */
    public String render(RawNode root, Bounds screenBounds, PhoneState phoneState) {
        StringBuilder result = new StringBuilder();

        appendPhoneState(phoneState, result);

        Bounds screen = screenBounds != null ? screenBounds : (root != null ? root.bounds : null);
        if (screen != null && screen.area() > 0) {
            result.append("屏幕: ").append(screen.width()).append('x').append(screen.height()).append("\n\n");
        }

        result.append("【可交互元素】\n");
        List<CompactElement> elements = compact(root, screenBounds);
        int index = 1;
        for (CompactElement element : elements) {
            result.append(index++).append(". ").append(element.toLine()).append('\n');
        }

        if (elements.isEmpty()) {
            result.append("（无可交互元素）\n");
        } else {
            result.append("共 ").append(elements.size()).append(" 个元素\n");
        }
        return result.toString();
    }

    private void appendPhoneState(PhoneState state, StringBuilder result) {
        if (state == null) return;

        result.append("【手机状态】\n");
        if (state.currentApp != null && !state.currentApp.isEmpty()) {
            result.append("APP: ").append(state.currentApp).append('\n');
        }
        if (state.packageName != null && !state.packageName.isEmpty()) {
            result.append("包名: ").append(state.packageName).append('\n');
        }
        if (state.activityName != null && !state.activityName.isEmpty()) {
            result.append("页面: ").append(state.activityName).append('\n');
        }
        result.append("键盘: ").append(state.keyboardVisible ? "显示" : "隐藏").append('\n');
        result.append("可编辑: ").append(state.isEditable ? "是" : "否").append('\n');

        FocusedElement focused = state.focusedElement;
        if (focused != null) {
            String text = focused.text != null ? focused.text : "";
            String id = focused.resourceId != null ? focused.resourceId : "";
            if (!text.isEmpty() || !id.isEmpty()) {
                result.append("焦点: ");
                if (!text.isEmpty()) result.append(truncate(text, maxTextLength));
                if (!id.isEmpty()) result.append(" #").append(id);
                result.append('\n');
            }
        }
    }

    // ========== 报文形式 ==========

    /**
     * 从完整树 JSON 精简
     *
     * 接受 TreeSerializer 输出的单个节点、{"a11y_tree": 节点或数组}，
     * 或外层再包一层 {"data": "..."} 字符串。解析失败时返回错误对象，不抛异常。
     *
     * @return {"success":true,"count":N,"elements":[...]} 或 {"success":false,"error":"..."}
     */
    public JSONObject compactJson(String rawJson) {
        try {
            if (rawJson == null || rawJson.trim().isEmpty()) {
                return errorJson("empty input");
            }
            JSONObject root = new JSONObject(rawJson);
            Object data = root.opt("data");
            if (data instanceof String) {
                root = new JSONObject((String) data);
            } else if (data instanceof JSONObject) {
                root = (JSONObject) data;
            }

            List<RawNode> roots = new ArrayList<>();
            Object tree = root.opt("a11y_tree");
            if (tree instanceof JSONArray) {
                JSONArray array = (JSONArray) tree;
                for (int i = 0; i < array.length(); i++) {
                    roots.add(TreeSerializer.fromJson(array.getJSONObject(i)));
                }
            } else if (tree instanceof JSONObject) {
                roots.add(TreeSerializer.fromJson((JSONObject) tree));
            } else {
                roots.add(TreeSerializer.fromJson(root));
            }

            List<CompactElement> elements = new ArrayList<>();
            for (RawNode node : roots) {
                if (elements.size() >= maxElements) break;
                for (CompactElement element : compact(node)) {
                    if (elements.size() >= maxElements) break;
                    elements.add(element);
                }
            }

            JSONObject result = new JSONObject();
            result.put("success", true);
            result.put("count", elements.size());
            result.put("elements", new JSONArray(JsonUtils.toJson(elements)));

            log.info("A11y tree compacted: {} -> {} elements", rawJson.length(), elements.size());
            return result;
        } catch (JSONException | IllegalArgumentException e) {
            log.warn("Malformed tree JSON: {}", e.getMessage());
            return errorJson("malformed tree: " + e.getMessage());
        }
    }

    private static JSONObject errorJson(String message) {
        JSONObject error = new JSONObject();
        error.put("success", false);
        error.put("error", message);
        error.put("code", ErrorCode.MALFORMED_INPUT.name());
        return error;
    }
}
