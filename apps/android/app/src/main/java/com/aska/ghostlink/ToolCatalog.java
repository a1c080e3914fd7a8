package com.aska.ghostlink;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 远程调用方可见的工具列表
 *
 * 每个工具对应分发器中的一个动作，附带说明和参数的 JSON Schema。
 * 工具名也接受 android. 前缀。
 */
public final class ToolCatalog {

    static final String NAME_PREFIX = "android.";

    /**
     * 工具定义
     */
    public static final class Tool {
        public final String name;
        public final String description;
        private final JSONObject inputSchema;

        Tool(String name, String description, JSONObject inputSchema) {
            this.name = name;
            this.description = description;
            this.inputSchema = inputSchema;
        }

        public JSONObject toJson() {
            JSONObject json = new JSONObject();
            json.put("name", name);
            json.put("description", description);
            json.put("inputSchema", new JSONObject(inputSchema.toString()));
            return json;
        }
    }

    private final Map<String, Tool> tools = new LinkedHashMap<>();

    /**
     * 短名到工具名，tools/list 不单独列出
     */
    private static final Map<String, String> ALIASES = new LinkedHashMap<>();

    static {
        ALIASES.put("input", "text.input");
        ALIASES.put("clear", "input.clear");
        ALIASES.put("key", "key.send");
    }

    public ToolCatalog() {
        add("tap", "在屏幕绝对坐标处点击",
            schema(required("x", "y"),
                prop("x", "integer", "X 坐标"),
                prop("y", "integer", "Y 坐标")));
        add("double_tap", "在屏幕坐标处双击，两次点击间隔约 100ms",
            schema(required("x", "y"),
                prop("x", "integer", "X 坐标"),
                prop("y", "integer", "Y 坐标")));
        add("long_press", "在屏幕坐标处长按",
            schema(required("x", "y"),
                prop("x", "integer", "X 坐标"),
                prop("y", "integer", "Y 坐标"),
                prop("duration", "integer", "按住时长（毫秒），默认 1000")));
        add("swipe", "从起点滑动到终点，时长限制在 10 到 5000 毫秒",
            schema(required("startX", "startY", "endX", "endY"),
                prop("startX", "integer", "起点 X"),
                prop("startY", "integer", "起点 Y"),
                prop("endX", "integer", "终点 X"),
                prop("endY", "integer", "终点 Y"),
                prop("duration", "integer", "滑动时长（毫秒），默认 300")));
        add("text.input", "向当前获得焦点的输入框写入文本",
            schema(required("text"),
                prop("text", "string", "要输入的文本"),
                prop("clear", "boolean", "true 替换原有内容（默认），false 追加")));
        add("input.clear", "清空当前获得焦点的输入框", schema(required()));
        add("key.send", "发送按键事件",
            schema(required("key_code"),
                prop("key_code", "integer", "Android KeyEvent 键码，例如 66 为回车")));
        add("launch_app", "按包名启动应用，可选指定 Activity",
            schema(required("package"),
                prop("package", "string", "应用包名"),
                prop("activity", "string", "Activity 名称，以 . 开头时相对于包名")));
        add("screen.dump", "获取当前屏幕的精简描述：手机状态和带编号的可交互元素列表",
            schema(required(),
                prop("filter", "boolean", "只保留屏幕内可见的元素，默认 true")));
        add("packages.list", "列出已安装的应用",
            schema(required(),
                enumProp("type", "应用类型，默认 all", "user", "system", "all")));

        add("element.find", "按属性查找控件，返回位置和状态。优先级 resource_id > text > content_description > class_name",
            locatorSchema());
        add("element.click", "定位控件并点击其中心", locatorSchema());
        add("element.long_press", "定位控件并长按其中心",
            locatorSchema(prop("duration", "integer", "按住时长（毫秒），默认 1000")));
        add("element.double_tap", "定位控件并双击其中心", locatorSchema());
        add("element.scroll", "在可滚动控件内滚动",
            locatorSchema(enumProp("direction", "滚动方向，默认 forward", "forward", "backward")));
        add("element.set_text", "定位可编辑控件并设置文本",
            locatorSchema(prop("input_text", "string", "要写入的文本")));
        add("element.drag", "把控件从中心拖动到目标坐标",
            locatorSchema(
                prop("target_x", "integer", "目标 X"),
                prop("target_y", "integer", "目标 Y")));
        add("element.toggle_checkbox", "切换复选框或开关，返回切换后的选中状态", locatorSchema());
        add("element.wait", "等待控件出现或消失",
            locatorSchema(
                enumProp("state", "等待出现 visible（默认）或消失 gone", "visible", "gone"),
                prop("interval", "integer", "轮询间隔（毫秒），默认 200"),
                prop("timeout", "integer", "最长等待（毫秒），默认 10000")));
    }

    private void add(String name, String description, JSONObject schema) {
        tools.put(name, new Tool(name, description, schema));
    }

    /**
     * 去掉 android. 前缀，短名换成对应的工具名
     */
    public static String canonicalName(String name) {
        if (name == null) return "";
        String bare = name.startsWith(NAME_PREFIX) ? name.substring(NAME_PREFIX.length()) : name;
        String target = ALIASES.get(bare);
        return target != null ? target : bare;
    }

    public Tool get(String name) {
        return tools.get(canonicalName(name));
    }

    public List<Tool> all() {
        return Collections.unmodifiableList(new ArrayList<>(tools.values()));
    }

    /**
     * 按 mcp_tools_enabled 过滤，未配置时全部可用
     */
    public List<Tool> enabled(ConfigStore config) {
        List<Tool> result = new ArrayList<>();
        for (Tool tool : tools.values()) {
            if (config.isToolEnabled(tool.name)) {
                result.add(tool);
            }
        }
        return result;
    }

    public boolean isEnabled(String name, ConfigStore config) {
        Tool tool = get(name);
        return tool != null && config.isToolEnabled(tool.name);
    }

    // ========== Schema ==========

    private static JSONObject locatorSchema(JSONObject... extra) {
        JSONObject[] props = new JSONObject[4 + extra.length];
        props[0] = prop("resource_id", "string", "控件的 resource-id，可省略包名前缀");
        props[1] = prop("text", "string", "控件包含的文本");
        props[2] = prop("content_description", "string", "控件的 content-description");
        props[3] = prop("class_name", "string", "控件类名，例如 android.widget.Button");
        System.arraycopy(extra, 0, props, 4, extra.length);
        return schema(required(), props);
    }

    private static JSONArray required(String... names) {
        JSONArray array = new JSONArray();
        for (String name : names) {
            array.put(name);
        }
        return array;
    }

    private static JSONObject prop(String name, String type, String description) {
        JSONObject property = new JSONObject();
        property.put("type", type);
        property.put("description", description);
        return new JSONObject().put(name, property);
    }

    private static JSONObject enumProp(String name, String description, String... values) {
        JSONObject property = new JSONObject();
        property.put("type", "string");
        property.put("description", description);
        property.put("enum", required(values));
        return new JSONObject().put(name, property);
    }

    private static JSONObject schema(JSONArray required, JSONObject... props) {
        JSONObject properties = new JSONObject();
        for (JSONObject prop : props) {
            for (String key : prop.keySet()) {
                properties.put(key, prop.get(key));
            }
        }
        JSONObject schema = new JSONObject();
        schema.put("type", "object");
        schema.put("properties", properties);
        if (required.length() > 0) {
            schema.put("required", required);
        }
        return schema;
    }
}
