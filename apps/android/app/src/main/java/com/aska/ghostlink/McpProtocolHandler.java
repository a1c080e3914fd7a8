package com.aska.ghostlink;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON-RPC 方法处理
 *
 * 支持 initialize、tools/list、tools/call、ping；通知不回复。
 * 工具执行结果包装成文本内容块，工具级失败放在 result 里并标记 isError，
 * 方法不存在等协议级错误使用顶层 error。
 */
public class McpProtocolHandler {

    private static final Logger log = LoggerFactory.getLogger(Config.LOG_TAG + ".Rpc");

    public static final String METHOD_INITIALIZE = "initialize";
    public static final String METHOD_TOOLS_LIST = "tools/list";
    public static final String METHOD_TOOLS_CALL = "tools/call";
    public static final String METHOD_PING = "ping";

    private final ActionDispatcher dispatcher;
    private final ToolCatalog catalog;
    private final ConfigStore config;

    public McpProtocolHandler(ActionDispatcher dispatcher, ToolCatalog catalog, ConfigStore config) {
        this.dispatcher = dispatcher;
        this.catalog = catalog;
        this.config = config;
    }

    /**
     * 处理一条文本消息
     *
     * @return 响应文本；通知返回 null
     */
    public String handleMessage(String text) {
        RpcRequest request;
        try {
            request = RpcRequest.parse(text);
        } catch (JSONException e) {
            log.warn("Invalid JSON-RPC message: {}", e.getMessage());
            return JsonRpc.error(null, JsonRpc.PARSE_ERROR, "Parse error").toString();
        }
        JSONObject response = handle(request);
        return response != null ? response.toString() : null;
    }

    /**
     * @return 响应对象；通知返回 null
     */
    JSONObject handle(RpcRequest request) {
        if (request.method.isEmpty()) {
            return request.isNotification() ? null
                : JsonRpc.error(request.id, JsonRpc.INVALID_REQUEST, "Invalid request: missing method");
        }
        if (request.isNotification()) {
            log.debug("Notification received: {}", request.method);
            return null;
        }

        try {
            switch (request.method) {
                case METHOD_INITIALIZE:
                    return JsonRpc.result(request.id, initializeResult());
                case METHOD_TOOLS_LIST:
                    return JsonRpc.result(request.id, toolsList());
                case METHOD_TOOLS_CALL:
                    return callTool(request);
                case METHOD_PING:
                    return JsonRpc.result(request.id, new JSONObject());
                default:
                    log.warn("Method not found: {}", request.method);
                    return JsonRpc.error(request.id, JsonRpc.METHOD_NOT_FOUND, "Method not found: " + request.method);
            }
        } catch (JSONException e) {
            log.error("Failed to handle {}", request, e);
            return JsonRpc.error(request.id, JsonRpc.INTERNAL_ERROR, "Internal error: " + e.getMessage());
        }
    }

    JSONObject initializeResult() {
        String version = config.getString(Config.KEY_APP_VERSION, "1.0.0");
        InitializeResult result = new InitializeResult(Config.PROTOCOL_VERSION,
            new ServerIdentity(Config.SERVER_NAME, version));
        return JsonUtils.toJsonObject(result);
    }

    JSONObject toolsList() {
        JSONArray tools = new JSONArray();
        for (ToolCatalog.Tool tool : catalog.enabled(config)) {
            tools.put(tool.toJson());
        }
        JSONObject result = new JSONObject();
        result.put("tools", tools);
        return result;
    }

    private JSONObject callTool(RpcRequest request) {
        String name = request.params.optString("name", "");
        if (name.isEmpty()) {
            return JsonRpc.error(request.id, JsonRpc.INVALID_PARAMS, "Missing tool name");
        }
        ToolCatalog.Tool tool = catalog.get(name);
        if (tool == null || !catalog.isEnabled(name, config)) {
            log.warn("Tool not available: {}", name);
            return JsonRpc.error(request.id, JsonRpc.METHOD_NOT_FOUND, "Tool not found or disabled: " + name);
        }

        JSONObject arguments = request.params.optJSONObject("arguments");
        log.info("Calling tool: {}", tool.name);
        ApiResponse response = dispatcher.dispatch(tool.name, arguments);
        return JsonRpc.result(request.id, toolResult(response));
    }

    /**
     * 包装为 {content:[{type:"text", text:...}], isError}
     */
    static JSONObject toolResult(ApiResponse response) {
        JSONObject content = new JSONObject();
        content.put("type", "text");
        content.put("text", response.toJson());

        JSONObject result = new JSONObject();
        result.put("content", new JSONArray().put(content));
        result.put("isError", !response.isSuccess());
        return result;
    }
}
