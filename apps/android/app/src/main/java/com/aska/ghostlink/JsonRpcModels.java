package com.aska.ghostlink;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * JSON-RPC 2.0 消息模型
 */

// ========== 握手 ==========

/**
 * initialize 响应中的服务端标识
 */
class ServerIdentity {
    public String name;
    public String version;

    public ServerIdentity() {}

    public ServerIdentity(String name, String version) {
        this.name = name;
        this.version = version;
    }
}

/**
 * 能力声明：目前只声明工具
 */
class ServerCapabilities {
    public ToolsCapability tools = new ToolsCapability();

    static class ToolsCapability {
        public boolean listChanged = false;
    }
}

/**
 * initialize 响应
 */
class InitializeResult {
    public String protocolVersion;
    public ServerCapabilities capabilities;
    public ServerIdentity serverInfo;

    public InitializeResult() {}

    public InitializeResult(String protocolVersion, ServerIdentity serverInfo) {
        this.protocolVersion = protocolVersion;
        this.capabilities = new ServerCapabilities();
        this.serverInfo = serverInfo;
    }
}

// ========== 信封 ==========

/**
 * 收到的请求或通知
 */
class RpcRequest {
    final Object id;
    final String method;
    final JSONObject params;

    RpcRequest(Object id, String method, JSONObject params) {
        this.id = id;
        this.method = method;
        this.params = params != null ? params : new JSONObject();
    }

    /**
     * 没有 id 的消息是通知，不需要响应
     */
    boolean isNotification() {
        return id == null;
    }

    /**
     * @throws JSONException 不是合法 JSON 对象
     */
    static RpcRequest parse(String text) {
        JSONObject json = new JSONObject(text);
        Object id = json.has("id") && !json.isNull("id") ? json.get("id") : null;
        String method = json.optString("method", "");
        return new RpcRequest(id, method, json.optJSONObject("params"));
    }

    @Override
    public String toString() {
        return "RpcRequest{id=" + id + ", method=" + method + "}";
    }
}

/**
 * 组装响应、错误和通知
 */
final class JsonRpc {

    static final String VERSION = "2.0";

    static final int PARSE_ERROR = -32700;
    static final int INVALID_REQUEST = -32600;
    static final int METHOD_NOT_FOUND = -32601;
    static final int INVALID_PARAMS = -32602;
    static final int INTERNAL_ERROR = -32603;

    private JsonRpc() {}

    static JSONObject result(Object id, Object result) {
        JSONObject json = new JSONObject();
        json.put("jsonrpc", VERSION);
        json.put("id", id != null ? id : JSONObject.NULL);
        json.put("result", result != null ? result : new JSONObject());
        return json;
    }

    static JSONObject error(Object id, int code, String message) {
        JSONObject error = new JSONObject();
        error.put("code", code);
        error.put("message", message);

        JSONObject json = new JSONObject();
        json.put("jsonrpc", VERSION);
        json.put("id", id != null ? id : JSONObject.NULL);
        json.put("error", error);
        return json;
    }

    static JSONObject error(Object id, ErrorCode code, String message) {
        return error(id, code.rpcCode(), message);
    }

    static JSONObject notification(String method, JSONObject params) {
        JSONObject json = new JSONObject();
        json.put("jsonrpc", VERSION);
        json.put("method", method);
        json.put("params", params != null ? params : new JSONObject());
        return json;
    }
}
