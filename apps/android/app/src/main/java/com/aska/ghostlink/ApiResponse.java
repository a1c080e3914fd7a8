package com.aska.ghostlink;

import org.json.JSONObject;

import java.util.Arrays;
import java.util.Base64;

/**
 * 分发结果：JSON 成功、错误或二进制（截图）
 */
public abstract class ApiResponse {

    private ApiResponse() {}

    public abstract boolean isSuccess();

    /**
     * 序列化为 JSON 文本
     */
    public abstract String toJson();

    public static Success success(Object data) {
        return new Success(data);
    }

    public static Error error(ErrorCode code, String message) {
        return new Error(code, message);
    }

    public static Error failed(String message) {
        return new Error(ErrorCode.OPERATION_FAILED, message);
    }

    /**
     * 成功，data 可以是字符串、数字、JSONObject/JSONArray 或 Gson 模型
     */
    public static final class Success extends ApiResponse {
        private final Object data;

        Success(Object data) {
            this.data = data;
        }

        public Object getData() {
            return data;
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public String toJson() {
            JSONObject json = new JSONObject();
            json.put("success", true);
            json.put("data", wrap(data));
            return json.toString();
        }

        private static Object wrap(Object data) {
            if (data == null) return JSONObject.NULL;
            if (data instanceof String || data instanceof Number || data instanceof Boolean
                    || data instanceof JSONObject || data instanceof org.json.JSONArray) {
                return data;
            }
            if (data instanceof Iterable) {
                return JsonUtils.toJsonArray((Iterable<?>) data);
            }
            return JsonUtils.toJsonObject(data);
        }

        @Override
        public String toString() {
            return "Success(" + data + ")";
        }
    }

    /**
     * 应用层错误
     */
    public static final class Error extends ApiResponse {
        private final ErrorCode code;
        private final String message;

        Error(ErrorCode code, String message) {
            this.code = code;
            this.message = message != null ? message : "Unknown error";
        }

        public ErrorCode getCode() {
            return code;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public String toJson() {
            JSONObject json = new JSONObject();
            json.put("success", false);
            json.put("error", message);
            json.put("code", code.name());
            return json.toString();
        }

        @Override
        public String toString() {
            return "Error(" + code + ": " + message + ")";
        }
    }

    /**
     * 二进制结果（PNG），HTTP 下原样写出，JSON 通道下转为 Base64
     */
    public static final class Binary extends ApiResponse {
        private final byte[] data;
        private final String contentType;

        public Binary(byte[] data, String contentType) {
            this.data = data;
            this.contentType = contentType;
        }

        public byte[] getData() {
            return data;
        }

        public String getContentType() {
            return contentType;
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public String toJson() {
            JSONObject json = new JSONObject();
            json.put("success", true);
            json.put("data", Base64.getEncoder().encodeToString(data));
            json.put("contentType", contentType);
            return json.toString();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Binary)) return false;
            return Arrays.equals(data, ((Binary) o).data);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(data);
        }
    }
}
