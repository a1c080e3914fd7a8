package com.aska.ghostlink;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * JSON 工具类
 * 类型化模型使用 Gson 序列化；协议信封使用 org.json，这里负责两者之间的桥接
 */
public final class JsonUtils {

    private static final Gson gson = new GsonBuilder()
        .serializeNulls()
        .disableHtmlEscaping()
        .create();

    private JsonUtils() {}

    /**
     * 将对象转换为 JSON 字符串
     */
    public static String toJson(Object obj) {
        return gson.toJson(obj);
    }

    /**
     * 模型对象转换为 JSONObject
     */
    public static JSONObject toJsonObject(Object obj) {
        return new JSONObject(gson.toJson(obj));
    }

    /**
     * 模型集合转换为 JSONArray
     */
    public static JSONArray toJsonArray(Iterable<?> items) {
        return new JSONArray(gson.toJson(items));
    }
}
