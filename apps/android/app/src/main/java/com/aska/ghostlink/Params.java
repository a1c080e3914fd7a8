package com.aska.ghostlink;

import org.json.JSONObject;

/**
 * 动作参数读取
 *
 * 数值参数缺失时按 0 处理；只有少数参数（包名、输入文本）是必填的。
 */
final class Params {

    private Params() {}

    static int getInt(JSONObject params, String key) {
        return params.optInt(key, 0);
    }

    static int getInt(JSONObject params, String key, int defaultValue) {
        return params.optInt(key, defaultValue);
    }

    static long getLong(JSONObject params, String key, long defaultValue) {
        return params.optLong(key, defaultValue);
    }

    /**
     * 接受 JSON 布尔值，也接受 "true"/"false" 字符串
     */
    static boolean getBoolean(JSONObject params, String key, boolean defaultValue) {
        return params.optBoolean(key, defaultValue);
    }

    /**
     * @return 参数值，缺失或为 JSON null 时返回 null
     */
    static String getString(JSONObject params, String key) {
        if (!params.has(key) || params.isNull(key)) {
            return null;
        }
        return String.valueOf(params.get(key));
    }

    static String getString(JSONObject params, String key, String defaultValue) {
        String value = getString(params, key);
        return value != null ? value : defaultValue;
    }

    /**
     * @throws MissingParameterException 参数缺失或为空串
     */
    static String requireString(JSONObject params, String key) throws MissingParameterException {
        String value = getString(params, key);
        if (value == null || value.isEmpty()) {
            throw new MissingParameterException(key);
        }
        return value;
    }
}
