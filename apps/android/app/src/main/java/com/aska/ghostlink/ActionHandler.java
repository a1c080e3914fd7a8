package com.aska.ghostlink;

import org.json.JSONObject;

/**
 * 单个动作的处理器
 *
 * 处理器可以抛出任何异常，由 ActionDispatcher 统一转换为错误结果。
 */
public interface ActionHandler {

    /**
     * @param params 动作参数，不为 null
     */
    ApiResponse handle(JSONObject params) throws Exception;
}
