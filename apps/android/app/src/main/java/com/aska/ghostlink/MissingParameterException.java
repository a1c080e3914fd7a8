package com.aska.ghostlink;

/**
 * 必填参数缺失（例如启动应用缺少包名、输入缺少文本）
 */
public class MissingParameterException extends Exception {

    private final String parameter;

    public MissingParameterException(String parameter) {
        super("Missing required parameter: " + parameter);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
