package com.aska.ghostlink;

import java.util.Properties;

/**
 * 测试用配置：默认值之上关闭等待延迟
 */
final class TestConfigs {

    private TestConfigs() {}

    static ConfigStore fast() {
        Properties overrides = new Properties();
        overrides.setProperty(Config.KEY_ELEMENT_SETTLE_DELAY, "0");
        overrides.setProperty(Config.KEY_SCREENSHOT_TIMEOUT, "300");
        overrides.setProperty(Config.KEY_WAIT_INTERVAL, "10");
        overrides.setProperty(Config.KEY_WAIT_TIMEOUT, "200");
        return ConfigStore.withOverrides(overrides);
    }
}
