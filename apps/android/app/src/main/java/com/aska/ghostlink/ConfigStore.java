package com.aska.ghostlink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 键值配置存储
 *
 * 职责：
 * 1. 从 classpath 的 ghostlink.properties 加载默认值
 * 2. 提供带类型的读写（字符串存储，读取时转换）
 * 3. 值发生变化时通知本实例持有的监听器
 *
 * 多线程读、设置界面单线程写，不需要事务。
 */
public class ConfigStore {

    private static final Logger log = LoggerFactory.getLogger(Config.LOG_TAG + ".Config");

    private final Map<String, String> values = new ConcurrentHashMap<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * 配置变更监听器，在写入方线程上同步回调
     */
    public interface ConfigChangeListener {
        void onConfigChanged(String key, String newValue);
    }

    /**
     * 加载 classpath 默认配置
     */
    public ConfigStore() {
        this(loadDefaults());
    }

    public ConfigStore(Properties initial) {
        if (initial != null) {
            for (String name : initial.stringPropertyNames()) {
                values.put(name, initial.getProperty(name));
            }
        }
    }

    /**
     * 以 classpath 默认值为底，再覆盖传入的配置
     */
    public static ConfigStore withOverrides(Properties overrides) {
        Properties merged = loadDefaults();
        if (overrides != null) {
            merged.putAll(overrides);
        }
        return new ConfigStore(merged);
    }

    private static Properties loadDefaults() {
        Properties props = new Properties();
        try (InputStream in = ConfigStore.class.getClassLoader().getResourceAsStream(Config.PREFS_RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                log.warn("{} not found on classpath, using built-in defaults", Config.PREFS_RESOURCE);
            }
        } catch (IOException e) {
            log.error("Failed to load " + Config.PREFS_RESOURCE, e);
        }
        return props;
    }

    // ========== 监听器 ==========

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    // ========== 读取 ==========

    public String getString(String key, String defaultValue) {
        String value = values.get(key);
        return value != null ? value : defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        String value = values.get(key);
        if (value == null || value.trim().isEmpty()) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Config {} is not an int: {}", key, value);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = values.get(key);
        if (value == null || value.trim().isEmpty()) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Config {} is not a long: {}", key, value);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = values.get(key);
        if (value == null || value.trim().isEmpty()) return defaultValue;
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * 逗号分隔的集合，未设置或为空时返回空集合
     */
    public Set<String> getStringSet(String key) {
        String value = values.get(key);
        if (value == null || value.trim().isEmpty()) return Collections.emptySet();
        Set<String> result = new LinkedHashSet<>();
        for (String item : value.split(",")) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) result.add(trimmed);
        }
        return result;
    }

    // ========== 写入 ==========

    public void setString(String key, String value) {
        String previous = value == null ? values.remove(key) : values.put(key, value);
        if (Objects.equals(previous, value)) return;

        if (Config.DEBUG_MODE) {
            log.debug("Config changed: {} = {}", key, value);
        }
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(key, value);
            } catch (RuntimeException e) {
                log.error("Config listener failed for " + key, e);
            }
        }
    }

    public void setInt(String key, int value) {
        setString(key, String.valueOf(value));
    }

    public void setLong(String key, long value) {
        setString(key, String.valueOf(value));
    }

    public void setBoolean(String key, boolean value) {
        setString(key, String.valueOf(value));
    }

    public void setStringSet(String key, Set<String> items) {
        setString(key, String.join(",", items));
    }

    // ========== 常用项 ==========

    public boolean isAuthEnabled() {
        return getBoolean(Config.KEY_AUTH_ENABLED, false);
    }

    /**
     * 鉴权令牌，首次读取时若不存在则生成
     */
    public synchronized String getAuthToken() {
        String token = getString(Config.KEY_AUTH_TOKEN, "");
        if (token.isEmpty()) {
            token = UUID.randomUUID().toString();
            setString(Config.KEY_AUTH_TOKEN, token);
            log.info("Generated new auth token");
        }
        return token;
    }

    public boolean isReverseConnectionEnabled() {
        return getBoolean(Config.KEY_REVERSE_CONNECTION_ENABLED, false);
    }

    public String getReverseConnectionUrl() {
        return getString(Config.KEY_REVERSE_CONNECTION_URL, "");
    }

    /**
     * 启用的工具集合；为空表示全部启用
     */
    public boolean isToolEnabled(String toolName) {
        Set<String> enabled = getStringSet(Config.KEY_MCP_TOOLS_ENABLED);
        return enabled.isEmpty() || enabled.contains(toolName);
    }

    public void setToolsEnabled(String... toolNames) {
        setStringSet(Config.KEY_MCP_TOOLS_ENABLED, new LinkedHashSet<>(Arrays.asList(toolNames)));
    }
}
