package com.aska.ghostlink;

/**
 * GhostLink 配置常量
 *
 * 包含端口、超时、重连策略、精简树上限以及配置项键名。
 * 运行时可变的值通过 {@link ConfigStore} 读取，这里只放默认值和键名。
 */
public final class Config {

    private Config() {}

    // ========== 日志配置 ==========

    /**
     * 日志标签前缀
     */
    public static final String LOG_TAG = "GhostLink";

    /**
     * 是否启用详细日志（原始报文、手势坐标）
     */
    public static volatile boolean DEBUG_MODE = false;

    // ========== 服务端口 ==========

    public static final int DEFAULT_SOCKET_PORT = 8080;
    public static final int DEFAULT_WEBSOCKET_PORT = 8081;

    /**
     * HTTP 工作线程数（另有一个线程负责 accept）
     */
    public static final int HTTP_THREAD_POOL_SIZE = 5;

    // ========== 反向连接 ==========

    /**
     * 重连初始延迟 1 秒，每次失败翻倍
     */
    public static final long INITIAL_RETRY_DELAY_MS = 1000L;

    /**
     * 重连最大延迟 60 秒
     */
    public static final long MAX_RETRY_DELAY_MS = 60 * 1000L;

    /**
     * 心跳间隔（OkHttp WebSocket ping），默认 30 秒
     */
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 30 * 1000L;

    /**
     * 握手完成前最多缓存的 tools/call 请求数
     */
    public static final int MAX_PENDING_REQUESTS = 10;

    /**
     * 缓存请求过期时间 30 秒
     */
    public static final long PENDING_REQUEST_TIMEOUT_MS = 30 * 1000L;

    public static final String PROTOCOL_VERSION = "2024-11-05";
    public static final String SERVER_NAME = "GhostLink";

    // ========== UI 树精简 ==========

    /**
     * 精简输出的最大元素数量，超过后静默丢弃
     */
    public static final int MAX_UI_ELEMENTS = 100;

    /**
     * 文本最大长度，超过后截断并追加省略号
     */
    public static final int MAX_TEXT_LENGTH = 80;

    /**
     * 可见比例阈值（1%）
     */
    public static final float VISIBILITY_THRESHOLD = 0.01f;

    // ========== 手势 ==========

    public static final long TAP_DURATION_MS = 50L;
    public static final long DOUBLE_TAP_INTERVAL_MS = 100L;
    public static final long DEFAULT_LONG_PRESS_MS = 1000L;
    public static final int DEFAULT_SWIPE_DURATION_MS = 300;
    public static final int MIN_SWIPE_DURATION_MS = 10;
    public static final int MAX_SWIPE_DURATION_MS = 5000;
    public static final int DRAG_DURATION_MS = 500;

    // ========== 等待与截图 ==========

    public static final long DEFAULT_WAIT_INTERVAL_MS = 200L;
    public static final long DEFAULT_WAIT_TIMEOUT_MS = 10 * 1000L;
    public static final long DEFAULT_SCREENSHOT_TIMEOUT_MS = 5 * 1000L;
    public static final long DEFAULT_ELEMENT_SETTLE_MS = 500L;

    // ========== 配置项键名 ==========

    public static final String PREFS_RESOURCE = "ghostlink.properties";

    public static final String KEY_SOCKET_SERVER_ENABLED = "socket_server_enabled";
    public static final String KEY_SOCKET_SERVER_PORT = "socket_server_port";
    public static final String KEY_WEBSOCKET_ENABLED = "websocket_enabled";
    public static final String KEY_WEBSOCKET_PORT = "websocket_port";
    public static final String KEY_REVERSE_CONNECTION_ENABLED = "reverse_connection_enabled";
    public static final String KEY_REVERSE_CONNECTION_URL = "reverse_connection_url";
    public static final String KEY_REVERSE_CONNECTION_TOKEN = "reverse_connection_token";
    public static final String KEY_AUTH_ENABLED = "auth_enabled";
    public static final String KEY_AUTH_TOKEN = "auth_token";
    public static final String KEY_OVERLAY_OFFSET = "overlay_offset";
    public static final String KEY_OVERLAY_VISIBLE = "overlay_visible";
    public static final String KEY_MCP_TOOLS_ENABLED = "mcp_tools_enabled";
    public static final String KEY_HEARTBEAT_INTERVAL = "heartbeat_interval";
    public static final String KEY_SCREENSHOT_TIMEOUT = "screenshot_timeout";
    public static final String KEY_WAIT_INTERVAL = "wait_interval";
    public static final String KEY_WAIT_TIMEOUT = "wait_timeout";
    public static final String KEY_ELEMENT_SETTLE_DELAY = "element_settle_delay";
    public static final String KEY_DEVICE_NAME = "device_name";
    public static final String KEY_APP_VERSION = "app_version";
}
