package com.aska.ghostlink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * GhostLink 服务核心
 *
 * 职责：
 * - 组装分发器、工具列表和三种传输
 * - 按配置启动本地 HTTP 服务、本地 WebSocket 服务和反向连接
 * - 配置变化时重启或启停对应的传输
 */
public class GhostLinkService implements ConfigStore.ConfigChangeListener, ConnectionListener {

    private static final Logger log = LoggerFactory.getLogger(Config.LOG_TAG + ".Service");

    private final ConfigStore config;
    private final ActionDispatcher dispatcher;
    private final McpProtocolHandler protocolHandler;
    private final HttpCommandServer httpServer;
    private final RpcWebSocketServer webSocketServer;
    private final ReverseConnectionClient reverseClient;

    private volatile boolean running = false;
    private volatile String lastNotice;

    public GhostLinkService(DeviceAutomation device, ConfigStore config) {
        this.config = config;
        this.dispatcher = ActionDispatcher.create(device, config);
        this.protocolHandler = new McpProtocolHandler(dispatcher, new ToolCatalog(), config);
        this.httpServer = new HttpCommandServer(dispatcher, config);
        this.webSocketServer = new RpcWebSocketServer(protocolHandler, config);
        this.reverseClient = new ReverseConnectionClient(config, protocolHandler);
        this.reverseClient.addListener(this);
    }

    /**
     * 按当前配置启动各个传输
     */
    public synchronized void start() {
        if (running) {
            log.warn("Service already running");
            return;
        }
        running = true;
        log.info("GhostLink service starting...");

        if (config.getBoolean(Config.KEY_SOCKET_SERVER_ENABLED, true)) {
            startHttpServer();
        }
        if (config.getBoolean(Config.KEY_WEBSOCKET_ENABLED, false)) {
            startWebSocketServer();
        }
        if (config.isReverseConnectionEnabled()) {
            reverseClient.connect();
        }
        config.addListener(this);

        if (config.isAuthEnabled()) {
            // 首次读取时生成令牌
            log.info("Authentication enabled, token length {}", config.getAuthToken().length());
        }
        log.info("GhostLink service started");
    }

    /**
     * 停止全部传输，之后可以再次 start
     */
    public synchronized void stop() {
        if (!running) return;
        running = false;
        log.info("GhostLink service stopping...");
        config.removeListener(this);
        httpServer.stop();
        webSocketServer.stop();
        reverseClient.disconnect();
        log.info("GhostLink service stopped");
    }

    /**
     * 停止并释放反向连接的线程，服务不再使用
     */
    public synchronized void release() {
        stop();
        reverseClient.release();
    }

    private void startHttpServer() {
        int port = config.getInt(Config.KEY_SOCKET_SERVER_PORT, Config.DEFAULT_SOCKET_PORT);
        if (!httpServer.start(port)) {
            log.error("HTTP server failed to start on port {}", port);
        }
    }

    private void startWebSocketServer() {
        int port = config.getInt(Config.KEY_WEBSOCKET_PORT, Config.DEFAULT_WEBSOCKET_PORT);
        if (!webSocketServer.start(port)) {
            log.error("WebSocket server failed to start on port {}", port);
        }
    }

    // ========== 配置变化 ==========

    @Override
    public void onConfigChanged(String key, String newValue) {
        if (!running) return;
        switch (key) {
            case Config.KEY_SOCKET_SERVER_ENABLED:
            case Config.KEY_SOCKET_SERVER_PORT:
                restartHttpServer();
                break;
            case Config.KEY_WEBSOCKET_ENABLED:
            case Config.KEY_WEBSOCKET_PORT:
                restartWebSocketServer();
                break;
            case Config.KEY_REVERSE_CONNECTION_ENABLED:
                if (config.isReverseConnectionEnabled()) {
                    reverseClient.connect();
                } else {
                    reverseClient.disconnect();
                }
                break;
            case Config.KEY_REVERSE_CONNECTION_URL:
            case Config.KEY_REVERSE_CONNECTION_TOKEN:
                if (config.isReverseConnectionEnabled()) {
                    reverseClient.reconnect();
                }
                break;
            default:
                break;
        }
    }

    private synchronized void restartHttpServer() {
        httpServer.stop();
        if (config.getBoolean(Config.KEY_SOCKET_SERVER_ENABLED, true)) {
            startHttpServer();
        }
    }

    private synchronized void restartWebSocketServer() {
        webSocketServer.stop();
        if (config.getBoolean(Config.KEY_WEBSOCKET_ENABLED, false)) {
            startWebSocketServer();
        }
    }

    // ========== 反向连接状态 ==========

    @Override
    public void onStateChanged(ConnectionState state) {
        log.info("Reverse connection state: {}", state);
    }

    @Override
    public void onConnectionNotice(String message) {
        lastNotice = message;
        log.info("Notice: {}", message);
    }

    // ========== 访问 ==========

    public boolean isRunning() {
        return running;
    }

    public ActionDispatcher getDispatcher() {
        return dispatcher;
    }

    public McpProtocolHandler getProtocolHandler() {
        return protocolHandler;
    }

    public HttpCommandServer getHttpServer() {
        return httpServer;
    }

    public RpcWebSocketServer getWebSocketServer() {
        return webSocketServer;
    }

    public ConnectionState getReverseConnectionState() {
        return reverseClient.getState();
    }

    public String getLastNotice() {
        return lastNotice;
    }
}
