package com.aska.ghostlink;

import org.java_websocket.WebSocket;
import org.java_websocket.framing.CloseFrame;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.server.WebSocketServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 本地 WebSocket JSON-RPC 服务
 *
 * 只保留一个会话：新连接建立时关闭旧连接。
 * 消息在单线程上依次处理，响应顺序与请求顺序一致。
 */
public class RpcWebSocketServer {

    private static final Logger log = LoggerFactory.getLogger(Config.LOG_TAG + ".WsServer");

    private static final long START_TIMEOUT_MS = 5000L;
    private static final int STOP_TIMEOUT_MS = 1000;

    private final McpProtocolHandler handler;
    private final ConfigStore config;

    private Server server;
    private ExecutorService messageExecutor;
    private volatile WebSocket session;
    private volatile int port = Config.DEFAULT_WEBSOCKET_PORT;

    public RpcWebSocketServer(McpProtocolHandler handler, ConfigStore config) {
        this.handler = handler;
        this.config = config;
    }

    /**
     * 启动并等待监听就绪
     *
     * @param port 监听端口，0 表示由系统分配
     */
    public synchronized boolean start(int port) {
        if (server != null) {
            log.warn("WebSocket server already running on port {}", this.port);
            return true;
        }

        Server candidate = new Server(new InetSocketAddress(port));
        candidate.setReuseAddr(true);
        messageExecutor = Executors.newSingleThreadExecutor(HttpCommandServer.namedThreads("ghostlink-ws-rpc"));
        candidate.start();

        try {
            if (!candidate.started.await(START_TIMEOUT_MS, TimeUnit.MILLISECONDS) || candidate.failure != null) {
                log.error("Failed to start WebSocket server on port {}", port, candidate.failure);
                shutdown(candidate);
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown(candidate);
            return false;
        }

        server = candidate;
        this.port = candidate.getPort();
        log.info("WebSocket server started on port {}", this.port);
        return true;
    }

    public synchronized void stop() {
        if (server == null) return;
        shutdown(server);
        server = null;
        session = null;
        log.info("WebSocket server stopped");
    }

    private void shutdown(Server target) {
        try {
            target.stop(STOP_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping WebSocket server");
        }
        if (messageExecutor != null) {
            messageExecutor.shutdownNow();
            messageExecutor = null;
        }
    }

    public boolean isRunning() {
        return server != null;
    }

    public int getPort() {
        return port;
    }

    public boolean hasSession() {
        WebSocket current = session;
        return current != null && current.isOpen();
    }

    /**
     * 开启认证时，握手需携带 Authorization: Bearer 或 ?token=
     */
    boolean isAuthorized(ClientHandshake handshake) {
        if (!config.isAuthEnabled()) {
            return true;
        }
        String expected = config.getAuthToken();
        String header = handshake.getFieldValue("Authorization");
        if (header != null && header.startsWith("Bearer ")
                && header.substring("Bearer ".length()).trim().equals(expected)) {
            return true;
        }
        String query = HttpCommandServer.parseQuery(handshake.getResourceDescriptor()).optString("token", "");
        return query.equals(expected);
    }

    private final class Server extends WebSocketServer {

        final CountDownLatch started = new CountDownLatch(1);
        volatile Exception failure;

        Server(InetSocketAddress address) {
            super(address);
        }

        @Override
        public void onOpen(WebSocket conn, ClientHandshake handshake) {
            if (!isAuthorized(handshake)) {
                log.warn("Rejected unauthorized WebSocket client: {}", conn.getRemoteSocketAddress());
                conn.close(CloseFrame.POLICY_VALIDATION, "Unauthorized");
                return;
            }
            WebSocket previous = session;
            session = conn;
            if (previous != null && previous.isOpen()) {
                log.info("Replacing previous WebSocket session");
                previous.close(CloseFrame.NORMAL, "Replaced by new session");
            }
            log.info("WebSocket client connected: {}", conn.getRemoteSocketAddress());
        }

        @Override
        public void onClose(WebSocket conn, int code, String reason, boolean remote) {
            if (conn == session) {
                session = null;
            }
            log.info("WebSocket client disconnected: code={}, reason={}", code, reason);
        }

        @Override
        public void onMessage(WebSocket conn, String message) {
            if (conn != session) {
                log.debug("Ignoring message from inactive connection");
                return;
            }
            if (Config.DEBUG_MODE) {
                log.debug("Received: {}", message);
            }
            ExecutorService executor = messageExecutor;
            if (executor == null) return;
            executor.execute(() -> {
                String reply = handler.handleMessage(message);
                if (reply != null && conn.isOpen()) {
                    conn.send(reply);
                }
            });
        }

        @Override
        public void onError(WebSocket conn, Exception ex) {
            if (conn == null) {
                // 服务端自身的错误（例如端口占用）
                failure = ex;
                started.countDown();
            }
            log.error("WebSocket error", ex);
        }

        @Override
        public void onStart() {
            started.countDown();
        }
    }
}
