package com.aska.ghostlink;

import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.logging.HttpLoggingInterceptor;

/**
 * 反向连接客户端
 *
 * 设备主动连接远端，但在 JSON-RPC 中扮演服务端：等待远端发送 initialize。
 *
 * 职责：
 * 1. 连接、握手、断开后按指数退避重连（1s 起，最大 60s），仅在配置开启时重连
 * 2. 握手完成前收到的 tools/call 进入有界队列，就绪后先按顺序处理完队列再处理新消息
 * 3. WebSocket ping 保活，超时由 OkHttp 判定为失败并进入重连
 * 4. 连接提示只在整个生命周期的第一次就绪时发出
 *
 * 所有状态只在内部单线程上修改。
 */
public class ReverseConnectionClient {

    private static final Logger log = LoggerFactory.getLogger(Config.LOG_TAG + ".Reverse");

    static final String NOTIFICATION_REQUEST_QUEUED = "notifications/request_queued";

    /**
     * 发送通道，便于替换底层 WebSocket
     */
    interface RpcChannel {
        boolean send(String text);

        void close(int code, String reason);
    }

    private final ConfigStore config;
    private final McpProtocolHandler handler;
    private final OkHttpClient client;
    private final ScheduledExecutorService executor;
    private final ReconnectBackoff backoff;
    private final PendingRequestQueue pending;
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private RpcChannel channel;
    private ScheduledFuture<?> reconnectTask;
    private int generation = 0;
    private boolean shouldReconnect = false;
    private boolean noticeSent = false;

    public ReverseConnectionClient(ConfigStore config, McpProtocolHandler handler) {
        this(config, handler, buildClient(config),
            Executors.newSingleThreadScheduledExecutor(HttpCommandServer.namedThreads("ghostlink-reverse")),
            new ReconnectBackoff(), new PendingRequestQueue());
    }

    ReverseConnectionClient(ConfigStore config, McpProtocolHandler handler, OkHttpClient client,
                            ScheduledExecutorService executor, ReconnectBackoff backoff,
                            PendingRequestQueue pending) {
        this.config = config;
        this.handler = handler;
        this.client = client;
        this.executor = executor;
        this.backoff = backoff;
        this.pending = pending;
    }

    private static OkHttpClient buildClient(ConfigStore config) {
        long heartbeat = config.getLong(Config.KEY_HEARTBEAT_INTERVAL, Config.DEFAULT_HEARTBEAT_INTERVAL_MS);
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(0, TimeUnit.SECONDS) // WebSocket 需要无限读取超时
            .writeTimeout(10, TimeUnit.SECONDS)
            .pingInterval(heartbeat, TimeUnit.MILLISECONDS);

        if (Config.DEBUG_MODE) {
            HttpLoggingInterceptor logging = new HttpLoggingInterceptor(message -> log.debug(message));
            logging.setLevel(HttpLoggingInterceptor.Level.BODY);
            builder.addInterceptor(logging);
        }
        return builder.build();
    }

    public void addListener(ConnectionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConnectionListener listener) {
        listeners.remove(listener);
    }

    public ConnectionState getState() {
        return state;
    }

    // ========== 连接控制 ==========

    /**
     * 开始连接，之后断线会自动重连
     */
    public void connect() {
        executor.execute(() -> {
            shouldReconnect = true;
            cancelReconnect();
            openSocket();
        });
    }

    /**
     * 主动断开，不再重连
     */
    public void disconnect() {
        executor.execute(this::closeInternal);
    }

    /**
     * 断开后立即按当前配置重新连接，退避复位
     */
    public void reconnect() {
        executor.execute(() -> {
            closeInternal();
            backoff.reset();
            shouldReconnect = true;
            openSocket();
        });
    }

    /**
     * 释放资源，之后不能再连接；重复调用无效果
     */
    public synchronized void release() {
        if (executor.isShutdown()) return;
        executor.execute(this::closeInternal);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        client.dispatcher().executorService().shutdown();
    }

    private void closeInternal() {
        log.info("Disconnecting reverse connection...");
        shouldReconnect = false;
        cancelReconnect();
        generation++;
        if (channel != null) {
            channel.close(1000, "Client disconnect");
            channel = null;
        }
        dropPending();
        setState(ConnectionState.DISCONNECTED);
    }

    private void openSocket() {
        if (!config.isReverseConnectionEnabled()) {
            log.info("Reverse connection disabled, not connecting");
            return;
        }
        String url = config.getReverseConnectionUrl();
        if (url == null || url.isEmpty()) {
            log.error("Cannot connect: reverse connection URL is empty");
            return;
        }
        if (state != ConnectionState.DISCONNECTED) {
            log.warn("Already {}", state);
            return;
        }

        Request request;
        try {
            Request.Builder builder = new Request.Builder().url(url);
            String token = config.getString(Config.KEY_REVERSE_CONNECTION_TOKEN, "");
            if (!token.isEmpty()) {
                builder.header("Authorization", "Bearer " + token);
            }
            String deviceName = config.getString(Config.KEY_DEVICE_NAME, "");
            if (!deviceName.isEmpty()) {
                builder.header("X-Device-Name", deviceName);
            }
            request = builder.build();
        } catch (IllegalArgumentException e) {
            log.error("Invalid reverse connection URL: {}", url, e);
            return;
        }

        log.info("Connecting to {}", url);
        setState(ConnectionState.CONNECTING);
        int socketGeneration = ++generation;
        client.newWebSocket(request, new SocketListener(socketGeneration));
    }

    // ========== 事件处理（连接线程） ==========

    void handleOpen(RpcChannel openedChannel) {
        log.info("Reverse connection opened, awaiting initialize");
        channel = openedChannel;
        backoff.reset();
        setState(ConnectionState.AWAITING_HANDSHAKE);
    }

    void handleText(String text) {
        if (Config.DEBUG_MODE) {
            log.debug("Received: {}", text);
        }

        RpcRequest request;
        try {
            request = RpcRequest.parse(text);
        } catch (JSONException e) {
            log.warn("Failed to parse message: {}", e.getMessage());
            send(JsonRpc.error(null, JsonRpc.PARSE_ERROR, "Parse error"));
            return;
        }

        if (McpProtocolHandler.METHOD_INITIALIZE.equals(request.method)) {
            send(handler.handle(request));
            if (state != ConnectionState.READY) {
                setState(ConnectionState.READY);
                sendNoticeOnce();
                drainPending();
            }
            return;
        }

        if (McpProtocolHandler.METHOD_TOOLS_CALL.equals(request.method)
                && !request.isNotification()
                && state != ConnectionState.READY) {
            enqueue(request);
            return;
        }

        send(handler.handle(request));
    }

    void handleClosed(String reason) {
        log.info("Reverse connection closed: {}", reason);
        channel = null;
        dropPending();
        setState(ConnectionState.DISCONNECTED);
        scheduleReconnect();
    }

    private void enqueue(RpcRequest request) {
        if (!pending.offer(request)) {
            log.warn("Pending queue full, rejecting {}", request);
            send(JsonRpc.error(request.id, ErrorCode.QUEUE_FULL, "Request queue full, retry later"));
            return;
        }
        log.info("Queued {} until handshake completes ({} pending)", request, pending.size());

        JSONObject params = new JSONObject();
        params.put("requestId", request.id);
        params.put("code", ErrorCode.QUEUED.rpcCode());
        params.put("message", "Request queued, will process automatically");
        params.put("position", pending.size());
        send(JsonRpc.notification(NOTIFICATION_REQUEST_QUEUED, params));
    }

    private void drainPending() {
        List<RpcRequest> requests = pending.drain();
        if (requests.isEmpty()) return;
        log.info("Processing {} queued request(s)", requests.size());
        for (RpcRequest request : requests) {
            send(handler.handle(request));
        }
    }

    private void dropPending() {
        int dropped = pending.clear();
        if (dropped > 0) {
            log.info("Dropped {} pending request(s) on disconnect", dropped);
        }
    }

    private void send(JSONObject message) {
        if (message == null) return;
        String text = message.toString();
        if (Config.DEBUG_MODE) {
            log.debug("Sending: {}", text);
        }
        if (channel == null || !channel.send(text)) {
            log.warn("Failed to send message, connection not available");
        }
    }

    private void sendNoticeOnce() {
        if (noticeSent) return;
        noticeSent = true;
        String message = "Connected to " + config.getReverseConnectionUrl();
        for (ConnectionListener listener : listeners) {
            listener.onConnectionNotice(message);
        }
    }

    private void setState(ConnectionState newState) {
        if (state == newState) return;
        state = newState;
        log.debug("State -> {}", newState);
        for (ConnectionListener listener : listeners) {
            listener.onStateChanged(newState);
        }
    }

    // ========== 重连 ==========

    private void scheduleReconnect() {
        if (!shouldReconnect || !config.isReverseConnectionEnabled()) {
            log.info("Reconnect skipped: disabled");
            return;
        }
        cancelReconnect();
        long delay = backoff.nextDelay();
        log.info("Reconnecting in {}ms", delay);
        reconnectTask = executor.schedule(() -> {
            reconnectTask = null;
            if (shouldReconnect && config.isReverseConnectionEnabled()) {
                openSocket();
            } else {
                log.info("Reconnect cancelled: disabled");
            }
        }, delay, TimeUnit.MILLISECONDS);
    }

    private void cancelReconnect() {
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
    }

    long nextBackoffDelay() {
        return backoff.peek();
    }

    int pendingCount() {
        return pending.size();
    }

    // ========== OkHttp 回调 ==========

    private final class SocketListener extends WebSocketListener {

        private final int socketGeneration;

        SocketListener(int socketGeneration) {
            this.socketGeneration = socketGeneration;
        }

        private void post(Runnable task) {
            executor.execute(() -> {
                if (socketGeneration == generation) {
                    task.run();
                }
            });
        }

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            post(() -> handleOpen(new OkHttpChannel(webSocket)));
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            post(() -> handleText(text));
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            log.info("Reverse connection closing: {} - {}", code, reason);
            webSocket.close(code, reason);
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            post(() -> handleClosed(code + " - " + reason));
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            log.error("Reverse connection error", t);
            post(() -> handleClosed("failure: " + t.getMessage()));
        }
    }

    private static final class OkHttpChannel implements RpcChannel {
        private final WebSocket webSocket;

        OkHttpChannel(WebSocket webSocket) {
            this.webSocket = webSocket;
        }

        @Override
        public boolean send(String text) {
            return webSocket.send(text);
        }

        @Override
        public void close(int code, String reason) {
            webSocket.close(code, reason);
        }
    }
}
