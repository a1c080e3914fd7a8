package com.aska.ghostlink;

import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 本地 HTTP 指令服务
 *
 * 职责：
 * 1. 一个接收线程 + 固定大小的工作线程池，每个连接只处理一次请求/响应
 * 2. 开启认证时校验 Authorization: Bearer，/ping 始终放行
 * 3. GET 路径映射到只读查询，POST 路径映射到分发器动作
 * 4. JSON 结果统一带 CORS 与 Connection: close，截图按二进制写出
 */
public class HttpCommandServer {

    private static final Logger log = LoggerFactory.getLogger(Config.LOG_TAG + ".Http");

    private static final int SOCKET_TIMEOUT_MS = 10 * 1000;
    private static final int MAX_HEADER_LINE = 8 * 1024;
    private static final int MAX_BODY_BYTES = 4 * 1024 * 1024;

    /**
     * GET 路径前缀到查询动作，较长的前缀在前
     */
    private static final Map<String, String> GET_ROUTES = new LinkedHashMap<>();

    static {
        GET_ROUTES.put("/ping", "ping");
        GET_ROUTES.put("/a11y_tree_full", "a11y_tree_full");
        GET_ROUTES.put("/a11y_tree", "a11y_tree");
        GET_ROUTES.put("/state_full", "state_full");
        GET_ROUTES.put("/state", "state");
        GET_ROUTES.put("/phone_state", "phone_state");
        GET_ROUTES.put("/version", "version");
        GET_ROUTES.put("/packages", "packages");
        GET_ROUTES.put("/screenshot", "screenshot");
        GET_ROUTES.put("/screen_dump", "screen.dump");
    }

    private final ActionDispatcher dispatcher;
    private final ConfigStore config;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private ServerSocket serverSocket;
    private ExecutorService workers;
    private Thread acceptThread;
    private volatile int port = Config.DEFAULT_SOCKET_PORT;

    public HttpCommandServer(ActionDispatcher dispatcher, ConfigStore config) {
        this.dispatcher = dispatcher;
        this.config = config;
    }

    /**
     * 启动服务
     *
     * @param port 监听端口，0 表示由系统分配
     * @return 启动成功或已在运行时返回 true
     */
    public synchronized boolean start(int port) {
        if (running.get()) {
            log.warn("Server already running on port {}", this.port);
            return true;
        }

        log.info("Starting HTTP server on port {}...", port);
        try {
            ServerSocket socket = new ServerSocket();
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(port));
            serverSocket = socket;
            this.port = socket.getLocalPort();
        } catch (IOException e) {
            log.error("Failed to start HTTP server on port {}", port, e);
            return false;
        }

        workers = Executors.newFixedThreadPool(Config.HTTP_THREAD_POOL_SIZE, namedThreads("ghostlink-http-worker"));
        running.set(true);

        acceptThread = new Thread(this::acceptConnections, "ghostlink-http-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();

        log.info("HTTP server started on port {}", this.port);
        return true;
    }

    /**
     * 停止服务，正在处理的请求会继续完成
     */
    public synchronized void stop() {
        if (!running.getAndSet(false)) return;
        try {
            serverSocket.close();
        } catch (IOException e) {
            log.warn("Error closing server socket", e);
        }
        workers.shutdown();
        workers = null;
        serverSocket = null;
        acceptThread = null;
        log.info("HTTP server stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getPort() {
        return port;
    }

    private void acceptConnections() {
        ServerSocket socket = serverSocket;
        ExecutorService pool = workers;
        while (running.get()) {
            try {
                Socket client = socket.accept();
                try {
                    pool.execute(() -> handleClient(client));
                } catch (RejectedExecutionException e) {
                    log.warn("Worker pool unavailable, dropping connection");
                    closeQuietly(client);
                }
            } catch (SocketException e) {
                if (running.get()) {
                    log.error("Socket exception while accepting connections", e);
                }
                break;
            } catch (IOException e) {
                log.error("Error accepting connection", e);
            }
        }
    }

    // ========== 请求处理 ==========

    void handleClient(Socket client) {
        try (Socket socket = client) {
            socket.setSoTimeout(SOCKET_TIMEOUT_MS);
            InputStream in = new BufferedInputStream(socket.getInputStream());
            OutputStream out = socket.getOutputStream();

            String requestLine = readLine(in);
            if (requestLine == null || requestLine.isEmpty()) return;

            String[] parts = requestLine.split(" ");
            if (parts.length < 2) {
                sendError(out, 400, "Bad Request", ErrorCode.MALFORMED_INPUT);
                return;
            }
            String method = parts[0].toUpperCase(Locale.ROOT);
            String target = parts[1];

            String authorization = null;
            int contentLength = 0;
            String line;
            while ((line = readLine(in)) != null && !line.isEmpty()) {
                int colon = line.indexOf(':');
                if (colon <= 0) continue;
                String name = line.substring(0, colon).trim();
                String value = line.substring(colon + 1).trim();
                if (name.equalsIgnoreCase("Authorization")) {
                    authorization = value;
                } else if (name.equalsIgnoreCase("Content-Length")) {
                    contentLength = parseContentLength(value);
                }
            }

            String path = stripQuery(target);
            if (!isAuthorized(path, authorization)) {
                log.warn("Unauthorized request: {} {}", method, path);
                sendError(out, 401, "Unauthorized", ErrorCode.UNAUTHORIZED);
                return;
            }

            JSONObject params = parseQuery(target);
            switch (method) {
                case "GET":
                    handleGet(path, params, out);
                    break;
                case "POST":
                    if (contentLength < 0 || contentLength > MAX_BODY_BYTES) {
                        sendError(out, 400, "Bad Request", ErrorCode.MALFORMED_INPUT);
                        return;
                    }
                    String body = new String(readBody(in, contentLength), StandardCharsets.UTF_8);
                    try {
                        mergeInto(params, parseBody(body));
                    } catch (JSONException e) {
                        log.warn("Malformed request body for {}: {}", path, e.getMessage());
                        sendError(out, 400, "Bad Request", ErrorCode.MALFORMED_INPUT);
                        return;
                    }
                    handlePost(path, params, out);
                    break;
                case "OPTIONS":
                    sendPreflight(out);
                    break;
                default:
                    sendError(out, 405, "Method Not Allowed", ErrorCode.UNKNOWN_ACTION);
                    break;
            }
        } catch (IOException e) {
            log.warn("Error handling client: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error handling client", e);
        }
    }

    private boolean isAuthorized(String path, String authorization) {
        if (!config.isAuthEnabled() || "/ping".equals(path)) {
            return true;
        }
        if (authorization == null) {
            return false;
        }
        String token = authorization.startsWith("Bearer ")
            ? authorization.substring("Bearer ".length()).trim()
            : authorization.trim();
        return token.equals(config.getAuthToken());
    }

    private void handleGet(String path, JSONObject params, OutputStream out) throws IOException {
        String action = null;
        for (Map.Entry<String, String> route : GET_ROUTES.entrySet()) {
            if (path.startsWith(route.getKey())) {
                action = route.getValue();
                break;
            }
        }
        if (action == null) {
            sendJson(out, ApiResponse.error(ErrorCode.UNKNOWN_ACTION, "Unknown endpoint: " + path).toJson());
            return;
        }
        writeResponse(out, dispatcher.dispatch(action, params), null);
    }

    private void handlePost(String path, JSONObject params, OutputStream out) throws IOException {
        writeResponse(out, dispatcher.dispatch(path, params), "application/octet-stream");
    }

    /**
     * @param binaryType 二进制结果的 Content-Type，为 null 时使用结果自带的类型
     */
    private void writeResponse(OutputStream out, ApiResponse response, String binaryType) throws IOException {
        if (response instanceof ApiResponse.Binary) {
            ApiResponse.Binary binary = (ApiResponse.Binary) response;
            sendBinary(out, binary.getData(), binaryType != null ? binaryType : binary.getContentType());
        } else {
            sendJson(out, response.toJson());
        }
    }

    // ========== 解析 ==========

    static String stripQuery(String target) {
        int q = target.indexOf('?');
        return q >= 0 ? target.substring(0, q) : target;
    }

    /**
     * 查询串参数，类型规则与表单相同
     */
    static JSONObject parseQuery(String target) {
        int q = target.indexOf('?');
        return q >= 0 ? parseForm(target.substring(q + 1)) : new JSONObject();
    }

    /**
     * JSON 对象或 key=value&... 表单
     *
     * @throws JSONException JSON 不合法
     */
    static JSONObject parseBody(String body) {
        String trimmed = body.trim();
        if (trimmed.isEmpty()) {
            return new JSONObject();
        }
        if (trimmed.startsWith("{")) {
            return new JSONObject(trimmed);
        }
        return parseForm(trimmed);
    }

    /**
     * 表单值自动转换：整数字符串转为数字，true/false 转为布尔
     */
    static JSONObject parseForm(String form) {
        JSONObject params = new JSONObject();
        for (String pair : form.split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) continue;
            String key = decode(pair.substring(0, eq));
            String value = decode(pair.substring(eq + 1));
            params.put(key, autoType(value));
        }
        return params;
    }

    static Object autoType(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        if (lower.equals("true")) return Boolean.TRUE;
        if (lower.equals("false")) return Boolean.FALSE;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return value;
        }
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }

    private static void mergeInto(JSONObject target, JSONObject source) {
        for (String key : source.keySet()) {
            target.put(key, source.get(key));
        }
    }

    private static int parseContentLength(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /**
     * 读取一行（CRLF 或 LF 结尾），流结束返回 null
     */
    private static String readLine(InputStream in) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') {
                break;
            }
            if (b != '\r') {
                buffer.write(b);
            }
            if (buffer.size() > MAX_HEADER_LINE) {
                throw new IOException("Header line too long");
            }
        }
        if (b == -1 && buffer.size() == 0) {
            return null;
        }
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static byte[] readBody(InputStream in, int length) throws IOException {
        byte[] body = new byte[length];
        int offset = 0;
        while (offset < length) {
            int read = in.read(body, offset, length - offset);
            if (read < 0) {
                throw new IOException("Unexpected end of request body");
            }
            offset += read;
        }
        return body;
    }

    // ========== 响应 ==========

    private static void sendJson(OutputStream out, String json) throws IOException {
        byte[] body = json.getBytes(StandardCharsets.UTF_8);
        String headers = "HTTP/1.1 200 OK\r\n"
            + "Content-Type: application/json\r\n"
            + "Content-Length: " + body.length + "\r\n"
            + "Access-Control-Allow-Origin: *\r\n"
            + "Connection: close\r\n"
            + "\r\n";
        out.write(headers.getBytes(StandardCharsets.UTF_8));
        out.write(body);
        out.flush();
    }

    private static void sendBinary(OutputStream out, byte[] data, String contentType) throws IOException {
        String headers = "HTTP/1.1 200 OK\r\n"
            + "Content-Type: " + contentType + "\r\n"
            + "Content-Length: " + data.length + "\r\n"
            + "Access-Control-Allow-Origin: *\r\n"
            + "Connection: close\r\n"
            + "\r\n";
        out.write(headers.getBytes(StandardCharsets.UTF_8));
        out.write(data);
        out.flush();
    }

    private static void sendError(OutputStream out, int status, String reason, ErrorCode code) throws IOException {
        byte[] body = ApiResponse.error(code, reason).toJson().getBytes(StandardCharsets.UTF_8);
        String headers = "HTTP/1.1 " + status + " " + reason + "\r\n"
            + "Content-Type: application/json\r\n"
            + "Content-Length: " + body.length + "\r\n"
            + "Access-Control-Allow-Origin: *\r\n"
            + "Connection: close\r\n"
            + "\r\n";
        out.write(headers.getBytes(StandardCharsets.UTF_8));
        out.write(body);
        out.flush();
    }

    private static void sendPreflight(OutputStream out) throws IOException {
        String headers = "HTTP/1.1 204 No Content\r\n"
            + "Access-Control-Allow-Origin: *\r\n"
            + "Access-Control-Allow-Methods: GET, POST, OPTIONS\r\n"
            + "Access-Control-Allow-Headers: Authorization, Content-Type\r\n"
            + "Content-Length: 0\r\n"
            + "Connection: close\r\n"
            + "\r\n";
        out.write(headers.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing rejected socket: {}", e.getMessage());
        }
    }

    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
