package com.aska.ghostlink;

import org.json.JSONObject;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

public class RpcWebSocketServerTest {

    /**
     * 客户端侧记录收到的消息和关闭码
     */
    private static final class Client extends WebSocketListener {
        final BlockingQueue<String> messages = new LinkedBlockingQueue<>();
        final AtomicInteger closeCode = new AtomicInteger(-1);
        final CountDownLatch opened = new CountDownLatch(1);
        final CountDownLatch closed = new CountDownLatch(1);

        @Override
        public void onOpen(WebSocket webSocket, okhttp3.Response response) {
            opened.countDown();
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            messages.add(text);
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            closeCode.set(code);
            webSocket.close(code, reason);
            closed.countDown();
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, okhttp3.Response response) {
            closed.countDown();
        }
    }

    private ConfigStore config;
    private RpcWebSocketServer server;
    private OkHttpClient okHttp;

    @Before
    public void setUp() {
        config = TestConfigs.fast();
        McpProtocolHandler handler = new McpProtocolHandler(
            ActionDispatcher.create(new FakeDeviceAutomation(), config), new ToolCatalog(), config);
        server = new RpcWebSocketServer(handler, config);
        assertTrue(server.start(0));
        okHttp = new OkHttpClient();
    }

    @After
    public void tearDown() {
        server.stop();
        okHttp.dispatcher().executorService().shutdown();
    }

    private WebSocket open(String query, Client listener) throws InterruptedException {
        Request request = new Request.Builder()
            .url("ws://127.0.0.1:" + server.getPort() + "/" + query)
            .build();
        WebSocket socket = okHttp.newWebSocket(request, listener);
        listener.opened.await(5, TimeUnit.SECONDS);
        return socket;
    }

    private static String ping(int id) {
        return new JSONObject().put("jsonrpc", "2.0").put("id", id).put("method", "ping").toString();
    }

    @Test
    public void answersRequestsInOrder() throws InterruptedException {
        Client listener = new Client();
        WebSocket socket = open("", listener);

        socket.send(ping(1));
        socket.send(ping(2));

        String first = listener.messages.poll(5, TimeUnit.SECONDS);
        String second = listener.messages.poll(5, TimeUnit.SECONDS);
        assertNotNull(first);
        assertNotNull(second);
        assertEquals(1, new JSONObject(first).getInt("id"));
        assertEquals(2, new JSONObject(second).getInt("id"));
        assertTrue(server.hasSession());
        socket.close(1000, null);
    }

    @Test
    public void newSessionReplacesOld() throws InterruptedException {
        Client firstListener = new Client();
        open("", firstListener);
        Client secondListener = new Client();
        WebSocket second = open("", secondListener);

        assertTrue(firstListener.closed.await(5, TimeUnit.SECONDS));
        assertEquals(1000, firstListener.closeCode.get());

        second.send(ping(7));
        String reply = secondListener.messages.poll(5, TimeUnit.SECONDS);
        assertNotNull(reply);
        assertEquals(7, new JSONObject(reply).getInt("id"));
        second.close(1000, null);
    }

    @Test
    public void rejectsMissingTokenWhenAuthEnabled() throws InterruptedException {
        config.setBoolean(Config.KEY_AUTH_ENABLED, true);
        String token = config.getAuthToken();

        Client rejected = new Client();
        open("", rejected);
        assertTrue(rejected.closed.await(5, TimeUnit.SECONDS));
        assertEquals(1008, rejected.closeCode.get());

        Client accepted = new Client();
        WebSocket socket = open("?token=" + token, accepted);
        socket.send(ping(3));
        assertNotNull(accepted.messages.poll(5, TimeUnit.SECONDS));
        socket.close(1000, null);
    }
}
