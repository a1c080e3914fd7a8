package com.aska.ghostlink;

import org.json.JSONObject;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import okhttp3.FormBody;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import static com.aska.ghostlink.FakeDeviceAutomation.button;
import static com.aska.ghostlink.FakeDeviceAutomation.node;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class HttpCommandServerTest {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private FakeDeviceAutomation device;
    private ConfigStore config;
    private HttpCommandServer server;
    private OkHttpClient client;
    private String base;

    @Before
    public void setUp() {
        device = new FakeDeviceAutomation();
        device.tree = node("android.widget.FrameLayout", 0, 0, 1080, 2400)
            .addChild(button("OK", 0, 0, 100, 100))
            .build();
        config = TestConfigs.fast();
        server = new HttpCommandServer(ActionDispatcher.create(device, config), config);
        assertTrue(server.start(0));
        base = "http://127.0.0.1:" + server.getPort();
        client = new OkHttpClient.Builder()
            .readTimeout(5, TimeUnit.SECONDS)
            .build();
    }

    @After
    public void tearDown() {
        server.stop();
        client.dispatcher().executorService().shutdown();
    }

    private Response get(String path) throws IOException {
        return client.newCall(new Request.Builder().url(base + path).build()).execute();
    }

    private Response post(String path, RequestBody body) throws IOException {
        return client.newCall(new Request.Builder().url(base + path).post(body).build()).execute();
    }

    @Test
    public void bindsEphemeralPort() {
        assertTrue(server.isRunning());
        assertNotEquals(0, server.getPort());
    }

    @Test
    public void pingCarriesCorsAndCloseHeaders() throws IOException {
        try (Response response = get("/ping")) {
            assertEquals(200, response.code());
            assertEquals("*", response.header("Access-Control-Allow-Origin"));
            assertEquals("close", response.header("Connection"));
            JSONObject json = new JSONObject(response.body().string());
            assertTrue(json.getBoolean("success"));
            assertEquals("pong", json.getString("data"));
        }
    }

    @Test
    public void getRoutesReachQueries() throws IOException {
        try (Response response = get("/a11y_tree")) {
            JSONObject json = new JSONObject(response.body().string());
            assertEquals(1, json.getJSONArray("data").length());
        }
        try (Response response = get("/state_full")) {
            JSONObject data = new JSONObject(response.body().string()).getJSONObject("data");
            assertTrue(data.has("device_context"));
        }
    }

    @Test
    public void unknownGetEndpointIsReportedInBody() throws IOException {
        try (Response response = get("/nowhere")) {
            assertEquals(200, response.code());
            JSONObject json = new JSONObject(response.body().string());
            assertFalse(json.getBoolean("success"));
            assertEquals("UNKNOWN_ACTION", json.getString("code"));
        }
    }

    @Test
    public void formBodyIsAutoTyped() throws IOException {
        RequestBody form = new FormBody.Builder().add("x", "120").add("y", "340").build();

        try (Response response = post("/tap", form)) {
            assertTrue(new JSONObject(response.body().string()).getBoolean("success"));
        }
        assertEquals(120, device.gestures.get(0).path.start()[0]);
        assertEquals(340, device.gestures.get(0).path.start()[1]);
    }

    @Test
    public void jsonBodyAndQueryAreMerged() throws IOException {
        RequestBody body = RequestBody.create("{\"y\": 7}", JSON);

        try (Response response = post("/action/tap?x=3", body)) {
            assertTrue(new JSONObject(response.body().string()).getBoolean("success"));
        }
        assertEquals(3, device.gestures.get(0).path.start()[0]);
        assertEquals(7, device.gestures.get(0).path.start()[1]);
    }

    @Test
    public void malformedJsonBodyIsBadRequest() throws IOException {
        try (Response response = post("/tap", RequestBody.create("{\"x\": ", JSON))) {
            assertEquals(400, response.code());
            assertEquals("MALFORMED_INPUT", new JSONObject(response.body().string()).getString("code"));
        }
        assertTrue(device.gestures.isEmpty());
    }

    @Test
    public void screenshotIsWrittenAsPng() throws IOException {
        try (Response response = get("/screenshot")) {
            assertEquals("image/png", response.header("Content-Type"));
            assertArrayEquals(device.screenshot, response.body().bytes());
        }
        try (Response response = post("/screenshot", RequestBody.create("", JSON))) {
            assertEquals("application/octet-stream", response.header("Content-Type"));
        }
    }

    @Test
    public void getUsesTheBinaryResultsOwnContentType() throws IOException {
        final byte[] jpeg = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
        ActionDispatcher dispatcher = ActionDispatcher.create(device, config);
        dispatcher.register("screenshot", params -> new ApiResponse.Binary(jpeg, "image/jpeg"));
        HttpCommandServer jpegServer = new HttpCommandServer(dispatcher, config);
        assertTrue(jpegServer.start(0));
        try {
            String url = "http://127.0.0.1:" + jpegServer.getPort() + "/screenshot";
            try (Response response = client.newCall(new Request.Builder().url(url).build()).execute()) {
                assertEquals("image/jpeg", response.header("Content-Type"));
                assertArrayEquals(jpeg, response.body().bytes());
            }
            try (Response response = client.newCall(new Request.Builder().url(url)
                    .post(RequestBody.create("", JSON)).build()).execute()) {
                assertEquals("application/octet-stream", response.header("Content-Type"));
            }
        } finally {
            jpegServer.stop();
        }
    }

    @Test
    public void authRequiredExceptForPing() throws IOException {
        config.setBoolean(Config.KEY_AUTH_ENABLED, true);
        String token = config.getAuthToken();

        try (Response response = get("/ping")) {
            assertEquals(200, response.code());
        }
        try (Response response = get("/state")) {
            assertEquals(401, response.code());
        }
        Request authorized = new Request.Builder().url(base + "/state")
            .header("Authorization", "Bearer " + token).build();
        try (Response response = client.newCall(authorized).execute()) {
            assertEquals(200, response.code());
            assertTrue(new JSONObject(response.body().string()).getBoolean("success"));
        }
    }

    @Test
    public void preflightAndUnsupportedMethods() throws IOException {
        Request options = new Request.Builder().url(base + "/tap").method("OPTIONS", null).build();
        try (Response response = client.newCall(options).execute()) {
            assertEquals(204, response.code());
            assertTrue(response.header("Access-Control-Allow-Methods").contains("POST"));
        }
        Request delete = new Request.Builder().url(base + "/tap").delete().build();
        try (Response response = client.newCall(delete).execute()) {
            assertEquals(405, response.code());
        }
    }

    @Test
    public void parsesFormValues() {
        JSONObject form = HttpCommandServer.parseForm("a=1&b=true&c=hello%20world&d=-5&e=");

        assertEquals(1, form.get("a"));
        assertEquals(Boolean.TRUE, form.get("b"));
        assertEquals("hello world", form.get("c"));
        assertEquals(-5, form.get("d"));
        assertEquals("", form.get("e"));
        assertEquals("/tap", HttpCommandServer.stripQuery("/tap?x=1"));
    }

    @Test
    public void stopReleasesPort() throws IOException {
        server.stop();

        assertFalse(server.isRunning());
        assertTrue(server.start(0));
        base = "http://127.0.0.1:" + server.getPort();
        try (Response response = get("/ping")) {
            assertEquals(200, response.code());
        }
    }
}
