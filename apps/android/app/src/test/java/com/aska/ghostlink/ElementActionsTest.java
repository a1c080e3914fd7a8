package com.aska.ghostlink;

import org.json.JSONObject;
import org.junit.Before;
import org.junit.Test;

import static com.aska.ghostlink.FakeDeviceAutomation.button;
import static com.aska.ghostlink.FakeDeviceAutomation.node;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class ElementActionsTest {

    private FakeDeviceAutomation device;
    private ActionDispatcher dispatcher;
    private RawNode field;

    @Before
    public void setUp() {
        device = new FakeDeviceAutomation();
        dispatcher = ActionDispatcher.create(device, TestConfigs.fast());

        field = node("android.widget.EditText", 0, 300, 1080, 400)
            .resourceId("com.example.app:id/search").text("Search").editable(true).build();
        device.tree = node("android.widget.FrameLayout", 0, 0, 1080, 2400)
            .addChild(button("Sign in", 100, 100, 300, 200))
            .addChild(field)
            .addChild(node("android.widget.ListView", 0, 500, 800, 1500).scrollable(true).build())
            .addChild(node("android.widget.CheckBox", 0, 1600, 100, 1700)
                .contentDescription("Remember me").checkable(true).build())
            .build();
    }

    private static JSONObject params(Object... keyValues) {
        JSONObject json = new JSONObject();
        for (int i = 0; i < keyValues.length; i += 2) {
            json.put((String) keyValues[i], keyValues[i + 1]);
        }
        return json;
    }

    private static JSONObject data(ApiResponse response) {
        assertTrue(response.toString(), response.isSuccess());
        return (JSONObject) ((ApiResponse.Success) response).getData();
    }

    @Test
    public void findReturnsElementInfo() {
        JSONObject element = data(dispatcher.dispatch("element.find", params("resource_id", "search")))
            .getJSONObject("element");

        assertEquals("Search", element.getString("text"));
        assertEquals("android.widget.EditText", element.getString("class_name"));
    }

    @Test
    public void findWithoutCriteriaIsMissingParameter() {
        ApiResponse response = dispatcher.dispatch("element.find", new JSONObject());

        assertEquals(ErrorCode.MISSING_PARAMETER, ((ApiResponse.Error) response).getCode());
        assertEquals(ElementActions.NO_CRITERIA, ((ApiResponse.Error) response).getMessage());
    }

    @Test
    public void missingElementFails() {
        ApiResponse response = dispatcher.dispatch("element.click", params("text", "Nope"));

        assertFalse(response.isSuccess());
        assertEquals(ElementActions.NOT_FOUND, ((ApiResponse.Error) response).getMessage());
        assertTrue(device.gestures.isEmpty());
    }

    @Test
    public void clickTapsCenterAndReturnsScreenState() {
        JSONObject result = data(dispatcher.dispatch("element.click", params("text", "Sign")));

        int[] point = device.gestures.get(0).path.start();
        assertEquals(200, point[0]);
        assertEquals(150, point[1]);
        assertTrue(result.getString("message").contains("(200, 150)"));
        assertTrue(result.getString("screen_state").contains("Sign in"));
    }

    @Test
    public void longPressAndDoubleTapUseElementCenter() {
        assertTrue(dispatcher.dispatch("element.long_press", params("text", "Sign in", "exact", true, "duration", 1500))
            .isSuccess());
        assertTrue(dispatcher.dispatch("element.double_tap", params("text", "Sign in")).isSuccess());

        assertEquals(1500L, device.gestures.get(0).durationMs);
        assertEquals(3, device.gestures.size());
    }

    @Test
    public void scrollSwipesInsideVerticalBounds() {
        assertTrue(dispatcher.dispatch("element.scroll", params("class_name", "android.widget.ListView")).isSuccess());
        assertTrue(dispatcher.dispatch("element.scroll",
            params("class_name", "android.widget.ListView", "direction", "backward")).isSuccess());

        GesturePath forward = device.gestures.get(0).path;
        assertEquals(1250, forward.start()[1]);
        assertEquals(750, forward.end()[1]);
        GesturePath backward = device.gestures.get(1).path;
        assertEquals(750, backward.start()[1]);
        assertEquals(1250, backward.end()[1]);
    }

    @Test
    public void scrollRejectsBadDirectionAndNonScrollable() {
        ApiResponse bad = dispatcher.dispatch("element.scroll",
            params("class_name", "android.widget.ListView", "direction", "sideways"));
        ApiResponse notScrollable = dispatcher.dispatch("element.scroll", params("text", "Sign in"));

        assertEquals(ErrorCode.MALFORMED_INPUT, ((ApiResponse.Error) bad).getCode());
        assertEquals("Element is not scrollable", ((ApiResponse.Error) notScrollable).getMessage());
    }

    @Test
    public void setTextWritesTargetNode() {
        assertTrue(dispatcher.dispatch("element.set_text",
            params("resource_id", "id/search", "input_text", "coffee")).isSuccess());

        assertEquals("coffee", device.textWrites.get(0));
        assertSame(field, device.textTargets.get(0));
        assertTrue(device.gestures.isEmpty());
    }

    @Test
    public void setTextRequiresEditableAndValue() {
        ApiResponse noValue = dispatcher.dispatch("element.set_text", params("resource_id", "search"));
        ApiResponse notEditable = dispatcher.dispatch("element.set_text",
            params("text", "Sign in", "input_text", "x"));

        assertEquals(ErrorCode.MISSING_PARAMETER, ((ApiResponse.Error) noValue).getCode());
        assertEquals("Element is not editable", ((ApiResponse.Error) notEditable).getMessage());
    }

    @Test
    public void dragMovesFromCenterToTarget() {
        assertTrue(dispatcher.dispatch("element.drag",
            params("text", "Sign in", "target_x", 900, "target_y", 2000)).isSuccess());

        FakeDeviceAutomation.Gesture gesture = device.gestures.get(0);
        assertEquals(200, gesture.path.start()[0]);
        assertEquals(900, gesture.path.end()[0]);
        assertEquals(2000, gesture.path.end()[1]);
        assertEquals(Config.DRAG_DURATION_MS, gesture.durationMs);
    }

    @Test
    public void toggleCheckboxReportsStateBeforeAndAfter() {
        JSONObject result = data(dispatcher.dispatch("element.toggle_checkbox",
            params("content_description", "Remember me")));

        assertFalse(result.getBoolean("previous_checked"));
        // 假设备的树不会变化，切换后的状态仍按重新采集的节点读取
        assertFalse(result.getBoolean("checked"));
        assertEquals(1, device.gestures.size());
        assertTrue(result.has("screen_state"));
    }

    @Test
    public void toggleRejectsNonCheckable() {
        ApiResponse response = dispatcher.dispatch("element.toggle_checkbox", params("text", "Sign in"));

        assertEquals("Element is not checkable", ((ApiResponse.Error) response).getMessage());
    }
}
