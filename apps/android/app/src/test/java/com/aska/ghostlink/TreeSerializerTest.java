package com.aska.ghostlink;

import org.json.JSONObject;
import org.junit.Test;

import static com.aska.ghostlink.FakeDeviceAutomation.button;
import static com.aska.ghostlink.FakeDeviceAutomation.node;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class TreeSerializerTest {

    private static final Bounds SCREEN = Bounds.ofSize(1080, 2400);

    @Test
    public void writesFullPropertySet() {
        RawNode tree = node("android.widget.CheckBox", 10, 20, 110, 70)
            .resourceId("com.example.app:id/agree")
            .text("Agree")
            .contentDescription("agree terms")
            .checkable(true)
            .checked(true)
            .clickable(true)
            .build();

        JSONObject json = TreeSerializer.toJson(tree, null);

        assertEquals("com.example.app:id/agree", json.getString("resourceId"));
        assertEquals("android.widget.CheckBox", json.getString("className"));
        assertEquals("com.example.app", json.getString("packageName"));
        assertEquals("agree terms", json.getString("contentDescription"));
        assertEquals(110, json.getJSONObject("boundsInScreen").getInt("right"));
        assertTrue(json.getBoolean("isChecked"));
        assertTrue(json.getBoolean("isClickable"));
        assertTrue(json.getBoolean("isEnabled"));
        assertFalse(json.getBoolean("isScrollable"));
        assertEquals(0, json.getInt("childCount"));
    }

    @Test
    public void filterDropsInvisibleLeavesButKeepsParents() {
        RawNode tree = node("android.widget.ScrollView", 0, -9000, 1080, 5)
            .addChild(button("Shown", 0, 0, 100, 5))
            .addChild(button("Hidden", 0, 4000, 100, 4100))
            .build();

        JSONObject json = TreeSerializer.toJson(tree, SCREEN);

        assertEquals(1, json.getJSONArray("children").length());
        assertEquals("Shown", json.getJSONArray("children").getJSONObject(0).getString("text"));
        assertEquals(2, json.getInt("childCount"));
    }

    @Test
    public void fullyInvisibleTreeSerializesToNull() {
        assertNull(TreeSerializer.toJson(button("Gone", 0, 5000, 10, 5010), SCREEN));
    }

    @Test
    public void readsBackWhatItWrites() {
        RawNode tree = node("android.widget.FrameLayout", 0, 0, 1080, 2400)
            .addChild(node("android.widget.EditText", 0, 0, 500, 100).editable(true).focused(true).build())
            .build();

        RawNode copy = TreeSerializer.fromJson(TreeSerializer.toJson(tree, null));

        assertEquals(tree.bounds, copy.bounds);
        assertEquals(1, copy.children.size());
        assertTrue(copy.children.get(0).editable);
        assertTrue(copy.children.get(0).focused);
    }

    @Test
    public void readsCompactBoundsAndUnprefixedFlags() {
        JSONObject json = new JSONObject()
            .put("text", "Go")
            .put("bounds", "1, 2, 30, 40")
            .put("clickable", true)
            .put("enabled", false)
            .put("contentDesc", "go button");

        RawNode node = TreeSerializer.fromJson(json);

        assertEquals(new Bounds(1, 2, 30, 40), node.bounds);
        assertTrue(node.clickable);
        assertFalse(node.enabled);
        assertEquals("go button", node.contentDescription);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsMalformedBoundsString() {
        TreeSerializer.fromJson(new JSONObject().put("bounds", "a,b,c,d"));
    }
}
