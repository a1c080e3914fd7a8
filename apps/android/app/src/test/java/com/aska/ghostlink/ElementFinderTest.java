package com.aska.ghostlink;

import org.junit.Test;

import java.util.Arrays;

import static com.aska.ghostlink.FakeDeviceAutomation.button;
import static com.aska.ghostlink.FakeDeviceAutomation.node;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class ElementFinderTest {

    private final RawNode ok = button("OK", 0, 0, 10, 10);
    private final RawNode okay = node("android.widget.Button", 0, 20, 10, 30)
        .resourceId("com.example.app:id/confirm").text("Okay").build();
    private final RawNode image = node("android.widget.ImageView", 0, 40, 10, 50)
        .contentDescription("OK").build();
    private final RawNode root = node("android.widget.FrameLayout", 0, 0, 100, 100)
        .addChild(ok).addChild(okay).addChild(image).build();

    @Test
    public void shortResourceIdIsCompletedWithPackage() {
        assertEquals(Arrays.asList("confirm", "com.example.app:id/confirm"),
            ElementFinder.resourceIdCandidates("confirm", "com.example.app"));
        assertEquals(Arrays.asList("id/confirm", "com.example.app:id/confirm"),
            ElementFinder.resourceIdCandidates("id/confirm", "com.example.app"));
        assertEquals(Arrays.asList("android:id/title"),
            ElementFinder.resourceIdCandidates("android:id/title", "com.example.app"));

        assertSame(okay, ElementFinder.find(root, ElementFinder.Locator.byResourceId("confirm")));
    }

    @Test
    public void textMatchesContainsUnlessExact() {
        assertSame(ok, ElementFinder.find(root, ElementFinder.Locator.byText("O")));
        assertSame(okay, ElementFinder.find(root, new ElementFinder.Locator(null, "Okay", null, null, true)));
        assertNull(ElementFinder.find(root, new ElementFinder.Locator(null, "Oka", null, null, true)));
    }

    @Test
    public void resourceIdTakesPriorityOverText() {
        ElementFinder.Locator locator = new ElementFinder.Locator("confirm", "OK", null, null, false);

        assertSame(okay, ElementFinder.find(root, locator));
    }

    @Test
    public void fallsBackToLaterCriteria() {
        ElementFinder.Locator locator = new ElementFinder.Locator("missing", "Cancel", "OK", null, false);

        assertSame(image, ElementFinder.find(root, locator));
        assertSame(image, ElementFinder.find(root,
            new ElementFinder.Locator(null, null, null, "android.widget.ImageView", false)));
    }

    @Test
    public void emptyLocatorFindsNothing() {
        ElementFinder.Locator empty = new ElementFinder.Locator("", "", null, null, false);

        assertTrue(empty.isEmpty());
        assertNull(ElementFinder.find(root, empty));
    }
}
