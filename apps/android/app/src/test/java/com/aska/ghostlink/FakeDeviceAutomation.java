package com.aska.ghostlink;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;

/**
 * 内存中的设备实现，记录所有调用
 */
class FakeDeviceAutomation implements DeviceAutomation {

    static final class Gesture {
        final GesturePath path;
        final long durationMs;
        final long atNanos;

        Gesture(GesturePath path, long durationMs, long atNanos) {
            this.path = path;
            this.durationMs = durationMs;
            this.atNanos = atNanos;
        }
    }

    volatile RawNode tree;
    volatile Bounds screen = Bounds.ofSize(1080, 2400);
    volatile boolean gestureResult = true;
    volatile boolean actionResult = true;
    volatile RawNode focusedEditable;
    volatile byte[] screenshot = new byte[] {(byte) 0x89, 'P', 'N', 'G'};
    volatile boolean screenshotNeverCompletes = false;
    volatile PhoneState phoneState = new PhoneState("Settings", "com.android.settings", ".Settings",
        false, false, null);
    final List<AppPackage> packages = new ArrayList<>();

    final List<Gesture> gestures = new CopyOnWriteArrayList<>();
    final List<Integer> globalActions = new CopyOnWriteArrayList<>();
    final List<String> textWrites = new CopyOnWriteArrayList<>();
    final List<RawNode> textTargets = new CopyOnWriteArrayList<>();
    final List<Integer> keyEvents = new CopyOnWriteArrayList<>();
    final List<String> launches = new CopyOnWriteArrayList<>();
    final List<Boolean> screenshotRequests = new CopyOnWriteArrayList<>();

    @Override
    public RawNode snapshotTree() {
        return tree;
    }

    @Override
    public Bounds getScreenBounds() {
        return screen;
    }

    @Override
    public boolean performGesture(GesturePath path, long durationMs) {
        gestures.add(new Gesture(path, durationMs, System.nanoTime()));
        return gestureResult;
    }

    @Override
    public boolean performGlobalAction(int actionId) {
        globalActions.add(actionId);
        return actionResult;
    }

    @Override
    public RawNode getFocusedEditableNode() {
        return focusedEditable;
    }

    @Override
    public boolean setNodeText(RawNode node, String text) {
        textTargets.add(node);
        textWrites.add(text);
        return actionResult;
    }

    @Override
    public boolean sendKeyEvent(int keyCode) {
        keyEvents.add(keyCode);
        return actionResult;
    }

    @Override
    public boolean launchApp(String packageName, String activity) {
        launches.add(activity == null ? packageName : packageName + "/" + activity);
        return actionResult;
    }

    @Override
    public Future<byte[]> captureScreenshotAsync(boolean hideOverlay) {
        screenshotRequests.add(hideOverlay);
        if (screenshotNeverCompletes) {
            return new CompletableFuture<>();
        }
        return CompletableFuture.completedFuture(screenshot);
    }

    @Override
    public PhoneState getPhoneState() {
        return phoneState;
    }

    @Override
    public List<AppPackage> getInstalledPackages() {
        return packages;
    }

    // ========== 构造树 ==========

    static RawNode.Builder node(String className, int l, int t, int r, int b) {
        return RawNode.builder().className(className).packageName("com.example.app").bounds(l, t, r, b);
    }

    static RawNode button(String text, int l, int t, int r, int b) {
        return node("android.widget.Button", l, t, r, b).text(text).clickable(true).build();
    }
}
