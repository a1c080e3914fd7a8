package com.aska.ghostlink;

import java.util.List;
import java.util.concurrent.Future;

/**
 * 设备自动化能力（由无障碍服务实现）
 *
 * 方法可能阻塞调用线程几十到几百毫秒，不能在主线程调用。
 * 并发调用由 {@link CommandExecutor} 串行化。
 */
public interface DeviceAutomation {

    /**
     * 采集当前活动窗口的 UI 树快照
     *
     * @return 根节点，没有活动窗口时返回 null
     */
    RawNode snapshotTree();

    /**
     * 屏幕可见区域
     */
    Bounds getScreenBounds();

    /**
     * 派发一条手势
     *
     * @return 系统是否接受了该手势
     */
    boolean performGesture(GesturePath path, long durationMs);

    /**
     * 系统级动作（HOME、BACK、RECENTS 等）
     */
    boolean performGlobalAction(int actionId);

    /**
     * 当前获得输入焦点的可编辑节点，没有时返回 null
     */
    RawNode getFocusedEditableNode();

    /**
     * 设置节点文本（替换原有内容）
     */
    boolean setNodeText(RawNode node, String text);

    /**
     * 发送按键事件
     */
    boolean sendKeyEvent(int keyCode);

    /**
     * 启动应用
     *
     * @param activity 可选的显式 Activity，可为 null；以 "." 开头时相对于包名
     */
    boolean launchApp(String packageName, String activity);

    /**
     * 异步截图，成功时得到 PNG 字节；失败时 future 以异常完成
     */
    Future<byte[]> captureScreenshotAsync(boolean hideOverlay);

    PhoneState getPhoneState();

    List<AppPackage> getInstalledPackages();
}
