package com.aska.ghostlink;

/**
 * 反向连接状态
 */
public enum ConnectionState {
    DISCONNECTED,       // 未连接，可能正在等待重连
    CONNECTING,         // 正在建立 WebSocket
    AWAITING_HANDSHAKE, // 已连接，等待对端 initialize
    READY               // 握手完成，可以执行工具调用
}
