package com.aska.ghostlink;

/**
 * 反向连接状态回调，在连接线程上调用
 */
public interface ConnectionListener {

    /**
     * 每次状态变化都会调用
     */
    void onStateChanged(ConnectionState state);

    /**
     * 面向用户的连接提示，整个生命周期只在第一次连接就绪时调用一次
     */
    default void onConnectionNotice(String message) {
    }
}
