package com.aska.ghostlink;

/**
 * 错误分类及对应的 JSON-RPC 错误码
 */
public enum ErrorCode {
    UNKNOWN_ACTION(-32601),
    MISSING_PARAMETER(-32602),
    MALFORMED_INPUT(-32700),
    OPERATION_FAILED(-32603),
    UNAUTHORIZED(-32003),
    QUEUED(-32001),
    QUEUE_FULL(-32002),
    TIMEOUT(-32004);

    private final int rpcCode;

    ErrorCode(int rpcCode) {
        this.rpcCode = rpcCode;
    }

    public int rpcCode() {
        return rpcCode;
    }
}
