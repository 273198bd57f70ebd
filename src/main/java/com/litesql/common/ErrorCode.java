package com.litesql.common;

/**
 * 线协议使用的错误码，取值沿用 HTTP 状态码语义。
 */
public final class ErrorCode {

    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int CONFLICT = 409;
    public static final int PAYLOAD_TOO_LARGE = 413;
    public static final int ENGINE_ERROR = 500;
    public static final int NOT_IMPLEMENTED = 501;
    public static final int BUSY = 503;

    private ErrorCode() {
    }
}
