package com.litesql.common;

/**
 * 所有对外可见错误的基类，携带写回客户端时使用的错误码。
 */
public class LiteSqlException extends Exception {

    private final int code;

    public LiteSqlException(int code, String message) {
        super(message);
        this.code = code;
    }

    public LiteSqlException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
