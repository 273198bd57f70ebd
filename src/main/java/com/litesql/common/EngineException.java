package com.litesql.common;

/**
 * 引擎返回的错误，保留引擎结果码与原始错误信息。
 */
public class EngineException extends LiteSqlException {

    /** SQLITE_ERROR */
    public static final int GENERIC = 1;
    /** SQLITE_MISUSE */
    public static final int MISUSE = 21;

    /** SQLITE_RANGE */
    public static final int RANGE = 25;

    private final int resultCode;

    public EngineException(int resultCode, String message) {
        super(ErrorCode.ENGINE_ERROR, message);
        this.resultCode = resultCode;
    }

    public EngineException(int resultCode, String message, Throwable cause) {
        super(ErrorCode.ENGINE_ERROR, message, cause);
        this.resultCode = resultCode;
    }

    public int getResultCode() {
        return resultCode;
    }
}
