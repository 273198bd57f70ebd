package com.litesql.common;

/**
 * 请求格式不合法（JSON 错误、缺少字段、行过长等），在接触引擎之前即被拒绝。
 */
public class ProtocolException extends LiteSqlException {

    public ProtocolException(String message) {
        super(ErrorCode.BAD_REQUEST, message);
    }

    public ProtocolException(int code, String message) {
        super(code, message);
    }
}
