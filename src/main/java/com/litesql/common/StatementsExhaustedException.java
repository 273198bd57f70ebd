package com.litesql.common;

public class StatementsExhaustedException extends LiteSqlException {

    public StatementsExhaustedException(int limit) {
        super(ErrorCode.CONFLICT, "no free stmt slots (limit " + limit + ")");
    }
}
