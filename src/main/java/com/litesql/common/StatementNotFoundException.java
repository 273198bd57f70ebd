package com.litesql.common;

public class StatementNotFoundException extends LiteSqlException {

    public StatementNotFoundException(int stmtId) {
        super(ErrorCode.NOT_FOUND, "stmt not found: " + stmtId);
    }
}
