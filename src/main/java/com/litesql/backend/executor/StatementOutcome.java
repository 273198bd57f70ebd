package com.litesql.backend.executor;

/**
 * 批量执行中单条语句的结果：查询（列 + 惰性行）或变更（影响行数 + 最后插入行号）。
 */
public interface StatementOutcome {

    /** 这条语句的 SQL 文本 */
    String getSql();

    boolean isQuery();
}
