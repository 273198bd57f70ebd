package com.litesql.client;

import java.util.List;

/**
 * 客户端一次查询取回的全部结果
 */
public class QueryResult {

    private final List<String> columns;
    private final List<List<String>> rows;

    public QueryResult(List<String> columns, List<List<String>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<List<String>> getRows() {
        return rows;
    }
}
