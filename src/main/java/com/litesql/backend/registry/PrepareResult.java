package com.litesql.backend.registry;

import java.util.List;

public class PrepareResult {

    private final int stmtId;
    private final List<String> columnNames;

    public PrepareResult(int stmtId, List<String> columnNames) {
        this.stmtId = stmtId;
        this.columnNames = columnNames;
    }

    public int getStmtId() {
        return stmtId;
    }

    public int getColumnCount() {
        return columnNames.size();
    }

    public List<String> getColumnNames() {
        return columnNames;
    }
}
