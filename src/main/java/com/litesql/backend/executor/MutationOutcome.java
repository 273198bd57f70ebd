package com.litesql.backend.executor;

public class MutationOutcome implements StatementOutcome {

    private final String sql;
    private final int changes;
    private final long lastInsertRowid;

    public MutationOutcome(String sql, int changes, long lastInsertRowid) {
        this.sql = sql;
        this.changes = changes;
        this.lastInsertRowid = lastInsertRowid;
    }

    @Override
    public String getSql() {
        return sql;
    }

    @Override
    public boolean isQuery() {
        return false;
    }

    public int getChanges() {
        return changes;
    }

    public long getLastInsertRowid() {
        return lastInsertRowid;
    }
}
