package com.litesql.backend.engine;

/**
 * 最近一条语句之后的变更计数快照。
 */
public class ChangeSummary {
    private final int changes;
    private final long totalChanges;
    private final long lastInsertRowid;

    public ChangeSummary(int changes, long totalChanges, long lastInsertRowid) {
        this.changes = changes;
        this.totalChanges = totalChanges;
        this.lastInsertRowid = lastInsertRowid;
    }

    public int getChanges() {
        return changes;
    }

    public long getTotalChanges() {
        return totalChanges;
    }

    public long getLastInsertRowid() {
        return lastInsertRowid;
    }
}
